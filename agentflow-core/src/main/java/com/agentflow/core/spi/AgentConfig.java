package com.agentflow.core.spi;

import java.time.Duration;

public record AgentConfig(String model, Duration timeout) {
}
