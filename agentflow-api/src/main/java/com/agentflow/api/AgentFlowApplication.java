package com.agentflow.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for agentflow.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.agentflow.api",
    "com.agentflow.engine"
})
public class AgentFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentFlowApplication.class, args);
    }
}
