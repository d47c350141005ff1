package com.agentflow.engine.health;

import java.time.Instant;

/**
 * Liveness of the run supervisor, as reported to the health endpoint.
 */
public interface SupervisorState {

    boolean isRunning();

    /**
     * @return when the last sweep finished, or null if none has run
     */
    Instant lastSweepAt();
}
