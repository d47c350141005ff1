package com.agentflow.recovery;

import java.time.Duration;

/**
 * @param pollInterval     delay between supervisor sweeps
 * @param ghostGracePeriod how long a RUNNING run may lack a live background worker
 */
public record SupervisorSettings(Duration pollInterval, Duration ghostGracePeriod) {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_GHOST_GRACE_PERIOD = Duration.ofSeconds(60);

    public SupervisorSettings {
        pollInterval = pollInterval != null ? pollInterval : DEFAULT_POLL_INTERVAL;
        ghostGracePeriod = ghostGracePeriod != null ? ghostGracePeriod : DEFAULT_GHOST_GRACE_PERIOD;
    }

    public static SupervisorSettings defaults() {
        return new SupervisorSettings(null, null);
    }
}
