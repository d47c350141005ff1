package com.agentflow.recovery.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock for testing time-dependent behavior.
 * Tests move time forward explicitly instead of waiting.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * TimeController time = TimeController.frozenAt(Instant.parse("2024-05-01T10:00:00Z"));
 * AgentRun run = AgentRun.start(taskId, "scripted", "plan", time.instant());
 * time.advanceMinutes(20);
 * supervisor.sweep();
 * }</pre>
 */
public class TimeController extends Clock {

    private final AtomicReference<Instant> currentTime;

    public TimeController(Instant startTime) {
        this.currentTime = new AtomicReference<>(startTime);
    }

    @Override
    public Instant instant() {
        return currentTime.get();
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    /**
     * Advance time by a duration.
     */
    public void advance(Duration duration) {
        currentTime.updateAndGet(t -> t.plus(duration));
    }

    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    public void advanceMinutes(long minutes) {
        advance(Duration.ofMinutes(minutes));
    }

    /**
     * Get the duration since an instant.
     */
    public Duration durationSince(Instant since) {
        return Duration.between(since, instant());
    }

    public static TimeController frozenAt(Instant time) {
        return new TimeController(time);
    }
}
