package com.versioning.engine.test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Controllable clock for testing timestamps.
 * Time only moves when the test advances it.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * TimeController time = TimeController.frozenAt(Instant.parse("2024-01-01T00:00:00Z"));
 * DraftCoordinator coordinator = new DraftCoordinator(..., time);
 *
 * time.advanceSeconds(30);
 * coordinator.update(draftId, data, null); // lastModifiedOn is 30s later
 * }</pre>
 */
public class TimeController extends Clock {

    private final AtomicReference<Instant> currentTime;

    /**
     * Create a time controller starting at the current time, truncated to
     * the microsecond precision the database keeps.
     */
    public TimeController() {
        this(Instant.now().truncatedTo(ChronoUnit.MICROS));
    }

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

    /**
     * Always UTC; the zone is not configurable.
     */
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
     * Set time to a specific instant.
     */
    public void setTime(Instant newTime) {
        currentTime.set(newTime);
    }

    /**
     * Create a frozen time controller at a specific time.
     */
    public static TimeController frozenAt(Instant time) {
        return new TimeController(time);
    }
}
