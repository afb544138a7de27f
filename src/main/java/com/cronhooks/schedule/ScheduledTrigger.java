package com.cronhooks.schedule;

import java.time.Duration;

/**
 * A timer owned by a {@link TriggerRegistry}.
 */
public interface ScheduledTrigger {

    /**
     * Longest single wait handed to the actor scheduler. Longer waits are covered by a chain of
     * wake-ups that re-arm until the fire time is within reach.
     */
    Duration MAX_TIMER_DELAY = Duration.ofDays(1);

    /**
     * Starts waiting for the next fire time. No-op when already armed or cancelled.
     */
    void arm();

    /**
     * Stops waiting but keeps the trigger usable for a later {@link #arm()}.
     */
    void disarm();

    /**
     * Permanently stops the trigger.
     */
    void cancel();
}
