package io.swarmcron;

import io.swarmcron.utils.Schedule;

/**
 * Time-trigger engine. Each registered trigger runs its task asynchronously every time its
 * schedule comes due, independently of the thread that registered it.
 */
public interface TriggerEngine {

    /**
     * Register a recurring trigger.
     *
     * @param key      label used in logs and thread diagnostics (usually the job name)
     * @param schedule when to fire
     * @param task     callback; must tolerate running concurrently with other triggers
     * @return handle used to cancel future firings
     * @throws IllegalArgumentException if the schedule has no future firing
     */
    TriggerHandle schedule(String key, Schedule schedule, Runnable task);

    /**
     * Cancel every trigger and release engine threads.
     */
    void shutdown();
}
