package io.swarmcron;

/**
 * Opaque reference to a registered trigger.
 */
public interface TriggerHandle {

    String key();

    /**
     * Prevent future firings. A firing already handed to a worker is not interrupted.
     */
    void cancel();

    boolean isCancelled();
}
