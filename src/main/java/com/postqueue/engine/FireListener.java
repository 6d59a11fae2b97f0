package com.postqueue.engine;

/**
 * Callback a {@link Trigger} invokes each time an armed handle fires.
 */
@FunctionalInterface
public interface FireListener {

    /**
     * Called on a firing thread, never on the timer thread and never while
     * the trigger registry is locked.
     *
     * @param handle the handle that fired
     */
    void onFire(TriggerHandle handle);
}
