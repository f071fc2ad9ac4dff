package com.questrail.peerlink.internal.time;

/**
 * Cancellation handle for a task submitted to a {@link MonotonicScheduler}.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if the task will not run; {@code false} if it already
     *         ran or was cancelled before.
     */
    boolean cancel();
}
