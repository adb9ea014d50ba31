package io.campaign.dispatch;

/**
 * Tracks which job is currently running for each campaign or group on this node, so two
 * jobs never touch the same target concurrently and the same job never runs twice at once.
 *
 * @see DefaultInFlightTracker
 * @see io.campaign.JobEnvelope#targetKey()
 */
public interface InFlightTracker {

    /** Outcome of {@link #tryAcquire}. */
    enum Acquisition {
        /** The caller now holds the target and must {@linkplain #release release} it. */
        ACQUIRED,
        /** The same job is already running; the caller should drop this copy. */
        DUPLICATE,
        /** A different job holds the target; the caller should postpone this one. */
        BUSY
    }

    /**
     * Attempts to take the target for {@code jobId}.
     *
     * @param targetKey key of the campaign or group the job acts on
     * @param jobId     the job asking for the target
     * @return the outcome
     */
    Acquisition tryAcquire(String targetKey, String jobId);

    /**
     * Releases the target if it is held by {@code jobId}; otherwise does nothing.
     */
    void release(String targetKey, String jobId);

    /**
     * Number of targets currently held.
     */
    int size();
}
