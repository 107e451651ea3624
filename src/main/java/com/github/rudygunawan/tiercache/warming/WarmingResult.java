package com.github.rudygunawan.tiercache.warming;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one {@link CacheWarmer#executeWarming(int)} run. Instances of this class are
 * immutable.
 */
public final class WarmingResult {

    /**
     * Whether the run did any work.
     */
    public enum Status {
        COMPLETED,
        ALREADY_IN_PROGRESS
    }

    private final Status status;
    private final int warmed;
    private final int failed;
    private final List<String> errors;
    private final int remainingQueueSize;
    private final Duration duration;

    public WarmingResult(Status status, int warmed, int failed, List<String> errors,
                         int remainingQueueSize, Duration duration) {
        this.status = status;
        this.warmed = warmed;
        this.failed = failed;
        this.errors = errors == null ? Collections.emptyList() : List.copyOf(errors);
        this.remainingQueueSize = remainingQueueSize;
        this.duration = duration;
    }

    static WarmingResult alreadyInProgress(int remainingQueueSize) {
        return new WarmingResult(Status.ALREADY_IN_PROGRESS, 0, 0, null, remainingQueueSize, Duration.ZERO);
    }

    public Status getStatus() {
        return status;
    }

    /**
     * Returns the number of keys computed and stored.
     */
    public int getWarmed() {
        return warmed;
    }

    /**
     * Returns the number of keys whose computation or write failed.
     */
    public int getFailed() {
        return failed;
    }

    /**
     * Returns one message per failed key.
     */
    public List<String> getErrors() {
        return errors;
    }

    /**
     * Returns the number of requests still queued after the run.
     */
    public int getRemainingQueueSize() {
        return remainingQueueSize;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return "WarmingResult{"
                + "status=" + status
                + ", warmed=" + warmed
                + ", failed=" + failed
                + ", remainingQueueSize=" + remainingQueueSize
                + ", duration=" + duration
                + '}';
    }
}
