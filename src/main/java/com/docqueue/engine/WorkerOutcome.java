package com.docqueue.engine;

/**
 * Result of one {@link Worker#runOnce(boolean)} call, with the exit code a
 * single-shot processor process reports for it.
 */
public enum WorkerOutcome {
    /** A job was processed and finalized to {@code complete}. */
    SUCCESS(0),
    /** A job was processed, failed, and was finalized to {@code error}. */
    FAILED(1),
    /** Nothing was claimable. */
    EMPTY(2),
    /** The worker was interrupted mid-job and gave the claim back. */
    RELEASED(1),
    /** The queue itself failed: claim, finalize or release raised an error. */
    ERROR(1);

    private final int exitCode;

    WorkerOutcome(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
