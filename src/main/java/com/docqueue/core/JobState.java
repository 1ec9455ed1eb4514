package com.docqueue.core;

/**
 * Enum representing the four queue states a job can occupy.
 *
 * <p>Each state is a top-level directory under the queue root. A job lives in
 * exactly one of them at a time; the only way a job changes state is by having
 * its files renamed into another state's directory.</p>
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>JOBS / PRIORITY → COMPLETE: processor finished and finalized the job</li>
 *   <li>JOBS / PRIORITY → ERROR: processor failed and finalized the job</li>
 *   <li>any → any: administrative move of an unlocked job (requeue, retry)</li>
 * </ul>
 *
 * <p>Locking is orthogonal to the state and is not represented here.</p>
 *
 * @see ArtifactKind
 */
public enum JobState {
    JOBS("jobs", "jobs"),
    PRIORITY("priority_jobs", "priority"),
    COMPLETE("complete", "complete"),
    ERROR("error", "error");

    private final String directoryName;
    private final String label;

    JobState(String directoryName, String label) {
        this.directoryName = directoryName;
        this.label = label;
    }

    /**
     * Get the name of the directory holding jobs in this state.
     *
     * @return the directory name (e.g., "priority_jobs")
     */
    public String getDirectoryName() {
        return directoryName;
    }

    /**
     * Get the short name used on the command line and over HTTP.
     *
     * @return the label (e.g., "priority")
     */
    public String getLabel() {
        return label;
    }

    /**
     * Check if this state is terminal. Jobs in terminal states are never
     * returned by a claim; they only leave through an administrative move.
     *
     * @return true for COMPLETE and ERROR
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }

    /**
     * Parse a state from its label or its directory name.
     *
     * @param value "jobs", "priority", "priority_jobs", "complete" or "error"
     * @return the matching state, or null if the value is unknown
     */
    public static JobState fromLabel(String value) {
        if (value == null) {
            return null;
        }
        for (JobState state : values()) {
            if (state.label.equals(value) || state.directoryName.equals(value)) {
                return state;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return label;
    }
}
