package com.docqueue.core;

import java.util.Objects;

/**
 * A job this process holds the lock on, as returned by a successful claim.
 */
public final class ClaimedJob {
    private final String uuid;
    private final JobState state;

    public ClaimedJob(String uuid, JobState state) {
        this.uuid = Objects.requireNonNull(uuid, "uuid");
        this.state = Objects.requireNonNull(state, "state");
    }

    public String getUuid() {
        return uuid;
    }

    /**
     * @return the state directory the job was claimed in (and is still in)
     */
    public JobState getState() {
        return state;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClaimedJob)) {
            return false;
        }
        ClaimedJob other = (ClaimedJob) o;
        return uuid.equals(other.uuid) && state == other.state;
    }

    @Override
    public int hashCode() {
        return Objects.hash(uuid, state);
    }

    @Override
    public String toString() {
        return uuid + " " + state.getLabel();
    }
}
