package com.docqueue.core;

import java.util.Objects;

/**
 * Where a job currently is: its state directory and whether it is claimed.
 */
public final class JobStatusInfo {
    private final JobState state;
    private final boolean locked;

    public JobStatusInfo(JobState state, boolean locked) {
        this.state = Objects.requireNonNull(state, "state");
        this.locked = locked;
    }

    public JobState getState() {
        return state;
    }

    public boolean isLocked() {
        return locked;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JobStatusInfo)) {
            return false;
        }
        JobStatusInfo other = (JobStatusInfo) o;
        return state == other.state && locked == other.locked;
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, locked);
    }

    @Override
    public String toString() {
        return "state=" + state.getLabel() + " locked=" + (locked ? 1 : 0);
    }
}
