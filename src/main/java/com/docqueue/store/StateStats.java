package com.docqueue.store;

import com.docqueue.core.ArtifactKind;
import com.docqueue.core.JobState;

import java.util.EnumMap;
import java.util.Map;

/**
 * File counts of one state directory, split by artifact kind.
 *
 * <p>Filled in by {@link StatsCollector}; read-only for everyone else.</p>
 */
public class StateStats {
    private final JobState state;
    private final Map<ArtifactKind, Long> unlocked = new EnumMap<>(ArtifactKind.class);
    private final Map<ArtifactKind, Long> locked = new EnumMap<>(ArtifactKind.class);
    private final Map<ArtifactKind, Long> orphans = new EnumMap<>(ArtifactKind.class);
    private final Map<ArtifactKind, Long> bytes = new EnumMap<>(ArtifactKind.class);
    private long pairs;
    private long lockedPairs;

    StateStats(JobState state) {
        this.state = state;
        for (ArtifactKind kind : ArtifactKind.values()) {
            unlocked.put(kind, 0L);
            locked.put(kind, 0L);
            orphans.put(kind, 0L);
            bytes.put(kind, 0L);
        }
    }

    void addFile(ArtifactKind kind, boolean isLocked, long size) {
        Map<ArtifactKind, Long> counts = isLocked ? locked : unlocked;
        counts.merge(kind, 1L, Long::sum);
        bytes.merge(kind, size, Long::sum);
    }

    void addOrphan(ArtifactKind kind) {
        orphans.merge(kind, 1L, Long::sum);
    }

    void addPair(boolean isLocked) {
        if (isLocked) {
            lockedPairs++;
        } else {
            pairs++;
        }
    }

    public JobState getState() {
        return state;
    }

    public long getUnlocked(ArtifactKind kind) {
        return unlocked.get(kind);
    }

    public long getLocked(ArtifactKind kind) {
        return locked.get(kind);
    }

    public long getOrphans(ArtifactKind kind) {
        return orphans.get(kind);
    }

    public long getBytes(ArtifactKind kind) {
        return bytes.get(kind);
    }

    // Unlocked pairs
    public long getPairs() {
        return pairs;
    }

    public long getLockedPairs() {
        return lockedPairs;
    }

    public long getFiles() {
        long total = 0;
        for (ArtifactKind kind : ArtifactKind.values()) {
            total += unlocked.get(kind) + locked.get(kind);
        }
        return total;
    }

    public long getLockedFiles() {
        long total = 0;
        for (long count : locked.values()) {
            total += count;
        }
        return total;
    }

    public long getOrphanCount() {
        long total = 0;
        for (long count : orphans.values()) {
            total += count;
        }
        return total;
    }

    public long getTotalBytes() {
        long total = 0;
        for (long size : bytes.values()) {
            total += size;
        }
        return total;
    }
}
