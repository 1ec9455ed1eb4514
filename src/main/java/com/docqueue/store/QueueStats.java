package com.docqueue.store;

import com.docqueue.core.ArtifactKind;
import com.docqueue.core.JobState;

import org.json.JSONObject;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Snapshot of a whole queue root as seen by one {@link StatsCollector#collect()} call.
 *
 * <p>Modification times are epoch seconds; both are 0 when the queue holds no
 * recognized file.</p>
 */
public class QueueStats {
    private final Path root;
    private final Map<JobState, StateStats> states;
    private final long oldestMtime;
    private final long newestMtime;

    QueueStats(Path root, Map<JobState, StateStats> states, long oldestMtime, long newestMtime) {
        this.root = root;
        this.states = Collections.unmodifiableMap(new EnumMap<>(states));
        this.oldestMtime = oldestMtime;
        this.newestMtime = newestMtime;
    }

    public Path getRoot() {
        return root;
    }

    public StateStats get(JobState state) {
        return states.get(state);
    }

    public Map<JobState, StateStats> getStates() {
        return states;
    }

    public long getOldestMtime() {
        return oldestMtime;
    }

    public long getNewestMtime() {
        return newestMtime;
    }

    public long getTotalFiles() {
        return states.values().stream().mapToLong(StateStats::getFiles).sum();
    }

    public long getTotalLocked() {
        return states.values().stream().mapToLong(StateStats::getLockedFiles).sum();
    }

    public long getTotalOrphans() {
        return states.values().stream().mapToLong(StateStats::getOrphanCount).sum();
    }

    public long getTotalBytes() {
        return states.values().stream().mapToLong(StateStats::getTotalBytes).sum();
    }

    public long getTotalPairs() {
        return states.values().stream().mapToLong(StateStats::getPairs).sum();
    }

    public long getTotalLockedPairs() {
        return states.values().stream().mapToLong(StateStats::getLockedPairs).sum();
    }

    /**
     * Render the snapshot as the JSON document served by {@code /metrics} and
     * printed by {@code stats --json}.
     *
     * @return {@code {"totals": {...}, "states": {"jobs": {...}, ...}}}
     */
    public JSONObject toJson() {
        JSONObject totals = new JSONObject();
        totals.put("files", getTotalFiles());
        totals.put("locked", getTotalLocked());
        totals.put("orphans", getTotalOrphans());
        totals.put("bytes", getTotalBytes());
        totals.put("pairs", getTotalPairs());
        totals.put("locked_pairs", getTotalLockedPairs());
        totals.put("oldest_mtime", oldestMtime);
        totals.put("newest_mtime", newestMtime);

        JSONObject stateObjects = new JSONObject();
        for (StateStats stats : states.values()) {
            stateObjects.put(stats.getState().getLabel(), stateJson(stats));
        }

        JSONObject document = new JSONObject();
        document.put("root", root.toString());
        document.put("totals", totals);
        document.put("states", stateObjects);
        return document;
    }

    private static JSONObject stateJson(StateStats stats) {
        JSONObject json = new JSONObject();
        for (ArtifactKind kind : ArtifactKind.values()) {
            String label = kind.getLabel();
            json.put(label, stats.getUnlocked(kind));
            json.put(label + "_locked", stats.getLocked(kind));
            json.put("orphan_" + label, stats.getOrphans(kind));
            json.put(label + "_bytes", stats.getBytes(kind));
        }
        json.put("pairs", stats.getPairs());
        json.put("locked_pairs", stats.getLockedPairs());
        return json;
    }
}
