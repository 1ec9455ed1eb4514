package com.docqueue.store;

import com.docqueue.core.ArtifactKind;
import com.docqueue.core.JobState;
import com.docqueue.core.QueueException;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Computes a {@link QueueStats} snapshot by listing every state directory.
 *
 * <p>Read-only. The snapshot is not atomic across directories: jobs moving
 * while the collector runs may be counted twice or not at all. A file that
 * disappears between listing and stat is left out of the counts.</p>
 *
 * <p>Orphans are counted per kind, each against the file it must sit next to
 * in the same lock state:</p>
 * <ul>
 *   <li>primary without metadata</li>
 *   <li>metadata without primary</li>
 *   <li>report without primary</li>
 * </ul>
 */
public class StatsCollector {
    private static final Logger logger = Logger.getLogger(StatsCollector.class.getName());

    private final Path root;
    private final PathResolver resolver;

    public StatsCollector(QueueLayout layout) {
        this.root = layout.getRoot();
        this.resolver = layout.getResolver();
    }

    /**
     * @return counts for all four states plus totals
     * @throws QueueException NOT_FOUND if a state directory is missing (root not
     *                        initialized), IO if a listing or stat fails
     */
    public QueueStats collect() throws QueueException {
        Map<JobState, StateStats> states = new EnumMap<>(JobState.class);
        long[] mtimeRange = {Long.MAX_VALUE, Long.MIN_VALUE};

        for (JobState state : JobState.values()) {
            states.put(state, collectState(state, mtimeRange));
        }

        boolean anyFile = mtimeRange[0] != Long.MAX_VALUE;
        QueueStats stats = new QueueStats(root, states,
                anyFile ? mtimeRange[0] : 0L,
                anyFile ? mtimeRange[1] : 0L);
        logger.fine("Collected stats for " + root + ": " + stats.getTotalFiles() + " files");
        return stats;
    }

    private StateStats collectState(JobState state, long[] mtimeRange) throws QueueException {
        Path directory = resolver.stateDirectory(root, state);
        StateStats stats = new StateStats(state);
        // Ids seen per kind, one map per lock state
        Map<ArtifactKind, Set<String>> seenUnlocked = newIdSets();
        Map<ArtifactKind, Set<String>> seenLocked = newIdSets();

        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                Match match = match(name);
                if (match == null) {
                    continue;
                }
                BasicFileAttributes attributes;
                try {
                    attributes = Files.readAttributes(entry, BasicFileAttributes.class);
                } catch (NoSuchFileException e) {
                    logger.fine("File vanished during stats: " + entry);
                    continue;
                }
                if (!attributes.isRegularFile()) {
                    continue;
                }

                stats.addFile(match.kind, match.locked, attributes.size());
                Map<ArtifactKind, Set<String>> seen = match.locked ? seenLocked : seenUnlocked;
                seen.get(match.kind).add(match.uuid);

                long mtime = attributes.lastModifiedTime().toMillis() / 1000L;
                mtimeRange[0] = Math.min(mtimeRange[0], mtime);
                mtimeRange[1] = Math.max(mtimeRange[1], mtime);
            }
        } catch (NoSuchFileException e) {
            throw QueueException.notFound("state directory missing: " + state.getDirectoryName());
        } catch (DirectoryIteratorException e) {
            throw QueueException.io("failed to list " + directory, e.getCause());
        } catch (IOException e) {
            throw QueueException.io("failed to read " + directory, e);
        }

        countPairs(stats, seenUnlocked, false);
        countPairs(stats, seenLocked, true);
        return stats;
    }

    private static Map<ArtifactKind, Set<String>> newIdSets() {
        Map<ArtifactKind, Set<String>> ids = new EnumMap<>(ArtifactKind.class);
        for (ArtifactKind kind : ArtifactKind.values()) {
            ids.put(kind, new HashSet<>());
        }
        return ids;
    }

    private static void countPairs(StateStats stats, Map<ArtifactKind, Set<String>> seen, boolean locked) {
        Set<String> pdfs = seen.get(ArtifactKind.PDF);
        Set<String> metadata = seen.get(ArtifactKind.METADATA);

        for (String uuid : pdfs) {
            if (metadata.contains(uuid)) {
                stats.addPair(locked);
            } else {
                stats.addOrphan(ArtifactKind.PDF);
            }
        }
        for (String uuid : metadata) {
            if (!pdfs.contains(uuid)) {
                stats.addOrphan(ArtifactKind.METADATA);
            }
        }
        for (String uuid : seen.get(ArtifactKind.REPORT)) {
            if (!pdfs.contains(uuid)) {
                stats.addOrphan(ArtifactKind.REPORT);
            }
        }
    }

    // Kind and lock state of a queue file name, or null for anything else (temp files etc.)
    private Match match(String name) {
        for (boolean locked : new boolean[] {true, false}) {
            for (ArtifactKind kind : ArtifactKind.values()) {
                String uuid = resolver.idFromFileName(name, kind, locked);
                if (uuid != null && !uuid.isEmpty()) {
                    return new Match(uuid, kind, locked);
                }
            }
        }
        return null;
    }

    private static final class Match {
        final String uuid;
        final ArtifactKind kind;
        final boolean locked;

        Match(String uuid, ArtifactKind kind, boolean locked) {
            this.uuid = uuid;
            this.kind = kind;
            this.locked = locked;
        }
    }
}
