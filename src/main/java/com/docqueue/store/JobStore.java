package com.docqueue.store;

import com.docqueue.core.ArtifactKind;
import com.docqueue.core.ClaimedJob;
import com.docqueue.core.InconsistentPairException;
import com.docqueue.core.JobState;
import com.docqueue.core.JobStatusInfo;
import com.docqueue.core.QueueErrorKind;
import com.docqueue.core.QueueException;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The queue engine: submission, claim, release, finalize, move and status of
 * jobs stored as file pairs under a root directory.
 *
 * <p><b>Shared state:</b> the state directories are the only shared state.
 * Any number of processes may operate on the same root concurrently. This class
 * keeps no cache of directory contents; every call re-reads the filesystem, so
 * one instance can be shared between threads.</p>
 *
 * <p><b>Mutual exclusion:</b> a job is claimed by renaming its primary file to
 * the locked name. Exactly one of several concurrent claimants can succeed at
 * that rename; the others see the source vanish and move on. All transitions go
 * through {@link PairRename}, which rolls back the primary rename if the
 * metadata rename fails.</p>
 *
 * <p><b>Ordering:</b> none. Directory enumeration order decides which job a
 * claim picks; the priority preference only decides which directory is scanned
 * first.</p>
 *
 * @see PathResolver
 * @see PairRename
 */
public class JobStore {
    private static final Logger logger = Logger.getLogger(JobStore.class.getName());

    // Probe order for status lookups
    private static final JobState[] STATUS_ORDER = {
            JobState.PRIORITY, JobState.JOBS, JobState.COMPLETE, JobState.ERROR
    };

    private final QueueLayout layout;
    private final PathResolver resolver;
    private final FileCopier copier;
    private final Path root;
    private Consumer<ArtifactKind> claimStepListener = kind -> { };

    public JobStore(QueueLayout layout) {
        this(layout, new FileCopier());
    }

    public JobStore(QueueLayout layout, FileCopier copier) {
        this.layout = layout;
        this.resolver = layout.getResolver();
        this.copier = copier;
        this.root = layout.getRoot();
    }

    public QueueLayout getLayout() {
        return layout;
    }

    public PathResolver getResolver() {
        return resolver;
    }

    public Path getRoot() {
        return root;
    }

    // Called after each completed rename of a claim, before the next one starts
    void setClaimStepListener(Consumer<ArtifactKind> listener) {
        this.claimStepListener = listener;
    }

    /**
     * Resolve the artifact paths of a job.
     *
     * @param uuid the job id
     * @param state the state directory
     * @param locked whether to resolve the locked names
     * @return the paths
     * @throws QueueException INVALID_ARGUMENT for a bad id or over-long path
     */
    public JobPaths paths(String uuid, JobState state, boolean locked) throws QueueException {
        return resolver.pair(root, uuid, state, locked);
    }

    /**
     * Copy a primary and a metadata file into the queue as a new job.
     *
     * <p>The job appears in {@code priority_jobs} when {@code priority} is set,
     * otherwise in {@code jobs}. An existing job with the same id in that state
     * is overwritten. If the metadata copy fails after the primary copy
     * succeeded, the primary copy is deleted before the error is thrown, so no
     * half-submitted job is ever claimable.</p>
     *
     * @param uuid the new job id
     * @param sourcePdf the primary file to copy
     * @param sourceMetadata the metadata file to copy
     * @param priority whether to submit into the expedited queue
     * @return the state the job was submitted to
     * @throws QueueException NOT_FOUND if a source is missing, INVALID_ARGUMENT
     *                        for a bad id or missing argument, IO otherwise
     */
    public JobState submit(String uuid, Path sourcePdf, Path sourceMetadata, boolean priority)
            throws QueueException {
        if (sourcePdf == null || sourceMetadata == null) {
            throw QueueException.invalidArgument("source pdf and metadata paths are required");
        }
        JobState state = priority ? JobState.PRIORITY : JobState.JOBS;
        JobPaths destination = resolver.pair(root, uuid, state, false);
        layout.ensureStateDirectory(state);

        copier.copy(sourcePdf, destination.getPdf());
        try {
            copier.copy(sourceMetadata, destination.getMetadata());
        } catch (QueueException e) {
            // Keep submission all-or-nothing
            try {
                Files.deleteIfExists(destination.getPdf());
            } catch (IOException cleanup) {
                logger.log(Level.SEVERE, "Failed to remove primary copy of half-submitted job " + uuid, cleanup);
            }
            throw e;
        }

        logger.info("Submitted job " + uuid + " to " + state.getDirectoryName());
        return state;
    }

    /**
     * Claim the next available job.
     *
     * <p>Scans the preferred directory first ({@code priority_jobs} when
     * {@code preferPriority}, else {@code jobs}) and the other one only if the
     * first yields nothing. Within a directory, entries are tried in enumeration
     * order:</p>
     * <ol>
     *   <li>skip names that are not unlocked primary files</li>
     *   <li>skip primaries whose unlocked metadata sibling is missing (orphans)</li>
     *   <li>rename the primary to its locked name; if it vanished, another
     *       claimant won it, so try the next entry</li>
     *   <li>rename the metadata to its locked name; on failure the primary is
     *       renamed back and the scan stops with the error</li>
     * </ol>
     *
     * @param preferPriority scan {@code priority_jobs} before {@code jobs}
     * @return the claimed job, or empty if nothing was claimable
     * @throws InconsistentPairException if the metadata vanished between the two renames
     * @throws QueueException IO if listing or renaming failed
     */
    public Optional<ClaimedJob> claimNext(boolean preferPriority) throws QueueException {
        JobState first = preferPriority ? JobState.PRIORITY : JobState.JOBS;
        JobState second = preferPriority ? JobState.JOBS : JobState.PRIORITY;

        ClaimedJob claimed = claimInDirectory(first);
        if (claimed == null) {
            claimed = claimInDirectory(second);
        }
        if (claimed == null) {
            logger.fine("No claimable job under " + root);
            return Optional.empty();
        }
        logger.info("Claimed job " + claimed.getUuid() + " in " + claimed.getState().getDirectoryName());
        return Optional.of(claimed);
    }

    private ClaimedJob claimInDirectory(JobState state) throws QueueException {
        Path directory = resolver.stateDirectory(root, state);
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                String uuid = resolver.idFromFileName(entry.getFileName().toString(), ArtifactKind.PDF, false);
                if (uuid == null) {
                    continue;
                }
                JobPaths unlocked = candidatePaths(uuid, state, false);
                JobPaths locked = candidatePaths(uuid, state, true);
                if (unlocked == null || locked == null) {
                    continue;
                }
                if (!Files.exists(unlocked.getMetadata())) {
                    // Usually a competing claimant between its two renames
                    logger.fine("Skipping primary without unlocked metadata: " + entry);
                    continue;
                }

                PairRename rename = PairRename.pairOnly(unlocked, locked).afterEachStep(claimStepListener);
                try {
                    rename.commit();
                    return new ClaimedJob(uuid, state);
                } catch (QueueException e) {
                    boolean vanished = e.getKind() == QueueErrorKind.NOT_FOUND;
                    if (vanished && rename.getFailedKind() == ArtifactKind.PDF) {
                        logger.fine("Lost claim race for " + uuid);
                        continue;
                    }
                    if (vanished && rename.getFailedKind() == ArtifactKind.METADATA) {
                        throw new InconsistentPairException(unlocked.getPdf(), unlocked.getMetadata());
                    }
                    throw e;
                }
            }
        } catch (NoSuchFileException e) {
            logger.fine("State directory missing: " + directory);
            return null;
        } catch (DirectoryIteratorException e) {
            throw QueueException.io("failed to list " + directory, e.getCause());
        } catch (IOException e) {
            throw QueueException.io("failed to list " + directory, e);
        }
        return null;
    }

    // Paths for a name found on disk; null when the name is not a usable job id
    private JobPaths candidatePaths(String uuid, JobState state, boolean locked) {
        try {
            return resolver.pair(root, uuid, state, locked);
        } catch (QueueException e) {
            logger.warning("Skipping entry with unusable job id in " + state.getDirectoryName() + ": " + e.getMessage());
            return null;
        }
    }

    /**
     * Give up a claim: rename the locked files back to their unlocked names in
     * the same state. A locked report, if any, is released with them.
     *
     * @param uuid the claimed job id
     * @param state the state the job was claimed in
     * @throws QueueException NOT_FOUND if the job is not locked there, IO on failure
     */
    public void release(String uuid, JobState state) throws QueueException {
        JobPaths locked = resolver.pair(root, uuid, state, true);
        JobPaths unlocked = resolver.pair(root, uuid, state, false);
        layout.ensureStateDirectory(state);

        PairRename.withReport(locked, unlocked).commit();
        logger.info("Released job " + uuid + " in " + state.getDirectoryName());
    }

    /**
     * Commit the outcome of processing: rename the locked files in
     * {@code fromState} to the unlocked names in {@code toState}. A locked report
     * written by the processor is carried along.
     *
     * @param uuid the claimed job id
     * @param fromState the state the job was claimed in
     * @param toState usually COMPLETE or ERROR
     * @throws QueueException NOT_FOUND if the job is not locked in fromState, IO on failure
     */
    public void finalizeJob(String uuid, JobState fromState, JobState toState) throws QueueException {
        JobPaths locked = resolver.pair(root, uuid, fromState, true);
        JobPaths destination = resolver.pair(root, uuid, toState, false);
        layout.ensureStateDirectory(toState);

        PairRename.withReport(locked, destination).commit();
        logger.info("Finalized job " + uuid + ": " + fromState.getDirectoryName() + " -> " + toState.getDirectoryName());
    }

    /**
     * Move an unlocked job between states regardless of the claim lifecycle,
     * e.g. to requeue a job from {@code error} back to {@code jobs}.
     *
     * @param uuid the job id
     * @param fromState the current state
     * @param toState the target state
     * @throws QueueException NOT_FOUND if no unlocked job exists in fromState, IO on failure
     */
    public void move(String uuid, JobState fromState, JobState toState) throws QueueException {
        JobPaths source = resolver.pair(root, uuid, fromState, false);
        JobPaths destination = resolver.pair(root, uuid, toState, false);
        layout.ensureStateDirectory(toState);

        PairRename.withReport(source, destination).commit();
        logger.info("Moved job " + uuid + ": " + fromState.getDirectoryName() + " -> " + toState.getDirectoryName());
    }

    /**
     * Find where a job is.
     *
     * <p>Probes {@code priority_jobs}, {@code jobs}, {@code complete} and
     * {@code error} in that order, unlocked names before locked ones.</p>
     *
     * @param uuid the job id
     * @return the state and lock flag, or empty if the job exists nowhere
     * @throws InconsistentPairException if exactly one file of a pair exists
     * @throws QueueException INVALID_ARGUMENT for a bad id, IO if a file cannot be probed
     */
    public Optional<JobStatusInfo> status(String uuid) throws QueueException {
        for (JobState state : STATUS_ORDER) {
            if (pairPresent(resolver.pair(root, uuid, state, false))) {
                return Optional.of(new JobStatusInfo(state, false));
            }
            if (pairPresent(resolver.pair(root, uuid, state, true))) {
                return Optional.of(new JobStatusInfo(state, true));
            }
        }
        return Optional.empty();
    }

    private boolean pairPresent(JobPaths paths) throws QueueException {
        boolean pdf = probe(paths.getPdf());
        boolean metadata = probe(paths.getMetadata());
        if (pdf && metadata) {
            return true;
        }
        if (!pdf && !metadata) {
            return false;
        }
        throw pdf
                ? new InconsistentPairException(paths.getPdf(), paths.getMetadata())
                : new InconsistentPairException(paths.getMetadata(), paths.getPdf());
    }

    private boolean probe(Path file) throws QueueException {
        if (Files.exists(file)) {
            return true;
        }
        if (Files.notExists(file)) {
            return false;
        }
        throw QueueException.io("cannot access " + file, null);
    }
}
