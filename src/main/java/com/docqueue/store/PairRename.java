package com.docqueue.store;

import com.docqueue.core.ArtifactKind;
import com.docqueue.core.QueueException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Two-phase rename of a job's files from one set of names to another.
 *
 * <p>Every lifecycle transition of a job (claim, release, finalize, move) is a
 * PairRename. The steps run in a fixed order and the transition only counts as
 * committed once all of them succeeded:</p>
 * <ol>
 *   <li>rename the primary file</li>
 *   <li>rename the metadata file</li>
 *   <li>rename the report, only if one exists and the transition carries it</li>
 * </ol>
 *
 * <p>If a step fails, every completed step is renamed back in reverse order and
 * the failure of the step is thrown. Rollback is best effort: a failed rollback
 * rename is logged at SEVERE and does not replace the original error.</p>
 *
 * <p><b>Atomicity:</b> each rename is {@code Files.move} with ATOMIC_MOVE, i.e.
 * POSIX rename(2) within one filesystem. If the source has already been renamed
 * away by a competing process the step fails with NOT_FOUND; this is what makes
 * the primary rename a mutual-exclusion primitive. A crash between steps leaves
 * an inconsistent pair, which status reports but nothing repairs.</p>
 *
 * <p>Instances are single-use and not thread-safe.</p>
 */
final class PairRename {
    private static final Logger logger = Logger.getLogger(PairRename.class.getName());

    enum Phase {
        PENDING,
        COMMITTED,
        ROLLED_BACK
    }

    private final JobPaths from;
    private final JobPaths to;
    private final boolean carryReport;
    // Completed steps, most recent first, so rollback can pop in reverse order
    private final Deque<ArtifactKind> completed = new ArrayDeque<>();

    private Phase phase = Phase.PENDING;
    private ArtifactKind failedKind;
    private Consumer<ArtifactKind> stepListener = kind -> { };

    private PairRename(JobPaths from, JobPaths to, boolean carryReport) {
        this.from = from;
        this.to = to;
        this.carryReport = carryReport;
    }

    /**
     * Transition that renames primary and metadata and, if present, the report.
     */
    static PairRename withReport(JobPaths from, JobPaths to) {
        return new PairRename(from, to, true);
    }

    /**
     * Transition that renames only the primary and metadata files.
     */
    static PairRename pairOnly(JobPaths from, JobPaths to) {
        return new PairRename(from, to, false);
    }

    /**
     * Run {@code listener} after each completed step, before the next one starts.
     */
    PairRename afterEachStep(Consumer<ArtifactKind> listener) {
        this.stepListener = listener;
        return this;
    }

    /**
     * Run all steps, rolling back on the first failure.
     *
     * @throws QueueException NOT_FOUND if a step's source file was missing, IO on
     *                        any other failure; {@link #getFailedKind()} names the step
     * @throws IllegalStateException if called twice
     */
    void commit() throws QueueException {
        if (phase != Phase.PENDING) {
            throw new IllegalStateException("PairRename already " + phase);
        }
        try {
            step(ArtifactKind.PDF);
            step(ArtifactKind.METADATA);
            if (carryReport && reportPresent()) {
                step(ArtifactKind.REPORT);
            }
            phase = Phase.COMMITTED;
        } catch (QueueException e) {
            rollback();
            throw e;
        }
    }

    Phase getPhase() {
        return phase;
    }

    /**
     * @return the artifact whose rename failed, or null if none failed
     */
    ArtifactKind getFailedKind() {
        return failedKind;
    }

    private void step(ArtifactKind kind) throws QueueException {
        Path source = from.get(kind);
        Path target = to.get(kind);
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (NoSuchFileException e) {
            failedKind = kind;
            throw QueueException.notFound("missing " + kind.getLabel() + " file " + source.getFileName());
        } catch (IOException e) {
            failedKind = kind;
            throw QueueException.io("failed to rename " + source + " to " + target, e);
        }
        completed.push(kind);
        stepListener.accept(kind);
    }

    private boolean reportPresent() throws QueueException {
        Path report = from.getReport();
        if (Files.exists(report)) {
            return true;
        }
        if (Files.notExists(report)) {
            return false;
        }
        failedKind = ArtifactKind.REPORT;
        throw QueueException.io("cannot determine whether report exists: " + report, null);
    }

    private void rollback() {
        while (!completed.isEmpty()) {
            ArtifactKind kind = completed.pop();
            Path source = from.get(kind);
            Path target = to.get(kind);
            try {
                Files.move(target, source, StandardCopyOption.ATOMIC_MOVE);
                logger.fine("Rolled back " + kind.getLabel() + " rename of " + target.getFileName());
            } catch (IOException e) {
                logger.log(Level.SEVERE, "Rollback failed: " + target + " could not be renamed back to " + source, e);
            }
        }
        phase = Phase.ROLLED_BACK;
    }
}
