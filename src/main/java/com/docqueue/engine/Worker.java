package com.docqueue.engine;

import com.docqueue.core.ClaimedJob;
import com.docqueue.core.JobProcessor;
import com.docqueue.core.JobState;
import com.docqueue.core.ProcessingContext;
import com.docqueue.core.ProcessingException;
import com.docqueue.core.QueueException;
import com.docqueue.store.JobStore;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Claims one job, runs a processor on it and finalizes it.
 *
 * <p>Each call to {@link #runOnce(boolean)} handles the complete lifecycle of a
 * single job:</p>
 * <ul>
 *   <li>Claim the next job; nothing claimable → {@link WorkerOutcome#EMPTY}</li>
 *   <li>Run the processor through the {@link JobExecutor}</li>
 *   <li>Success: store the result document, finalize to {@code complete}</li>
 *   <li>Failure: overwrite the metadata with {@code {"error", "detail"}},
 *       delete any partial report, finalize to {@code error}</li>
 *   <li>Interrupted: release the claim so another worker can take the job</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> A Worker holds no per-job state, so several threads
 * may call {@code runOnce} on the same instance. The filesystem claim makes sure
 * they never process the same job.</p>
 *
 * <p>A job is never retried here. Requeueing an errored job is an operator
 * action ({@code move error jobs}).</p>
 *
 * @see Scheduler
 * @see JobProcessor
 */
public class Worker {
    private static final Logger logger = Logger.getLogger(Worker.class.getName());

    static final String GENERIC_ERROR_CODE = "processing_failed";

    private final JobStore store;
    private final JobProcessor processor;
    private final JobExecutor executor;

    public Worker(JobStore store, JobProcessor processor) {
        this(store, processor, new JobExecutor());
    }

    public Worker(JobStore store, JobProcessor processor, JobExecutor executor) {
        this.store = store;
        this.processor = processor;
        this.executor = executor;
    }

    public JobProcessor getProcessor() {
        return processor;
    }

    /**
     * Process at most one job.
     *
     * @param preferPriority claim from {@code priority_jobs} first
     * @return what happened
     */
    public WorkerOutcome runOnce(boolean preferPriority) {
        Optional<ClaimedJob> claimed;
        try {
            claimed = store.claimNext(preferPriority);
        } catch (QueueException e) {
            logger.log(Level.SEVERE, "Claim failed under " + store.getRoot(), e);
            return WorkerOutcome.ERROR;
        }
        if (claimed.isEmpty()) {
            return WorkerOutcome.EMPTY;
        }

        ClaimedJob job = claimed.get();
        ProcessingContext context;
        try {
            context = new ProcessingContext(job, store.paths(job.getUuid(), job.getState(), true));
        } catch (QueueException e) {
            // Cannot happen for an id the store just claimed
            logger.log(Level.SEVERE, "Cannot resolve paths of claimed job " + job.getUuid(), e);
            return WorkerOutcome.ERROR;
        }

        try {
            executor.execute(processor, context);
            context.writeResultsIfPending();

        } catch (InterruptedException e) {
            logger.warning("Interrupted while processing " + job.getUuid() + ", releasing claim");
            Thread.currentThread().interrupt();
            return release(job);

        } catch (ProcessingException e) {
            return fail(context, e.getCode(), e.getDetail());

        } catch (Exception e) {
            logger.log(Level.SEVERE, "Processor " + processor.getName() + " crashed on " + job.getUuid(), e);
            return fail(context, GENERIC_ERROR_CODE, describe(e));
        }

        try {
            store.finalizeJob(job.getUuid(), job.getState(), JobState.COMPLETE);
        } catch (QueueException e) {
            logger.log(Level.SEVERE, "Failed to finalize " + job.getUuid() + " to complete", e);
            return WorkerOutcome.ERROR;
        }
        return WorkerOutcome.SUCCESS;
    }

    private WorkerOutcome fail(ProcessingContext context, String code, String detail) {
        String uuid = context.getJobId();
        logger.info("Job " + uuid + " failed: " + code + " (" + detail + ")");

        try {
            context.writeErrorMetadata(code, detail);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to write error document for " + uuid, e);
        }
        try {
            // A half-written report must not reach the error directory
            Files.deleteIfExists(context.getReportFile());
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to delete partial report of " + uuid, e);
        }

        try {
            store.finalizeJob(uuid, context.getState(), JobState.ERROR);
        } catch (QueueException e) {
            logger.log(Level.SEVERE, "Failed to finalize " + uuid + " to error", e);
            return WorkerOutcome.ERROR;
        }
        return WorkerOutcome.FAILED;
    }

    private WorkerOutcome release(ClaimedJob job) {
        try {
            store.release(job.getUuid(), job.getState());
        } catch (QueueException e) {
            logger.log(Level.SEVERE, "Failed to release " + job.getUuid(), e);
            return WorkerOutcome.ERROR;
        }
        return WorkerOutcome.RELEASED;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
