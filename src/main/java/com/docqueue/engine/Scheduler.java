package com.docqueue.engine;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process polling runner: a fixed pool of threads, each repeatedly calling
 * {@link Worker#runOnce(boolean)}.
 *
 * <p>The queue has no wake-up mechanism, so an idle thread sleeps for the poll
 * interval before trying again. The same interval is used as a back-off after a
 * queue error. Threads that find work loop again immediately.</p>
 *
 * <p><b>Lifecycle:</b></p>
 * <ol>
 *   <li>{@link #start()} submits one polling loop per worker thread and returns</li>
 *   <li>{@link #shutdown()} clears the running flag, wakes idle threads and
 *       waits for in-flight jobs to finish</li>
 * </ol>
 *
 * <p>Several schedulers, in this or other processes, may poll the same root.</p>
 */
public class Scheduler {
    private static final Logger logger = Logger.getLogger(Scheduler.class.getName());

    private final Worker worker;
    private final int workerCount;
    private final long pollIntervalMillis;
    private final boolean preferPriority;
    private final ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object idleLock = new Object();

    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    /**
     * @param worker the worker every thread calls
     * @param workerCount number of polling threads
     * @param pollIntervalMillis sleep between empty polls
     * @param preferPriority claim from {@code priority_jobs} first
     */
    public Scheduler(Worker worker, int workerCount, long pollIntervalMillis, boolean preferPriority) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive: " + workerCount);
        }
        if (pollIntervalMillis < 0) {
            throw new IllegalArgumentException("pollIntervalMillis must not be negative: " + pollIntervalMillis);
        }
        this.worker = worker;
        this.workerCount = workerCount;
        this.pollIntervalMillis = pollIntervalMillis;
        this.preferPriority = preferPriority;
        this.executorService = Executors.newFixedThreadPool(workerCount);

        logger.info("Scheduler initialized with " + workerCount + " workers, poll interval "
                + pollIntervalMillis + "ms");
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.warning("Scheduler is already running");
            return;
        }
        for (int i = 0; i < workerCount; i++) {
            executorService.submit(this::pollLoop);
        }
        logger.info("Scheduler started with " + workerCount + " workers running "
                + worker.getProcessor().getName());
    }

    private void pollLoop() {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            WorkerOutcome outcome;
            try {
                outcome = worker.runOnce(preferPriority);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Unexpected error in polling loop", e);
                outcome = WorkerOutcome.ERROR;
            }

            switch (outcome) {
                case SUCCESS:
                    succeeded.incrementAndGet();
                    continue;
                case FAILED:
                    failed.incrementAndGet();
                    continue;
                case ERROR:
                    errors.incrementAndGet();
                    break;
                case RELEASED:
                    return;
                default:
                    break;
            }

            try {
                idle();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        logger.fine("Polling loop exited on " + Thread.currentThread().getName());
    }

    // Sleep the poll interval; shutdown() cuts the sleep short
    private void idle() throws InterruptedException {
        synchronized (idleLock) {
            if (running.get() && pollIntervalMillis > 0) {
                idleLock.wait(pollIntervalMillis);
            }
        }
    }

    /**
     * Stop polling and wait for in-flight jobs to finish.
     *
     * <p>Idle threads are woken immediately. A job being processed runs to
     * completion and is finalized as usual; processors are not interrupted.</p>
     */
    public void shutdown() {
        logger.info("Shutting down scheduler...");
        running.set(false);
        synchronized (idleLock) {
            idleLock.notifyAll();
        }
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(60, TimeUnit.SECONDS)) {
                logger.warning("Scheduler threads did not terminate within 60 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Scheduler shut down: " + succeeded.get() + " succeeded, " + failed.get()
                + " failed, " + errors.get() + " queue errors");
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getSucceededCount() {
        return succeeded.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    public long getErrorCount() {
        return errors.get();
    }
}
