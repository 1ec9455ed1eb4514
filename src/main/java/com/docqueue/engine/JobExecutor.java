package com.docqueue.engine;

import com.docqueue.core.JobProcessor;
import com.docqueue.core.ProcessingContext;

import java.util.logging.Logger;

/**
 * Runs a processor against a claimed job and times it.
 *
 * <p>Separates the invocation from the {@link Worker}'s lifecycle handling so
 * the timing and logging stay in one place.</p>
 */
public class JobExecutor {
    private static final Logger logger = Logger.getLogger(JobExecutor.class.getName());

    /**
     * Run the processor.
     *
     * @param processor the processor to run
     * @param context the claimed job's context
     * @throws Exception whatever the processor throws
     */
    public void execute(JobProcessor processor, ProcessingContext context) throws Exception {
        logger.info("Running processor " + processor.getName() + " on job " + context.getJobId());

        long startTime = System.currentTimeMillis();

        try {
            processor.process(context);

            long duration = System.currentTimeMillis() - startTime;
            logger.info("Job " + context.getJobId() + " processed in " + duration + "ms");

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.warning("Job " + context.getJobId() + " failed after " + duration + "ms: " + e.getMessage());
            throw e;
        }
    }
}
