package com.docqueue.core;

/**
 * A unit of domain work run against a claimed job.
 *
 * <p>A processor is handed a {@link ProcessingContext} after a successful claim
 * and before the job is finalized. It reads the locked primary file, writes its
 * structured result into the locked metadata file and may write a report. It
 * must never rename, move or delete queue files itself; the
 * {@link com.docqueue.engine.Worker} finalizes the job based on whether
 * {@link #process(ProcessingContext)} returned or threw.</p>
 */
public interface JobProcessor {

    /**
     * Get the name of this processor, used in logs.
     *
     * @return a short identifier such as "ocr-triage"
     */
    String getName();

    /**
     * Run the processor's business logic against a claimed job.
     *
     * <p>On success the result document is either written directly with
     * {@link ProcessingContext#writeMetadata(String)} or assembled from the fields
     * recorded with {@link ProcessingContext#addResult(String, Object)}.
     * On failure it should throw a {@link ProcessingException} carrying a short
     * machine-readable code; any other exception is recorded with the code
     * {@code processing_failed}.</p>
     *
     * @param context paths and helpers for the claimed job
     * @throws Exception if processing fails. The job is then finalized into the
     *                   error state with a structured error document.
     */
    void process(ProcessingContext context) throws Exception;
}
