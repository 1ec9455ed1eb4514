package com.docqueue.core;

import com.docqueue.store.JobPaths;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Execution context handed to a {@link JobProcessor} for one claimed job.
 *
 * <p>This class is the bridge between a processor's domain logic and the queue.
 * It provides:</p>
 * <ul>
 *   <li>The locked primary, metadata and report paths of the claimed job</li>
 *   <li>Reading the submitted metadata sidecar</li>
 *   <li>Writing the result document and an optional report</li>
 *   <li>A result map that is serialized as the success document when the
 *       processor does not write one itself</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> A context belongs to the single worker thread that
 * claimed the job. The result map is synchronized so a processor may fan work
 * out internally, but contexts are never shared between jobs.</p>
 *
 * <p><b>Usage Pattern:</b></p>
 * <pre>{@code
 * public void process(ProcessingContext context) throws Exception {
 *     byte[] pdf = Files.readAllBytes(context.getPdfFile());
 *     context.addResult("bytes_scanned", pdf.length);
 * }
 * }</pre>
 *
 * @see JobProcessor#process(ProcessingContext)
 */
public class ProcessingContext {
    private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    private final ClaimedJob job;
    private final JobPaths lockedPaths;
    private final Map<String, Object> results;
    // Set once the processor writes the metadata file directly
    private final AtomicBoolean metadataWritten;
    private final AtomicBoolean reportWritten;

    /**
     * Create a context for a claimed job.
     *
     * @param job the claimed job
     * @param lockedPaths the locked artifact paths of the job in its claimed state
     */
    public ProcessingContext(ClaimedJob job, JobPaths lockedPaths) {
        this.job = job;
        this.lockedPaths = lockedPaths;
        this.results = Collections.synchronizedMap(new LinkedHashMap<>());
        this.metadataWritten = new AtomicBoolean(false);
        this.reportWritten = new AtomicBoolean(false);
    }

    public String getJobId() {
        return job.getUuid();
    }

    public JobState getState() {
        return job.getState();
    }

    public ClaimedJob getJob() {
        return job;
    }

    /**
     * @return the locked primary file, the document to process
     */
    public Path getPdfFile() {
        return lockedPaths.getPdf();
    }

    /**
     * @return the locked metadata file; it holds the submitted metadata until
     *         a result document is written over it
     */
    public Path getMetadataFile() {
        return lockedPaths.getMetadata();
    }

    /**
     * @return the locked report path; finalize carries it into the target state
     */
    public Path getReportFile() {
        return lockedPaths.getReport();
    }

    /**
     * Read the metadata sidecar as submitted.
     *
     * @return the file content decoded as UTF-8
     * @throws IOException if the file cannot be read
     */
    public String readMetadata() throws IOException {
        return Files.readString(lockedPaths.getMetadata(), StandardCharsets.UTF_8);
    }

    /**
     * Overwrite the locked metadata file with a result document.
     *
     * @param document the JSON document to store
     * @throws IOException if the write fails
     */
    public void writeMetadata(String document) throws IOException {
        Files.writeString(lockedPaths.getMetadata(), document, StandardCharsets.UTF_8);
        metadataWritten.set(true);
    }

    /**
     * Write a report next to the job. It travels with the job on finalize.
     *
     * @param content the report body
     * @throws IOException if the write fails
     */
    public void writeReport(String content) throws IOException {
        Files.writeString(lockedPaths.getReport(), content, StandardCharsets.UTF_8);
        reportWritten.set(true);
    }

    /**
     * Write the structured failure document {@code {"error": code, "detail": detail}}.
     *
     * @param code machine-readable error code
     * @param detail human-readable detail
     * @throws IOException if the write fails
     */
    public void writeErrorMetadata(String code, String detail) throws IOException {
        Map<String, String> document = new LinkedHashMap<>();
        document.put("error", code);
        document.put("detail", detail);
        writeMetadata(gson.toJson(document));
    }

    /**
     * Record a field of the success document.
     *
     * @param key field name
     * @param value field value, serialized with Gson
     */
    public void addResult(String key, Object value) {
        results.put(key, value);
    }

    /**
     * @return a snapshot of the recorded result fields
     */
    public Map<String, Object> getResults() {
        synchronized (results) {
            return new LinkedHashMap<>(results);
        }
    }

    /**
     * Serialize the recorded result fields over the metadata file, unless the
     * processor already wrote the metadata file itself.
     *
     * @throws IOException if the write fails
     */
    public void writeResultsIfPending() throws IOException {
        if (!metadataWritten.get()) {
            writeMetadata(gson.toJson(getResults()));
        }
    }

    public boolean isMetadataWritten() {
        return metadataWritten.get();
    }

    public boolean isReportWritten() {
        return reportWritten.get();
    }
}
