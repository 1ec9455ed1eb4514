package com.docqueue.test;

import com.docqueue.core.JobState;
import com.docqueue.core.QueueException;
import com.docqueue.store.JobStore;
import com.docqueue.store.PathResolver;
import com.docqueue.store.QueueLayout;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared fixtures for tests that need a queue root with jobs in it.
 */
public final class QueueTestSupport {

    public static final String PDF_CONTENT = "%PDF-1.7\n1 0 obj\n<< /Type /Catalog >>\nendobj\n%%EOF\n";
    public static final String METADATA_CONTENT = "{\"source\":\"scanner-3\"}";

    private QueueTestSupport() {
    }

    /**
     * Create an initialized queue under {@code tempDir/queue}.
     */
    public static JobStore newStore(Path tempDir) throws QueueException {
        QueueLayout layout = new QueueLayout(tempDir.resolve("queue"), new PathResolver());
        layout.initialize();
        return new JobStore(layout);
    }

    /**
     * A store over a root that has not been initialized.
     */
    public static JobStore uninitializedStore(Path root) {
        return new JobStore(new QueueLayout(root, new PathResolver()));
    }

    /**
     * Write a primary/metadata source pair under {@code tempDir/incoming}.
     *
     * @return the primary file; the metadata file sits next to it as {@code <name>.json}
     */
    public static Path writeSource(Path tempDir, String name, String pdf, String metadata) throws IOException {
        Path incoming = Files.createDirectories(tempDir.resolve("incoming"));
        Path pdfFile = incoming.resolve(name + ".pdf");
        Files.writeString(pdfFile, pdf, StandardCharsets.UTF_8);
        Files.writeString(metadataOf(pdfFile), metadata, StandardCharsets.UTF_8);
        return pdfFile;
    }

    public static Path metadataOf(Path pdfSource) {
        return pdfSource.resolveSibling(pdfSource.getFileName().toString().replace(".pdf", ".json"));
    }

    /**
     * Write sources and submit them as one job.
     */
    public static JobState submit(JobStore store, Path tempDir, String uuid, boolean priority)
            throws IOException, QueueException {
        Path pdf = writeSource(tempDir, uuid, PDF_CONTENT, METADATA_CONTENT);
        return store.submit(uuid, pdf, metadataOf(pdf), priority);
    }

    /**
     * Path of a job file by bare name, e.g. {@code file(store, "jobs", "a.pdf.job.lock")}.
     */
    public static Path file(JobStore store, String directory, String name) {
        return store.getRoot().resolve(directory).resolve(name);
    }
}
