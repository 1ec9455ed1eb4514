package com.docqueue.store;

import com.docqueue.core.ArtifactKind;

import java.nio.file.Path;

/**
 * Resolved artifact paths of one job in one state and lock condition.
 */
public final class JobPaths {
    private final Path pdf;
    private final Path metadata;
    private final Path report;

    JobPaths(Path pdf, Path metadata, Path report) {
        this.pdf = pdf;
        this.metadata = metadata;
        this.report = report;
    }

    public Path getPdf() {
        return pdf;
    }

    public Path getMetadata() {
        return metadata;
    }

    public Path getReport() {
        return report;
    }

    public Path get(ArtifactKind kind) {
        return switch (kind) {
            case PDF -> pdf;
            case METADATA -> metadata;
            case REPORT -> report;
        };
    }

    @Override
    public String toString() {
        return "JobPaths{pdf=" + pdf + ", metadata=" + metadata + ", report=" + report + "}";
    }
}
