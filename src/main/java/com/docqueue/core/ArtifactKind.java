package com.docqueue.core;

/**
 * The files that make up a job on disk.
 *
 * <p>PDF and METADATA form the atomic pair. REPORT is a derived artifact that
 * may sit next to a job and follows the pair when it moves, but its absence is
 * never an inconsistency.</p>
 */
public enum ArtifactKind {
    PDF("pdf", ".pdf.job", "application/pdf"),
    METADATA("metadata", ".metadata.job", "application/json"),
    REPORT("report", ".report.html", "text/html");

    /** Suffix appended to every file of a claimed job. */
    public static final String LOCK_SUFFIX = ".lock";

    private final String label;
    private final String suffix;
    private final String contentType;

    ArtifactKind(String label, String suffix, String contentType) {
        this.label = label;
        this.suffix = suffix;
        this.contentType = contentType;
    }

    public String getLabel() {
        return label;
    }

    public String getSuffix() {
        return suffix;
    }

    public String getContentType() {
        return contentType;
    }

    /**
     * Full suffix of a file of this kind, with or without the lock marker.
     *
     * @param locked whether the file belongs to a claimed job
     * @return e.g. ".pdf.job" or ".pdf.job.lock"
     */
    public String suffix(boolean locked) {
        return locked ? suffix + LOCK_SUFFIX : suffix;
    }

    /**
     * Build the file name of this artifact for a job.
     *
     * @param uuid the job identifier
     * @param locked whether the job is claimed
     * @return the bare file name, without directory
     */
    public String fileName(String uuid, boolean locked) {
        return uuid + suffix(locked);
    }

    /**
     * Parse a kind from its label.
     *
     * @param value "pdf", "metadata" or "report"
     * @return the matching kind, or null if unknown
     */
    public static ArtifactKind fromLabel(String value) {
        for (ArtifactKind kind : values()) {
            if (kind.label.equals(value)) {
                return kind;
            }
        }
        return null;
    }
}
