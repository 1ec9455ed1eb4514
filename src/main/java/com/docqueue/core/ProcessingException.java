package com.docqueue.core;

/**
 * Failure raised by a {@link JobProcessor}. The code and detail end up in the
 * job's metadata file as {@code {"error": code, "detail": detail}}.
 */
public class ProcessingException extends Exception {

    private final String code;
    private final String detail;

    /**
     * @param code short machine-readable code, e.g. "ocr_failed"
     * @param detail human-readable detail, e.g. "parse_error"
     */
    public ProcessingException(String code, String detail) {
        super(code + ": " + detail);
        this.code = code;
        this.detail = detail;
    }

    public ProcessingException(String code, String detail, Throwable cause) {
        super(code + ": " + detail, cause);
        this.code = code;
        this.detail = detail;
    }

    public String getCode() {
        return code;
    }

    public String getDetail() {
        return detail;
    }
}
