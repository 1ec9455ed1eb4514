package com.docqueue.core;

/**
 * The three classes of queue failure.
 *
 * <p>Callers branch on the kind, never on the message:</p>
 * <ul>
 *   <li>INVALID_ARGUMENT: caller-fixable input problem, never retried internally</li>
 *   <li>NOT_FOUND: no matching job or source file; a normal outcome for pollers</li>
 *   <li>IO: filesystem failure, surfaced verbatim</li>
 * </ul>
 */
public enum QueueErrorKind {
    INVALID_ARGUMENT(400, 1),
    NOT_FOUND(404, 2),
    IO(500, 1);

    private final int httpStatus;
    private final int exitCode;

    QueueErrorKind(int httpStatus, int exitCode) {
        this.httpStatus = httpStatus;
        this.exitCode = exitCode;
    }

    /**
     * @return the HTTP status the control plane answers with
     */
    public int getHttpStatus() {
        return httpStatus;
    }

    /**
     * @return the process exit code the CLI terminates with
     */
    public int getExitCode() {
        return exitCode;
    }
}
