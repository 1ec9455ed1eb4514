package com.docqueue.core;

/**
 * Exception thrown by every queue operation that cannot complete.
 *
 * <p>The {@link QueueErrorKind} is the programmatic contract: the CLI turns it
 * into an exit code and the control plane into an HTTP status. The message is
 * for logs and must not be relied on by callers.</p>
 *
 * <p><b>Example Handling:</b></p>
 * <pre>{@code
 * try {
 *     store.release(uuid, JobState.JOBS);
 * } catch (QueueException e) {
 *     if (e.getKind() == QueueErrorKind.NOT_FOUND) {
 *         // someone else already released or finalized it
 *     }
 * }
 * }</pre>
 *
 * @see QueueErrorKind
 */
public class QueueException extends Exception {

    private final QueueErrorKind kind;

    /**
     * Create a new QueueException.
     *
     * @param kind the error class
     * @param message the error message
     */
    public QueueException(QueueErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Create a new QueueException wrapping a lower-level failure.
     *
     * @param kind the error class
     * @param message the error message
     * @param cause the underlying cause, usually an IOException
     */
    public QueueException(QueueErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Get the error class of this failure.
     *
     * @return the kind, never null
     */
    public QueueErrorKind getKind() {
        return kind;
    }

    public static QueueException invalidArgument(String message) {
        return new QueueException(QueueErrorKind.INVALID_ARGUMENT, message);
    }

    public static QueueException notFound(String message) {
        return new QueueException(QueueErrorKind.NOT_FOUND, message);
    }

    public static QueueException io(String message, Throwable cause) {
        return new QueueException(QueueErrorKind.IO, message, cause);
    }
}
