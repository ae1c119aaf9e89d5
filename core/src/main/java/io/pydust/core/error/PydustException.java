package io.pydust.core.error;

/**
 * Abstract base for all ziggy-pydust configuration errors. Never thrown directly, use one of the
 * concrete subclasses. Every error is terminal for the operation that raised it: configuration
 * errors are authoring mistakes and are not retried.
 */
public abstract class PydustException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected PydustException(String message, String source) {
        super(message);
        this.source = source;
    }

    protected PydustException(String message, Throwable cause, String source) {
        super(message, cause);
        this.source = source;
    }

    /** The manifest path that produced the error, or {@code null} if not file-bound. */
    public String source() {
        return source;
    }
}
