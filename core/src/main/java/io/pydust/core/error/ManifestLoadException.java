package io.pydust.core.error;

/** Thrown when the manifest file is missing, unreadable or not valid TOML. */
public final class ManifestLoadException extends PydustException {

    private static final long serialVersionUID = 1L;

    public ManifestLoadException(String message, String source) {
        super(message, source);
    }

    public ManifestLoadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
