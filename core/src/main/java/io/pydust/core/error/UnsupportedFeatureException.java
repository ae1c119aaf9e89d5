package io.pydust.core.error;

/** Thrown when a derived value is requested for a configuration combination not yet supported. */
public final class UnsupportedFeatureException extends PydustException {

    private static final long serialVersionUID = 1L;

    public UnsupportedFeatureException(String message) {
        super(message, null);
    }
}
