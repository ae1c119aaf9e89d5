package io.pydust.core.error;

/**
 * Thrown when individually well-typed values are inconsistent with each other or with the running
 * tool: self-managed mode combined with declared extension modules, a {@code build-system.requires}
 * pin for a different ziggy-pydust version, or an unrecognised key. The message states the fix.
 */
public final class InvalidConfigurationException extends PydustException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message) {
        super(message, null);
    }

    public InvalidConfigurationException(String message, String source) {
        super(message, source);
    }
}
