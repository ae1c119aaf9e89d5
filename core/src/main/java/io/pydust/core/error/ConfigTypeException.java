package io.pydust.core.error;

/**
 * Thrown when a configuration value does not have the shape its field declares, e.g. a module
 * {@code name} given as a number or a {@code zig_tests} flag given as a string.
 *
 * <p>Carries the offending field, the rejected value and the expected shape description so that
 * the message points straight at the manifest entry to fix.
 */
public final class ConfigTypeException extends PydustException {

    private static final long serialVersionUID = 1L;

    private final String field;
    private final transient Object value;
    private final String expected;

    public ConfigTypeException(String message, String field, Object value, String expected) {
        super(message, null);
        this.field = field;
        this.value = value;
        this.expected = expected;
    }

    /** The configuration key whose value was rejected. */
    public String field() {
        return field;
    }

    /** The rejected value, {@code null} if the key was absent. */
    public Object value() {
        return value;
    }

    /** Description of the accepted shape, e.g. {@code "Path | None"}. */
    public String expected() {
        return expected;
    }
}
