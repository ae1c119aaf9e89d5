package io.pydust.core.validation;

import io.pydust.core.error.ConfigTypeException;
import java.util.Objects;

/**
 * Guard applied at every field-assignment site of the configuration model. Returns the value
 * unchanged when it conforms to the declared {@link ValueShape}, otherwise throws a
 * {@link ConfigTypeException} naming the field, the rejected value and the expected shape.
 *
 * <p>Stateless and thread-safe.
 */
public final class TypeValidator {

    private TypeValidator() {
        // utility class
    }

    /**
     * Validates {@code value} against {@code expected}.
     *
     * @param field    configuration key, used in the diagnostic
     * @param value    the value to check, may be {@code null}
     * @param expected the accepted shape
     * @param <T>      static type of the value
     * @return {@code value}, unchanged
     * @throws ConfigTypeException if the value does not conform
     */
    public static <T> T validate(String field, T value, ValueShape expected) {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(expected, "expected must not be null");
        if (expected.accepts(value)) {
            return value;
        }
        String message = "Input of " + field + "=" + repr(value) + " is not a valid \"" + expected.description() + "\".";
        throw new ConfigTypeException(message, field, value, expected.description());
    }

    /** Renders a value for diagnostics: strings single-quoted, {@code null} as {@code null}. */
    static String repr(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence text) {
            return "'" + text + "'";
        }
        return String.valueOf(value);
    }
}
