package io.pydust.core.validation;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declared shape of a configuration value: the Java types a field accepts and whether it may be
 * absent. Immutable, thread-safe.
 *
 * <p>Shapes are unions by construction: {@code ValueShape.PATH.orAbsent()} accepts a {@link Path}
 * or {@code null} and describes itself as {@code "path or absent"}.
 */
public final class ValueShape {

    /** Textual value ({@link String}). */
    public static final ValueShape TEXT = new ValueShape("text", List.of(String.class), false);

    /** Filesystem path value ({@link Path}); a bare string is not accepted. */
    public static final ValueShape PATH = new ValueShape("path", List.of(Path.class), false);

    /** Boolean flag ({@link Boolean}). */
    public static final ValueShape BOOLEAN = new ValueShape("boolean", List.of(Boolean.class), false);

    /** Ordered sequence ({@link List}). */
    public static final ValueShape ARRAY = new ValueShape("array", List.of(List.class), false);

    /** Key/value table ({@link Map}). */
    public static final ValueShape TABLE = new ValueShape("table", List.of(Map.class), false);

    private final String description;
    private final List<Class<?>> types;
    private final boolean absentAllowed;

    private ValueShape(String description, List<Class<?>> types, boolean absentAllowed) {
        this.description = description;
        this.types = types;
        this.absentAllowed = absentAllowed;
    }

    /** Shape accepting instances of a single type, e.g. a model record. */
    public static ValueShape of(String description, Class<?> type) {
        return new ValueShape(description, List.of(type), false);
    }

    /** Returns a shape accepting everything this one does, plus {@code null}. */
    public ValueShape orAbsent() {
        if (absentAllowed) {
            return this;
        }
        return new ValueShape(description + " or absent", types, true);
    }

    /** Returns {@code true} if {@code value} conforms to this shape. */
    public boolean accepts(Object value) {
        if (value == null) {
            return absentAllowed;
        }
        for (Class<?> type : types) {
            if (type.isInstance(value)) {
                return true;
            }
        }
        return false;
    }

    /** Human-readable description used in diagnostics, e.g. {@code "path or absent"}. */
    public String description() {
        return description;
    }

    /** Whether {@code null} is accepted. */
    public boolean absentAllowed() {
        return absentAllowed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValueShape other)) {
            return false;
        }
        return absentAllowed == other.absentAllowed
                && description.equals(other.description)
                && types.equals(other.types);
    }

    @Override
    public int hashCode() {
        return Objects.hash(description, types, absentAllowed);
    }

    @Override
    public String toString() {
        return description;
    }
}
