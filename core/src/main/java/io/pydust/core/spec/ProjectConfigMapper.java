package io.pydust.core.spec;

import com.fasterxml.jackson.databind.JsonNode;
import io.pydust.core.error.ConfigTypeException;
import io.pydust.core.error.InvalidConfigurationException;
import io.pydust.core.model.ModuleSpec;
import io.pydust.core.model.ProjectConfig;
import io.pydust.core.validation.TypeValidator;
import io.pydust.core.validation.ValueShape;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps the {@code [tool.pydust]} table of a parsed manifest onto a {@link ProjectConfig}.
 *
 * <p>Extraction is explicit and field by field: every value is checked with
 * {@link TypeValidator} before it reaches the model, so a mistyped manifest entry is reported
 * with its key and value rather than surfacing later as an opaque failure. TOML has no path type,
 * so path fields accept text and convert it; any other value is rejected as not a path.
 */
public final class ProjectConfigMapper {

    /** Recognized keys of {@code [tool.pydust]}. */
    static final Set<String> KNOWN_TOOL_KEYS =
            Set.of("zig_exe", "build_zig", "zig_tests", "self_managed", "ext_module");

    /** Recognized keys of each {@code [[tool.pydust.ext_module]]} entry. */
    static final Set<String> KNOWN_MODULE_KEYS = Set.of("name", "root", "limited_api");

    private ProjectConfigMapper() {
        // utility class
    }

    /**
     * Builds the configuration from the manifest root.
     *
     * @param manifest parsed manifest root table
     * @param source   manifest path, for diagnostics
     * @return the validated configuration; all defaults if {@code [tool.pydust]} is absent
     * @throws ConfigTypeException            if a value has the wrong shape
     * @throws InvalidConfigurationException if a key is unknown or the self-managed rule is broken
     */
    public static ProjectConfig map(JsonNode manifest, String source) {
        Objects.requireNonNull(manifest, "manifest must not be null");
        JsonNode tool = manifest.path("tool");
        if (tool.isMissingNode()) {
            return ProjectConfig.defaults();
        }
        TypeValidator.validate("tool", ManifestParser.toValue(tool), ValueShape.TABLE);

        JsonNode pydust = tool.path("pydust");
        if (pydust.isMissingNode()) {
            return ProjectConfig.defaults();
        }
        TypeValidator.validate("tool.pydust", ManifestParser.toValue(pydust), ValueShape.TABLE);
        rejectUnknownKeys(pydust, KNOWN_TOOL_KEYS, "[tool.pydust]", source);

        Path zigExe = optionalPath(pydust, "zig_exe");
        Path buildZig = pydust.has("build_zig") ? requirePath(pydust, "build_zig") : ProjectConfig.DEFAULT_BUILD_ZIG;
        boolean zigTests = bool(pydust, "zig_tests", true);
        boolean selfManaged = bool(pydust, "self_managed", false);
        List<ModuleSpec> modules = pydust.has("ext_module") ? modules(pydust.get("ext_module"), source) : null;

        return new ProjectConfig(Optional.ofNullable(zigExe), buildZig, zigTests, selfManaged, modules);
    }

    private static List<ModuleSpec> modules(JsonNode node, String source) {
        TypeValidator.validate("ext_module", ManifestParser.toValue(node), ValueShape.ARRAY);
        List<ModuleSpec> modules = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            JsonNode entry = node.get(i);
            TypeValidator.validate("ext_module[" + i + "]", ManifestParser.toValue(entry), ValueShape.TABLE);
            rejectUnknownKeys(entry, KNOWN_MODULE_KEYS, "[[tool.pydust.ext_module]]", source);
            modules.add(module(entry));
        }
        return modules;
    }

    private static ModuleSpec module(JsonNode entry) {
        String name =
                (String) TypeValidator.validate("name", ManifestParser.toValue(entry.get("name")), ValueShape.TEXT);
        Path root = requirePath(entry, "root");
        boolean limitedApi = bool(entry, "limited_api", true);
        return new ModuleSpec(name, root, limitedApi);
    }

    private static boolean bool(JsonNode table, String field, boolean defaultValue) {
        if (!table.has(field)) {
            return defaultValue;
        }
        return (Boolean) TypeValidator.validate(field, ManifestParser.toValue(table.get(field)), ValueShape.BOOLEAN);
    }

    private static Path optionalPath(JsonNode table, String field) {
        return table.has(field) ? toPath(field, table.get(field), ValueShape.PATH.orAbsent()) : null;
    }

    private static Path requirePath(JsonNode table, String field) {
        return toPath(field, table.get(field), ValueShape.PATH);
    }

    private static Path toPath(String field, JsonNode node, ValueShape shape) {
        if (node != null && node.isTextual()) {
            try {
                return Path.of(node.textValue());
            } catch (InvalidPathException e) {
                throw new ConfigTypeException(
                        "Input of " + field + "='" + node.textValue() + "' is not a valid \"" + shape.description()
                                + "\": " + e.getReason(),
                        field,
                        node.textValue(),
                        shape.description());
            }
        }
        // not text: let the validator reject it with the uniform message
        return (Path) TypeValidator.validate(field, ManifestParser.toValue(node), shape);
    }

    private static void rejectUnknownKeys(JsonNode table, Set<String> known, String section, String source) {
        Iterator<String> names = table.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!known.contains(name)) {
                throw new InvalidConfigurationException(
                        "Unknown key '" + name + "' in " + section + ". Recognized keys: " + new TreeSet<>(known),
                        source);
            }
        }
    }
}
