package io.pydust.core.model;

import io.pydust.core.error.InvalidConfigurationException;
import io.pydust.core.validation.TypeValidator;
import io.pydust.core.validation.ValueShape;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Model of the {@code [tool.pydust]} table of a {@code pyproject.toml}. Immutable, thread-safe.
 *
 * <p>Self-managed mode and declared extension modules are mutually exclusive: in self-managed mode
 * the user writes {@code build.zig} by hand, otherwise it is generated from {@link #modules()}.
 * Constructing a config with both fails with {@link InvalidConfigurationException}.
 *
 * @param zigExe      explicit Zig executable, empty to use the default resolution
 * @param buildZig    path of the build descriptor, {@code build.zig} by default
 * @param zigTests    whether Zig tests are collected as part of the test run
 * @param selfManaged whether the user maintains the build descriptor themselves
 * @param modules     declared extension modules in manifest order
 */
public record ProjectConfig(
        Optional<Path> zigExe, Path buildZig, boolean zigTests, boolean selfManaged, List<ModuleSpec> modules) {

    /** Conventional build descriptor file name. */
    public static final Path DEFAULT_BUILD_ZIG = Path.of("build.zig");

    /** Companion file written next to the build descriptor. */
    public static final String PYDUST_BUILD_ZIG = "pydust.build.zig";

    private static final ValueShape MODULE_SHAPE = ValueShape.of("module", ModuleSpec.class);

    private static final ProjectConfig DEFAULTS = builder().build();

    /** Canonical constructor: normalises absent values, validates shapes and the self-managed rule. */
    public ProjectConfig {
        zigExe = zigExe != null ? zigExe : Optional.empty();
        TypeValidator.validate("zig_exe", zigExe.orElse(null), ValueShape.PATH.orAbsent());
        TypeValidator.validate("build_zig", buildZig, ValueShape.PATH);
        if (modules == null) {
            modules = List.of();
        } else {
            TypeValidator.validate("ext_module", modules, ValueShape.ARRAY);
            for (int i = 0; i < modules.size(); i++) {
                TypeValidator.validate("ext_module[" + i + "]", modules.get(i), MODULE_SHAPE);
            }
            modules = List.copyOf(modules);
        }

        if (selfManaged && !modules.isEmpty()) {
            throw new InvalidConfigurationException(
                    "ext_modules cannot be defined when using Pydust in self-managed mode.");
        }
    }

    /** The configuration an absent {@code [tool.pydust]} table resolves to. */
    public static ProjectConfig defaults() {
        return DEFAULTS;
    }

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Sibling of {@link #buildZig()} named {@value #PYDUST_BUILD_ZIG}. */
    public Path pydustBuildZig() {
        return buildZig.resolveSibling(PYDUST_BUILD_ZIG);
    }

    /**
     * Builder for {@link ProjectConfig}. Defaults: no Zig override, {@code build.zig}, Zig tests
     * enabled, not self-managed, no modules.
     */
    public static final class Builder {
        private Path zigExe;
        private Path buildZig = DEFAULT_BUILD_ZIG;
        private boolean zigTests = true;
        private boolean selfManaged;
        private final List<ModuleSpec> modules = new ArrayList<>();

        Builder() {}

        public Builder zigExe(Path zigExe) {
            this.zigExe = zigExe;
            return this;
        }

        public Builder buildZig(Path buildZig) {
            this.buildZig = buildZig;
            return this;
        }

        public Builder zigTests(boolean zigTests) {
            this.zigTests = zigTests;
            return this;
        }

        public Builder selfManaged(boolean selfManaged) {
            this.selfManaged = selfManaged;
            return this;
        }

        public Builder addModule(ModuleSpec module) {
            this.modules.add(module);
            return this;
        }

        public Builder modules(List<ModuleSpec> modules) {
            this.modules.clear();
            this.modules.addAll(modules);
            return this;
        }

        /** Builds the {@link ProjectConfig}, applying all validation. */
        public ProjectConfig build() {
            return new ProjectConfig(Optional.ofNullable(zigExe), buildZig, zigTests, selfManaged, modules);
        }
    }
}
