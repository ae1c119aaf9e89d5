package io.pydust.core.model;

import io.pydust.core.error.InvalidConfigurationException;
import io.pydust.core.error.UnsupportedFeatureException;
import io.pydust.core.validation.TypeValidator;
import io.pydust.core.validation.ValueShape;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * One Zig extension module declared under {@code [[tool.pydust.ext_module]]}. Immutable,
 * thread-safe. Created at load time by {@code ProjectConfigMapper} and owned by the
 * {@link ProjectConfig} that lists it.
 *
 * <p>All paths returned by the derived accessors are relative: {@link #installPath()} to the
 * package install root and {@link #testBinPath()} to the project directory.
 *
 * @param name       fully-qualified dotted import path of the module, e.g. {@code pkg.fastmod}
 * @param root       directory holding the module's Zig sources
 * @param limitedApi whether the module targets the stable (limited) Python ABI
 */
public record ModuleSpec(String name, Path root, boolean limitedApi) {

    /** Shared-library suffix for stable-ABI extension modules. */
    public static final String ABI3_SUFFIX = ".abi3.so";

    /** Output directory of the Zig test binaries. */
    public static final Path TEST_BIN_DIR = Path.of("zig-out", "bin");

    /** Suffix of a module's Zig test binary. */
    public static final String TEST_BIN_SUFFIX = ".test.bin";

    private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

    /** Canonical constructor: validates field shapes and the dotted name. */
    public ModuleSpec {
        TypeValidator.validate("name", name, ValueShape.TEXT);
        TypeValidator.validate("root", root, ValueShape.PATH);
        requireDottedName(name);
    }

    /** Creates a limited-API module, the default. */
    public ModuleSpec(String name, Path root) {
        this(name, root, true);
    }

    /** Short library name: the last dotted segment of {@link #name()}. */
    public String libname() {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }

    /**
     * Install location of the compiled module: the dotted name as nested directories with
     * {@value #ABI3_SUFFIX} appended. Independent of {@link #root()}.
     *
     * @throws UnsupportedFeatureException if {@link #limitedApi()} is {@code false}
     */
    public Path installPath() {
        if (!limitedApi) {
            throw new UnsupportedFeatureException(
                    "Only limited API modules are supported right now (ext_module '" + name + "')");
        }
        String[] segments = name.split("\\.");
        segments[segments.length - 1] = segments[segments.length - 1] + ABI3_SUFFIX;
        return Path.of(segments[0], Arrays.copyOfRange(segments, 1, segments.length));
    }

    /** Location of the module's Zig test binary, e.g. {@code zig-out/bin/fastmod.test.bin}. */
    public Path testBinPath() {
        return TEST_BIN_DIR.resolve(libname() + TEST_BIN_SUFFIX);
    }

    private static void requireDottedName(String name) {
        // limit -1 keeps trailing empty segments so "pkg." is rejected
        boolean valid = Arrays.stream(name.split("\\.", -1))
                .allMatch(segment -> IDENTIFIER.matcher(segment).matches());
        if (!valid) {
            throw new InvalidConfigurationException("Invalid ext_module name '" + name
                    + "': expected dotted identifiers such as 'pkg.module'");
        }
    }
}
