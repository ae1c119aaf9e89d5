package io.pydust.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.pydust.core.error.ConfigTypeException;
import io.pydust.core.error.InvalidConfigurationException;
import io.pydust.core.error.ManifestLoadException;
import io.pydust.core.model.ProjectConfig;
import io.pydust.core.spec.ManifestParser;
import io.pydust.core.spec.ProjectConfigMapper;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the ziggy-pydust configuration from {@value #MANIFEST_FILE} in the working directory.
 *
 * <p>{@link #load()} reads the manifest once per process and caches the result: later calls
 * return the same instance without touching the file, even if it has changed. A failed load is not
 * cached, so the next call retries. First access is serialised on a private lock, so concurrent
 * callers read the manifest at most once.
 *
 * <p>Load sequence ({@link #read(Path, String)}):
 * <ol>
 * <li>parse the manifest as TOML</li>
 * <li>check the {@code build-system.requires} pin against the running version</li>
 * <li>map {@code [tool.pydust]} onto a validated {@link ProjectConfig}</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Manifest file name, resolved against the working directory. */
    public static final String MANIFEST_FILE = "pyproject.toml";

    private static final Object LOCK = new Object();

    private static volatile ProjectConfig cached;

    private ConfigLoader() {
        // utility class
    }

    /**
     * Returns the process-wide configuration, loading it on first use.
     *
     * @return the cached configuration
     * @throws ManifestLoadException          if the manifest is missing or malformed
     * @throws InvalidConfigurationException  if the version pin or a cross-field rule is violated
     * @throws ConfigTypeException            if a manifest value has the wrong shape
     */
    public static ProjectConfig load() {
        return load(Path.of(MANIFEST_FILE), ToolVersion::current);
    }

    /**
     * Cached load from an explicit manifest. The cache holds one configuration regardless of the
     * arguments: once loaded, both are ignored.
     */
    static ProjectConfig load(Path manifest, Supplier<String> toolVersion) {
        ProjectConfig config = cached;
        if (config != null) {
            LOG.debug("Using cached pydust configuration");
            return config;
        }
        synchronized (LOCK) {
            if (cached == null) {
                cached = read(manifest, toolVersion.get());
            }
            return cached;
        }
    }

    /**
     * Runs the full load sequence without consulting or updating the cache.
     *
     * @param manifest    path to {@code pyproject.toml}
     * @param toolVersion version of the running tool, for the pin check
     * @return a freshly validated configuration
     */
    public static ProjectConfig read(Path manifest, String toolVersion) {
        Objects.requireNonNull(manifest, "manifest must not be null");
        Objects.requireNonNull(toolVersion, "toolVersion must not be null");
        String source = manifest.toString();

        JsonNode root = ManifestParser.parse(manifest);
        VersionGuard.check(root, toolVersion, source);
        ProjectConfig config = ProjectConfigMapper.map(root, source);

        LOG.info(
                "Loaded pydust configuration from {}: modules={}, self_managed={}, zig_tests={}",
                source,
                config.modules().size(),
                config.selfManaged(),
                config.zigTests());
        return config;
    }

    /** Whether the process-wide configuration has been loaded. */
    static boolean isLoaded() {
        return cached != null;
    }

    /** Clears the process-wide cache. Test isolation only. */
    static void reset() {
        synchronized (LOCK) {
            cached = null;
        }
    }
}
