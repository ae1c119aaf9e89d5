package io.pydust.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Version of the running ziggy-pydust build, read from
 * {@value #PROPS_PATH} (written at build time from the project version).
 */
public final class ToolVersion {

    private static final Logger LOG = LoggerFactory.getLogger(ToolVersion.class);

    static final String PROPS_PATH = "META-INF/ziggy-pydust/version.properties";

    private ToolVersion() {}

    /**
     * Returns the running tool version. Falls back to the development version, which disables the
     * build-system pin check, when the resource is missing or unfiltered.
     */
    public static String current() {
        return fromResource(PROPS_PATH);
    }

    static String fromResource(String resource) {
        Properties props = new Properties();
        try (InputStream is = ToolVersion.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                props.load(is);
            }
        } catch (IOException e) {
            LOG.warn("Failed to read tool version from {}", resource, e);
        }

        String version = props.getProperty("version");
        if (version == null || version.isBlank() || version.startsWith("${")) {
            LOG.warn(
                    "Cannot determine ziggy-pydust version from {}; assuming development version {}",
                    resource,
                    VersionGuard.DEVELOPMENT_VERSION);
            return VersionGuard.DEVELOPMENT_VERSION;
        }
        return version.trim();
    }
}
