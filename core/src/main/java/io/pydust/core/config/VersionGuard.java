package io.pydust.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.pydust.core.error.ConfigTypeException;
import io.pydust.core.error.InvalidConfigurationException;
import io.pydust.core.spec.ManifestParser;
import io.pydust.core.validation.TypeValidator;
import io.pydust.core.validation.ValueShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guards against a manifest whose {@code build-system.requires} pins a different ziggy-pydust
 * version than the one running. Build-system requirements are not locked by the project's
 * dependency manager, so the pin can silently drift from the installed tool.
 *
 * <p>Every requirement starting with {@value #TOOL_NAME} must equal exactly
 * {@code ziggy-pydust==<running version>}. The check is skipped for the local development version
 * {@value #DEVELOPMENT_VERSION}.
 */
final class VersionGuard {

    private static final Logger LOG = LoggerFactory.getLogger(VersionGuard.class);

    /** Distribution name of the tool as it appears in requirement strings. */
    static final String TOOL_NAME = "ziggy-pydust";

    /** Version reported by a local development install. */
    static final String DEVELOPMENT_VERSION = "0.1.0";

    private VersionGuard() {}

    /**
     * Checks the manifest's build-system pin against the running version.
     *
     * @param manifest       parsed manifest root
     * @param runningVersion version of the running tool
     * @param source         manifest path, for diagnostics
     * @throws InvalidConfigurationException if a ziggy-pydust requirement is not the exact pin
     * @throws ConfigTypeException           if {@code build-system.requires} is not an array of text
     */
    static void check(JsonNode manifest, String runningVersion, String source) {
        if (DEVELOPMENT_VERSION.equals(runningVersion)) {
            LOG.debug("Running development version {}: build-system pin check skipped", runningVersion);
            return;
        }

        JsonNode requires = manifest.path("build-system").path("requires");
        if (requires.isMissingNode()) {
            LOG.debug("No build-system.requires in {}: nothing to check", source);
            return;
        }
        TypeValidator.validate("build-system.requires", ManifestParser.toValue(requires), ValueShape.ARRAY);

        String expected = TOOL_NAME + "==" + runningVersion;
        for (int i = 0; i < requires.size(); i++) {
            String requirement = (String) TypeValidator.validate(
                    "build-system.requires[" + i + "]", ManifestParser.toValue(requires.get(i)), ValueShape.TEXT);
            if (!requirement.startsWith(TOOL_NAME)) {
                continue;
            }
            if (!requirement.equals(expected)) {
                throw new InvalidConfigurationException(
                        "Detected misconfigured ziggy-pydust. You must include \"" + expected
                                + "\" in build-system.requires in pyproject.toml (found \"" + requirement + "\")",
                        source);
            }
        }
        LOG.info("Build-system pin check passed for {}", expected);
    }
}
