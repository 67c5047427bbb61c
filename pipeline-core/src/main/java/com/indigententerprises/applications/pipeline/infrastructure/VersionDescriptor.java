package com.indigententerprises.applications.pipeline.infrastructure;

import com.indigententerprises.applications.pipeline.serviceinterfaces.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * the service version, read from a classpath resource holding a single SemVer line.
 */
public final class VersionDescriptor {

    private static final Pattern SEMVER = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");

    private VersionDescriptor() {}

    public static String read(final ClassLoader classLoader, final String resource) throws ConfigurationException {
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("version descriptor not found: " + resource);
            }

            final String version = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();

            if (!SEMVER.matcher(version).matches()) {
                throw new ConfigurationException("invalid SemVer in " + resource + ": " + version);
            } else {
                return version;
            }
        } catch (IOException e) {
            throw new ConfigurationException("version descriptor not readable: " + resource, e);
        }
    }
}
