// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.config;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.dataformat.javaprop.JavaPropsMapper;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Binds {@link RewardsConfig} from {@code rewards.*} properties. The bundled defaults are loaded
 * first, then the overrides are applied on top of them.
 */
public final class RewardsConfigLoader {

    /** Classpath resource holding the default value of every property. */
    public static final String DEFAULTS_RESOURCE = "rewards-defaults.properties";

    /** The prefix of every property bound into {@link RewardsConfig}. */
    public static final String PREFIX = "rewards";

    private static final JavaPropsMapper MAPPER = new JavaPropsMapper();

    private RewardsConfigLoader() {
        // Utility class
    }

    /**
     * Returns the configuration with every property at its default.
     *
     * @return the default configuration
     */
    @NonNull
    public static RewardsConfig defaults() {
        return load(new Properties());
    }

    /**
     * Loads the defaults and applies the given overrides. Keys outside the {@code rewards.}
     * prefix are ignored.
     *
     * @param overrides property overrides
     * @return the configuration
     * @throws IllegalArgumentException if a property is unknown or a value is out of range
     */
    @NonNull
    public static RewardsConfig load(@NonNull final Properties overrides) {
        requireNonNull(overrides);
        final var merged = new Properties();
        try (InputStream in = RewardsConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            merged.load(in);
        } catch (final IOException e) {
            throw new UncheckedIOException("Unable to read " + DEFAULTS_RESOURCE, e);
        }
        for (final String name : overrides.stringPropertyNames()) {
            if (name.startsWith(PREFIX + ".")) {
                merged.setProperty(name, overrides.getProperty(name));
            }
        }
        return bind(merged);
    }

    /**
     * Loads the defaults and applies the overrides read from the given stream.
     *
     * @param in a stream in {@link Properties} format
     * @return the configuration
     * @throws IllegalArgumentException if a property is unknown or a value is out of range
     */
    @NonNull
    public static RewardsConfig load(@NonNull final InputStream in) {
        requireNonNull(in);
        final var overrides = new Properties();
        try {
            overrides.load(in);
        } catch (final IOException e) {
            throw new UncheckedIOException("Unable to read rewards properties", e);
        }
        return load(overrides);
    }

    private static RewardsConfig bind(@NonNull final Properties properties) {
        try {
            final JsonNode root = MAPPER.readPropertiesAs(properties, JsonNode.class);
            return MAPPER.treeToValue(root.path(PREFIX), RewardsConfig.class);
        } catch (final ValueInstantiationException e) {
            // The record constructor rejected a value; surface its own message
            final var cause = e.getCause();
            if (cause instanceof IllegalArgumentException iae) {
                throw iae;
            }
            throw new IllegalArgumentException("Invalid rewards configuration", e);
        } catch (final IOException e) {
            throw new IllegalArgumentException("Invalid rewards configuration: " + e.getMessage(), e);
        }
    }
}
