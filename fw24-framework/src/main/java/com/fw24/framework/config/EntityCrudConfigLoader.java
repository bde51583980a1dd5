package com.fw24.framework.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.Map;

/**
 * Builds {@link EntityCrudConfig} outside a container: classpath
 * {@code application.properties}, then system properties and environment, then the
 * given overrides.
 */
public final class EntityCrudConfigLoader {

    private static final Logger LOG = Logger.getLogger(EntityCrudConfigLoader.class);
    private static final String APPLICATION_PROPERTIES = "application.properties";

    private EntityCrudConfigLoader() {
    }

    public static EntityCrudConfig load() {
        return load(Map.of());
    }

    public static EntityCrudConfig load(Map<String, String> overrides) {
        SmallRyeConfigBuilder builder = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withMapping(EntityCrudConfig.class)
                .withSources(new PropertiesConfigSource(overrides, "overrides", 500));
        URL properties = Thread.currentThread().getContextClassLoader().getResource(APPLICATION_PROPERTIES);
        if (properties != null) {
            try {
                builder.withSources(new PropertiesConfigSource(properties, 250));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + properties, e);
            }
        } else {
            LOG.debugf("No %s on the classpath; using mapping defaults", APPLICATION_PROPERTIES);
        }
        SmallRyeConfig config = builder.build();
        return config.getConfigMapping(EntityCrudConfig.class);
    }
}
