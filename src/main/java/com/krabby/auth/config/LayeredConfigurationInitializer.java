package com.krabby.auth.config;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.PropertyResolver;
import org.springframework.core.io.ResourceLoader;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <p>
 * Builds the {@link AppConfiguration} snapshot before the application context refreshes and
 * registers it as the {@code appConfiguration} singleton.</p>
 * <p>
 * Layers, in increasing order of precedence:
 * <ol>
 *     <li>{@code base.yml} (required)</li>
 *     <li>{@code <environment>.yml} (required)</li>
 *     <li>{@code local.yml} (optional, meant for developer machines)</li>
 *     <li>environment variables named {@code APP__SECTION__FIELD}</li>
 * </ol>
 * The files are resolved against {@code app.config.location} and the environment is selected with
 * {@code app.config.environment} or the {@code APP__ENV} environment variable.</p>
 * <p>
 * The Spring properties that depend on the snapshot (server address, data source, connection pool
 * and transaction timeout) are derived from it and take precedence over every other property
 * source.</p>
 */
@Slf4j
public class LayeredConfigurationInitializer implements ApplicationContextInitializer<ConfigurableApplicationContext> {

    public static final String LOCATION_PROPERTY = "app.config.location";
    public static final String ENVIRONMENT_PROPERTY = "app.config.environment";
    public static final String SNAPSHOT_BEAN = "appConfiguration";

    static final String DEFAULT_LOCATION = "file:./config/";
    static final String ENV_PREFIX = "APP";
    static final String ENVIRONMENT_VARIABLE = ENV_PREFIX + ConfigurationLayer.ENV_SEPARATOR + "ENV";
    static final String DERIVED_PROPERTY_SOURCE = "appConfigurationDerivedProperties";

    @Override
    public void initialize(@NonNull ConfigurableApplicationContext context) {
        val environment = context.getEnvironment();
        final AppConfiguration config;
        try {
            config = load(context, environment, System.getenv());
        } catch (ConfigurationException e) {
            log.error("refusing to start: {}", e.getMessage());
            throw e;
        }

        environment.getPropertySources().addFirst(new MapPropertySource(DERIVED_PROPERTY_SOURCE, derivedProperties(config)));
        context.getBeanFactory().registerSingleton(SNAPSHOT_BEAN, config);
        log.info("loaded configuration for '{}' environment", config.getApp().getEnvironment());
    }

    @NonNull
    static AppConfiguration load(
        @NonNull ResourceLoader resourceLoader,
        @NonNull PropertyResolver properties,
        @NonNull Map<String, String> variables
    ) {
        var location = properties.getProperty(LOCATION_PROPERTY, DEFAULT_LOCATION);
        if (!location.endsWith("/")) {
            location += "/";
        }

        val environmentName = properties.getProperty(ENVIRONMENT_PROPERTY, variables.getOrDefault(ENVIRONMENT_VARIABLE, ""));
        if (environmentName.isBlank()) {
            throw new ConfigurationException(
                "app.environment",
                String.format("must be selected with %s or %s", ENVIRONMENT_VARIABLE, ENVIRONMENT_PROPERTY));
        }

        // the selected name overrides any app.environment set by the other layers.
        return new ConfigurationLoader().load(List.of(
            ConfigurationLayer.fromYaml(resourceLoader.getResource(location + "base.yml"), true),
            ConfigurationLayer.fromYaml(resourceLoader.getResource(location + environmentName + ".yml"), true),
            ConfigurationLayer.fromYaml(resourceLoader.getResource(location + "local.yml"), false),
            ConfigurationLayer.fromEnvironmentVariables(ENV_PREFIX, variables),
            ConfigurationLayer.of("selected environment", Map.<String, Object>of("app", Map.of("environment", environmentName)))));
    }

    @NonNull
    static Map<String, Object> derivedProperties(@NonNull AppConfiguration config) {
        val server = config.getServer();
        val database = config.getDatabase();
        val properties = new LinkedHashMap<String, Object>();
        properties.put("spring.application.name", config.getApp().getName());
        properties.put("server.address", server.getHost());
        properties.put("server.port", server.getPort());
        properties.put("spring.datasource.url", database.getUrl());
        if (database.getUsername() != null) {
            properties.put("spring.datasource.username", database.getUsername());
        }

        if (database.getPassword() != null) {
            properties.put("spring.datasource.password", database.getPassword());
        }

        properties.put("spring.datasource.hikari.minimum-idle", database.getMinConnections());
        properties.put("spring.datasource.hikari.maximum-pool-size", database.getMaxConnections());
        if (database.getConnectTimeout() != null) {
            properties.put("spring.datasource.hikari.connection-timeout", database.getConnectTimeout().toMillis());
        }

        // transaction timeouts have a granularity of seconds and zero would expire every transaction.
        val transactionTimeout = Math.max(1, (server.getRequestTimeout().toMillis() + 999) / 1000);
        properties.put("spring.transaction.default-timeout", transactionTimeout + "s");
        return properties;
    }
}
