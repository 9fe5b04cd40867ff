package com.krabby.auth.config;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Merges {@link ConfigurationLayer}s, binds the result to an {@link AppConfiguration} and
 * validates it. Any problem surfaces as a {@link ConfigurationException}; a partially valid
 * configuration is never returned.
 */
@Slf4j
public class ConfigurationLoader {

    static final String ROOT = "krabby";

    private final Validator validator;

    public ConfigurationLoader() {
        this(Validation.buildDefaultValidatorFactory().getValidator());
    }

    ConfigurationLoader(@NonNull Validator validator) {
        this.validator = validator;
    }

    /**
     * @param layers configuration layers in increasing order of precedence.
     * @return a validated configuration snapshot.
     * @throws ConfigurationException if the merged configuration cannot be bound or is invalid.
     */
    @NonNull
    public AppConfiguration load(@NonNull List<ConfigurationLayer> layers) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (val layer : layers) {
            merged = ConfigurationTree.merge(merged, layer.getTree());
            log.debug("merged configuration layer: {}", layer.getName());
        }

        val config = bind(merged);
        validate(config);
        return config;
    }

    @NonNull
    AppConfiguration bind(@NonNull Map<String, Object> tree) {
        val source = new MapConfigurationPropertySource(ConfigurationTree.flatten(ROOT, tree));
        try {
            return new Binder(source).bindOrCreate(ROOT, AppConfiguration.class);
        } catch (BindException e) {
            // conversion messages may echo the offending value, so the cause is kept out of the message.
            throw new ConfigurationException(fieldName(e.getName().toString()), "has a value of the wrong type", e);
        }
    }

    void validate(@NonNull AppConfiguration config) {
        val violations = validator.validate(config)
            .stream()
            .map(v -> new ConfigurationException.Violation(fieldName(v.getPropertyPath().toString()), v.getMessage()))
            .collect(Collectors.toList());

        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }
    }

    @NonNull
    static String fieldName(@NonNull String path) {
        val relative = path.startsWith(ROOT + ".") ? path.substring(ROOT.length() + 1) : path;
        return ConfigurationTree.toFieldName(relative);
    }
}
