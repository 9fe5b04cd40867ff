package com.krabby.auth.config;

import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.config.YamlMapFactoryBean;
import org.springframework.core.io.Resource;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * A named, immutable configuration tree. {@link ConfigurationLoader} merges layers in order, so
 * a layer overrides every layer that precedes it.
 */
@Slf4j
@Value
public class ConfigurationLayer {

    static final String ENV_SEPARATOR = "__";

    @NonNull
    String name;

    @NonNull
    Map<String, Object> tree;

    @NonNull
    public static ConfigurationLayer of(@NonNull String name, @NonNull Map<String, Object> tree) {
        return new ConfigurationLayer(name, Collections.unmodifiableMap(new LinkedHashMap<>(tree)));
    }

    /**
     * Reads a YAML document into a layer.
     *
     * @param resource the YAML file.
     * @param required whether a missing file is an error. An optional missing file yields an empty
     *                 layer.
     * @throws ConfigurationException if a required file is missing or the file is not valid YAML.
     */
    @NonNull
    public static ConfigurationLayer fromYaml(@NonNull Resource resource, boolean required) {
        val name = resource.getDescription();
        if (!resource.exists()) {
            if (required) {
                throw new ConfigurationException("source", "is missing: " + name);
            }

            log.debug("skipping optional configuration source {}", name);
            return of(name, Map.of());
        }

        val factory = new YamlMapFactoryBean();
        factory.setResources(resource);
        try {
            val tree = factory.getObject();
            return of(name, tree == null ? Map.of() : tree);
        } catch (RuntimeException e) {
            throw new ConfigurationException("source", "is not valid YAML: " + name, e);
        }
    }

    /**
     * Builds a layer from environment variables. Only variables named {@code
     * <prefix>__SECTION__FIELD} are considered, e.g. {@code APP__SERVER__PORT=9000} becomes {@code
     * server.port = "9000"}. Segments are lower-cased. Values stay strings and are converted while
     * binding.
     */
    @NonNull
    public static ConfigurationLayer fromEnvironmentVariables(@NonNull String prefix, @NonNull Map<String, String> variables) {
        val marker = prefix + ENV_SEPARATOR;
        val tree = new LinkedHashMap<String, Object>();

        // sorted, so a table always replaces a scalar set at the same key.
        new TreeMap<>(variables).forEach((variable, value) -> {
            if (!variable.regionMatches(true, 0, marker, 0, marker.length())) {
                return;
            }

            val path = variable.substring(marker.length()).toLowerCase(Locale.ROOT).split(ENV_SEPARATOR, -1);
            if (Arrays.stream(path).anyMatch(String::isBlank)) {
                log.warn("ignoring environment variable {} with an empty path segment", variable);
                return;
            }

            put(tree, path, value, variable);
        });

        return of("environment variables", tree);
    }

    private static void put(Map<String, Object> tree, String[] path, String value, String variable) {
        Map<String, Object> current = tree;
        for (int i = 0; i < path.length - 1; i++) {
            val child = current.get(path[i]);
            if (!(child instanceof Map)) {
                val table = new LinkedHashMap<String, Object>();
                current.put(path[i], table);
                current = table;
            } else {
                current = ConfigurationTree.asTree(child);
            }
        }

        val key = path[path.length - 1];
        if (current.get(key) instanceof Map) {
            log.warn("ignoring environment variable {} because a table exists at the same path", variable);
            return;
        }

        current.put(key, value);
    }
}
