package com.krabby.auth.config;

import lombok.NonNull;
import lombok.val;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Helpers for nested configuration trees, i.e. {@code Map<String, Object>} instances whose values
 * are scalars, lists or other trees.
 */
final class ConfigurationTree {

    private ConfigurationTree() {
    }

    /**
     * Deep merges {@code overlay} onto {@code base} and returns the result as a new tree. Nested
     * trees are merged key by key, so an overlay can override a single nested field without
     * repeating the rest of its section. Any other value in the overlay (scalars, lists and
     * {@literal null}s) replaces the corresponding value in the base. Neither argument is modified.
     *
     * @param base    tree with lower precedence.
     * @param overlay tree with higher precedence.
     * @return a new, merged tree.
     */
    @NonNull
    static Map<String, Object> merge(@NonNull Map<String, Object> base, @NonNull Map<String, Object> overlay) {
        val merged = new LinkedHashMap<String, Object>(base);
        overlay.forEach((key, value) -> {
            val existing = merged.get(key);
            if (existing instanceof Map && value instanceof Map) {
                merged.put(key, merge(asTree(existing), asTree(value)));
            } else {
                merged.put(key, value);
            }
        });

        return merged;
    }

    /**
     * Flattens a tree into dotted property names below the given {@code root}, e.g. {@code
     * {server: {request_timeout: 30s}}} becomes {@code root.server.request-timeout=30s}. Keys are
     * lower-cased and underscores become dashes so that the names are in Spring Boot's canonical
     * form. List elements are addressed with {@code [index]}. {@literal null} values are dropped.
     */
    @NonNull
    static Map<String, Object> flatten(@NonNull String root, @NonNull Map<String, Object> tree) {
        val flat = new LinkedHashMap<String, Object>();
        flattenInto(flat, root, tree);
        return flat;
    }

    private static void flattenInto(Map<String, Object> flat, String path, Object value) {
        if (value instanceof Map) {
            asTree(value).forEach((key, child) -> flattenInto(flat, join(path, canonicalKey(key)), child));
        } else if (value instanceof List) {
            val list = (List<?>) value;
            for (int i = 0; i < list.size(); i++) {
                flattenInto(flat, path + "[" + i + "]", list.get(i));
            }
        } else if (value != null) {
            flat.put(path, value);
        }
    }

    @NonNull
    static String canonicalKey(@NonNull String key) {
        return key.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Converts a property path in either canonical ({@code server.request-timeout}) or Java bean
     * ({@code server.requestTimeout}) form to the snake_case form used by configuration files,
     * i.e. {@code server.request_timeout}.
     */
    @NonNull
    static String toFieldName(@NonNull String path) {
        return path.replaceAll("([a-z0-9])([A-Z])", "$1_$2")
            .replace('-', '_')
            .toLowerCase(Locale.ROOT);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asTree(Object value) {
        return (Map<String, Object>) value;
    }

    private static String join(String path, String key) {
        return path.isEmpty() ? key : path + "." + key;
    }
}
