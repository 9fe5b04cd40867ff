package com.krabby.auth.config;

import lombok.NonNull;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;

class ConfigurationLoaderTest {

    private ConfigurationLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ConfigurationLoader();
    }

    @Test
    void load_withValidLayers() {
        val config = loader.load(List.of(ConfigurationLayer.of("base", validTree())));

        assertEquals("krabby-auth-api", config.getApp().getName());
        assertEquals("development", config.getApp().getEnvironment());
        assertFalse(config.getApp().isProduction());
        assertEquals("0.0.0.0", config.getServer().getHost());
        assertEquals(8080, config.getServer().getPort());
        assertEquals(Duration.ofSeconds(30), config.getServer().getRequestTimeout());
        assertEquals(2, config.getDatabase().getMinConnections());
        assertEquals(10, config.getDatabase().getMaxConnections());
        assertNull(config.getDatabase().getUsername());
        assertEquals(Duration.ofMinutes(15), config.getAuth().getAccessTokenExpiry());
        assertEquals(Duration.ofDays(7), config.getAuth().getRefreshTokenExpiry());
        assertEquals(AppConfiguration.SameSite.STRICT, config.getAuth().getCookieSameSite());
    }

    @Test
    void load_laterLayersTakePrecedence() {
        val config = loader.load(List.of(
            ConfigurationLayer.of("base", validTree()),
            ConfigurationLayer.of("environment", Map.of(
                "server", Map.of("port", 3000),
                "app", Map.of("environment", "production"))),
            ConfigurationLayer.of("local", Map.of("server", Map.of("port", 4000))),
            ConfigurationLayer.fromEnvironmentVariables("APP", Map.of("APP__SERVER__PORT", "9000"))));

        assertEquals(9000, config.getServer().getPort());
        assertEquals("0.0.0.0", config.getServer().getHost());
        assertTrue(config.getApp().isProduction());
    }

    @ParameterizedTest
    @MethodSource("invalidConfigurationTestCases")
    void load_withInvalidConfiguration(String section, String field, Object value, String expectedField) {
        val tree = validTree();
        override(tree, section, field, value);

        val e = assertThrows(ConfigurationException.class, () -> loader.load(List.of(ConfigurationLayer.of("base", tree))));
        assertEquals(List.of(expectedField), e.getFields());
    }

    static Stream<Arguments> invalidConfigurationTestCases() {
        return Stream.of(
            // section, field, value, expected field
            arguments("app", "name", " ", "app.name"),
            arguments("server", "host", "", "server.host"),
            arguments("server", "host", " ", "server.host"),
            arguments("server", "host", "not a host", "server.host"),
            arguments("server", "port", 0, "server.port"),
            arguments("server", "port", 65536, "server.port"),
            arguments("server", "port", "not-a-port", "server.port"),
            arguments("server", "request_timeout", "0s", "server.request_timeout"),
            arguments("server", "request_timeout", "-5s", "server.request_timeout"),
            arguments("database", "url", "", "database.url"),
            arguments("database", "username", " ", "database.username"),
            arguments("database", "min_connections", 0, "database.min_connections"),
            arguments("database", "min_connections", 11, "database.min_connections"),
            arguments("database", "max_connections", -1, "database.max_connections"),
            arguments("database", "connect_timeout", "0ms", "database.connect_timeout"),
            arguments("auth", "signing_secret", "", "auth.signing_secret"),
            arguments("auth", "access_token_expiry", "7d", "auth.access_token_expiry"),
            arguments("auth", "refresh_token_expiry", "1m", "auth.access_token_expiry"),
            arguments("auth", "access_token_expiry", "500ms", "auth.access_token_expiry"),
            arguments("auth", "access_token_expiry", "1500ms", "auth.access_token_expiry"),
            arguments("auth", "refresh_token_expiry", "999ms", "auth.refresh_token_expiry"),
            arguments("auth", "cookie_domain", "", "auth.cookie_domain"));
    }

    @Test
    void load_withMissingSection() {
        val tree = validTree();
        tree.remove("database");

        val e = assertThrows(ConfigurationException.class, () -> loader.load(List.of(ConfigurationLayer.of("base", tree))));
        assertEquals(List.of("database"), e.getFields());
    }

    @Test
    void load_withSubSecondTokenExpiries() {
        val tree = validTree();
        override(tree, "auth", "access_token_expiry", "500ms");
        override(tree, "auth", "refresh_token_expiry", "999ms");

        val e = assertThrows(ConfigurationException.class, () -> loader.load(List.of(ConfigurationLayer.of("base", tree))));
        assertEquals(List.of("auth.access_token_expiry", "auth.refresh_token_expiry"), e.getFields());
    }

    @Test
    void load_withMissingSigningSecret() {
        val tree = validTree();
        ConfigurationTree.asTree(tree.get("auth")).remove("signing_secret");

        val e = assertThrows(ConfigurationException.class, () -> loader.load(List.of(ConfigurationLayer.of("base", tree))));
        assertEquals(List.of("auth.signing_secret"), e.getFields());
    }

    @Test
    void load_reportsEveryViolation() {
        val tree = validTree();
        override(tree, "app", "name", "");
        override(tree, "auth", "signing_secret", "");
        override(tree, "server", "port", 0);

        val e = assertThrows(ConfigurationException.class, () -> loader.load(List.of(ConfigurationLayer.of("base", tree))));
        assertEquals(List.of("app.name", "auth.signing_secret", "server.port"), e.getFields());
        assertFalse(e.getMessage().contains("base-secret"));
    }

    @Test
    void load_withNoLayers() {
        val e = assertThrows(ConfigurationException.class, () -> loader.load(List.of()));
        assertEquals(List.of("app", "auth", "database", "server"), e.getFields());
    }

    @NonNull
    static Map<String, Object> validTree() {
        val tree = new LinkedHashMap<String, Object>();
        tree.put("app", new LinkedHashMap<>(Map.of("name", "krabby-auth-api", "environment", "development")));
        tree.put("server", new LinkedHashMap<>(Map.of("host", "0.0.0.0", "port", 8080, "request_timeout", "30s")));
        tree.put("database", new LinkedHashMap<>(Map.of(
            "url", "jdbc:postgresql://localhost:5432/krabby",
            "min_connections", 2,
            "max_connections", 10,
            "connect_timeout", "5s")));
        tree.put("auth", new LinkedHashMap<>(Map.of(
            "signing_secret", "base-secret",
            "access_token_expiry", "15m",
            "refresh_token_expiry", "7d",
            "cookie_same_site", "strict")));
        return tree;
    }

    private static void override(Map<String, Object> tree, String section, String field, Object value) {
        ConfigurationTree.asTree(tree.get(section)).put(field, value);
    }
}
