package com.krabby.auth.config;

import com.krabby.auth.config.validation.annotations.ConnectionPoolBounds;
import com.krabby.auth.config.validation.annotations.TokenExpiryOrder;
import com.krabby.auth.platform.validation.annotations.PositiveDuration;
import com.krabby.auth.platform.validation.annotations.WholeSeconds;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.time.Duration;
import java.util.Locale;

/**
 * <p>
 * Immutable snapshot of the service configuration. It is assembled once at startup by {@link
 * ConfigurationLoader} from the layered configuration sources and registered as a singleton bean,
 * so every component reads the same values for the lifetime of the process.</p>
 * <p>
 * Durations accept Spring Boot's simple format, e.g. {@code 15m} or {@code 7d}. Bare numbers are
 * milliseconds.</p>
 */
@Value
@AllArgsConstructor(onConstructor_ = @ConstructorBinding)
public class AppConfiguration {

    static final String PRODUCTION_ENVIRONMENT = "production";

    @NotNull
    @Valid
    App app;

    @NotNull
    @Valid
    Server server;

    @NotNull
    @Valid
    Database database;

    @NotNull
    @Valid
    Auth auth;

    @Value
    @AllArgsConstructor(onConstructor_ = @ConstructorBinding)
    public static class App {

        @NotBlank
        String name;

        /**
         * Selected deployment environment, e.g. {@code development} or {@code production}.
         */
        @NotBlank
        String environment;

        public boolean isProduction() {
            return environment != null && PRODUCTION_ENVIRONMENT.equals(environment.trim().toLowerCase(Locale.ROOT));
        }
    }

    @Value
    @AllArgsConstructor(onConstructor_ = @ConstructorBinding)
    public static class Server {

        @NotBlank
        @Pattern(regexp = "[A-Za-z0-9.:\\[\\]-]*", message = "must be a host name or an IP address")
        String host;

        @NotNull
        @Min(1)
        @Max(65535)
        Integer port;

        /**
         * Upper bound for the work done on behalf of a single request.
         */
        @NotNull
        @PositiveDuration
        Duration requestTimeout;
    }

    @Value
    @AllArgsConstructor(onConstructor_ = @ConstructorBinding)
    @ConnectionPoolBounds
    public static class Database {

        @NotBlank
        String url;

        @Pattern(regexp = "\\S+", message = "must not be blank or contain whitespace")
        String username;

        @ToString.Exclude
        @Pattern(regexp = ".*\\S.*", message = "must not be blank")
        String password;

        @NotNull
        @Positive
        Integer minConnections;

        @NotNull
        @Positive
        Integer maxConnections;

        @PositiveDuration
        Duration connectTimeout;
    }

    @Value
    @AllArgsConstructor(onConstructor_ = @ConstructorBinding)
    @TokenExpiryOrder
    public static class Auth {

        /**
         * HMAC secret that signs and verifies every token.
         */
        @NotBlank
        @ToString.Exclude
        String signingSecret;

        /**
         * Tokens carry expiry times in whole seconds.
         */
        @NotNull
        @PositiveDuration
        @WholeSeconds
        Duration accessTokenExpiry;

        @NotNull
        @PositiveDuration
        @WholeSeconds
        Duration refreshTokenExpiry;

        @Pattern(regexp = "\\S+", message = "must not be blank or contain whitespace")
        String cookieDomain;

        /**
         * {@code SameSite} attribute of the credential cookies. {@code Lax} when not set.
         */
        SameSite cookieSameSite;
    }

    public enum SameSite {
        STRICT("Strict"),
        LAX("Lax"),
        NONE("None");

        private final String attributeValue;

        SameSite(@NonNull String attributeValue) {
            this.attributeValue = attributeValue;
        }

        @NonNull
        public String getAttributeValue() {
            return attributeValue;
        }
    }
}
