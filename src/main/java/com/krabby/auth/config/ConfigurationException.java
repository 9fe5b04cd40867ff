package com.krabby.auth.config;

import lombok.Getter;
import lombok.NonNull;
import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when the layered configuration cannot be loaded, bound or validated. It carries every
 * violation found so that a single startup attempt reports all the problems at once.
 */
@Getter
public class ConfigurationException extends RuntimeException {

    private final List<Violation> violations;

    public ConfigurationException(@NonNull String field, @NonNull String message) {
        this(field, message, null);
    }

    public ConfigurationException(@NonNull String field, @NonNull String message, Throwable cause) {
        this(List.of(new Violation(field, message)), cause);
    }

    public ConfigurationException(@NonNull List<Violation> violations) {
        this(violations, null);
    }

    private ConfigurationException(@NonNull List<Violation> violations, Throwable cause) {
        super(describe(violations), cause);
        this.violations = violations.stream()
            .sorted(Comparator.comparing(Violation::getField))
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * @return snake_case paths of all the offending fields, each listed once, e.g. {@code auth.signing_secret}.
     */
    @NonNull
    public List<String> getFields() {
        return violations.stream()
            .map(Violation::getField)
            .distinct()
            .collect(Collectors.toUnmodifiableList());
    }

    private static String describe(List<Violation> violations) {
        return "invalid configuration: " + violations.stream()
            .sorted(Comparator.comparing(Violation::getField))
            .map(Violation::toString)
            .collect(Collectors.joining("; "));
    }

    @Value
    public static class Violation {

        @NonNull
        String field;

        @NonNull
        String message;

        @Override
        public String toString() {
            return field + " " + message;
        }
    }
}
