package ai.docscanner.review.config;

import java.util.Optional;

/**
 * Source of configuration values keyed by environment variable name. The typed readers treat unset and blank
 * values alike and reject malformed ones with a message naming the key.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }

    default Optional<String> text(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }

    default Optional<Integer> integer(String key, int minimum) {
        return text(key).map(raw -> {
            int value;
            try {
                value = Integer.parseInt(raw);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(key + " must be an integer", ex);
            }
            if (value < minimum) {
                throw new IllegalArgumentException(key + " must be " + minimum + " or greater");
            }
            return value;
        });
    }

    default Optional<Double> ratio(String key) {
        return text(key).map(raw -> {
            double value;
            try {
                value = Double.parseDouble(raw);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid double value for " + key + ": " + raw, ex);
            }
            if (value <= 0d || value > 1d) {
                throw new IllegalArgumentException(key + " must be within (0, 1]: " + raw);
            }
            return value;
        });
    }

    /**
     * {@code true}, {@code yes} and {@code 1} switch a flag on; anything else switches it off.
     */
    default boolean flag(String key) {
        return text(key)
                .map(value -> value.equalsIgnoreCase("true") || value.equalsIgnoreCase("yes") || value.equals("1"))
                .orElse(false);
    }
}
