package ai.longdoc.translator.config;

import java.util.Map;
import java.util.Optional;

/**
 * Source of configuration values keyed by environment variable name.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * The trimmed value of {@code key}, or empty when it is unset or blank.
     */
    default Optional<String> find(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }

    static EnvironmentReader of(Map<String, String> values) {
        Map<String, String> copy = Map.copyOf(values);
        return key -> Optional.ofNullable(copy.get(key));
    }
}
