package spl.idstring.config;

import java.util.Optional;

/**
 * Source of environment values, replaceable in tests.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Reads the process environment.
     */
    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
