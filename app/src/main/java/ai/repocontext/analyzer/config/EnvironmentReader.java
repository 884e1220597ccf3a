package ai.repocontext.analyzer.config;

import java.util.Optional;

/**
 * Source of environment-style key/value settings. Only {@link ConfigLoader} consults it.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    default Optional<String> getNonBlank(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }
}
