package com.qanun.document.config;

import java.util.Optional;

/**
 * Reads settings from the process environment, falling back to JVM system properties.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        String value = System.getenv(key);
        if (value == null) {
            value = System.getProperty(key);
        }
        return Optional.ofNullable(value);
    }
}
