package io.clawdos.core.config;

public final class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }
}
