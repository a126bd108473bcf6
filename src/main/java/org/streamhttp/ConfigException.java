package org.streamhttp;

/**
 * Invalid server configuration. Raised while the server is being built, never
 * once it accepts connections.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
