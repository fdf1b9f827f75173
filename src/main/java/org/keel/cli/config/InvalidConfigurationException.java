package org.keel.cli.config;

/**
 * Thrown when the CLI configuration cannot be found, parsed or interpreted.
 * The message names the offending file and key so it can be shown to the user as is.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
