package io.github.uccuyo.consistency.config;

/**
 * Raised when a configuration resource exists but cannot be used.
 */
public class ConsistencyConfigException extends RuntimeException {

    public ConsistencyConfigException(String message) {
        super(message);
    }

    public ConsistencyConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
