package work.lcod.components.store;

import work.lcod.components.api.ComponentException;

/**
 * Raised when a value cannot be represented as JSON (cycles, functions, non-finite numbers).
 */
public final class SerializationException extends ComponentException {
    public SerializationException(String message) {
        super("serialization", message);
    }

    public SerializationException(String message, Throwable cause) {
        super("serialization", message, cause);
    }
}
