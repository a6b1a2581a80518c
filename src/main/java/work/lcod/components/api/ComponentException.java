package work.lcod.components.api;

/**
 * Base class of every runtime error. Carries a stable machine-readable code next to the message.
 */
public class ComponentException extends RuntimeException {
    private final String code;

    public ComponentException(String code, String message) {
        super(message);
        this.code = code;
    }

    public ComponentException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
