package work.lcod.components.props;

import work.lcod.components.api.ComponentException;

/**
 * Prop schema or supplied values cannot be resolved; the instance never becomes active.
 */
public final class PropResolutionException extends ComponentException {
    private final String prop;

    public PropResolutionException(String prop, String message) {
        super("prop_resolution", message);
        this.prop = prop;
    }

    public PropResolutionException(String prop, String message, Throwable cause) {
        super("prop_resolution", message, cause);
        this.prop = prop;
    }

    public String prop() {
        return prop;
    }
}
