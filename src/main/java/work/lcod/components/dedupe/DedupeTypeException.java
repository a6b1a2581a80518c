package work.lcod.components.dedupe;

import work.lcod.components.api.ComponentException;

public final class DedupeTypeException extends ComponentException {
    public DedupeTypeException(String message) {
        super("dedupe_type", message);
    }
}
