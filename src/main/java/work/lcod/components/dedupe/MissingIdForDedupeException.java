package work.lcod.components.dedupe;

import work.lcod.components.api.ComponentException;

public final class MissingIdForDedupeException extends ComponentException {
    public MissingIdForDedupeException(DedupeStrategy strategy) {
        super("missing_id_for_dedupe", "Dedupe strategy '" + strategy.wireName() + "' requires every emitted event to carry an id");
    }
}
