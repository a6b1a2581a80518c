package work.lcod.components.dedupe;

import java.util.Map;

/**
 * Strategy-specific cache persisted between invocations of one instance. Implementations are
 * immutable; admission returns a new state.
 */
public interface DedupeState {
    DedupeStrategy strategy();

    Map<String, Object> toMap();

    static DedupeState empty(DedupeStrategy strategy) {
        return switch (strategy) {
            case NONE -> PassThrough.INSTANCE;
            case UNIQUE -> UniqueCache.empty();
            case GREATEST -> GreatestCache.empty();
            case LAST -> LastCache.empty();
        };
    }

    /**
     * Restores a state from its {@link #toMap()} form. A document written for another strategy is
     * ignored and yields an empty state.
     */
    static DedupeState fromMap(DedupeStrategy strategy, Map<?, ?> stored) {
        if (stored == null || !strategy.wireName().equals(stored.get("strategy"))) {
            return empty(strategy);
        }
        return switch (strategy) {
            case NONE -> PassThrough.INSTANCE;
            case UNIQUE -> UniqueCache.fromMap(stored);
            case GREATEST -> GreatestCache.fromMap(stored);
            case LAST -> LastCache.fromMap(stored);
        };
    }

    enum PassThrough implements DedupeState {
        INSTANCE;

        @Override
        public DedupeStrategy strategy() {
            return DedupeStrategy.NONE;
        }

        @Override
        public Map<String, Object> toMap() {
            return Map.of("strategy", DedupeStrategy.NONE.wireName());
        }
    }
}
