package work.lcod.components.dedupe;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Decides which emissions pass for a configured strategy. The engine is stateless: callers hand in
 * the current {@link DedupeState} and persist the returned one.
 */
public final class DedupeEngine {
    private final DedupeStrategy strategy;

    public DedupeEngine(DedupeStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    public DedupeStrategy strategy() {
        return strategy;
    }

    /**
     * Admits a single id. Under {@link DedupeStrategy#LAST} this is a batch of one.
     */
    public Admission admit(Object id, DedupeState state) {
        var batch = admitBatch(Collections.singletonList(id), state);
        return new Admission(batch.accepted().get(0), batch.state());
    }

    /**
     * Admits an ordered batch (the emissions of one invocation, oldest first).
     */
    public BatchAdmission admitBatch(List<?> ids, DedupeState state) {
        DedupeState current = state == null ? DedupeState.empty(strategy) : state;
        if (current.strategy() != strategy) {
            throw new IllegalArgumentException("State of strategy " + current.strategy() + " given to " + strategy + " engine");
        }
        if (ids.isEmpty()) {
            return new BatchAdmission(List.of(), current);
        }
        return switch (strategy) {
            case NONE -> new BatchAdmission(Collections.nCopies(ids.size(), Boolean.TRUE), current);
            case UNIQUE -> admitUnique(ids, (UniqueCache) current);
            case GREATEST -> admitGreatest(ids, (GreatestCache) current);
            case LAST -> admitLast(ids, (LastCache) current);
        };
    }

    private BatchAdmission admitUnique(List<?> ids, UniqueCache cache) {
        var accepted = new ArrayList<Boolean>(ids.size());
        for (Object raw : ids) {
            String id = requireCanonical(raw);
            if (cache.contains(id)) {
                accepted.add(Boolean.FALSE);
            } else {
                cache = cache.append(id);
                accepted.add(Boolean.TRUE);
            }
        }
        return new BatchAdmission(accepted, cache);
    }

    private BatchAdmission admitGreatest(List<?> ids, GreatestCache cache) {
        var accepted = new ArrayList<Boolean>(ids.size());
        BigDecimal max = cache.maxId();
        for (Object raw : ids) {
            if (raw == null) {
                throw new MissingIdForDedupeException(strategy);
            }
            BigDecimal id = DedupeIds.numeric(raw);
            if (max == null || id.compareTo(max) > 0) {
                max = id;
                accepted.add(Boolean.TRUE);
            } else {
                accepted.add(Boolean.FALSE);
            }
        }
        return new BatchAdmission(accepted, new GreatestCache(max));
    }

    /**
     * Everything after the first occurrence of {@code lastId} passes. When {@code lastId} is not in
     * the batch, only ids already in the recent window are dropped.
     */
    private BatchAdmission admitLast(List<?> ids, LastCache cache) {
        var keys = new ArrayList<String>(ids.size());
        for (Object raw : ids) {
            keys.add(requireCanonical(raw));
        }
        int cut = cache.lastId() == null ? -1 : keys.indexOf(cache.lastId());
        boolean fallback = cache.lastId() != null && cut < 0;
        var accepted = new ArrayList<Boolean>(keys.size());
        var acceptedIds = new ArrayList<String>();
        for (int i = 0; i < keys.size(); i++) {
            boolean pass = fallback ? !cache.recent().contains(keys.get(i)) : i > cut;
            accepted.add(pass);
            if (pass) {
                acceptedIds.add(keys.get(i));
            }
        }
        DedupeState next = acceptedIds.isEmpty() ? cache : cache.accept(acceptedIds);
        return new BatchAdmission(accepted, next);
    }

    private String requireCanonical(Object raw) {
        if (raw == null) {
            throw new MissingIdForDedupeException(strategy);
        }
        return DedupeIds.canonical(raw);
    }

    public record Admission(boolean accepted, DedupeState state) {}

    public record BatchAdmission(List<Boolean> accepted, DedupeState state) {
        public BatchAdmission {
            accepted = List.copyOf(accepted);
        }

        public int acceptedCount() {
            return (int) accepted.stream().filter(Boolean::booleanValue).count();
        }
    }
}
