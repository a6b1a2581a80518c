package work.lcod.components.runtime;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.components.api.ComponentException;
import work.lcod.components.dedupe.DedupeEngine;
import work.lcod.components.dedupe.DedupeIds;
import work.lcod.components.dedupe.DedupeState;
import work.lcod.components.dedupe.DedupeStrategy;
import work.lcod.components.store.JsonValues;

/**
 * Buffers the emissions of one invocation. Calls that cannot satisfy the dedupe strategy, or carry
 * data that is not JSON-serializable, are rejected on the spot and recorded; the run goes on.
 *
 * <p>On drain the buffer is ordered by {@code ts} ascending. An emission without {@code ts} takes
 * the {@code ts} of the closest timestamped emission before it in call order, or sorts first when
 * there is none; call order breaks ties.
 */
public final class EventEmitter {
    private static final Logger log = LoggerFactory.getLogger(EventEmitter.class);

    private final DedupeStrategy strategy;
    private final List<Pending> buffer = new ArrayList<>();
    private final List<EmitRejection> rejections = new ArrayList<>();
    private int calls;

    public EventEmitter(DedupeStrategy strategy) {
        this.strategy = strategy;
    }

    public synchronized void emit(Object data, EmitMetadata metadata) {
        int index = calls++;
        EmitMetadata meta = metadata == null ? EmitMetadata.none() : metadata;
        Object snapshot;
        try {
            DedupeIds.validate(strategy, meta.id());
            snapshot = JsonValues.copy(data);
        } catch (ComponentException ex) {
            rejections.add(new EmitRejection(index, ex.code(), ex.getMessage()));
            log.warn("Rejected emit #{}: {}", index, ex.getMessage());
            return;
        }
        buffer.add(new Pending(index, snapshot, meta, 0L));
    }

    public synchronized List<EmitRejection> rejections() {
        return List.copyOf(rejections);
    }

    public synchronized int bufferedCount() {
        return buffer.size();
    }

    synchronized List<Pending> ordered() {
        var keyed = new ArrayList<Pending>(buffer.size());
        Long carried = null;
        for (Pending pending : buffer) {
            if (pending.metadata().ts() != null) {
                carried = pending.metadata().ts();
            }
            long sortKey = carried == null ? Long.MIN_VALUE : carried;
            keyed.add(new Pending(pending.index(), pending.data(), pending.metadata(), sortKey));
        }
        keyed.sort(Comparator.comparingLong(Pending::sortKey).thenComparingInt(Pending::index));
        return keyed;
    }

    /**
     * Orders the buffer and runs it through dedupe as one batch.
     */
    synchronized Drain drain(DedupeEngine engine, DedupeState state) {
        var ordered = ordered();
        var ids = new ArrayList<Object>(ordered.size());
        for (Pending pending : ordered) {
            ids.add(pending.metadata().id());
        }
        var admission = engine.admitBatch(ids, state);
        var accepted = new ArrayList<Pending>();
        for (int i = 0; i < ordered.size(); i++) {
            if (admission.accepted().get(i)) {
                accepted.add(ordered.get(i));
            }
        }
        return new Drain(accepted, ordered.size() - accepted.size(), admission.state());
    }

    record Pending(int index, Object data, EmitMetadata metadata, long sortKey) {}

    record Drain(List<Pending> accepted, int dropped, DedupeState state) {}
}
