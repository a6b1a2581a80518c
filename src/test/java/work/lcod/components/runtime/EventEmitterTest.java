package work.lcod.components.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.components.dedupe.DedupeEngine;
import work.lcod.components.dedupe.DedupeState;
import work.lcod.components.dedupe.DedupeStrategy;

class EventEmitterTest {
    @Test
    void ordersByTsRegardlessOfCallOrder() {
        var emitter = new EventEmitter(DedupeStrategy.NONE);
        emitter.emit("c", EmitMetadata.none().withTs(300));
        emitter.emit("a", EmitMetadata.none().withTs(100));
        emitter.emit("b", EmitMetadata.none().withTs(200));
        assertEquals(List.of("a", "b", "c"), data(emitter.ordered()));
    }

    @Test
    void emissionsWithoutTsFollowTheirPredecessor() {
        var emitter = new EventEmitter(DedupeStrategy.NONE);
        emitter.emit("first", null);
        emitter.emit("late", EmitMetadata.none().withTs(300));
        emitter.emit("after-late", null);
        emitter.emit("early", EmitMetadata.none().withTs(100));
        assertEquals(List.of("first", "early", "late", "after-late"), data(emitter.ordered()));
    }

    @Test
    void equalTsKeepsCallOrder() {
        var emitter = new EventEmitter(DedupeStrategy.NONE);
        emitter.emit("x", EmitMetadata.none().withTs(5));
        emitter.emit("y", EmitMetadata.none().withTs(5));
        emitter.emit("z", EmitMetadata.none().withTs(5));
        assertEquals(List.of("x", "y", "z"), data(emitter.ordered()));
    }

    @Test
    void rejectsEmitsThatCannotBeDeduped() {
        var emitter = new EventEmitter(DedupeStrategy.GREATEST);
        emitter.emit("no id", null);
        emitter.emit("bad id", EmitMetadata.id("abc"));
        emitter.emit("ok", EmitMetadata.id(7));
        var rejections = emitter.rejections();
        assertEquals(2, rejections.size());
        assertEquals(new EmitRejection(0, "missing_id_for_dedupe", rejections.get(0).message()), rejections.get(0));
        assertEquals("dedupe_type", rejections.get(1).code());
        assertEquals(1, emitter.bufferedCount());
    }

    @Test
    void rejectsDataThatIsNotJson() {
        var emitter = new EventEmitter(DedupeStrategy.NONE);
        emitter.emit(Double.POSITIVE_INFINITY, null);
        assertEquals("serialization", emitter.rejections().get(0).code());
        assertEquals(0, emitter.bufferedCount());
    }

    @Test
    void snapshotsDataAtEmitTime() {
        var emitter = new EventEmitter(DedupeStrategy.NONE);
        var data = new LinkedHashMap<String, Object>();
        data.put("n", 1);
        emitter.emit(data, null);
        data.put("n", 2);
        assertEquals(Map.of("n", 1), emitter.ordered().get(0).data());
    }

    @Test
    void drainAppliesDedupeInTsOrder() {
        var emitter = new EventEmitter(DedupeStrategy.LAST);
        emitter.emit("c", new EmitMetadata("c", null, 3L));
        emitter.emit("a", new EmitMetadata("a", null, 1L));
        emitter.emit("b", new EmitMetadata("b", null, 2L));
        var drain = emitter.drain(new DedupeEngine(DedupeStrategy.LAST), DedupeState.empty(DedupeStrategy.LAST));
        var accepted = new ArrayList<Object>();
        drain.accepted().forEach(pending -> accepted.add(pending.data()));
        assertEquals(List.of("a", "b", "c"), accepted);
        assertEquals(0, drain.dropped());
        assertTrue(drain.state().toMap().containsValue("c"));
    }

    private static List<Object> data(List<EventEmitter.Pending> pending) {
        var values = new ArrayList<Object>();
        pending.forEach(item -> values.add(item.data()));
        return values;
    }
}
