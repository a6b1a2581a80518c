package work.lcod.components.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class InstanceStateStoreTest {
    @Test
    void returnsWhatWasSetAcrossStoreHandles() {
        var backend = new InMemoryStateBackend();
        var first = new InstanceStateStore("ci_1", "store", backend);
        first.set("k", Map.of("a", 1));

        assertEquals(Optional.of(Map.of("a", 1)), first.get("k"));
        var later = new InstanceStateStore("ci_1", "store", backend);
        assertEquals(Optional.of(Map.of("a", 1)), later.get("k"));
        assertTrue(later.get("missing").isEmpty());
    }

    @Test
    void storedValuesAreNotAliased() {
        var store = new InstanceStateStore("ci_1", "store", new InMemoryStateBackend());
        var value = new LinkedHashMap<String, Object>();
        value.put("items", new ArrayList<>(List.of(1, 2)));
        store.set("k", value);
        value.put("items", List.of());

        @SuppressWarnings("unchecked")
        var read = (Map<String, Object>) store.get("k").orElseThrow();
        assertEquals(List.of(1, 2), read.get("items"));
        read.put("items", "mutated");
        assertEquals(Map.of("items", List.of(1, 2)), store.get("k").orElseThrow());
    }

    @Test
    void namespacesAndInstancesAreIsolated() {
        var backend = new InMemoryStateBackend();
        new InstanceStateStore("ci_1", "store", backend).set("k", "store");
        new InstanceStateStore("ci_1", "dedupe", backend).set("k", "dedupe");
        new InstanceStateStore("ci_2", "store", backend).set("k", "other");

        assertEquals(Optional.of("store"), new InstanceStateStore("ci_1", "store", backend).get("k"));
        assertEquals(Optional.of("dedupe"), new InstanceStateStore("ci_1", "dedupe", backend).get("k"));
        assertEquals(Optional.of("other"), new InstanceStateStore("ci_2", "store", backend).get("k"));
    }

    @Test
    void deleteAndKeys() {
        var store = new InstanceStateStore("ci_1", "store", new InMemoryStateBackend());
        store.set("a", 1);
        store.set("b", true);
        assertEquals(Set.of("a", "b"), store.keys());
        assertTrue(store.delete("a"));
        assertFalse(store.delete("a"));
        assertEquals(Set.of("b"), store.keys());
    }

    @Test
    void rejectsValuesThatAreNotJson() {
        var store = new InstanceStateStore("ci_1", "store", new InMemoryStateBackend());
        Supplier<String> function = () -> "x";
        var cyclic = new LinkedHashMap<String, Object>();
        cyclic.put("self", cyclic);

        assertEquals("serialization", assertThrows(SerializationException.class, () -> store.set("f", function)).code());
        assertThrows(SerializationException.class, () -> store.set("nan", Double.NaN));
        assertThrows(SerializationException.class, () -> store.set("cycle", cyclic));
        assertThrows(SerializationException.class, () -> store.set("keys", Map.of(1, "a")));
        assertTrue(store.keys().isEmpty(), "failed writes leave no entry");
    }
}
