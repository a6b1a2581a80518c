package work.lcod.components.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.lang.reflect.Array;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * JSON encode/decode helpers shared by the store, the dedupe cache and the emitter.
 * Decoded values are plain maps, lists, strings, numbers and booleans.
 */
public final class JsonValues {
    private static final ObjectMapper JSON = new ObjectMapper();

    private JsonValues() {}

    public static ObjectMapper mapper() {
        return JSON;
    }

    public static String encode(Object value) {
        ensureSerializable(value, Collections.newSetFromMap(new IdentityHashMap<>()), "$");
        String json;
        try {
            json = JSON.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new SerializationException("Value is not JSON-serializable: " + ex.getOriginalMessage(), ex);
        }
        try {
            // POJOs are only inspected by Jackson; a NaN inside one surfaces here
            JSON.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new SerializationException("Value produced invalid JSON: " + ex.getOriginalMessage(), ex);
        }
        return json;
    }

    public static Object decode(String json) {
        if (json == null) {
            return null;
        }
        try {
            return JSON.readValue(json, Object.class);
        } catch (JsonProcessingException ex) {
            throw new SerializationException("Stored value is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    public static Object copy(Object value) {
        return value == null ? null : decode(encode(value));
    }

    private static void ensureSerializable(Object value, Set<Object> path, String where) {
        if (value == null || value instanceof CharSequence || value instanceof Boolean || value instanceof Character) {
            return;
        }
        if (value instanceof Double d && !Double.isFinite(d)) {
            throw new SerializationException("Non-finite number at " + where);
        }
        if (value instanceof Float f && !Float.isFinite(f)) {
            throw new SerializationException("Non-finite number at " + where);
        }
        if (value instanceof Number || value instanceof Enum<?>) {
            return;
        }
        if (value instanceof JsonNode node) {
            ensureFiniteNode(node, where);
            return;
        }
        if (value instanceof Function<?, ?> || value instanceof BiFunction<?, ?, ?> || value instanceof Supplier<?>
            || value instanceof Consumer<?> || value instanceof Runnable || value.getClass().isSynthetic()) {
            throw new SerializationException("Functions are not serializable (at " + where + ")");
        }
        if (value instanceof Map<?, ?> map) {
            enter(path, value, where);
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw new SerializationException("Object keys must be strings (at " + where + ")");
                }
                ensureSerializable(entry.getValue(), path, where + "." + entry.getKey());
            }
            path.remove(value);
            return;
        }
        if (value instanceof Iterable<?> iterable) {
            enter(path, value, where);
            int index = 0;
            for (Object item : iterable) {
                ensureSerializable(item, path, where + "[" + index++ + "]");
            }
            path.remove(value);
            return;
        }
        if (value.getClass().isArray() && !(value instanceof byte[])) {
            enter(path, value, where);
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                ensureSerializable(Array.get(value, i), path, where + "[" + i + "]");
            }
            path.remove(value);
        }
    }

    private static void enter(Set<Object> path, Object value, String where) {
        if (!path.add(value)) {
            throw new SerializationException("Cyclic reference at " + where);
        }
    }

    private static void ensureFiniteNode(JsonNode node, String where) {
        if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
            throw new SerializationException("Non-finite number at " + where);
        }
        if (node.isContainerNode()) {
            for (JsonNode child : node) {
                ensureFiniteNode(child, where);
            }
        }
    }
}
