package work.lcod.components.store;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link StateStore} bound to one instance and namespace. Every {@code set}/{@code delete} is
 * written through to the backend before it becomes visible to readers.
 */
public final class InstanceStateStore implements StateStore {
    private final String instanceId;
    private final String namespace;
    private final StateBackend backend;
    private Map<String, String> entries;

    public InstanceStateStore(String instanceId, String namespace, StateBackend backend) {
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.entries = new LinkedHashMap<>(backend.load(instanceId, namespace));
    }

    public String instanceId() {
        return instanceId;
    }

    public String namespace() {
        return namespace;
    }

    @Override
    public synchronized Optional<Object> get(String key) {
        String encoded = entries.get(checkKey(key));
        return encoded == null ? Optional.empty() : Optional.ofNullable(JsonValues.decode(encoded));
    }

    @Override
    public synchronized void set(String key, Object value) {
        String encoded = JsonValues.encode(value);
        var next = new LinkedHashMap<>(entries);
        next.put(checkKey(key), encoded);
        backend.save(instanceId, namespace, next);
        entries = next;
    }

    @Override
    public synchronized boolean delete(String key) {
        if (!entries.containsKey(checkKey(key))) {
            return false;
        }
        var next = new LinkedHashMap<>(entries);
        next.remove(key);
        backend.save(instanceId, namespace, next);
        entries = next;
        return true;
    }

    @Override
    public synchronized Set<String> keys() {
        return Set.copyOf(entries.keySet());
    }

    private static String checkKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("State key must not be null");
        }
        return key;
    }
}
