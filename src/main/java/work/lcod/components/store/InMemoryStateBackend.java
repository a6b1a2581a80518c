package work.lcod.components.store;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local backend; state lives as long as the backend instance.
 */
public final class InMemoryStateBackend implements StateBackend {
    private final Map<String, Map<String, String>> documents = new ConcurrentHashMap<>();

    @Override
    public Map<String, String> load(String instanceId, String namespace) {
        var stored = documents.get(key(instanceId, namespace));
        return stored == null ? new LinkedHashMap<>() : new LinkedHashMap<>(stored);
    }

    @Override
    public void save(String instanceId, String namespace, Map<String, String> entries) {
        documents.put(key(instanceId, namespace), Map.copyOf(entries));
    }

    @Override
    public void drop(String instanceId) {
        String prefix = instanceId + "/";
        documents.keySet().removeIf(key -> key.startsWith(prefix));
    }

    private static String key(String instanceId, String namespace) {
        return instanceId + "/" + namespace;
    }
}
