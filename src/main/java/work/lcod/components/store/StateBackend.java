package work.lcod.components.store;

import java.util.Map;

/**
 * Persistence SPI behind {@link InstanceStateStore}. Entries map keys to encoded JSON text and
 * are saved as one unit per instance and namespace.
 */
public interface StateBackend {
    Map<String, String> load(String instanceId, String namespace);

    void save(String instanceId, String namespace, Map<String, String> entries);

    /**
     * Removes every namespace of an instance.
     */
    void drop(String instanceId);
}
