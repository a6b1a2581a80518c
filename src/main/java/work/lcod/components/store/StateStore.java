package work.lcod.components.store;

import java.util.Optional;
import java.util.Set;

/**
 * Key-value capability scoped to one component instance. Values are JSON documents; every read
 * returns a fresh copy.
 */
public interface StateStore {
    Optional<Object> get(String key);

    /**
     * @throws SerializationException when {@code value} is not JSON-serializable
     */
    void set(String key, Object value);

    boolean delete(String key);

    Set<String> keys();
}
