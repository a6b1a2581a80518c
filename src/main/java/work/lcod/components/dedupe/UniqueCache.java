package work.lcod.components.dedupe;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Insertion-ordered set of the most recent accepted ids, bounded to {@link #CAPACITY}.
 */
public record UniqueCache(List<String> ids) implements DedupeState {
    public static final int CAPACITY = 100;

    public UniqueCache {
        ids = List.copyOf(new LinkedHashSet<>(ids));
        if (ids.size() > CAPACITY) {
            ids = ids.subList(ids.size() - CAPACITY, ids.size());
        }
    }

    public static UniqueCache empty() {
        return new UniqueCache(List.of());
    }

    public boolean contains(String id) {
        return ids.contains(id);
    }

    /**
     * Appends an id, evicting the oldest entries beyond capacity.
     */
    public UniqueCache append(String id) {
        var next = new ArrayList<>(ids);
        next.add(id);
        while (next.size() > CAPACITY) {
            next.remove(0);
        }
        return new UniqueCache(next);
    }

    @Override
    public DedupeStrategy strategy() {
        return DedupeStrategy.UNIQUE;
    }

    @Override
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("strategy", strategy().wireName());
        map.put("ids", ids);
        return map;
    }

    static UniqueCache fromMap(Map<?, ?> stored) {
        var ids = new ArrayList<String>();
        if (stored.get("ids") instanceof List<?> list) {
            for (Object item : list) {
                ids.add(String.valueOf(item));
            }
        }
        return new UniqueCache(ids);
    }
}
