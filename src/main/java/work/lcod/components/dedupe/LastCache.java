package work.lcod.components.dedupe;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Id of the newest accepted emission plus a bounded window of recently accepted ids. The window
 * filters a batch in which {@code lastId} itself no longer shows up.
 */
public record LastCache(String lastId, List<String> recent) implements DedupeState {
    public LastCache {
        recent = recent == null ? List.of() : List.copyOf(new LinkedHashSet<>(recent));
        if (recent.size() > UniqueCache.CAPACITY) {
            recent = recent.subList(recent.size() - UniqueCache.CAPACITY, recent.size());
        }
    }

    public static LastCache empty() {
        return new LastCache(null, List.of());
    }

    LastCache accept(List<String> acceptedIds) {
        var window = new ArrayList<String>(recent);
        for (String id : acceptedIds) {
            window.remove(id);
            window.add(id);
        }
        return new LastCache(acceptedIds.get(acceptedIds.size() - 1), window);
    }

    @Override
    public DedupeStrategy strategy() {
        return DedupeStrategy.LAST;
    }

    @Override
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("strategy", strategy().wireName());
        map.put("lastId", lastId);
        map.put("recent", recent);
        return map;
    }

    static LastCache fromMap(Map<?, ?> stored) {
        Object last = stored.get("lastId");
        var recent = new ArrayList<String>();
        if (stored.get("recent") instanceof List<?> list) {
            for (Object item : list) {
                recent.add(String.valueOf(item));
            }
        }
        return new LastCache(last == null ? null : String.valueOf(last), recent);
    }
}
