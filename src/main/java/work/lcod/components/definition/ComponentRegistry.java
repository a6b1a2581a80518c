package work.lcod.components.definition;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps component names unique per owner. A name already taken by the same owner gets the first
 * free numeric suffix ({@code name-1}, {@code name-2}, ...); other owners are unaffected.
 */
public final class ComponentRegistry {
    private final Map<String, Set<String>> namesByOwner = new ConcurrentHashMap<>();

    /**
     * @return the definition under its assigned, owner-unique name
     */
    public ComponentDefinition register(String owner, ComponentDefinition definition) {
        var names = namesByOwner.computeIfAbsent(owner, key -> ConcurrentHashMap.newKeySet());
        synchronized (names) {
            String candidate = definition.name();
            int suffix = 1;
            while (names.contains(candidate)) {
                candidate = definition.name() + "-" + suffix++;
            }
            names.add(candidate);
            return candidate.equals(definition.name()) ? definition : definition.withName(candidate);
        }
    }

    public void release(String owner, String name) {
        var names = namesByOwner.get(owner);
        if (names != null) {
            synchronized (names) {
                names.remove(name);
            }
        }
    }

    public Set<String> names(String owner) {
        var names = namesByOwner.get(owner);
        return names == null ? Set.of() : Collections.unmodifiableSet(Set.copyOf(names));
    }
}
