package work.lcod.components.definition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.components.dedupe.DedupeStrategy;

class ComponentRegistryTest {
    private static final ComponentDefinition SYNC = ComponentDefinition.builder("sync")
        .dedupe(DedupeStrategy.LAST)
        .run((event, ctx) -> {})
        .build();

    @Test
    void firstRegistrationKeepsTheDefinition() {
        var registry = new ComponentRegistry();
        assertSame(SYNC, registry.register("alice", SYNC));
    }

    @Test
    void collisionsGetTheFirstFreeSuffix() {
        var registry = new ComponentRegistry();
        registry.register("alice", SYNC);
        var second = registry.register("alice", SYNC);
        assertEquals("sync-1", second.name());
        assertEquals(DedupeStrategy.LAST, second.dedupe());
        assertEquals("sync-2", registry.register("alice", SYNC).name());

        registry.release("alice", "sync-1");
        assertEquals("sync-1", registry.register("alice", SYNC).name());
        assertEquals(Set.of("sync", "sync-1", "sync-2"), registry.names("alice"));
        assertEquals("sync", registry.register("bob", SYNC).name());
    }

    @Test
    void definitionsNeedANameAndARunHandler() {
        assertThrows(IllegalArgumentException.class, () -> ComponentDefinition.builder(" ").run((event, ctx) -> {}).build());
        assertThrows(NullPointerException.class, () -> ComponentDefinition.builder("x").build());
    }
}
