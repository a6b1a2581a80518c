package work.lcod.components.props;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import work.lcod.components.trigger.TimerConfig;

class PropResolverTest {
    private final PropResolver resolver = new PropResolver();

    @Test
    void resolvesEveryPropKindInDeclarationOrder() {
        var schema = new LinkedHashMap<String, PropSpec>();
        schema.put("timer", InterfaceProp.timer(TimerConfig.interval(60)));
        schema.put("http", InterfaceProp.http());
        schema.put("db", ServiceProp.db());
        schema.put("github", AppProp.of("github"));
        schema.put("repo", UserInputProp.of(PropType.STRING));
        schema.put("limit", UserInputProp.builder(PropType.INTEGER).optional(true).defaultValue(10).build());

        var resolved = resolver.resolve(schema, Map.of("repo", "lcod", "github", Map.of("token", "t")));

        assertEquals(List.of("timer", "http", "db", "github", "repo", "limit"), new ArrayList<>(resolved.all().keySet()));
        assertEquals(TimerConfig.interval(60), resolved.value("timer"));
        assertNull(resolved.value("http"));
        assertEquals(Map.of("token", "t"), resolved.value("github"));
        assertEquals(Map.of("repo", "lcod", "limit", 10), resolved.userValues());
    }

    @Test
    void suppliedTimerOverridesTheDefault() {
        var schema = Map.<String, PropSpec>of("timer", InterfaceProp.timer(TimerConfig.interval(60)));
        var resolved = resolver.resolve(schema, Map.of("timer", Map.of("cron", "*/5 * * * *")));
        assertEquals(TimerConfig.cron("*/5 * * * *"), resolved.value("timer"));
    }

    @Test
    void missingRequiredValueFails() {
        var schema = Map.<String, PropSpec>of("repo", UserInputProp.of(PropType.STRING));
        var error = assertThrows(PropResolutionException.class, () -> resolver.resolve(schema, Map.of()));
        assertEquals("repo", error.prop());
        assertEquals("prop_resolution", error.code());
    }

    @Test
    void optionalWithoutDefaultResolvesToNull() {
        var schema = Map.<String, PropSpec>of("repo", UserInputProp.builder(PropType.STRING).optional(true).build());
        assertNull(resolver.resolve(schema, Map.of()).value("repo"));
    }

    @Test
    void defaultOnRequiredPropIsASchemaError() {
        var schema = Map.<String, PropSpec>of("repo", UserInputProp.builder(PropType.STRING).defaultValue("x").build());
        assertThrows(PropResolutionException.class, () -> resolver.resolve(schema, Map.of("repo", "y")));
    }

    @Test
    void rejectsValuesOfTheWrongType() {
        var schema = new LinkedHashMap<String, PropSpec>();
        schema.put("count", UserInputProp.of(PropType.INTEGER));
        schema.put("tags", UserInputProp.of(PropType.STRING_ARRAY));
        assertThrows(PropResolutionException.class, () -> resolver.resolve(schema, Map.of("count", "3", "tags", List.of("a"))));
        assertThrows(PropResolutionException.class, () -> resolver.resolve(schema, Map.of("count", 3, "tags", List.of(1))));
        assertEquals(3, resolver.resolve(schema, Map.of("count", 3, "tags", List.of("a"))).value("count"));
    }

    @Test
    void appPropNeedsCredentials() {
        var schema = Map.<String, PropSpec>of("github", AppProp.of("github"));
        assertThrows(PropResolutionException.class, () -> resolver.resolve(schema, Map.of()));
    }

    @Test
    void propDefinitionRefInheritsAndMergesOverrides() {
        var base = UserInputProp.builder(PropType.STRING)
            .label("Repository")
            .description("Repository to watch")
            .staticOptions(List.of(PropOption.of("a"), PropOption.of("b")))
            .build();
        var app = new AppProp("github", Map.of("repo", base), Map.of());
        var overrides = PropOverrides.builder().label("Source repo").optional(true).build();

        var schema = new LinkedHashMap<String, PropSpec>();
        schema.put("github", app);
        schema.put("repo", new PropDefinitionRef("github", "repo", null, overrides));

        var resolved = resolver.resolve(schema, Map.of("github", Map.of()));
        var effective = assertInstanceOf(UserInputProp.class, resolved.get("repo").spec());
        assertEquals("Source repo", effective.label());
        assertEquals("Repository to watch", effective.description());
        assertTrue(effective.optional());
        assertNull(resolved.value("repo"));
    }

    @Test
    void refToUnknownAppOrDefinitionIsRejected() {
        var unknownApp = new LinkedHashMap<String, PropSpec>();
        unknownApp.put("repo", PropDefinitionRef.of("github", "repo"));
        assertThrows(PropResolutionException.class, () -> resolver.validateSchema(unknownApp));

        var unknownDefinition = new LinkedHashMap<String, PropSpec>();
        unknownDefinition.put("github", AppProp.of("github"));
        unknownDefinition.put("repo", PropDefinitionRef.of("github", "repo"));
        assertThrows(PropResolutionException.class, () -> resolver.validateSchema(unknownDefinition));
    }

    @Test
    void inputValuesReferencingALaterPropAreRejectedBeforeAnythingRuns() {
        var providerCalls = new AtomicInteger();
        var inputCalls = new AtomicInteger();
        var base = UserInputProp.builder(PropType.STRING)
            .optionsProvider(query -> {
                providerCalls.incrementAndGet();
                return OptionsPage.empty();
            })
            .build();
        var schema = new LinkedHashMap<String, PropSpec>();
        schema.put("github", new AppProp("github", Map.of("branch", base), Map.of()));
        schema.put("branch", new PropDefinitionRef("github", "branch", InputValues.derived(List.of("repo"), values -> {
            inputCalls.incrementAndGet();
            return Map.of("repo", values.get("repo"));
        }), null));
        schema.put("repo", UserInputProp.of(PropType.STRING));

        var error = assertThrows(PropResolutionException.class,
            () -> resolver.resolve(schema, Map.of("github", Map.of(), "branch", "main", "repo", "lcod")));
        assertEquals("branch", error.prop());
        assertThrows(PropResolutionException.class, () -> resolver.fetchOptionsPage(schema, "branch", 0, null, Map.of()));
        assertEquals(0, providerCalls.get());
        assertEquals(0, inputCalls.get());
    }

    @Test
    void fetchOptionsPagePassesInputValuesAndContext() {
        var seen = new ArrayList<OptionsQuery>();
        var base = UserInputProp.builder(PropType.STRING)
            .optionsProvider(query -> {
                seen.add(query);
                return new OptionsPage(List.of(PropOption.of(query.inputValues().get("repo") + "/main")), "next");
            })
            .build();
        var schema = new LinkedHashMap<String, PropSpec>();
        schema.put("github", new AppProp("github", Map.of("branch", base), Map.of()));
        schema.put("repo", UserInputProp.of(PropType.STRING));
        schema.put("branch", new PropDefinitionRef("github", "branch",
            InputValues.derived(List.of("repo"), values -> Map.of("repo", values.get("repo"))), null));

        var page = resolver.fetchOptionsPage(schema, "branch", 1, "ctx-1", Map.of("repo", "lcod"));

        assertEquals(List.of(PropOption.of("lcod/main")), page.options());
        assertEquals("next", page.nextPageToken());
        assertEquals(1, seen.get(0).page());
        assertEquals("ctx-1", seen.get(0).prevContext());
    }

    @Test
    void staticOptionsAreASinglePage() {
        var schema = Map.<String, PropSpec>of("format", UserInputProp.builder(PropType.STRING)
            .staticOptions(List.of(PropOption.of("json"), PropOption.of("text")))
            .build());
        var first = resolver.fetchOptionsPage(schema, "format", 0, null, Map.of());
        assertEquals(2, first.options().size());
        assertTrue(first.isLast());
        assertTrue(resolver.fetchOptionsPage(schema, "format", 1, null, Map.of()).options().isEmpty());
    }

    @Test
    void providerFailuresAreWrapped() {
        var schema = Map.<String, PropSpec>of("repo", UserInputProp.builder(PropType.STRING)
            .optionsProvider(query -> {
                throw new IllegalStateException("rate limited");
            })
            .build());
        var error = assertThrows(OptionsProviderException.class, () -> resolver.fetchOptionsPage(schema, "repo", 0, null, Map.of()));
        assertTrue(error.getMessage().contains("rate limited"));
        assertEquals("options_provider", error.code());
    }
}
