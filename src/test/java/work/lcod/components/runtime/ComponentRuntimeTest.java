package work.lcod.components.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.components.api.ComponentException;
import work.lcod.components.api.RuntimeConfiguration;
import work.lcod.components.definition.ComponentDefinition;
import work.lcod.components.definition.ComponentMethod;
import work.lcod.components.props.AppProp;
import work.lcod.components.props.InterfaceProp;
import work.lcod.components.props.PropResolutionException;
import work.lcod.components.props.PropType;
import work.lcod.components.props.ServiceProp;
import work.lcod.components.props.UserInputProp;
import work.lcod.components.support.ComponentTestSupport;
import work.lcod.components.support.ComponentTestSupport.MutableClock;
import work.lcod.components.trigger.HttpEvent;
import work.lcod.components.trigger.HttpRequest;
import work.lcod.components.trigger.HttpResponse;
import work.lcod.components.trigger.TimerConfig;

class ComponentRuntimeTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
    private final InMemoryEventSink sink = new InMemoryEventSink();
    private final ComponentRuntime runtime = new ComponentRuntime(ComponentTestSupport.configuration(clock), sink);

    @AfterEach
    void closeRuntime() {
        runtime.close();
    }

    private static ComponentDefinition webhook() {
        return ComponentDefinition.builder("webhook")
            .prop("http", InterfaceProp.http())
            .prop("db", ServiceProp.db())
            .prop("greeting", UserInputProp.of(PropType.STRING))
            .run((event, ctx) -> {
                if (event instanceof HttpEvent http) {
                    var db = ctx.db("db");
                    long hits = db.get("hits").map(value -> ((Number) value).longValue()).orElse(0L) + 1;
                    db.set("hits", hits);
                    if (!"/silent".equals(http.path())) {
                        ctx.http("http").respond(HttpResponse.of(200, Map.of("greeting", ctx.prop("greeting"), "hits", hits)));
                    }
                }
            })
            .build();
    }

    @Test
    void httpInvocationReturnsTheComponentResponse() {
        var instance = runtime.deploy(webhook(), Map.of("greeting", "hi"));
        assertNotNull(instance.endpointId());

        var response = runtime.handleHttp(instance.endpointId(), HttpRequest.get("/"));
        assertEquals(200, response.status());
        assertEquals(Map.of("greeting", "hi", "hits", 1L), response.body());
    }

    @Test
    void runWithoutRespondYieldsEmptySuccess() {
        var instance = runtime.deploy(webhook(), Map.of("greeting", "hi"));
        var response = runtime.handleHttp(instance.endpointId(), HttpRequest.get("/silent"));
        assertEquals(200, response.status());
        assertNull(response.body());
    }

    @Test
    void failingHttpRunYields500() {
        var definition = ComponentDefinition.builder("broken")
            .prop("http", InterfaceProp.http())
            .run((event, ctx) -> {
                throw new IllegalStateException("boom");
            })
            .build();
        var instance = runtime.deploy(definition, Map.of());
        assertEquals(500, runtime.handleHttp(instance.endpointId(), HttpRequest.get("/")).status());
    }

    @Test
    void respondOutsideHttpRunsIsRejected() {
        var definition = ComponentDefinition.builder("manual")
            .prop("http", InterfaceProp.http())
            .run((event, ctx) -> ctx.emit(ctx.http("http").endpoint()))
            .build();
        var instance = runtime.deploy(definition, Map.of());
        var result = runtime.invoke(instance.id(), null);
        assertEquals(instance.endpointId(), result.emitted().get(0).data());

        var responding = ComponentDefinition.builder("responding")
            .prop("http", InterfaceProp.http())
            .run((event, ctx) -> ctx.http("http").respond(HttpResponse.ok()))
            .build();
        var other = runtime.deploy(responding, Map.of());
        var failed = runtime.invoke(other.id(), null);
        assertFalse(failed.isSuccess());
        assertTrue(failed.error().contains("only available while handling an HTTP event"));
    }

    @Test
    void updateKeepsInstanceIdEndpointAndStore() {
        var instance = runtime.deploy(webhook(), Map.of("greeting", "hi"));
        runtime.handleHttp(instance.endpointId(), HttpRequest.get("/"));

        var updated = runtime.update(instance.id(), Map.of("greeting", "hello"));

        assertEquals(instance.id(), updated.id());
        assertEquals(instance.endpointId(), updated.endpointId());
        assertEquals(LifecycleState.DEACTIVATED, instance.state());
        assertEquals(LifecycleState.ACTIVE, updated.state());
        var response = runtime.handleHttp(instance.endpointId(), HttpRequest.get("/"));
        assertEquals(Map.of("greeting", "hello", "hits", 2L), response.body());
    }

    @Test
    void updateWithInvalidValuesKeepsTheRunningDeployment() {
        var instance = runtime.deploy(webhook(), Map.of("greeting", "hi"));
        assertThrows(PropResolutionException.class, () -> runtime.update(instance.id(), Map.of()));
        assertEquals(LifecycleState.ACTIVE, instance.state());
        assertEquals(200, runtime.handleHttp(instance.endpointId(), HttpRequest.get("/")).status());
    }

    @Test
    void undeployRemovesEndpointAndState() {
        var instance = runtime.deploy(webhook(), Map.of("greeting", "hi"));
        runtime.handleHttp(instance.endpointId(), HttpRequest.get("/"));
        runtime.undeploy(instance.id());

        assertEquals(404, runtime.handleHttp(instance.endpointId(), HttpRequest.get("/")).status());
        assertThrows(ComponentException.class, () -> runtime.instance(instance.id()));

        var redeployed = runtime.deploy(webhook(), Map.of("greeting", "hi"));
        assertNotEquals(instance.id(), redeployed.id());
        assertNotEquals(instance.endpointId(), redeployed.endpointId());
        var response = runtime.handleHttp(redeployed.endpointId(), HttpRequest.get("/"));
        assertEquals(Map.of("greeting", "hi", "hits", 1L), response.body());
    }

    @Test
    void namesAreSuffixedPerOwner() {
        var definition = ComponentDefinition.builder("job").run((event, ctx) -> {}).build();
        var first = runtime.deploy("alice", definition, Map.of());
        var second = runtime.deploy("alice", definition, Map.of());
        var third = runtime.deploy("alice", definition, Map.of());
        var other = runtime.deploy("bob", definition, Map.of());

        assertEquals("job", first.definition().name());
        assertEquals("job-1", second.definition().name());
        assertEquals("job-2", third.definition().name());
        assertEquals("job", other.definition().name());

        runtime.undeploy(second.id());
        assertEquals("job-1", runtime.deploy("alice", definition, Map.of()).definition().name());
    }

    @Test
    void failedActivationDoesNotDeploy() {
        var definition = ComponentDefinition.builder("grumpy")
            .prop("http", InterfaceProp.http())
            .onActivate(ctx -> {
                throw new IllegalStateException("no");
            })
            .run((event, ctx) -> {})
            .build();
        assertThrows(LifecycleTransitionException.class, () -> runtime.deploy(definition, Map.of()));
        assertTrue(runtime.instances().isEmpty());
        assertTrue(runtime.registry().names(ComponentRuntime.DEFAULT_OWNER).isEmpty());
    }

    @Test
    void invocationsOfOneInstanceNeverOverlap() throws Exception {
        var running = new AtomicInteger();
        var overlaps = new AtomicInteger();
        var definition = ComponentDefinition.builder("serial")
            .prop("http", InterfaceProp.http())
            .run((event, ctx) -> {
                if (running.incrementAndGet() > 1) {
                    overlaps.incrementAndGet();
                }
                Thread.sleep(20);
                running.decrementAndGet();
            })
            .build();
        var instance = runtime.deploy(definition, Map.of());

        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            var futures = new ArrayList<Future<?>>();
            for (int i = 0; i < 8; i++) {
                futures.add(callers.submit(() -> runtime.handleHttp(instance.endpointId(), HttpRequest.get("/"))));
                futures.add(callers.submit(() -> runtime.invoke(instance.id(), null)));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            callers.shutdownNow();
        }
        assertEquals(0, overlaps.get());
    }

    @Test
    void timerPropsAreScheduledAndCanBeFiredOnDemand() {
        var definition = ComponentDefinition.builder("ticker")
            .prop("timer", InterfaceProp.timer(TimerConfig.interval(3600)))
            .run((event, ctx) -> ctx.emit(event.toWire()))
            .build();
        var instance = runtime.deploy(definition, Map.of());
        assertTrue(runtime.isTimerScheduled(instance.id(), "timer"));

        var result = runtime.fireTimer(instance.id(), "timer");
        @SuppressWarnings("unchecked")
        var wire = (Map<String, Object>) result.emitted().get(0).data();
        assertEquals(clock.instant().getEpochSecond(), ((Number) wire.get("timestamp")).longValue());
        assertEquals(3600, ((Number) wire.get("interval_seconds")).intValue());

        runtime.undeploy(instance.id());
        assertFalse(runtime.isTimerScheduled(instance.id(), "timer"));
    }

    @Test
    void appPropsExposeAuthAndMethods() {
        Map<String, ComponentMethod> methods = Map.of(
            "whoami", (ctx, args) -> "user-of-" + ctx.app("github").auth().get("token")
        );
        var github = new AppProp("github", Map.of(), methods);
        var definition = ComponentDefinition.builder("app-user")
            .prop("github", github)
            .run((event, ctx) -> ctx.emit(ctx.app("github").call("whoami", Map.of())))
            .build();
        var instance = runtime.deploy(definition, Map.of("github", Map.of("token", "t0k")));
        assertEquals("user-of-t0k", runtime.invoke(instance.id(), null).emitted().get(0).data());
    }

    @Test
    void fileBackedStateSurvivesRuntimeRestarts(@TempDir Path stateDir) {
        var configuration = RuntimeConfiguration.builder().clock(clock).stateDirectory(stateDir).build();
        var definition = ComponentDefinition.builder("persistent")
            .prop("db", ServiceProp.db())
            .run((event, ctx) -> {
                var db = ctx.db("db");
                long runs = db.get("runs").map(value -> ((Number) value).longValue()).orElse(0L) + 1;
                db.set("runs", runs);
                ctx.emit(runs);
            })
            .build();

        try (var first = new ComponentRuntime(configuration, sink)) {
            first.deploy(ComponentRuntime.DEFAULT_OWNER, definition, Map.of(), "ci_stable");
            first.invoke("ci_stable", null);
        }
        try (var second = new ComponentRuntime(configuration, sink)) {
            second.deploy(ComponentRuntime.DEFAULT_OWNER, definition, Map.of(), "ci_stable");
            assertEquals(2, second.invoke("ci_stable", null).emitted().get(0).data());
            assertEquals(Optional.of(2), second.instance("ci_stable").store().get("runs"));
        }
        assertEquals(List.of(1, 2), sink.events().stream().map(EmittedEvent::data).toList());
    }

    @Test
    void unknownInstancesAreReported() {
        var error = assertThrows(ComponentException.class, () -> runtime.invoke("ci_missing", null));
        assertEquals("unknown_instance", error.code());
    }

    @Test
    void deactivateWaitsForTheRunInFlight() throws Exception {
        var started = new CountDownLatch(1);
        var finished = new AtomicInteger();
        var definition = ComponentDefinition.builder("slow")
            .prop("http", InterfaceProp.http())
            .run((event, ctx) -> {
                started.countDown();
                Thread.sleep(200);
                finished.incrementAndGet();
            })
            .build();
        var instance = runtime.deploy(definition, Map.of());
        var caller = Executors.newSingleThreadExecutor();
        try {
            caller.submit(() -> runtime.handleHttp(instance.endpointId(), HttpRequest.get("/")));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            runtime.undeploy(instance.id());
            assertEquals(1, finished.get());
        } finally {
            caller.shutdownNow();
        }
    }
}
