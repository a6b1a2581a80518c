package work.lcod.components.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.components.api.ComponentException;
import work.lcod.components.api.RuntimeConfiguration;
import work.lcod.components.definition.ComponentDefinition;
import work.lcod.components.definition.ComponentRegistry;
import work.lcod.components.props.InterfaceProp;
import work.lcod.components.props.OptionsPage;
import work.lcod.components.props.PropResolver;
import work.lcod.components.props.ResolvedProp;
import work.lcod.components.props.ResolvedProps;
import work.lcod.components.shared.NamedThreadFactory;
import work.lcod.components.store.FileStateBackend;
import work.lcod.components.store.InMemoryStateBackend;
import work.lcod.components.store.StateBackend;
import work.lcod.components.trigger.HttpDispatcher;
import work.lcod.components.trigger.HttpRequest;
import work.lcod.components.trigger.HttpResponse;
import work.lcod.components.trigger.InvocationEvent;
import work.lcod.components.trigger.ManualEvent;
import work.lcod.components.trigger.TimerConfig;
import work.lcod.components.trigger.TimerEvent;
import work.lcod.components.trigger.TimerSchedule;
import work.lcod.components.trigger.TimerScheduler;

/**
 * Hosts deployed instances and wires their interface props to triggers. Every deployment owns a
 * single-thread queue; timer fires, HTTP requests and manual invocations of one instance are
 * executed on it in arrival order.
 */
public final class ComponentRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ComponentRuntime.class);

    public static final String DEFAULT_OWNER = "default";

    private final RuntimeConfiguration configuration;
    private final EventSink sink;
    private final StateBackend backend;
    private final PropResolver resolver = new PropResolver();
    private final ComponentRegistry registry = new ComponentRegistry();
    private final TimerScheduler timers;
    private final HttpDispatcher http;
    private final Map<String, Deployment> deployments = new ConcurrentHashMap<>();

    public ComponentRuntime(RuntimeConfiguration configuration, EventSink sink) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.backend = configuration.stateDirectory()
            .<StateBackend>map(FileStateBackend::new)
            .orElseGet(InMemoryStateBackend::new);
        this.timers = new TimerScheduler(configuration.clock());
        this.http = new HttpDispatcher(configuration.httpTimeout());
    }

    /**
     * Resolves props and builds an instance in {@code CREATED} state without wiring any trigger.
     * The caller drives its lifecycle.
     */
    public ComponentInstance create(ComponentDefinition definition, Map<String, Object> values) {
        return newInstance(newInstanceId(), definition, values);
    }

    public ComponentInstance deploy(ComponentDefinition definition, Map<String, Object> values) {
        return deploy(DEFAULT_OWNER, definition, values);
    }

    public ComponentInstance deploy(String owner, ComponentDefinition definition, Map<String, Object> values) {
        return deploy(owner, definition, values, newInstanceId());
    }

    /**
     * Registers, resolves, activates and wires a new instance. A stable {@code instanceId} lets a
     * file-backed store survive restarts.
     */
    public synchronized ComponentInstance deploy(
        String owner,
        ComponentDefinition definition,
        Map<String, Object> values,
        String instanceId
    ) {
        Objects.requireNonNull(instanceId, "instanceId");
        if (deployments.containsKey(instanceId)) {
            throw new ComponentException("duplicate_instance", "Instance already deployed: " + instanceId);
        }
        ComponentDefinition named = registry.register(owner, definition);
        try {
            ComponentInstance instance = newInstance(instanceId, named, values);
            String endpointId = declaresHttp(instance.props()) ? HttpDispatcher.newEndpointId() : null;
            start(new Deployment(owner, instance, endpointId));
            log.info("Deployed {} as {}", named.name(), instanceId);
            return instance;
        } catch (RuntimeException ex) {
            registry.release(owner, named.name());
            throw ex;
        }
    }

    /**
     * Replaces the props of a deployed instance. The old configuration is deactivated and a new one
     * activated under the same instance id, endpoint and store. When the new values do not resolve,
     * the running deployment is left as it was.
     */
    public synchronized ComponentInstance update(String instanceId, Map<String, Object> values) {
        Deployment current = require(instanceId);
        ComponentInstance fresh = newInstance(instanceId, current.instance.definition(), values);
        detach(current);
        try {
            current.instance.deactivate();
        } catch (RuntimeException ex) {
            attach(current);
            throw ex;
        }
        current.executor.shutdown();
        var next = new Deployment(current.owner, fresh, current.endpointId);
        try {
            start(next);
        } catch (RuntimeException ex) {
            deployments.remove(instanceId);
            registry.release(current.owner, fresh.definition().name());
            log.error("Redeploy of {} failed; instance removed", instanceId, ex);
            throw ex;
        }
        log.info("Redeployed {} ({})", instanceId, fresh.definition().name());
        return fresh;
    }

    /**
     * Deactivates an instance, removes its triggers, and drops its persisted state.
     */
    public synchronized void undeploy(String instanceId) {
        Deployment deployment = require(instanceId);
        detach(deployment);
        try {
            deployment.instance.deactivate();
        } catch (RuntimeException ex) {
            attach(deployment);
            throw ex;
        }
        deployment.executor.shutdown();
        deployments.remove(instanceId);
        registry.release(deployment.owner, deployment.instance.definition().name());
        backend.drop(instanceId);
        log.info("Undeployed {}", instanceId);
    }

    /**
     * Runs a manual invocation and waits for its result.
     */
    public InvocationResult invoke(String instanceId, Object payload) {
        return await(enqueue(require(instanceId), new ManualEvent(payload)));
    }

    /**
     * Fires a timer prop immediately, outside its schedule.
     */
    public InvocationResult fireTimer(String instanceId, String propName) {
        Deployment deployment = require(instanceId);
        ResolvedProp prop = deployment.instance.props().get(propName);
        if (prop == null || !(prop.value() instanceof TimerConfig config)) {
            throw new ComponentException("unknown_timer", "Instance " + instanceId + " has no timer prop '" + propName + "'");
        }
        var event = TimerEvent.of(configuration.clock().instant().getEpochSecond(), config);
        return await(enqueue(deployment, event));
    }

    public HttpResponse handleHttp(String endpointId, HttpRequest request) {
        return http.dispatch(endpointId, request);
    }

    public HttpDispatcher httpDispatcher() {
        return http;
    }

    public ComponentInstance instance(String instanceId) {
        return require(instanceId).instance;
    }

    public List<ComponentInstance> instances() {
        var instances = new ArrayList<ComponentInstance>();
        deployments.values().forEach(deployment -> instances.add(deployment.instance));
        return instances;
    }

    public ComponentRegistry registry() {
        return registry;
    }

    public boolean isTimerScheduled(String instanceId, String propName) {
        return timers.isScheduled(timerKey(instanceId, propName));
    }

    public OptionsPage fetchOptionsPage(
        ComponentDefinition definition,
        String propName,
        int page,
        String prevContext,
        Map<String, Object> values
    ) {
        return resolver.fetchOptionsPage(definition.props(), propName, page, prevContext, values);
    }

    /**
     * Stops every trigger and deactivates every instance. Persisted state is kept.
     */
    @Override
    public synchronized void close() {
        for (Deployment deployment : List.copyOf(deployments.values())) {
            detach(deployment);
            try {
                deployment.instance.deactivate();
            } catch (RuntimeException ex) {
                log.warn("Deactivation of {} failed during shutdown: {}", deployment.instance.id(), ex.getMessage());
            }
            deployment.executor.shutdown();
            registry.release(deployment.owner, deployment.instance.definition().name());
        }
        deployments.clear();
        timers.close();
    }

    private ComponentInstance newInstance(String instanceId, ComponentDefinition definition, Map<String, Object> values) {
        ResolvedProps props = resolver.resolve(definition.props(), values);
        return new ComponentInstance(instanceId, definition, props, backend, sink, configuration.clock());
    }

    private void start(Deployment deployment) {
        deployment.instance.bindEndpoint(deployment.endpointId);
        try {
            deployment.instance.activate();
        } catch (RuntimeException ex) {
            deployment.executor.shutdownNow();
            throw ex;
        }
        deployments.put(deployment.instance.id(), deployment);
        attach(deployment);
    }

    private void attach(Deployment deployment) {
        var instance = deployment.instance;
        for (ResolvedProp prop : instance.props().all().values()) {
            if (prop.spec() instanceof InterfaceProp iface && iface.kind() == InterfaceProp.Kind.TIMER) {
                var schedule = new TimerSchedule(
                    (TimerConfig) prop.value(),
                    configuration.clock().instant(),
                    configuration.clock().getZone()
                );
                timers.schedule(timerKey(instance.id(), prop.name()), schedule, event -> enqueue(deployment, event));
            }
        }
        if (deployment.endpointId != null) {
            http.register(deployment.endpointId, event -> enqueue(deployment, event).thenApply(result -> {
                if (!result.isSuccess()) {
                    throw new CompletionException(new ComponentException("invocation_failed", result.error()));
                }
                return result;
            }));
        }
    }

    private void detach(Deployment deployment) {
        for (String propName : deployment.instance.props().all().keySet()) {
            timers.cancel(timerKey(deployment.instance.id(), propName));
        }
        http.unregister(deployment.endpointId);
    }

    private CompletableFuture<InvocationResult> enqueue(Deployment deployment, InvocationEvent event) {
        try {
            return CompletableFuture.supplyAsync(() -> deployment.instance.run(event), deployment.executor);
        } catch (RejectedExecutionException ex) {
            return CompletableFuture.failedFuture(
                new InvalidLifecycleStateException(deployment.instance.id(), deployment.instance.state(), "run"));
        }
    }

    private static InvocationResult await(CompletableFuture<InvocationResult> future) {
        try {
            return future.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        }
    }

    private Deployment require(String instanceId) {
        Deployment deployment = instanceId == null ? null : deployments.get(instanceId);
        if (deployment == null) {
            throw new ComponentException("unknown_instance", "No deployed instance " + instanceId);
        }
        return deployment;
    }

    private static boolean declaresHttp(ResolvedProps props) {
        return props.all().values().stream()
            .anyMatch(prop -> prop.spec() instanceof InterfaceProp iface && iface.kind() == InterfaceProp.Kind.HTTP);
    }

    private static String timerKey(String instanceId, String propName) {
        return instanceId + "/" + propName;
    }

    private static String newInstanceId() {
        return "ci_" + UUID.randomUUID().toString().replace("-", "");
    }

    private static final class Deployment {
        private final String owner;
        private final ComponentInstance instance;
        private final String endpointId;
        private final ExecutorService executor;

        private Deployment(String owner, ComponentInstance instance, String endpointId) {
            this.owner = owner;
            this.instance = instance;
            this.endpointId = endpointId;
            this.executor = Executors.newSingleThreadExecutor(new NamedThreadFactory("lcod-instance-" + instance.id() + "-"));
        }
    }
}
