package work.lcod.components.runtime;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.components.definition.ComponentDefinition;
import work.lcod.components.definition.ComponentHook;
import work.lcod.components.dedupe.DedupeEngine;
import work.lcod.components.dedupe.DedupeState;
import work.lcod.components.dedupe.DedupeStrategy;
import work.lcod.components.props.ResolvedProps;
import work.lcod.components.store.InstanceStateStore;
import work.lcod.components.store.StateBackend;
import work.lcod.components.store.StateStore;
import work.lcod.components.trigger.HttpEvent;
import work.lcod.components.trigger.InvocationEvent;

/**
 * One configured component. Invocations are serialized through a fair lock, so they run one at a
 * time in arrival order; deactivation waits for the run in flight.
 *
 * <p>A successful run commits its dedupe state once and then hands accepted events to the sink.
 * A failed run delivers nothing and leaves the dedupe state untouched; store writes it made before
 * failing are kept.
 */
public final class ComponentInstance {
    private static final Logger log = LoggerFactory.getLogger(ComponentInstance.class);

    static final String STORE_NAMESPACE = "store";
    static final String DEDUPE_NAMESPACE = "dedupe";
    static final String DEDUPE_KEY = "state";

    private final String id;
    private final ComponentDefinition definition;
    private final ResolvedProps props;
    private final InstanceStateStore store;
    private final InstanceStateStore dedupeStore;
    private final DedupeEngine dedupe;
    private final EventSink sink;
    private final Clock clock;
    private final ReentrantLock invocationLock = new ReentrantLock(true);
    private final Object lifecycle = new Object();
    private volatile LifecycleState state = LifecycleState.CREATED;
    private volatile String endpointId;

    ComponentInstance(
        String id,
        ComponentDefinition definition,
        ResolvedProps props,
        StateBackend backend,
        EventSink sink,
        Clock clock
    ) {
        this.id = id;
        this.definition = definition;
        this.props = props;
        this.store = new InstanceStateStore(id, STORE_NAMESPACE, backend);
        this.dedupeStore = new InstanceStateStore(id, DEDUPE_NAMESPACE, backend);
        this.dedupe = new DedupeEngine(definition.dedupe());
        this.sink = sink;
        this.clock = clock;
    }

    public String id() {
        return id;
    }

    public ComponentDefinition definition() {
        return definition;
    }

    public ResolvedProps props() {
        return props;
    }

    public LifecycleState state() {
        return state;
    }

    /**
     * Endpoint routed to this instance, or {@code null} when it declares no HTTP prop.
     */
    public String endpointId() {
        return endpointId;
    }

    public StateStore store() {
        return store;
    }

    void bindEndpoint(String endpointId) {
        this.endpointId = endpointId;
    }

    public void activate() {
        synchronized (lifecycle) {
            if (state != LifecycleState.CREATED) {
                throw new InvalidLifecycleStateException(id, state, "activate");
            }
            runHook("activate", definition.activate());
            state = LifecycleState.ACTIVE;
        }
        log.info("Activated {} ({})", id, definition.name());
    }

    public void deactivate() {
        synchronized (lifecycle) {
            if (state != LifecycleState.ACTIVE) {
                throw new InvalidLifecycleStateException(id, state, "deactivate");
            }
            invocationLock.lock();
            try {
                runHook("deactivate", definition.deactivate());
                state = LifecycleState.DEACTIVATED;
            } finally {
                invocationLock.unlock();
            }
        }
        log.info("Deactivated {} ({})", id, definition.name());
    }

    public InvocationResult run(InvocationEvent event) {
        if (state != LifecycleState.ACTIVE) {
            throw rejected();
        }
        invocationLock.lock();
        try {
            if (state != LifecycleState.ACTIVE) {
                throw rejected();
            }
            return invoke(event);
        } finally {
            invocationLock.unlock();
        }
    }

    private InvocationResult invoke(InvocationEvent event) {
        Instant started = clock.instant();
        log.debug("Invoking {} with {} event", id, event.type());
        DedupeState dedupeState = loadDedupeState();
        var emitter = new EventEmitter(definition.dedupe());
        var context = new ExecutionContext(this, event, emitter);
        try {
            definition.run().run(event, context);
        } catch (Exception ex) {
            log.error("Invocation of {} ({}) failed", id, event.type(), ex);
            return InvocationResult.failure(id, event.type(), List.of(), emitter.rejections(), message(ex), started, clock.instant());
        }

        var drain = emitter.drain(dedupe, dedupeState);
        if (drain.dropped() > 0) {
            log.debug("Dedupe ({}) dropped {} of {} events for {}",
                definition.dedupe().wireName(), drain.dropped(), drain.dropped() + drain.accepted().size(), id);
        }

        Instant emittedAt = clock.instant();
        var delivered = new ArrayList<EmittedEvent>(drain.accepted().size());
        for (EventEmitter.Pending pending : drain.accepted()) {
            var metadata = pending.metadata();
            var emitted = new EmittedEvent(id, definition.name(), pending.data(), metadata.id(), metadata.summary(), metadata.ts(), emittedAt);
            try {
                sink.accept(emitted);
            } catch (RuntimeException ex) {
                log.error("Event sink rejected event {} of {}", metadata.id(), id, ex);
                return InvocationResult.failure(id, event.type(), delivered, emitter.rejections(), "Event sink failed: " + message(ex), started, clock.instant());
            }
            delivered.add(emitted);
        }
        // only once every accepted event reached the sink
        if (definition.dedupe() != DedupeStrategy.NONE) {
            dedupeStore.set(DEDUPE_KEY, drain.state().toMap());
        }

        if (event instanceof HttpEvent http && http.responseChannel().isExpired()) {
            return InvocationResult.failure(id, event.type(), delivered, emitter.rejections(), "HTTP response timed out", started, clock.instant());
        }
        return InvocationResult.success(id, event.type(), delivered, drain.dropped(), emitter.rejections(), started, clock.instant());
    }

    private DedupeState loadDedupeState() {
        if (definition.dedupe() == DedupeStrategy.NONE) {
            return DedupeState.empty(DedupeStrategy.NONE);
        }
        return dedupeStore.get(DEDUPE_KEY)
            .filter(Map.class::isInstance)
            .map(stored -> DedupeState.fromMap(definition.dedupe(), (Map<?, ?>) stored))
            .orElseGet(() -> DedupeState.empty(definition.dedupe()));
    }

    private void runHook(String phase, ComponentHook hook) {
        if (hook == null) {
            return;
        }
        try {
            hook.handle(new ExecutionContext(this, null, null));
        } catch (Exception ex) {
            log.error("{} hook of {} failed", phase, id, ex);
            throw new LifecycleTransitionException(id, phase, ex);
        }
    }

    private InvalidLifecycleStateException rejected() {
        var error = new InvalidLifecycleStateException(id, state, "run");
        log.warn("Rejected invocation: {}", error.getMessage());
        return error;
    }

    private static String message(Throwable error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
