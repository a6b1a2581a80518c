package work.lcod.components.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.components.api.ComponentException;
import work.lcod.components.definition.ComponentMethod;
import work.lcod.components.props.AppProp;
import work.lcod.components.props.InterfaceProp;
import work.lcod.components.props.PropResolutionException;
import work.lcod.components.props.ResolvedProp;
import work.lcod.components.props.ServiceProp;
import work.lcod.components.store.StateStore;
import work.lcod.components.trigger.HttpEvent;
import work.lcod.components.trigger.InvocationEvent;
import work.lcod.components.trigger.TimerConfig;

/**
 * Everything a component sees while one of its handlers runs: resolved props, capabilities of
 * interface, service and app props, the instance store and {@code emit}.
 *
 * <p>Contexts created for lifecycle hooks have no event and cannot emit.
 */
public final class ExecutionContext {
    private final ComponentInstance instance;
    private final InvocationEvent event;
    private final EventEmitter emitter;

    ExecutionContext(ComponentInstance instance, InvocationEvent event, EventEmitter emitter) {
        this.instance = Objects.requireNonNull(instance, "instance");
        this.event = event;
        this.emitter = emitter;
    }

    public String instanceId() {
        return instance.id();
    }

    public String componentName() {
        return instance.definition().name();
    }

    /**
     * The triggering event; {@code null} inside activate and deactivate hooks.
     */
    public InvocationEvent event() {
        return event;
    }

    public Map<String, Object> props() {
        return instance.props().userValues();
    }

    public Object prop(String name) {
        ResolvedProp prop = require(name);
        if (!prop.isUserInput()) {
            throw new PropResolutionException(name, "Prop '" + name + "' is a " + prop.spec().typeName() + " prop; use its accessor");
        }
        return prop.value();
    }

    public TimerCapability timer(String name) {
        ResolvedProp prop = require(name);
        if (!(prop.spec() instanceof InterfaceProp iface) || iface.kind() != InterfaceProp.Kind.TIMER) {
            throw wrongKind(name, "timer");
        }
        return new TimerCapability(name, (TimerConfig) prop.value());
    }

    public HttpCapability http(String name) {
        ResolvedProp prop = require(name);
        if (!(prop.spec() instanceof InterfaceProp iface) || iface.kind() != InterfaceProp.Kind.HTTP) {
            throw wrongKind(name, "http");
        }
        var channel = event instanceof HttpEvent http ? http.responseChannel() : null;
        return new HttpCapability(name, instance.endpointId(), channel);
    }

    public StateStore db(String name) {
        ResolvedProp prop = require(name);
        if (!(prop.spec() instanceof ServiceProp)) {
            throw wrongKind(name, "db");
        }
        return instance.store();
    }

    @SuppressWarnings("unchecked")
    public AppCapability app(String name) {
        ResolvedProp prop = require(name);
        if (!(prop.spec() instanceof AppProp app)) {
            throw wrongKind(name, "app");
        }
        var auth = Collections.unmodifiableMap(new LinkedHashMap<>((Map<String, Object>) prop.value()));
        return new AppCapability(name, app.appSlug(), auth, app.methods(), this);
    }

    public void emit(Object data) {
        emit(data, EmitMetadata.none());
    }

    public void emit(Object data, EmitMetadata metadata) {
        if (emitter == null) {
            throw new IllegalStateException("emit is unavailable in this context");
        }
        emitter.emit(data, metadata);
    }

    /**
     * Invokes one of the component's own methods with this context.
     */
    public Object call(String method, Map<String, Object> args) throws Exception {
        ComponentMethod target = instance.definition().methods().get(method);
        if (target == null) {
            throw new ComponentException("unknown_method", "Component '" + componentName() + "' has no method '" + method + "'");
        }
        return target.invoke(this, args == null ? Map.of() : args);
    }

    private ResolvedProp require(String name) {
        ResolvedProp prop = instance.props().get(name);
        if (prop == null) {
            throw new PropResolutionException(name, "Unknown prop '" + name + "'");
        }
        return prop;
    }

    private static PropResolutionException wrongKind(String name, String expected) {
        return new PropResolutionException(name, "Prop '" + name + "' is not a " + expected + " prop");
    }
}
