package work.lcod.components.definition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.components.dedupe.DedupeStrategy;
import work.lcod.components.props.PropSpec;

/**
 * Everything needed to instantiate a component: metadata, prop schema (in declaration order),
 * methods, optional lifecycle hooks, dedupe strategy and the run handler.
 */
public final class ComponentDefinition {
    private final String name;
    private final String version;
    private final String description;
    private final Map<String, PropSpec> props;
    private final Map<String, ComponentMethod> methods;
    private final ComponentHook activate;
    private final ComponentHook deactivate;
    private final DedupeStrategy dedupe;
    private final RunHandler run;

    private ComponentDefinition(Builder builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new IllegalArgumentException("Component name is required");
        }
        this.name = builder.name.trim();
        this.version = builder.version == null ? "0.0.1" : builder.version;
        this.description = builder.description;
        this.props = Collections.unmodifiableMap(new LinkedHashMap<>(builder.props));
        this.methods = Map.copyOf(builder.methods);
        this.activate = builder.activate;
        this.deactivate = builder.deactivate;
        this.dedupe = builder.dedupe == null ? DedupeStrategy.NONE : builder.dedupe;
        this.run = Objects.requireNonNull(builder.run, "Component '" + this.name + "' has no run handler");
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    /**
     * Builder pre-filled with the callables of {@code handler}.
     */
    public static Builder fromHandler(String name, ComponentHandler handler) {
        var builder = builder(name)
            .run(handler::run)
            .onActivate(handler::activate)
            .onDeactivate(handler::deactivate);
        handler.methods().forEach(builder::method);
        return builder;
    }

    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    public String description() {
        return description;
    }

    public Map<String, PropSpec> props() {
        return props;
    }

    public Map<String, ComponentMethod> methods() {
        return methods;
    }

    public ComponentHook activate() {
        return activate;
    }

    public ComponentHook deactivate() {
        return deactivate;
    }

    public DedupeStrategy dedupe() {
        return dedupe;
    }

    public RunHandler run() {
        return run;
    }

    public ComponentDefinition withName(String newName) {
        return toBuilder().name(newName).build();
    }

    public Builder toBuilder() {
        var builder = new Builder()
            .name(name)
            .version(version)
            .description(description)
            .dedupe(dedupe)
            .onActivate(activate)
            .onDeactivate(deactivate)
            .run(run);
        props.forEach(builder::prop);
        methods.forEach(builder::method);
        return builder;
    }

    public static final class Builder {
        private String name;
        private String version;
        private String description;
        private final Map<String, PropSpec> props = new LinkedHashMap<>();
        private final Map<String, ComponentMethod> methods = new LinkedHashMap<>();
        private ComponentHook activate;
        private ComponentHook deactivate;
        private DedupeStrategy dedupe;
        private RunHandler run;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder prop(String propName, PropSpec spec) {
            props.put(Objects.requireNonNull(propName, "propName"), spec);
            return this;
        }

        public Builder method(String methodName, ComponentMethod method) {
            methods.put(Objects.requireNonNull(methodName, "methodName"), Objects.requireNonNull(method, "method"));
            return this;
        }

        public Builder onActivate(ComponentHook hook) {
            this.activate = hook;
            return this;
        }

        public Builder onDeactivate(ComponentHook hook) {
            this.deactivate = hook;
            return this;
        }

        public Builder dedupe(DedupeStrategy dedupe) {
            this.dedupe = dedupe;
            return this;
        }

        public Builder run(RunHandler run) {
            this.run = run;
            return this;
        }

        public ComponentDefinition build() {
            return new ComponentDefinition(this);
        }
    }
}
