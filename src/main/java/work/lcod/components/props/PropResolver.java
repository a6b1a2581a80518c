package work.lcod.components.props;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.components.trigger.TimerConfig;

/**
 * Resolves a prop schema against supplied values, in declaration order.
 *
 * <p>Schema checks (defaults on required props, dangling prop definition references, input values
 * depending on props declared later) run before any value is looked at or any provider is called.
 * Dynamic options are never evaluated by {@link #resolve}; they are pulled page by page through
 * {@link #fetchOptionsPage}.
 */
public final class PropResolver {
    private static final Logger log = LoggerFactory.getLogger(PropResolver.class);

    public ResolvedProps resolve(Map<String, PropSpec> schema, Map<String, Object> supplied) {
        validateSchema(schema);
        return resolvePrefix(schema, supplied == null ? Map.of() : supplied, null, false);
    }

    /**
     * Fetches one page of options for {@code propName}. Props declared before it are resolved
     * leniently (missing values become {@code null}) so input values can be computed while the
     * configuration is still incomplete.
     */
    public OptionsPage fetchOptionsPage(
        Map<String, PropSpec> schema,
        String propName,
        int page,
        String prevContext,
        Map<String, Object> supplied
    ) {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        validateSchema(schema);
        PropSpec spec = schema.get(propName);
        if (spec == null) {
            throw new PropResolutionException(propName, "Unknown prop '" + propName + "'");
        }
        var values = supplied == null ? Map.<String, Object>of() : supplied;
        ResolvedProps earlier = resolvePrefix(schema, values, propName, true);
        UserInputProp effective;
        Map<String, Object> inputValues = Map.of();
        if (spec instanceof UserInputProp userInput) {
            effective = userInput;
        } else if (spec instanceof PropDefinitionRef ref) {
            effective = inherited(propName, ref, schema);
            inputValues = evaluateInputValues(propName, ref, earlier.all());
        } else {
            throw new PropResolutionException(propName, "Prop '" + propName + "' (" + spec.typeName() + ") has no options");
        }

        if (effective.optionsProvider() != null) {
            OptionsPage result;
            try {
                result = effective.optionsProvider().options(new OptionsQuery(page, prevContext, inputValues));
            } catch (Exception ex) {
                throw new OptionsProviderException("Options provider of '" + propName + "' failed: " + ex.getMessage(), ex);
            }
            if (result == null) {
                throw new OptionsProviderException("Options provider of '" + propName + "' returned no page", null);
            }
            log.debug("Fetched {} options for '{}' page {}", result.options().size(), propName, page);
            return result;
        }
        if (effective.staticOptions() != null && page == 0) {
            return OptionsPage.last(effective.staticOptions());
        }
        return OptionsPage.empty();
    }

    /**
     * Static definition checks; throws on the first error found.
     */
    public void validateSchema(Map<String, PropSpec> schema) {
        if (schema == null) {
            throw new PropResolutionException(null, "Prop schema must not be null");
        }
        Set<String> declared = new HashSet<>();
        for (var entry : schema.entrySet()) {
            String name = entry.getKey();
            PropSpec spec = entry.getValue();
            if (spec == null) {
                throw new PropResolutionException(name, "Prop '" + name + "' has no definition");
            }
            if (spec instanceof UserInputProp userInput) {
                checkDefault(name, userInput);
            } else if (spec instanceof PropDefinitionRef ref) {
                checkDefault(name, inherited(name, ref, schema));
                for (String dependency : ref.inputValues().dependencies()) {
                    if (declared.contains(dependency)) {
                        continue;
                    }
                    if (schema.containsKey(dependency)) {
                        throw new PropResolutionException(name,
                            "Input values of '" + name + "' reference '" + dependency + "', which is not declared before it");
                    }
                    throw new PropResolutionException(name,
                        "Input values of '" + name + "' reference unknown prop '" + dependency + "'");
                }
            }
            declared.add(name);
        }
    }

    private ResolvedProps resolvePrefix(
        Map<String, PropSpec> schema,
        Map<String, Object> supplied,
        String stopBefore,
        boolean lenient
    ) {
        var resolved = new LinkedHashMap<String, ResolvedProp>();
        for (var entry : schema.entrySet()) {
            String name = entry.getKey();
            if (name.equals(stopBefore)) {
                break;
            }
            resolved.put(name, resolveOne(name, entry.getValue(), schema, supplied, resolved, lenient));
        }
        return new ResolvedProps(resolved);
    }

    private ResolvedProp resolveOne(
        String name,
        PropSpec spec,
        Map<String, PropSpec> schema,
        Map<String, Object> supplied,
        Map<String, ResolvedProp> resolved,
        boolean lenient
    ) {
        if (spec instanceof UserInputProp userInput) {
            return new ResolvedProp(name, userInput, userValue(name, userInput, supplied, lenient), Map.of());
        }
        if (spec instanceof PropDefinitionRef ref) {
            UserInputProp effective = inherited(name, ref, schema);
            Map<String, Object> inputValues = evaluateInputValues(name, ref, resolved);
            return new ResolvedProp(name, effective, userValue(name, effective, supplied, lenient), inputValues);
        }
        if (spec instanceof InterfaceProp iface) {
            if (iface.kind() == InterfaceProp.Kind.HTTP) {
                return new ResolvedProp(name, iface, null, Map.of());
            }
            return new ResolvedProp(name, iface, timerValue(name, iface, supplied, lenient), Map.of());
        }
        if (spec instanceof ServiceProp service) {
            return new ResolvedProp(name, service, null, Map.of());
        }
        if (spec instanceof AppProp app) {
            return new ResolvedProp(name, app, credentials(name, app, supplied, lenient), Map.of());
        }
        throw new PropResolutionException(name, "Unsupported prop kind: " + spec.getClass().getSimpleName());
    }

    private static Object userValue(String name, UserInputProp spec, Map<String, Object> supplied, boolean lenient) {
        Object value = supplied.get(name);
        if (value != null) {
            if (!spec.type().accepts(value)) {
                throw new PropResolutionException(name,
                    "Prop '" + name + "' expects " + spec.type().wireName() + ", got " + value.getClass().getSimpleName());
            }
            return value;
        }
        if (spec.hasDefault()) {
            return spec.defaultValue();
        }
        if (spec.optional() || lenient) {
            return null;
        }
        throw new PropResolutionException(name, "Missing value for required prop '" + name + "'");
    }

    private static TimerConfig timerValue(String name, InterfaceProp spec, Map<String, Object> supplied, boolean lenient) {
        Object value = supplied.get(name);
        if (value == null) {
            if (spec.defaultTimer() != null || lenient) {
                return spec.defaultTimer();
            }
            throw new PropResolutionException(name, "Timer prop '" + name + "' needs intervalSeconds or cron");
        }
        try {
            return TimerConfig.from(value);
        } catch (IllegalArgumentException ex) {
            throw new PropResolutionException(name, "Invalid timer for '" + name + "': " + ex.getMessage(), ex);
        }
    }

    private static Map<String, Object> credentials(String name, AppProp spec, Map<String, Object> supplied, boolean lenient) {
        Object value = supplied.get(name);
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            map.forEach((key, item) -> copy.put(String.valueOf(key), item));
            return Collections.unmodifiableMap(copy);
        }
        if (value == null && lenient) {
            return Map.of();
        }
        throw new PropResolutionException(name, "App prop '" + name + "' (" + spec.appSlug() + ") needs a credentials object");
    }

    private static UserInputProp inherited(String name, PropDefinitionRef ref, Map<String, PropSpec> schema) {
        if (!(schema.get(ref.app()) instanceof AppProp app)) {
            throw new PropResolutionException(name, "Prop '" + name + "' references unknown app prop '" + ref.app() + "'");
        }
        PropSpec base = app.propDefinitions().get(ref.propDefinitionName());
        if (base == null) {
            throw new PropResolutionException(name,
                "App '" + app.appSlug() + "' has no prop definition '" + ref.propDefinitionName() + "'");
        }
        if (!(base instanceof UserInputProp userInput)) {
            throw new PropResolutionException(name,
                "Prop definition '" + ref.propDefinitionName() + "' of app '" + app.appSlug() + "' is not a user-input prop");
        }
        return userInput.merge(ref.overrides());
    }

    private static Map<String, Object> evaluateInputValues(String name, PropDefinitionRef ref, Map<String, ResolvedProp> resolved) {
        var visible = new LinkedHashMap<String, Object>();
        for (String dependency : ref.inputValues().dependencies()) {
            var prop = resolved.get(dependency);
            if (prop == null) {
                throw new PropResolutionException(name, "Input values of '" + name + "' need unresolved prop '" + dependency + "'");
            }
            visible.put(dependency, prop.value());
        }
        try {
            return ref.inputValues().evaluate(Collections.unmodifiableMap(visible));
        } catch (RuntimeException ex) {
            throw new PropResolutionException(name, "Input values of '" + name + "' failed: " + ex.getMessage(), ex);
        }
    }

    private static void checkDefault(String name, UserInputProp spec) {
        if (spec.hasDefault() && !spec.optional()) {
            throw new PropResolutionException(name, "Prop '" + name + "' declares a default but is not optional");
        }
    }
}
