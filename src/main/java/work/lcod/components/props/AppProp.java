package work.lcod.components.props;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.components.definition.ComponentMethod;

/**
 * Connection to a third-party app. The resolved value is the credential map supplied from outside;
 * {@code propDefinitions} are reusable prop templates other props reference by name.
 */
public record AppProp(
    String appSlug,
    Map<String, PropSpec> propDefinitions,
    Map<String, ComponentMethod> methods
) implements PropSpec {
    public AppProp {
        Objects.requireNonNull(appSlug, "appSlug");
        propDefinitions = propDefinitions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(propDefinitions));
        methods = methods == null ? Map.of() : Map.copyOf(methods);
    }

    public static AppProp of(String appSlug) {
        return new AppProp(appSlug, Map.of(), Map.of());
    }

    @Override
    public String typeName() {
        return "app";
    }
}
