package work.lcod.components.props;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolved props in declaration order.
 */
public final class ResolvedProps {
    private final Map<String, ResolvedProp> props;

    ResolvedProps(Map<String, ResolvedProp> props) {
        this.props = Collections.unmodifiableMap(new LinkedHashMap<>(props));
    }

    public static ResolvedProps empty() {
        return new ResolvedProps(Map.of());
    }

    public Map<String, ResolvedProp> all() {
        return props;
    }

    public ResolvedProp get(String name) {
        return props.get(name);
    }

    public boolean contains(String name) {
        return props.containsKey(name);
    }

    public Object value(String name) {
        var prop = props.get(name);
        return prop == null ? null : prop.value();
    }

    /**
     * Values of user-input props only.
     */
    public Map<String, Object> userValues() {
        var values = new LinkedHashMap<String, Object>();
        props.forEach((name, prop) -> {
            if (prop.isUserInput()) {
                values.put(name, prop.value());
            }
        });
        return Collections.unmodifiableMap(values);
    }
}
