package work.lcod.components.props;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Values handed to an inherited prop's options provider: either a literal map or a function of
 * earlier props. The function sees only the props listed as dependencies, which must all be
 * declared before the referencing prop.
 */
public final class InputValues {
    private static final InputValues NONE = new InputValues(List.of(), resolved -> Map.of());

    private final List<String> dependencies;
    private final Function<Map<String, Object>, Map<String, Object>> function;

    private InputValues(List<String> dependencies, Function<Map<String, Object>, Map<String, Object>> function) {
        this.dependencies = List.copyOf(dependencies);
        this.function = function;
    }

    public static InputValues none() {
        return NONE;
    }

    public static InputValues literal(Map<String, Object> values) {
        var copy = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        return new InputValues(List.of(), resolved -> copy);
    }

    public static InputValues derived(List<String> dependencies, Function<Map<String, Object>, Map<String, Object>> function) {
        return new InputValues(dependencies, Objects.requireNonNull(function, "function"));
    }

    public List<String> dependencies() {
        return dependencies;
    }

    Map<String, Object> evaluate(Map<String, Object> resolvedDependencies) {
        Map<String, Object> values = function.apply(resolvedDependencies);
        return values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
