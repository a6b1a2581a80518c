package work.lcod.components.props;

import java.util.Map;

/**
 * Outcome of resolving one prop. {@code spec} is the effective spec (inherited definitions
 * already merged); {@code value} is the user value, the timer schedule, or the app credentials,
 * and {@code null} for HTTP and store props.
 */
public record ResolvedProp(String name, PropSpec spec, Object value, Map<String, Object> inputValues) {
    public ResolvedProp {
        inputValues = inputValues == null ? Map.of() : inputValues;
    }

    public boolean isUserInput() {
        return spec instanceof UserInputProp;
    }
}
