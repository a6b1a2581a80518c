package work.lcod.components.props;

import java.util.Objects;

/**
 * Prop inherited from the {@code propDefinitions} of the app prop named {@code app}, with local
 * overrides and optional input values for its options provider.
 */
public record PropDefinitionRef(
    String app,
    String propDefinitionName,
    InputValues inputValues,
    PropOverrides overrides
) implements PropSpec {
    public PropDefinitionRef {
        Objects.requireNonNull(app, "app");
        Objects.requireNonNull(propDefinitionName, "propDefinitionName");
        inputValues = inputValues == null ? InputValues.none() : inputValues;
        overrides = overrides == null ? PropOverrides.none() : overrides;
    }

    public static PropDefinitionRef of(String app, String propDefinitionName) {
        return new PropDefinitionRef(app, propDefinitionName, null, null);
    }

    @Override
    public String typeName() {
        return "propDefinition";
    }
}
