package work.lcod.components.props;

import java.util.List;
import java.util.Objects;

/**
 * Prop whose value is chosen by the person configuring the component. Options come either from a
 * static list or from an {@link OptionsProvider}, never both.
 */
public final class UserInputProp implements PropSpec {
    private final PropType type;
    private final String label;
    private final String description;
    private final List<PropOption> staticOptions;
    private final OptionsProvider optionsProvider;
    private final boolean optional;
    private final boolean hasDefault;
    private final Object defaultValue;

    private UserInputProp(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type");
        this.label = builder.label;
        this.description = builder.description;
        this.staticOptions = builder.staticOptions == null ? null : List.copyOf(builder.staticOptions);
        this.optionsProvider = builder.optionsProvider;
        this.optional = builder.optional;
        this.hasDefault = builder.hasDefault;
        this.defaultValue = builder.defaultValue;
    }

    public static Builder builder(PropType type) {
        return new Builder().type(type);
    }

    public static UserInputProp of(PropType type) {
        return builder(type).build();
    }

    public PropType type() {
        return type;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }

    public List<PropOption> staticOptions() {
        return staticOptions;
    }

    public OptionsProvider optionsProvider() {
        return optionsProvider;
    }

    public boolean hasOptions() {
        return staticOptions != null || optionsProvider != null;
    }

    public boolean optional() {
        return optional;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    public Object defaultValue() {
        return defaultValue;
    }

    @Override
    public String typeName() {
        return type.wireName();
    }

    /**
     * Field-by-field merge: every field set on {@code overrides} replaces the base field, the rest
     * is kept. Static options and a provider count as the same field.
     */
    public UserInputProp merge(PropOverrides overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        var builder = toBuilder();
        if (overrides.type() != null) {
            builder.type(overrides.type());
        }
        if (overrides.label() != null) {
            builder.label(overrides.label());
        }
        if (overrides.description() != null) {
            builder.description(overrides.description());
        }
        if (overrides.staticOptions() != null) {
            builder.staticOptions(overrides.staticOptions());
        } else if (overrides.optionsProvider() != null) {
            builder.optionsProvider(overrides.optionsProvider());
        }
        if (overrides.optional() != null) {
            builder.optional(overrides.optional());
        }
        if (overrides.hasDefault()) {
            builder.defaultValue(overrides.defaultValue());
        }
        return builder.build();
    }

    public Builder toBuilder() {
        var builder = new Builder()
            .type(type)
            .label(label)
            .description(description)
            .optional(optional);
        if (staticOptions != null) {
            builder.staticOptions(staticOptions);
        } else if (optionsProvider != null) {
            builder.optionsProvider(optionsProvider);
        }
        if (hasDefault) {
            builder.defaultValue(defaultValue);
        }
        return builder;
    }

    public static final class Builder {
        private PropType type;
        private String label;
        private String description;
        private List<PropOption> staticOptions;
        private OptionsProvider optionsProvider;
        private boolean optional;
        private boolean hasDefault;
        private Object defaultValue;

        public Builder type(PropType type) {
            this.type = type;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder staticOptions(List<PropOption> options) {
            this.staticOptions = options;
            this.optionsProvider = null;
            return this;
        }

        public Builder optionsProvider(OptionsProvider provider) {
            this.optionsProvider = provider;
            this.staticOptions = null;
            return this;
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder defaultValue(Object value) {
            this.hasDefault = true;
            this.defaultValue = value;
            return this;
        }

        public UserInputProp build() {
            return new UserInputProp(this);
        }
    }
}
