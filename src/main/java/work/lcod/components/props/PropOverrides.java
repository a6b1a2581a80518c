package work.lcod.components.props;

import java.util.List;

/**
 * Local fields layered over a prop definition. {@code null} means "keep the base value".
 */
public final class PropOverrides {
    private static final PropOverrides NONE = new Builder().build();

    private final PropType type;
    private final String label;
    private final String description;
    private final List<PropOption> staticOptions;
    private final OptionsProvider optionsProvider;
    private final Boolean optional;
    private final boolean hasDefault;
    private final Object defaultValue;

    private PropOverrides(Builder builder) {
        this.type = builder.type;
        this.label = builder.label;
        this.description = builder.description;
        this.staticOptions = builder.staticOptions == null ? null : List.copyOf(builder.staticOptions);
        this.optionsProvider = builder.optionsProvider;
        this.optional = builder.optional;
        this.hasDefault = builder.hasDefault;
        this.defaultValue = builder.defaultValue;
    }

    public static PropOverrides none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return type == null && label == null && description == null && staticOptions == null
            && optionsProvider == null && optional == null && !hasDefault;
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

    public Boolean optional() {
        return optional;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    public Object defaultValue() {
        return defaultValue;
    }

    public static final class Builder {
        private PropType type;
        private String label;
        private String description;
        private List<PropOption> staticOptions;
        private OptionsProvider optionsProvider;
        private Boolean optional;
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

        public PropOverrides build() {
            return new PropOverrides(this);
        }
    }
}
