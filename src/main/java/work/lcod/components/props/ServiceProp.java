package work.lcod.components.props;

import java.util.Objects;

/**
 * Platform-managed capability; currently only the instance key-value store.
 */
public record ServiceProp(Kind kind) implements PropSpec {
    public ServiceProp {
        Objects.requireNonNull(kind, "kind");
    }

    public static ServiceProp db() {
        return new ServiceProp(Kind.KEY_VALUE_STORE);
    }

    @Override
    public String typeName() {
        return "$.service.db";
    }

    public enum Kind {
        KEY_VALUE_STORE
    }
}
