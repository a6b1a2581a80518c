package work.lcod.components.runtime;

/**
 * Optional metadata of an emitted event. {@code id} (string or number) drives dedupe, {@code ts}
 * drives ordering, {@code summary} is for display only.
 */
public record EmitMetadata(Object id, String summary, Long ts) {
    private static final EmitMetadata NONE = new EmitMetadata(null, null, null);

    public static EmitMetadata none() {
        return NONE;
    }

    public static EmitMetadata id(Object id) {
        return new EmitMetadata(id, null, null);
    }

    public EmitMetadata withId(Object newId) {
        return new EmitMetadata(newId, summary, ts);
    }

    public EmitMetadata withSummary(String newSummary) {
        return new EmitMetadata(id, newSummary, ts);
    }

    public EmitMetadata withTs(long newTs) {
        return new EmitMetadata(id, summary, newTs);
    }
}
