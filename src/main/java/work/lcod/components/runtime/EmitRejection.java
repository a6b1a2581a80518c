package work.lcod.components.runtime;

/**
 * An {@code emit} call refused before buffering. {@code index} is the call's position within the run.
 */
public record EmitRejection(int index, String code, String message) {}
