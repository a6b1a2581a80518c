package work.lcod.components.runtime;

/**
 * {@code CREATED -> ACTIVE -> DEACTIVATED}; the last state is terminal.
 */
public enum LifecycleState {
    CREATED,
    ACTIVE,
    DEACTIVATED
}
