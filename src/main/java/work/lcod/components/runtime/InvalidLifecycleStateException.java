package work.lcod.components.runtime;

import work.lcod.components.api.ComponentException;

public final class InvalidLifecycleStateException extends ComponentException {
    private final LifecycleState state;

    public InvalidLifecycleStateException(String instanceId, LifecycleState state, String operation) {
        super("invalid_lifecycle_state", "Cannot " + operation + " instance " + instanceId + " in state " + state);
        this.state = state;
    }

    public LifecycleState state() {
        return state;
    }
}
