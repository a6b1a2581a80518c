package work.lcod.components.runtime;

import work.lcod.components.api.ComponentException;

/**
 * An activate or deactivate hook failed; the instance stays in its previous state.
 */
public final class LifecycleTransitionException extends ComponentException {
    public LifecycleTransitionException(String instanceId, String hook, Throwable cause) {
        super("lifecycle_transition", "Hook '" + hook + "' of instance " + instanceId + " failed: " + cause.getMessage(), cause);
    }
}
