package work.lcod.components.definition;

import work.lcod.components.runtime.ExecutionContext;

/**
 * Lifecycle callback run on activation or deactivation.
 */
@FunctionalInterface
public interface ComponentHook {
    void handle(ExecutionContext ctx) throws Exception;
}
