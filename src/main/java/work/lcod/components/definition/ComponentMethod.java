package work.lcod.components.definition;

import java.util.Map;
import work.lcod.components.runtime.ExecutionContext;

/**
 * Helper callable declared by a component or an app, invoked with the current context.
 */
@FunctionalInterface
public interface ComponentMethod {
    Object invoke(ExecutionContext ctx, Map<String, Object> args) throws Exception;
}
