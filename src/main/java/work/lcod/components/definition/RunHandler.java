package work.lcod.components.definition;

import work.lcod.components.runtime.ExecutionContext;
import work.lcod.components.trigger.InvocationEvent;

@FunctionalInterface
public interface RunHandler {
    void run(InvocationEvent event, ExecutionContext ctx) throws Exception;
}
