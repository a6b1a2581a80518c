package work.lcod.components.definition;

import java.util.Map;
import work.lcod.components.props.PropSpec;
import work.lcod.components.runtime.ExecutionContext;
import work.lcod.components.trigger.InvocationEvent;

/**
 * Code half of a component declared in a manifest. Implementations need a public no-arg
 * constructor. Props returned by {@link #props()} replace manifest props of the same name and are
 * appended otherwise.
 */
public interface ComponentHandler {
    void run(InvocationEvent event, ExecutionContext ctx) throws Exception;

    default void activate(ExecutionContext ctx) throws Exception {}

    default void deactivate(ExecutionContext ctx) throws Exception {}

    default Map<String, ComponentMethod> methods() {
        return Map.of();
    }

    default Map<String, PropSpec> props() {
        return Map.of();
    }
}
