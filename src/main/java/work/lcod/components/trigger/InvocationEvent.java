package work.lcod.components.trigger;

import java.util.Map;

/**
 * Stimulus handed to a component's run handler.
 */
public interface InvocationEvent {
    String type();

    /**
     * Wire representation as documented for the trigger kind.
     */
    Map<String, Object> toWire();
}
