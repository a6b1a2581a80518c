package work.lcod.components.trigger;

import java.util.LinkedHashMap;
import java.util.Map;

public record ManualEvent(Object payload) implements InvocationEvent {
    @Override
    public String type() {
        return "manual";
    }

    @Override
    public Map<String, Object> toWire() {
        var wire = new LinkedHashMap<String, Object>();
        wire.put("payload", payload);
        return wire;
    }
}
