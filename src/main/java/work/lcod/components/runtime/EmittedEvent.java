package work.lcod.components.runtime;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event that passed ordering and dedupe and was handed to the sink.
 */
public record EmittedEvent(
    String instanceId,
    String componentName,
    Object data,
    Object id,
    String summary,
    Long ts,
    Instant emittedAt
) {
    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("instanceId", instanceId);
        map.put("component", componentName);
        if (id != null) {
            map.put("id", id);
        }
        if (summary != null) {
            map.put("summary", summary);
        }
        if (ts != null) {
            map.put("ts", ts);
        }
        map.put("emittedAt", emittedAt.toString());
        map.put("data", data);
        return map;
    }
}
