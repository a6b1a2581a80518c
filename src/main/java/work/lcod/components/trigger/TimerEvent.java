package work.lcod.components.trigger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One timer fire. {@code timestamp} is in unix seconds; the configured interval or cron is echoed.
 */
public record TimerEvent(long timestamp, Long intervalSeconds, String cron) implements InvocationEvent {
    public static TimerEvent of(long timestamp, TimerConfig config) {
        return new TimerEvent(timestamp, config.intervalSeconds(), config.cron());
    }

    @Override
    public String type() {
        return "timer";
    }

    @Override
    public Map<String, Object> toWire() {
        var wire = new LinkedHashMap<String, Object>();
        wire.put("timestamp", timestamp);
        if (intervalSeconds != null) {
            wire.put("interval_seconds", intervalSeconds);
        }
        if (cron != null) {
            wire.put("cron", cron);
        }
        return wire;
    }
}
