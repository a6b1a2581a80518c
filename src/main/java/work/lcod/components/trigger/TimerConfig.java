package work.lcod.components.trigger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Timer schedule: either a fixed interval or a cron expression, never both.
 */
public record TimerConfig(Long intervalSeconds, String cron) {
    public TimerConfig {
        boolean hasInterval = intervalSeconds != null;
        boolean hasCron = cron != null && !cron.isBlank();
        if (hasInterval && hasCron) {
            throw new IllegalArgumentException("Timer accepts either intervalSeconds or cron, not both");
        }
        if (!hasInterval && !hasCron) {
            throw new IllegalArgumentException("Timer requires intervalSeconds or cron");
        }
        if (hasInterval && intervalSeconds <= 0) {
            throw new IllegalArgumentException("intervalSeconds must be > 0");
        }
        if (hasCron) {
            CronExpression.parse(cron);
        }
    }

    public static TimerConfig interval(long seconds) {
        return new TimerConfig(seconds, null);
    }

    public static TimerConfig cron(String expression) {
        return new TimerConfig(null, expression.trim());
    }

    public boolean isInterval() {
        return intervalSeconds != null;
    }

    /**
     * Accepts a {@link TimerConfig} or a map with {@code intervalSeconds}/{@code interval_seconds}
     * or {@code cron}.
     */
    public static TimerConfig from(Object value) {
        if (value instanceof TimerConfig config) {
            return config;
        }
        if (value instanceof Map<?, ?> map) {
            Object interval = map.containsKey("intervalSeconds") ? map.get("intervalSeconds") : map.get("interval_seconds");
            Object cron = map.get("cron");
            Long seconds = null;
            if (interval instanceof Number number) {
                seconds = number.longValue();
            } else if (interval instanceof String text && !text.isBlank()) {
                try {
                    seconds = Long.parseLong(text.trim());
                } catch (NumberFormatException ex) {
                    throw new IllegalArgumentException("intervalSeconds must be an integer: " + text);
                }
            } else if (interval != null) {
                throw new IllegalArgumentException("intervalSeconds must be an integer");
            }
            return new TimerConfig(seconds, cron == null ? null : String.valueOf(cron).trim());
        }
        throw new IllegalArgumentException("Unsupported timer configuration: " + value);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        if (intervalSeconds != null) {
            map.put("intervalSeconds", intervalSeconds);
        } else {
            map.put("cron", cron);
        }
        return map;
    }
}
