package work.lcod.components.trigger;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Computes fire times for one timer. Interval timers tick on a fixed cadence anchored at
 * activation; cron timers follow the wall clock in {@code zone}. The next fire is always the first
 * boundary strictly after the given instant, so ticks missed while paused collapse into one.
 */
public final class TimerSchedule {
    private final TimerConfig config;
    private final CronExpression cron;
    private final Instant anchor;
    private final ZoneId zone;

    public TimerSchedule(TimerConfig config, Instant anchor, ZoneId zone) {
        this.config = Objects.requireNonNull(config, "config");
        this.anchor = Objects.requireNonNull(anchor, "anchor");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.cron = config.isInterval() ? null : CronExpression.parse(config.cron());
    }

    public TimerConfig config() {
        return config;
    }

    public Instant nextFire(Instant after) {
        if (cron != null) {
            return cron.next(after.atZone(zone)).toInstant();
        }
        long periodMillis = Duration.ofSeconds(config.intervalSeconds()).toMillis();
        long elapsed = after.toEpochMilli() - anchor.toEpochMilli();
        if (elapsed < 0) {
            return anchor.plusMillis(periodMillis);
        }
        long ticks = elapsed / periodMillis + 1;
        return anchor.plusMillis(ticks * periodMillis);
    }
}
