package work.lcod.components.trigger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.components.shared.NamedThreadFactory;

/**
 * Fires timer events on a single scheduler thread. Each timer is re-armed one-shot after every fire
 * from the current clock, so a paused process produces a single late fire instead of a burst.
 * The fire callback must not block; instances queue the resulting invocation themselves.
 */
public final class TimerScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TimerScheduler.class);

    private final ScheduledExecutorService executor;
    private final Clock clock;
    private final Map<String, Registration> timers = new ConcurrentHashMap<>();

    public TimerScheduler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("lcod-timer-"));
    }

    public void schedule(String key, TimerSchedule schedule, Consumer<TimerEvent> onFire) {
        var registration = new Registration(key, schedule, onFire);
        if (timers.putIfAbsent(key, registration) != null) {
            throw new IllegalStateException("Timer already scheduled: " + key);
        }
        registration.arm(clock.instant());
        log.debug("Scheduled timer {} ({})", key, schedule.config().toMap());
    }

    public boolean cancel(String key) {
        var registration = timers.remove(key);
        if (registration == null) {
            return false;
        }
        registration.cancel();
        log.debug("Cancelled timer {}", key);
        return true;
    }

    public boolean isScheduled(String key) {
        return timers.containsKey(key);
    }

    /**
     * Instant of the pending fire, if the timer is armed.
     */
    public Instant nextFire(String key) {
        var registration = timers.get(key);
        return registration == null ? null : registration.scheduledFor;
    }

    @Override
    public void close() {
        timers.values().forEach(Registration::cancel);
        timers.clear();
        executor.shutdownNow();
    }

    private final class Registration {
        private final String key;
        private final TimerSchedule schedule;
        private final Consumer<TimerEvent> onFire;
        private volatile ScheduledFuture<?> future;
        private volatile Instant scheduledFor;
        private volatile boolean cancelled;

        private Registration(String key, TimerSchedule schedule, Consumer<TimerEvent> onFire) {
            this.key = key;
            this.schedule = schedule;
            this.onFire = onFire;
        }

        synchronized void arm(Instant after) {
            if (cancelled) {
                return;
            }
            Instant next = schedule.nextFire(after);
            scheduledFor = next;
            long delay = Math.max(0L, Duration.between(clock.instant(), next).toMillis());
            future = executor.schedule(this::fire, delay, TimeUnit.MILLISECONDS);
        }

        private void fire() {
            if (cancelled) {
                return;
            }
            Instant now = clock.instant();
            Instant boundary = scheduledFor;
            log.debug("Timer {} fired for boundary {}", key, boundary);
            try {
                onFire.accept(TimerEvent.of(now.getEpochSecond(), schedule.config()));
            } catch (RuntimeException ex) {
                log.error("Timer {} callback failed", key, ex);
            }
            arm(now.isAfter(boundary) ? now : boundary);
        }

        synchronized void cancel() {
            cancelled = true;
            var pending = future;
            if (pending != null) {
                pending.cancel(false);
            }
        }
    }
}
