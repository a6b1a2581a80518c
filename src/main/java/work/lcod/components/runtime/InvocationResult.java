package work.lcod.components.runtime;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of one {@code run}: delivered events, dedupe drops, rejected emit calls and the error of
 * a failed run.
 */
public record InvocationResult(
    Status status,
    String instanceId,
    String eventType,
    List<EmittedEvent> emitted,
    int dropped,
    List<EmitRejection> rejections,
    String error,
    Instant startedAt,
    Instant finishedAt
) {
    public InvocationResult {
        emitted = List.copyOf(emitted);
        rejections = List.copyOf(rejections);
    }

    static InvocationResult success(
        String instanceId,
        String eventType,
        List<EmittedEvent> emitted,
        int dropped,
        List<EmitRejection> rejections,
        Instant startedAt,
        Instant finishedAt
    ) {
        return new InvocationResult(Status.SUCCESS, instanceId, eventType, emitted, dropped, rejections, null, startedAt, finishedAt);
    }

    static InvocationResult failure(
        String instanceId,
        String eventType,
        List<EmittedEvent> emitted,
        List<EmitRejection> rejections,
        String error,
        Instant startedAt,
        Instant finishedAt
    ) {
        return new InvocationResult(Status.FAILURE, instanceId, eventType, emitted, 0, rejections, error, startedAt, finishedAt);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("status", status.name().toLowerCase(Locale.ROOT));
        map.put("instanceId", instanceId);
        map.put("event", eventType);
        var events = new ArrayList<Map<String, Object>>();
        for (EmittedEvent event : emitted) {
            events.add(event.toSerializableMap());
        }
        map.put("emitted", events);
        map.put("dropped", dropped);
        if (!rejections.isEmpty()) {
            var rejected = new ArrayList<Map<String, Object>>();
            for (EmitRejection rejection : rejections) {
                var entry = new LinkedHashMap<String, Object>();
                entry.put("index", rejection.index());
                entry.put("code", rejection.code());
                entry.put("message", rejection.message());
                rejected.add(entry);
            }
            map.put("rejections", rejected);
        }
        if (error != null) {
            map.put("error", error);
        }
        map.put("startedAt", startedAt.toString());
        map.put("finishedAt", finishedAt.toString());
        return map;
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
