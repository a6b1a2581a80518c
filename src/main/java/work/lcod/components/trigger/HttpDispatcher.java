package work.lcod.components.trigger;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes inbound requests to the instance owning an endpoint and blocks until that instance
 * responds, finishes without responding (empty 200), fails (500), or the timeout elapses (504).
 */
public final class HttpDispatcher {
    private static final Logger log = LoggerFactory.getLogger(HttpDispatcher.class);
    private static final char[] ENDPOINT_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Map<String, HttpInvocationTarget> endpoints = new ConcurrentHashMap<>();
    private final Duration timeout;

    public HttpDispatcher(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public static String newEndpointId() {
        var builder = new StringBuilder("en");
        for (int i = 0; i < 20; i++) {
            builder.append(ENDPOINT_ALPHABET[RANDOM.nextInt(ENDPOINT_ALPHABET.length)]);
        }
        return builder.toString();
    }

    public void register(String endpointId, HttpInvocationTarget target) {
        Objects.requireNonNull(endpointId, "endpointId");
        Objects.requireNonNull(target, "target");
        if (endpoints.putIfAbsent(endpointId, target) != null) {
            throw new IllegalStateException("Endpoint already registered: " + endpointId);
        }
        log.debug("Registered HTTP endpoint {}", endpointId);
    }

    public void unregister(String endpointId) {
        if (endpointId != null && endpoints.remove(endpointId) != null) {
            log.debug("Unregistered HTTP endpoint {}", endpointId);
        }
    }

    public boolean isRegistered(String endpointId) {
        return endpointId != null && endpoints.containsKey(endpointId);
    }

    public HttpResponse dispatch(String endpointId, HttpRequest request) {
        HttpInvocationTarget target = endpointId == null ? null : endpoints.get(endpointId);
        if (target == null) {
            return HttpResponse.of(404, "Unknown endpoint");
        }
        var channel = new ResponseChannel();
        var event = HttpEvent.from(request, channel);
        target.submit(event).whenComplete((result, error) -> {
            if (error != null) {
                if (channel.completeDefault(HttpResponse.of(500, "Invocation failed"))) {
                    log.warn("Endpoint {} invocation failed before responding: {}", endpointId, rootMessage(error));
                }
            } else if (channel.completeDefault(HttpResponse.ok())) {
                log.warn("Endpoint {} finished without calling respond(); sent empty 200", endpointId);
            }
        });
        try {
            return channel.await(timeout);
        } catch (TimeoutException ex) {
            channel.expire();
            log.warn("Endpoint {} did not respond within {}; sent 504", endpointId, timeout);
            return HttpResponse.of(504, "Timed out waiting for component response");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            channel.expire();
            return HttpResponse.of(503, "Interrupted");
        }
    }

    public Duration timeout() {
        return timeout;
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.getClass().getSimpleName() : current.getMessage();
    }
}
