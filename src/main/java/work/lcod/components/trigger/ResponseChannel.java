package work.lcod.components.trigger;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Carries exactly one response from a running invocation back to the waiting HTTP caller.
 * Later responses are ignored.
 */
public final class ResponseChannel {
    private static final Logger log = LoggerFactory.getLogger(ResponseChannel.class);

    private final CompletableFuture<HttpResponse> response = new CompletableFuture<>();
    private volatile boolean expired;

    /**
     * @return {@code false} when a response was already issued or the caller stopped waiting
     */
    public boolean respond(HttpResponse value) {
        if (value == null) {
            throw new IllegalArgumentException("response must not be null");
        }
        if (expired) {
            log.warn("respond() called after the HTTP caller timed out; ignored");
            return false;
        }
        if (!response.complete(value)) {
            log.warn("respond() already called for this request; status {} ignored", value.status());
            return false;
        }
        return true;
    }

    public boolean isResponded() {
        return response.isDone();
    }

    public boolean isExpired() {
        return expired;
    }

    boolean completeDefault(HttpResponse fallback) {
        return !expired && response.complete(fallback);
    }

    HttpResponse await(Duration timeout) throws TimeoutException, InterruptedException {
        try {
            return response.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Response channel failed", ex.getCause());
        }
    }

    void expire() {
        expired = true;
    }
}
