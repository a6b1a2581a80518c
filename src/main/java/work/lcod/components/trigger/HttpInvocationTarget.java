package work.lcod.components.trigger;

import java.util.concurrent.CompletableFuture;

/**
 * Queues an HTTP invocation on the owning instance. The future completes when {@code run} finishes.
 */
@FunctionalInterface
public interface HttpInvocationTarget {
    CompletableFuture<?> submit(HttpEvent event);
}
