package work.lcod.components.runtime;

import work.lcod.components.trigger.HttpResponse;
import work.lcod.components.trigger.ResponseChannel;

/**
 * Runtime view of an HTTP interface prop. {@link #respond} answers the request being handled and
 * is only usable during an HTTP-triggered run.
 */
public final class HttpCapability {
    private final String propName;
    private final String endpoint;
    private final ResponseChannel channel;

    HttpCapability(String propName, String endpoint, ResponseChannel channel) {
        this.propName = propName;
        this.endpoint = endpoint;
        this.channel = channel;
    }

    public String propName() {
        return propName;
    }

    /**
     * Stable endpoint id routed to this instance; survives redeploys.
     */
    public String endpoint() {
        return endpoint;
    }

    /**
     * @return {@code false} when a response was already sent or the caller timed out
     */
    public boolean respond(HttpResponse response) {
        if (channel == null) {
            throw new IllegalStateException("respond() is only available while handling an HTTP event");
        }
        return channel.respond(response);
    }

    public boolean hasResponded() {
        return channel != null && channel.isResponded();
    }
}
