package work.lcod.components.trigger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Invocation produced by one inbound HTTP request. {@code body} is the parsed JSON when the request
 * declared a JSON content type and parsed cleanly, otherwise the raw text.
 */
public record HttpEvent(
    String method,
    String path,
    Map<String, String> query,
    Map<String, String> headers,
    String bodyRaw,
    Object body,
    ResponseChannel responseChannel
) implements InvocationEvent {
    private static final ObjectMapper JSON = new ObjectMapper();

    public static HttpEvent from(HttpRequest request, ResponseChannel channel) {
        return new HttpEvent(
            request.method(),
            request.path(),
            request.query(),
            request.headers(),
            request.bodyRaw(),
            parseBody(request),
            channel
        );
    }

    @Override
    public String type() {
        return "http";
    }

    @Override
    public Map<String, Object> toWire() {
        var wire = new LinkedHashMap<String, Object>();
        wire.put("method", method);
        wire.put("path", path);
        wire.put("query", query);
        wire.put("headers", headers);
        wire.put("bodyRaw", bodyRaw);
        wire.put("body", body);
        return wire;
    }

    static Object parseBody(HttpRequest request) {
        String raw = request.bodyRaw();
        String contentType = request.headers().getOrDefault("content-type", "");
        if (raw.isBlank() || !contentType.toLowerCase(Locale.ROOT).contains("json")) {
            return raw;
        }
        try {
            return JSON.readValue(raw, Object.class);
        } catch (JsonProcessingException ex) {
            return raw;
        }
    }
}
