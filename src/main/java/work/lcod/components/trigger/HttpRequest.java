package work.lcod.components.trigger;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Inbound request for an HTTP endpoint. Header names are lower-cased.
 */
public record HttpRequest(
    String method,
    String path,
    Map<String, String> query,
    Map<String, String> headers,
    String bodyRaw
) {
    public HttpRequest {
        Objects.requireNonNull(method, "method");
        path = path == null || path.isEmpty() ? "/" : path;
        query = query == null ? Map.of() : Map.copyOf(query);
        headers = headers == null ? Map.of() : lowerCaseKeys(headers);
        bodyRaw = bodyRaw == null ? "" : bodyRaw;
    }

    public static HttpRequest get(String path) {
        return new HttpRequest("GET", path, Map.of(), Map.of(), "");
    }

    public static HttpRequest post(String path, String contentType, String body) {
        return new HttpRequest("POST", path, Map.of(), Map.of("Content-Type", contentType), body);
    }

    private static Map<String, String> lowerCaseKeys(Map<String, String> headers) {
        var normalized = new LinkedHashMap<String, String>();
        headers.forEach((name, value) -> normalized.put(name.toLowerCase(Locale.ROOT), value));
        return Map.copyOf(normalized);
    }
}
