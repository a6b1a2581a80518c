package work.lcod.components.trigger;

import java.util.Map;

/**
 * Response issued through {@code respond()}. {@code body} is a string, a byte array, or any
 * JSON-serializable value.
 */
public record HttpResponse(int status, Map<String, String> headers, Object body) {
    public HttpResponse {
        if (status < 100 || status > 599) {
            throw new IllegalArgumentException("Invalid HTTP status: " + status);
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static HttpResponse of(int status) {
        return new HttpResponse(status, Map.of(), null);
    }

    public static HttpResponse of(int status, Object body) {
        return new HttpResponse(status, Map.of(), body);
    }

    public static HttpResponse ok() {
        return of(200);
    }
}
