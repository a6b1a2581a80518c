package work.lcod.components.trigger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.components.shared.NamedThreadFactory;

/**
 * Exposes the endpoints of an {@link HttpDispatcher} at {@code /{endpointId}/...} on the JDK HTTP
 * server. Query parameters and headers with several values keep the last one.
 */
public final class HttpTriggerServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HttpTriggerServer.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final HttpDispatcher dispatcher;
    private final HttpServer server;
    private final ExecutorService executor;

    public HttpTriggerServer(HttpDispatcher dispatcher, InetSocketAddress address) throws IOException {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.server = HttpServer.create(address, 0);
        this.executor = Executors.newCachedThreadPool(new NamedThreadFactory("lcod-http-"));
        this.server.setExecutor(executor);
        this.server.createContext("/", this::handle);
    }

    public void start() {
        server.start();
        log.info("HTTP triggers listening on port {}", port());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            String rawPath = exchange.getRequestURI().getRawPath();
            String trimmed = rawPath.startsWith("/") ? rawPath.substring(1) : rawPath;
            int slash = trimmed.indexOf('/');
            String endpointId = slash < 0 ? trimmed : trimmed.substring(0, slash);
            String path = slash < 0 ? "/" : decodePath(trimmed.substring(slash));

            var request = new HttpRequest(
                exchange.getRequestMethod(),
                path,
                parseQuery(exchange.getRequestURI().getRawQuery()),
                flattenHeaders(exchange.getRequestHeaders()),
                readBody(exchange.getRequestBody())
            );
            write(exchange, dispatcher.dispatch(endpointId, request));
        } catch (RuntimeException ex) {
            log.error("Failed to handle HTTP trigger request {}", exchange.getRequestURI(), ex);
            throw ex;
        } finally {
            exchange.close();
        }
    }

    private static void write(HttpExchange exchange, HttpResponse response) throws IOException {
        byte[] payload;
        var headers = exchange.getResponseHeaders();
        response.headers().forEach(headers::set);
        Object body = response.body();
        if (body == null) {
            payload = new byte[0];
        } else if (body instanceof byte[] bytes) {
            payload = bytes;
        } else if (body instanceof CharSequence text) {
            payload = text.toString().getBytes(StandardCharsets.UTF_8);
        } else {
            payload = JSON.writeValueAsBytes(body);
            if (!headers.containsKey("Content-Type")) {
                headers.set("Content-Type", "application/json");
            }
        }
        exchange.sendResponseHeaders(response.status(), payload.length == 0 ? -1 : payload.length);
        if (payload.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(payload);
            }
        }
    }

    private static String readBody(InputStream in) throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }

    /**
     * Percent-decodes a raw path the way {@link URI#getPath()} does; {@code +} stays a literal plus.
     */
    static String decodePath(String rawPath) {
        return URI.create(rawPath).getPath();
    }

    static Map<String, String> parseQuery(String rawQuery) {
        var query = new LinkedHashMap<String, String>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return query;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            query.put(URLDecoder.decode(name, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return query;
    }

    private static Map<String, String> flattenHeaders(Map<String, List<String>> headers) {
        var flat = new LinkedHashMap<String, String>();
        headers.forEach((name, values) -> {
            if (name != null && values != null && !values.isEmpty()) {
                flat.put(name, values.get(values.size() - 1));
            }
        });
        return flat;
    }
}
