package work.lcod.components.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.util.Objects;

/**
 * Writes each event as one JSON document per line.
 */
public final class JsonLinesEventSink implements EventSink {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final PrintWriter out;

    public JsonLinesEventSink(PrintWriter out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public synchronized void accept(EmittedEvent event) {
        try {
            out.println(JSON.writeValueAsString(event.toSerializableMap()));
            out.flush();
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to write event " + event.id() + ": " + ex.getOriginalMessage(), ex);
        }
    }
}
