package work.lcod.components.runtime;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class InMemoryEventSink implements EventSink {
    private final List<EmittedEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void accept(EmittedEvent event) {
        events.add(event);
    }

    public List<EmittedEvent> events() {
        return List.copyOf(events);
    }

    public void clear() {
        events.clear();
    }
}
