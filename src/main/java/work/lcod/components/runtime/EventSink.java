package work.lcod.components.runtime;

/**
 * Receives accepted events, oldest first, after the invocation that produced them completed.
 */
@FunctionalInterface
public interface EventSink {
    void accept(EmittedEvent event);
}
