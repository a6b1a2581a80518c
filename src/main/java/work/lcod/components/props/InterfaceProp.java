package work.lcod.components.props;

import java.util.Objects;
import work.lcod.components.trigger.TimerConfig;

/**
 * Platform-supplied trigger infrastructure. A timer may carry a default schedule.
 */
public record InterfaceProp(Kind kind, TimerConfig defaultTimer) implements PropSpec {
    public InterfaceProp {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.HTTP && defaultTimer != null) {
            throw new IllegalArgumentException("HTTP interface props take no timer default");
        }
    }

    public static InterfaceProp timer() {
        return new InterfaceProp(Kind.TIMER, null);
    }

    public static InterfaceProp timer(TimerConfig defaultTimer) {
        return new InterfaceProp(Kind.TIMER, defaultTimer);
    }

    public static InterfaceProp http() {
        return new InterfaceProp(Kind.HTTP, null);
    }

    @Override
    public String typeName() {
        return kind == Kind.TIMER ? "$.interface.timer" : "$.interface.http";
    }

    public enum Kind {
        TIMER,
        HTTP
    }
}
