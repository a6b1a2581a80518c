package work.lcod.components.props;

import java.util.Objects;

/**
 * One selectable option: a display label and the value stored when it is chosen.
 */
public record PropOption(String label, Object value) {
    public PropOption {
        Objects.requireNonNull(label, "label");
    }

    public static PropOption of(Object value) {
        return new PropOption(String.valueOf(value), value);
    }
}
