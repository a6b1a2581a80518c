package work.lcod.components.dedupe;

import java.util.Locale;

/**
 * Admission policy applied to the events a component emits.
 */
public enum DedupeStrategy {
    NONE,
    UNIQUE,
    GREATEST,
    LAST;

    public boolean requiresId() {
        return this != NONE;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DedupeStrategy from(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return DedupeStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported dedupe strategy: " + value);
        }
    }
}
