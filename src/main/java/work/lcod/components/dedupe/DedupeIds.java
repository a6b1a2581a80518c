package work.lcod.components.dedupe;

import java.math.BigDecimal;

/**
 * Normalises emitted ids. Strings and numbers share one key space: {@code 1}, {@code 1.0} and
 * {@code "1"} are the same id.
 */
public final class DedupeIds {
    private DedupeIds() {}

    /**
     * Checks an id against the strategy before the emission is buffered.
     */
    public static void validate(DedupeStrategy strategy, Object id) {
        if (!strategy.requiresId()) {
            return;
        }
        if (id == null) {
            throw new MissingIdForDedupeException(strategy);
        }
        if (strategy == DedupeStrategy.GREATEST) {
            numeric(id);
        } else {
            canonical(id);
        }
    }

    public static String canonical(Object id) {
        if (id instanceof CharSequence text) {
            return text.toString();
        }
        if (id instanceof Number number) {
            BigDecimal decimal = toDecimal(number);
            return decimal.signum() == 0 ? "0" : decimal.stripTrailingZeros().toPlainString();
        }
        throw new DedupeTypeException("Event id must be a string or a number, got "
            + (id == null ? "null" : id.getClass().getSimpleName()));
    }

    public static BigDecimal numeric(Object id) {
        if (id instanceof Number number) {
            return toDecimal(number);
        }
        if (id instanceof CharSequence text) {
            try {
                return new BigDecimal(text.toString().trim());
            } catch (NumberFormatException ex) {
                throw new DedupeTypeException("Dedupe strategy 'greatest' requires a numeric id, got '" + text + "'");
            }
        }
        throw new DedupeTypeException("Dedupe strategy 'greatest' requires a numeric id, got "
            + (id == null ? "null" : id.getClass().getSimpleName()));
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            double value = number.doubleValue();
            if (!Double.isFinite(value)) {
                throw new DedupeTypeException("Event id must be a finite number, got " + value);
            }
            return BigDecimal.valueOf(value);
        }
        return new BigDecimal(number.toString());
    }
}
