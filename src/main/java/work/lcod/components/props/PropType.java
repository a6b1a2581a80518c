package work.lcod.components.props;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Value types a user-input prop may declare.
 */
public enum PropType {
    STRING("string"),
    STRING_ARRAY("string[]"),
    INTEGER("integer"),
    INTEGER_ARRAY("integer[]"),
    BOOLEAN("boolean"),
    OBJECT("object"),
    ANY("any");

    private final String wireName;

    PropType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static PropType from(String value) {
        for (PropType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported prop type: " + value);
    }

    public static boolean isUserInputType(String value) {
        for (PropType type : values()) {
            if (type.wireName.equals(value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether a supplied value is plausible for this type. Only the shape is checked.
     */
    public boolean accepts(Object value) {
        return switch (this) {
            case STRING -> value instanceof CharSequence;
            case STRING_ARRAY -> value instanceof List<?> list && list.stream().allMatch(item -> item instanceof CharSequence)
                || value instanceof String[];
            case INTEGER -> isInteger(value);
            case INTEGER_ARRAY -> value instanceof List<?> list && list.stream().allMatch(PropType::isInteger)
                || value instanceof int[] || value instanceof long[];
            case BOOLEAN -> value instanceof Boolean;
            case OBJECT -> value instanceof Map<?, ?>;
            case ANY -> value != null;
        };
    }

    private static boolean isInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) && d == Math.rint(d);
        }
        return false;
    }
}
