package work.lcod.components.dedupe;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Highest id accepted so far; {@code maxId} is {@code null} until the first acceptance.
 */
public record GreatestCache(BigDecimal maxId) implements DedupeState {
    public static GreatestCache empty() {
        return new GreatestCache(null);
    }

    @Override
    public DedupeStrategy strategy() {
        return DedupeStrategy.GREATEST;
    }

    @Override
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("strategy", strategy().wireName());
        map.put("maxId", maxId == null ? null : maxId.toPlainString());
        return map;
    }

    static GreatestCache fromMap(Map<?, ?> stored) {
        Object raw = stored.get("maxId");
        return new GreatestCache(raw == null ? null : new BigDecimal(String.valueOf(raw)));
    }
}
