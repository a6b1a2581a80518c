package work.lcod.components.trigger;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Standard five-field cron expression: minute, hour, day of month, month, day of week.
 * Fields accept {@code *}, lists, ranges, steps and English month/day abbreviations. When both
 * day fields are restricted a day matches if either does.
 */
public final class CronExpression {
    private static final List<String> MONTHS = List.of(
        "JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC"
    );
    private static final List<String> DAYS = List.of("SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT");
    private static final int SEARCH_YEARS = 5;

    private final String expression;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;
    private final boolean dayOfMonthRestricted;
    private final boolean dayOfWeekRestricted;

    private CronExpression(String expression, String[] fields) {
        this.expression = expression;
        this.minutes = parseField(fields[0], 0, 59, null, 0);
        this.hours = parseField(fields[1], 0, 23, null, 0);
        this.daysOfMonth = parseField(fields[2], 1, 31, null, 0);
        this.months = parseField(fields[3], 1, 12, MONTHS, 1);
        BitSet dow = parseField(fields[4], 0, 7, DAYS, 0);
        if (dow.get(7)) {
            dow.set(0);
            dow.clear(7);
        }
        this.daysOfWeek = dow;
        this.dayOfMonthRestricted = !fields[2].startsWith("*");
        this.dayOfWeekRestricted = !fields[4].startsWith("*");
    }

    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression must not be blank");
        }
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        if (fields.length != 5) {
            throw new IllegalArgumentException("Cron expression must have 5 fields: '" + expression + "'");
        }
        return new CronExpression(trimmed, fields);
    }

    public String expression() {
        return expression;
    }

    public boolean matches(ZonedDateTime time) {
        return months.get(time.getMonthValue())
            && matchesDay(time)
            && hours.get(time.getHour())
            && minutes.get(time.getMinute());
    }

    /**
     * First matching minute strictly after {@code after}.
     */
    public ZonedDateTime next(ZonedDateTime after) {
        Objects.requireNonNull(after, "after");
        ZonedDateTime candidate = after.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        ZonedDateTime limit = candidate.plusYears(SEARCH_YEARS);
        while (candidate.isBefore(limit)) {
            if (!months.get(candidate.getMonthValue())) {
                candidate = candidate.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
                continue;
            }
            if (!matchesDay(candidate)) {
                candidate = candidate.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            if (!hours.get(candidate.getHour())) {
                candidate = candidate.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minutes.get(candidate.getMinute())) {
                candidate = candidate.plusMinutes(1);
                continue;
            }
            return candidate;
        }
        throw new IllegalStateException("Cron expression never fires: '" + expression + "'");
    }

    private boolean matchesDay(ZonedDateTime time) {
        boolean domMatch = daysOfMonth.get(time.getDayOfMonth());
        boolean dowMatch = daysOfWeek.get(time.getDayOfWeek().getValue() % 7);
        if (dayOfMonthRestricted && dayOfWeekRestricted) {
            return domMatch || dowMatch;
        }
        return domMatch && dowMatch;
    }

    private static BitSet parseField(String field, int min, int max, List<String> names, int nameOffset) {
        var bits = new BitSet(max + 1);
        for (String part : field.split(",")) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Empty cron list element in '" + field + "'");
            }
            int step = 1;
            String range = part;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                step = parseNumber(part.substring(slash + 1), field);
                if (step <= 0) {
                    throw new IllegalArgumentException("Cron step must be > 0 in '" + field + "'");
                }
            }
            int low;
            int high;
            if ("*".equals(range)) {
                low = min;
                high = max;
            } else if (range.indexOf('-') > 0) {
                int dash = range.indexOf('-');
                low = parseValue(range.substring(0, dash), field, names, nameOffset);
                high = parseValue(range.substring(dash + 1), field, names, nameOffset);
            } else {
                low = parseValue(range, field, names, nameOffset);
                high = slash >= 0 ? max : low;
            }
            if (low < min || high > max || low > high) {
                throw new IllegalArgumentException("Cron field '" + field + "' out of range " + min + "-" + max);
            }
            for (int value = low; value <= high; value += step) {
                bits.set(value);
            }
        }
        return bits;
    }

    private static int parseValue(String token, String field, List<String> names, int nameOffset) {
        if (names != null) {
            int index = names.indexOf(token.toUpperCase(Locale.ROOT));
            if (index >= 0) {
                return index + nameOffset;
            }
        }
        return parseNumber(token, field);
    }

    private static int parseNumber(String token, String field) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid cron value '" + token + "' in '" + field + "'");
        }
    }

    @Override
    public String toString() {
        return expression;
    }
}
