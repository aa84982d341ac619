package com.example.almanac.scheduler;

import com.example.almanac.common.ConfigException;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.List;
import java.util.Locale;

/**
 * Five-field cron expression: minute, hour, day-of-month, month, day-of-week.
 *
 * <p>Each field accepts {@code *}, single values, ranges ({@code 1-5}), steps ({@code *}{@code /15},
 * {@code 10-40/10}) and comma lists. Months and weekdays also accept three-letter names; weekday
 * 0 and 7 both mean Sunday.</p>
 *
 * <p>Day matching follows classic cron: when both day-of-month and day-of-week are restricted a
 * day matches if <em>either</em> field matches; when one of them starts with {@code *} only the
 * other one decides.</p>
 */
public final class CronExpression {

    private static final List<String> MONTH_NAMES = List.of(
            "JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC");
    private static final List<String> DAY_NAMES = List.of("SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT");

    /** Feb 29 on a fixed weekday can be 28 years away. */
    private static final long SEARCH_YEARS = 30;

    private final String expression;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;
    private final boolean dayOfMonthStar;
    private final boolean dayOfWeekStar;

    private CronExpression(String expression, String[] fields) {
        this.expression = expression;
        this.minutes = parseField(fields[0], 0, 59, null, "minute");
        this.hours = parseField(fields[1], 0, 23, null, "hour");
        this.daysOfMonth = parseField(fields[2], 1, 31, null, "day-of-month");
        this.months = parseField(fields[3], 1, 12, MONTH_NAMES, "month");
        BitSet dow = parseField(fields[4], 0, 7, DAY_NAMES, "day-of-week");
        if (dow.get(7)) {
            dow.set(0);
            dow.clear(7);
        }
        this.daysOfWeek = dow;
        this.dayOfMonthStar = fields[2].startsWith("*");
        this.dayOfWeekStar = fields[4].startsWith("*");
    }

    /**
     * Parse and validate an expression.
     *
     * @throws ConfigException if the expression is malformed or can never fire
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigException("Cron expression is empty");
        }
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        if (fields.length != 5) {
            throw new ConfigException("Invalid cron expression (need 5 fields): '" + trimmed + "'");
        }
        CronExpression cron = new CronExpression(trimmed, fields);
        if (cron.nextAfter(ZonedDateTime.of(2000, 1, 1, 0, 0, 0, 0, ZoneId.of("UTC"))) == null) {
            throw new ConfigException("Cron expression never fires: '" + trimmed + "'");
        }
        return cron;
    }

    /**
     * Smallest minute-aligned instant strictly after {@code after} that matches, evaluated in {@code zone}.
     *
     * @return the next fire time, or null if there is none within the search horizon
     */
    public Instant next(Instant after, ZoneId zone) {
        ZonedDateTime next = nextAfter(after.atZone(zone));
        return next != null ? next.toInstant() : null;
    }

    public Instant next(Instant after) {
        return next(after, ZoneId.of("UTC"));
    }

    private ZonedDateTime nextAfter(ZonedDateTime after) {
        ZonedDateTime t = after.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        ZonedDateTime limit = after.plusYears(SEARCH_YEARS);

        while (!t.isAfter(limit)) {
            if (!months.get(t.getMonthValue())) {
                t = t.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
                continue;
            }
            if (!dayMatches(t)) {
                t = t.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            int hour = hours.nextSetBit(t.getHour());
            if (hour < 0) {
                t = t.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            if (hour != t.getHour()) {
                ZonedDateTime moved = t.truncatedTo(ChronoUnit.DAYS).withHour(hour);
                // DST gap: the wall-clock hour does not exist, move past it
                t = moved.isAfter(t) ? moved : t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            int minute = minutes.nextSetBit(t.getMinute());
            if (minute < 0) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (minute != t.getMinute()) {
                t = t.withMinute(minute);
                continue;
            }
            return t;
        }
        return null;
    }

    boolean dayMatches(ZonedDateTime t) {
        boolean domMatch = daysOfMonth.get(t.getDayOfMonth());
        boolean dowMatch = daysOfWeek.get(t.getDayOfWeek().getValue() % 7);
        if (dayOfMonthStar || dayOfWeekStar) {
            return domMatch && dowMatch;
        }
        return domMatch || dowMatch;
    }

    private static BitSet parseField(String field, int min, int max, List<String> names, String label) {
        BitSet bits = new BitSet(max + 1);
        for (String part : field.split(",")) {
            if (part.isEmpty()) {
                throw new ConfigException("Empty list element in " + label + " field '" + field + "'");
            }
            int step = 1;
            String range = part;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                step = parseNumber(part.substring(slash + 1), label);
                if (step <= 0) {
                    throw new ConfigException("Step must be positive in " + label + " field '" + field + "'");
                }
            }

            int lo;
            int hi;
            if ("*".equals(range)) {
                lo = min;
                hi = max;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-", 2);
                lo = parseValue(bounds[0], names, label);
                hi = parseValue(bounds[1], names, label);
            } else {
                lo = parseValue(range, names, label);
                // "5/15" means from 5 to the end of the range every 15
                hi = slash >= 0 ? max : lo;
            }

            if (lo < min || hi > max || lo > hi) {
                throw new ConfigException(String.format("Value out of range in %s field '%s' (allowed %d-%d)",
                        label, field, min, max));
            }
            for (int v = lo; v <= hi; v += step) {
                bits.set(v);
            }
        }
        return bits;
    }

    private static int parseValue(String token, List<String> names, String label) {
        if (names != null) {
            int idx = names.indexOf(token.toUpperCase(Locale.ROOT));
            if (idx >= 0) {
                // month names are 1-based, weekday names 0-based
                return names.size() == 12 ? idx + 1 : idx;
            }
        }
        return parseNumber(token, label);
    }

    private static int parseNumber(String token, String label) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new ConfigException("Invalid " + label + " value '" + token + "'", e);
        }
    }

    @Override
    public String toString() {
        return expression;
    }
}
