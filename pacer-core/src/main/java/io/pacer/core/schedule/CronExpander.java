package io.pacer.core.schedule;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import io.pacer.core.schedule.CronExpansion.NthWeekday;

import static io.pacer.core.schedule.CronExpansion.DAY_OF_MONTH;
import static io.pacer.core.schedule.CronExpansion.DAY_OF_WEEK;
import static io.pacer.core.schedule.CronExpansion.FIELD_COUNT;
import static io.pacer.core.schedule.CronExpansion.MONTH;

/**
 * Parses 5-field cron expressions.
 *
 * Supported syntax per field: {@code *}, {@code ?} (same as {@code *}), numbers, 3-letter month and weekday
 * names, ranges {@code a-b}, steps on a wildcard, a range or a start value ({@code a-b/n}, {@code a/n}), and
 * comma separated lists.
 * Day of month also accepts {@code L} (last day of the month) and day of week accepts {@code d#n}
 * (the n-th given weekday of the month). Day of week 7 is Sunday, same as 0.
 *
 * Expressions with a seconds or years field are rejected.
 */
public final class CronExpander
{
    private static final Splitter FIELD_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
    private static final Splitter LIST_SPLITTER = Splitter.on(',');

    private static final String[] FIELD_NAMES = {"minute", "hour", "day of month", "month", "day of week"};
    private static final int[] MIN_VALUES = {0, 0, 1, 1, 0};
    private static final int[] MAX_VALUES = {59, 23, 31, 12, 7};
    private static final int[] WILDCARD_MAX_VALUES = {59, 23, 31, 12, 6};
    private static final int[] FULL_SIZES = {60, 24, 31, 12, 7};

    private static final Map<String, Integer> MONTH_NAMES = ImmutableMap.<String, Integer>builder()
        .put("jan", 1).put("feb", 2).put("mar", 3).put("apr", 4)
        .put("may", 5).put("jun", 6).put("jul", 7).put("aug", 8)
        .put("sep", 9).put("oct", 10).put("nov", 11).put("dec", 12)
        .build();

    private static final Map<String, Integer> DAY_OF_WEEK_NAMES = ImmutableMap.<String, Integer>builder()
        .put("sun", 0).put("mon", 1).put("tue", 2).put("wed", 3)
        .put("thu", 4).put("fri", 5).put("sat", 6)
        .build();

    // unix crontab fields plus L and #, used for iteration of expressions without a fixed interval
    private static final CronDefinition CRON_DEFINITION = CronDefinitionBuilder.defineCron()
        .withMinutes().withValidRange(0, 59).withStrictRange().and()
        .withHours().withValidRange(0, 23).withStrictRange().and()
        .withDayOfMonth().withValidRange(1, 31).supportsL().and()
        .withMonth().withValidRange(1, 12).withStrictRange().and()
        .withDayOfWeek().withValidRange(0, 7).withMondayDoWValue(1).supportsHash().and()
        .instance();

    private static final CronParser CRON_PARSER = new CronParser(CRON_DEFINITION);

    private CronExpander()
    { }

    public static CronExpansion expand(String expression)
    {
        if (expression == null) {
            throw new InvalidCronExpressionException("Cron expression must not be null");
        }

        List<String> fields = FIELD_SPLITTER.splitToList(expression);
        if (fields.size() != FIELD_COUNT) {
            throw new InvalidCronExpressionException(expression,
                    String.format(Locale.ENGLISH, "expected %d fields but got %d", FIELD_COUNT, fields.size()));
        }

        List<ImmutableSortedSet<Integer>> values = new ArrayList<>();
        List<Boolean> wildcards = new ArrayList<>();
        boolean lastDayOfMonth = false;
        List<NthWeekday> nthWeekdays = new ArrayList<>();

        for (int field = 0; field < FIELD_COUNT; field++) {
            FieldParser parser = new FieldParser(expression, field);
            for (String part : LIST_SPLITTER.split(fields.get(field))) {
                parser.parsePart(part);
            }
            values.add(ImmutableSortedSet.copyOf(parser.values));
            wildcards.add(parser.isWildcard());
            if (field == DAY_OF_MONTH) {
                lastDayOfMonth = parser.lastDayOfMonth;
            }
            else if (field == DAY_OF_WEEK) {
                nthWeekdays.addAll(parser.nthWeekdays);
            }
        }

        if (!wildcards.get(DAY_OF_MONTH) && wildcards.get(DAY_OF_WEEK) && !lastDayOfMonth
                && values.get(DAY_OF_MONTH).first() > longestMonthLength(values.get(MONTH))) {
            throw new InvalidCronExpressionException(expression, "day of month never exists in the given months");
        }

        CronExpansion shape = new CronExpansion(expression, values, wildcards, lastDayOfMonth, nthWeekdays, null);
        String canonical = shape.getCanonicalExpression();
        ExecutionTime executionTime;
        try {
            executionTime = ExecutionTime.forCron(CRON_PARSER.parse(canonical));
        }
        catch (IllegalArgumentException ex) {
            throw new InvalidCronExpressionException(expression, ex.getMessage(), ex);
        }

        return new CronExpansion(expression, values, wildcards, lastDayOfMonth, nthWeekdays, executionTime);
    }

    private static int longestMonthLength(ImmutableSortedSet<Integer> months)
    {
        int longest = 0;
        for (int month : months) {
            int length;
            switch (month) {
            case 2:
                length = 29;
                break;
            case 4:
            case 6:
            case 9:
            case 11:
                length = 30;
                break;
            default:
                length = 31;
            }
            longest = Math.max(longest, length);
        }
        return longest;
    }

    private static class FieldParser
    {
        private final String expression;
        private final int field;
        private final TreeSet<Integer> values = new TreeSet<>();
        private final List<NthWeekday> nthWeekdays = new ArrayList<>();
        private boolean lastDayOfMonth = false;

        FieldParser(String expression, int field)
        {
            this.expression = expression;
            this.field = field;
        }

        boolean isWildcard()
        {
            return !lastDayOfMonth && nthWeekdays.isEmpty() && values.size() == FULL_SIZES[field];
        }

        void parsePart(String part)
        {
            if (part.isEmpty()) {
                throw invalid("empty list item");
            }

            if (field == DAY_OF_MONTH && part.equalsIgnoreCase("L")) {
                lastDayOfMonth = true;
                return;
            }

            if (field == DAY_OF_WEEK && part.indexOf('#') >= 0) {
                List<String> pair = Splitter.on('#').splitToList(part);
                if (pair.size() != 2) {
                    throw invalid("malformed nth weekday '" + part + "'");
                }
                int dayOfWeek = parseValue(pair.get(0)) % 7;
                int nth = parseNumber(pair.get(1));
                if (nth < 1 || nth > 5) {
                    throw invalid("nth weekday must be between 1 and 5 but got " + nth);
                }
                nthWeekdays.add(new NthWeekday(dayOfWeek, nth));
                return;
            }

            int slash = part.indexOf('/');
            String base = slash < 0 ? part : part.substring(0, slash);
            int step = 1;
            if (slash >= 0) {
                step = parseNumber(part.substring(slash + 1));
                if (step <= 0) {
                    throw invalid("step must be positive in '" + part + "'");
                }
            }

            int low;
            int high;
            if (base.equals("*") || base.equals("?")) {
                if (base.equals("?") && field != DAY_OF_MONTH && field != DAY_OF_WEEK) {
                    throw invalid("'?' is allowed only in day of month and day of week");
                }
                low = MIN_VALUES[field];
                high = WILDCARD_MAX_VALUES[field];
            }
            else if (base.indexOf('-') > 0) {
                List<String> range = Splitter.on('-').splitToList(base);
                if (range.size() != 2) {
                    throw invalid("malformed range '" + base + "'");
                }
                low = parseValue(range.get(0));
                high = parseValue(range.get(1));
                if (low > high) {
                    throw invalid("range start is greater than its end in '" + base + "'");
                }
            }
            else {
                low = parseValue(base);
                high = slash < 0 ? low : WILDCARD_MAX_VALUES[field];
            }

            for (int v = low; v <= high; v += step) {
                values.add(field == DAY_OF_WEEK ? v % 7 : v);
            }
        }

        private int parseValue(String token)
        {
            int value;
            if (!token.isEmpty() && CharMatcher.inRange('0', '9').matchesAllOf(token)) {
                value = parseNumber(token);
            }
            else {
                Map<String, Integer> names;
                if (field == MONTH) {
                    names = MONTH_NAMES;
                }
                else if (field == DAY_OF_WEEK) {
                    names = DAY_OF_WEEK_NAMES;
                }
                else {
                    throw invalid("'" + token + "' is not a number");
                }
                Integer named = names.get(token.toLowerCase(Locale.ENGLISH));
                if (named == null) {
                    throw invalid("unknown name '" + token + "'");
                }
                value = named;
            }
            if (value < MIN_VALUES[field] || value > MAX_VALUES[field]) {
                throw invalid(String.format(Locale.ENGLISH, "%d is out of range %d-%d",
                            value, MIN_VALUES[field], MAX_VALUES[field]));
            }
            return value;
        }

        private int parseNumber(String token)
        {
            if (token.isEmpty() || !CharMatcher.inRange('0', '9').matchesAllOf(token) || token.length() > 4) {
                throw invalid("'" + token + "' is not a number");
            }
            return Integer.parseInt(token);
        }

        private InvalidCronExpressionException invalid(String reason)
        {
            return new InvalidCronExpressionException(expression, FIELD_NAMES[field] + " field: " + reason);
        }
    }
}
