package io.pacer.core.schedule;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.SortedSet;

import com.cronutils.model.time.ExecutionTime;
import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

/**
 * A parsed 5-field cron expression.
 *
 * Each field is expanded to the sorted set of values it matches. Instances are created by
 * {@link CronExpander} and are immutable.
 */
public final class CronExpansion
{
    public static final int MINUTE = 0;
    public static final int HOUR = 1;
    public static final int DAY_OF_MONTH = 2;
    public static final int MONTH = 3;
    public static final int DAY_OF_WEEK = 4;

    static final int FIELD_COUNT = 5;

    private static final Joiner LIST_JOINER = Joiner.on(',');

    /**
     * The {@code n}th occurrence of a day of week in a month, written {@code d#n}.
     */
    public static final class NthWeekday
    {
        private final int dayOfWeek;
        private final int nth;

        NthWeekday(int dayOfWeek, int nth)
        {
            this.dayOfWeek = dayOfWeek;
            this.nth = nth;
        }

        public int getDayOfWeek()
        {
            return dayOfWeek;
        }

        public int getNth()
        {
            return nth;
        }

        @Override
        public String toString()
        {
            return dayOfWeek + "#" + nth;
        }
    }

    private final String expression;
    private final List<ImmutableSortedSet<Integer>> values;
    private final List<Boolean> wildcards;
    private final boolean lastDayOfMonth;
    private final List<NthWeekday> nthWeekdays;
    private final ExecutionTime executionTime;

    CronExpansion(String expression,
            List<ImmutableSortedSet<Integer>> values,
            List<Boolean> wildcards,
            boolean lastDayOfMonth,
            List<NthWeekday> nthWeekdays,
            ExecutionTime executionTime)
    {
        this.expression = expression;
        this.values = ImmutableList.copyOf(values);
        this.wildcards = ImmutableList.copyOf(wildcards);
        this.lastDayOfMonth = lastDayOfMonth;
        this.nthWeekdays = ImmutableList.copyOf(nthWeekdays);
        this.executionTime = executionTime;
    }

    public String getExpression()
    {
        return expression;
    }

    /**
     * Values matched by a field. Day of week uses 0 for Sunday. Special day-of-month and day-of-week
     * forms ({@code L}, {@code d#n}) are not included.
     */
    public SortedSet<Integer> getValues(int field)
    {
        return values.get(field);
    }

    public boolean isWildcard(int field)
    {
        return wildcards.get(field);
    }

    /**
     * True if the field matches exactly one explicit value.
     */
    public boolean isNumeric(int field)
    {
        if (isWildcard(field) || values.get(field).size() != 1) {
            return false;
        }
        if (field == DAY_OF_MONTH && lastDayOfMonth) {
            return false;
        }
        if (field == DAY_OF_WEEK && !nthWeekdays.isEmpty()) {
            return false;
        }
        return true;
    }

    public Optional<Integer> getNumericValue(int field)
    {
        if (isNumeric(field)) {
            return Optional.of(values.get(field).first());
        }
        return Optional.absent();
    }

    public boolean isLastDayOfMonth()
    {
        return lastDayOfMonth;
    }

    public boolean hasNthWeekday()
    {
        return !nthWeekdays.isEmpty();
    }

    public List<NthWeekday> getNthWeekdays()
    {
        return nthWeekdays;
    }

    /**
     * Returns the calendar unit this expression ticks once per, or absent when ticks have to be found
     * by matching fields.
     */
    public Optional<ScheduleType> getScheduleType()
    {
        if (hasNthWeekday()) {
            return Optional.absent();
        }
        if (isNumeric(MINUTE) && isNumeric(HOUR) && isNumeric(DAY_OF_MONTH)
                && isWildcard(MONTH) && isWildcard(DAY_OF_WEEK)) {
            // days after the 28th are missing in some months
            if (values.get(DAY_OF_MONTH).first() > 28) {
                return Optional.absent();
            }
            return Optional.of(ScheduleType.MONTHLY);
        }
        if (isNumeric(MINUTE) && isNumeric(HOUR) && isNumeric(DAY_OF_WEEK)
                && isWildcard(DAY_OF_MONTH) && isWildcard(MONTH)) {
            return Optional.of(ScheduleType.WEEKLY);
        }
        if (isNumeric(MINUTE) && isNumeric(HOUR)
                && isWildcard(DAY_OF_MONTH) && isWildcard(MONTH) && isWildcard(DAY_OF_WEEK)) {
            return Optional.of(ScheduleType.DAILY);
        }
        if (isNumeric(MINUTE)
                && isWildcard(HOUR) && isWildcard(DAY_OF_MONTH) && isWildcard(MONTH) && isWildcard(DAY_OF_WEEK)) {
            return Optional.of(ScheduleType.HOURLY);
        }
        return Optional.absent();
    }

    /**
     * True for expressions that fire only on February 29th.
     */
    public boolean isLeapDay()
    {
        return isNumeric(DAY_OF_MONTH) && values.get(DAY_OF_MONTH).first() == 29
            && isNumeric(MONTH) && values.get(MONTH).first() == 2
            && isWildcard(DAY_OF_WEEK);
    }

    /**
     * Same minute and hour fields on February 28th. Ticks of a leap-day expression are the ticks of this
     * expression in leap years, one day later.
     */
    String getLeapDayBaseExpression()
    {
        return getCanonicalField(MINUTE) + " " + getCanonicalField(HOUR) + " 28 2 *";
    }

    /**
     * The expression rewritten with explicit numeric lists, as understood by the generic matcher.
     */
    public String getCanonicalExpression()
    {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < FIELD_COUNT; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(getCanonicalField(i));
        }
        return sb.toString();
    }

    private String getCanonicalField(int field)
    {
        if (isWildcard(field)) {
            return "*";
        }
        ImmutableList.Builder<Object> items = ImmutableList.builder();
        items.addAll(values.get(field));
        if (field == DAY_OF_MONTH && lastDayOfMonth) {
            items.add("L");
        }
        if (field == DAY_OF_WEEK) {
            items.addAll(nthWeekdays);
        }
        return LIST_JOINER.join(items.build());
    }

    /**
     * Tests the local wall-clock fields of {@code time}. Seconds are ignored.
     *
     * When both day of month and day of week are restricted, a day matching either one matches.
     */
    public boolean matches(LocalDateTime time)
    {
        return executionTime.isMatch(wallClock(time));
    }

    /**
     * True if {@code time} is a tick of this expression.
     *
     * Seconds must be zero and the wall-clock fields must match. A wall-clock time repeated by a fall-back
     * transition is a tick only at its later occurrence, except for hourly expressions, which tick in
     * both occurrences of the repeated hour.
     */
    public boolean isExactTick(ZonedDateTime time)
    {
        if (time.getSecond() != 0 || time.getNano() != 0) {
            return false;
        }
        LocalDateTime local = time.toLocalDateTime();
        if (!matches(local)) {
            return false;
        }
        if (getScheduleType().orNull() == ScheduleType.HOURLY) {
            return true;
        }
        return time.toInstant().equals(CalendarMath.atLocal(local, time.getZone()).toInstant());
    }

    /**
     * First wall-clock time after {@code time} that matches. Local times skipped or repeated by
     * daylight saving transitions are visited exactly once.
     */
    Optional<LocalDateTime> nextLocalMatch(LocalDateTime time)
    {
        return Optional.fromJavaUtil(executionTime.nextExecution(wallClock(time))).transform(ZonedDateTime::toLocalDateTime);
    }

    /**
     * Last wall-clock time before {@code time} that matches.
     */
    Optional<LocalDateTime> lastLocalMatch(LocalDateTime time)
    {
        return Optional.fromJavaUtil(executionTime.lastExecution(wallClock(time))).transform(ZonedDateTime::toLocalDateTime);
    }

    // UTC has no transitions, so the matcher sees plain calendar fields
    private static ZonedDateTime wallClock(LocalDateTime time)
    {
        return time.atZone(ZoneOffset.UTC);
    }

    static int dayOfWeekOf(LocalDateTime time)
    {
        // DayOfWeek runs 1 (Monday) to 7 (Sunday); cron uses 0 for Sunday
        return time.getDayOfWeek().getValue() % 7;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CronExpansion)) {
            return false;
        }
        return getCanonicalExpression().equals(((CronExpansion) o).getCanonicalExpression());
    }

    @Override
    public int hashCode()
    {
        return getCanonicalExpression().hashCode();
    }

    @Override
    public String toString()
    {
        return "CronExpansion{" + expression + " => " + getCanonicalExpression() + "}";
    }
}
