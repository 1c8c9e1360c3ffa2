package io.pacer.core.schedule;

import java.time.Instant;
import java.time.ZonedDateTime;

import com.google.common.base.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static io.pacer.core.schedule.CalendarMath.resolveLocalTime;

/**
 * Computes the latest tick of a fixed-interval schedule that is strictly before a reference time,
 * using calendar arithmetic only.
 */
public final class PreviousTickLocator
{
    private PreviousTickLocator()
    { }

    public static ZonedDateTime findPrevious(CronExpansion expansion, ZonedDateTime reference)
    {
        return findPrevious(expansion, reference, 1);
    }

    public static ZonedDateTime findPrevious(CronExpansion expansion, ZonedDateTime reference, int steps)
    {
        Optional<ScheduleType> type = expansion.getScheduleType();
        checkArgument(type.isPresent(), "'%s' is not a fixed-interval schedule", expansion.getExpression());
        return findPrevious(type.get(),
                expansion.getNumericValue(CronExpansion.MINUTE),
                expansion.getNumericValue(CronExpansion.HOUR),
                expansion.getNumericValue(CronExpansion.DAY_OF_MONTH),
                expansion.getNumericValue(CronExpansion.DAY_OF_WEEK),
                reference, steps);
    }

    public static ZonedDateTime findPrevious(ScheduleType type,
            Optional<Integer> minute, Optional<Integer> hour,
            Optional<Integer> day, Optional<Integer> dayOfWeek,
            ZonedDateTime reference, int steps)
    {
        checkArgument(steps >= 1, "steps must be positive: %s", steps);
        ZonedDateTime time = reference;
        for (int i = 0; i < steps; i++) {
            time = findPrevious(type, minute, hour, day, dayOfWeek, time);
        }
        return time;
    }

    public static ZonedDateTime findPrevious(ScheduleType type,
            Optional<Integer> minute, Optional<Integer> hour,
            Optional<Integer> day, Optional<Integer> dayOfWeek,
            ZonedDateTime reference)
    {
        switch (type) {
        case HOURLY:
            return previousHourly(required(minute, "minute"), reference);
        case DAILY:
            return previousDaily(required(hour, "hour"), required(minute, "minute"), reference);
        case WEEKLY:
            return previousWeekly(required(hour, "hour"), required(minute, "minute"),
                    required(dayOfWeek, "day of week"), reference);
        case MONTHLY:
            return previousMonthly(required(hour, "hour"), required(minute, "minute"),
                    required(day, "day of month"), reference);
        default:
            throw new IllegalArgumentException("Unexpected schedule type: " + type);
        }
    }

    private static ZonedDateTime previousHourly(int minute, ZonedDateTime reference)
    {
        long seconds = reference.toEpochSecond();
        seconds -= Math.floorMod(seconds, 60L);
        seconds -= 60L * Math.floorMod(reference.getMinute() - minute, 60);

        if (!Instant.ofEpochSecond(seconds).isBefore(reference.toInstant())) {
            seconds -= 3600L;
        }
        return Instant.ofEpochSecond(seconds).atZone(reference.getZone());
    }

    private static ZonedDateTime previousDaily(int hour, int minute, ZonedDateTime reference)
    {
        ZonedDateTime time = resolveLocalTime(reference, hour, minute, reference.getDayOfMonth());

        if (!time.isBefore(reference)) {
            time = ScheduleType.DAILY.shift(time, -1);
            // the shift may cross a transition and move the wall clock
            time = resolveLocalTime(time, hour, minute, time.getDayOfMonth());
        }
        return time;
    }

    private static ZonedDateTime previousWeekly(int hour, int minute, int dayOfWeek, ZonedDateTime reference)
    {
        ZonedDateTime time = resolveLocalTime(reference, hour, minute, reference.getDayOfMonth());

        int currentDayOfWeek = CronExpansion.dayOfWeekOf(time.toLocalDateTime());
        if (currentDayOfWeek != dayOfWeek) {
            time = ScheduleType.DAILY.shift(time, -Math.floorMod(currentDayOfWeek - dayOfWeek, 7));
        }

        if (!time.isBefore(reference)) {
            time = ScheduleType.WEEKLY.shift(time, -1);
        }

        return resolveLocalTime(time, hour, minute, time.getDayOfMonth());
    }

    private static ZonedDateTime previousMonthly(int hour, int minute, int day, ZonedDateTime reference)
    {
        ZonedDateTime time = resolveLocalTime(reference, hour, minute, day);

        if (!time.isBefore(reference)) {
            time = ScheduleType.MONTHLY.shift(time, -1);
            time = resolveLocalTime(time, hour, minute, day);
        }
        return time;
    }

    private static int required(Optional<Integer> value, String field)
    {
        checkState(value.isPresent(), "%s must be a single value", field);
        return value.get();
    }
}
