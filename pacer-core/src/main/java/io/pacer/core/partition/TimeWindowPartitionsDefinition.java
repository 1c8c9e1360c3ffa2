package io.pacer.core.partition;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.pacer.core.schedule.CronExpressions;
import io.pacer.core.schedule.CronTickSequence;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Partitions that each cover the interval between two consecutive ticks of a cron expression.
 *
 * Only completed windows exist: a window whose end is later than the clock's current instant
 * has no partition yet. Keys are the formatted start of each window.
 */
public class TimeWindowPartitionsDefinition
        implements PartitionsDefinition
{
    public static final String DAILY_FORMAT = "uuuu-MM-dd";
    public static final String HOURLY_FORMAT = "uuuu-MM-dd-HH:mm";

    private final String cronSchedule;
    private final Instant start;
    private final ZoneId timeZone;
    private final String format;
    private final DateTimeFormatter formatter;
    private final Clock clock;

    public TimeWindowPartitionsDefinition(String cronSchedule, Instant start, ZoneId timeZone, String format, Clock clock)
    {
        CronExpressions.expand(checkNotNull(cronSchedule, "cronSchedule"));
        this.cronSchedule = cronSchedule;
        this.start = checkNotNull(start, "start");
        this.timeZone = checkNotNull(timeZone, "timeZone");
        this.format = checkNotNull(format, "format");
        this.formatter = DateTimeFormatter.ofPattern(format).withZone(timeZone);
        this.clock = checkNotNull(clock, "clock");
    }

    public static TimeWindowPartitionsDefinition daily(Instant start, ZoneId timeZone)
    {
        return new TimeWindowPartitionsDefinition("0 0 * * *", start, timeZone, DAILY_FORMAT, Clock.systemUTC());
    }

    public static TimeWindowPartitionsDefinition hourly(Instant start, ZoneId timeZone)
    {
        return new TimeWindowPartitionsDefinition("0 * * * *", start, timeZone, HOURLY_FORMAT, Clock.systemUTC());
    }

    public String getCronSchedule()
    {
        return cronSchedule;
    }

    public Instant getStart()
    {
        return start;
    }

    public ZoneId getTimeZone()
    {
        return timeZone;
    }

    public String getFormat()
    {
        return format;
    }

    public List<TimeWindow> getTimeWindows()
    {
        Instant now = clock.instant();
        ImmutableList.Builder<TimeWindow> builder = ImmutableList.builder();
        Iterator<ZonedDateTime> ticks = CronTickSequence.ascending(start, cronSchedule, timeZone).iterator();
        if (!ticks.hasNext()) {
            return builder.build();
        }
        ZonedDateTime windowStart = ticks.next();
        while (ticks.hasNext()) {
            ZonedDateTime windowEnd = ticks.next();
            if (windowEnd.toInstant().isAfter(now)) {
                break;
            }
            builder.add(TimeWindow.of(windowStart, windowEnd));
            windowStart = windowEnd;
        }
        return builder.build();
    }

    @Override
    public List<String> getPartitionKeys()
    {
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (TimeWindow window : getTimeWindows()) {
            builder.add(formatter.format(window.getStart()));
        }
        return builder.build();
    }

    public Optional<TimeWindow> timeWindowFor(String partitionKey)
    {
        for (TimeWindow window : getTimeWindows()) {
            if (formatter.format(window.getStart()).equals(partitionKey)) {
                return Optional.of(window);
            }
        }
        return Optional.absent();
    }

    /**
     * Keys of the partitions whose windows overlap the given window.
     */
    public List<String> getPartitionKeysIn(TimeWindow window)
    {
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (TimeWindow candidate : getTimeWindows()) {
            if (candidate.overlaps(window)) {
                builder.add(formatter.format(candidate.getStart()));
            }
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TimeWindowPartitionsDefinition other = (TimeWindowPartitionsDefinition) o;
        return cronSchedule.equals(other.cronSchedule) &&
            start.equals(other.start) &&
            timeZone.equals(other.timeZone) &&
            format.equals(other.format);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(cronSchedule, start, timeZone, format);
    }

    @Override
    public String toString()
    {
        return "TimeWindowPartitionsDefinition{" +
            "cronSchedule=" + cronSchedule +
            ", start=" + start +
            ", timeZone=" + timeZone +
            ", format=" + format +
            "}";
    }
}
