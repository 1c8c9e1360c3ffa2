package io.pacer.standards.scheduler;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Iterator;
import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import io.pacer.core.schedule.CronTickService;
import io.pacer.spi.Schedule;

/**
 * A schedule firing at the ticks of one or more cron expressions, optionally bounded by a start
 * (inclusive) and an end (exclusive).
 */
public class CronSchedule
        implements Schedule
{
    private final List<String> cronSchedule;
    private final ZoneId timeZone;
    private final Optional<Instant> start;
    private final Optional<Instant> end;
    private final CronTickService tickService;

    CronSchedule(List<String> cronSchedule, ZoneId timeZone, Optional<Instant> start, Optional<Instant> end,
            CronTickService tickService)
    {
        this.cronSchedule = ImmutableList.copyOf(cronSchedule);
        this.timeZone = timeZone;
        this.start = start;
        this.end = end;
        this.tickService = tickService;
    }

    @Override
    public List<String> getCronSchedule()
    {
        return cronSchedule;
    }

    @Override
    public ZoneId getTimeZone()
    {
        return timeZone;
    }

    @Override
    public Optional<Instant> getStartDate()
    {
        return start;
    }

    @Override
    public Optional<Instant> getEndDate()
    {
        return end;
    }

    @Override
    public Iterable<ZonedDateTime> nextExecutionTimes(Instant currentTime)
    {
        Instant from = currentTime;
        if (start.isPresent() && start.get().isAfter(from)) {
            from = start.get();
        }
        Iterable<ZonedDateTime> ticks = tickService.executionTimes(from, cronSchedule, Optional.of(timeZone), true);
        return () -> new BoundedIterator(ticks.iterator());
    }

    @Override
    public Iterable<ZonedDateTime> previousExecutionTimes(Instant currentTime)
    {
        Instant from = currentTime;
        if (end.isPresent() && !end.get().isAfter(from)) {
            from = end.get().minusNanos(1);
        }
        Iterable<ZonedDateTime> ticks = tickService.executionTimes(from, cronSchedule, Optional.of(timeZone), false);
        return () -> new BoundedIterator(ticks.iterator());
    }

    private boolean isInRange(ZonedDateTime time)
    {
        Instant instant = time.toInstant();
        return (!start.isPresent() || !instant.isBefore(start.get())) &&
            (!end.isPresent() || instant.isBefore(end.get()));
    }

    // both directions move away from the range once a tick falls outside of it
    private class BoundedIterator
            extends AbstractIterator<ZonedDateTime>
    {
        private final Iterator<ZonedDateTime> ticks;

        BoundedIterator(Iterator<ZonedDateTime> ticks)
        {
            this.ticks = ticks;
        }

        @Override
        protected ZonedDateTime computeNext()
        {
            if (ticks.hasNext()) {
                ZonedDateTime next = ticks.next();
                if (isInRange(next)) {
                    return next;
                }
            }
            return endOfData();
        }
    }

    @Override
    public String toString()
    {
        return "CronSchedule{" +
            "cronSchedule=" + cronSchedule +
            ", timeZone=" + timeZone +
            ", start=" + start +
            ", end=" + end +
            "}";
    }
}
