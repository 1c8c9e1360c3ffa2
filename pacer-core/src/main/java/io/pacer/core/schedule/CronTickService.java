package io.pacer.core.schedule;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;

/**
 * Entry point of the tick engine for schedulers.
 */
public class CronTickService
{
    private final CronExpressionCache cache;
    private final ZoneId defaultTimeZone;

    @Inject
    public CronTickService(CronExpressionCache cache, TickEngineConfig config)
    {
        this.cache = cache;
        this.defaultTimeZone = config.getDefaultTimeZone();
    }

    /**
     * Returns execution times of a schedule made of one or more cron expressions.
     *
     * @param startOrEnd first possible tick when ascending, last possible tick when descending
     * @param timeZone time zone the expressions are evaluated in, or absent for the default time zone
     * @throws InvalidCronExpressionException if the list is empty or an expression is invalid
     */
    public Iterable<ZonedDateTime> executionTimes(Instant startOrEnd, List<String> cronSchedule,
            Optional<ZoneId> timeZone, boolean ascending)
    {
        if (cronSchedule.isEmpty()) {
            throw new InvalidCronExpressionException("Cron schedule must have at least one cron expression");
        }
        ImmutableList.Builder<CronExpansion> expansions = ImmutableList.builder();
        for (String expression : cronSchedule) {
            expansions.add(cache.get(expression));
        }
        return ScheduleTickSequence.of(startOrEnd, expansions.build(), timeZone.or(defaultTimeZone), ascending);
    }

    public Iterable<ZonedDateTime> executionTimes(Instant startOrEnd, String cron,
            Optional<ZoneId> timeZone, boolean ascending)
    {
        return executionTimes(startOrEnd, ImmutableList.of(cron), timeZone, ascending);
    }

    public boolean isValidCronString(String expression)
    {
        return CronExpressions.isValidCronString(cache, expression);
    }

    public boolean isValidCronSchedule(List<String> cronSchedule)
    {
        return CronExpressions.isValidCronSchedule(cache, cronSchedule);
    }

    /**
     * True if {@code time} is exactly on a tick of {@code cron}, to the nanosecond.
     */
    public boolean isExactTick(String cron, ZonedDateTime time)
    {
        return cache.get(cron).isExactTick(time);
    }

    public ZoneId getDefaultTimeZone()
    {
        return defaultTimeZone;
    }
}
