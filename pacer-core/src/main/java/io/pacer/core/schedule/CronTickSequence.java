package io.pacer.core.schedule;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.Year;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

import com.google.common.base.Optional;
import com.google.common.collect.AbstractIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static io.pacer.core.schedule.CalendarMath.plusDays;
import static io.pacer.core.schedule.CalendarMath.withHour;
import static io.pacer.core.schedule.CalendarMath.withMinute;

/**
 * Ticks of one cron expression in one time zone, in ascending order from a start time or in descending
 * order from an end time.
 *
 * The sequence is unbounded. Every call of {@link #iterator()} starts over from the same origin and
 * iterators keep no state outside of themselves, so a sequence can be shared between threads.
 *
 * Expressions with a fixed interval ({@link ScheduleType}) are iterated by adding the interval. When the
 * expected local time falls into a spring-forward gap, the tick runs at the top of the hour after the
 * gap and the following ticks return to the expected time. Other expressions are iterated by matching
 * wall-clock fields, and each match is placed by {@link CalendarMath#resolveLocalTime(java.time.LocalDateTime, ZoneId)}
 * so that both kinds of expressions handle transitions the same way.
 */
public class CronTickSequence
        implements Iterable<ZonedDateTime>
{
    private static final Logger logger = LoggerFactory.getLogger(CronTickSequence.class);

    private final CronExpansion expansion;
    private final Instant origin;
    private final ZoneId timeZone;
    private final boolean ascending;
    private final int startOffset;

    private CronTickSequence(CronExpansion expansion, Instant origin, ZoneId timeZone, boolean ascending, int startOffset)
    {
        this.expansion = expansion;
        this.origin = origin;
        this.timeZone = timeZone;
        this.ascending = ascending;
        this.startOffset = startOffset;
    }

    /**
     * Ticks at or after {@code start}.
     */
    public static CronTickSequence ascending(Instant start, String cron, ZoneId timeZone)
    {
        return ascending(CronExpressions.expand(cron), start, timeZone, 0);
    }

    /**
     * Ticks from the {@code -startOffset}-th tick before {@code start}. With 0, same as
     * {@link #ascending(Instant, String, ZoneId)}.
     */
    public static CronTickSequence ascending(Instant start, String cron, ZoneId timeZone, int startOffset)
    {
        return ascending(CronExpressions.expand(cron), start, timeZone, startOffset);
    }

    public static CronTickSequence ascending(CronExpansion expansion, Instant start, ZoneId timeZone, int startOffset)
    {
        checkArgument(startOffset <= 0, "startOffset must not be positive: %s", startOffset);
        return new CronTickSequence(expansion, start, timeZone, true, startOffset);
    }

    /**
     * Ticks at or before {@code end}, latest first.
     */
    public static CronTickSequence descending(Instant end, String cron, ZoneId timeZone)
    {
        return descending(CronExpressions.expand(cron), end, timeZone);
    }

    public static CronTickSequence descending(CronExpansion expansion, Instant end, ZoneId timeZone)
    {
        return new CronTickSequence(expansion, end, timeZone, false, 0);
    }

    public CronExpansion getExpansion()
    {
        return expansion;
    }

    public ZoneId getTimeZone()
    {
        return timeZone;
    }

    public boolean isAscending()
    {
        return ascending;
    }

    @Override
    public Iterator<ZonedDateTime> iterator()
    {
        Optional<ScheduleType> type = expansion.getScheduleType();
        if (ascending) {
            if (expansion.isLeapDay()) {
                return new LeapDayIterator();
            }
            else if (type.isPresent()) {
                return new ForwardIntervalIterator(type.get());
            }
            else {
                return new ForwardMatchingIterator();
            }
        }
        else {
            if (type.isPresent()) {
                return new ReverseIntervalIterator(type.get());
            }
            else {
                return new ReverseMatchingIterator();
            }
        }
    }

    private ZonedDateTime originTime()
    {
        return origin.atZone(timeZone);
    }

    private boolean isBeforeStart(ZonedDateTime time)
    {
        return startOffset == 0 && time.toInstant().isBefore(origin);
    }

    private ZonedDateTime resolve(LocalDateTime match)
    {
        return CalendarMath.resolveLocalTime(match, timeZone);
    }

    private abstract class IntervalIterator
            extends AbstractIterator<ZonedDateTime>
    {
        protected final ScheduleType type;
        protected final Optional<Integer> expectedMinute;
        protected final Optional<Integer> expectedHour;
        protected final Deque<ZonedDateTime> ready = new ArrayDeque<>();
        protected ZonedDateTime current;

        IntervalIterator(ScheduleType type)
        {
            this.type = type;
            this.expectedMinute = expansion.getNumericValue(CronExpansion.MINUTE);
            this.expectedHour = expansion.getNumericValue(CronExpansion.HOUR);
        }

        @Override
        protected ZonedDateTime computeNext()
        {
            while (ready.isEmpty()) {
                advance();
            }
            return ready.poll();
        }

        /**
         * Moves {@code current} by one interval and queues the ticks passed on the way.
         */
        protected abstract void advance();

        protected ZonedDateTime gapTick(ZonedDateTime candidate)
        {
            ZonedDateTime tick = candidate.withMinute(0);
            logger.debug("Expected time of '{}' does not exist near {}, using {}",
                    expansion.getExpression(), candidate, tick);
            return tick;
        }
    }

    private class ForwardIntervalIterator
            extends IntervalIterator
    {
        ForwardIntervalIterator(ScheduleType type)
        {
            super(type);
            ZonedDateTime start = originTime();
            if (startOffset == 0 && expansion.isExactTick(start)) {
                // step from the start itself; the first advance() yields the tick after it
                current = start;
                ready.add(start);
            }
            else {
                current = PreviousTickLocator.findPrevious(expansion, start, 1 - startOffset);
            }
        }

        @Override
        protected void advance()
        {
            ZonedDateTime candidate = type.shift(current, 1);

            if (!type.isHourChangeExpected() && candidate.getHour() != current.getHour()) {
                offer(gapTick(candidate));
                candidate = type.shift(current, 2);
            }
            else if (expectedHour.isPresent() && candidate.getHour() != expectedHour.get()
                    && candidate.getOffset().equals(current.getOffset())) {
                // back from the top of the hour after a gap to the expected hour
                candidate = withHour(candidate, expectedHour.get());
            }

            if (expectedMinute.isPresent() && candidate.getMinute() != expectedMinute.get()) {
                candidate = withMinute(candidate, expectedMinute.get());
            }

            current = candidate;
            offer(candidate);
        }

        private void offer(ZonedDateTime tick)
        {
            if (isBeforeStart(tick)) {
                logger.debug("Skipping tick {} of '{}' before start time {}", tick, expansion.getExpression(), origin);
                return;
            }
            ready.add(tick);
        }
    }

    private class ReverseIntervalIterator
            extends IntervalIterator
    {
        ReverseIntervalIterator(ScheduleType type)
        {
            super(type);
            // latest tick at or before the end
            current = PreviousTickLocator.findPrevious(expansion, originTime().plusNanos(1));
            ready.add(current);
        }

        @Override
        protected void advance()
        {
            ZonedDateTime candidate = type.shift(current, -1);

            if (!type.isHourChangeExpected() && candidate.getHour() != current.getHour()) {
                offer(gapTick(candidate));
                candidate = type.shift(current, -2);
            }

            // the offset changes when stepping back from the top of the hour after a gap
            if (expectedHour.isPresent() && candidate.getHour() != expectedHour.get()) {
                candidate = withHour(candidate, expectedHour.get());
            }
            if (expectedMinute.isPresent() && candidate.getMinute() != expectedMinute.get()) {
                candidate = withMinute(candidate, expectedMinute.get());
            }

            current = candidate;
            offer(candidate);
        }

        private void offer(ZonedDateTime tick)
        {
            if (tick.toInstant().isAfter(origin)) {
                logger.debug("Skipping tick {} of '{}' after end time {}", tick, expansion.getExpression(), origin);
                return;
            }
            ready.add(tick);
        }
    }

    /**
     * Walks wall-clock matches in ascending order. Each match becomes one tick; a match inside a gap and
     * a match at the top of the hour after it run at the same instant and are emitted once.
     */
    private class ForwardMatchingIterator
            extends AbstractIterator<ZonedDateTime>
    {
        private LocalDateTime cursor;
        private ZonedDateTime previous;

        ForwardMatchingIterator()
        {
            // a transition moves a tick by less than a day from its wall-clock time
            LocalDateTime before = originTime().toLocalDateTime().minusDays(1);
            Optional<LocalDateTime> first = expansion.nextLocalMatch(before);
            while (first.isPresent() && resolve(first.get()).toInstant().isBefore(origin)) {
                before = first.get();
                first = expansion.nextLocalMatch(before);
            }
            this.cursor = before;

            if (startOffset < 0 && first.isPresent()) {
                ZonedDateTime seen = resolve(first.get());
                LocalDateTime back = first.get();
                int remaining = -startOffset;
                while (remaining > 0) {
                    Optional<LocalDateTime> earlier = expansion.lastLocalMatch(back);
                    if (!earlier.isPresent()) {
                        break;
                    }
                    back = earlier.get();
                    ZonedDateTime tick = resolve(back);
                    if (tick.isBefore(seen)) {
                        seen = tick;
                        remaining--;
                    }
                }
                this.cursor = back.minusSeconds(1);
            }
        }

        @Override
        protected ZonedDateTime computeNext()
        {
            while (true) {
                Optional<LocalDateTime> next = expansion.nextLocalMatch(cursor);
                if (!next.isPresent()) {
                    return endOfData();
                }
                cursor = next.get();
                ZonedDateTime tick = resolve(cursor);
                if (previous != null && !tick.isAfter(previous)) {
                    logger.debug("Skipping tick {} of '{}' already emitted for an earlier match", tick, expansion.getExpression());
                    continue;
                }
                previous = tick;
                return tick;
            }
        }
    }

    private class ReverseMatchingIterator
            extends AbstractIterator<ZonedDateTime>
    {
        private LocalDateTime cursor = originTime().toLocalDateTime().plusDays(1);
        private ZonedDateTime previous;

        @Override
        protected ZonedDateTime computeNext()
        {
            while (true) {
                Optional<LocalDateTime> last = expansion.lastLocalMatch(cursor);
                if (!last.isPresent()) {
                    return endOfData();
                }
                cursor = last.get();
                ZonedDateTime tick = resolve(cursor);
                if (tick.toInstant().isAfter(origin)) {
                    continue;
                }
                if (previous != null && !tick.isBefore(previous)) {
                    logger.debug("Skipping tick {} of '{}' already emitted for a later match", tick, expansion.getExpression());
                    continue;
                }
                previous = tick;
                return tick;
            }
        }
    }

    /**
     * February 29th ticks are the February 28th ticks of leap years moved by one day.
     */
    private class LeapDayIterator
            extends AbstractIterator<ZonedDateTime>
    {
        private final Iterator<ZonedDateTime> dayBefore;

        LeapDayIterator()
        {
            CronExpansion base = CronExpressions.expand(expansion.getLeapDayBaseExpression());
            // a start on February 29th itself needs the tick of the day before
            Instant baseStart = plusDays(originTime(), -1).toInstant();
            this.dayBefore = CronTickSequence.ascending(base, baseStart, timeZone, startOffset).iterator();
        }

        @Override
        protected ZonedDateTime computeNext()
        {
            while (dayBefore.hasNext()) {
                ZonedDateTime tick = dayBefore.next();
                if (!Year.isLeap(tick.getYear())) {
                    continue;
                }
                ZonedDateTime shifted = plusDays(tick, 1);
                if (isBeforeStart(shifted)) {
                    continue;
                }
                return shifted;
            }
            return endOfData();
        }
    }
}
