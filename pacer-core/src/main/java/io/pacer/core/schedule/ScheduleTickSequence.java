package io.pacer.core.schedule;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Union of the tick sequences of several cron expressions.
 *
 * Ascending unions emit the earliest pending tick of all expressions, descending unions the latest.
 * Expressions that tick at the same instant produce one tick.
 */
public class ScheduleTickSequence
        implements Iterable<ZonedDateTime>
{
    private final List<CronTickSequence> sequences;
    private final boolean ascending;

    private ScheduleTickSequence(List<CronTickSequence> sequences, boolean ascending)
    {
        this.sequences = sequences;
        this.ascending = ascending;
    }

    public static ScheduleTickSequence of(Instant startOrEnd, List<CronExpansion> expansions, ZoneId timeZone, boolean ascending)
    {
        checkArgument(!expansions.isEmpty(), "at least one cron expression is required");
        ImmutableList.Builder<CronTickSequence> builder = ImmutableList.builder();
        for (CronExpansion expansion : expansions) {
            builder.add(ascending
                    ? CronTickSequence.ascending(expansion, startOrEnd, timeZone, 0)
                    : CronTickSequence.descending(expansion, startOrEnd, timeZone));
        }
        return new ScheduleTickSequence(builder.build(), ascending);
    }

    public List<CronTickSequence> getSequences()
    {
        return sequences;
    }

    @Override
    public Iterator<ZonedDateTime> iterator()
    {
        if (sequences.size() == 1) {
            return sequences.get(0).iterator();
        }
        ImmutableList.Builder<PeekingIterator<ZonedDateTime>> iterators = ImmutableList.builder();
        for (CronTickSequence sequence : sequences) {
            iterators.add(Iterators.peekingIterator(sequence.iterator()));
        }
        return new UnionIterator(iterators.build());
    }

    private class UnionIterator
            extends AbstractIterator<ZonedDateTime>
    {
        private final List<PeekingIterator<ZonedDateTime>> iterators;

        UnionIterator(List<PeekingIterator<ZonedDateTime>> iterators)
        {
            this.iterators = iterators;
        }

        @Override
        protected ZonedDateTime computeNext()
        {
            ZonedDateTime selected = null;
            for (PeekingIterator<ZonedDateTime> it : iterators) {
                if (!it.hasNext()) {
                    continue;
                }
                ZonedDateTime head = it.peek();
                if (selected == null || (ascending ? head.isBefore(selected) : head.isAfter(selected))) {
                    selected = head;
                }
            }
            if (selected == null) {
                return endOfData();
            }

            for (PeekingIterator<ZonedDateTime> it : iterators) {
                if (it.hasNext() && it.peek().isEqual(selected)) {
                    it.next();
                }
            }
            return selected;
        }
    }
}
