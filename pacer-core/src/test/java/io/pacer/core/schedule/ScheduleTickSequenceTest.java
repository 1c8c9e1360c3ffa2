package io.pacer.core.schedule;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.TreeSet;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import static io.pacer.core.schedule.TickTestHelper.instant;
import static io.pacer.core.schedule.TickTestHelper.take;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class ScheduleTickSequenceTest
{
    private static final ZoneId UTC = ZoneId.of("UTC");

    private static ScheduleTickSequence union(String time, boolean ascending, String... crons)
    {
        ImmutableList.Builder<CronExpansion> expansions = ImmutableList.builder();
        for (String cron : crons) {
            expansions.add(CronExpander.expand(cron));
        }
        return ScheduleTickSequence.of(instant(time), expansions.build(), UTC, ascending);
    }

    @Test
    public void earliestOfAllExpressions()
    {
        assertThat(take(union("2016-02-03 12:00:00 +0000", true, "0 9 * * *", "0 17 * * *"), 4),
                is(ImmutableList.of(
                        "2016-02-03 17:00:00 +0000",
                        "2016-02-04 09:00:00 +0000",
                        "2016-02-04 17:00:00 +0000",
                        "2016-02-05 09:00:00 +0000")));
    }

    @Test
    public void coincidingTicksAreEmittedOnce()
    {
        assertThat(take(union("2016-02-03 00:00:00 +0000", true, "0 * * * *", "0 */2 * * *"), 4),
                is(ImmutableList.of(
                        "2016-02-03 00:00:00 +0000",
                        "2016-02-03 01:00:00 +0000",
                        "2016-02-03 02:00:00 +0000",
                        "2016-02-03 03:00:00 +0000")));
        assertThat(take(union("2016-02-03 00:00:00 +0000", true, "0 10 * * *", "0 10 * * *"), 2),
                is(ImmutableList.of(
                        "2016-02-03 10:00:00 +0000",
                        "2016-02-04 10:00:00 +0000")));
    }

    @Test
    public void descendingEmitsLatestFirst()
    {
        assertThat(take(union("2016-02-04 12:00:00 +0000", false, "0 9 * * *", "0 17 * * *"), 3),
                is(ImmutableList.of(
                        "2016-02-04 09:00:00 +0000",
                        "2016-02-03 17:00:00 +0000",
                        "2016-02-03 09:00:00 +0000")));
    }

    @Test
    public void equalsSortedMergeOfEachExpression()
    {
        Instant start = instant("2016-02-01 00:00:00 +0000");
        Instant end = instant("2016-02-11 00:00:00 +0000");
        List<String> crons = ImmutableList.of("0 9 * * 1-5", "30 */6 * * *", "0 12 * * 3");

        TreeSet<Instant> expected = new TreeSet<>();
        for (String cron : crons) {
            for (ZonedDateTime tick : CronTickSequence.ascending(start, cron, UTC)) {
                if (tick.toInstant().isAfter(end)) {
                    break;
                }
                expected.add(tick.toInstant());
            }
        }

        ImmutableList.Builder<Instant> actual = ImmutableList.builder();
        for (ZonedDateTime tick : union("2016-02-01 00:00:00 +0000", true, crons.toArray(new String[0]))) {
            if (tick.toInstant().isAfter(end)) {
                break;
            }
            actual.add(tick.toInstant());
        }
        assertThat(actual.build(), is(ImmutableList.copyOf(expected)));
    }
}
