package io.pacer.core.partition;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.pacer.core.schedule.InvalidCronExpressionException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class TimeWindowPartitionsDefinitionTest
{
    @Rule
    public ExpectedException exception = ExpectedException.none();

    private static Clock clockAt(String instant)
    {
        return Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
    }

    @Test
    public void dailyKeysOfCompletedWindows()
    {
        TimeWindowPartitionsDefinition daily = new TimeWindowPartitionsDefinition("0 0 * * *",
                Instant.parse("2022-01-01T00:00:00Z"), ZoneId.of("UTC"),
                TimeWindowPartitionsDefinition.DAILY_FORMAT, clockAt("2022-01-04T12:00:00Z"));
        assertThat(daily.getPartitionKeys(), is(ImmutableList.of("2022-01-01", "2022-01-02", "2022-01-03")));
    }

    @Test
    public void windowEndingNowIsComplete()
    {
        TimeWindowPartitionsDefinition daily = new TimeWindowPartitionsDefinition("0 0 * * *",
                Instant.parse("2022-01-01T00:00:00Z"), ZoneId.of("UTC"),
                TimeWindowPartitionsDefinition.DAILY_FORMAT, clockAt("2022-01-03T00:00:00Z"));
        assertThat(daily.getPartitionKeys(), is(ImmutableList.of("2022-01-01", "2022-01-02")));
    }

    @Test
    public void startBetweenTicks()
    {
        TimeWindowPartitionsDefinition daily = new TimeWindowPartitionsDefinition("0 0 * * *",
                Instant.parse("2022-01-01T05:00:00Z"), ZoneId.of("UTC"),
                TimeWindowPartitionsDefinition.DAILY_FORMAT, clockAt("2022-01-04T00:00:00Z"));
        assertThat(daily.getPartitionKeys(), is(ImmutableList.of("2022-01-02", "2022-01-03")));
    }

    @Test
    public void timeZone()
    {
        ZoneId tokyo = ZoneId.of("Asia/Tokyo");
        TimeWindowPartitionsDefinition daily = new TimeWindowPartitionsDefinition("0 0 * * *",
                Instant.parse("2021-12-31T15:00:00Z"), tokyo,
                TimeWindowPartitionsDefinition.DAILY_FORMAT, clockAt("2022-01-02T15:00:00Z"));
        assertThat(daily.getPartitionKeys(), is(ImmutableList.of("2022-01-01", "2022-01-02")));

        TimeWindow window = daily.timeWindowFor("2022-01-02").get();
        assertThat(window.getStart(), is(ZonedDateTime.of(2022, 1, 2, 0, 0, 0, 0, tokyo)));
        assertThat(window.getEnd(), is(ZonedDateTime.of(2022, 1, 3, 0, 0, 0, 0, tokyo)));
    }

    @Test
    public void hourly()
    {
        TimeWindowPartitionsDefinition hourly = new TimeWindowPartitionsDefinition("0 * * * *",
                Instant.parse("2022-01-01T00:00:00Z"), ZoneId.of("UTC"),
                TimeWindowPartitionsDefinition.HOURLY_FORMAT, clockAt("2022-01-01T02:30:00Z"));
        assertThat(hourly.getPartitionKeys(), is(ImmutableList.of("2022-01-01-00:00", "2022-01-01-01:00")));
        assertThat(hourly.timeWindowFor("2022-01-01-02:00"), is(Optional.<TimeWindow>absent()));
    }

    @Test
    public void keysInWindow()
    {
        TimeWindowPartitionsDefinition hourly = new TimeWindowPartitionsDefinition("0 * * * *",
                Instant.parse("2022-01-01T00:00:00Z"), ZoneId.of("UTC"),
                TimeWindowPartitionsDefinition.HOURLY_FORMAT, clockAt("2022-01-02T00:00:00Z"));
        ZoneId utc = ZoneId.of("UTC");
        TimeWindow window = TimeWindow.of(
                ZonedDateTime.of(2022, 1, 1, 3, 30, 0, 0, utc),
                ZonedDateTime.of(2022, 1, 1, 5, 0, 0, 0, utc));
        assertThat(hourly.getPartitionKeysIn(window), is(ImmutableList.of("2022-01-01-03:00", "2022-01-01-04:00")));
    }

    @Test
    public void invalidCron()
    {
        exception.expect(InvalidCronExpressionException.class);
        new TimeWindowPartitionsDefinition("0 0 * *", Instant.parse("2022-01-01T00:00:00Z"), ZoneId.of("UTC"),
                TimeWindowPartitionsDefinition.DAILY_FORMAT, Clock.systemUTC());
    }

    @Test
    public void equality()
    {
        Instant start = Instant.parse("2022-01-01T00:00:00Z");
        assertThat(TimeWindowPartitionsDefinition.daily(start, ZoneId.of("UTC")),
                is(TimeWindowPartitionsDefinition.daily(start, ZoneId.of("UTC"))));
    }
}
