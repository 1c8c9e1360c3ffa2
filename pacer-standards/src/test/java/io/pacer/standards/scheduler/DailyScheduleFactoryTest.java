package io.pacer.standards.scheduler;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.pacer.client.config.ConfigException;
import io.pacer.spi.Schedule;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class DailyScheduleFactoryTest
        extends ScheduleTestHelper
{
    @Rule
    public ExpectedException exception = ExpectedException.none();

    @Override
    AbstractCronScheduleFactory newFactory()
    {
        return new DailyScheduleFactory(configHelper, tickService);
    }

    @Test
    public void cronSchedule()
    {
        assertThat(newSchedule("10:00", "UTC").getCronSchedule(), is(ImmutableList.of("0 10 * * *")));
        assertThat(newSchedule("07:30:00", "UTC").getCronSchedule(), is(ImmutableList.of("30 7 * * *")));
    }

    @Test
    public void nextExecutionTimesUtc()
    {
        Schedule schedule = newSchedule("10:00:00", "UTC");
        assertThat(take(schedule.nextExecutionTimes(instant("2016-02-03 09:34:12 +0000")), 2),
                is(ImmutableList.of("2016-02-03 10:00:00 +0000", "2016-02-04 10:00:00 +0000")));
        // current time on a tick
        assertThat(take(schedule.nextExecutionTimes(instant("2016-02-03 10:00:00 +0000")), 1),
                is(ImmutableList.of("2016-02-03 10:00:00 +0000")));
        assertThat(take(schedule.nextExecutionTimes(instant("2016-02-03 10:00:01 +0000")), 1),
                is(ImmutableList.of("2016-02-04 10:00:00 +0000")));
    }

    @Test
    public void nextExecutionTimesTz()
    {
        Schedule schedule = newSchedule("10:00", "Asia/Tokyo");
        assertThat(take(schedule.nextExecutionTimes(instant("2016-02-03 09:34:12 +0900")), 2),
                is(ImmutableList.of("2016-02-03 10:00:00 +0900", "2016-02-04 10:00:00 +0900")));
    }

    @Test
    public void nextExecutionTimesDst()
    {
        // America/Los_Angeles begins DST at 2016-03-13 02:00:00 -0800
        Schedule schedule = newSchedule("10:00", "America/Los_Angeles");
        assertThat(take(schedule.nextExecutionTimes(instant("2016-03-12 12:00:00 -0800")), 2),
                is(ImmutableList.of("2016-03-13 10:00:00 -0700", "2016-03-14 10:00:00 -0700")));
    }

    @Test
    public void startAndEnd()
    {
        Schedule schedule = newSchedule("10:00", "Asia/Tokyo", Optional.of("2016-03-01"), Optional.of("2016-03-02"));
        assertThat(take(schedule.nextExecutionTimes(instant("2016-02-03 09:59:59 +0900")), 5),
                is(ImmutableList.of("2016-03-01 10:00:00 +0900", "2016-03-02 10:00:00 +0900")));
        assertThat(take(schedule.previousExecutionTimes(instant("2016-04-01 00:00:00 +0900")), 5),
                is(ImmutableList.of("2016-03-02 10:00:00 +0900", "2016-03-01 10:00:00 +0900")));
        assertThat(take(schedule.nextExecutionTimes(instant("2016-03-02 10:00:01 +0900")), 1),
                is(ImmutableList.of()));
        assertThat(schedule.getStartDate(), is(Optional.of(instant("2016-03-01 00:00:00 +0900"))));
        assertThat(schedule.getEndDate(), is(Optional.of(instant("2016-03-03 00:00:00 +0900"))));
    }

    @Test
    public void previousExecutionTimes()
    {
        Schedule schedule = newSchedule("10:00", "UTC");
        assertThat(take(schedule.previousExecutionTimes(instant("2016-02-02 00:00:00 +0000")), 2),
                is(ImmutableList.of("2016-02-01 10:00:00 +0000", "2016-01-31 10:00:00 +0000")));
    }

    @Test
    public void rejectSeconds()
    {
        exception.expect(ConfigException.class);
        exception.expectMessage("minute precision only");
        newSchedule("10:00:30", "UTC");
    }

    @Test
    public void rejectOutOfRange()
    {
        exception.expect(ConfigException.class);
        exception.expectMessage("out of range");
        newSchedule("24:00", "UTC");
    }

    @Test
    public void rejectMalformed()
    {
        exception.expect(ConfigException.class);
        exception.expectMessage("hh:mm[:ss] format");
        newSchedule("ten", "UTC");
    }

    @Test
    public void rejectEndBeforeStart()
    {
        exception.expect(ConfigException.class);
        exception.expectMessage("The schedule of end is earlier than start");
        newSchedule("10:00", "UTC", Optional.of("2016-03-02"), Optional.of("2016-03-01"));
    }
}
