package io.pacer.standards.scheduler;

import com.google.common.collect.ImmutableList;
import io.pacer.client.config.ConfigException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class WeeklyScheduleFactoryTest
        extends ScheduleTestHelper
{
    @Rule
    public ExpectedException exception = ExpectedException.none();

    @Override
    AbstractCronScheduleFactory newFactory()
    {
        return new WeeklyScheduleFactory(configHelper, tickService);
    }

    @Test
    public void dayNumber()
    {
        // 2016-02-03 is a Wednesday
        assertThat(take(newSchedule("1,10:00:00", "UTC").nextExecutionTimes(instant("2016-02-03 00:00:00 +0000")), 2),
                is(ImmutableList.of("2016-02-08 10:00:00 +0000", "2016-02-15 10:00:00 +0000")));
    }

    @Test
    public void dayName()
    {
        assertThat(newSchedule("Sun,09:30", "UTC").getCronSchedule(), is(ImmutableList.of("30 9 * * Sun")));
        assertThat(take(newSchedule("Sun,09:30", "UTC").nextExecutionTimes(instant("2016-02-03 00:00:00 +0000")), 1),
                is(ImmutableList.of("2016-02-07 09:30:00 +0000")));
    }

    @Test
    public void rejectInvalidDay()
    {
        exception.expect(ConfigException.class);
        exception.expectMessage("weekly>: invalid schedule");
        newSchedule("Someday,10:00", "UTC");
    }

    @Test
    public void rejectMissingTime()
    {
        exception.expect(ConfigException.class);
        exception.expectMessage("day,hh:mm:ss format");
        newSchedule("Mon", "UTC");
    }
}
