package io.pacer.core.schedule;

import java.time.LocalDateTime;
import java.time.ZoneId;

import org.junit.Test;

import static io.pacer.core.schedule.TickTestHelper.format;
import static io.pacer.core.schedule.TickTestHelper.zoned;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class CalendarMathTest
{
    @Test
    public void resolveExistingTime()
    {
        assertThat(format(CalendarMath.resolveLocalTime(zoned("2016-02-03 09:34:12 +0900", "Asia/Tokyo"), 10, 15, 5)),
                is("2016-02-05 10:15:00 +0900"));
    }

    @Test
    public void resolveNonexistentTimeToTopOfNextHour()
    {
        // clocks in Los Angeles jump from 02:00 to 03:00 on 2019-03-10
        assertThat(format(CalendarMath.resolveLocalTime(zoned("2019-03-10 00:00:00 -0800", "America/Los_Angeles"), 2, 30, 10)),
                is("2019-03-10 03:00:00 -0700"));
    }

    @Test
    public void resolveAmbiguousTimeToLaterOccurrence()
    {
        // clocks in New York go back from 02:00 to 01:00 on 2019-11-03
        assertThat(format(CalendarMath.resolveLocalTime(zoned("2019-11-03 00:00:00 -0400", "America/New_York"), 1, 30, 3)),
                is("2019-11-03 01:30:00 -0500"));
    }

    @Test
    public void atLocalShiftsByGapLength()
    {
        ZoneId zone = ZoneId.of("America/Los_Angeles");
        assertThat(format(CalendarMath.atLocal(LocalDateTime.of(2019, 3, 10, 2, 30), zone)),
                is("2019-03-10 03:30:00 -0700"));
        assertThat(format(CalendarMath.atLocal(LocalDateTime.of(2019, 11, 3, 1, 30), zone)),
                is("2019-11-03 01:30:00 -0800"));
    }

    @Test
    public void plusDaysKeepsWallClock()
    {
        assertThat(format(CalendarMath.plusDays(zoned("2019-03-09 10:00:00 -0800", "America/Los_Angeles"), 1)),
                is("2019-03-10 10:00:00 -0700"));
        assertThat(format(CalendarMath.plusDays(zoned("2019-03-10 10:00:00 -0700", "America/Los_Angeles"), -1)),
                is("2019-03-09 10:00:00 -0800"));
    }
}
