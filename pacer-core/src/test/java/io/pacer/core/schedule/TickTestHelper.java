package io.pacer.core.schedule;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

import com.google.common.collect.FluentIterable;

import static java.util.Locale.ENGLISH;

final class TickTestHelper
{
    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z", ENGLISH);

    private TickTestHelper()
    { }

    static Instant instant(String time)
    {
        return Instant.from(TIME_FORMAT.parse(time));
    }

    static ZonedDateTime zoned(String time, String zone)
    {
        return instant(time).atZone(java.time.ZoneId.of(zone));
    }

    static String format(ZonedDateTime time)
    {
        return TIME_FORMAT.format(time);
    }

    static List<String> take(Iterable<ZonedDateTime> ticks, int count)
    {
        return FluentIterable.from(ticks)
            .limit(count)
            .transform(TickTestHelper::format)
            .toList();
    }
}
