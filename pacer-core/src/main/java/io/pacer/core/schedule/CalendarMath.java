package io.pacer.core.schedule;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Builds zoned date-times from local fields with fixed rules for daylight saving transitions.
 *
 * <ul>
 * <li>A local time inside a spring-forward gap does not exist. {@link #resolveLocalTime} moves it to the top of
 * the following hour, and {@link #atLocal} shifts it forward by the length of the gap.</li>
 * <li>A local time inside a fall-back overlap exists twice. Both methods pick the later occurrence.</li>
 * </ul>
 */
public final class CalendarMath
{
    private CalendarMath()
    { }

    public static ZonedDateTime resolveLocalTime(ZonedDateTime base, int hour, int minute, int day)
    {
        return resolveLocalTime(LocalDateTime.of(base.getYear(), base.getMonthValue(), day, hour, minute), base.getZone());
    }

    public static ZonedDateTime resolveLocalTime(LocalDateTime local, ZoneId zone)
    {
        List<ZoneOffset> validOffsets = zone.getRules().getValidOffsets(local);
        if (validOffsets.isEmpty()) {
            return ZonedDateTime.ofLocal(local.withMinute(0).plusHours(1), zone, null);
        }
        else if (validOffsets.size() > 1) {
            return ZonedDateTime.ofLocal(local, zone, null).withLaterOffsetAtOverlap();
        }
        else {
            return ZonedDateTime.ofLocal(local, zone, validOffsets.get(0));
        }
    }

    public static ZonedDateTime atLocal(LocalDateTime local, ZoneId zone)
    {
        return ZonedDateTime.ofLocal(local, zone, null).withLaterOffsetAtOverlap();
    }

    public static ZonedDateTime withHour(ZonedDateTime time, int hour)
    {
        return atLocal(time.toLocalDateTime().withHour(hour), time.getZone());
    }

    public static ZonedDateTime withMinute(ZonedDateTime time, int minute)
    {
        return atLocal(time.toLocalDateTime().withMinute(minute), time.getZone());
    }

    public static ZonedDateTime plusDays(ZonedDateTime time, long days)
    {
        return atLocal(time.toLocalDateTime().plusDays(days), time.getZone());
    }
}
