package io.pacer.standards.scheduler;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;

import com.google.common.base.Optional;
import io.pacer.client.config.Config;
import io.pacer.client.config.ConfigException;

/**
 * Reads the {@code start} and {@code end} dates that bound a schedule.
 */
public class ScheduleConfigHelper
{
    // strict mode requires 'uuuu' instead of 'yyyy'
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter
        .ofPattern("uuuu-MM-dd", Locale.ENGLISH)
        .withResolverStyle(ResolverStyle.STRICT);

    /**
     * Returns the beginning of the given day in the time zone.
     */
    public Optional<Instant> getDateTimeStart(Config config, String key, ZoneId zoneId)
    {
        return getDayBoundary(config, key, zoneId, 0, "start");
    }

    /**
     * Returns the beginning of the day after the given day so that the whole end day is included.
     */
    public Optional<Instant> getDateTimeEnd(Config config, String key, ZoneId zoneId)
    {
        return getDayBoundary(config, key, zoneId, 1, "end");
    }

    public void validateStartEnd(Optional<Instant> start, Optional<Instant> end)
    {
        if (start.isPresent() && end.isPresent() && !start.get().isBefore(end.get())) {
            throw new ConfigException("The schedule of end is earlier than start");
        }
    }

    private Optional<Instant> getDayBoundary(Config config, String key, ZoneId zoneId, int plusDays, String label)
    {
        Optional<String> date = config.getOptional(key, String.class);
        if (!date.isPresent()) {
            return Optional.absent();
        }
        LocalDate day;
        try {
            day = LocalDate.parse(date.get(), DATE_FORMAT);
        }
        catch (DateTimeParseException ex) {
            throw new ConfigException(String.format(Locale.ENGLISH, "Invalid %s: %s (%s)", label, date.get(), ex.getMessage()), ex);
        }
        return Optional.of(day.plusDays(plusDays).atStartOfDay(zoneId).toInstant());
    }
}
