package io.pacer.spi;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

import com.google.common.base.Optional;

/**
 * A recurring schedule resolved from a schedule configuration.
 */
public interface Schedule
{
    List<String> getCronSchedule();

    ZoneId getTimeZone();

    Optional<Instant> getStartDate();

    Optional<Instant> getEndDate();

    /**
     * Returns ticks at or after {@code currentTime} in ascending order.
     *
     * Ticks before the start date are skipped and the sequence ends before the end date.
     */
    Iterable<ZonedDateTime> nextExecutionTimes(Instant currentTime);

    /**
     * Returns ticks at or before {@code currentTime} in descending order, bounded the same way as
     * {@link #nextExecutionTimes(Instant)}.
     */
    Iterable<ZonedDateTime> previousExecutionTimes(Instant currentTime);
}
