package io.pacer.core.partition;

import java.time.ZonedDateTime;

import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkState;

/**
 * Half-open interval [start, end).
 */
@Value.Immutable
public interface TimeWindow
{
    ZonedDateTime getStart();

    ZonedDateTime getEnd();

    @Value.Check
    default void check()
    {
        checkState(getStart().isBefore(getEnd()), "Time window must end after it starts");
    }

    default boolean overlaps(TimeWindow other)
    {
        return getStart().isBefore(other.getEnd()) && other.getStart().isBefore(getEnd());
    }

    static TimeWindow of(ZonedDateTime start, ZonedDateTime end)
    {
        return ImmutableTimeWindow.builder()
            .start(start)
            .end(end)
            .build();
    }
}
