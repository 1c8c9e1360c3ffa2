package io.pacer.spi;

import java.util.List;

import com.google.common.base.Optional;

/**
 * Handle to the persistent instance a sensor reads events from.
 *
 * A sensor evaluation context acquires one lazily and closes it when the tick ends.
 */
public interface SensorInstance
        extends AutoCloseable
{
    /**
     * Returns event records matching the filter ordered by storage id.
     *
     * @param ascending true to return the oldest records first
     * @param limit maximum number of records to return, or absent for all
     */
    List<EventLogRecord> getEventRecords(EventRecordsFilter filter, boolean ascending, Optional<Integer> limit);

    /**
     * An ephemeral instance keeps its state in memory only and can't be used by sensors
     * that are evaluated outside of the daemon.
     */
    boolean isEphemeral();

    @Override
    void close();
}
