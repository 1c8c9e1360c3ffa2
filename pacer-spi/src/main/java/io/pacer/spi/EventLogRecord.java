package io.pacer.spi;

import java.time.Instant;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * An entry of the event log together with its storage offset.
 *
 * Storage ids grow monotonically in insertion order so they double as cursors.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableEventLogRecord.class)
@JsonDeserialize(as = ImmutableEventLogRecord.class)
public interface EventLogRecord
{
    long getStorageId();

    EventType getEventType();

    Optional<AssetKey> getAssetKey();

    Optional<String> getPartition();

    Optional<String> getRunId();

    Instant getTimestamp();

    static ImmutableEventLogRecord.Builder builder()
    {
        return ImmutableEventLogRecord.builder();
    }
}
