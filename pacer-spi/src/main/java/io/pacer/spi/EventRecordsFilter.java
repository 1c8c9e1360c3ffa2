package io.pacer.spi;

import java.util.List;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableEventRecordsFilter.class)
@JsonDeserialize(as = ImmutableEventRecordsFilter.class)
public interface EventRecordsFilter
{
    EventType getEventType();

    Optional<AssetKey> getAssetKey();

    /**
     * Only records whose storage id is strictly greater than this value match.
     */
    Optional<Long> getAfterCursor();

    /**
     * When present, only records of one of these partitions match.
     */
    Optional<List<String>> getAssetPartitions();

    static ImmutableEventRecordsFilter.Builder builder()
    {
        return ImmutableEventRecordsFilter.builder();
    }

    static EventRecordsFilter materializationsOf(AssetKey assetKey, Optional<Long> afterCursor)
    {
        return builder()
            .eventType(EventType.ASSET_MATERIALIZATION)
            .assetKey(assetKey)
            .afterCursor(afterCursor)
            .build();
    }
}
