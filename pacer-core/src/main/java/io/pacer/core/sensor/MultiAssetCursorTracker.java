package io.pacer.core.sensor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.pacer.spi.AssetKey;
import io.pacer.spi.EventLogRecord;
import io.pacer.spi.EventRecordsFilter;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Cursor of a sensor that monitors materializations of several assets.
 *
 * The cursor is a JSON object that maps each asset key to the storage id of the last
 * materialization the sensor handled, for example {@code {"raw/users": 120, "raw/orders": 98}}.
 */
public class MultiAssetCursorTracker
        extends AbstractAssetCursorTracker
{
    private final List<AssetKey> assetKeys;

    MultiAssetCursorTracker(SensorEvaluationContext context, List<AssetKey> assetKeys)
    {
        super(context);
        this.assetKeys = ImmutableList.copyOf(assetKeys);
    }

    public List<AssetKey> getAssetKeys()
    {
        return assetKeys;
    }

    public Optional<Long> getCursor(AssetKey assetKey)
    {
        JsonNode value = readCursor().get(assetKey.toUserString());
        if (value == null || value.isNull()) {
            return Optional.absent();
        }
        if (!value.canConvertToLong()) {
            throw new SensorEvaluationException("Cursor of asset " + assetKey + " must be a storage id: " + value);
        }
        return Optional.of(value.asLong());
    }

    /**
     * Fetches the most recent materialization after the cursor for each monitored asset.
     */
    public Map<AssetKey, Optional<EventLogRecord>> latestMaterializationRecordsByKey()
    {
        Map<AssetKey, Optional<EventLogRecord>> records = new LinkedHashMap<>();
        for (AssetKey assetKey : assetKeys) {
            List<EventLogRecord> latest = queryEvents(
                    EventRecordsFilter.materializationsOf(assetKey, getCursor(assetKey)),
                    false, Optional.of(1));
            records.put(assetKey, latest.isEmpty() ? Optional.absent() : Optional.of(latest.get(0)));
        }
        return records;
    }

    /**
     * Fetches up to {@code limit} materializations after the cursor of an asset, oldest first.
     */
    public List<EventLogRecord> materializationRecordsForKey(AssetKey assetKey, int limit)
    {
        checkArgument(assetKeys.contains(assetKey), "Asset %s is not monitored by this sensor", assetKey);
        return queryEvents(
                EventRecordsFilter.materializationsOf(assetKey, getCursor(assetKey)),
                true, Optional.of(limit));
    }

    /**
     * Moves the cursor of each given asset to the storage id of its record. An absent record
     * leaves the asset's cursor unchanged, as do assets not in the map.
     */
    public void advanceCursor(Map<AssetKey, Optional<EventLogRecord>> materializationRecordsByKey)
    {
        ObjectNode cursor = readCursor();
        for (Map.Entry<AssetKey, Optional<EventLogRecord>> entry : materializationRecordsByKey.entrySet()) {
            if (entry.getValue().isPresent()) {
                cursor.put(entry.getKey().toUserString(), entry.getValue().get().getStorageId());
            }
        }
        writeCursor(cursor);
    }

    @Override
    public void advanceAllCursors()
    {
        advanceCursor(latestMaterializationRecordsByKey());
    }
}
