package io.pacer.core.sensor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.pacer.core.partition.AssetsDefinition;
import io.pacer.core.partition.PartitionsDefinition;
import io.pacer.core.partition.TimeWindowPartitionMapping;
import io.pacer.core.partition.TimeWindowPartitionsDefinition;
import io.pacer.spi.AssetKey;
import io.pacer.spi.EventLogRecord;
import io.pacer.spi.EventRecordsFilter;
import io.pacer.spi.EventType;

/**
 * Cursor of a sensor that monitors partitioned assets.
 *
 * The cursor maps each asset key to the partition and storage id of the last materialization
 * the sensor handled, for example {@code {"events": ["2022-01-02", 301]}}. Only partitions from
 * the cursor's partition onward are fetched.
 */
public class PartitionedAssetCursorTracker
        extends AbstractAssetCursorTracker
{
    private final List<AssetsDefinition> assets;
    private final TimeWindowPartitionMapping partitionMapping = new TimeWindowPartitionMapping();

    PartitionedAssetCursorTracker(SensorEvaluationContext context, List<AssetsDefinition> assets)
    {
        super(context);
        this.assets = ImmutableList.copyOf(assets);
    }

    public List<AssetsDefinition> getAssets()
    {
        return assets;
    }

    private static class AssetCursor
    {
        private final Optional<String> partition;
        private final Optional<Long> storageId;

        AssetCursor(Optional<String> partition, Optional<Long> storageId)
        {
            this.partition = partition;
            this.storageId = storageId;
        }
    }

    private AssetCursor getAssetCursor(AssetKey assetKey)
    {
        JsonNode value = readCursor().get(assetKey.toUserString());
        if (value == null || value.isNull()) {
            return new AssetCursor(Optional.absent(), Optional.absent());
        }
        if (!value.isArray() || value.size() != 2) {
            throw new SensorEvaluationException("Cursor of asset " + assetKey + " must be a [partition, storage id] pair: " + value);
        }
        JsonNode partition = value.get(0);
        JsonNode storageId = value.get(1);
        return new AssetCursor(
                partition.isNull() ? Optional.absent() : Optional.of(partition.asText()),
                storageId.isNull() ? Optional.absent() : Optional.of(storageId.asLong()));
    }

    /**
     * Returns the partition the cursor of an asset is on. The asset key can be omitted when
     * the sensor monitors a single asset.
     */
    public Optional<String> getCursorPartition(Optional<AssetKey> assetKey)
    {
        if (assetKey.isPresent()) {
            return getAssetCursor(assetKey.get()).partition;
        }
        else if (assets.size() == 1) {
            return getAssetCursor(assets.get(0).getKey()).partition;
        }
        else {
            throw new SensorInvocationException("Asset key must be provided when multiple assets are defined");
        }
    }

    public Optional<String> getPartitionFromEventLogRecord(EventLogRecord record)
    {
        return record.getPartition();
    }

    /**
     * Converts a partition key of {@code fromPartitions} to the keys of {@code toPartitions}
     * whose time windows overlap it. {@code fromPartitions} defaults to the partitions of the
     * only monitored asset.
     */
    public List<String> mapPartition(String partitionKey, PartitionsDefinition toPartitions,
            Optional<PartitionsDefinition> fromPartitions)
    {
        PartitionsDefinition from;
        if (fromPartitions.isPresent()) {
            from = fromPartitions.get();
        }
        else if (assets.size() == 1 && assets.get(0).getPartitionsDefinition().isPresent()) {
            from = assets.get(0).getPartitionsDefinition().get();
        }
        else {
            throw new SensorInvocationException(
                    "fromPartitions must be provided unless the sensor monitors exactly one partitioned asset");
        }

        if (!(from instanceof TimeWindowPartitionsDefinition) || !(toPartitions instanceof TimeWindowPartitionsDefinition)) {
            throw new SensorInvocationException("Currently only time window partitions are supported");
        }

        List<String> downstream = partitionMapping.getDownstreamPartitions(partitionKey,
                (TimeWindowPartitionsDefinition) from,
                (TimeWindowPartitionsDefinition) toPartitions);
        if (downstream.isEmpty()) {
            throw new SensorInvocationException(
                    "Mapped partition key " + partitionKey + " to no partition of the downstream partitions definition");
        }
        return downstream;
    }

    private List<String> partitionsToFetch(AssetsDefinition asset, AssetCursor cursor)
    {
        if (!asset.getPartitionsDefinition().isPresent()) {
            throw new InvariantViolationException(
                    "Cannot get latest materialization by partition for assets with no partitions");
        }
        List<String> keys = asset.getPartitionsDefinition().get().getPartitionKeys();
        if (cursor.partition.isPresent()) {
            int index = keys.indexOf(cursor.partition.get());
            if (index >= 0) {
                return keys.subList(index, keys.size());
            }
        }
        return keys;
    }

    private EventRecordsFilter filterOf(AssetKey assetKey, AssetCursor cursor, List<String> partitions)
    {
        return EventRecordsFilter.builder()
            .eventType(EventType.ASSET_MATERIALIZATION)
            .assetKey(assetKey)
            .afterCursor(cursor.storageId)
            .assetPartitions(partitions)
            .build();
    }

    /**
     * Fetches the most recent materialization after the cursor for each monitored asset,
     * restricted to partitions from the cursor's partition onward.
     */
    public Map<AssetKey, Optional<EventLogRecord>> latestMaterializationRecordsByKey()
    {
        Map<AssetKey, Optional<EventLogRecord>> records = new LinkedHashMap<>();
        for (AssetsDefinition asset : assets) {
            AssetCursor cursor = getAssetCursor(asset.getKey());
            List<String> partitions = partitionsToFetch(asset, cursor);
            List<EventLogRecord> latest = queryEvents(filterOf(asset.getKey(), cursor, partitions),
                    false, Optional.of(1));
            records.put(asset.getKey(), latest.isEmpty() ? Optional.absent() : Optional.of(latest.get(0)));
        }
        return records;
    }

    /**
     * Fetches the most recent materialization after the cursor for each partition of each
     * monitored asset. Partitions without one map to absent.
     */
    public Map<AssetKey, Map<String, Optional<EventLogRecord>>> latestMaterializationByPartition()
    {
        Map<AssetKey, Map<String, Optional<EventLogRecord>>> result = new LinkedHashMap<>();
        for (AssetsDefinition asset : assets) {
            AssetCursor cursor = getAssetCursor(asset.getKey());
            List<String> partitions = partitionsToFetch(asset, cursor);

            Map<String, Optional<EventLogRecord>> byPartition = new LinkedHashMap<>();
            for (String partition : partitions) {
                byPartition.put(partition, Optional.absent());
            }
            // newest first so that the first record seen for a partition is its latest
            for (EventLogRecord record : queryEvents(filterOf(asset.getKey(), cursor, partitions), false, Optional.absent())) {
                Optional<String> partition = getPartitionFromEventLogRecord(record);
                if (partition.isPresent() && byPartition.containsKey(partition.get())
                        && !byPartition.get(partition.get()).isPresent()) {
                    byPartition.put(partition.get(), Optional.of(record));
                }
            }
            result.put(asset.getKey(), byPartition);
        }
        return result;
    }

    /**
     * Moves the cursor of each given asset to the partition and storage id of its record. An
     * absent record leaves the asset's cursor unchanged, as do assets not in the map.
     */
    public void advanceCursor(Map<AssetKey, Optional<EventLogRecord>> materializationRecordsByKey)
    {
        ObjectNode cursor = readCursor();
        for (Map.Entry<AssetKey, Optional<EventLogRecord>> entry : materializationRecordsByKey.entrySet()) {
            if (entry.getValue().isPresent()) {
                EventLogRecord record = entry.getValue().get();
                ArrayNode pair = cursor.putArray(entry.getKey().toUserString());
                Optional<String> partition = getPartitionFromEventLogRecord(record);
                if (partition.isPresent()) {
                    pair.add(partition.get());
                }
                else {
                    pair.addNull();
                }
                pair.add(record.getStorageId());
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
