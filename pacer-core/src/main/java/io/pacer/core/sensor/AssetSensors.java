package io.pacer.core.sensor;

import java.util.Iterator;
import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import io.pacer.core.partition.AssetsDefinition;
import io.pacer.spi.AssetKey;
import io.pacer.spi.EventLogRecord;
import io.pacer.spi.EventRecordsFilter;
import io.pacer.spi.RunRequest;

/**
 * Sensors driven by asset materializations. Each method returns a builder so that targets and
 * other settings can be added before the sensor is built.
 */
public final class AssetSensors
{
    private AssetSensors()
    { }

    /**
     * A sensor that calls {@code function} with the latest materialization of {@code assetKey}
     * after the cursor, then moves the cursor to it. The cursor is the storage id as a string.
     */
    public static SensorDefinition.Builder single(String name, AssetKey assetKey, AssetMaterializationFunction function)
    {
        return SensorDefinition.builder(name)
            .evaluationFunction(context -> {
                List<EventLogRecord> records = context.getInstance().getEventRecords(
                        EventRecordsFilter.materializationsOf(assetKey, parseStorageId(context.getCursor())),
                        false, Optional.of(1));
                if (records.isEmpty()) {
                    return SensorOutput.none();
                }
                EventLogRecord record = records.get(0);
                SensorOutput output = function.evaluate(context, record);
                List<Object> items = output == null ? ImmutableList.of() : output.toList();
                context.updateCursor(Optional.of(Long.toString(record.getStorageId())));
                return SensorOutput.fromValue(items);
            });
    }

    /**
     * A sensor that monitors several assets through a {@link MultiAssetCursorTracker}. The
     * routine must advance the cursor whenever it requests a run.
     */
    public static SensorDefinition.Builder multiAsset(String name, List<AssetKey> assetKeys, SensorFunction function)
    {
        List<AssetKey> keys = ImmutableList.copyOf(assetKeys);
        return SensorDefinition.builder(name)
            .evaluationFunction(requireCursorAdvance(name, function))
            .contextInitializer(context -> SensorContexts.attachMultiAssetTracker(context, keys));
    }

    /**
     * A sensor that monitors partitioned assets through a {@link PartitionedAssetCursorTracker}.
     * The routine must advance the cursor whenever it requests a run.
     */
    public static SensorDefinition.Builder partitionedAsset(String name, List<AssetsDefinition> assets, SensorFunction function)
    {
        List<AssetsDefinition> copy = ImmutableList.copyOf(assets);
        return SensorDefinition.builder(name)
            .evaluationFunction(requireCursorAdvance(name, function))
            .contextInitializer(context -> SensorContexts.attachPartitionedAssetTracker(context, copy));
    }

    static Optional<Long> parseStorageId(Optional<String> cursor)
    {
        if (!cursor.isPresent()) {
            return Optional.absent();
        }
        try {
            return Optional.of(Long.parseLong(cursor.get()));
        }
        catch (NumberFormatException ex) {
            return Optional.absent();
        }
    }

    private static SensorFunction requireCursorAdvance(String name, SensorFunction function)
    {
        return context -> {
            Optional<AssetCursorTracker> tracker = context.getAssetCursorTracker();
            if (!tracker.isPresent()) {
                throw new InvariantViolationException("Asset sensor " + name + " was evaluated without an asset cursor tracker");
            }
            tracker.get().resetCursorUpdated();
            SensorOutput output = function.evaluate(context);
            if (output == null) {
                return SensorOutput.none();
            }
            return SensorOutput.fromValue(new CursorAdvanceCheckingIterator(name, output.iterator(), tracker.get()));
        };
    }

    private static class CursorAdvanceCheckingIterator
            extends AbstractIterator<Object>
    {
        private final String name;
        private final Iterator<?> items;
        private final AssetCursorTracker tracker;
        private boolean runsYielded = false;

        CursorAdvanceCheckingIterator(String name, Iterator<?> items, AssetCursorTracker tracker)
        {
            this.name = name;
            this.items = items;
            this.tracker = tracker;
        }

        @Override
        protected Object computeNext()
        {
            if (items.hasNext()) {
                Object item = items.next();
                if (item instanceof RunRequest) {
                    runsYielded = true;
                }
                return item;
            }
            if (runsYielded && !tracker.isCursorUpdated()) {
                throw new SensorEvaluationException("Error in sensor " + name + ": " +
                        "Asset materializations have been handled in this sensor, but the cursor was not updated. " +
                        "This means the same materialization events will be handled in the next sensor tick. " +
                        "Use advanceCursor or advanceAllCursors to update the cursor.");
            }
            return endOfData();
        }
    }
}
