package io.pacer.core.sensor;

import java.util.List;

import com.google.common.base.Optional;
import io.pacer.core.partition.AssetsDefinition;
import io.pacer.spi.AssetKey;
import io.pacer.spi.SensorInstance;

/**
 * Builds contexts to invoke or evaluate sensors outside of the tick runner, mostly in tests.
 *
 * An instance given here must be persistent.
 */
public final class SensorContexts
{
    private SensorContexts()
    { }

    public static SensorEvaluationContext build()
    {
        return build(Optional.absent(), Optional.absent(), Optional.absent());
    }

    public static SensorEvaluationContext build(Optional<SensorInstance> instance,
            Optional<String> cursor, Optional<String> repositoryName)
    {
        if (instance.isPresent() && instance.get().isEphemeral()) {
            throw new SensorInvocationException(
                    "Sensor context can't be built with an ephemeral instance. Use a persistent instance.");
        }
        return SensorEvaluationContext.builder()
            .instance(instance)
            .cursor(cursor)
            .repositoryName(repositoryName)
            .build();
    }

    public static SensorEvaluationContext buildMultiAsset(List<AssetKey> assetKeys)
    {
        return buildMultiAsset(assetKeys, Optional.absent(), Optional.absent(), Optional.absent());
    }

    /**
     * @param cursor JSON object of asset keys to storage ids
     */
    public static SensorEvaluationContext buildMultiAsset(List<AssetKey> assetKeys,
            Optional<SensorInstance> instance, Optional<String> cursor, Optional<String> repositoryName)
    {
        SensorEvaluationContext context = build(instance, cursor, repositoryName);
        attachMultiAssetTracker(context, assetKeys);
        return context;
    }

    public static SensorEvaluationContext buildPartitionedAsset(List<AssetsDefinition> assets)
    {
        return buildPartitionedAsset(assets, Optional.absent(), Optional.absent(), Optional.absent());
    }

    public static SensorEvaluationContext buildPartitionedAsset(List<AssetsDefinition> assets,
            Optional<SensorInstance> instance, Optional<String> cursor, Optional<String> repositoryName)
    {
        SensorEvaluationContext context = build(instance, cursor, repositoryName);
        attachPartitionedAssetTracker(context, assets);
        return context;
    }

    static void attachMultiAssetTracker(SensorEvaluationContext context, List<AssetKey> assetKeys)
    {
        context.attachTracker(new MultiAssetCursorTracker(context, assetKeys));
    }

    static void attachPartitionedAssetTracker(SensorEvaluationContext context, List<AssetsDefinition> assets)
    {
        context.attachTracker(new PartitionedAssetCursorTracker(context, assets));
    }
}
