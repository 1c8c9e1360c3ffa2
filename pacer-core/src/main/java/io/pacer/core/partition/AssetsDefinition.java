package io.pacer.core.partition;

import com.google.common.base.Optional;
import io.pacer.spi.AssetKey;
import org.immutables.value.Value;

/**
 * An asset monitored by a sensor, with the partitions it is materialized in, if any.
 */
@Value.Immutable
public interface AssetsDefinition
{
    AssetKey getKey();

    Optional<PartitionsDefinition> getPartitionsDefinition();

    static AssetsDefinition of(AssetKey key)
    {
        return ImmutableAssetsDefinition.builder()
            .key(key)
            .build();
    }

    static AssetsDefinition of(AssetKey key, PartitionsDefinition partitionsDefinition)
    {
        return ImmutableAssetsDefinition.builder()
            .key(key)
            .partitionsDefinition(partitionsDefinition)
            .build();
    }
}
