package io.pacer.core.partition;

import java.util.List;

/**
 * Set of partition keys an asset is split into, in their natural order.
 */
public interface PartitionsDefinition
{
    List<String> getPartitionKeys();
}
