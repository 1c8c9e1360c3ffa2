package io.pacer.core.partition;

import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;

/**
 * Maps a partition of an upstream time-window partitioned asset to the partitions of a
 * downstream asset whose windows overlap it.
 */
public class TimeWindowPartitionMapping
{
    /**
     * Returns the downstream keys in window order. The list is empty when the upstream key is
     * unknown or no downstream window overlaps it.
     */
    public List<String> getDownstreamPartitions(String upstreamPartitionKey,
            TimeWindowPartitionsDefinition upstream,
            TimeWindowPartitionsDefinition downstream)
    {
        Optional<TimeWindow> window = upstream.timeWindowFor(upstreamPartitionKey);
        if (!window.isPresent()) {
            return ImmutableList.of();
        }
        return downstream.getPartitionKeysIn(window.get());
    }
}
