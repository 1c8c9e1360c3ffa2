package io.pacer.core.partition;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import static com.google.common.base.Preconditions.checkArgument;

public class StaticPartitionsDefinition
        implements PartitionsDefinition
{
    private final List<String> partitionKeys;

    public StaticPartitionsDefinition(List<String> partitionKeys)
    {
        Set<String> seen = new HashSet<>();
        for (String key : partitionKeys) {
            checkArgument(seen.add(key), "Duplicate partition key: %s", key);
        }
        this.partitionKeys = ImmutableList.copyOf(partitionKeys);
    }

    public static StaticPartitionsDefinition of(String... partitionKeys)
    {
        return new StaticPartitionsDefinition(ImmutableList.copyOf(partitionKeys));
    }

    @Override
    public List<String> getPartitionKeys()
    {
        return partitionKeys;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return partitionKeys.equals(((StaticPartitionsDefinition) o).partitionKeys);
    }

    @Override
    public int hashCode()
    {
        return partitionKeys.hashCode();
    }

    @Override
    public String toString()
    {
        return "StaticPartitionsDefinition{" + partitionKeys + "}";
    }
}
