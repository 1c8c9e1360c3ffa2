package io.pacer.spi;

import java.util.Map;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Serializable reference from which a {@link SensorInstance} can be opened.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableInstanceRef.class)
@JsonDeserialize(as = ImmutableInstanceRef.class)
public interface InstanceRef
{
    String getLocation();

    Map<String, String> getSettings();

    static InstanceRef of(String location)
    {
        return ImmutableInstanceRef.builder()
            .location(location)
            .build();
    }
}
