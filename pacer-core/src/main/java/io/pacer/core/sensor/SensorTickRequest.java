package io.pacer.core.sensor;

import java.time.Instant;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.pacer.spi.InstanceRef;
import org.immutables.value.Value;

/**
 * Inputs the caller threads from one tick of a sensor to the next.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSensorTickRequest.class)
@JsonDeserialize(as = ImmutableSensorTickRequest.class)
public interface SensorTickRequest
{
    InstanceRef getInstanceRef();

    Optional<String> getCursor();

    Optional<Instant> getLastCompletionTime();

    Optional<String> getLastRunKey();

    Optional<String> getRepositoryName();

    static ImmutableSensorTickRequest.Builder builder()
    {
        return ImmutableSensorTickRequest.builder();
    }
}
