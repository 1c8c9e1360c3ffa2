package io.pacer.core.sensor;

import io.pacer.client.config.Config;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkState;

@Value.Immutable
public interface SensorEngineConfig
{
    int getDefaultMinimumIntervalSeconds();

    @Value.Check
    default void check()
    {
        checkState(getDefaultMinimumIntervalSeconds() > 0, "sensor.default_minimum_interval_seconds must be positive");
    }

    static ImmutableSensorEngineConfig.Builder builder()
    {
        return ImmutableSensorEngineConfig.builder();
    }

    static SensorEngineConfig defaultConfig()
    {
        return builder()
            .defaultMinimumIntervalSeconds(SensorDefinition.DEFAULT_MINIMUM_INTERVAL_SECONDS)
            .build();
    }

    static SensorEngineConfig convertFrom(Config config)
    {
        return builder()
            .defaultMinimumIntervalSeconds(config.get("sensor.default_minimum_interval_seconds", int.class,
                        SensorDefinition.DEFAULT_MINIMUM_INTERVAL_SECONDS))
            .build();
    }
}
