package io.pacer.core.sensor;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.pacer.client.config.Config;

public class SensorEngineConfigProvider
        implements Provider<SensorEngineConfig>
{
    private final SensorEngineConfig config;

    @Inject
    public SensorEngineConfigProvider(Config systemConfig)
    {
        this.config = SensorEngineConfig.convertFrom(systemConfig);
    }

    @Override
    public SensorEngineConfig get()
    {
        return config;
    }
}
