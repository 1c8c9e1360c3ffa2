package io.pacer.core.schedule;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.pacer.client.config.Config;

public class TickEngineConfigProvider
        implements Provider<TickEngineConfig>
{
    private final TickEngineConfig config;

    @Inject
    public TickEngineConfigProvider(Config systemConfig)
    {
        this.config = TickEngineConfig.convertFrom(systemConfig);
    }

    @Override
    public TickEngineConfig get()
    {
        return config;
    }
}
