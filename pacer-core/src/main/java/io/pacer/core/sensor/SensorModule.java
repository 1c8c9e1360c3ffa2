package io.pacer.core.sensor;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;

/**
 * Binds the sensor tick runner. The embedding application binds {@link io.pacer.spi.InstanceFactory}.
 */
public class SensorModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(SensorEngineConfig.class).toProvider(SensorEngineConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(SensorTickRunner.class).in(Scopes.SINGLETON);
    }
}
