package io.pacer.core.schedule;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.pacer.spi.ScheduleFactory;

public class TickModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(TickEngineConfig.class).toProvider(TickEngineConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(CronExpressionCache.class).in(Scopes.SINGLETON);
        binder.bind(CronTickService.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleManager.class).in(Scopes.SINGLETON);
        Multibinder.newSetBinder(binder, ScheduleFactory.class);
    }
}
