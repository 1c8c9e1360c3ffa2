package io.pacer.standards.scheduler;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.pacer.spi.ScheduleFactory;

public class ScheduleFactoryModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        addStandardScheduleFactory(binder, CronScheduleFactory.class);
        addStandardScheduleFactory(binder, MonthlyScheduleFactory.class);
        addStandardScheduleFactory(binder, WeeklyScheduleFactory.class);
        addStandardScheduleFactory(binder, DailyScheduleFactory.class);
        addStandardScheduleFactory(binder, HourlyScheduleFactory.class);
        binder.bind(ScheduleConfigHelper.class).in(Scopes.SINGLETON);
    }

    protected void addStandardScheduleFactory(Binder binder, Class<? extends ScheduleFactory> factory)
    {
        Multibinder.newSetBinder(binder, ScheduleFactory.class)
            .addBinding().to(factory).in(Scopes.SINGLETON);
    }
}
