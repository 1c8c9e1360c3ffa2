package io.pacer.standards.scheduler;

import java.util.List;

import com.google.inject.Inject;
import io.pacer.client.config.Config;
import io.pacer.core.schedule.CronTickService;

/**
 * {@code cron>: "0 10 * * 1-5"} or a list of expressions whose ticks are merged.
 */
public class CronScheduleFactory
        extends AbstractCronScheduleFactory
{
    @Inject
    public CronScheduleFactory(ScheduleConfigHelper configHelper, CronTickService tickService)
    {
        super(configHelper, tickService);
    }

    @Override
    public String getType()
    {
        return "cron";
    }

    @Override
    List<String> toCronSchedule(Config config)
    {
        return config.getListOrSingle("_command", String.class);
    }
}
