package io.pacer.standards.scheduler;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.pacer.client.config.Config;
import io.pacer.core.schedule.CronTickService;

/**
 * {@code daily>: "HH:MM[:SS]"}.
 */
public class DailyScheduleFactory
        extends AbstractCronScheduleFactory
{
    @Inject
    public DailyScheduleFactory(ScheduleConfigHelper configHelper, CronTickService tickService)
    {
        super(configHelper, tickService);
    }

    @Override
    public String getType()
    {
        return "daily";
    }

    @Override
    List<String> toCronSchedule(Config config)
    {
        int[] at = parseAt("daily>", getCommand(config));
        return ImmutableList.of(at[1] + " " + at[0] + " * * *");
    }
}
