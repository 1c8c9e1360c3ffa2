package io.pacer.standards.scheduler;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.pacer.client.config.Config;
import io.pacer.client.config.ConfigException;
import io.pacer.core.schedule.CronTickService;

/**
 * {@code hourly>: "MM:SS"}.
 */
public class HourlyScheduleFactory
        extends AbstractCronScheduleFactory
{
    @Inject
    public HourlyScheduleFactory(ScheduleConfigHelper configHelper, CronTickService tickService)
    {
        super(configHelper, tickService);
    }

    @Override
    public String getType()
    {
        return "hourly";
    }

    @Override
    List<String> toCronSchedule(Config config)
    {
        String at = getCommand(config);
        String[] fragments = at.trim().split(":");
        if (fragments.length != 2) {
            throw new ConfigException("hourly>: scheduler requires mm:ss format: " + at);
        }
        int min = parseFragment("hourly>", fragments[0], at, 59);
        if (parseFragment("hourly>", fragments[1], at, 59) != 0) {
            throw new ConfigException("hourly> scheduler supports minute precision only: " + at);
        }
        return ImmutableList.of(min + " * * * *");
    }
}
