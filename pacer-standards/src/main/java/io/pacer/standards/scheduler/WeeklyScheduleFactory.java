package io.pacer.standards.scheduler;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.pacer.client.config.Config;
import io.pacer.client.config.ConfigException;
import io.pacer.core.schedule.CronTickService;

/**
 * {@code weekly>: "<day>,HH:MM[:SS]"} where day is a day-of-week number or name such as "Sun".
 */
public class WeeklyScheduleFactory
        extends AbstractCronScheduleFactory
{
    @Inject
    public WeeklyScheduleFactory(ScheduleConfigHelper configHelper, CronTickService tickService)
    {
        super(configHelper, tickService);
    }

    @Override
    public String getType()
    {
        return "weekly";
    }

    @Override
    List<String> toCronSchedule(Config config)
    {
        String desc = getCommand(config);
        String[] fragments = desc.split(",", 2);
        if (fragments.length != 2) {
            throw new ConfigException("weekly>: scheduler requires day,hh:mm:ss format: " + desc);
        }
        String day = fragments[0].trim();
        int[] at = parseAt("weekly>", fragments[1]);
        return ImmutableList.of(at[1] + " " + at[0] + " * * " + day);
    }
}
