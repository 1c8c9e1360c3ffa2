package io.pacer.standards.scheduler;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.pacer.client.config.Config;
import io.pacer.client.config.ConfigException;
import io.pacer.core.schedule.CronTickService;

/**
 * {@code monthly>: "<day>,HH:MM[:SS]"} where day is a day of month from 1 to 31. Months without
 * the day are skipped.
 */
public class MonthlyScheduleFactory
        extends AbstractCronScheduleFactory
{
    @Inject
    public MonthlyScheduleFactory(ScheduleConfigHelper configHelper, CronTickService tickService)
    {
        super(configHelper, tickService);
    }

    @Override
    public String getType()
    {
        return "monthly";
    }

    @Override
    List<String> toCronSchedule(Config config)
    {
        String desc = getCommand(config);
        String[] fragments = desc.split(",", 2);
        if (fragments.length != 2) {
            throw new ConfigException("monthly>: scheduler requires day,hh:mm:ss format: " + desc);
        }
        int day = parseFragment("monthly>", fragments[0], desc, 31);
        if (day < 1) {
            throw new ConfigException("monthly>: invalid day: " + fragments[0].trim());
        }
        int[] at = parseAt("monthly>", fragments[1]);
        return ImmutableList.of(at[1] + " " + at[0] + " " + day + " * *");
    }
}
