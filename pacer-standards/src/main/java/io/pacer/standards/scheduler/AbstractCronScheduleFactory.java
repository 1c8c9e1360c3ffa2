package io.pacer.standards.scheduler;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import com.google.common.base.Optional;
import io.pacer.client.config.Config;
import io.pacer.client.config.ConfigException;
import io.pacer.core.schedule.CronTickService;
import io.pacer.spi.Schedule;
import io.pacer.spi.ScheduleFactory;

abstract class AbstractCronScheduleFactory
        implements ScheduleFactory
{
    private final ScheduleConfigHelper configHelper;
    private final CronTickService tickService;

    AbstractCronScheduleFactory(ScheduleConfigHelper configHelper, CronTickService tickService)
    {
        this.configHelper = configHelper;
        this.tickService = tickService;
    }

    @Override
    public Schedule newSchedule(Config config, ZoneId timeZone)
    {
        List<String> cronSchedule = toCronSchedule(config);
        if (!tickService.isValidCronSchedule(cronSchedule)) {
            throw new ConfigException(getType() + ">: invalid schedule: " + cronSchedule);
        }

        Optional<Instant> start = configHelper.getDateTimeStart(config, "start", timeZone);
        Optional<Instant> end = configHelper.getDateTimeEnd(config, "end", timeZone);
        configHelper.validateStartEnd(start, end);

        return new CronSchedule(cronSchedule, timeZone, start, end, tickService);
    }

    abstract List<String> toCronSchedule(Config config);

    static String getCommand(Config config)
    {
        return config.getOptional("_command", String.class).or(() -> config.get("at", String.class));
    }

    /**
     * Parses {@code hh:mm} or {@code hh:mm:ss} into {hour, minute}. Seconds must be 0.
     */
    static int[] parseAt(String kind, String at)
    {
        String[] fragments = at.trim().split(":");
        if (fragments.length != 2 && fragments.length != 3) {
            throw new ConfigException(kind + " scheduler requires hh:mm[:ss] format: " + at);
        }
        int hour = parseFragment(kind, fragments[0], at, 23);
        int min = parseFragment(kind, fragments[1], at, 59);
        if (fragments.length == 3 && parseFragment(kind, fragments[2], at, 59) != 0) {
            throw new ConfigException(kind + " scheduler supports minute precision only: " + at);
        }
        return new int[] {hour, min};
    }

    static int parseFragment(String kind, String s, String at, int max)
    {
        int value;
        try {
            value = Integer.parseInt(s.trim());
        }
        catch (NumberFormatException ex) {
            throw new ConfigException(kind + " scheduler requires hh:mm[:ss] format: " + at);
        }
        if (value < 0 || value > max) {
            throw new ConfigException(kind + " scheduler got out of range time: " + at);
        }
        return value;
    }
}
