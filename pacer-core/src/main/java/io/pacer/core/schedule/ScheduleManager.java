package io.pacer.core.schedule;

import java.time.ZoneId;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import io.pacer.client.config.Config;
import io.pacer.client.config.ConfigException;
import io.pacer.spi.Schedule;
import io.pacer.spi.ScheduleFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves schedule configurations such as {@code {"daily>": "10:00", "timezone": "Asia/Tokyo"}} to
 * {@link Schedule}s using the registered {@link ScheduleFactory}s.
 *
 * The type is taken from the key ending with {@code >}. Factories read the value of that key from
 * {@code _command}.
 */
public class ScheduleManager
{
    private static final Logger logger = LoggerFactory.getLogger(ScheduleManager.class);

    private final Map<String, ScheduleFactory> types;
    private final ZoneId defaultTimeZone;

    @Inject
    public ScheduleManager(Set<ScheduleFactory> factories, TickEngineConfig config)
    {
        ImmutableMap.Builder<String, ScheduleFactory> builder = ImmutableMap.builder();
        for (ScheduleFactory factory : factories) {
            builder.put(factory.getType(), factory);
        }
        this.types = builder.build();
        this.defaultTimeZone = config.getDefaultTimeZone();
    }

    public Set<String> getTypes()
    {
        return types.keySet();
    }

    public Schedule getSchedule(Config scheduleConfig)
    {
        return getSchedule(scheduleConfig, defaultTimeZone);
    }

    public Schedule getSchedule(Config scheduleConfig, ZoneId defaultTimeZone)
    {
        Config c = scheduleConfig.deepCopy();

        String type;
        if (c.has("_type")) {
            type = c.get("_type", String.class);
        }
        else {
            java.util.Optional<String> operatorKey = c.getKeys()
                .stream()
                .filter(key -> key.endsWith(">"))
                .findFirst();
            if (!operatorKey.isPresent()) {
                throw new ConfigException("Schedule config requires 'type>: command' parameter: " + c);
            }
            type = operatorKey.get().substring(0, operatorKey.get().length() - 1);
            Object command = c.get(operatorKey.get(), Object.class);
            c.set("_type", type);
            c.set("_command", command);
        }

        ScheduleFactory factory = types.get(type);
        if (factory == null) {
            throw new ConfigException("Unknown schedule type: " + type);
        }

        Optional<ZoneId> timeZone = c.getOptional("timezone", ZoneId.class);
        Schedule schedule = factory.newSchedule(c, timeZone.or(defaultTimeZone));
        logger.debug("Resolved schedule {} to {} in {}", scheduleConfig, schedule.getCronSchedule(), schedule.getTimeZone());
        return schedule;
    }
}
