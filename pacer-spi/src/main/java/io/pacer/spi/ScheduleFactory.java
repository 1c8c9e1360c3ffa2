package io.pacer.spi;

import java.time.ZoneId;

import io.pacer.client.config.Config;

public interface ScheduleFactory
{
    String getType();

    Schedule newSchedule(Config config, ZoneId timeZone);
}
