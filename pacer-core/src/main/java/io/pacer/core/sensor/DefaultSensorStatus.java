package io.pacer.core.sensor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.pacer.client.config.ConfigException;

public enum DefaultSensorStatus
{
    RUNNING("running"),
    STOPPED("stopped");

    private final String name;

    DefaultSensorStatus(String name)
    {
        this.name = name;
    }

    @JsonCreator
    public static DefaultSensorStatus of(String name)
    {
        for (DefaultSensorStatus status : values()) {
            if (status.name.equals(name)) {
                return status;
            }
        }
        throw new ConfigException("Unknown sensor status: " + name);
    }

    @JsonValue
    public String getName()
    {
        return name;
    }
}
