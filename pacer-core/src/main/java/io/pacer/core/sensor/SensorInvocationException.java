package io.pacer.core.sensor;

public class SensorInvocationException
        extends IllegalArgumentException
{
    public SensorInvocationException(String message)
    {
        super(message);
    }
}
