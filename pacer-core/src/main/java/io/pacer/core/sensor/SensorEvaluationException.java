package io.pacer.core.sensor;

/**
 * The output of a sensor tick can't be turned into execution data. The whole tick is rejected.
 */
public class SensorEvaluationException
        extends RuntimeException
{
    public SensorEvaluationException(String message)
    {
        super(message);
    }

    public SensorEvaluationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
