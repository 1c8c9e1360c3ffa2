package io.pacer.core.sensor;

/**
 * A sensor is defined or targeted in a way that can never be evaluated successfully.
 */
public class InvalidSensorDefinitionException
        extends RuntimeException
{
    public InvalidSensorDefinitionException(String message)
    {
        super(message);
    }

    public InvalidSensorDefinitionException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
