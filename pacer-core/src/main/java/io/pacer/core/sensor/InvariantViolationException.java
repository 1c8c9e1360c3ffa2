package io.pacer.core.sensor;

public class InvariantViolationException
        extends IllegalStateException
{
    public InvariantViolationException(String message)
    {
        super(message);
    }
}
