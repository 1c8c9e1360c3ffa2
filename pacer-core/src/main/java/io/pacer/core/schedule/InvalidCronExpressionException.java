package io.pacer.core.schedule;

import io.pacer.client.config.ConfigException;

public class InvalidCronExpressionException
        extends ConfigException
{
    public InvalidCronExpressionException(String message)
    {
        super(message);
    }

    public InvalidCronExpressionException(String expression, String reason)
    {
        super(String.format("Invalid cron expression '%s': %s", expression, reason));
    }

    public InvalidCronExpressionException(String expression, String reason, Throwable cause)
    {
        super(String.format("Invalid cron expression '%s': %s", expression, reason), cause);
    }
}
