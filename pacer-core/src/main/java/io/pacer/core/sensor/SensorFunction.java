package io.pacer.core.sensor;

/**
 * Evaluation routine of a sensor that reads its context.
 */
@FunctionalInterface
public interface SensorFunction
{
    SensorOutput evaluate(SensorEvaluationContext context);
}
