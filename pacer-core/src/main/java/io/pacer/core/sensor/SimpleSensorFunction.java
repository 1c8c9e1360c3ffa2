package io.pacer.core.sensor;

/**
 * Evaluation routine of a sensor that takes no argument.
 */
@FunctionalInterface
public interface SimpleSensorFunction
{
    SensorOutput evaluate();
}
