package io.pacer.core.sensor;

import io.pacer.spi.EventLogRecord;

/**
 * Evaluation routine of a single-asset sensor, called with the latest materialization of the
 * monitored asset that the sensor has not handled yet.
 */
@FunctionalInterface
public interface AssetMaterializationFunction
{
    SensorOutput evaluate(SensorEvaluationContext context, EventLogRecord materialization);
}
