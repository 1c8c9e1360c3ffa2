package io.pacer.core.sensor;

import java.time.Duration;
import java.time.Instant;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.pacer.spi.InstanceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.pacer.commons.guava.ThrowablesUtil.firstCauseWithMessage;

/**
 * Runs sensor ticks on behalf of a daemon.
 *
 * Each tick gets a fresh context bound to the requested instance. The instance is closed when
 * the tick ends, whether it succeeded or not.
 */
public class SensorTickRunner
{
    private static final Logger logger = LoggerFactory.getLogger(SensorTickRunner.class);

    private final InstanceFactory instanceFactory;
    private final SensorEngineConfig config;

    @Inject
    public SensorTickRunner(InstanceFactory instanceFactory, SensorEngineConfig config)
    {
        this.instanceFactory = instanceFactory;
        this.config = config;
    }

    public int getMinimumIntervalSeconds(SensorDefinition sensor)
    {
        return sensor.getMinimumIntervalSeconds().or(config.getDefaultMinimumIntervalSeconds());
    }

    /**
     * Returns true when the minimum interval of the sensor has elapsed since its last completed tick.
     */
    public boolean isTickDue(SensorDefinition sensor, Optional<Instant> lastCompletionTime, Instant now)
    {
        if (!lastCompletionTime.isPresent()) {
            return true;
        }
        Duration elapsed = Duration.between(lastCompletionTime.get(), now);
        return elapsed.getSeconds() >= getMinimumIntervalSeconds(sensor);
    }

    public SensorExecutionData runTick(SensorDefinition sensor, SensorTickRequest request)
    {
        try (SensorEvaluationContext context = SensorEvaluationContext.builder()
                .instanceRef(request.getInstanceRef(), instanceFactory)
                .cursor(request.getCursor())
                .lastCompletionTime(request.getLastCompletionTime())
                .lastRunKey(request.getLastRunKey())
                .repositoryName(request.getRepositoryName())
                .build()) {
            SensorExecutionData data = sensor.evaluateTick(context);
            if (data.getSkipMessage().isPresent()) {
                logger.info("Sensor {} skipped: {}", sensor.getName(), data.getSkipMessage().get());
            }
            else {
                logger.info("Sensor {} requested {} runs", sensor.getName(), data.getRunRequests().size());
            }
            return data;
        }
        catch (RuntimeException ex) {
            logger.error("Sensor {} tick failed: {}", sensor.getName(), firstCauseWithMessage(ex).getMessage(), ex);
            throw ex;
        }
    }
}
