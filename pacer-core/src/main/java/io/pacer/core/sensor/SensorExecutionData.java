package io.pacer.core.sensor;

import java.util.List;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.pacer.spi.RunReaction;
import io.pacer.spi.RunRequest;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkState;

/**
 * Result of one sensor tick. The caller launches the run requests and persists the cursor to
 * feed it back to the next tick.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSensorExecutionData.class)
@JsonDeserialize(as = ImmutableSensorExecutionData.class)
public interface SensorExecutionData
{
    List<RunRequest> getRunRequests();

    Optional<String> getSkipMessage();

    Optional<String> getCursor();

    List<RunReaction> getRunReactions();

    @Value.Check
    default void check()
    {
        checkState(getRunRequests().isEmpty() || !getSkipMessage().isPresent(),
                "Found both skip data and run request data");
    }

    static ImmutableSensorExecutionData.Builder builder()
    {
        return ImmutableSensorExecutionData.builder();
    }
}
