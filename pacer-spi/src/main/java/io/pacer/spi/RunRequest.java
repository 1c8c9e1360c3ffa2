package io.pacer.spi;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.pacer.client.PacerObjectMapper;
import io.pacer.client.config.Config;
import io.pacer.client.config.ConfigFactory;
import org.immutables.value.Value;

/**
 * Asks the caller to launch a run of a job.
 *
 * The run key deduplicates requests across ticks: the caller launches at most one run per key.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableRunRequest.class)
@JsonDeserialize(as = ImmutableRunRequest.class)
public abstract class RunRequest
        implements SensorResult
{
    private static final ConfigFactory CONFIG_FACTORY = new ConfigFactory(PacerObjectMapper.objectMapper());

    public abstract Optional<String> getRunKey();

    /**
     * Name of the targeted job. Required when the sensor targets more than one job.
     */
    public abstract Optional<String> getJobName();

    @Value.Default
    public Config getRunConfig()
    {
        return CONFIG_FACTORY.create();
    }

    public abstract Map<String, String> getTags();

    public abstract Optional<String> getPartitionKey();

    @Override
    @JsonIgnore
    public Kind getKind()
    {
        return Kind.RUN_REQUEST;
    }

    @Override
    public <R> R accept(Visitor<R> visitor)
    {
        return visitor.visitRunRequest(this);
    }

    public static ImmutableRunRequest.Builder builder()
    {
        return ImmutableRunRequest.builder();
    }

    public static RunRequest of()
    {
        return builder().build();
    }

    public static RunRequest ofRunKey(String runKey)
    {
        return builder().runKey(runKey).build();
    }
}
