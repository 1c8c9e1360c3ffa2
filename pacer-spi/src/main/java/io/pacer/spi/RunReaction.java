package io.pacer.spi;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Reports that a sensor reacted to the status of an existing run instead of requesting a new one.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableRunReaction.class)
@JsonDeserialize(as = ImmutableRunReaction.class)
public abstract class RunReaction
        implements SensorResult
{
    public abstract String getRunId();

    public abstract Optional<String> getRunStatus();

    public abstract Optional<String> getError();

    @Override
    @JsonIgnore
    public Kind getKind()
    {
        return Kind.RUN_REACTION;
    }

    @Override
    public <R> R accept(Visitor<R> visitor)
    {
        return visitor.visitRunReaction(this);
    }

    public static ImmutableRunReaction.Builder builder()
    {
        return ImmutableRunReaction.builder();
    }
}
