package io.pacer.spi;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableSkipReason.class)
@JsonDeserialize(as = ImmutableSkipReason.class)
public abstract class SkipReason
        implements SensorResult
{
    public abstract Optional<String> getSkipMessage();

    @Override
    @JsonIgnore
    public Kind getKind()
    {
        return Kind.SKIP_REASON;
    }

    @Override
    public <R> R accept(Visitor<R> visitor)
    {
        return visitor.visitSkipReason(this);
    }

    public static SkipReason of(String skipMessage)
    {
        return ImmutableSkipReason.builder()
            .skipMessage(skipMessage)
            .build();
    }

    public static SkipReason empty()
    {
        return ImmutableSkipReason.builder().build();
    }
}
