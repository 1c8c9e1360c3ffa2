package io.pacer.spi;

/**
 * An item produced by a sensor evaluation function.
 *
 * The set of implementations is closed: {@link RunRequest}, {@link SkipReason} and {@link RunReaction}.
 */
public interface SensorResult
{
    enum Kind
    {
        RUN_REQUEST,
        SKIP_REASON,
        RUN_REACTION;
    }

    Kind getKind();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R>
    {
        R visitRunRequest(RunRequest runRequest);

        R visitSkipReason(SkipReason skipReason);

        R visitRunReaction(RunReaction runReaction);
    }
}
