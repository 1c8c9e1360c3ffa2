package io.pacer.spi;

/**
 * A job that a sensor can request runs of. Its definition lives outside of this engine.
 */
public interface JobDefinition
{
    String getName();
}
