package io.pacer.spi;

public enum EventType
{
    ASSET_MATERIALIZATION,
    ASSET_OBSERVATION,
    RUN_SUCCESS,
    RUN_FAILURE;
}
