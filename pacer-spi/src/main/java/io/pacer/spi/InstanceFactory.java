package io.pacer.spi;

public interface InstanceFactory
{
    SensorInstance open(InstanceRef ref);
}
