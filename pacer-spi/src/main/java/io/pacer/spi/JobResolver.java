package io.pacer.spi;

import com.google.common.base.Optional;

/**
 * Resolves a job name to a loadable job definition in the repository the sensor belongs to.
 */
public interface JobResolver
{
    Optional<JobDefinition> resolve(String jobName);
}
