package io.pacer.core.sensor;

import com.google.common.base.Optional;
import io.pacer.spi.JobDefinition;
import io.pacer.spi.JobResolver;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A job a sensor may request runs of, either referenced by name within the repository or
 * given directly as a definition.
 */
public final class SensorTarget
{
    private final String jobName;
    private final Optional<JobDefinition> job;

    private SensorTarget(String jobName, Optional<JobDefinition> job)
    {
        this.jobName = checkNotNull(jobName, "jobName");
        this.job = job;
    }

    public static SensorTarget ofJobName(String jobName)
    {
        return new SensorTarget(jobName, Optional.absent());
    }

    public static SensorTarget ofJob(JobDefinition job)
    {
        return new SensorTarget(job.getName(), Optional.of(job));
    }

    public String getJobName()
    {
        return jobName;
    }

    public Optional<JobDefinition> getJob()
    {
        return job;
    }

    public boolean isLoadable()
    {
        return job.isPresent();
    }

    public JobDefinition resolve(JobResolver resolver)
    {
        if (job.isPresent()) {
            return job.get();
        }
        Optional<JobDefinition> resolved = resolver.resolve(jobName);
        if (!resolved.isPresent()) {
            throw new InvalidSensorDefinitionException("Job '" + jobName + "' targeted by a sensor does not exist");
        }
        return resolved.get();
    }

    @Override
    public String toString()
    {
        return job.isPresent() ? "SensorTarget{job=" + jobName + "}" : "SensorTarget{jobName=" + jobName + "}";
    }
}
