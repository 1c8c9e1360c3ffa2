package io.pacer.core.sensor;

import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Pattern;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.pacer.spi.JobDefinition;
import io.pacer.spi.JobResolver;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A sensor: an evaluation routine run at an interval to decide whether runs of its target jobs
 * should be launched.
 *
 * <pre>
 * SensorDefinition sensor = SensorDefinition.builder("new_files")
 *     .jobName("ingest")
 *     .evaluationFunction(context -&gt; SensorOutput.of(RunRequest.ofRunKey("file-1")))
 *     .build();
 * SensorExecutionData data = sensor.evaluateTick(context);
 * </pre>
 */
public class SensorDefinition
{
    public static final int DEFAULT_MINIMUM_INTERVAL_SECONDS = 30;

    private static final Pattern VALID_NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_]+$");

    private static final ImmutableSet<String> DISALLOWED_NAMES = ImmutableSet.of(
            "context", "conf", "config", "meta", "arg_dict", "dict", "input_arg_dict",
            "output_arg_dict", "int", "str", "float", "bool", "input", "output", "type");

    private final String name;
    private final Optional<SensorFunction> contextFunction;
    private final Optional<SimpleSensorFunction> simpleFunction;
    private final Optional<Integer> minimumIntervalSeconds;
    private final Optional<String> description;
    private final List<SensorTarget> targets;
    private final DefaultSensorStatus defaultStatus;
    private final Optional<Consumer<SensorEvaluationContext>> contextInitializer;

    private SensorDefinition(Builder builder, List<SensorTarget> targets)
    {
        this.name = builder.name;
        this.contextFunction = builder.contextFunction;
        this.simpleFunction = builder.simpleFunction;
        this.minimumIntervalSeconds = builder.minimumIntervalSeconds;
        this.description = builder.description;
        this.targets = targets;
        this.defaultStatus = builder.defaultStatus;
        this.contextInitializer = builder.contextInitializer;
    }

    public static Builder builder(String name)
    {
        return new Builder(name);
    }

    static String checkValidName(String name)
    {
        if (name == null || !VALID_NAME_PATTERN.matcher(name).matches()) {
            throw new InvalidSensorDefinitionException(String.format(
                        "\"%s\" is not a valid name. It must match regex %s", name, VALID_NAME_PATTERN.pattern()));
        }
        if (DISALLOWED_NAMES.contains(name)) {
            throw new InvalidSensorDefinitionException(String.format(
                        "\"%s\" is not a valid name. It is a reserved word", name));
        }
        return name;
    }

    public String getName()
    {
        return name;
    }

    public Optional<String> getDescription()
    {
        return description;
    }

    /**
     * Minimum number of seconds between two evaluations, when the sensor sets one.
     */
    public Optional<Integer> getMinimumIntervalSeconds()
    {
        return minimumIntervalSeconds;
    }

    public DefaultSensorStatus getDefaultStatus()
    {
        return defaultStatus;
    }

    public List<SensorTarget> getTargets()
    {
        return targets;
    }

    /**
     * Returns true when the evaluation routine takes a context argument.
     */
    public boolean isContextProvided()
    {
        return contextFunction.isPresent();
    }

    public JobDefinition getJob()
    {
        if (targets.size() > 1) {
            throw new InvalidSensorDefinitionException(
                    "Job property not available when SensorDefinition has multiple jobs.");
        }
        if (targets.size() == 1 && targets.get(0).getJob().isPresent()) {
            return targets.get(0).getJob().get();
        }
        throw new InvalidSensorDefinitionException("No job was provided to SensorDefinition.");
    }

    public Optional<String> getJobName()
    {
        if (targets.size() > 1) {
            throw new SensorInvocationException(
                    "Cannot use jobName for sensor " + name + ", which targets multiple jobs.");
        }
        if (targets.isEmpty()) {
            return Optional.absent();
        }
        return Optional.of(targets.get(0).getJobName());
    }

    public boolean hasLoadableTargets()
    {
        for (SensorTarget target : targets) {
            if (target.isLoadable()) {
                return true;
            }
        }
        return false;
    }

    public List<JobDefinition> loadTargets()
    {
        ImmutableList.Builder<JobDefinition> builder = ImmutableList.builder();
        for (SensorTarget target : targets) {
            if (target.isLoadable()) {
                builder.add(target.getJob().get());
            }
        }
        return builder.build();
    }

    /**
     * Resolves every target, including ones referenced by name, to a job definition.
     */
    public List<JobDefinition> resolveTargets(JobResolver resolver)
    {
        ImmutableList.Builder<JobDefinition> builder = ImmutableList.builder();
        for (SensorTarget target : targets) {
            builder.add(target.resolve(resolver));
        }
        return builder.build();
    }

    /**
     * Evaluates the sensor once with the given context.
     *
     * @throws SensorEvaluationException if the output is not a valid combination of results
     * @throws InvalidSensorDefinitionException if a run request does not match the targets
     */
    public SensorExecutionData evaluateTick(SensorEvaluationContext context)
    {
        prepareContext(context);
        return new SensorEvaluator(this).evaluate(context);
    }

    /**
     * Calls the evaluation routine of a sensor that takes no argument.
     */
    public SensorOutput invoke()
    {
        if (contextFunction.isPresent()) {
            throw new SensorInvocationException(
                    "Sensor evaluation function expected context argument, but no context argument was provided when invoking.");
        }
        return nullToNone(simpleFunction.get().evaluate());
    }

    public SensorOutput invoke(SensorEvaluationContext context)
    {
        return invoke(Optional.of(context));
    }

    /**
     * Calls the evaluation routine of a sensor that takes a context. A default context is
     * built when none is given.
     */
    public SensorOutput invoke(Optional<SensorEvaluationContext> context)
    {
        if (!contextFunction.isPresent()) {
            throw new SensorInvocationException(
                    "Sensor function has no arguments, but arguments were provided to invocation.");
        }
        SensorEvaluationContext ctx = context.isPresent() ? context.get() : SensorContexts.build();
        prepareContext(ctx);
        return nullToNone(contextFunction.get().evaluate(ctx));
    }

    SensorOutput evaluateFunction(SensorEvaluationContext context)
    {
        if (contextFunction.isPresent()) {
            return nullToNone(contextFunction.get().evaluate(context));
        }
        else {
            return nullToNone(simpleFunction.get().evaluate());
        }
    }

    private void prepareContext(SensorEvaluationContext context)
    {
        if (contextInitializer.isPresent() && !context.getAssetCursorTracker().isPresent()) {
            contextInitializer.get().accept(context);
        }
    }

    private static SensorOutput nullToNone(SensorOutput output)
    {
        return output == null ? SensorOutput.none() : output;
    }

    @Override
    public String toString()
    {
        return "SensorDefinition{name=" + name + ", targets=" + targets + "}";
    }

    public static class Builder
    {
        private final String name;
        private Optional<SensorFunction> contextFunction = Optional.absent();
        private Optional<SimpleSensorFunction> simpleFunction = Optional.absent();
        private Optional<String> jobName = Optional.absent();
        private Optional<JobDefinition> job = Optional.absent();
        private Optional<List<JobDefinition>> jobs = Optional.absent();
        private Optional<Integer> minimumIntervalSeconds = Optional.absent();
        private Optional<String> description = Optional.absent();
        private DefaultSensorStatus defaultStatus = DefaultSensorStatus.STOPPED;
        private Optional<Consumer<SensorEvaluationContext>> contextInitializer = Optional.absent();

        private Builder(String name)
        {
            this.name = name;
        }

        public Builder evaluationFunction(SensorFunction function)
        {
            this.contextFunction = Optional.of(function);
            this.simpleFunction = Optional.absent();
            return this;
        }

        public Builder simpleEvaluationFunction(SimpleSensorFunction function)
        {
            this.simpleFunction = Optional.of(function);
            this.contextFunction = Optional.absent();
            return this;
        }

        public Builder jobName(String jobName)
        {
            this.jobName = Optional.of(jobName);
            return this;
        }

        public Builder job(JobDefinition job)
        {
            this.job = Optional.of(job);
            return this;
        }

        public Builder jobs(List<JobDefinition> jobs)
        {
            this.jobs = Optional.of(ImmutableList.copyOf(jobs));
            return this;
        }

        public Builder minimumIntervalSeconds(int minimumIntervalSeconds)
        {
            checkArgument(minimumIntervalSeconds > 0, "minimumIntervalSeconds must be positive: %s", minimumIntervalSeconds);
            this.minimumIntervalSeconds = Optional.of(minimumIntervalSeconds);
            return this;
        }

        public Builder description(String description)
        {
            this.description = Optional.of(description);
            return this;
        }

        public Builder defaultStatus(DefaultSensorStatus defaultStatus)
        {
            this.defaultStatus = defaultStatus;
            return this;
        }

        Builder contextInitializer(Consumer<SensorEvaluationContext> contextInitializer)
        {
            this.contextInitializer = Optional.of(contextInitializer);
            return this;
        }

        public SensorDefinition build()
        {
            checkValidName(name);
            if (!contextFunction.isPresent() && !simpleFunction.isPresent()) {
                throw new InvalidSensorDefinitionException("Must provide an evaluation function to SensorDefinition.");
            }
            boolean hasJobs = jobs.isPresent() && !jobs.get().isEmpty();
            if (job.isPresent() && hasJobs) {
                throw new InvalidSensorDefinitionException(
                        "Attempted to provide both job and jobs to SensorDefinition. Must provide only one of the two.");
            }
            if (jobName.isPresent() && (job.isPresent() || hasJobs)) {
                throw new InvalidSensorDefinitionException(String.format(
                            "Attempted to provide both jobName and %s to SensorDefinition. Must provide only one of the two.",
                            job.isPresent() ? "job" : "jobs"));
            }

            ImmutableList.Builder<SensorTarget> targets = ImmutableList.builder();
            if (jobName.isPresent()) {
                targets.add(SensorTarget.ofJobName(jobName.get()));
            }
            else if (job.isPresent()) {
                targets.add(SensorTarget.ofJob(job.get()));
            }
            else if (hasJobs) {
                for (JobDefinition j : jobs.get()) {
                    targets.add(SensorTarget.ofJob(j));
                }
            }
            return new SensorDefinition(this, targets.build());
        }
    }
}
