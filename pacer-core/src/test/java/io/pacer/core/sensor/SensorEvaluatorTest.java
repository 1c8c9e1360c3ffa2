package io.pacer.core.sensor;

import java.util.Arrays;
import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.pacer.spi.JobDefinition;
import io.pacer.spi.RunReaction;
import io.pacer.spi.RunRequest;
import io.pacer.spi.SkipReason;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class SensorEvaluatorTest
{
    @Rule
    public ExpectedException exception = ExpectedException.none();

    private static JobDefinition job(String name)
    {
        return () -> name;
    }

    private static SensorDefinition sensor(SensorFunction function)
    {
        return SensorDefinition.builder("test_sensor")
            .jobName("job_a")
            .evaluationFunction(function)
            .build();
    }

    private static SensorExecutionData evaluate(SensorDefinition sensor)
    {
        return sensor.evaluateTick(SensorContexts.build());
    }

    @Test
    public void singleSkipReason()
    {
        SensorExecutionData data = evaluate(sensor(context -> SensorOutput.of(SkipReason.of("no new data"))));
        assertThat(data.getRunRequests().isEmpty(), is(true));
        assertThat(data.getSkipMessage(), is(Optional.of("no new data")));
        assertThat(data.getRunReactions().isEmpty(), is(true));
    }

    @Test
    public void skipReasonWithoutMessage()
    {
        SensorExecutionData data = evaluate(sensor(context -> SensorOutput.of(SkipReason.empty())));
        assertThat(data.getSkipMessage(), is(Optional.absent()));
    }

    @Test
    public void emptyResult()
    {
        SensorExecutionData data = evaluate(sensor(context -> SensorOutput.none()));
        assertThat(data.getSkipMessage(), is(Optional.of("Sensor function returned an empty result")));

        data = evaluate(sensor(context -> null));
        assertThat(data.getSkipMessage(), is(Optional.of("Sensor function returned an empty result")));

        data = evaluate(sensor(context -> SensorOutput.fromValue(Arrays.asList((Object) null))));
        assertThat(data.getSkipMessage(), is(Optional.of("Sensor function returned an empty result")));
    }

    @Test
    public void runRequests()
    {
        SensorExecutionData data = evaluate(sensor(context -> SensorOutput.of(
                        RunRequest.ofRunKey("a"),
                        RunRequest.builder().runKey("b").jobName("job_a").build())));
        assertThat(data.getRunRequests().size(), is(2));
        assertThat(data.getRunRequests().get(0).getRunKey(), is(Optional.of("a")));
        assertThat(data.getSkipMessage(), is(Optional.absent()));
    }

    @Test
    public void lazyOutputIsConsumed()
    {
        List<RunRequest> requests = ImmutableList.of(RunRequest.ofRunKey("1"), RunRequest.ofRunKey("2"), RunRequest.ofRunKey("3"));
        SensorExecutionData data = evaluate(sensor(context -> SensorOutput.lazy(requests::iterator)));
        assertThat(data.getRunRequests(), is(requests));
    }

    @Test
    public void runReaction()
    {
        RunReaction reaction = RunReaction.builder()
            .runId("run-1")
            .runStatus("FAILURE")
            .build();
        SensorExecutionData data = evaluate(sensor(context -> SensorOutput.of(reaction)));
        assertThat(data.getRunReactions(), is(ImmutableList.of(reaction)));
        assertThat(data.getRunRequests().isEmpty(), is(true));
    }

    @Test
    public void cursorIsReturned()
    {
        SensorExecutionData data = evaluate(sensor(context -> {
            context.updateCursor(Optional.of("42"));
            return SensorOutput.of(RunRequest.ofRunKey("42"));
        }));
        assertThat(data.getCursor(), is(Optional.of("42")));
    }

    @Test
    public void skipReasonAndRunRequest()
    {
        exception.expect(SensorEvaluationException.class);
        exception.expectMessage("Error in sensor test_sensor: Expected a single SkipReason or one or more RunRequests: received both RunRequest and SkipReason");
        evaluate(sensor(context -> SensorOutput.of(RunRequest.of(), SkipReason.of("skip"))));
    }

    @Test
    public void skipReasonAndRunReaction()
    {
        exception.expect(SensorEvaluationException.class);
        exception.expectMessage("received both RunReaction and SkipReason");
        evaluate(sensor(context -> SensorOutput.of(
                        SkipReason.of("skip"),
                        RunReaction.builder().runId("run-1").build())));
    }

    @Test
    public void multipleSkipReasons()
    {
        exception.expect(SensorEvaluationException.class);
        exception.expectMessage("Expected a single SkipReason: received multiple SkipReasons");
        evaluate(sensor(context -> SensorOutput.of(SkipReason.of("a"), SkipReason.of("b"))));
    }

    @Test
    public void unexpectedOutputType()
    {
        exception.expect(SensorEvaluationException.class);
        exception.expectMessage("of type java.lang.Integer");
        evaluate(sensor(context -> SensorOutput.fromValue(42)));
    }

    @Test
    public void runRequestWithoutTarget()
    {
        SensorDefinition sensor = SensorDefinition.builder("untargeted")
            .evaluationFunction(context -> SensorOutput.of(RunRequest.of()))
            .build();

        exception.expect(InvalidSensorDefinitionException.class);
        exception.expectMessage("Error in sensor untargeted: Sensor evaluation function returned a RunRequest for a sensor lacking a specified target");
        evaluate(sensor);
    }

    @Test
    public void runRequestNamingUnknownJob()
    {
        SensorDefinition sensor = SensorDefinition.builder("two_jobs")
            .jobs(ImmutableList.of(job("job_a"), job("job_b")))
            .evaluationFunction(context -> SensorOutput.of(RunRequest.builder().jobName("job_c").build()))
            .build();

        exception.expect(InvalidSensorDefinitionException.class);
        exception.expectMessage("Error in sensor two_jobs: Sensor returned a RunRequest with jobName job_c. Expected one of: [job_a, job_b]");
        evaluate(sensor);
    }

    @Test
    public void runRequestWithoutJobNameForMultipleTargets()
    {
        SensorDefinition sensor = SensorDefinition.builder("two_jobs")
            .jobs(ImmutableList.of(job("job_a"), job("job_b")))
            .evaluationFunction(context -> SensorOutput.of(RunRequest.of()))
            .build();

        exception.expect(InvalidSensorDefinitionException.class);
        exception.expectMessage("did not specify jobName for the requested run. Expected one of: [job_a, job_b]");
        evaluate(sensor);
    }

    @Test
    public void runRequestNamingOneOfMultipleTargets()
    {
        SensorDefinition sensor = SensorDefinition.builder("two_jobs")
            .jobs(ImmutableList.of(job("job_a"), job("job_b")))
            .evaluationFunction(context -> SensorOutput.of(
                        RunRequest.builder().jobName("job_b").build(),
                        RunRequest.builder().jobName("job_a").build()))
            .build();

        assertThat(evaluate(sensor).getRunRequests().size(), is(2));
    }

    @Test
    public void simpleFunction()
    {
        SensorDefinition sensor = SensorDefinition.builder("simple")
            .jobName("job_a")
            .simpleEvaluationFunction(() -> SensorOutput.of(RunRequest.ofRunKey("x")))
            .build();
        assertThat(evaluate(sensor).getRunRequests().get(0).getRunKey(), is(Optional.of("x")));
    }

    @Test
    public void states()
    {
        SensorEvaluator evaluator = new SensorEvaluator(sensor(context -> SensorOutput.of(SkipReason.of("ok"))));
        assertThat(evaluator.getState(), is(SensorEvaluator.State.READY));
        evaluator.evaluate(SensorContexts.build());
        assertThat(evaluator.getState(), is(SensorEvaluator.State.VALID));

        SensorEvaluator rejected = new SensorEvaluator(sensor(context -> SensorOutput.of(SkipReason.of("a"), SkipReason.of("b"))));
        try {
            rejected.evaluate(SensorContexts.build());
            fail();
        }
        catch (SensorEvaluationException ex) {
            assertThat(ex.getMessage(), containsString("multiple SkipReasons"));
        }
        assertThat(rejected.getState(), is(SensorEvaluator.State.REJECTED));
    }

    @Test
    public void evaluatorIsUsedOnce()
    {
        SensorEvaluator evaluator = new SensorEvaluator(sensor(context -> SensorOutput.none()));
        evaluator.evaluate(SensorContexts.build());

        exception.expect(IllegalStateException.class);
        evaluator.evaluate(SensorContexts.build());
    }
}
