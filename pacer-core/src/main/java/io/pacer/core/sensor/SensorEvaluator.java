package io.pacer.core.sensor;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Optional;
import io.pacer.spi.RunReaction;
import io.pacer.spi.RunRequest;
import io.pacer.spi.SensorResult;
import io.pacer.spi.SkipReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkState;

/**
 * Evaluates one tick of a sensor: invokes the routine, classifies what it produced and checks
 * the run requests against the sensor's targets.
 *
 * An evaluator is used once. A failure at any step rejects the whole tick.
 */
class SensorEvaluator
{
    private static final Logger logger = LoggerFactory.getLogger(SensorEvaluator.class);

    static final String EMPTY_RESULT_MESSAGE = "Sensor function returned an empty result";

    enum State
    {
        READY,
        INVOKING,
        CLASSIFYING,
        VALID,
        REJECTED;
    }

    private final SensorDefinition sensor;
    private State state = State.READY;

    SensorEvaluator(SensorDefinition sensor)
    {
        this.sensor = sensor;
    }

    State getState()
    {
        return state;
    }

    SensorExecutionData evaluate(SensorEvaluationContext context)
    {
        checkState(state == State.READY, "Sensor evaluator is already used");
        try {
            state = State.INVOKING;
            List<Object> items = sensor.evaluateFunction(context).toList();

            state = State.CLASSIFYING;
            Classification classification = classify(items);
            checkValidRunRequests(classification.runRequests);

            SensorExecutionData data = SensorExecutionData.builder()
                .runRequests(classification.runRequests)
                .skipMessage(classification.skipMessage)
                .cursor(context.getCursor())
                .runReactions(classification.runReactions)
                .build();
            state = State.VALID;
            logger.debug("Sensor {} produced {} run requests, {} run reactions, skip message: {}",
                    sensor.getName(), data.getRunRequests().size(), data.getRunReactions().size(),
                    data.getSkipMessage().or("-"));
            return data;
        }
        catch (RuntimeException ex) {
            state = State.REJECTED;
            throw ex;
        }
    }

    private static class Classification
    {
        private final List<RunRequest> runRequests = new ArrayList<>();
        private final List<RunReaction> runReactions = new ArrayList<>();
        private final List<SkipReason> skipReasons = new ArrayList<>();
        private Optional<String> skipMessage = Optional.absent();
    }

    private Classification classify(List<Object> items)
    {
        Classification classification = new Classification();

        if (items.isEmpty() || (items.size() == 1 && items.get(0) == null)) {
            classification.skipMessage = Optional.of(EMPTY_RESULT_MESSAGE);
            return classification;
        }

        for (Object item : items) {
            collect(classification, item);
        }

        if (items.size() == 1) {
            if (!classification.skipReasons.isEmpty()) {
                classification.skipMessage = classification.skipReasons.get(0).getSkipMessage();
            }
            return classification;
        }

        if (!classification.skipReasons.isEmpty()) {
            if (!classification.runRequests.isEmpty()) {
                throw error("Expected a single SkipReason or one or more RunRequests: received both RunRequest and SkipReason");
            }
            else if (!classification.runReactions.isEmpty()) {
                throw error("Expected a single SkipReason or one or more RunReactions: received both RunReaction and SkipReason");
            }
            else {
                throw error("Expected a single SkipReason: received multiple SkipReasons");
            }
        }
        return classification;
    }

    private void collect(final Classification classification, Object item)
    {
        if (!(item instanceof SensorResult)) {
            throw error(String.format(
                        "Sensor unexpectedly returned output %s of type %s. Should only return SkipReason, RunRequest or RunReaction objects.",
                        item, item == null ? "null" : item.getClass().getName()));
        }
        ((SensorResult) item).accept(new SensorResult.Visitor<Void>()
        {
            @Override
            public Void visitRunRequest(RunRequest runRequest)
            {
                classification.runRequests.add(runRequest);
                return null;
            }

            @Override
            public Void visitSkipReason(SkipReason skipReason)
            {
                classification.skipReasons.add(skipReason);
                return null;
            }

            @Override
            public Void visitRunReaction(RunReaction runReaction)
            {
                classification.runReactions.add(runReaction);
                return null;
            }
        });
    }

    private void checkValidRunRequests(List<RunRequest> runRequests)
    {
        List<SensorTarget> targets = sensor.getTargets();
        List<String> targetNames = new ArrayList<>();
        for (SensorTarget target : targets) {
            targetNames.add(target.getJobName());
        }

        if (!runRequests.isEmpty() && targets.isEmpty()) {
            throw new InvalidSensorDefinitionException(errorMessage(
                        "Sensor evaluation function returned a RunRequest for a sensor lacking a specified target (jobName, job, or jobs). " +
                        "Targets can be specified by providing job, jobs, or jobName to the sensor definition."));
        }
        for (RunRequest runRequest : runRequests) {
            if (!runRequest.getJobName().isPresent() && targets.size() > 1) {
                throw new InvalidSensorDefinitionException(errorMessage(
                            "Sensor returned a RunRequest that did not specify jobName for the requested run. Expected one of: " + targetNames));
            }
            else if (runRequest.getJobName().isPresent() && !targetNames.contains(runRequest.getJobName().get())) {
                throw new InvalidSensorDefinitionException(errorMessage(
                            "Sensor returned a RunRequest with jobName " + runRequest.getJobName().get() + ". Expected one of: " + targetNames));
            }
        }
    }

    private String errorMessage(String message)
    {
        return "Error in sensor " + sensor.getName() + ": " + message;
    }

    private SensorEvaluationException error(String message)
    {
        return new SensorEvaluationException(errorMessage(message));
    }
}
