package io.pacer.spi;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pacer.client.PacerObjectMapper;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class SensorResultTest
{
    private final ObjectMapper mapper = PacerObjectMapper.objectMapper();

    private static final SensorResult.Visitor<String> DESCRIBE = new SensorResult.Visitor<String>()
    {
        @Override
        public String visitRunRequest(RunRequest runRequest)
        {
            return "run:" + runRequest.getRunKey().or("-");
        }

        @Override
        public String visitSkipReason(SkipReason skipReason)
        {
            return "skip:" + skipReason.getSkipMessage().or("-");
        }

        @Override
        public String visitRunReaction(RunReaction runReaction)
        {
            return "reaction:" + runReaction.getRunId();
        }
    };

    @Test
    public void visitorDispatchesByKind()
    {
        assertThat(RunRequest.ofRunKey("k1").accept(DESCRIBE), is("run:k1"));
        assertThat(SkipReason.of("no new data").accept(DESCRIBE), is("skip:no new data"));
        assertThat(RunReaction.builder().runId("r1").build().accept(DESCRIBE), is("reaction:r1"));

        assertThat(RunRequest.of().getKind(), is(SensorResult.Kind.RUN_REQUEST));
        assertThat(SkipReason.empty().getKind(), is(SensorResult.Kind.SKIP_REASON));
    }

    @Test
    public void runRequestHasEmptyRunConfigByDefault()
    {
        RunRequest request = RunRequest.builder().jobName("job_a").build();
        assertThat(request.getRunConfig().isEmpty(), is(true));
        assertThat(request.getTags().isEmpty(), is(true));
    }

    @Test
    public void runRequestJson()
            throws Exception
    {
        RunRequest request = RunRequest.builder()
            .runKey("2016-02-03")
            .jobName("job_a")
            .putTags("owner", "etl")
            .partitionKey("2016-02-03")
            .build();
        String json = mapper.writeValueAsString(request);
        RunRequest decoded = mapper.readValue(json, RunRequest.class);
        assertThat(decoded, is(request));
    }
}
