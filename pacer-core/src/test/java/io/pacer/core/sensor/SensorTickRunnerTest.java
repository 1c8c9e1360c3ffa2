package io.pacer.core.sensor;

import java.time.Instant;

import com.google.common.base.Optional;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.pacer.client.PacerObjectMapper;
import io.pacer.client.config.Config;
import io.pacer.client.config.ConfigFactory;
import io.pacer.spi.InstanceFactory;
import io.pacer.spi.InstanceRef;
import io.pacer.spi.RunRequest;
import io.pacer.spi.SensorInstance;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@RunWith(MockitoJUnitRunner.class)
public class SensorTickRunnerTest
{
    private static final InstanceRef REF = InstanceRef.of("memory://test");

    @Mock InstanceFactory instanceFactory;
    @Mock SensorInstance instance;

    private final SensorTickRunner runner = new SensorTickRunner(
            ref -> instanceFactory.open(ref), SensorEngineConfig.defaultConfig());

    private static SensorTickRequest request(Optional<String> cursor)
    {
        return SensorTickRequest.builder()
            .instanceRef(REF)
            .cursor(cursor)
            .build();
    }

    @Test
    public void closesInstanceAfterSuccess()
    {
        when(instanceFactory.open(REF)).thenReturn(instance);
        SensorDefinition sensor = SensorDefinition.builder("touches_instance")
            .jobName("job")
            .evaluationFunction(context -> {
                assertThat(context.getInstance(), is(sameInstance(instance)));
                context.updateCursor(Optional.of("next"));
                return SensorOutput.of(RunRequest.of());
            })
            .build();

        SensorExecutionData data = runner.runTick(sensor, request(Optional.of("prev")));
        assertThat(data.getCursor(), is(Optional.of("next")));
        verify(instance).close();
    }

    @Test
    public void closesInstanceAfterFailure()
    {
        when(instanceFactory.open(REF)).thenReturn(instance);
        SensorDefinition sensor = SensorDefinition.builder("fails")
            .evaluationFunction(context -> {
                context.getInstance();
                return SensorOutput.of(RunRequest.of());
            })
            .build();

        try {
            runner.runTick(sensor, request(Optional.absent()));
            fail();
        }
        catch (InvalidSensorDefinitionException ex) {
            assertThat(ex.getMessage().startsWith("Error in sensor fails:"), is(true));
        }
        verify(instance).close();
    }

    @Test
    public void instanceIsOpenedLazily()
    {
        SensorDefinition sensor = SensorDefinition.builder("no_instance")
            .simpleEvaluationFunction(() -> SensorOutput.none())
            .build();

        SensorExecutionData data = runner.runTick(sensor, request(Optional.of("c")));
        assertThat(data.getCursor(), is(Optional.of("c")));
        verify(instanceFactory, never()).open(REF);
    }

    @Test
    public void tickDue()
    {
        SensorDefinition defaultInterval = SensorDefinition.builder("default_interval")
            .simpleEvaluationFunction(() -> SensorOutput.none())
            .build();
        SensorDefinition slow = SensorDefinition.builder("slow")
            .simpleEvaluationFunction(() -> SensorOutput.none())
            .minimumIntervalSeconds(300)
            .build();
        Instant last = Instant.parse("2022-01-01T00:00:00Z");

        assertThat(runner.getMinimumIntervalSeconds(defaultInterval), is(30));
        assertThat(runner.isTickDue(defaultInterval, Optional.absent(), last), is(true));
        assertThat(runner.isTickDue(defaultInterval, Optional.of(last), last.plusSeconds(29)), is(false));
        assertThat(runner.isTickDue(defaultInterval, Optional.of(last), last.plusSeconds(30)), is(true));
        assertThat(runner.isTickDue(slow, Optional.of(last), last.plusSeconds(60)), is(false));
    }

    @Test
    public void configuredByModule()
    {
        Config systemConfig = new ConfigFactory(PacerObjectMapper.objectMapper()).create()
            .set("sensor.default_minimum_interval_seconds", 10);
        Injector injector = Guice.createInjector(
                new SensorModule(),
                binder -> {
                    binder.bind(Config.class).toInstance(systemConfig);
                    binder.bind(InstanceFactory.class).toInstance(instanceFactory);
                });

        SensorTickRunner injected = injector.getInstance(SensorTickRunner.class);
        SensorDefinition sensor = SensorDefinition.builder("s")
            .simpleEvaluationFunction(() -> SensorOutput.none())
            .build();
        assertThat(injected.getMinimumIntervalSeconds(sensor), is(10));
        assertThat(injector.getInstance(SensorTickRunner.class), is(sameInstance(injected)));
    }
}
