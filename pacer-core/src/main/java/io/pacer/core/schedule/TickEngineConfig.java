package io.pacer.core.schedule;

import java.time.ZoneId;

import io.pacer.client.config.Config;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkState;

@Value.Immutable
public interface TickEngineConfig
{
    int DEFAULT_CRON_CACHE_SIZE = 128;

    String DEFAULT_TIMEZONE = "UTC";

    int getCronCacheSize();

    ZoneId getDefaultTimeZone();

    @Value.Check
    default void check()
    {
        checkState(getCronCacheSize() > 0, "tick.cron_cache_size must be positive");
    }

    static ImmutableTickEngineConfig.Builder builder()
    {
        return ImmutableTickEngineConfig.builder();
    }

    static TickEngineConfig defaultConfig()
    {
        return builder()
            .cronCacheSize(DEFAULT_CRON_CACHE_SIZE)
            .defaultTimeZone(ZoneId.of(DEFAULT_TIMEZONE))
            .build();
    }

    static TickEngineConfig convertFrom(Config config)
    {
        return builder()
            .cronCacheSize(config.get("tick.cron_cache_size", int.class, DEFAULT_CRON_CACHE_SIZE))
            .defaultTimeZone(config.get("tick.default_timezone", ZoneId.class, ZoneId.of(DEFAULT_TIMEZONE)))
            .build();
    }
}
