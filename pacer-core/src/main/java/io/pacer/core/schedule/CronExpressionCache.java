package io.pacer.core.schedule;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.google.inject.Inject;
import io.pacer.commons.guava.ThrowablesUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded memo of {@link CronExpander#expand(String)} results keyed by expression.
 *
 * Least recently used entries are evicted first once the cache holds {@code maximumSize} expressions.
 * Invalid expressions are not cached.
 */
public class CronExpressionCache
{
    private static final Logger logger = LoggerFactory.getLogger(CronExpressionCache.class);

    private final LoadingCache<String, CronExpansion> cache;

    @Inject
    public CronExpressionCache(TickEngineConfig config)
    {
        this(config.getCronCacheSize());
    }

    public CronExpressionCache(int maximumSize)
    {
        this.cache = CacheBuilder.newBuilder()
            .maximumSize(maximumSize)
            .build(new CacheLoader<String, CronExpansion>()
            {
                @Override
                public CronExpansion load(String expression)
                {
                    logger.debug("Expanding cron expression '{}'", expression);
                    return CronExpander.expand(expression);
                }
            });
    }

    public CronExpansion get(String expression)
    {
        if (expression == null) {
            throw new InvalidCronExpressionException("Cron expression must not be null");
        }
        try {
            return cache.getUnchecked(expression);
        }
        catch (UncheckedExecutionException ex) {
            throw ThrowablesUtil.propagate(ex.getCause());
        }
    }

    public long size()
    {
        return cache.size();
    }
}
