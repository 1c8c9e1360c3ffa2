package io.pacer.core.schedule;

import java.util.List;

/**
 * Validation and expansion of cron expressions through a process-wide cache.
 */
public final class CronExpressions
{
    private static final CronExpressionCache DEFAULT_CACHE =
        new CronExpressionCache(TickEngineConfig.DEFAULT_CRON_CACHE_SIZE);

    private CronExpressions()
    { }

    public static CronExpressionCache defaultCache()
    {
        return DEFAULT_CACHE;
    }

    public static CronExpansion expand(String expression)
    {
        return DEFAULT_CACHE.get(expression);
    }

    public static boolean isValidCronString(String expression)
    {
        return isValidCronString(DEFAULT_CACHE, expression);
    }

    public static boolean isValidCronSchedule(List<String> cronSchedule)
    {
        return isValidCronSchedule(DEFAULT_CACHE, cronSchedule);
    }

    static boolean isValidCronString(CronExpressionCache cache, String expression)
    {
        if (expression == null) {
            return false;
        }
        try {
            cache.get(expression);
            return true;
        }
        catch (InvalidCronExpressionException ex) {
            return false;
        }
    }

    static boolean isValidCronSchedule(CronExpressionCache cache, List<String> cronSchedule)
    {
        if (cronSchedule == null || cronSchedule.isEmpty()) {
            return false;
        }
        for (String expression : cronSchedule) {
            if (!isValidCronString(cache, expression)) {
                return false;
            }
        }
        return true;
    }
}
