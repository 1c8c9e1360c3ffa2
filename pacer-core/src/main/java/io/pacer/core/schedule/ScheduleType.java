package io.pacer.core.schedule;

import java.time.ZonedDateTime;

import static io.pacer.core.schedule.CalendarMath.atLocal;

/**
 * Cron expressions that tick once per calendar unit at a fixed position inside it.
 *
 * Ticks of these schedules can be computed by adding the unit instead of matching cron fields.
 */
public enum ScheduleType
{
    HOURLY {
        @Override
        public ZonedDateTime shift(ZonedDateTime time, int amount)
        {
            // elapsed hours so that both occurrences of a repeated local hour are visited
            return time.plusHours(amount);
        }

        @Override
        public boolean isHourChangeExpected()
        {
            return true;
        }
    },
    DAILY {
        @Override
        public ZonedDateTime shift(ZonedDateTime time, int amount)
        {
            return atLocal(time.toLocalDateTime().plusDays(amount), time.getZone());
        }
    },
    WEEKLY {
        @Override
        public ZonedDateTime shift(ZonedDateTime time, int amount)
        {
            return atLocal(time.toLocalDateTime().plusWeeks(amount), time.getZone());
        }
    },
    MONTHLY {
        @Override
        public ZonedDateTime shift(ZonedDateTime time, int amount)
        {
            return atLocal(time.toLocalDateTime().plusMonths(amount), time.getZone());
        }
    };

    /**
     * Moves {@code time} by {@code amount} units. A negative amount moves backward.
     */
    public abstract ZonedDateTime shift(ZonedDateTime time, int amount);

    public boolean isHourChangeExpected()
    {
        return false;
    }
}
