package io.pacer.core.sensor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

import com.google.common.collect.ImmutableList;
import io.pacer.spi.SensorResult;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * What an evaluation routine returns: nothing, a single result, a list of results, or a lazily
 * produced sequence of results.
 *
 * A lazy output is consumed only once, by the tick that evaluates it.
 */
public final class SensorOutput
{
    private static final SensorOutput NONE = new SensorOutput(Collections::emptyIterator);

    private final Supplier<? extends Iterator<?>> items;

    private SensorOutput(Supplier<? extends Iterator<?>> items)
    {
        this.items = items;
    }

    public static SensorOutput none()
    {
        return NONE;
    }

    public static SensorOutput of(SensorResult result)
    {
        checkNotNull(result, "result");
        List<SensorResult> list = ImmutableList.of(result);
        return new SensorOutput(list::iterator);
    }

    public static SensorOutput of(SensorResult first, SensorResult... rest)
    {
        List<SensorResult> list = new ArrayList<>();
        list.add(first);
        list.addAll(Arrays.asList(rest));
        return new SensorOutput(list::iterator);
    }

    public static SensorOutput of(List<? extends SensorResult> results)
    {
        List<SensorResult> list = new ArrayList<>(results);
        return new SensorOutput(list::iterator);
    }

    public static SensorOutput lazy(Supplier<? extends Iterator<? extends SensorResult>> results)
    {
        checkNotNull(results, "results");
        return new SensorOutput(results);
    }

    /**
     * Wraps a loosely typed value returned by a routine written against {@code Object}.
     *
     * null is treated as no output, an {@link Iterable} or {@link Iterator} as a sequence, and
     * anything else as a single item. Items that are not sensor results are rejected when the
     * tick is evaluated.
     */
    public static SensorOutput fromValue(Object value)
    {
        if (value == null) {
            return NONE;
        }
        else if (value instanceof SensorOutput) {
            return (SensorOutput) value;
        }
        else if (value instanceof Iterable) {
            Iterable<?> iterable = (Iterable<?>) value;
            return new SensorOutput(iterable::iterator);
        }
        else if (value instanceof Iterator) {
            Iterator<?> iterator = (Iterator<?>) value;
            return new SensorOutput(() -> iterator);
        }
        else {
            List<Object> list = new ArrayList<>();
            list.add(value);
            return new SensorOutput(list::iterator);
        }
    }

    Iterator<?> iterator()
    {
        Iterator<?> iterator = items.get();
        return iterator == null ? Collections.emptyIterator() : iterator;
    }

    /**
     * Drains the output. The returned list may contain null items.
     */
    public List<Object> toList()
    {
        List<Object> list = new ArrayList<>();
        iterator().forEachRemaining(list::add);
        return list;
    }
}
