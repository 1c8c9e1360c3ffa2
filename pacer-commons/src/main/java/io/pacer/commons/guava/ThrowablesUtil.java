package io.pacer.commons.guava;

import com.google.common.base.Throwables;

public class ThrowablesUtil
{
    private ThrowablesUtil()
    { }

    /**
     * Rethrows an unchecked throwable as is and wraps a checked one with RuntimeException.
     *
     * The return type lets callers write {@code throw ThrowablesUtil.propagate(ex);} so that
     * the compiler sees the statement as terminal.
     */
    public static RuntimeException propagate(Throwable throwable)
    {
        Throwables.throwIfUnchecked(throwable);
        throw new RuntimeException(throwable);
    }

    public static <X extends Throwable> void propagateIfInstanceOf(Throwable throwable, Class<X> declaredType)
            throws X
    {
        if (throwable != null) {
            Throwables.throwIfInstanceOf(throwable, declaredType);
        }
    }

    /**
     * Walks the cause chain and returns the first throwable with a non-empty message, or the throwable itself.
     */
    public static Throwable firstCauseWithMessage(Throwable throwable)
    {
        Throwable current = throwable;
        while (current != null) {
            String message = current.getMessage();
            if (message != null && !message.isEmpty()) {
                return current;
            }
            current = current.getCause();
        }
        return throwable;
    }
}
