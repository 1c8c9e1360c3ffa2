package io.pacer.commons.guava;

import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

public class ThrowablesUtilTest
{
    @Test
    public void propagateRethrowsUncheckedAsIs()
    {
        IllegalStateException original = new IllegalStateException("test");
        IllegalStateException thrown = Assert.assertThrows(IllegalStateException.class, () -> ThrowablesUtil.propagate(original));
        assertThat(thrown, is(sameInstance(original)));

        Assert.assertThrows(AssertionError.class, () -> ThrowablesUtil.propagate(new AssertionError("test")));
    }

    @Test
    public void propagateWrapsChecked()
    {
        IOException original = new IOException("test");
        RuntimeException thrown = Assert.assertThrows(RuntimeException.class, () -> ThrowablesUtil.propagate(original));
        assertThat(thrown.getCause(), is(sameInstance(original)));
    }

    @Test
    public void propagateIfInstanceOf()
    {
        // null is ignored
        ThrowablesUtil.propagateIfInstanceOf(null, RuntimeException.class);
        // unrelated types are not thrown
        ThrowablesUtil.propagateIfInstanceOf(new NullPointerException("test"), Error.class);

        Assert.assertThrows(NullPointerException.class,
                () -> ThrowablesUtil.propagateIfInstanceOf(new NullPointerException("test"), RuntimeException.class));
    }

    @Test
    public void firstCauseWithMessage()
    {
        IOException root = new IOException("disk full");
        RuntimeException wrapper = new RuntimeException((String) null);
        wrapper.initCause(root);

        assertThat(ThrowablesUtil.firstCauseWithMessage(wrapper), is(sameInstance(root)));
        assertThat(ThrowablesUtil.firstCauseWithMessage(root), is(instanceOf(IOException.class)));
    }
}
