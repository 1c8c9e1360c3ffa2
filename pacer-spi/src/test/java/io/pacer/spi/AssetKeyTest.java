package io.pacer.spi;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pacer.client.PacerObjectMapper;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class AssetKeyTest
{
    @Rule
    public ExpectedException exception = ExpectedException.none();

    private final ObjectMapper mapper = PacerObjectMapper.objectMapper();

    @Test
    public void userStringJoinsPath()
    {
        AssetKey key = AssetKey.of("warehouse", "orders");
        assertThat(key.toUserString(), is("warehouse/orders"));
        assertThat(AssetKey.fromUserString("warehouse/orders"), is(key));
        assertThat(AssetKey.fromUserString("events").getPath(), contains("events"));
    }

    @Test
    public void serializedAsUserString()
            throws Exception
    {
        AssetKey key = AssetKey.of("a", "b");
        String json = mapper.writeValueAsString(key);
        assertThat(json, is("\"a/b\""));
        assertThat(mapper.readValue(json, AssetKey.class), is(key));
    }

    @Test
    public void rejectEmptyComponent()
    {
        exception.expect(IllegalStateException.class);
        AssetKey.of("a", "");
    }
}
