package io.pacer.spi;

import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkState;

/**
 * Identifies an asset by a path of name components.
 *
 * The user string form joins the components with '/' and is used as the key of asset cursors.
 */
@Value.Immutable
public abstract class AssetKey
{
    private static final Joiner PATH_JOINER = Joiner.on('/');
    private static final Splitter PATH_SPLITTER = Splitter.on('/');

    public abstract List<String> getPath();

    public static AssetKey of(String... path)
    {
        return ImmutableAssetKey.builder()
            .path(Arrays.asList(path))
            .build();
    }

    public static AssetKey of(List<String> path)
    {
        return ImmutableAssetKey.builder()
            .path(path)
            .build();
    }

    @JsonCreator
    public static AssetKey fromUserString(String userString)
    {
        return of(PATH_SPLITTER.splitToList(userString));
    }

    @JsonValue
    public String toUserString()
    {
        return PATH_JOINER.join(getPath());
    }

    @Value.Check
    protected void check()
    {
        checkState(!getPath().isEmpty(), "asset key must have at least one path component");
        for (String component : getPath()) {
            checkState(!component.isEmpty() && component.indexOf('/') < 0,
                    "asset key component must be non-empty and must not contain '/': %s", getPath());
        }
    }

    @Override
    public String toString()
    {
        return "AssetKey{" + toUserString() + "}";
    }
}
