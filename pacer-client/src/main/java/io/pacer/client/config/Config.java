package io.pacer.client.config;

import java.util.List;

import com.fasterxml.jackson.annotation.JacksonInject;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.pacer.commons.guava.ThrowablesUtil;

import static java.util.Locale.ENGLISH;

/**
 * Mutable, JSON-backed bag of settings.
 *
 * Schedule declarations, run configs of run requests and engine settings are all carried as
 * Config. Keys are flat; engine settings use dotted names such as {@code tick.default_timezone}.
 */
public class Config
{
    private final ObjectMapper mapper;
    private final ObjectNode object;

    Config(ObjectMapper mapper)
    {
        this(mapper, new ObjectNode(JsonNodeFactory.instance));
    }

    Config(ObjectMapper mapper, ObjectNode object)
    {
        this.mapper = mapper;
        this.object = object;
    }

    @JsonCreator
    public static Config deserializeFromJackson(@JacksonInject ObjectMapper mapper, JsonNode object)
    {
        if (!object.isObject()) {
            throw new RuntimeJsonMappingException("Expected object but got " + object);
        }
        return new Config(mapper, (ObjectNode) object);
    }

    @JsonValue
    public ObjectNode getObjectNode()
    {
        return object;
    }

    /**
     * Sets a value. A null value removes the key.
     */
    public Config set(String key, Object value)
    {
        if (value == null) {
            object.remove(key);
            return this;
        }
        try {
            object.set(key, mapper.valueToTree(value));
        }
        catch (IllegalArgumentException ex) {
            throw new ConfigException("Value can't be stored in a config: " + value, ex);
        }
        return this;
    }

    public Config deepCopy()
    {
        return new Config(mapper, object.deepCopy());
    }

    public List<String> getKeys()
    {
        return ImmutableList.copyOf(object.fieldNames());
    }

    public boolean isEmpty()
    {
        return object.size() == 0;
    }

    public boolean has(String key)
    {
        return object.has(key);
    }

    public <E> E get(String key, Class<E> type)
    {
        return read(requiredNode(key), type, key);
    }

    public <E> E get(String key, Class<E> type, E defaultValue)
    {
        return getOptional(key, type).or(defaultValue);
    }

    public <E> Optional<E> getOptional(String key, Class<E> type)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return Optional.absent();
        }
        return Optional.of(read(value, type, key));
    }

    public <E> List<E> getList(String key, Class<E> elementType)
    {
        JsonNode value = requiredNode(key);
        if (!value.isArray()) {
            throw conversionError(null, "array type", value, key);
        }
        ImmutableList.Builder<E> builder = ImmutableList.builder();
        for (JsonNode element : value) {
            builder.add(read(element, elementType, key));
        }
        return builder.build();
    }

    /**
     * Reads a value written either as a single element or as an array of elements.
     */
    public <E> List<E> getListOrSingle(String key, Class<E> elementType)
    {
        JsonNode value = requiredNode(key);
        if (value.isArray()) {
            return getList(key, elementType);
        }
        return ImmutableList.of(read(value, elementType, key));
    }

    private JsonNode requiredNode(String key)
    {
        JsonNode value = object.get(key);
        if (value == null) {
            throw new ConfigException("Parameter '" + key + "' is required but not set");
        }
        if (value.isNull()) {
            throw new ConfigException("Parameter '" + key + "' is required but null");
        }
        return value;
    }

    private <E> E read(JsonNode value, Class<E> type, String key)
    {
        try {
            return mapper.treeToValue(value, type);
        }
        catch (Exception ex) {
            ThrowablesUtil.propagateIfInstanceOf(ex, ConfigException.class);
            throw conversionError(ex, describe(type), value, key);
        }
    }

    private static ConfigException conversionError(Exception cause, String expected, JsonNode value, String key)
    {
        String json = value.toString();
        if (json.length() >= 100) {
            json = json.substring(0, 97) + "...";
        }
        String message = String.format(ENGLISH, "Expected %s for key '%s' but got %s (%s)",
                expected, key, json, value.getNodeType().toString().toLowerCase(ENGLISH));
        return cause == null ? new ConfigException(message) : new ConfigException(message, cause);
    }

    private static String describe(Class<?> type)
    {
        if (type == String.class) {
            return "string type";
        }
        if (type == int.class || type == Integer.class) {
            return "integer (int) type";
        }
        if (type == long.class || type == Long.class) {
            return "integer (long) type";
        }
        if (type == boolean.class || type == Boolean.class) {
            return "'true' or 'false'";
        }
        return type.getSimpleName();
    }

    @Override
    public String toString()
    {
        return object.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof Config)) {
            return false;
        }
        return object.equals(((Config) other).object);
    }

    @Override
    public int hashCode()
    {
        return object.hashCode();
    }
}
