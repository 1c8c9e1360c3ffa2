package io.pacer.client.config;

import java.io.IOException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Inject;

public class ConfigFactory
{
    private final ObjectMapper objectMapper;

    @Inject
    public ConfigFactory(ObjectMapper objectMapper)
    {
        this.objectMapper = objectMapper;
    }

    public Config create()
    {
        return new Config(objectMapper);
    }

    /**
     * Parses a JSON object such as a schedule declaration or a system config file.
     */
    public Config fromJsonString(String json)
    {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        }
        catch (IOException ex) {
            throw new ConfigException("Invalid JSON: " + json, ex);
        }
        if (node == null || !node.isObject()) {
            throw new ConfigException("Expected a JSON object but got " + json);
        }
        return new Config(objectMapper, (ObjectNode) node);
    }
}
