package io.pacer.core.sensor;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Optional;
import io.pacer.client.PacerObjectMapper;
import io.pacer.spi.EventLogRecord;
import io.pacer.spi.EventRecordsFilter;
import io.pacer.spi.SensorInstance;

abstract class AbstractAssetCursorTracker
        implements AssetCursorTracker
{
    private static final ObjectMapper mapper = PacerObjectMapper.objectMapper();

    private final SensorEvaluationContext context;
    private boolean cursorUpdated = false;

    AbstractAssetCursorTracker(SensorEvaluationContext context)
    {
        this.context = context;
    }

    @Override
    public boolean isCursorUpdated()
    {
        return cursorUpdated;
    }

    @Override
    public void resetCursorUpdated()
    {
        cursorUpdated = false;
    }

    ObjectNode readCursor()
    {
        Optional<String> cursor = context.getCursor();
        if (!cursor.isPresent() || cursor.get().isEmpty()) {
            return mapper.createObjectNode();
        }
        JsonNode node;
        try {
            node = mapper.readTree(cursor.get());
        }
        catch (JsonProcessingException ex) {
            throw new SensorEvaluationException("Asset cursor is not valid JSON: " + cursor.get(), ex);
        }
        if (!node.isObject()) {
            throw new SensorEvaluationException("Asset cursor must be a JSON object: " + cursor.get());
        }
        return (ObjectNode) node;
    }

    ObjectNode newCursor()
    {
        return mapper.createObjectNode();
    }

    void writeCursor(ObjectNode cursor)
    {
        context.updateCursor(Optional.of(cursor.toString()));
        cursorUpdated = true;
    }

    List<EventLogRecord> queryEvents(EventRecordsFilter filter, boolean ascending, Optional<Integer> limit)
    {
        SensorInstance instance = context.getInstance();
        return instance.getEventRecords(filter, ascending, limit);
    }
}
