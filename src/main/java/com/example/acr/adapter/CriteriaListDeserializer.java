package com.example.acr.adapter;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads criterion ids given either as a JSON array or as one comma-separated string,
 * e.g. {@code ["1.1.1", "4.1.2"]} or {@code "1.1.1, 4.1.2"}.
 */
public class CriteriaListDeserializer extends JsonDeserializer<List<String>> {

    @Override
    public List<String> deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        List<String> ids = new ArrayList<>();
        if (node == null || node.isNull()) {
            return ids;
        }
        if (node.isArray()) {
            node.forEach(element -> ids.addAll(split(element.asText())));
        } else {
            ids.addAll(split(node.asText()));
        }
        return ids;
    }

    @Override
    public List<String> getNullValue(DeserializationContext context) {
        return List.of();
    }

    static List<String> split(String raw) {
        List<String> ids = new ArrayList<>();
        if (raw == null) return ids;
        for (String part : raw.split(",")) {
            String id = part.trim();
            if (!id.isEmpty()) ids.add(id);
        }
        return ids;
    }
}
