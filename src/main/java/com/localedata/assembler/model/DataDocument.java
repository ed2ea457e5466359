package com.localedata.assembler.model;

import java.util.Iterator;
import java.util.Map;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.EqualsAndHashCode;
import lombok.NonNull;

/**
 * Immutable associative document holding one repository payload.
 *
 * Merging is structural: objects are merged key by key, recursively, and for
 * any other value the document passed to {@link #mergedWith(DataDocument)}
 * wins. Neither operand is modified.
 */
@EqualsAndHashCode
public final class DataDocument {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JsonNode root;

    private DataDocument(JsonNode root) {
        this.root = root;
    }

    public static DataDocument parse(String json) throws JsonProcessingException {
        JsonNode root = MAPPER.readTree(json);
        if (root == null || root.isMissingNode()) {
            throw new JsonParseException(null, "Empty document");
        }
        return new DataDocument(root);
    }

    /**
     * Value of a top-level boolean field, false when absent or not a boolean.
     */
    public boolean isFlagSet(String field) {
        JsonNode value = root.get(field);
        return value != null && value.isBoolean() && value.booleanValue();
    }

    public JsonNode get(String field) {
        JsonNode value = root.get(field);
        return value == null ? null : value.deepCopy();
    }

    public DataDocument mergedWith(@NonNull DataDocument overrides) {
        return new DataDocument(merge(root.deepCopy(), overrides.root));
    }

    private static JsonNode merge(JsonNode target, JsonNode source) {
        if (!target.isObject() || !source.isObject()) {
            return source.deepCopy();
        }
        ObjectNode merged = (ObjectNode) target;
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = merged.get(field.getKey());
            merged.set(field.getKey(), existing == null
                    ? field.getValue().deepCopy()
                    : merge(existing, field.getValue()));
        }
        return merged;
    }

    /**
     * Compact JSON text of the document.
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Document cannot be serialized", e);
        }
    }

    @Override
    public String toString() {
        return toJson();
    }
}
