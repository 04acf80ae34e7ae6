package com.trigger.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.trigger.exception.ValueDecodeException;
import com.trigger.exception.ValueEncodeException;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts values to and from their persisted record form.
 * <p>
 * A record is a JSON object with a single {@code value} field, e.g. {@code {"value":42}}.
 * The variable name is not part of the record; it is carried by the storage key.
 */
public class ValueCodec {

    static final String VALUE_FIELD = "value";

    private final ObjectMapper objectMapper;

    public ValueCodec() {
        this(new ObjectMapper());
    }

    public ValueCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Encode a value as a persisted record.
     *
     * @param value Value to encode
     * @return JSON record text
     * @throws ValueEncodeException if the value has no persisted form
     */
    public String encode(Value value) {
        ObjectNode record = objectMapper.createObjectNode();
        record.set(VALUE_FIELD, toJson(value));
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new ValueEncodeException("Failed to encode value " + value, e);
        }
    }

    /**
     * Decode a persisted record.
     *
     * @param record JSON record text
     * @return Decoded value
     * @throws ValueDecodeException if the record is malformed
     */
    public Value decode(String record) {
        JsonNode root;
        try {
            root = objectMapper.readTree(record);
        } catch (JsonProcessingException e) {
            throw new ValueDecodeException("Malformed variable record: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject() || !root.has(VALUE_FIELD)) {
            throw new ValueDecodeException("Variable record has no '" + VALUE_FIELD + "' field: " + record);
        }
        return fromJson(root.get(VALUE_FIELD));
    }

    private JsonNode toJson(Value value) {
        JsonNodeFactory nodes = objectMapper.getNodeFactory();
        return switch (value.type()) {
            case INTEGER -> nodes.numberNode(((IntegerValue) value).value());
            case FLOAT -> {
                double number = ((FloatValue) value).value();
                if (!Double.isFinite(number)) {
                    throw new ValueEncodeException("Non-finite float cannot be stored: " + number);
                }
                yield nodes.numberNode(number);
            }
            case STRING -> nodes.textNode(((StringValue) value).value());
            case BOOLEAN -> nodes.booleanNode(((BooleanValue) value).value());
            case NULL -> nodes.nullNode();
            case LIST -> {
                ArrayNode array = nodes.arrayNode();
                for (Value item : ((ListValue) value).items()) {
                    array.add(toJson(item));
                }
                yield array;
            }
            case FUNCTION -> throw new ValueEncodeException("Functions cannot be stored in variables");
        };
    }

    private Value fromJson(JsonNode node) {
        if (node.isNull()) {
            return Value.nil();
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw new ValueDecodeException("Integer out of range: " + node);
            }
            return Value.of(node.longValue());
        }
        if (node.isNumber()) {
            return Value.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return Value.of(node.textValue());
        }
        if (node.isBoolean()) {
            return Value.of(node.booleanValue());
        }
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(fromJson(item));
            }
            return new ListValue(items);
        }
        throw new ValueDecodeException("Unsupported value shape: " + node.getNodeType());
    }
}
