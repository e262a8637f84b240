package io.renderscratch.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.renderscratch.core.ScratchValue;
import io.renderscratch.json.spi.JsonException;
import io.renderscratch.json.spi.ScratchJsonCodec;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Jackson implementation of ScratchJsonCodec.
 * Converts scratch values to and from Jackson trees.
 */
public final class JacksonScratchJsonCodec implements ScratchJsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper.
     */
    public JacksonScratchJsonCodec() {
        this(new ObjectMapper(new JsonFactory()));
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonScratchJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public byte[] writeBytes(ScratchValue value) throws JsonException {
        Objects.requireNonNull(value, "value");
        JsonNode tree = toTree(value, mapper.getNodeFactory(), "$");
        try {
            return mapper.writeValueAsBytes(tree);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize scratch value to bytes", e);
        }
    }

    @Override
    public String writeString(ScratchValue value) throws JsonException {
        Objects.requireNonNull(value, "value");
        JsonNode tree = toTree(value, mapper.getNodeFactory(), "$");
        try {
            return mapper.writeValueAsString(tree);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize scratch value to string", e);
        }
    }

    @Override
    public ScratchValue readValue(byte[] data) throws JsonException {
        JsonNode node;
        try {
            node = mapper.readTree(data);
        } catch (Exception e) {
            throw new JsonException("Failed to parse bytes to scratch value", e);
        }
        return fromTree(node, "$");
    }

    @Override
    public ScratchValue readValue(String json) throws JsonException {
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (Exception e) {
            throw new JsonException("Failed to parse string to scratch value", e);
        }
        return fromTree(node, "$");
    }

    @Override
    public ScratchValue readValue(InputStream input) throws JsonException {
        JsonNode node;
        try {
            node = mapper.readTree(input);
        } catch (Exception e) {
            throw new JsonException("Failed to parse input stream to scratch value", e);
        }
        return fromTree(node, "$");
    }

    static JsonNode toTree(ScratchValue value, JsonNodeFactory nodes, String path) throws JsonException {
        switch (value.type()) {
            case NUMERIC:
                ScratchValue.Numeric n = (ScratchValue.Numeric) value;
                if (n.isIntegral()) return nodes.numberNode(n.longValue());
                // JSON has no NaN or Infinity literal
                if (!Double.isFinite(n.doubleValue())) {
                    throw new JsonException("Non-finite number " + n + " has no JSON representation", path);
                }
                return nodes.numberNode(n.doubleValue());
            case TEXT:
                return nodes.textNode(((ScratchValue.Text) value).value());
            case SEQUENCE:
                ArrayNode array = nodes.arrayNode();
                List<ScratchValue> elements = ((ScratchValue.Sequence) value).elements();
                for (int i = 0; i < elements.size(); i++) {
                    array.add(toTree(elements.get(i), nodes, path + "[" + i + "]"));
                }
                return array;
            case MAPPING:
                ObjectNode object = nodes.objectNode();
                for (Map.Entry<String, ScratchValue> e : ((ScratchValue.Mapping) value).entries().entrySet()) {
                    object.set(e.getKey(), toTree(e.getValue(), nodes, path + "." + e.getKey()));
                }
                return object;
            default:
                throw new IllegalStateException("unhandled value type " + value.type());
        }
    }

    static ScratchValue fromTree(JsonNode node, String path) throws JsonException {
        if (node == null || node.isMissingNode()) {
            throw new JsonException("No JSON content", path);
        }
        switch (node.getNodeType()) {
            case NUMBER:
                if (node.isIntegralNumber() && node.canConvertToLong()) {
                    return ScratchValue.of(node.longValue());
                }
                return ScratchValue.of(node.doubleValue());
            case STRING:
                return ScratchValue.of(node.textValue());
            case ARRAY:
                List<ScratchValue> elements = new ArrayList<>(node.size());
                for (int i = 0; i < node.size(); i++) {
                    elements.add(fromTree(node.get(i), path + "[" + i + "]"));
                }
                return new ScratchValue.Sequence(elements);
            case OBJECT:
                TreeMap<String, ScratchValue> entries = new TreeMap<>();
                Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    entries.put(field.getKey(), fromTree(field.getValue(), path + "." + field.getKey()));
                }
                return new ScratchValue.Mapping(entries);
            default:
                throw new JsonException("Unsupported JSON " + node.getNodeType().name().toLowerCase(Locale.ROOT)
                        + " (scratch values are numbers, strings, arrays or objects)", path);
        }
    }
}
