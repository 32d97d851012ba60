package io.flowcheck.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flowcheck.core.check.StructuredFieldParser;
import io.flowcheck.core.exception.MalformedStructureException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Jackson-based implementation of {@link StructuredFieldParser}.
///
/// Reads the JSON text stored in embedded-structure columns (`depends_on`,
/// `blocks`, `assignees`) and evidence files.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is thread-safe.
public class JacksonStructuredFieldParser implements StructuredFieldParser {

    private static final TypeReference<List<Object>> LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JacksonStructuredFieldParser() {
        this(new ObjectMapper());
    }

    /// @param objectMapper the mapper used to read stored text, not null
    public JacksonStructuredFieldParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public List<Object> parseList(String text) throws MalformedStructureException {
        JsonNode node = read(text);
        if (!node.isArray()) {
            throw new MalformedStructureException(
                    "Expected a JSON array but found " + node.getNodeType());
        }
        return objectMapper.convertValue(node, LIST);
    }

    @Override
    public Map<String, Object> parseObject(String text) throws MalformedStructureException {
        JsonNode node = read(text);
        if (!node.isObject()) {
            throw new MalformedStructureException(
                    "Expected a JSON object but found " + node.getNodeType());
        }
        return objectMapper.convertValue(node, OBJECT);
    }

    private JsonNode read(String text) throws MalformedStructureException {
        Objects.requireNonNull(text, "text must not be null");
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node == null || node.isMissingNode()) {
                throw new MalformedStructureException("Empty structure");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedStructureException(
                    "Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
