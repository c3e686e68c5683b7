package schedulerapp.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

/**
 * Converts a task's keyword-argument bundle to the JSON text stored in
 * {@code periodic_tasks.kwargs} and back.
 *
 * <p>A null or empty bundle encodes to {@code {}}. Encoding failures surface as
 * {@link IllegalArgumentException} because they mean the caller passed a value Jackson
 * cannot represent.
 */
@Component
public class KwargsCodec {

    /** Stored form of an empty bundle. */
    public static final String EMPTY = "{}";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final JsonMapper jsonMapper;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "JsonMapper is a shared, immutable Spring bean")
    public KwargsCodec(final JsonMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    /**
     * @param kwargs argument bundle, may be null
     * @return JSON object text
     * @throws IllegalArgumentException if a value cannot be serialized
     */
    public String encode(final Map<String, ?> kwargs) {
        if (kwargs == null || kwargs.isEmpty()) {
            return EMPTY;
        }
        try {
            return jsonMapper.writeValueAsString(kwargs);
        } catch (JacksonException e) {
            throw new IllegalArgumentException("kwargs could not be serialized: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @param json stored JSON object text, may be null or blank
     * @return unmodifiable argument bundle in stored key order
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public Map<String, Object> decode(final String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            final Map<String, Object> decoded = jsonMapper.readValue(json, MAP_TYPE);
            return decoded == null ? Map.of() : Collections.unmodifiableMap(decoded);
        } catch (JacksonException e) {
            throw new IllegalArgumentException("kwargs could not be deserialized: " + e.getOriginalMessage(), e);
        }
    }
}
