package io.trello.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.jspecify.annotations.Nullable;

public final class Utils {

    public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Utils() {
    }

    /**
     * Parses a JSON document into a tree. An empty or blank document yields {@link NullNode}.
     *
     * @param json the document
     * @return the parsed tree
     * @throws JsonProcessingException if the document is not valid JSON
     */
    public static JsonNode readTree(@Nullable String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return NullNode.getInstance();
        }
        return OBJECT_MAPPER.readTree(json);
    }

    public static String toJson(Object value) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsString(value);
    }

    public static <T> T defaultIfNull(@Nullable T value, T defaultValue) {
        return value == null ? defaultValue : value;
    }

    public static boolean isBlank(@Nullable String value) {
        return value == null || value.isBlank();
    }
}
