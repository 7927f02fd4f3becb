package org.javai.httperror.classify;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.httperror.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decodes a failed response body into the JSON object attached to
 * {@link org.javai.httperror.HttpError.FailedResponse}.
 *
 * <p>Anything that is not a well-formed JSON object yields empty. Top-level entries
 * whose value is JSON null are dropped; nested values are kept as decoded.
 * Decimal numbers keep their exact digits and scale.
 * Instances are thread-safe.
 */
public final class JsonBodyDecoder {

    private static final Logger logger = LoggerFactory.getLogger(JsonBodyDecoder.class);

    private final ObjectMapper objectMapper;

    public JsonBodyDecoder() {
        this(new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .setNodeFactory(JsonNodeFactory.withExactBigDecimals(true)));
    }

    public JsonBodyDecoder(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public Optional<ObjectNode> decodeObject(ResponseBody body) {
        Objects.requireNonNull(body, "body must not be null");
        if (body.isEmpty()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body.bytes());
        } catch (IOException e) {
            logger.debug("Omitting JSON body of failed response: {}", e.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        return Optional.of(withoutNulls((ObjectNode) root));
    }

    /**
     * Returns a copy of the object without its top-level null entries.
     */
    static ObjectNode withoutNulls(ObjectNode node) {
        ObjectNode copy = node.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNull()) {
                copy.set(field.getKey(), field.getValue());
            }
        }
        return copy;
    }
}
