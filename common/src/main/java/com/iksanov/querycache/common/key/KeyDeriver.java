package com.iksanov.querycache.common.key;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.NumericNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.hash.Hashing;
import com.iksanov.querycache.common.codec.JsonValueCodec;
import com.iksanov.querycache.common.exception.InvalidCacheRequestException;
import com.iksanov.querycache.common.exception.InvalidShapeException;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Maps a (namespace, query shape) pair to a fixed-length {@link CacheKey}.
 * <p>
 * The shape is converted to a JSON tree, object fields are sorted by name at every
 * depth, and the compact JSON text is hashed with SHA-256. Field order and map
 * implementation therefore never change the key, and the same shape yields the
 * same key in every process that uses this class.
 * <p>
 * Array order is significant. A {@code null} shape is a valid parameterless query.
 * <p>
 * Numbers are written in plain decimal notation with trailing zeros removed, so
 * {@code 1.0E10}, {@code 10000000000} and {@code 1e10} from another runtime's JSON
 * encoder all canonicalize to {@code 10000000000}, and {@code 2.50} to {@code 2.5}.
 * Integral values produce the same key whether they were given as integers or doubles.
 */
public final class KeyDeriver {

    public static final int DIGEST_HEX_LENGTH = 64;
    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    public KeyDeriver() {
        this(JsonValueCodec.defaultMapper());
    }

    public KeyDeriver(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.writer = mapper.writer().with(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN);
    }

    public CacheKey derive(String namespace, Object shape) {
        requireValidNamespace(namespace);
        String canonical = canonicalize(shape);
        String digest = Hashing.sha256()
                .hashString(canonical, StandardCharsets.UTF_8)
                .toString();
        return new CacheKey(namespace, digest);
    }

    public String canonicalize(Object shape) {
        JsonNode tree;
        try {
            tree = shape == null ? NullNode.getInstance() : mapper.valueToTree(shape);
        } catch (IllegalArgumentException e) {
            throw new InvalidShapeException("Query shape of type " + shape.getClass().getName() + " is not serializable", e);
        }
        if (tree == null) tree = NullNode.getInstance();

        try {
            return writer.writeValueAsString(sorted(tree));
        } catch (JsonProcessingException e) {
            throw new InvalidShapeException("Failed to write canonical form of query shape", e);
        }
    }

    static String requireValidNamespace(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new InvalidCacheRequestException("namespace cannot be null or blank");
        }
        if (namespace.indexOf(CacheKey.SEPARATOR) >= 0) {
            throw new InvalidCacheRequestException("namespace cannot contain '" + CacheKey.SEPARATOR + "': " + namespace);
        }
        return namespace;
    }

    private static JsonNode sorted(JsonNode node) {
        if (node.isObject()) {
            Map<String, JsonNode> fields = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> field = it.next();
                fields.put(field.getKey(), sorted(field.getValue()));
            }
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            fields.forEach(result::set);
            return result;
        }
        if (node.isArray()) {
            ArrayNode result = JsonNodeFactory.instance.arrayNode(node.size());
            for (JsonNode element : node) result.add(sorted(element));
            return result;
        }
        if (node.isFloatingPointNumber() && !((NumericNode) node).isNaN()) {
            return plainNumber(node.decimalValue());
        }
        return node;
    }

    private static JsonNode plainNumber(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            return JsonNodeFactory.instance.numberNode(stripped.toBigIntegerExact());
        }
        return JsonNodeFactory.instance.numberNode(stripped);
    }
}
