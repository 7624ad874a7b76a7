package com.baykanat.metrics.core.domain.service;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Dimension map'inin kanonik JSON'u üzerinden sıra bağımsız SHA-256 hex digest. Anahtarlar sıralanır, değerler
 * JSON tipleriyle yazılır ("null" string'i ile null ayrışır). null ve boş map "{}" olarak aynı digest'i üretir.
 */
@Component
public class DimensionHasher {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper objectMapper;
    private final ObjectWriter canonicalWriter;

    public DimensionHasher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.canonicalWriter = objectMapper.writer().with(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
    }

    public String hash(Map<String, ?> dimensions) {
        JsonNode canonical = dimensions == null ? NODES.objectNode() : canonicalMap(dimensions);
        try {
            return sha256(canonicalWriter.writeValueAsString(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Dimensions are not serializable: " + dimensions, e);
        }
    }

    /** Anahtar sıralı ObjectNode; null anahtar boş string sayılır. */
    private ObjectNode canonicalMap(Map<?, ?> map) {
        Map<String, Object> sorted = new TreeMap<>();
        map.forEach((key, value) -> sorted.put(key == null ? "" : key.toString(), value));
        ObjectNode node = NODES.objectNode();
        sorted.forEach((key, value) -> node.set(key, canonicalValue(value)));
        return node;
    }

    /** Sayılar ölçekten bağımsız (1 ve 1.0 aynı). */
    private JsonNode canonicalValue(Object value) {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof String text) {
            return NODES.textNode(text);
        }
        if (value instanceof Boolean flag) {
            return NODES.booleanNode(flag);
        }
        if (value instanceof Number number) {
            return NODES.numberNode(new BigDecimal(number.toString()).stripTrailingZeros());
        }
        if (value instanceof Map<?, ?> nested) {
            return canonicalMap(nested);
        }
        if (value instanceof Collection<?> items) {
            ArrayNode array = NODES.arrayNode();
            items.forEach(item -> array.add(canonicalValue(item)));
            return array;
        }
        return objectMapper.valueToTree(value);
    }

    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
