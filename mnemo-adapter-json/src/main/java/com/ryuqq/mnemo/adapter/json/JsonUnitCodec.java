package com.ryuqq.mnemo.adapter.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Property;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.spi.UnitCodec;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * unit을 Jackson {@link ObjectNode}로 인코딩.
 *
 * <p>선언된 property마다 필드 하나가 됩니다. 디코딩은 각 필드를 property의 선언 Java 타입으로
 * 변환하므로 날짜, decimal, 정수 폭이 텍스트를 거쳐도 유지됩니다.</p>
 *
 * <p><strong>Mapper 설정:</strong></p>
 * <ul>
 *   <li>{@link JavaTimeModule}, 날짜는 ISO-8601 문자열</li>
 *   <li>부동소수점은 {@code BigDecimal}로 읽고 끝자리 0 유지</li>
 *   <li>{@code BigDecimal}은 plain 표기로 출력</li>
 * </ul>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class JsonUnitCodec implements UnitCodec<ObjectNode> {

    private final ObjectMapper mapper;

    public JsonUnitCodec() {
        this.mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false)
            .build();
    }

    /**
     * @return the configured mapper, shared with the storage for file I/O
     */
    ObjectMapper mapper() {
        return mapper;
    }

    @Override
    public ObjectNode encode(Unit unit) {
        ObjectNode node = mapper.createObjectNode();
        for (Map.Entry<String, Object> entry : unit.values().entrySet()) {
            if (entry.getValue() == null) {
                node.putNull(entry.getKey());
            } else {
                node.set(entry.getKey(), mapper.valueToTree(entry.getValue()));
            }
        }
        return node;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Fields the type does not declare are ignored; declared properties
     * missing from the node keep their default.</p>
     *
     * @throws UncheckedIOException if a field cannot be converted to its property type
     */
    @Override
    public Unit decode(EntityType type, ObjectNode stored) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Property property : type.properties()) {
            JsonNode field = stored.get(property.name());
            if (field != null) {
                values.put(property.name(), convert(field, property));
            }
        }
        return type.newUnit().load(values);
    }

    /**
     * @param field stored field
     * @param property declared property
     * @return the field as an instance of the property type, or null
     */
    Object convert(JsonNode field, Property property) {
        if (field.isNull()) {
            return null;
        }
        try {
            return mapper.treeToValue(field, property.type());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(
                "Cannot read " + property.name() + " as " + property.type().getSimpleName(), e);
        }
    }

    /**
     * Converts an identifier read back from a file name.
     *
     * @param text file name atom
     * @param property identifier property
     * @return the value as an instance of the property type
     */
    Object fromText(String text, Property property) {
        return mapper.convertValue(text, property.type());
    }
}
