package com.fastguard.core.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fastguard.core.spi.PayloadSerializer;

/**
 * 死信 payload / 本地死信文件行 / kafka 告警消息共用的 JSON 序列化
 */
public class JacksonPayloadSerializer implements PayloadSerializer {

    private final ObjectMapper objectMapper;

    public JacksonPayloadSerializer() {
        this(createDefaultMapper());
    }

    public JacksonPayloadSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String serialize(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON write failed for " + value.getClass().getSimpleName(), e);
        }
    }

    @Override
    public <T> T deserialize(String json, Class<T> type) {
        return json == null ? null : read(json, type.getSimpleName(), objectMapper.constructType(type));
    }

    @Override
    public <T> T deserialize(String json, TypeReference<T> typeRef) {
        return json == null ? null : read(json, typeRef.getType().getTypeName(), objectMapper.constructType(typeRef));
    }

    private <T> T read(String json, String target, JavaType javaType) {
        try {
            return objectMapper.readValue(json, javaType);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON read failed for " + target, e);
        }
    }

    /**
     * ISO-8601 时间, 容忍未知字段和空字符串, 自动注册 classpath 上的模块(JSR310 等)
     */
    public static ObjectMapper createDefaultMapper() {
        ObjectMapper om = new ObjectMapper();
        om.findAndRegisterModules();
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        om.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
        return om;
    }
}
