package com.fastticker.core.serializer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fastticker.core.spi.PayloadSerializer;

import java.io.IOException;

public class JacksonPayloadSerializer implements PayloadSerializer {

    private final ObjectMapper mapper;

    /** 使用推荐的默认配置构造 */
    public JacksonPayloadSerializer() {
        this(createDefaultMapper());
    }

    /** 允许外部传入自定义 ObjectMapper */
    public JacksonPayloadSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public <T> T deserialize(byte[] bytes, TypeReference<T> typeRef) {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        try {
            return mapper.readValue(bytes, typeRef);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to deserialize payload from JSON", e);
        }
    }

    @Override
    public byte[] serialize(Object payload) {
        if (payload == null) {
            return null;
        }
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize payload to JSON", e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // 反序列化忽略未知字段，增强前后兼容
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        m.enable(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT);
        // 自动发现 JSR310 等模块
        m.findAndRegisterModules();
        return m;
    }
}
