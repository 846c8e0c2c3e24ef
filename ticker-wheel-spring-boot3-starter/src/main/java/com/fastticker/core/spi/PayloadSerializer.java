package com.fastticker.core.spi;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * 载荷编解码, 对引擎而言载荷是不透明字节
 */
public interface PayloadSerializer {

    /** 反序列化为指定泛型类型 */
    <T> T deserialize(byte[] bytes, TypeReference<T> typeRef);

    /** 序列化为字节 */
    byte[] serialize(Object obj);
}
