package com.fastguard.core.spi;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * 序列化, 失败抛 IllegalStateException
 */
public interface PayloadSerializer {

    /** 将对象序列化为 JSON 字符串, null 返回 null */
    String serialize(Object obj);

    /** 反序列化 JSON 为指定泛型类型 */
    <T> T deserialize(String json, TypeReference<T> typeRef);

    <T> T deserialize(String json, Class<T> type);
}
