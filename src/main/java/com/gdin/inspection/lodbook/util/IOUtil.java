package com.gdin.inspection.lodbook.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;

@Slf4j
public class IOUtil {
    private static final ObjectMapper simpleMapper = new ObjectMapper();

    static {
        simpleMapper.registerModule(new JavaTimeModule());
        // 避免写成时间戳（否则 Instant 会变成 long）
        simpleMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public static ObjectMapper mapper() {
        return simpleMapper;
    }

    /**
     * json序列化(不降类型信息序列化到json字符串中)
     */
    public static String jsonSerializeWithNoType(Object obj) throws JsonProcessingException {
        return jsonSerializeWithNoType(obj, false);
    }

    /**
     * json序列化(不降类型信息序列化到json字符串中)
     */
    public static String jsonSerializeWithNoType(Object obj, boolean pretty) throws JsonProcessingException {
        if (obj == null) {
            return null;
        } else {
            return pretty ? simpleMapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj) : simpleMapper.writeValueAsString(obj);
        }
    }

    /**
     * json反序列化(json字符串中不包含类型信息)
     */
    public static Object jsonDeserializeWithNoType(InputStream is) throws IOException {
        return simpleMapper.readValue(is, Object.class);
    }

    /**
     * json反序列化(json字符串中不包含类型信息)
     */
    public static <T> T jsonDeserializeWithNoType(String content, Class<T> clazz) throws IOException {
        return simpleMapper.readValue(content, clazz);
    }
}
