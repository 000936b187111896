package com.wangbin.hvac.common.utils;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONWriter;
import com.alibaba.fastjson2.TypeReference;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * JSON工具类
 */
@Slf4j
public class JsonUtil {

    private JsonUtil() {
        // 工具类，防止实例化
    }

    /**
     * 对象转JSON字符串
     */
    public static String toJsonString(Object object) {
        try {
            return JSON.toJSONString(object, JSONWriter.Feature.WriteMapNullValue);
        } catch (Exception e) {
            log.error("对象转JSON字符串失败", e);
            return null;
        }
    }

    /**
     * JSON字符串转对象
     */
    public static <T> T parseObject(String json, Class<T> clazz) {
        try {
            return JSON.parseObject(json, clazz);
        } catch (Exception e) {
            log.error("JSON字符串转对象失败: {}", json, e);
            return null;
        }
    }

    /**
     * JSON字符串转Map
     */
    public static Map<String, Object> parseMap(String json) {
        try {
            return JSON.parseObject(json, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            log.error("JSON字符串转Map失败: {}", json, e);
            return null;
        }
    }

    /**
     * 尝试把命令值解析为JSON标量（数字/布尔），失败时保留原字符串
     */
    public static Object parseScalar(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        try {
            Object value = JSON.parse(trimmed);
            return value instanceof Number || value instanceof Boolean ? value : trimmed;
        } catch (Exception e) {
            return trimmed;
        }
    }
}
