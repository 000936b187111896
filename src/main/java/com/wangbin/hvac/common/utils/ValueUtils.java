package com.wangbin.hvac.common.utils;

/**
 * 遥测值转换工具，非法值统一视为缺失
 */
public final class ValueUtils {

    private ValueUtils() {
    }

    /**
     * 转为有限的double，无法转换或为NaN/Infinity时返回null
     */
    public static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        double result;
        if (value instanceof Number number) {
            result = number.doubleValue();
        } else if (value instanceof Boolean bool) {
            result = bool ? 1.0 : 0.0;
        } else {
            String text = value.toString().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                result = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return Double.isFinite(result) ? result : null;
    }

    /**
     * 转为布尔值，支持 true/false、on/off、1/0、yes/no
     */
    public static Boolean toBoolean(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        String text = value.toString().trim().toLowerCase();
        return switch (text) {
            case "true", "on", "1", "yes", "enabled", "running" -> Boolean.TRUE;
            case "false", "off", "0", "no", "disabled", "stopped" -> Boolean.FALSE;
            default -> null;
        };
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * 百分比限幅到 [0,100]
     */
    public static double clampPercent(double value) {
        return clamp(value, 0, 100);
    }

    /**
     * 保留一位小数
     */
    public static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
