package com.wangbin.hvac.core.report;

import com.wangbin.hvac.core.report.model.SinkRecord;

import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

/**
 * InfluxDB 行协议编码
 */
public final class LineProtocolFormatter {

    private LineProtocolFormatter() {
    }

    public static String format(List<SinkRecord> records) {
        StringJoiner lines = new StringJoiner("\n");
        for (SinkRecord record : records) {
            String line = format(record);
            if (line != null) {
                lines.add(line);
            }
        }
        return lines.toString();
    }

    /**
     * 编码一条记录，无有效字段时返回 null
     */
    public static String format(SinkRecord record) {
        StringJoiner fields = new StringJoiner(",");
        for (Map.Entry<String, Object> entry : record.getFields().entrySet()) {
            String value = formatValue(entry.getValue());
            if (value != null) {
                fields.add(escapeKey(entry.getKey()) + "=" + value);
            }
        }
        if (fields.length() == 0) {
            return null;
        }

        StringBuilder line = new StringBuilder(escapeMeasurement(record.getMeasurement()));
        for (Map.Entry<String, String> tag : record.getTags().entrySet()) {
            if (tag.getValue() == null || tag.getValue().isEmpty()) {
                continue;
            }
            line.append(',').append(escapeKey(tag.getKey())).append('=').append(escapeKey(tag.getValue()));
        }
        line.append(' ').append(fields);
        line.append(' ').append(TimeUnit.MILLISECONDS.toNanos(record.getTimestamp()));
        return line.toString();
    }

    static String formatValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean flag) {
            return flag ? "t" : "f";
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return value + "i";
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return Double.toString(d);
        }
        return "\"" + value.toString().replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    static String escapeKey(String value) {
        return value.replace(",", "\\,").replace("=", "\\=").replace(" ", "\\ ");
    }

    static String escapeMeasurement(String value) {
        return value.replace(",", "\\,").replace(" ", "\\ ");
    }
}
