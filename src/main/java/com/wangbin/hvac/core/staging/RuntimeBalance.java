package com.wangbin.hvac.core.staging;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 运行时间均衡分析：理想占比 100/n，取各机组占比与理想值的最大偏差
 */
@Value
public class RuntimeBalance {

    BalanceQuality quality;
    double idealShare;
    double maxDeviation;
    long totalRuntime;
    Map<String, Double> shares;

    public static <K> RuntimeBalance analyze(Map<K, Long> runtimes) {
        if (runtimes == null || runtimes.isEmpty()) {
            return new RuntimeBalance(BalanceQuality.UNKNOWN, 0, 0, 0, Collections.emptyMap());
        }
        long total = runtimes.values().stream().mapToLong(value -> value == null ? 0 : value).sum();
        double ideal = 100.0 / runtimes.size();
        if (total <= 0) {
            return new RuntimeBalance(BalanceQuality.UNKNOWN, ideal, 0, 0, Collections.emptyMap());
        }
        Map<String, Double> shares = new LinkedHashMap<>();
        double maxDeviation = 0;
        for (Map.Entry<K, Long> entry : runtimes.entrySet()) {
            long runtime = entry.getValue() == null ? 0 : entry.getValue();
            double share = runtime * 100.0 / total;
            shares.put(String.valueOf(entry.getKey()), Math.round(share * 10.0) / 10.0);
            maxDeviation = Math.max(maxDeviation, Math.abs(share - ideal));
        }
        return new RuntimeBalance(BalanceQuality.fromDeviation(maxDeviation), ideal, maxDeviation, total,
                Collections.unmodifiableMap(shares));
    }

    public static RuntimeBalance of(StagingState state) {
        return analyze(state.getRuntimeMillis());
    }
}
