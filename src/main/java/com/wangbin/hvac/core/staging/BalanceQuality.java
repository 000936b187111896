package com.wangbin.hvac.core.staging;

/**
 * 运行时间均衡度
 */
public enum BalanceQuality {
    EXCELLENT("excellent"),
    GOOD("good"),
    FAIR("fair"),
    POOR("poor"),
    UNKNOWN("unknown");

    private final String code;

    BalanceQuality(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 按最大偏差（百分点）分级：>15 差，>10 一般，>5 良好，否则优秀
     */
    public static BalanceQuality fromDeviation(double maxDeviation) {
        if (maxDeviation > 15) {
            return POOR;
        }
        if (maxDeviation > 10) {
            return FAIR;
        }
        if (maxDeviation > 5) {
            return GOOD;
        }
        return EXCELLENT;
    }
}
