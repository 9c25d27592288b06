package com.watchflixx.gateway.core.metrics;

/**
 * 分位数计算
 *
 * <p>升序数组长度为 n 时，pN 取下标 {@code ceil(N/100 * n) - 1}，并限制在 [0, n-1]。
 */
public final class Percentiles {

    private Percentiles() {
    }

    /**
     * @param sortedAscending 已升序排列的耗时
     * @param percentile      0-100
     * @return 空数组返回 0
     */
    public static long percentile(long[] sortedAscending, double percentile) {
        int n = sortedAscending.length;
        if (n == 0) {
            return 0L;
        }
        int index = (int) Math.ceil(percentile / 100.0d * n) - 1;
        index = Math.max(0, Math.min(n - 1, index));
        return sortedAscending[index];
    }

    /**
     * 四舍五入后的平均值，空数组返回 0
     */
    public static long average(long[] values) {
        if (values.length == 0) {
            return 0L;
        }
        long sum = 0;
        for (long value : values) {
            sum += value;
        }
        return Math.round((double) sum / values.length);
    }
}
