package com.watchflixx.gateway.core.metrics;

import com.watchflixx.gateway.dto.HealthScoreDto;

import java.util.ArrayList;
import java.util.List;

/**
 * 综合健康评分
 *
 * <p>四个因子先各自映射到 0-100 的影响值，再按权重加权求和并取整：
 * <ul>
 *   <li><b>错误率</b>（权重 30）：100 - 错误率% × 2，下限 0</li>
 *   <li><b>p95 延迟</b>（权重 25）：100 - min(p95 / 50, 100)，下限 0</li>
 *   <li><b>吞吐量</b>（权重 20）：min(100, 请求数 / 10)</li>
 *   <li><b>可用率</b>（权重 25）：状态码 &lt; 500 的请求占比%</li>
 * </ul>
 */
public final class HealthScoreCalculator {

    public static final int ERROR_RATE_WEIGHT = 30;
    public static final int LATENCY_WEIGHT = 25;
    public static final int THROUGHPUT_WEIGHT = 20;
    public static final int AVAILABILITY_WEIGHT = 25;

    private HealthScoreCalculator() {
    }

    /**
     * @param errorRatePercent    错误率（百分比）
     * @param p95Ms               p95 延迟（毫秒）
     * @param requestCount        窗口内请求数
     * @param availabilityPercent 可用率（百分比）
     */
    public static HealthScoreDto calculate(double errorRatePercent, long p95Ms, long requestCount, double availabilityPercent) {
        List<HealthScoreDto.Factor> factors = new ArrayList<>();
        factors.add(new HealthScoreDto.Factor("errorRate", errorRatePercent,
                Math.max(0.0d, 100.0d - errorRatePercent * 2), ERROR_RATE_WEIGHT));
        factors.add(new HealthScoreDto.Factor("responseTime", (double) p95Ms,
                Math.max(0.0d, 100.0d - Math.min(p95Ms / 50.0d, 100.0d)), LATENCY_WEIGHT));
        factors.add(new HealthScoreDto.Factor("throughput", (double) requestCount,
                Math.min(100.0d, requestCount / 10.0d), THROUGHPUT_WEIGHT));
        factors.add(new HealthScoreDto.Factor("availability", availabilityPercent,
                Math.max(0.0d, Math.min(100.0d, availabilityPercent)), AVAILABILITY_WEIGHT));

        double weighted = 0.0d;
        for (HealthScoreDto.Factor factor : factors) {
            weighted += factor.getImpact() * factor.getWeight() / 100.0d;
        }
        int score = (int) Math.round(weighted);

        HealthScoreDto dto = new HealthScoreDto();
        dto.setScore(score);
        dto.setStatus(statusOf(score));
        dto.setFactors(factors);
        return dto;
    }

    static String statusOf(int score) {
        if (score >= 80) {
            return "healthy";
        }
        if (score >= 60) {
            return "degraded";
        }
        return "unhealthy";
    }
}
