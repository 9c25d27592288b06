package com.watchflixx.gateway.core.metrics;

import com.watchflixx.gateway.core.model.RequestMetric;
import com.watchflixx.gateway.dto.AggregatedMetricsDto;
import com.watchflixx.gateway.dto.ErrorDistributionDto;
import com.watchflixx.gateway.dto.HealthScoreDto;
import com.watchflixx.gateway.dto.ResponseTimeDto;
import com.watchflixx.gateway.dto.ServiceBreakdownDto;
import com.watchflixx.gateway.dto.ServiceMetricsDto;
import com.watchflixx.gateway.dto.SlowEndpointDto;
import com.watchflixx.gateway.dto.TrafficBucketDto;
import com.watchflixx.gateway.dto.UserActivityDto;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 请求指标聚合器
 *
 * <p>维护一个同时受容量和时间约束的请求历史，并按需计算：
 * <ul>
 *   <li><b>窗口聚合</b>：请求数、错误数、平均/中位/p95/p99 耗时、状态码分类、按服务拆分</li>
 *   <li><b>慢接口排行</b>：按 METHOD + 归一化路径分组，平均耗时降序</li>
 *   <li><b>错误分布</b>：按状态码、路径和服务统计</li>
 *   <li><b>流量模式</b>：最近一小时 12 个 5 分钟桶</li>
 *   <li><b>综合健康评分</b>：见 {@link HealthScoreCalculator}</li>
 * </ul>
 *
 * <p>写入是无锁追加，超过容量时从队首淘汰；过期清理由后台线程定期执行，不阻塞请求路径。
 * 历史按完成顺序追加，队首即最旧记录。
 */
@Slf4j
public class MetricsAggregator {

    private static final Duration TRAFFIC_BUCKET = Duration.ofMinutes(5);
    private static final int TRAFFIC_BUCKETS = 12;
    private static final int TOP_N = 10;
    private static final String UNROUTED = "gateway";

    private final ConcurrentLinkedDeque<RequestMetric> history = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger(0);
    /** 进程生命周期内的累计值，供 Prometheus 计数器使用 */
    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong totalErrors = new AtomicLong(0);

    private final MetricsSettings settings;
    private final Clock clock;
    private ScheduledExecutorService scheduler;

    public MetricsAggregator(MetricsSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public void start() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "metrics-compactor");
            t.setDaemon(true);
            return t;
        });
        long interval = settings.getCompactionInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::safeCompact, interval, interval, TimeUnit.MILLISECONDS);
        log.info("MetricsAggregator started, maxHistory={}, retention={}", settings.getMaxHistory(), settings.getRetention());
    }

    public void stop() {
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private void safeCompact() {
        try {
            int removed = compact();
            if (removed > 0) {
                log.debug("Compacted {} expired request metrics, {} retained", removed, size.get());
            }
        } catch (RuntimeException e) {
            log.error("Metrics compaction failed", e);
        }
    }

    // ---------------------------------------------------------------- 写入

    public void record(RequestMetric metric) {
        history.addLast(metric);
        totalRequests.incrementAndGet();
        if (metric.isError()) {
            totalErrors.incrementAndGet();
        }
        if (size.incrementAndGet() > settings.getMaxHistory()) {
            trimToCapacity();
        }
    }

    /**
     * 删除超过保留时长的记录，并把总数压到容量以内
     *
     * <p>记录以请求开始时间为时间戳、在请求结束时写入，队列不保证按时间有序，因此需要完整扫描。
     *
     * @return 删除的记录数
     */
    public int compact() {
        long cutoff = clock.millis() - settings.getRetention().toMillis();
        int removed = 0;
        for (RequestMetric metric : history) {
            if (metric.getTimestamp() < cutoff && history.removeFirstOccurrence(metric)) {
                size.decrementAndGet();
                removed++;
            }
        }
        return removed + trimToCapacity();
    }

    private int trimToCapacity() {
        int removed = 0;
        while (size.get() > settings.getMaxHistory()) {
            if (history.pollFirst() == null) {
                break;
            }
            size.decrementAndGet();
            removed++;
        }
        return removed;
    }

    public void reset() {
        history.clear();
        size.set(0);
        totalRequests.set(0);
        totalErrors.set(0);
        log.info("Request metrics history cleared");
    }

    public int size() {
        return size.get();
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getTotalErrors() {
        return totalErrors.get();
    }

    public List<RequestMetric> snapshot() {
        return new ArrayList<>(history);
    }

    private List<RequestMetric> within(Duration window) {
        long since = clock.millis() - window.toMillis();
        List<RequestMetric> result = new ArrayList<>();
        for (RequestMetric metric : history) {
            if (metric.getTimestamp() >= since) {
                result.add(metric);
            }
        }
        return result;
    }

    // ---------------------------------------------------------------- 查询

    public AggregatedMetricsDto getAggregatedMetrics() {
        return getAggregatedMetrics(settings.getWindow());
    }

    public AggregatedMetricsDto getAggregatedMetrics(Duration window) {
        List<RequestMetric> metrics = within(window);
        long errors = 0;
        Map<String, Long> statusClasses = new TreeMap<>();
        Map<String, List<RequestMetric>> byService = new LinkedHashMap<>();
        for (RequestMetric metric : metrics) {
            if (metric.isError()) {
                errors++;
            }
            statusClasses.merge((metric.getStatusCode() / 100) + "xx", 1L, Long::sum);
            if (metric.getServiceName() != null) {
                byService.computeIfAbsent(metric.getServiceName(), k -> new ArrayList<>()).add(metric);
            }
        }
        Map<String, ServiceBreakdownDto> services = new LinkedHashMap<>();
        byService.forEach((service, list) -> {
            long serviceErrors = list.stream().filter(RequestMetric::isError).count();
            services.put(service, new ServiceBreakdownDto((long) list.size(), serviceErrors,
                    Percentiles.average(responseTimes(list))));
        });

        AggregatedMetricsDto dto = new AggregatedMetricsDto();
        dto.setWindowMs(window.toMillis());
        dto.setRequestCount((long) metrics.size());
        dto.setErrorCount(errors);
        dto.setErrorRate(metrics.isEmpty() ? 0.0d : errors * 100.0d / metrics.size());
        dto.setResponseTime(responseTimeOf(metrics));
        dto.setStatusCodes(statusClasses);
        dto.setServices(services);
        return dto;
    }

    /**
     * 单个服务在全部保留历史上的指标
     *
     * @return 没有该服务的记录时返回空
     */
    public Optional<ServiceMetricsDto> getServiceMetrics(String serviceName) {
        List<RequestMetric> metrics = new ArrayList<>();
        for (RequestMetric metric : history) {
            if (serviceName.equals(metric.getServiceName())) {
                metrics.add(metric);
            }
        }
        if (metrics.isEmpty()) {
            return Optional.empty();
        }
        long errors = 0;
        long available = 0;
        long lastRequest = 0;
        Map<String, Long> statusCodes = new TreeMap<>();
        for (RequestMetric metric : metrics) {
            if (metric.isError()) {
                errors++;
            }
            if (!metric.isServerError()) {
                available++;
            }
            lastRequest = Math.max(lastRequest, metric.getTimestamp());
            statusCodes.merge(String.valueOf(metric.getStatusCode()), 1L, Long::sum);
        }
        ServiceMetricsDto dto = new ServiceMetricsDto();
        dto.setServiceName(serviceName);
        dto.setRequestCount((long) metrics.size());
        dto.setErrorCount(errors);
        dto.setResponseTime(responseTimeOf(metrics));
        dto.setStatusCodes(statusCodes);
        dto.setLastRequestTime(Instant.ofEpochMilli(lastRequest).toString());
        dto.setUptime(available * 100.0d / metrics.size());
        return Optional.of(dto);
    }

    public List<SlowEndpointDto> getSlowEndpoints(int limit) {
        Map<String, List<RequestMetric>> grouped = new HashMap<>();
        for (RequestMetric metric : within(settings.getWindow())) {
            grouped.computeIfAbsent(metric.getMethod() + " " + metric.getPath(), k -> new ArrayList<>()).add(metric);
        }
        List<SlowEndpointDto> ranking = new ArrayList<>();
        grouped.forEach((endpoint, list) ->
                ranking.add(new SlowEndpointDto(endpoint, Percentiles.average(responseTimes(list)), (long) list.size())));
        ranking.sort(Comparator.comparing(SlowEndpointDto::getAverageResponseTime).reversed()
                .thenComparing(SlowEndpointDto::getEndpoint));
        return ranking.size() > limit ? new ArrayList<>(ranking.subList(0, Math.max(0, limit))) : ranking;
    }

    public ErrorDistributionDto getErrorDistribution() {
        long total = 0;
        Map<String, Long> byStatus = new TreeMap<>();
        Map<String, Long> byPath = new HashMap<>();
        Map<String, Long> byService = new TreeMap<>();
        for (RequestMetric metric : within(settings.getWindow())) {
            if (!metric.isError()) {
                continue;
            }
            total++;
            byStatus.merge(String.valueOf(metric.getStatusCode()), 1L, Long::sum);
            byPath.merge(metric.getMethod() + " " + metric.getPath(), 1L, Long::sum);
            byService.merge(metric.getServiceName() == null ? UNROUTED : metric.getServiceName(), 1L, Long::sum);
        }
        ErrorDistributionDto dto = new ErrorDistributionDto();
        dto.setTotal(total);
        dto.setByStatus(byStatus);
        dto.setByPath(topN(byPath));
        dto.setByService(byService);
        return dto;
    }

    /**
     * 以当前时间为终点的 12 个连续 5 分钟桶，最旧的在前
     */
    public List<TrafficBucketDto> getTrafficPatterns() {
        long now = clock.millis();
        long bucketMs = TRAFFIC_BUCKET.toMillis();
        long start = now - bucketMs * TRAFFIC_BUCKETS;
        long[] requests = new long[TRAFFIC_BUCKETS];
        long[] errors = new long[TRAFFIC_BUCKETS];
        long[] latency = new long[TRAFFIC_BUCKETS];
        for (RequestMetric metric : history) {
            long offset = metric.getTimestamp() - start;
            if (offset < 0 || metric.getTimestamp() > now) {
                continue;
            }
            int index = (int) Math.min(TRAFFIC_BUCKETS - 1, offset / bucketMs);
            requests[index]++;
            latency[index] += metric.getResponseTimeMs();
            if (metric.isError()) {
                errors[index]++;
            }
        }
        List<TrafficBucketDto> buckets = new ArrayList<>(TRAFFIC_BUCKETS);
        for (int i = 0; i < TRAFFIC_BUCKETS; i++) {
            long average = requests[i] == 0 ? 0L : Math.round((double) latency[i] / requests[i]);
            buckets.add(new TrafficBucketDto(Instant.ofEpochMilli(start + i * bucketMs).toString(),
                    requests[i], errors[i], average));
        }
        return buckets;
    }

    public UserActivityDto getUserActivity() {
        Map<String, Long> perUser = new HashMap<>();
        long total = 0;
        for (RequestMetric metric : within(settings.getWindow())) {
            if (metric.getUserId() != null) {
                perUser.merge(metric.getUserId(), 1L, Long::sum);
                total++;
            }
        }
        List<UserActivityDto.UserRequestCount> top = new ArrayList<>();
        topN(perUser).forEach((user, count) -> top.add(new UserActivityDto.UserRequestCount(user, count)));
        UserActivityDto dto = new UserActivityDto();
        dto.setActiveUsers(perUser.size());
        dto.setTotalRequests(total);
        dto.setTopUsers(top);
        return dto;
    }

    public HealthScoreDto getHealthScore() {
        List<RequestMetric> metrics = within(settings.getWindow());
        long errors = 0;
        long available = 0;
        for (RequestMetric metric : metrics) {
            if (metric.isError()) {
                errors++;
            }
            if (!metric.isServerError()) {
                available++;
            }
        }
        long[] sorted = responseTimes(metrics);
        Arrays.sort(sorted);
        double errorRate = metrics.isEmpty() ? 0.0d : errors * 100.0d / metrics.size();
        double availability = metrics.isEmpty() ? 100.0d : available * 100.0d / metrics.size();
        return HealthScoreCalculator.calculate(errorRate, Percentiles.percentile(sorted, 95), metrics.size(), availability);
    }

    // ---------------------------------------------------------------- 工具

    private static ResponseTimeDto responseTimeOf(List<RequestMetric> metrics) {
        long[] sorted = responseTimes(metrics);
        Arrays.sort(sorted);
        return new ResponseTimeDto(
                Percentiles.average(sorted),
                Percentiles.percentile(sorted, 50),
                Percentiles.percentile(sorted, 95),
                Percentiles.percentile(sorted, 99));
    }

    private static long[] responseTimes(List<RequestMetric> metrics) {
        long[] values = new long[metrics.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = metrics.get(i).getResponseTimeMs();
        }
        return values;
    }

    private static Map<String, Long> topN(Map<String, Long> counts) {
        List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry::getKey));
        Map<String, Long> top = new LinkedHashMap<>();
        for (int i = 0; i < Math.min(TOP_N, entries.size()); i++) {
            top.put(entries.get(i).getKey(), entries.get(i).getValue());
        }
        return top;
    }

    public MetricsSettings getSettings() {
        return settings;
    }
}
