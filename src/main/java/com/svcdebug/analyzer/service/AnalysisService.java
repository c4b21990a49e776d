package com.svcdebug.analyzer.service;

import com.svcdebug.analyzer.anomaly.AnomalyEngine;
import com.svcdebug.analyzer.correlate.EventCorrelator;
import com.svcdebug.analyzer.model.*;
import com.svcdebug.analyzer.normalize.EventNormalizer;
import com.svcdebug.analyzer.report.AnomalyDigestRenderer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * 一次完整分析：
 * 1. 四个来源的原始记录 → UnifiedEvent
 * 2. （可选）只保留目标服务的事件
 * 3. 关联引擎 和 异常引擎 作为两个独立任务并行执行
 * 4. 组装 AnalysisResult + 文本摘要
 *
 * 两个引擎都是纯计算，没有共享可变状态，这里不需要任何锁。
 */
@Service
@Slf4j
public class AnalysisService {

    private final EventNormalizer normalizer;
    private final EventCorrelator correlator;
    private final AnomalyEngine anomalyEngine;
    private final AnomalyDigestRenderer digestRenderer;
    private final Executor executor;

    public AnalysisService(EventNormalizer normalizer,
                           EventCorrelator correlator,
                           AnomalyEngine anomalyEngine,
                           AnomalyDigestRenderer digestRenderer,
                           @Qualifier("analysisExecutor") Executor executor) {
        this.normalizer = normalizer;
        this.correlator = correlator;
        this.anomalyEngine = anomalyEngine;
        this.digestRenderer = digestRenderer;
        this.executor = executor;
    }

    public AnalysisResult analyze(AnalyzeRequest request) {
        Duration window = correlator.getDefaultWindow();
        if (request.getTimeWindowMs() != null) {
            if (request.getTimeWindowMs() < 0) {
                throw new IllegalArgumentException("timeWindowMs must be >= 0, got " + request.getTimeWindowMs());
            }
            window = Duration.ofMillis(request.getTimeWindowMs());
        }

        Map<EventSource, List<Map<String, Object>>> records = new EnumMap<>(EventSource.class);
        for (EventSource source : EventSource.values()) {
            records.put(source, request.recordsOf(source));
        }
        return analyze(records, window, request.getServiceId());
    }

    /**
     * @param records   每个来源的原始记录，缺失的来源按空处理
     * @param window    关联时间窗
     * @param serviceId 目标服务，null / 空白表示不过滤
     */
    public AnalysisResult analyze(Map<EventSource, List<Map<String, Object>>> records,
                                  Duration window,
                                  String serviceId) {
        String target = serviceId == null || serviceId.isBlank() ? null : serviceId.trim();

        Map<EventSource, List<UnifiedEvent>> bySource = new EnumMap<>(EventSource.class);
        List<UnifiedEvent> merged = new ArrayList<>();
        for (EventSource source : EventSource.values()) {
            List<UnifiedEvent> events = normalizer.normalize(source, records.getOrDefault(source, List.of()));
            if (target != null) {
                events = events.stream()
                        .filter(e -> e.hasServiceId() && e.getServiceId().equalsIgnoreCase(target))
                        .toList();
            }
            bySource.put(source, List.copyOf(events));
            merged.addAll(events);
        }
        List<UnifiedEvent> snapshot = List.copyOf(merged);

        log.info("Analyzing {} events (log={}, trace={}, capture={}, other={}), service={}, window={}ms",
                snapshot.size(),
                bySource.get(EventSource.LOG).size(),
                bySource.get(EventSource.TRACE).size(),
                bySource.get(EventSource.CAPTURE).size(),
                bySource.get(EventSource.OTHER).size(),
                target == null ? "*" : target,
                window.toMillis());

        CompletableFuture<CorrelationResult> correlation =
                submit(() -> correlator.correlate(snapshot, window), "correlation");
        CompletableFuture<AnomalyReport> anomalies;
        try {
            anomalies = submit(() -> anomalyEngine.detect(bySource), "anomaly detection");
        } catch (AnalysisException e) {
            // 第二个任务没提交成功，第一个的结果没人读了
            correlation.cancel(false);
            throw e;
        }

        CorrelationResult correlationResult = await(correlation, "correlation");
        AnomalyReport anomalyReport = await(anomalies, "anomaly detection");

        log.info("Analysis done: {} correlation groups, {} anomalies",
                correlationResult.getGroups().size(), anomalyReport.getAnomalies().size());

        return AnalysisResult.builder()
                .serviceId(target)
                .timeWindowMs(window.toMillis())
                .totalEvents(snapshot.size())
                .correlation(correlationResult)
                .anomalies(anomalyReport)
                .anomalyDigest(digestRenderer.render(anomalyReport.getAnomalies()))
                .build();
    }

    /**
     * 线程池满时拒绝提交，按分析失败处理。
     */
    private <T> CompletableFuture<T> submit(Supplier<T> task, String name) {
        try {
            return CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            log.warn("Analysis task rejected: {}", name);
            throw new AnalysisException("Analysis task rejected: " + name, e);
        }
    }

    private static <T> T await(CompletableFuture<T> future, String task) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof IllegalArgumentException iae) {
                throw iae;
            }
            throw new AnalysisException("Analysis task failed: " + task, cause);
        }
    }
}
