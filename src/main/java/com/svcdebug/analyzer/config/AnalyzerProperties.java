package com.svcdebug.analyzer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 分析器配置，前缀 analyzer。
 * 默认值与 application.yml 保持一致，单元测试里直接 new 出来就能用。
 */
@Data
@Validated
@ConfigurationProperties(prefix = "analyzer")
public class AnalyzerProperties {

    @Valid
    private final Timestamp timestamp = new Timestamp();
    @Valid
    private final Correlation correlation = new Correlation();
    @Valid
    private final Anomaly anomaly = new Anomaly();
    @Valid
    private final Executor executor = new Executor();

    @Data
    public static class Timestamp {
        /** 把微秒级 epoch 转成本地时间时使用的时区 */
        @NotBlank
        private String zone = "UTC";
    }

    @Data
    public static class Correlation {
        /** 两个事件被视为可能相关的最大时间差 */
        @NotNull
        private Duration timeWindow = Duration.ofMillis(1000);

        /** anchor：以锚点为中心，组之间可重叠；transitive：并查集，组之间不相交 */
        @NotNull
        private ClusteringMode clustering = ClusteringMode.ANCHOR;
    }

    @Data
    public static class Anomaly {
        @NotNull
        private BucketMode bucketMode = BucketMode.TRUNCATE;

        /** error_spike：错误占比超过该值触发 */
        @Positive
        private double errorRateThreshold = 0.1;
        /** error_spike：超过该值为 high */
        @Positive
        private double highErrorRateThreshold = 0.3;

        /** frequency_spike：最忙的分钟 > 平均值 * multiplier */
        @Positive
        private double frequencySpikeMultiplier = 3.0;
        /** frequency_spike：同时还要 > 这个绝对条数 */
        @PositiveOrZero
        private int frequencySpikeMinCount = 20;

        /** source_silence：少于这个条数视为“沉默” */
        @Positive
        private int silenceMaxMessages = 3;

        /** duplicate_message：出现次数 > 该值触发 */
        @PositiveOrZero
        private int duplicateThreshold = 10;
        /** duplicate_message：达到该值升为 medium */
        @Positive
        private int duplicateMediumCount = 20;

        /** suspicious_pattern：某类模式出现次数 > 该值触发 */
        @PositiveOrZero
        private int patternThreshold = 5;
        /** suspicious_pattern：超过该值为 medium */
        @Positive
        private int patternMediumCount = 10;
    }

    @Data
    public static class Executor {
        @Positive
        private int corePoolSize = 2;
        @Positive
        private int maxPoolSize = 8;
        @PositiveOrZero
        private int queueCapacity = 100;
    }

    public enum ClusteringMode {
        ANCHOR,
        TRANSITIVE
    }

    /**
     * 分钟桶的计算方式。
     */
    public enum BucketMode {
        /** 把时间截断到分钟，渲染成 yyyy-MM-dd HH:mm */
        TRUNCATE,
        /** 兼容旧报表：取展示格式（HH:mm:ss.SSS）的前 5 个字符 */
        DISPLAY_PREFIX
    }
}
