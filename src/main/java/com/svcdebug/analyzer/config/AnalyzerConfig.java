package com.svcdebug.analyzer.config;

import com.svcdebug.analyzer.normalize.TimestampNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.ZoneId;

@Slf4j
@Configuration
@EnableConfigurationProperties(AnalyzerProperties.class)
public class AnalyzerConfig {

    @Bean
    public TimestampNormalizer timestampNormalizer(AnalyzerProperties properties) {
        ZoneId zone = ZoneId.of(properties.getTimestamp().getZone());
        log.info("Timestamp normalizer zone: {}", zone);
        return new TimestampNormalizer(zone);
    }

    /**
     * 关联引擎和异常引擎各占一个任务，互不共享可变状态。
     */
    @Bean(name = "analysisExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor analysisExecutor(AnalyzerProperties properties) {
        AnalyzerProperties.Executor cfg = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(cfg.getCorePoolSize(), cfg.getMaxPoolSize()));
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setThreadNamePrefix("analysis-");
        executor.initialize();
        return executor;
    }
}
