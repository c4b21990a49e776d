package com.svcdebug.analyzer.anomaly;

import com.svcdebug.analyzer.config.AnalyzerProperties.BucketMode;
import com.svcdebug.analyzer.model.UnifiedEvent;
import com.svcdebug.analyzer.normalize.TimestampNormalizer;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Set;

/**
 * 检测器共用的小工具：分钟桶、错误级别判断、保留两位小数。
 */
final class DetectorSupport {

    static final String UNKNOWN_BUCKET = "unknown";

    private static final DateTimeFormatter MINUTE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private static final int DISPLAY_PREFIX_LENGTH = 5;

    private static final Set<String> ERROR_LEVELS = Set.of("ERROR", "FATAL");

    private DetectorSupport() {
    }

    /**
     * 1 分钟桶的 key；没有时间戳的事件统一落到 unknown 桶。
     */
    static String minuteKey(UnifiedEvent event, BucketMode mode) {
        if (!event.hasTimestamp()) {
            return UNKNOWN_BUCKET;
        }
        if (mode == BucketMode.DISPLAY_PREFIX) {
            String display = TimestampNormalizer.format(event.getTimestamp());
            return display.length() >= DISPLAY_PREFIX_LENGTH
                    ? display.substring(0, DISPLAY_PREFIX_LENGTH)
                    : UNKNOWN_BUCKET;
        }
        return MINUTE_FORMAT.format(event.getTimestamp().truncatedTo(ChronoUnit.MINUTES));
    }

    /** level 缺失时按非错误处理 */
    static boolean isErrorLevel(String level) {
        return level != null && ERROR_LEVELS.contains(level.toUpperCase(Locale.ROOT));
    }

    static double round2(double v) {
        return BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
