package com.svcdebug.analyzer.normalize;

import com.svcdebug.analyzer.model.EventSource;
import com.svcdebug.analyzer.model.UnifiedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把各来源解码器产出的字段 map 转成 UnifiedEvent 列表。
 *
 * 字段约定（与各解码器一致）：
 * - timestamp / raw_timestamp      : 时间戳
 * - service_id                     : 服务 ID
 * - level / log_level              : 日志级别
 * - component / app_id / context_id / protocol : 子系统，按来源取
 * - full_message / message         : 消息正文
 * 其余非空白字段原样（转字符串）放进 extra；被映射的字段不重复放。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventNormalizer {

    static final String TIMESTAMP = "timestamp";
    static final String RAW_TIMESTAMP = "raw_timestamp";
    static final String SERVICE_ID = "service_id";
    static final String LEVEL = "level";
    static final String LOG_LEVEL = "log_level";
    static final String COMPONENT = "component";
    static final String APP_ID = "app_id";
    static final String CONTEXT_ID = "context_id";
    static final String PROTOCOL = "protocol";
    static final String FULL_MESSAGE = "full_message";
    static final String MESSAGE = "message";

    private final TimestampNormalizer timestampNormalizer;

    public List<UnifiedEvent> normalize(EventSource source, List<Map<String, Object>> records) {
        List<UnifiedEvent> result = new ArrayList<>();
        if (records == null || records.isEmpty()) {
            return result;
        }

        int unparsable = 0;
        for (Map<String, Object> record : records) {
            if (record == null) {
                log.debug("Drop null {} record", source);
                continue;
            }
            UnifiedEvent evt = mapToUnified(source, record);
            if (!evt.hasTimestamp()) {
                unparsable++;
            }
            result.add(evt);
        }

        if (unparsable > 0) {
            log.debug("{} of {} {} records have no usable timestamp", unparsable, result.size(), source);
        }
        return result;
    }

    UnifiedEvent mapToUnified(EventSource source, Map<String, Object> record) {
        // 记录实际取值的字段，其余字段才进 extra，保证每个字段要么被映射要么被保留
        Set<String> consumed = new HashSet<>();

        Object rawTs = take(record, consumed, TIMESTAMP, RAW_TIMESTAMP);
        LocalDateTime ts = timestampNormalizer.normalize(rawTs).orElse(null);

        Object message = take(record, consumed, FULL_MESSAGE, MESSAGE);

        return UnifiedEvent.builder()
                .source(source)
                .timestampRaw(rawTs == null ? null : rawTs.toString())
                .timestamp(ts)
                .serviceId(text(take(record, consumed, SERVICE_ID)))
                .level(text(take(record, consumed, LEVEL, LOG_LEVEL)))
                .component(text(take(record, consumed, componentFields(source))))
                .message(message == null ? "" : message.toString())
                .extra(extraFields(record, consumed))
                .build();
    }

    /** component 按来源取不同字段，按优先级排列 */
    private static String[] componentFields(EventSource source) {
        return switch (source) {
            case TRACE -> new String[]{APP_ID, CONTEXT_ID};
            case CAPTURE -> new String[]{PROTOCOL};
            default -> new String[]{COMPONENT};
        };
    }

    private static Map<String, String> extraFields(Map<String, Object> record, Set<String> consumed) {
        Map<String, String> extra = new LinkedHashMap<>();
        record.forEach((k, v) -> {
            if (k == null || consumed.contains(k) || isBlank(v)) {
                return;
            }
            extra.put(k, v.toString());
        });
        return Collections.unmodifiableMap(extra);
    }

    /**
     * 取第一个非空白字段的值，并把字段名记进 consumed。
     */
    private static Object take(Map<String, Object> record, Set<String> consumed, String... keys) {
        for (String k : keys) {
            Object v = record.get(k);
            if (!isBlank(v)) {
                consumed.add(k);
                return v;
            }
        }
        return null;
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }

    /** 空白串按缺失处理 */
    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }
}
