package com.svcdebug.analyzer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 从各来源原始记录抽象后的“统一事件”，后续关联和异常检测都基于它。
 *
 * 约定：
 * - source / message 一定存在（message 可以是空串）
 * - timestamp / serviceId / level / component 都可能为 null，
 *   所有消费方必须显式处理 null，不能补默认值（否则会制造假关联）
 */
@Value
@Builder(toBuilder = true)
public class UnifiedEvent {

    /** 来源：log / trace / capture / other */
    @NonNull
    EventSource source;

    /** 原始时间戳文本（原样保留，便于排查） */
    String timestampRaw;

    /** 归一化后的时间；无法解析时为 null */
    LocalDateTime timestamp;

    /** 逻辑服务 ID，例如 0x1234；null 表示“未归属” */
    String serviceId;

    /** 日志级别：INFO / WARN / ERROR / FATAL / VERBOSE ... 各来源词汇不同 */
    String level;

    /** 子系统：日志组件 / trace 的 app 或 context / 抓包协议名 */
    String component;

    /** 完整消息文本 */
    @NonNull
    @Builder.Default
    String message = "";

    /** 来源特有的附加字段：method_id / source_ip / dest_ip ... */
    @NonNull
    @Builder.Default
    Map<String, String> extra = Map.of();

    public boolean hasTimestamp() {
        return timestamp != null;
    }

    public boolean hasServiceId() {
        return serviceId != null;
    }
}
