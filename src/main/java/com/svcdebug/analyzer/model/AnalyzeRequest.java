package com.svcdebug.analyzer.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 一次分析的输入：四类来源的原始记录（已由各自解码器转成字段 map），
 * 外加可选的目标服务和时间窗。
 */
@Data
public class AnalyzeRequest {

    /** 只分析这个服务的事件；为空表示全部 */
    private String serviceId;

    /** 关联时间窗（毫秒）；为空时使用配置值 */
    private Long timeWindowMs;

    private List<Map<String, Object>> log = new ArrayList<>();
    private List<Map<String, Object>> trace = new ArrayList<>();
    private List<Map<String, Object>> capture = new ArrayList<>();
    private List<Map<String, Object>> other = new ArrayList<>();

    public List<Map<String, Object>> recordsOf(EventSource source) {
        List<Map<String, Object>> records = switch (source) {
            case LOG -> log;
            case TRACE -> trace;
            case CAPTURE -> capture;
            case OTHER -> other;
        };
        return records == null ? List.of() : records;
    }
}
