package com.svcdebug.analyzer.anomaly;

import com.svcdebug.analyzer.model.Anomaly;
import com.svcdebug.analyzer.model.AnomalyKind;
import com.svcdebug.analyzer.model.EventSource;
import com.svcdebug.analyzer.model.UnifiedEvent;

import java.util.List;

/**
 * 单个异常检测器。
 * 每次只看一个来源的事件，彼此之间不依赖对方的输出，也不保存状态。
 */
public interface AnomalyDetector {

    AnomalyKind kind();

    /**
     * @param source 事件所属来源
     * @param events 该来源的全部事件（可能含没有时间戳 / serviceId 的事件），非空
     */
    List<Anomaly> detect(EventSource source, List<UnifiedEvent> events);
}
