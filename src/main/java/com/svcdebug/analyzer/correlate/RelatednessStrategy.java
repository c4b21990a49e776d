package com.svcdebug.analyzer.correlate;

import com.svcdebug.analyzer.model.UnifiedEvent;

/**
 * 判断“两个时间窗内的事件是否相关”的策略。
 * 只做布尔判断，不打分；时间窗由调用方负责。
 */
public interface RelatednessStrategy {

    /**
     * 任何一个字段缺失（null）都只能算“不匹配”，不能当成相等。
     */
    boolean related(UnifiedEvent anchor, UnifiedEvent candidate);
}
