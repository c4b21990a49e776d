package com.svcdebug.analyzer.service;

/**
 * 分析任务本身失败（非输入问题）时抛出。
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
