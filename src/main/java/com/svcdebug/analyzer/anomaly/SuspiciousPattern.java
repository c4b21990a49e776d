package com.svcdebug.analyzer.anomaly;

import java.util.regex.Pattern;

/**
 * 可疑关键字表：(正则, 类别)。匹配对象是小写后的消息正文。
 * 新增类别只需要在这里加一行。
 */
public enum SuspiciousPattern {
    ERROR_PATTERN("error_pattern", "failed|failure|error|exception"),
    TIMEOUT_PATTERN("timeout_pattern", "timeout|timed out"),
    CONNECTION_ISSUE("connection_issue", "connection.*lost|disconnected"),
    MEMORY_ISSUE("memory_issue", "memory|out of memory|oom"),
    CRASH_PATTERN("crash_pattern", "crash|crashed|segfault");

    private final String category;
    private final Pattern pattern;

    SuspiciousPattern(String category, String regex) {
        this.category = category;
        this.pattern = Pattern.compile(regex);
    }

    public String category() {
        return category;
    }

    public boolean matches(String lowercaseMessage) {
        return lowercaseMessage != null && pattern.matcher(lowercaseMessage).find();
    }
}
