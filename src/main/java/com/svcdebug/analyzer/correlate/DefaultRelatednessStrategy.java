package com.svcdebug.analyzer.correlate;

import com.svcdebug.analyzer.model.UnifiedEvent;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 默认的相关性判断，满足任意一条即相关：
 * 1. serviceId 相同（双方都非 null）
 * 2. component 相同（双方都非 null）
 * 3. 小写消息按单词切分后，至少有 2 个共同单词
 */
@Component
public class DefaultRelatednessStrategy implements RelatednessStrategy {

    static final int MIN_SHARED_TOKENS = 2;

    private static final Pattern WORD_PATTERN = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public boolean related(UnifiedEvent anchor, UnifiedEvent candidate) {
        if (anchor == null || candidate == null) {
            return false;
        }
        if (sameNonNull(anchor.getServiceId(), candidate.getServiceId())) {
            return true;
        }
        if (sameNonNull(anchor.getComponent(), candidate.getComponent())) {
            return true;
        }
        return sharedTokens(anchor.getMessage(), candidate.getMessage()) >= MIN_SHARED_TOKENS;
    }

    static Set<String> tokenize(String message) {
        Set<String> tokens = new HashSet<>();
        if (message == null || message.isEmpty()) {
            return tokens;
        }
        Matcher m = WORD_PATTERN.matcher(message.toLowerCase(Locale.ROOT));
        while (m.find()) {
            tokens.add(m.group());
        }
        return tokens;
    }

    private static int sharedTokens(String a, String b) {
        Set<String> left = tokenize(a);
        if (left.isEmpty()) {
            return 0;
        }
        Set<String> right = tokenize(b);
        int shared = 0;
        for (String t : right) {
            if (left.contains(t) && ++shared >= MIN_SHARED_TOKENS) {
                break;
            }
        }
        return shared;
    }

    private static boolean sameNonNull(String a, String b) {
        return a != null && b != null && Objects.equals(a, b);
    }
}
