package com.example.floodlog.parser;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 解析 "stat1 val1, stat2: val2, ..." 形式的内容（标签已去掉）。
 * 只要有一个 key 不在允许列表里，整行都不要。
 */
public class StatPairParser {

    static final Pattern PAIR = Pattern.compile("(\\w+):?\\s+(\\d+)");

    private final Set<String> allowedKeys;

    public StatPairParser(Set<String> allowedKeys) {
        this.allowedKeys = allowedKeys;
    }

    public Result parse(String content) {
        Map<String, Long> pairs = new LinkedHashMap<>();
        Matcher m = PAIR.matcher(content);
        while (m.find()) {
            String key = m.group(1);
            if (!allowedKeys.contains(key)) {
                return Result.rejected(WarningKind.UNKNOWN_STAT_KEY, "No matching key: " + key);
            }
            try {
                pairs.put(key, Long.parseLong(m.group(2)));
            } catch (NumberFormatException e) {
                return Result.rejected(WarningKind.BAD_STAT_VALUE, key + " " + m.group(2));
            }
        }
        return Result.accepted(pairs);
    }

    @Getter
    public static final class Result {

        private final Map<String, Long> pairs;
        /** 被拒绝时的原因，接受时为 null */
        private final WarningKind rejection;
        private final String detail;

        private Result(Map<String, Long> pairs, WarningKind rejection, String detail) {
            this.pairs = pairs;
            this.rejection = rejection;
            this.detail = detail;
        }

        static Result accepted(Map<String, Long> pairs) {
            return new Result(Collections.unmodifiableMap(pairs), null, null);
        }

        static Result rejected(WarningKind kind, String detail) {
            return new Result(Collections.emptyMap(), kind, detail);
        }

        public boolean isAccepted() {
            return rejection == null;
        }
    }
}
