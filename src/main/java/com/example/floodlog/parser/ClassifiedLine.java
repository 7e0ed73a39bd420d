package com.example.floodlog.parser;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 分类后的一行日志：(node id, tag, content)。
 * 启动标志行没有 tag，sessionStart 为 true。
 */
@Getter
@ToString
@AllArgsConstructor
public class ClassifiedLine {

    private final long lineNo;
    private final String nodeId;
    /** 方括号里的标签，例如 GLOSSY_PAYLOAD；启动标志行为 null */
    private final String tag;
    private final String content;
    private final boolean sessionStart;

    public static ClassifiedLine tagged(long lineNo, String nodeId, String tag, String content) {
        return new ClassifiedLine(lineNo, nodeId, tag, content, false);
    }

    public static ClassifiedLine start(long lineNo, String nodeId, String content) {
        return new ClassifiedLine(lineNo, nodeId, null, content, true);
    }
}
