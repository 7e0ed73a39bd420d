package com.example.floodlog.exception;

/**
 * 解析阶段的硬错误：没有发现任何会话，或 GLOSSY_BROADCAST 内容无法解析。
 * 出现后本次解析结果不可信，整个文件放弃。
 */
public class LogParseException extends RuntimeException {

    private final long lineNo;

    public LogParseException(String message) {
        this(message, -1);
    }

    public LogParseException(String message, long lineNo) {
        super(lineNo > 0 ? message + " (line " + lineNo + ")" : message);
        this.lineNo = lineNo;
    }

    /** 出错行号，未知时为 -1 */
    public long getLineNo() {
        return lineNo;
    }
}
