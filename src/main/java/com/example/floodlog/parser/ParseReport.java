package com.example.floodlog.parser;

import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次解析过程中累计的警告。每条警告同时写入注入进来的 logger。
 */
public class ParseReport {

    private final Logger log;
    private final List<ParseWarning> warnings = new ArrayList<>();

    private long linesRead;
    private long endOfTestLine = -1;

    public ParseReport(Logger log) {
        this.log = log;
    }

    public void warn(WarningKind kind, long lineNo, String nodeId, String message) {
        warnings.add(new ParseWarning(kind, lineNo, nodeId, message));
        log.warn("[{}] {}. line={}, node={}, detail={}", kind.getCode(), kind.getDesc(), lineNo, nodeId, message);
    }

    /** 数据质量类的提示只在 debug 级别输出，但同样计入警告 */
    public void note(WarningKind kind, long lineNo, String nodeId, String message) {
        warnings.add(new ParseWarning(kind, lineNo, nodeId, message));
        log.debug("[{}] {}. line={}, node={}, detail={}", kind.getCode(), kind.getDesc(), lineNo, nodeId, message);
    }

    public Logger log() {
        return log;
    }

    public List<ParseWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public long count(WarningKind kind) {
        return warnings.stream().filter(w -> w.getKind() == kind).count();
    }

    public long getLinesRead() {
        return linesRead;
    }

    void setLinesRead(long linesRead) {
        this.linesRead = linesRead;
    }

    /** 遇到 end test 标志的行号；没遇到为 -1 */
    public long getEndOfTestLine() {
        return endOfTestLine;
    }

    void setEndOfTestLine(long endOfTestLine) {
        this.endOfTestLine = endOfTestLine;
    }
}
