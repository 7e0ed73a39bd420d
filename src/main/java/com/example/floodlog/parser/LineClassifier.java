package com.example.floodlog.parser;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把一行原始日志变成 (node id, tag, content)，或者丢弃。
 *
 * testbed 模式下每行形如：
 * <pre>
 * [2019-03-01 10:00:00,123] INFO:firefly-01: 7 &lt; b'[GLOSSY_PAYLOAD]rcvd_seq 100\n'
 * </pre>
 * 非 testbed 模式下整行就是内容，node id 固定为 "0"。
 * 只有 testbed 模式会做 {@link #normalize}，原始日志里的 b'...' 外壳和 \\n 转义原样保留。
 *
 * 一旦看到 end test 标志就永久停止，后面的行全部忽略。
 */
public class LineClassifier {

    static final Pattern TESTBED_PREFIX = Pattern.compile(
            "\\[\\d+-\\d+-\\d+\\s+\\d+:\\d+:\\d+,\\d+\\]\\s+\\w+:[\\w\\-.]+:\\s+(\\d+)\\s*<\\s*(.*)");
    static final Pattern TAGGED = Pattern.compile("^\\[\\s*([\\w-]+)\\s*\\]\\s*(.*)");
    static final Pattern SESSION_START = Pattern.compile("^Starting Glossy.*");
    static final Pattern BROKEN_LABEL = Pattern.compile("^\\[[^\\]]*$");
    static final Pattern END_TEST = Pattern.compile("testbed-server:\\s+end\\s+test", Pattern.CASE_INSENSITIVE);
    static final Pattern ESCAPED_WHITESPACE = Pattern.compile("(?:\\\\t|\\\\n)+");

    static final String RAW_NODE_ID = "0";

    private final boolean testbed;
    private final ParseReport report;

    private long lineNo;
    private boolean stopped;

    public LineClassifier(boolean testbed, ParseReport report) {
        this.testbed = testbed;
        this.report = report;
    }

    public Optional<ClassifiedLine> classify(String line) {
        if (stopped || line == null) {
            return Optional.empty();
        }
        lineNo++;

        if (END_TEST.matcher(line).find()) {
            stopped = true;
            report.setEndOfTestLine(lineNo);
            report.log().debug("End of test encountered at line {}. Stop parsing...", lineNo);
            return Optional.empty();
        }

        String nodeId;
        String payload;
        if (testbed) {
            Matcher m = TESTBED_PREFIX.matcher(line);
            if (!m.find()) {
                return Optional.empty();
            }
            nodeId = m.group(1);
            payload = normalize(m.group(2));
        } else {
            nodeId = RAW_NODE_ID;
            payload = line;
        }

        if (BROKEN_LABEL.matcher(payload).find()) {
            report.note(WarningKind.BROKEN_LABEL, lineNo, nodeId, payload);
        }

        Matcher tagged = TAGGED.matcher(payload);
        if (tagged.find()) {
            return Optional.of(ClassifiedLine.tagged(lineNo, nodeId, tagged.group(1), tagged.group(2)));
        }
        if (SESSION_START.matcher(payload).find()) {
            return Optional.of(ClassifiedLine.start(lineNo, nodeId, payload));
        }
        return Optional.empty();
    }

    public boolean isStopped() {
        return stopped;
    }

    public long getLineNo() {
        return lineNo;
    }

    /**
     * 去掉 b'...' 字节串外壳，连续的 \t / \n 转义替换成一个空格
     */
    static String normalize(String payload) {
        String s = payload;
        if (s.length() >= 2 && s.charAt(0) == 'b' && (s.charAt(1) == '\'' || s.charAt(1) == '"')) {
            char quote = s.charAt(1);
            int end = s.lastIndexOf(quote);
            s = end > 1 ? s.substring(2, end) : s.substring(2);
        }
        return ESCAPED_WHITESPACE.matcher(s).replaceAll(" ");
    }
}
