package com.example.floodlog.parser;

import com.example.floodlog.model.NodeRecord;
import com.example.floodlog.model.RecordStore;
import com.example.floodlog.model.StoreKeys;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 负责：读取一次测试的日志文件（多个节点交错打印），
 * 按节点重建会话，输出一棵 RecordStore 树：
 *
 * <pre>
 * nodes
 * |-------|---> node         : &lt;node_id&gt;
 *         |---> broadcast    : &lt;list of pkt seqno bcast&gt;
 *         |---> glossy_stats : {stat: val, ...}
 *         |---> app_stats    : {n_sync, n_nosync, epoch_rtimer}
 *         |---> floods
 *                 |-------|---> pkt_seqno : &lt;seqno_1&gt;
 *                         |---> stat      : val ...
 * </pre>
 *
 * 每次调用都用新的分类器和状态机，实例本身可以复用。
 */
public class FloodLogParser {

    private final Set<String> allowedStatKeys;
    private final ObjectMapper objectMapper;
    private final Logger log;

    public FloodLogParser() {
        this(new LinkedHashSet<>(StoreKeys.DEFAULT_STAT_KEYS), new ObjectMapper(),
                LoggerFactory.getLogger(FloodLogParser.class));
    }

    public FloodLogParser(Set<String> allowedStatKeys, ObjectMapper objectMapper, Logger log) {
        this.allowedStatKeys = Objects.requireNonNull(allowedStatKeys, "allowedStatKeys");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.log = log != null ? log : LoggerFactory.getLogger(FloodLogParser.class);
    }

    /**
     * 对外入口：传入日志文件路径，返回记录树和解析警告。
     * 文件里可能有乱码，按 UTF-8 读取，非法字节替换掉，不中断。
     */
    public ParseResult parseFile(Path logFile, boolean testbed) throws IOException {
        if (logFile == null || !Files.exists(logFile)) {
            throw new IllegalArgumentException("log file not found: " + logFile);
        }
        log.debug("Parsing {} (testbed={})", logFile, testbed);
        try (Reader reader = new InputStreamReader(Files.newInputStream(logFile), StandardCharsets.UTF_8)) {
            return parse(reader, testbed);
        }
    }

    public ParseResult parse(Reader reader, boolean testbed) throws IOException {
        ParseReport report = new ParseReport(log);
        LineClassifier classifier = new LineClassifier(testbed, report);
        SessionStateMachine machine = new SessionStateMachine(allowedStatKeys, report);

        BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        String line;
        while (!classifier.isStopped() && (line = br.readLine()) != null) {
            Optional<ClassifiedLine> classified = classifier.classify(line);
            classified.ifPresent(machine::accept);
        }
        report.setLinesRead(classifier.getLineNo());

        List<NodeRecord> records = machine.finish();
        log.info("Parsed {} lines, {} nodes, {} warnings",
                classifier.getLineNo(), records.size(), report.getWarnings().size());
        return new ParseResult(RecordStore.fromRecords(records, objectMapper), report);
    }

    public ParseResult parse(List<String> lines, boolean testbed) {
        try {
            return parse(new StringReader(String.join("\n", lines)), testbed);
        } catch (IOException e) {
            // StringReader 不会抛 IOException
            throw new IllegalStateException(e);
        }
    }
}
