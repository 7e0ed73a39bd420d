package com.example.floodlog.service;

import com.example.floodlog.config.FloodLogProperties;
import com.example.floodlog.model.AnalysisResult;
import com.example.floodlog.model.RecordStore;
import com.example.floodlog.parser.FloodLogParser;
import com.example.floodlog.parser.ParseResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 单个日志文件的处理主流程：解析 → 清洗 → 统计。
 * 每次调用独立构造解析器和记录树，多个文件之间不共享状态。
 *
 * 解析失败抛 LogParseException，数据不一致抛 DataIntegrityException，
 * 是跳过还是整体中止由调用方决定。
 */
@Service
public class FloodLogAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(FloodLogAnalysisService.class);

    private final FloodLogProperties props;
    private final ConsistencyCleaner cleaner;
    private final FloodStatistics statistics;
    private final ObjectMapper objectMapper;

    public FloodLogAnalysisService(FloodLogProperties props,
                                   ConsistencyCleaner cleaner,
                                   FloodStatistics statistics,
                                   ObjectMapper objectMapper) {
        this.props = props;
        this.cleaner = cleaner;
        this.statistics = statistics;
        this.objectMapper = objectMapper;
    }

    public ParseResult parse(Path logFile) throws IOException {
        return parse(logFile, props.isTestbed(), log);
    }

    /**
     * @param sink 解析警告写到这个 logger，便于调用方按文件区分输出
     */
    public ParseResult parse(Path logFile, boolean testbed, Logger sink) throws IOException {
        FloodLogParser parser = new FloodLogParser(props.statKeySet(), objectMapper, sink);
        return parser.parseFile(logFile, testbed);
    }

    public ParseResult parseAndClean(Path logFile) throws IOException {
        ParseResult result = parse(logFile);
        cleaner.clean(result.getStore(), props.getTrimOffset());
        return result;
    }

    public AnalysisResult analyse(Path logFile) throws IOException {
        ParseResult parsed = parseAndClean(logFile);
        RecordStore store = parsed.getStore();
        log.info("Analysing {}: {} nodes after cleaning (offset={})",
                logFile.getFileName(), store.nodeCount(), props.getTrimOffset());

        return AnalysisResult.builder()
                .store(store)
                .warnings(parsed.getWarnings())
                .trimOffset(props.getTrimOffset())
                .packetCounts(statistics.packetCounts(store))
                .pdr(statistics.pdr(store))
                .firstRelayCounters(statistics.firstRelayCounters(store))
                .slotEstimates(statistics.slotEstimates(store))
                .failedSlotEstimations(statistics.failedSlotEstimations(store))
                .floodTrx(statistics.floodTrx(store))
                .trxErrors(statistics.trxErrors(store))
                .trxErrorDetails(statistics.trxErrorDetails(store))
                .syncCounters(statistics.syncCounters(store))
                .epochEstimates(statistics.epochEstimates(store))
                .build();
    }
}
