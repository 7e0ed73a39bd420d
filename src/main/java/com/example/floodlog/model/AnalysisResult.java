package com.example.floodlog.model;

import com.example.floodlog.parser.ParseWarning;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * 一个日志文件解析 + 清洗 + 统计后的完整结果，交给下游画图/写报表
 */
@Getter
@Builder
public class AnalysisResult {

    private final RecordStore store;
    private final List<ParseWarning> warnings;
    private final int trimOffset;

    private final PacketCounts packetCounts;
    private final Map<String, Double> pdr;
    private final Map<String, List<Long>> firstRelayCounters;
    private final Map<String, List<Long>> slotEstimates;
    private final Map<String, Integer> failedSlotEstimations;
    private final FloodTrx floodTrx;
    private final TrxErrors trxErrors;
    private final Map<String, Long> trxErrorDetails;
    private final SyncCounters syncCounters;
    private final Map<String, List<Long>> epochEstimates;
}
