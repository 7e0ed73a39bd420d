package com.example.floodlog.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次接收到的 flood：pkt_seqno + 若干命名统计值。
 * 统计项不固定，序列化时直接平铺成 JSON 对象的字段。
 */
@EqualsAndHashCode
@ToString
public class FloodRecord {

    private final Map<String, Long> stats = new LinkedHashMap<>();

    public FloodRecord() {
    }

    public FloodRecord(long pktSeqno) {
        stats.put(StoreKeys.PKT_SEQNO, pktSeqno);
    }

    @JsonAnyGetter
    public Map<String, Long> getStats() {
        return stats;
    }

    @JsonAnySetter
    public void put(String name, long value) {
        stats.put(name, value);
    }

    @JsonIgnore
    public Long getPktSeqno() {
        return stats.get(StoreKeys.PKT_SEQNO);
    }
}
