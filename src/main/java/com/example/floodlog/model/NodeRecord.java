package com.example.floodlog.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个节点在一次测试中的全部记录
 */
@Data
@NoArgsConstructor
@JsonPropertyOrder({StoreKeys.NODE, StoreKeys.BROADCAST, StoreKeys.FLOODS,
        StoreKeys.GLOSSY_STATS, StoreKeys.APP_STATS})
public class NodeRecord {

    /** 节点号（testbed 日志中的 node id，原始日志固定为 "0"） */
    @JsonProperty(StoreKeys.NODE)
    private String nodeId;

    /** 本节点作为发起者广播出去的 seqno，按日志顺序 */
    @JsonProperty(StoreKeys.BROADCAST)
    private List<Long> broadcast = new ArrayList<>();

    @JsonProperty(StoreKeys.FLOODS)
    private List<FloodRecord> floods = new ArrayList<>();

    /** 整个运行期的累计计数，后出现的值覆盖先出现的 */
    @JsonProperty(StoreKeys.GLOSSY_STATS)
    private Map<String, Long> glossyStats = new LinkedHashMap<>();

    @JsonProperty(StoreKeys.APP_STATS)
    private AppStats appStats = new AppStats();

    public NodeRecord(String nodeId) {
        this.nodeId = nodeId;
    }
}
