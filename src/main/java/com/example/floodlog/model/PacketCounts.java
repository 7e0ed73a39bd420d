package com.example.floodlog.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;
import java.util.Set;

/**
 * 全网广播的包数，以及每个节点收到/漏掉的包
 */
@Data
@AllArgsConstructor
public class PacketCounts {

    /** 所有节点广播 seqno 并集的大小 */
    private int sent;
    private Map<String, Integer> received;
    private Map<String, Set<Long>> notReceived;
}
