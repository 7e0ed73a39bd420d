package com.example.floodlog.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 每个节点在每个 flood 内的发送/接收次数
 */
@Data
@AllArgsConstructor
public class FloodTrx {

    private Map<String, List<Long>> tx;
    private Map<String, List<Long>> rx;
}
