package com.example.floodlog.service;

import com.example.floodlog.exception.DataIntegrityException;
import com.example.floodlog.model.FloodTrx;
import com.example.floodlog.model.PacketCounts;
import com.example.floodlog.model.RecordStore;
import com.example.floodlog.model.StoreKeys;
import com.example.floodlog.model.SyncCounters;
import com.example.floodlog.model.TrxErrors;
import com.example.floodlog.util.TreeQuery;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 基于 TreeQuery 的派生统计，只读，不修改记录树。
 * 结果都按节点号排序（数字节点号按数值排）。
 */
@Service
public class FloodStatistics {

    private static final Logger log = LoggerFactory.getLogger(FloodStatistics.class);

    /** 纯数字的节点号按数值比较，其余按字符串 */
    static final Comparator<String> NODE_ORDER = (a, b) -> {
        boolean na = isNumeric(a);
        boolean nb = isNumeric(b);
        if (na && nb) {
            int c = Long.compare(Long.parseLong(a), Long.parseLong(b));
            return c != 0 ? c : a.compareTo(b);
        }
        if (na != nb) {
            return na ? -1 : 1;
        }
        return a.compareTo(b);
    };

    /**
     * 1. 所有节点广播的包的并集
     * 2. 每个节点收到的包（有 flood 记录就算收到）
     * 3. 每个节点漏掉的包
     */
    public PacketCounts packetCounts(RecordStore store) {
        Set<Long> sent = sentUnion(store);
        Map<String, Set<Long>> rx = receivedByNode(store, sent);

        Map<String, Integer> received = new TreeMap<>(NODE_ORDER);
        Map<String, Set<Long>> notReceived = new TreeMap<>(NODE_ORDER);
        rx.forEach((node, pkts) -> {
            received.put(node, pkts.size());
            Set<Long> lost = new TreeSet<>(sent);
            lost.removeAll(pkts);
            notReceived.put(node, lost);
        });
        return new PacketCounts(sent.size(), received, notReceived);
    }

    /** 每个节点的 PDR = 收到的包数 / 全网广播的包数 */
    public Map<String, Double> pdr(RecordStore store) {
        Set<Long> sent = sentUnion(store);
        Map<String, Double> out = new TreeMap<>(NODE_ORDER);
        receivedByNode(store, sent).forEach((node, pkts) ->
                out.put(node, sent.isEmpty() ? 0.0 : (double) pkts.size() / sent.size()));
        return out;
    }

    public Map<String, List<Long>> firstRelayCounters(RecordStore store) {
        return perNodeLongs(store, StoreKeys.REF_RELAY_CNT);
    }

    /**
     * 各节点的 slot 估计值，去掉估计失败（为 0）的。
     * 单位是收发器时钟（1 unit 约 31.25ns）。
     */
    public Map<String, List<Long>> slotEstimates(RecordStore store) {
        Map<String, List<Long>> out = new TreeMap<>(NODE_ORDER);
        perNodeLongs(store, StoreKeys.T_SLOT).forEach((node, slots) ->
                out.put(node, slots.stream().filter(s -> s > 0).collect(Collectors.toList())));
        return out;
    }

    /** 各节点 slot 估计失败（T_slot == 0）的次数 */
    public Map<String, Integer> failedSlotEstimations(RecordStore store) {
        Map<String, Integer> out = new TreeMap<>(NODE_ORDER);
        perNodeLongs(store, StoreKeys.T_SLOT).forEach((node, slots) ->
                out.put(node, (int) slots.stream().filter(s -> s == 0).count()));
        return out;
    }

    public FloodTrx floodTrx(RecordStore store) {
        Map<String, List<Long>> tx = new TreeMap<>(NODE_ORDER);
        Map<String, List<Long>> rx = new TreeMap<>(NODE_ORDER);
        nodes(store).forEach((node, data) -> {
            JsonNode floods = TreeQuery.select(data, StoreKeys.FLOODS);
            tx.put(node, TreeQuery.longs(TreeQuery.select(floods, StoreKeys.N_TX)));
            rx.put(node, TreeQuery.longs(TreeQuery.select(floods, StoreKeys.N_RX)));
        });
        return new FloodTrx(tx, rx);
    }

    /**
     * 收发错误数 = n_rx_err + rx_to；坏包数 = n_bad_length + n_bad_header + n_bad_payload。
     * 缺任何一项时该节点记 0。
     */
    public TrxErrors trxErrors(RecordStore store) {
        Map<String, Long> errors = new TreeMap<>(NODE_ORDER);
        Map<String, Long> badPackets = new TreeMap<>(NODE_ORDER);
        nodes(store).forEach((node, data) -> {
            JsonNode stats = TreeQuery.select(data, StoreKeys.GLOSSY_STATS);
            Long err = sum(stats, StoreKeys.N_RX_ERR, StoreKeys.RX_TIMEOUT);
            Long bad = sum(stats, StoreKeys.BAD_LENGTH, StoreKeys.BAD_HEADER, StoreKeys.BAD_PAYLOAD);
            if (err == null || bad == null) {
                errors.put(node, 0L);
                badPackets.put(node, 0L);
            } else {
                errors.put(node, err);
                badPackets.put(node, bad);
            }
        });
        return new TrxErrors(errors, badPackets);
    }

    /**
     * 全网汇总的错误明细（bad_crc、rf_err ...），
     * 另外算出 unknown_err = (n_rx_err + rx_to) - 明细之和。
     */
    public Map<String, Long> trxErrorDetails(RecordStore store) {
        Map<String, Long> totals = new LinkedHashMap<>();
        for (JsonNode stats : TreeQuery.select(store.root(), StoreKeys.GLOSSY_STATS)) {
            if (!stats.isObject() || stats.size() == 0) continue;
            Iterator<Map.Entry<String, JsonNode>> it = stats.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                totals.merge(e.getKey(), e.getValue().asLong(), Long::sum);
            }
        }
        if (totals.isEmpty()) {
            return totals;
        }

        long nerrs = totals.getOrDefault(StoreKeys.N_RX_ERR, 0L) + totals.getOrDefault(StoreKeys.RX_TIMEOUT, 0L);
        for (String k : List.of(StoreKeys.N_RX_ERR, StoreKeys.RX_TIMEOUT,
                StoreKeys.BAD_LENGTH, StoreKeys.BAD_HEADER, StoreKeys.BAD_PAYLOAD,
                StoreKeys.N_RX, StoreKeys.N_TX, StoreKeys.REL_CNT_FIRST_RX)) {
            totals.remove(k);
        }
        long detailed = totals.values().stream().mapToLong(Long::longValue).sum();
        totals.put("unknown_err", nerrs - detailed);
        return totals;
    }

    public SyncCounters syncCounters(RecordStore store) {
        Map<String, Long> sync = new TreeMap<>(NODE_ORDER);
        Map<String, Long> desync = new TreeMap<>(NODE_ORDER);
        nodes(store).forEach((node, data) -> {
            JsonNode app = TreeQuery.select(data, StoreKeys.APP_STATS);
            sync.put(node, app.path(StoreKeys.N_SYNC).asLong(0));
            desync.put(node, app.path(StoreKeys.N_NOSYNC).asLong(0));
        });
        return new SyncCounters(sync, desync);
    }

    public Map<String, List<Long>> epochEstimates(RecordStore store) {
        return perNodeLongs(store, StoreKeys.EPOCH_RTIMER);
    }

    // -------------------- 内部辅助方法 --------------------

    private Map<String, JsonNode> nodes(RecordStore store) {
        return TreeQuery.groupBy(store.root(), StoreKeys.NODE);
    }

    private Map<String, List<Long>> perNodeLongs(RecordStore store, String field) {
        Map<String, List<Long>> out = new TreeMap<>(NODE_ORDER);
        nodes(store).forEach((node, data) -> out.put(node, TreeQuery.longs(TreeQuery.select(data, field))));
        return out;
    }

    private Set<Long> sentUnion(RecordStore store) {
        return new HashSet<>(TreeQuery.longs(TreeQuery.select(store.root(), StoreKeys.BROADCAST)));
    }

    /** 收到的包必须是发送过的包的子集，否则数据有问题 */
    private Map<String, Set<Long>> receivedByNode(RecordStore store, Set<Long> sent) {
        Map<String, Set<Long>> out = new TreeMap<>(NODE_ORDER);
        nodes(store).forEach((node, data) -> {
            Set<Long> rx = new TreeSet<>(TreeQuery.longs(TreeQuery.select(data, StoreKeys.PKT_SEQNO)));
            if (!sent.containsAll(rx)) {
                Set<Long> unknown = new TreeSet<>(rx);
                unknown.removeAll(sent);
                log.error("Received packets are not a subset of those sent in node {}", node);
                throw new DataIntegrityException(
                        "Received packets are not a subset of those sent in node " + node, unknown);
            }
            out.put(node, rx);
        });
        return out;
    }

    private static Long sum(JsonNode stats, String... keys) {
        long total = 0;
        for (String k : keys) {
            JsonNode v = stats.get(k);
            if (v == null || !v.isNumber()) {
                return null;
            }
            total += v.asLong();
        }
        return total;
    }

    private static boolean isNumeric(String s) {
        if (s == null || s.isEmpty() || s.length() > 18) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }
}
