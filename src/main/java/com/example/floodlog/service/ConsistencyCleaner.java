package com.example.floodlog.service;

import com.example.floodlog.exception.DataIntegrityException;
import com.example.floodlog.model.RecordStore;
import com.example.floodlog.model.StoreKeys;
import com.example.floodlog.util.TreeQuery;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 清洗：去掉首尾的 flood，并检查发送集合与接收集合是否一致。
 *
 * 1. 所有节点广播过的 seqno 取并集，排序后按排名首尾各去掉 offset 个，得到保留集合；
 * 2. 不在保留集合中的 seqno（发送或接收过的）全部删除：flood 记录 + broadcast 列表；
 * 3. 每个节点的 epoch 采样首尾各去掉 offset 个（与第 1 步无关，按个数截）；
 * 4. 重新计算两个并集，不相等则抛 {@link DataIntegrityException}。
 *
 * 按排名截而不是按数值范围截，日志里出现错乱的 seqno 时也不会影响保留范围。
 */
@Service
public class ConsistencyCleaner {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyCleaner.class);

    public boolean clean(RecordStore store, int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got: " + offset);
        }
        ObjectNode root = store.root();

        // 同一个 offset 已经清洗过，只做一致性检查
        if (store.trimOffset().isPresent() && store.trimOffset().getAsInt() == offset) {
            log.debug("Store already cleaned with offset {}, verifying only", offset);
            verify(root);
            return true;
        }

        Set<Long> sent = union(TreeQuery.select(root, StoreKeys.BROADCAST));
        Set<Long> received = union(TreeQuery.select(root, StoreKeys.PKT_SEQNO));

        List<Long> ranked = new ArrayList<>(new TreeSet<>(sent));
        List<Long> considered = ranked.size() > 2 * offset
                ? ranked.subList(offset, ranked.size() - offset)
                : List.of();

        Set<Long> toRemove = new TreeSet<>(sent);
        toRemove.addAll(received);
        toRemove.removeAll(considered);
        log.debug("Cleaning with offset {}: {} pkt broadcast, {} kept, {} removed",
                offset, sent.size(), considered.size(), toRemove.size());

        TreeQuery.delete(root, StoreKeys.PKT_SEQNO, toRemove);

        for (ObjectNode holder : TreeQuery.pointersToField(root, StoreKeys.BROADCAST)) {
            JsonNode bcast = holder.get(StoreKeys.BROADCAST);
            ArrayNode kept = holder.arrayNode();
            for (JsonNode seqno : bcast) {
                if (!toRemove.contains(seqno.asLong())) {
                    kept.add(seqno);
                }
            }
            holder.set(StoreKeys.BROADCAST, kept);
        }

        for (ObjectNode holder : TreeQuery.pointersToField(root, StoreKeys.EPOCH_RTIMER)) {
            JsonNode epochs = holder.get(StoreKeys.EPOCH_RTIMER);
            ArrayNode kept = holder.arrayNode();
            for (int i = offset; i < epochs.size() - offset; i++) {
                kept.add(epochs.get(i));
            }
            holder.set(StoreKeys.EPOCH_RTIMER, kept);
        }

        root.put(StoreKeys.TRIM_OFFSET, (long) offset);
        verify(root);
        return true;
    }

    private void verify(JsonNode root) {
        Set<Long> sent = union(TreeQuery.select(root, StoreKeys.BROADCAST));
        Set<Long> received = union(TreeQuery.select(root, StoreKeys.PKT_SEQNO));

        Set<Long> diff = new TreeSet<>(sent);
        diff.addAll(received);
        Set<Long> common = new HashSet<>(sent);
        common.retainAll(received);
        diff.removeAll(common);

        if (!diff.isEmpty()) {
            log.error("Packets received and sent differ! Differing packets: {}", diff);
            throw new DataIntegrityException("Packets received and sent differ", diff);
        }
    }

    private static Set<Long> union(JsonNode selected) {
        return new HashSet<>(TreeQuery.longs(selected));
    }
}
