package com.example.floodlog.service;

import com.example.floodlog.exception.DataIntegrityException;
import com.example.floodlog.model.FloodRecord;
import com.example.floodlog.model.NodeRecord;
import com.example.floodlog.model.RecordStore;
import com.example.floodlog.model.StoreKeys;
import com.example.floodlog.util.TreeQuery;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class ConsistencyCleanerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ConsistencyCleaner cleaner = new ConsistencyCleaner();

    static NodeRecord node(String id, List<Long> broadcast, List<Long> received) {
        NodeRecord n = new NodeRecord(id);
        n.setBroadcast(new ArrayList<>(broadcast));
        for (Long seqno : received) {
            FloodRecord f = new FloodRecord(seqno);
            f.put(StoreKeys.T_SLOT, 1000 + seqno);
            n.getFloods().add(f);
        }
        return n;
    }

    static List<Long> range(long from, long to) {
        return LongStream.rangeClosed(from, to).boxed().collect(Collectors.toList());
    }

    private RecordStore store(NodeRecord... nodes) {
        return RecordStore.fromRecords(List.of(nodes), objectMapper);
    }

    private Map<String, NodeRecord> byId(RecordStore store) {
        return store.toRecords(objectMapper).stream()
                .collect(Collectors.toMap(NodeRecord::getNodeId, n -> n));
    }

    private static List<Long> seqnos(NodeRecord n) {
        return n.getFloods().stream().map(FloodRecord::getPktSeqno).collect(Collectors.toList());
    }

    @Test
    void trimsByRankAtBothEnds() {
        RecordStore s = store(
                node("1", range(1, 10), List.of()),
                node("2", List.of(), range(1, 10)),
                node("3", List.of(), List.of(1L, 4L, 9L)));

        assertTrue(cleaner.clean(s, 2));

        Map<String, NodeRecord> nodes = byId(s);
        assertEquals(range(3, 8), nodes.get("1").getBroadcast());
        assertEquals(range(3, 8), seqnos(nodes.get("2")));
        assertEquals(List.of(4L), seqnos(nodes.get("3")));
        assertEquals(2, s.trimOffset().getAsInt());
    }

    @Test
    void rankNotValueDecidesWhatIsKept() {
        // seqno 不连续时按排名截
        RecordStore s = store(
                node("1", List.of(5L, 100L, 7L, 2L, 50L), List.of()),
                node("2", List.of(), List.of(2L, 5L, 7L, 50L, 100L)));

        cleaner.clean(s, 1);

        Map<String, NodeRecord> nodes = byId(s);
        // 广播顺序保持不变
        assertEquals(List.of(5L, 7L, 50L), nodes.get("1").getBroadcast());
        assertEquals(List.of(5L, 7L, 50L), seqnos(nodes.get("2")));
    }

    @Test
    void sentButNeverReceivedIsAnIntegrityError() {
        RecordStore s = store(
                node("1", range(1, 5), List.of()),
                node("2", range(6, 10), List.of()));

        DataIntegrityException e = assertThrows(DataIntegrityException.class, () -> cleaner.clean(s, 1));

        assertEquals(Set.copyOf(range(2, 9)), e.getSeqnos());
    }

    @Test
    void corruptedReceivedSeqnoIsRemoved() {
        RecordStore s = store(
                node("1", range(1, 6), List.of()),
                node("2", List.of(), List.of(1L, 2L, 3L, 999L, 4L, 5L, 6L)));

        cleaner.clean(s, 1);

        assertEquals(range(2, 5), seqnos(byId(s).get("2")));
    }

    @Test
    void sameOffsetTwiceOnlyVerifies() {
        RecordStore s = store(
                node("1", range(1, 8), List.of()),
                node("2", List.of(), range(1, 8)));
        cleaner.clean(s, 2);
        RecordStore once = s.deepCopy();

        cleaner.clean(s, 2);

        assertEquals(once, s);
    }

    @Test
    void differentOffsetTrimsAgain() {
        RecordStore s = store(
                node("1", range(1, 8), List.of()),
                node("2", List.of(), range(1, 8)));
        cleaner.clean(s, 1);

        cleaner.clean(s, 2);

        // 在已清洗的 2..7 上再按排名截
        assertEquals(range(4, 5), byId(s).get("1").getBroadcast());
        assertEquals(range(4, 5), seqnos(byId(s).get("2")));
        assertEquals(2, s.trimOffset().getAsInt());
    }

    @Test
    void zeroOffsetKeepsEverything() {
        RecordStore s = store(
                node("1", range(1, 4), List.of()),
                node("2", List.of(), range(1, 4)));

        cleaner.clean(s, 0);

        assertEquals(range(1, 4), seqnos(byId(s).get("2")));
        assertEquals(0, s.trimOffset().getAsInt());
    }

    @Test
    void negativeOffsetIsRejected() {
        RecordStore s = store(node("1", range(1, 4), List.of()));

        assertThrows(IllegalArgumentException.class, () -> cleaner.clean(s, -1));
        assertFalse(s.trimOffset().isPresent());
    }

    @Test
    void offsetLargerThanHalfEmptiesTheStore() {
        RecordStore s = store(
                node("1", range(1, 4), List.of()),
                node("2", List.of(), range(1, 4)));

        cleaner.clean(s, 2);

        assertTrue(TreeQuery.longs(TreeQuery.select(s.root(), StoreKeys.BROADCAST)).isEmpty());
        assertTrue(TreeQuery.longs(TreeQuery.select(s.root(), StoreKeys.PKT_SEQNO)).isEmpty());
    }

    @Test
    void epochSamplesAreTrimmedByCount() {
        NodeRecord a = node("1", range(1, 4), range(1, 4));
        a.getAppStats().setEpochRtimer(new ArrayList<>(List.of(10L, 20L, 30L, 40L, 50L)));
        NodeRecord b = node("2", List.of(), range(1, 4));
        b.getAppStats().setEpochRtimer(new ArrayList<>(List.of(7L, 8L)));
        RecordStore s = store(a, b);

        cleaner.clean(s, 1);

        Map<String, NodeRecord> nodes = byId(s);
        assertEquals(List.of(20L, 30L, 40L), nodes.get("1").getAppStats().getEpochRtimer());
        assertTrue(nodes.get("2").getAppStats().getEpochRtimer().isEmpty());
    }
}
