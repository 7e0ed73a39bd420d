package com.example.floodlog.service;

import com.example.floodlog.exception.DataIntegrityException;
import com.example.floodlog.model.FloodRecord;
import com.example.floodlog.model.NodeRecord;
import com.example.floodlog.model.PacketCounts;
import com.example.floodlog.model.RecordStore;
import com.example.floodlog.model.StoreKeys;
import com.example.floodlog.model.SyncCounters;
import com.example.floodlog.model.TrxErrors;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.floodlog.service.ConsistencyCleanerTest.node;
import static org.junit.jupiter.api.Assertions.*;

class FloodStatisticsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final FloodStatistics statistics = new FloodStatistics();

    private RecordStore store;

    @BeforeEach
    void setUp() {
        NodeRecord initiator = node("1", List.of(1L, 2L, 3L, 4L), List.of());

        NodeRecord n2 = node("2", List.of(), List.of(1L, 2L, 4L));
        n2.getFloods().get(1).put(StoreKeys.T_SLOT, 0L);
        for (FloodRecord f : n2.getFloods()) {
            f.put(StoreKeys.REF_RELAY_CNT, f.getPktSeqno() % 2);
            f.put(StoreKeys.N_TX, 3L);
            f.put(StoreKeys.N_RX, 2L);
        }
        n2.setGlossyStats(stats(StoreKeys.N_RX_ERR, 5L, StoreKeys.RX_TIMEOUT, 2L,
                StoreKeys.BAD_LENGTH, 1L, StoreKeys.BAD_HEADER, 1L, StoreKeys.BAD_PAYLOAD, 0L,
                StoreKeys.CRC_ERROR, 3L, StoreKeys.RF_ERROR, 1L, StoreKeys.N_RX, 40L));
        n2.getAppStats().setSyncCount(4);
        n2.getAppStats().setDesyncCount(1);
        n2.getAppStats().setEpochRtimer(new ArrayList<>(List.of(3276L, 3277L)));

        // 缺 rx_to，错误数按 0 处理
        NodeRecord n10 = node("10", List.of(), List.of(1L, 2L, 3L, 4L));
        n10.setGlossyStats(stats(StoreKeys.N_RX_ERR, 2L,
                StoreKeys.BAD_LENGTH, 0L, StoreKeys.BAD_HEADER, 0L, StoreKeys.BAD_PAYLOAD, 0L,
                StoreKeys.CRC_ERROR, 1L));

        store = RecordStore.fromRecords(List.of(initiator, n10, n2), objectMapper);
    }

    private static Map<String, Long> stats(Object... kv) {
        Map<String, Long> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], (Long) kv[i + 1]);
        }
        return m;
    }

    @Test
    void packetCountsPerNode() {
        PacketCounts counts = statistics.packetCounts(store);

        assertEquals(4, counts.getSent());
        assertEquals(List.of("1", "2", "10"), List.copyOf(counts.getReceived().keySet()));
        assertEquals(0, counts.getReceived().get("1"));
        assertEquals(3, counts.getReceived().get("2"));
        assertEquals(4, counts.getReceived().get("10"));
        assertEquals(Set.of(3L), counts.getNotReceived().get("2"));
        assertTrue(counts.getNotReceived().get("10").isEmpty());
    }

    @Test
    void pdrIsReceivedOverSent() {
        Map<String, Double> pdr = statistics.pdr(store);

        assertEquals(0.0, pdr.get("1"));
        assertEquals(0.75, pdr.get("2"), 1e-9);
        assertEquals(1.0, pdr.get("10"), 1e-9);
    }

    @Test
    void receivedOutsideSentIsAnIntegrityError() {
        RecordStore bad = RecordStore.fromRecords(List.of(
                node("1", List.of(1L, 2L), List.of()),
                node("2", List.of(), List.of(1L, 7L))), objectMapper);

        DataIntegrityException e = assertThrows(DataIntegrityException.class, () -> statistics.packetCounts(bad));
        assertEquals(Set.of(7L), e.getSeqnos());
    }

    @Test
    void slotEstimatesSkipFailures() {
        Map<String, List<Long>> slots = statistics.slotEstimates(store);
        Map<String, Integer> failed = statistics.failedSlotEstimations(store);

        assertEquals(List.of(1001L, 1004L), slots.get("2"));
        assertEquals(1, failed.get("2"));
        assertEquals(0, failed.get("10"));
        assertTrue(slots.get("1").isEmpty());
    }

    @Test
    void relayCountersAndTrxFollowFloodOrder() {
        assertEquals(List.of(1L, 0L, 0L), statistics.firstRelayCounters(store).get("2"));
        assertTrue(statistics.firstRelayCounters(store).get("10").isEmpty());

        assertEquals(List.of(3L, 3L, 3L), statistics.floodTrx(store).getTx().get("2"));
        assertEquals(List.of(2L, 2L, 2L), statistics.floodTrx(store).getRx().get("2"));
        assertTrue(statistics.floodTrx(store).getTx().get("1").isEmpty());
    }

    @Test
    void trxErrorsFallBackToZeroWhenIncomplete() {
        TrxErrors errors = statistics.trxErrors(store);

        assertEquals(7L, errors.getErrors().get("2"));
        assertEquals(2L, errors.getBadPackets().get("2"));
        assertEquals(0L, errors.getErrors().get("10"));
        assertEquals(0L, errors.getBadPackets().get("10"));
        assertEquals(0L, errors.getErrors().get("1"));
    }

    @Test
    void errorDetailsAccountForUnknownErrors() {
        Map<String, Long> details = statistics.trxErrorDetails(store);

        assertEquals(4L, details.get(StoreKeys.CRC_ERROR));
        assertEquals(1L, details.get(StoreKeys.RF_ERROR));
        // (5 + 2 + 2) - (4 + 1)
        assertEquals(4L, details.get("unknown_err"));
        assertFalse(details.containsKey(StoreKeys.N_RX));
        assertFalse(details.containsKey(StoreKeys.BAD_LENGTH));
    }

    @Test
    void appCountersPerNode() {
        SyncCounters sync = statistics.syncCounters(store);

        assertEquals(4L, sync.getSync().get("2"));
        assertEquals(1L, sync.getDesync().get("2"));
        assertEquals(0L, sync.getSync().get("10"));
        assertEquals(List.of(3276L, 3277L), statistics.epochEstimates(store).get("2"));
        assertTrue(statistics.epochEstimates(store).get("1").isEmpty());
    }

    @Test
    void numericNodeIdsSortByValue() {
        List<String> ids = new ArrayList<>(List.of("10", "b", "2", "a", "1"));
        ids.sort(FloodStatistics.NODE_ORDER);

        assertEquals(List.of("1", "2", "10", "a", "b"), ids);
    }
}
