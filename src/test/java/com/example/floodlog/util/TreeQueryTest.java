package com.example.floodlog.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TreeQueryTest {

    private static final String TREE = "{\"nodes\":["
            + "{\"node\":\"1\",\"broadcast\":[1,2],"
            + "\"floods\":[{\"pkt_seqno\":1,\"T_slot\":5},{\"pkt_seqno\":2,\"T_slot\":0}],"
            + "\"app_stats\":{\"n_sync\":1,\"epoch_rtimer\":[10,20]}},"
            + "{\"node\":\"2\",\"broadcast\":[],"
            + "\"floods\":[{\"pkt_seqno\":1,\"T_slot\":7}],"
            + "\"app_stats\":{\"n_sync\":0,\"epoch_rtimer\":[]}}"
            + "]}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private JsonNode tree;

    @BeforeEach
    void setUp() throws Exception {
        tree = objectMapper.readTree(TREE);
    }

    @Test
    void pathsFollowMappingKeysOnly() {
        Set<List<String>> paths = TreeQuery.paths(tree);

        assertEquals(List.of("nodes"), paths.iterator().next());
        assertTrue(paths.contains(List.of("nodes", "node")));
        assertTrue(paths.contains(List.of("nodes", "floods", "pkt_seqno")));
        assertTrue(paths.contains(List.of("nodes", "app_stats", "epoch_rtimer")));
        // 序列不产生路径段，两个节点的相同结构只出现一次
        assertEquals(9, paths.size());
    }

    @Test
    void pathsForFieldFindsNestedField() {
        assertEquals(List.of(List.of("nodes", "floods", "pkt_seqno")),
                TreeQuery.pathsForField(tree, "pkt_seqno"));
        assertTrue(TreeQuery.pathsForField(tree, "missing").isEmpty());
    }

    @Test
    void selectWalksEveryElementOfIntermediateSequences() {
        JsonNode ids = TreeQuery.select(tree, "node");
        assertEquals("[\"1\",\"2\"]", ids.toString());

        JsonNode seqnos = TreeQuery.select(tree, "pkt_seqno");
        assertEquals(2, seqnos.size());
        assertEquals("[[1,2],[1]]", seqnos.toString());
        assertEquals(List.of(1L, 2L, 1L), TreeQuery.longs(seqnos));

        JsonNode appStats = TreeQuery.select(tree.get("nodes").get(0), "app_stats");
        assertTrue(appStats.isObject());
        assertEquals(1, appStats.get("n_sync").asInt());
    }

    @Test
    void selectReturnsEmptySequenceWhenFieldIsAbsent() {
        JsonNode r = TreeQuery.select(tree, "relay_cnt_t_ref");
        assertTrue(r.isArray());
        assertEquals(0, r.size());
        assertSame(tree, TreeQuery.select(tree, null));
    }

    @Test
    void selectReturnsValueWrittenUnderKey() {
        Map<String, JsonNode> nodes = TreeQuery.groupBy(tree, "node");
        ObjectNode flood = (ObjectNode) nodes.get("2").get("floods").get(0);
        flood.put("relay_cnt_t_ref", 3L);

        JsonNode r = TreeQuery.select(nodes.get("2"), "relay_cnt_t_ref");
        assertEquals(List.of(3L), TreeQuery.longs(r));
    }

    @Test
    void groupByKeysContainersByTheirOwnValue() {
        Map<String, JsonNode> nodes = TreeQuery.groupBy(tree, "node");

        assertEquals(List.of("1", "2"), List.copyOf(nodes.keySet()));
        nodes.forEach((id, node) -> assertEquals(id, node.get("node").asText()));
        assertSame(tree.get("nodes").get(0), nodes.get("1"));

        Map<String, JsonNode> floods = TreeQuery.groupBy(nodes.get("1"), "pkt_seqno");
        assertEquals(Set.of("1", "2"), floods.keySet());
        assertEquals(0, floods.get("2").get("T_slot").asInt());
    }

    @Test
    void groupByCollisionKeepsLastContainer() throws Exception {
        JsonNode dup = objectMapper.readTree("{\"nodes\":[{\"node\":\"1\",\"v\":1},{\"node\":\"1\",\"v\":2}]}");

        Map<String, JsonNode> groups = TreeQuery.groupBy(dup, "node");
        assertEquals(1, groups.size());
        assertEquals(2, groups.get("1").get("v").asInt());
    }

    @Test
    void deleteFiltersSequenceHolders() {
        TreeQuery.delete(tree, "pkt_seqno", Set.of(1L));

        assertEquals("[[2],[]]", TreeQuery.select(tree, "pkt_seqno").toString());
        assertEquals(0, tree.get("nodes").get(1).get("floods").size());
    }

    @Test
    void deleteAllSeqnosLeavesEmptySentinel() {
        TreeQuery.delete(tree, "pkt_seqno", List.of(1, 2));

        JsonNode r = TreeQuery.select(tree, "pkt_seqno");
        assertTrue(r.isArray());
        assertEquals(0, r.size());
    }

    @Test
    void deleteAbsentValueIsNoOp() {
        JsonNode before = tree.deepCopy();

        TreeQuery.delete(tree, "pkt_seqno", Set.of(99L));
        TreeQuery.deleteValue(tree, "missing_field", 1);
        TreeQuery.delete(tree, "pkt_seqno", List.of());

        assertEquals(before, tree);
    }

    @Test
    void deleteDropsFieldFromMappingHolderOnMatch() {
        TreeQuery.deleteValue(tree, "n_sync", 1);

        assertFalse(tree.get("nodes").get(0).get("app_stats").has("n_sync"));
        assertTrue(tree.get("nodes").get(1).get("app_stats").has("n_sync"));
    }

    @Test
    void pointersReturnLiveReferences() {
        List<ObjectNode> holders = TreeQuery.pointersToField(tree, "broadcast");

        assertEquals(2, holders.size());
        assertSame(tree.get("nodes").get(0), holders.get(0));

        ((ArrayNode) holders.get(1).get("broadcast")).add(42);
        assertEquals(List.of(1L, 2L, 42L), TreeQuery.longs(TreeQuery.select(tree, "broadcast")));
    }

    @Test
    void pointersToMissingPathIsEmpty() {
        assertTrue(TreeQuery.pointersTo(tree, List.of("nodes", "nothing")).isEmpty());
        assertTrue(TreeQuery.pointersTo(tree, List.of()).isEmpty());
    }
}
