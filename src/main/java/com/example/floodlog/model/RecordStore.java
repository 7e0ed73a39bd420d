package com.example.floodlog.model;

import com.example.floodlog.util.TreeQuery;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * 记录树的根容器：{"nodes": [ {node, broadcast, floods, glossy_stats, app_stats}, ... ]}
 *
 * 树本身就是 Jackson 的 JsonNode（ObjectNode / ArrayNode / 标量），
 * 读写都通过 {@link TreeQuery} 完成，这里不暴露固定 schema 的访问器。
 * 清洗过的树在根上多一个 key：trim_offset（见 {@link StoreKeys#TRIM_OFFSET}），
 * 所以 TreeQuery.paths 的结果里也会出现它。
 */
public final class RecordStore {

    private static final TypeReference<List<NodeRecord>> NODE_LIST = new TypeReference<>() {};

    private final ObjectNode root;

    public RecordStore(ObjectNode root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public static RecordStore fromRecords(List<NodeRecord> records, ObjectMapper objectMapper) {
        ObjectNode root = objectMapper.createObjectNode();
        root.set(StoreKeys.NODES, objectMapper.valueToTree(records));
        return new RecordStore(root);
    }

    public ObjectNode root() {
        return root;
    }

    public int nodeCount() {
        return TreeQuery.groupBy(root, StoreKeys.NODE).size();
    }

    /** 清洗时写入的 offset；未清洗过则为空 */
    public OptionalInt trimOffset() {
        JsonNode n = root.get(StoreKeys.TRIM_OFFSET);
        return (n == null || !n.canConvertToInt()) ? OptionalInt.empty() : OptionalInt.of(n.asInt());
    }

    /** 转回强类型记录，只给测试和报表用；统计和清洗都走 TreeQuery */
    public List<NodeRecord> toRecords(ObjectMapper objectMapper) {
        return objectMapper.convertValue(root.path(StoreKeys.NODES), NODE_LIST);
    }

    public RecordStore deepCopy() {
        return new RecordStore(root.deepCopy());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecordStore)) return false;
        return root.equals(((RecordStore) o).root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
