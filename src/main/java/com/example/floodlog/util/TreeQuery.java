package com.example.floodlog.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 不依赖 schema 的树查询工具，树就是 Jackson 的 JsonNode：
 * ObjectNode 当作映射，ArrayNode 当作序列，其余都是标量。
 *
 * 路径只由映射的 key 组成，遍历序列时逐个元素下钻但不产生路径段。
 * 所以 {"nodes":[{"node":"1"}]} 中 node 的路径是 [nodes, node]。
 *
 * 所有操作每次都重新发现路径（线性遍历），一次性批处理足够用了。
 */
public final class TreeQuery {

    private TreeQuery() {}

    /**
     * 返回树中所有不同的 key 路径，按深度优先、文档顺序发现的先后排列。
     */
    public static Set<List<String>> paths(JsonNode tree) {
        Set<List<String>> out = new LinkedHashSet<>();
        collectPaths(tree, Collections.emptyList(), out);
        return out;
    }

    private static void collectPaths(JsonNode node, List<String> prefix, Set<List<String>> out) {
        if (node == null) return;
        if (node.isArray()) {
            for (JsonNode element : node) {
                collectPaths(element, prefix, out);
            }
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                List<String> path = append(prefix, e.getKey());
                out.add(path);
                JsonNode child = e.getValue();
                if (child.isContainerNode()) {
                    collectPaths(child, path, out);
                }
            }
        }
    }

    /**
     * 所有以 field 结尾的路径，第一个就是“首次发现”的那条
     */
    public static List<List<String>> pathsForField(JsonNode tree, String field) {
        List<List<String>> out = new ArrayList<>();
        for (List<String> path : paths(tree)) {
            if (path.get(path.size() - 1).equals(field)) {
                out.add(path);
            }
        }
        return out;
    }

    /**
     * 沿 path 逐层向下取；碰到序列就对每个元素分别继续，结果收集成 ArrayNode。
     * 某个分支取不到时剪掉该分支，整体取不到返回 null。
     */
    public static JsonNode query(JsonNode tree, List<String> path) {
        if (tree == null) return null;
        if (tree.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : tree) {
                JsonNode r = query(element, path);
                if (r != null) {
                    out.add(r);
                }
            }
            return out;
        }
        if (tree.isObject()) {
            if (path.isEmpty()) return null;
            JsonNode branch = tree.get(path.get(0));
            if (branch == null) return null;
            if (path.size() > 1) {
                return query(branch, path.subList(1, path.size()));
            }
            return branch;
        }
        return null;
    }

    /**
     * 按字段名取值：用第一条以 field 结尾的路径去 {@link #query}。
     * field 为 null 时返回整棵树；找不到时返回空 ArrayNode。
     */
    public static JsonNode select(JsonNode tree, String field) {
        if (field == null) return tree;
        List<List<String>> paths = pathsForField(tree, field);
        if (paths.isEmpty()) {
            return emptySequence();
        }
        JsonNode r = query(tree, paths.get(0));
        return r == null ? emptySequence() : r;
    }

    /**
     * 找到 field 上一层的容器集合，按每个容器自身在 field 上的值建立映射。
     * 调用方需保证该值在这一层唯一（实际上就是节点号），冲突时后者覆盖前者。
     */
    public static Map<String, JsonNode> groupBy(JsonNode tree, String field) {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        List<List<String>> paths = pathsForField(tree, field);
        if (paths.isEmpty()) {
            return out;
        }
        List<String> path = paths.get(0);
        JsonNode containers = path.size() > 1
                ? query(tree, path.subList(0, path.size() - 1))
                : tree;

        List<ObjectNode> groups = new ArrayList<>();
        collectObjects(containers, groups);
        for (ObjectNode group : groups) {
            JsonNode key = group.get(field);
            if (key == null || key.isContainerNode()) continue;
            out.put(key.asText(), group);
        }
        return out;
    }

    private static void collectObjects(JsonNode node, List<ObjectNode> out) {
        if (node == null) return;
        if (node.isObject()) {
            out.add((ObjectNode) node);
        } else if (node.isArray()) {
            for (JsonNode element : node) {
                collectObjects(element, out);
            }
        }
    }

    /**
     * 就地删除：定位 field 所在的上一层。
     * 上一层是映射时，值匹配就把 field 本身去掉；
     * 上一层是序列时，去掉 field 值在 values 中的那些元素。
     * values 中没有命中任何元素时什么都不改。
     */
    public static void delete(JsonNode tree, String field, Collection<?> values) {
        Set<JsonNode> targets = new HashSet<>();
        for (Object v : values) {
            targets.add(normalize(v));
        }
        if (targets.isEmpty()) return;

        List<List<String>> paths = pathsForField(tree, field);
        if (paths.isEmpty()) return;
        List<String> path = paths.get(0);

        if (path.size() == 1) {
            // field 就在根上
            dropFrom(tree, field, targets);
            return;
        }

        List<String> backPath = path.subList(0, path.size() - 1);
        String backField = backPath.get(backPath.size() - 1);
        for (ObjectNode holder : pointersTo(tree, backPath)) {
            JsonNode held = holder.get(backField);
            if (held == null) continue;
            if (held.isObject()) {
                dropFrom(held, field, targets);
            } else if (held.isArray()) {
                holder.set(backField, filtered((ArrayNode) held, field, targets));
            }
        }
    }

    public static void deleteValue(JsonNode tree, String field, Object value) {
        delete(tree, field, List.of(value));
    }

    private static void dropFrom(JsonNode container, String field, Set<JsonNode> targets) {
        if (container.isObject()) {
            JsonNode v = container.get(field);
            if (v != null && targets.contains(normalize(v))) {
                ((ObjectNode) container).remove(field);
            }
        } else if (container.isArray()) {
            ArrayNode array = (ArrayNode) container;
            ArrayNode kept = filtered(array, field, targets);
            array.removeAll();
            array.addAll(kept);
        }
    }

    private static ArrayNode filtered(ArrayNode array, String field, Set<JsonNode> targets) {
        ArrayNode kept = JsonNodeFactory.instance.arrayNode();
        for (JsonNode element : array) {
            JsonNode v = element.isObject() ? element.get(field) : null;
            if (v != null && targets.contains(normalize(v))) {
                continue;
            }
            kept.add(element);
        }
        return kept;
    }

    /**
     * 返回直接持有 path 最后一个 key 的那些映射（引用，不是拷贝），用于定点修改。
     */
    public static List<ObjectNode> pointersTo(JsonNode tree, List<String> path) {
        List<ObjectNode> out = new ArrayList<>();
        if (path.isEmpty()) return out;
        Set<ObjectNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        collectPointers(tree, path, out, seen);
        return out;
    }

    /**
     * {@link #pointersTo} 的便捷版：先找到 field 的第一条路径
     */
    public static List<ObjectNode> pointersToField(JsonNode tree, String field) {
        List<List<String>> paths = pathsForField(tree, field);
        if (paths.isEmpty()) return new ArrayList<>();
        return pointersTo(tree, paths.get(0));
    }

    private static void collectPointers(JsonNode node, List<String> path,
                                        List<ObjectNode> out, Set<ObjectNode> seen) {
        if (node == null) return;
        if (node.isArray()) {
            for (JsonNode element : node) {
                collectPointers(element, path, out, seen);
            }
        } else if (node.isObject()) {
            JsonNode branch = node.get(path.get(0));
            if (branch == null) return;
            if (path.size() > 1) {
                collectPointers(branch, path.subList(1, path.size()), out, seen);
            } else if (seen.add((ObjectNode) node)) {
                out.add((ObjectNode) node);
            }
        }
    }

    // -------------------- 值辅助 --------------------

    public static ArrayNode emptySequence() {
        return JsonNodeFactory.instance.arrayNode();
    }

    /** 把 select 得到的嵌套序列压平成标量列表 */
    public static List<JsonNode> scalars(JsonNode node) {
        List<JsonNode> out = new ArrayList<>();
        flatten(node, out);
        return out;
    }

    private static void flatten(JsonNode node, List<JsonNode> out) {
        if (node == null || node.isMissingNode()) return;
        if (node.isArray()) {
            for (JsonNode element : node) {
                flatten(element, out);
            }
        } else if (node.isValueNode()) {
            out.add(node);
        }
    }

    /** 压平后只保留整数值 */
    public static List<Long> longs(JsonNode node) {
        List<Long> out = new ArrayList<>();
        for (JsonNode v : scalars(node)) {
            if (v.isIntegralNumber() && v.canConvertToLong()) {
                out.add(v.asLong());
            }
        }
        return out;
    }

    /**
     * 比较用的规范形式：不管 JSON 里是 int 还是 long，整数都按 long 比较。
     */
    static JsonNode normalize(Object v) {
        if (v == null) return NullNode.getInstance();
        if (v instanceof JsonNode) {
            JsonNode n = (JsonNode) v;
            if (n.isIntegralNumber() && n.canConvertToLong()) return LongNode.valueOf(n.asLong());
            if (n.isFloatingPointNumber()) return DoubleNode.valueOf(n.asDouble());
            return n;
        }
        if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return LongNode.valueOf(((Number) v).longValue());
        }
        if (v instanceof BigInteger) {
            BigInteger b = (BigInteger) v;
            return b.bitLength() < 64 ? LongNode.valueOf(b.longValue())
                    : JsonNodeFactory.instance.numberNode(b);
        }
        if (v instanceof Number) return DoubleNode.valueOf(((Number) v).doubleValue());
        if (v instanceof Boolean) return BooleanNode.valueOf((Boolean) v);
        return TextNode.valueOf(v.toString());
    }

    private static List<String> append(List<String> prefix, String key) {
        List<String> path = new ArrayList<>(prefix.size() + 1);
        path.addAll(prefix);
        path.add(key);
        return Collections.unmodifiableList(path);
    }
}
