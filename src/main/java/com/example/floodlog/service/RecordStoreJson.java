package com.example.floodlog.service;

import com.example.floodlog.model.RecordStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * 记录树的 JSON 持久化。写出去的文件原样读回来应得到相同的树，
 * 整数统一读成 long，避免 int / long 节点类型不一致。
 */
@Component
public class RecordStoreJson {

    private static final Logger log = LoggerFactory.getLogger(RecordStoreJson.class);

    private final ObjectMapper objectMapper;

    public RecordStoreJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 写入 JSON 文件；扩展名不是 .json 时自动补上。返回实际写入的路径。
     */
    public Path save(RecordStore store, Path dest) throws IOException {
        Path target = withJsonExtension(dest);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        try (OutputStream os = Files.newOutputStream(target)) {
            objectMapper.writeValue(os, store.root());
        }
        log.debug("Record store saved to {}", target);
        return target;
    }

    public RecordStore load(Path source) throws IOException {
        if (source == null || !Files.exists(source)) {
            throw new IllegalArgumentException("json file not found: " + source);
        }
        JsonNode root;
        try (InputStream is = Files.newInputStream(source)) {
            root = objectMapper.reader()
                    .with(DeserializationFeature.USE_LONG_FOR_INTS)
                    .readTree(is);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("JSON file does not contain a record store object: " + source);
        }
        return new RecordStore((ObjectNode) root);
    }

    public String toJson(RecordStore store) throws IOException {
        return objectMapper.writeValueAsString(store.root());
    }

    static Path withJsonExtension(Path dest) {
        String name = dest.getFileName().toString();
        if (name.toLowerCase(Locale.ROOT).endsWith(".json")) {
            return dest;
        }
        return dest.resolveSibling(name + ".json");
    }
}
