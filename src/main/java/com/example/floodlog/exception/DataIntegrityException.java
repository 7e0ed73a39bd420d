package com.example.floodlog.exception;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 实验数据本身不一致：清洗后发送集合与接收集合对不上，
 * 或者某节点收到了没有任何节点发送过的包。
 * 与 {@link LogParseException} 分开，批量处理时调用方通常直接中止。
 */
public class DataIntegrityException extends RuntimeException {

    private final Set<Long> seqnos;

    public DataIntegrityException(String message, Set<Long> seqnos) {
        super(message + ": " + new TreeSet<>(seqnos));
        this.seqnos = Collections.unmodifiableSet(new TreeSet<>(seqnos));
    }

    /** 出问题的 seqno（例如发送/接收集合的对称差） */
    public Set<Long> getSeqnos() {
        return seqnos;
    }
}
