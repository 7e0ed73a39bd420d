package com.example.floodlog.parser;

import com.example.floodlog.model.AppStats;
import com.example.floodlog.model.FloodRecord;
import com.example.floodlog.model.NodeRecord;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个节点的解析状态。看到启动标志时新建一个（覆盖之前的）。
 */
@Getter
class NodeSession {

    private final String nodeId;
    private final long startLine;

    private final List<Long> broadcast = new ArrayList<>();
    /** seqno -> flood，保持第一次出现的顺序 */
    private final Map<Long, FloodRecord> floods = new LinkedHashMap<>();
    private final Map<String, Long> glossyStats = new LinkedHashMap<>();

    private long syncCount;
    private long desyncCount;
    private final List<Long> epochRtimer = new ArrayList<>();

    /** 最近一次 GLOSSY_PAYLOAD 打开的 flood */
    private FloodRecord currentFlood;

    NodeSession(String nodeId, long startLine) {
        this.nodeId = nodeId;
        this.startLine = startLine;
    }

    FloodRecord openFlood(long pktSeqno) {
        FloodRecord flood = new FloodRecord(pktSeqno);
        floods.put(pktSeqno, flood);
        currentFlood = flood;
        return flood;
    }

    void incrementSync() {
        syncCount++;
    }

    void incrementDesync() {
        desyncCount++;
    }

    NodeRecord toRecord() {
        NodeRecord r = new NodeRecord(nodeId);
        r.setBroadcast(new ArrayList<>(broadcast));
        r.setFloods(new ArrayList<>(floods.values()));
        r.setGlossyStats(new LinkedHashMap<>(glossyStats));
        AppStats app = new AppStats();
        app.setSyncCount(syncCount);
        app.setDesyncCount(desyncCount);
        app.setEpochRtimer(new ArrayList<>(epochRtimer));
        r.setAppStats(app);
        return r;
    }
}
