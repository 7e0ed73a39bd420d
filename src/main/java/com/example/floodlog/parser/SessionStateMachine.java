package com.example.floodlog.parser;

import com.example.floodlog.exception.LogParseException;
import com.example.floodlog.model.FloodRecord;
import com.example.floodlog.model.NodeRecord;
import com.example.floodlog.model.StoreKeys;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按文件顺序消费分类后的行，每个 node id 维护一份 {@link NodeSession}。
 *
 * 约定（与固件打印顺序一致）：
 * 1. "Starting Glossy" 出现在该节点其他日志之前；
 * 2. GLOSSY_PAYLOAD 先于对应 flood 的 GLOSSY_FLOOD_DEBUG / APP_STATS 打印。
 * 违反约定的行按警告处理并丢弃，唯一例外是 GLOSSY_BROADCAST 解析失败，直接中止。
 */
public class SessionStateMachine {

    static final Pattern RCVD_SEQ = Pattern.compile("rcvd_seq\\s*(\\d+)");
    static final Pattern SENT_SEQ = Pattern.compile("\\s*sent_seq\\s+(\\d+),\\s+payload_len\\s+\\d+");
    static final Pattern APP_TRX = Pattern.compile("\\s*n_rx\\s+(\\d+),\\s*n_tx\\s+(\\d+),");
    static final Pattern EPOCH_DIFF = Pattern.compile("Epoch_diff\\s+rtimer\\s+(\\d+)");

    static final String SYNC = "Synced";
    static final String NO_SYNC = "Not Synced";
    static final String EPOCH_PREFIX = "epoch_diff";

    private final StatPairParser statParser;
    private final ParseReport report;

    private final Map<String, NodeSession> sessions = new LinkedHashMap<>();
    private final Set<String> unmanagedTags = new HashSet<>();

    public SessionStateMachine(Set<String> allowedStatKeys, ParseReport report) {
        this.statParser = new StatPairParser(allowedStatKeys);
        this.report = report;
    }

    public void accept(ClassifiedLine line) {
        String nodeId = line.getNodeId();

        if (line.isSessionStart()) {
            if (sessions.containsKey(nodeId)) {
                report.log().debug("Node {} restarted at line {}, previous session dropped", nodeId, line.getLineNo());
            }
            sessions.put(nodeId, new NodeSession(nodeId, line.getLineNo()));
            return;
        }

        NodeSession session = sessions.get(nodeId);
        if (session == null) {
            report.note(WarningKind.INACTIVE_NODE, line.getLineNo(), nodeId, "[" + line.getTag() + "] " + line.getContent());
            return;
        }

        String content = line.getContent();
        switch (LogTag.fromLabel(line.getTag())) {
            case GLOSSY_STATS:
                onGlossyStats(session, line, content);
                break;
            case GLOSSY_PAYLOAD:
                onPayload(session, line, content);
                break;
            case GLOSSY_FLOOD_DEBUG:
                onFloodDebug(session, line, content);
                break;
            case GLOSSY_BROADCAST:
                onBroadcast(session, line, content);
                break;
            case APP_STATS:
                onAppStats(session, line, content);
                break;
            case APP_DEBUG:
                onAppDebug(session, line, content);
                break;
            case APP_INFO:
                report.log().debug("Failed to init flood at node {}. Retrying on next slot", nodeId);
                break;
            default:
                if (unmanagedTags.add(line.getTag())) {
                    report.note(WarningKind.UNMANAGED_TAG, line.getLineNo(), nodeId, line.getTag());
                }
        }
    }

    // 周期性打印的是全量计数，后出现的直接覆盖
    private void onGlossyStats(NodeSession session, ClassifiedLine line, String content) {
        StatPairParser.Result r = statParser.parse(content);
        if (!r.isAccepted()) {
            report.note(r.getRejection(), line.getLineNo(), session.getNodeId(), r.getDetail() + ". Dropping log: " + content);
            return;
        }
        session.getGlossyStats().putAll(r.getPairs());
    }

    private void onPayload(NodeSession session, ClassifiedLine line, String content) {
        Matcher m = RCVD_SEQ.matcher(content);
        if (!m.lookingAt()) {
            report.warn(WarningKind.MALFORMED_PAYLOAD, line.getLineNo(), session.getNodeId(), content);
            return;
        }
        Long seqno = parseLong(m.group(1));
        if (seqno == null) {
            report.warn(WarningKind.MALFORMED_PAYLOAD, line.getLineNo(), session.getNodeId(), content);
            return;
        }
        session.openFlood(seqno);
    }

    private void onFloodDebug(NodeSession session, ClassifiedLine line, String content) {
        FloodRecord flood = session.getCurrentFlood();
        if (flood == null) {
            report.warn(WarningKind.NO_CURRENT_FLOOD, line.getLineNo(), session.getNodeId(), content);
            return;
        }
        StatPairParser.Result r = statParser.parse(content);
        if (!r.isAccepted()) {
            report.note(r.getRejection(), line.getLineNo(), session.getNodeId(), r.getDetail() + ". Dropping log: " + content);
            return;
        }
        r.getPairs().forEach(flood::put);
    }

    private void onBroadcast(NodeSession session, ClassifiedLine line, String content) {
        Matcher m = SENT_SEQ.matcher(content);
        Long seqno = m.lookingAt() ? parseLong(m.group(1)) : null;
        if (seqno == null) {
            throw new LogParseException("Invalid GLOSSY_BROADCAST content at node "
                    + session.getNodeId() + ", cannot capture pkt seqno: " + content, line.getLineNo());
        }
        session.getBroadcast().add(seqno);
    }

    private void onAppStats(NodeSession session, ClassifiedLine line, String content) {
        Matcher m = APP_TRX.matcher(content);
        Long nrx = m.lookingAt() ? parseLong(m.group(1)) : null;
        Long ntx = nrx != null ? parseLong(m.group(2)) : null;
        if (ntx == null) {
            report.note(WarningKind.MALFORMED_APP_STATS, line.getLineNo(), session.getNodeId(),
                    "No matching n_tx, n_rx. Dropping log: " + content);
            return;
        }
        FloodRecord flood = session.getCurrentFlood();
        if (flood == null) {
            report.warn(WarningKind.NO_CURRENT_FLOOD, line.getLineNo(), session.getNodeId(), content);
            return;
        }
        flood.put(StoreKeys.N_TX, ntx);
        flood.put(StoreKeys.N_RX, nrx);
    }

    private void onAppDebug(NodeSession session, ClassifiedLine line, String content) {
        String s = content.strip();
        if (SYNC.equals(s)) {
            session.incrementSync();
        } else if (NO_SYNC.equals(s)) {
            session.incrementDesync();
        } else if (s.toLowerCase(Locale.ROOT).startsWith(EPOCH_PREFIX)) {
            Matcher m = EPOCH_DIFF.matcher(s);
            Long rtimer = m.lookingAt() ? parseLong(m.group(1)) : null;
            if (rtimer == null) {
                report.note(WarningKind.MALFORMED_EPOCH, line.getLineNo(), session.getNodeId(),
                        "No matching epoch diff info. Dropping log: " + s);
                return;
            }
            session.getEpochRtimer().add(rtimer);
        } else {
            report.note(WarningKind.UNMANAGED_APP_DEBUG, line.getLineNo(), session.getNodeId(), s);
        }
    }

    /**
     * 结束解析：做一次数据一致性检查（只告警），然后把所有会话转成 NodeRecord。
     */
    public List<NodeRecord> finish() {
        if (sessions.isEmpty()) {
            throw new LogParseException("No data has been collected, check out the log format!");
        }
        checkUniformity();

        List<NodeRecord> out = new ArrayList<>(sessions.size());
        for (NodeSession s : sessions.values()) {
            out.add(s.toRecord());
        }
        return out;
    }

    public int sessionCount() {
        return sessions.size();
    }

    private void checkUniformity() {
        Integer floodLen = null;
        boolean floodsOk = true;
        Integer glossyLen = null;
        boolean glossyOk = true;

        for (NodeSession s : sessions.values()) {
            for (FloodRecord f : s.getFloods().values()) {
                int n = f.getStats().size();
                if (floodLen == null) {
                    floodLen = n;
                } else if (floodLen != n) {
                    floodsOk = false;
                }
            }
            int g = s.getGlossyStats().size();
            if (g > 0) {
                if (glossyLen == null) {
                    glossyLen = g;
                } else if (glossyLen != g) {
                    glossyOk = false;
                }
            }
        }

        if (!floodsOk) {
            report.note(WarningKind.NON_UNIFORM_FLOODS, -1, null,
                    "Nodes have different amount of floods information.");
        }
        if (!glossyOk) {
            report.note(WarningKind.NON_UNIFORM_GLOSSY_STATS, -1, null,
                    "Nodes have different amount of glossy stats information");
        }
    }

    private static Long parseLong(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
