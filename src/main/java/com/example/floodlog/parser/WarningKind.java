package com.example.floodlog.parser;

/**
 * 解析过程中的非致命问题分类。出现后只记录日志，丢弃对应的行/记录，继续解析。
 */
public enum WarningKind {
    BROKEN_LABEL("BL", "标签缺少右括号，可能是被截断的行"),
    INACTIVE_NODE("IN", "节点还没有出现启动标志，丢弃"),
    UNKNOWN_STAT_KEY("UK", "统计行含未知 key，整行丢弃"),
    BAD_STAT_VALUE("BV", "统计值无法转成整数，整行丢弃"),
    NO_CURRENT_FLOOD("NF", "还没有收到包就出现了 flood 统计"),
    MALFORMED_PAYLOAD("MP", "GLOSSY_PAYLOAD 中没有 rcvd_seq"),
    MALFORMED_APP_STATS("MA", "APP_STATS 中没有 n_rx / n_tx"),
    MALFORMED_EPOCH("ME", "Epoch_diff 格式不对"),
    UNMANAGED_APP_DEBUG("UD", "APP_DEBUG 内容未处理"),
    UNMANAGED_TAG("UT", "未处理的标签"),
    NON_UNIFORM_FLOODS("NU", "各 flood 的统计项个数不一致"),
    NON_UNIFORM_GLOSSY_STATS("NG", "各节点 glossy_stats 个数不一致");

    private final String code;
    private final String desc;

    WarningKind(String code, String desc) {
        this.code = code;
        this.desc = desc;
    }

    public String getCode() {
        return code;
    }

    public String getDesc() {
        return desc;
    }
}
