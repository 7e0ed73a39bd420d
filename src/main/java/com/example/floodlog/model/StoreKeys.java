package com.example.floodlog.model;

import java.util.List;

/**
 * 记录树（RecordStore）里用到的固定 key，以及解析时允许出现的统计项名称。
 */
public final class StoreKeys {

    private StoreKeys() {}

    // ---------------- 树结构 key ----------------
    public static final String NODES        = "nodes";
    public static final String NODE         = "node";
    public static final String BROADCAST    = "broadcast";
    public static final String FLOODS       = "floods";
    public static final String GLOSSY_STATS = "glossy_stats";
    public static final String APP_STATS    = "app_stats";
    /** 清洗后写在根节点上，记录本次使用的 offset */
    public static final String TRIM_OFFSET  = "trim_offset";

    // ---------------- flood / 节点统计项 ----------------
    public static final String PKT_SEQNO          = "pkt_seqno";
    public static final String REF_RELAY_CNT      = "relay_cnt_t_ref";
    public static final String T_SLOT             = "T_slot";
    public static final String N_TX               = "n_tx";
    public static final String N_RX               = "n_rx";
    public static final String N_RX_ERR           = "n_rx_err";
    public static final String RX_TIMEOUT         = "rx_to";
    public static final String REL_CNT_FIRST_RX   = "relay_cnt_first_rx";
    public static final String BAD_LENGTH         = "n_bad_length";
    public static final String BAD_HEADER         = "n_bad_header";
    public static final String BAD_PAYLOAD        = "n_bad_payload";
    public static final String RF_ERROR           = "rf_err";
    public static final String CRC_ERROR          = "bad_crc";

    // ---------------- app 统计项 ----------------
    public static final String N_SYNC       = "n_sync";
    public static final String N_NOSYNC     = "n_nosync";
    public static final String EPOCH_RTIMER = "epoch_rtimer";

    public static final List<String> FLOOD_KEYS = List.of(
            "n_T_slots", T_SLOT, REF_RELAY_CNT, "tref_ts", "T_slot_estimated");

    public static final List<String> GLOSSY_KEYS = List.of(
            N_RX, N_TX, REL_CNT_FIRST_RX, BAD_LENGTH, BAD_HEADER, BAD_PAYLOAD);

    public static final List<String> ERROR_KEYS = List.of(
            N_RX_ERR, RX_TIMEOUT, CRC_ERROR, RF_ERROR);

    /** 默认允许的统计项：FLOOD_KEYS + GLOSSY_KEYS + ERROR_KEYS */
    public static final List<String> DEFAULT_STAT_KEYS = List.of(
            "n_T_slots", T_SLOT, REF_RELAY_CNT, "tref_ts", "T_slot_estimated",
            N_RX, N_TX, REL_CNT_FIRST_RX, BAD_LENGTH, BAD_HEADER, BAD_PAYLOAD,
            N_RX_ERR, RX_TIMEOUT, CRC_ERROR, RF_ERROR);
}
