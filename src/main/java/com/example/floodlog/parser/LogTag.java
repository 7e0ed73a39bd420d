package com.example.floodlog.parser;

/**
 * 固件打印的日志标签
 */
public enum LogTag {
    /** GLOSSY_STATS、GLOSSY_STATS_0 ... 都归到这里 */
    GLOSSY_STATS("GLOSSY_STATS"),
    GLOSSY_PAYLOAD("GLOSSY_PAYLOAD"),
    GLOSSY_FLOOD_DEBUG("GLOSSY_FLOOD_DEBUG"),
    GLOSSY_BROADCAST("GLOSSY_BROADCAST"),
    APP_STATS("APP_STATS"),
    APP_DEBUG("APP_DEBUG"),
    APP_INFO("APP_INFO"),
    UNKNOWN("");

    private final String label;

    LogTag(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static LogTag fromLabel(String label) {
        if (label == null) {
            return UNKNOWN;
        }
        if (label.startsWith(GLOSSY_STATS.label)) {
            return GLOSSY_STATS;
        }
        for (LogTag t : values()) {
            if (t != UNKNOWN && t != GLOSSY_STATS && t.label.equals(label)) {
                return t;
            }
        }
        return UNKNOWN;
    }
}
