package com.example.floodlog.config;

import com.example.floodlog.model.StoreKeys;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Setter
@Getter
@Component
@ConfigurationProperties(prefix = "floodlog")
public class FloodLogProperties {

    /**
     * true: 每行带 testbed 前缀（时间戳 + logger + node id）；
     * false: 单进程原始日志，node id 固定 "0"
     */
    private boolean testbed = true;

    /** 清洗时按 seqno 排名首尾各丢弃的 flood 数，同时也是 epoch 采样首尾各丢弃的个数 */
    private int trimOffset = 20;

    /** GLOSSY_STATS / GLOSSY_FLOOD_DEBUG 中允许出现的统计项 */
    private List<String> statKeys = new ArrayList<>(StoreKeys.DEFAULT_STAT_KEYS);

    public Set<String> statKeySet() {
        if (statKeys == null || statKeys.isEmpty()) {
            return new LinkedHashSet<>(StoreKeys.DEFAULT_STAT_KEYS);
        }
        return new LinkedHashSet<>(statKeys);
    }
}
