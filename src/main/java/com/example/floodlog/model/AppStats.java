package com.example.floodlog.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 应用层统计：同步/失步次数 + epoch 时长采样（rtimer 单位）
 */
@Data
@JsonPropertyOrder({StoreKeys.N_SYNC, StoreKeys.N_NOSYNC, StoreKeys.EPOCH_RTIMER})
public class AppStats {

    @JsonProperty(StoreKeys.N_SYNC)
    private long syncCount;

    @JsonProperty(StoreKeys.N_NOSYNC)
    private long desyncCount;

    @JsonProperty(StoreKeys.EPOCH_RTIMER)
    private List<Long> epochRtimer = new ArrayList<>();
}
