package com.example.floodlog.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

@Data
@AllArgsConstructor
public class SyncCounters {

    private Map<String, Long> sync;
    private Map<String, Long> desync;
}
