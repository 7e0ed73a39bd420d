package com.example.floodlog.parser;

import com.example.floodlog.model.RecordStore;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class ParseResult {

    private final RecordStore store;
    private final ParseReport report;

    public List<ParseWarning> getWarnings() {
        return report.getWarnings();
    }
}
