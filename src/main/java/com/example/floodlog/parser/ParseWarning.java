package com.example.floodlog.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ParseWarning {

    private WarningKind kind;
    /** 行号，从 1 开始；数据校验类警告没有行号，为 -1 */
    private long lineNo;
    private String nodeId;
    private String message;
}
