package com.example.floodlog.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

@Data
@AllArgsConstructor
public class TrxErrors {

    /** n_rx_err + rx_to */
    private Map<String, Long> errors;
    /** n_bad_length + n_bad_header + n_bad_payload */
    private Map<String, Long> badPackets;
}
