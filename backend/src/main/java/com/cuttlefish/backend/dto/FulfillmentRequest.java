package com.cuttlefish.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FulfillmentRequest {

    // hex encoded, 0x prefix optional
    private String response;

    private String error;
}
