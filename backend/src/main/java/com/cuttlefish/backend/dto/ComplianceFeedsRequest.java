package com.cuttlefish.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceFeedsRequest {

    private String volatilityFeedId;

    private String regulatoryFeedId;
}
