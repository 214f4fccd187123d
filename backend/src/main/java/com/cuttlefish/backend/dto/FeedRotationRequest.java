package com.cuttlefish.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedRotationRequest {

    // blank clears the slot where the slot is optional
    private String feedId;
}
