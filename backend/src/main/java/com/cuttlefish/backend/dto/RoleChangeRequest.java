package com.cuttlefish.backend.dto;

import com.cuttlefish.backend.model.Capability;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoleChangeRequest {

    @NotBlank
    private String actor;

    @NotNull
    private Capability capability;
}
