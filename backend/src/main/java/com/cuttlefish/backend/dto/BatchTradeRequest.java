package com.cuttlefish.backend.dto;

import com.cuttlefish.backend.model.BatchTradeCommand;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchTradeRequest {

    @NotEmpty
    private List<BigInteger> amountsIn;

    @NotNull
    private List<BigInteger> amountsOutMin;

    @NotNull
    private Instant deadline;

    @Min(0)
    @Max(10_000)
    private int confidenceBps;

    public BatchTradeCommand toCommand() {
        return new BatchTradeCommand(amountsIn, amountsOutMin, deadline, confidenceBps);
    }
}
