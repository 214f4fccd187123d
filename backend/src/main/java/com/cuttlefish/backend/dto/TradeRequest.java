package com.cuttlefish.backend.dto;

import com.cuttlefish.backend.model.TradeCommand;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeRequest {

    @NotNull
    @Positive
    private BigInteger amountIn;

    @PositiveOrZero
    private BigInteger amountOutMin;

    @NotNull
    private Instant deadline;

    @Min(0)
    @Max(10_000)
    private int confidenceBps;

    public TradeCommand toCommand() {
        return new TradeCommand(amountIn, amountOutMin == null ? BigInteger.ZERO : amountOutMin, deadline, confidenceBps);
    }
}
