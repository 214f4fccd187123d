package com.cuttlefish.backend.exception;

import com.cuttlefish.backend.model.RejectReason;
import lombok.Getter;

/**
 * A gate refused the request. Nothing was committed; the caller may resubmit once the condition
 * behind {@link #getReason()} has changed.
 */
@Getter
public class TradeRejectedException extends TradingException {

    private final RejectReason reason;

    public TradeRejectedException(RejectReason reason) {
        super(reason.getMessage());
        this.reason = reason;
    }

    public TradeRejectedException(RejectReason reason, String detail) {
        super(detail == null || detail.isBlank() ? reason.getMessage() : reason.getMessage() + ": " + detail);
        this.reason = reason;
    }
}
