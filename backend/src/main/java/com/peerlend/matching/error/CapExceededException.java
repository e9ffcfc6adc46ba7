package com.peerlend.matching.error;

import com.peerlend.domain.MarketSide;

import java.math.BigDecimal;

/**
 * Requested amount would push the side's total (P2P + pool) above the pool's cap.
 */
public class CapExceededException extends MatchingEngineException {

    public static final String SUPPLY_CAP_EXCEEDED = "SUPPLY_CAP_EXCEEDED";
    public static final String BORROW_CAP_EXCEEDED = "BORROW_CAP_EXCEEDED";

    public CapExceededException(MarketSide side, String underlying, BigDecimal projected, BigDecimal cap) {
        super(side == MarketSide.SUPPLY ? SUPPLY_CAP_EXCEEDED : BORROW_CAP_EXCEEDED,
                side + " cap exceeded on " + underlying + ": projected " + projected.toPlainString()
                        + " > cap " + cap.toPlainString());
    }
}
