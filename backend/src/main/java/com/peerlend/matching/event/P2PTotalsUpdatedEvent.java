package com.peerlend.matching.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.math.BigDecimal;

/**
 * Total P2P volumes of a market changed (P2P-index units).
 */
@Getter
public class P2PTotalsUpdatedEvent extends ApplicationEvent {

    private final String underlying;
    private final BigDecimal scaledTotalSupplyP2P;
    private final BigDecimal scaledTotalBorrowP2P;

    public P2PTotalsUpdatedEvent(Object source, String underlying,
                                 BigDecimal scaledTotalSupplyP2P, BigDecimal scaledTotalBorrowP2P) {
        super(source);
        this.underlying = underlying;
        this.scaledTotalSupplyP2P = scaledTotalSupplyP2P;
        this.scaledTotalBorrowP2P = scaledTotalBorrowP2P;
    }
}
