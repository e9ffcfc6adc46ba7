package com.peerlend.matching.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.math.BigDecimal;

/**
 * Supplied, borrowed, repaid or withdrawn. amount is in underlying units; balances are the
 * resulting scaled balances of onBehalf (pool-index and P2P-index units).
 */
@Getter
public class LiquidityActionEvent extends ApplicationEvent {

    public enum Type {
        SUPPLIED,
        BORROWED,
        REPAID,
        WITHDRAWN
    }

    private final Type type;
    private final String from;
    private final String onBehalf;
    private final String underlying;
    private final BigDecimal amount;
    private final BigDecimal scaledOnPool;
    private final BigDecimal scaledInP2P;

    public LiquidityActionEvent(Object source, Type type, String from, String onBehalf, String underlying,
                                BigDecimal amount, BigDecimal scaledOnPool, BigDecimal scaledInP2P) {
        super(source);
        this.type = type;
        this.from = from;
        this.onBehalf = onBehalf;
        this.underlying = underlying;
        this.amount = amount;
        this.scaledOnPool = scaledOnPool;
        this.scaledInP2P = scaledInP2P;
    }
}
