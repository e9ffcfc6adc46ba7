package com.peerlend.matching.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.math.BigDecimal;

@Getter
public class CollateralActionEvent extends ApplicationEvent {

    public enum Type {
        SUPPLIED,
        WITHDRAWN
    }

    private final Type type;
    private final String from;
    private final String onBehalf;
    private final String underlying;
    private final BigDecimal amount;
    /** Resulting collateral balance of onBehalf, pool-index units. */
    private final BigDecimal scaledCollateral;

    public CollateralActionEvent(Object source, Type type, String from, String onBehalf, String underlying,
                                 BigDecimal amount, BigDecimal scaledCollateral) {
        super(source);
        this.type = type;
        this.from = from;
        this.onBehalf = onBehalf;
        this.underlying = underlying;
        this.amount = amount;
        this.scaledCollateral = scaledCollateral;
    }
}
