package com.peerlend.matching.event;

import com.peerlend.domain.MarketSide;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.math.BigDecimal;

/**
 * A counterpart was promoted to or demoted from P2P while matching someone else's action.
 */
@Getter
public class PositionUpdatedEvent extends ApplicationEvent {

    private final MarketSide side;
    private final String user;
    private final String underlying;
    private final BigDecimal scaledOnPool;
    private final BigDecimal scaledInP2P;

    public PositionUpdatedEvent(Object source, MarketSide side, String user, String underlying,
                                BigDecimal scaledOnPool, BigDecimal scaledInP2P) {
        super(source);
        this.side = side;
        this.user = user;
        this.underlying = underlying;
        this.scaledOnPool = scaledOnPool;
        this.scaledInP2P = scaledInP2P;
    }
}
