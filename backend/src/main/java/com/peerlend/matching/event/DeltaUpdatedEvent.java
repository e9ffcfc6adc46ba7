package com.peerlend.matching.event;

import com.peerlend.domain.MarketSide;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.math.BigDecimal;

/**
 * A side's P2P delta changed. scaledDelta is the new value in pool-index units.
 */
@Getter
public class DeltaUpdatedEvent extends ApplicationEvent {

    private final String underlying;
    private final MarketSide side;
    private final BigDecimal scaledDelta;

    public DeltaUpdatedEvent(Object source, String underlying, MarketSide side, BigDecimal scaledDelta) {
        super(source);
        this.underlying = underlying;
        this.side = side;
        this.scaledDelta = scaledDelta;
    }
}
