package com.peerlend.matching.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.math.BigDecimal;

@Getter
public class IdleSupplyUpdatedEvent extends ApplicationEvent {

    private final String underlying;
    private final BigDecimal idleSupply;

    public IdleSupplyUpdatedEvent(Object source, String underlying, BigDecimal idleSupply) {
        super(source);
        this.underlying = underlying;
        this.idleSupply = idleSupply;
    }
}
