package com.peerlend.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Per-underlying configuration and peer-to-peer state. Created once, mutated by every accounting action.
 * idleSupply is P2P supply held back from the pool because its supply cap was reached (underlying units).
 */
@NoArgsConstructor
@Getter
@Setter
public class Market {

    private String underlying;
    private Deltas deltas = new Deltas();
    private BigDecimal idleSupply = BigDecimal.ZERO;
    private Indexes indexes = Indexes.genesis();
    private boolean p2pDisabled;
    private boolean deprecated;
    /** Whether suppliers may use this asset as collateral. */
    private boolean collateral;
    private int eModeCategoryId;
    private Instant createdAt;
    private Instant lastUpdatedAt;

    private Set<MarketAction> pausedActions = EnumSet.noneOf(MarketAction.class);

    public boolean isPaused(MarketAction action) {
        return pausedActions.contains(action);
    }

    public void setPaused(MarketAction action, boolean paused) {
        if (paused) {
            pausedActions.add(action);
        } else {
            pausedActions.remove(action);
        }
    }

    public Market copy() {
        Market copy = new Market();
        copy.underlying = underlying;
        copy.deltas = deltas.copy();
        copy.idleSupply = idleSupply;
        copy.indexes = indexes;
        copy.p2pDisabled = p2pDisabled;
        copy.deprecated = deprecated;
        copy.collateral = collateral;
        copy.eModeCategoryId = eModeCategoryId;
        copy.createdAt = createdAt;
        copy.lastUpdatedAt = lastUpdatedAt;
        copy.pausedActions = pausedActions.isEmpty()
                ? EnumSet.noneOf(MarketAction.class)
                : EnumSet.copyOf(pausedActions);
        return copy;
    }
}
