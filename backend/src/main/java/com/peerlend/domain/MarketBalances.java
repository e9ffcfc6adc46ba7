package com.peerlend.domain;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Scaled user balances of one market: pool and P2P queues for both sides, plus collateral
 * (pool-index units only, never matched peer-to-peer).
 */
public final class MarketBalances {

    private final MatchingQueue poolSuppliers;
    private final MatchingQueue p2pSuppliers;
    private final MatchingQueue poolBorrowers;
    private final MatchingQueue p2pBorrowers;
    private final Map<String, BigDecimal> collateral;

    public MarketBalances() {
        this(new MatchingQueue(), new MatchingQueue(), new MatchingQueue(), new MatchingQueue(), new HashMap<>());
    }

    private MarketBalances(MatchingQueue poolSuppliers, MatchingQueue p2pSuppliers,
                           MatchingQueue poolBorrowers, MatchingQueue p2pBorrowers,
                           Map<String, BigDecimal> collateral) {
        this.poolSuppliers = poolSuppliers;
        this.p2pSuppliers = p2pSuppliers;
        this.poolBorrowers = poolBorrowers;
        this.p2pBorrowers = p2pBorrowers;
        this.collateral = collateral;
    }

    public MatchingQueue pool(MarketSide side) {
        return side == MarketSide.SUPPLY ? poolSuppliers : poolBorrowers;
    }

    public MatchingQueue p2p(MarketSide side) {
        return side == MarketSide.SUPPLY ? p2pSuppliers : p2pBorrowers;
    }

    public BigDecimal scaledPoolBalance(MarketSide side, String user) {
        return pool(side).valueOf(user);
    }

    public BigDecimal scaledP2PBalance(MarketSide side, String user) {
        return p2p(side).valueOf(user);
    }

    public BigDecimal scaledCollateral(String user) {
        return collateral.getOrDefault(user, BigDecimal.ZERO);
    }

    public void setScaledCollateral(String user, BigDecimal value) {
        if (value.signum() == 0) {
            collateral.remove(user);
        } else {
            collateral.put(user, value);
        }
    }

    public Map<String, BigDecimal> collateralBalances() {
        return Collections.unmodifiableMap(collateral);
    }

    public MarketBalances copy() {
        return new MarketBalances(poolSuppliers.copy(), p2pSuppliers.copy(),
                poolBorrowers.copy(), p2pBorrowers.copy(), new HashMap<>(collateral));
    }
}
