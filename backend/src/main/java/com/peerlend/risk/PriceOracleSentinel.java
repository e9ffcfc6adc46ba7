package com.peerlend.risk;

/**
 * Optional circuit breaker of the pool's oracle (e.g. during a sequencer outage).
 */
public interface PriceOracleSentinel {

    boolean isLiquidationAllowed();
}
