package com.peerlend.pool;

import com.peerlend.domain.ReserveConfiguration;

import java.math.BigDecimal;

/**
 * Read view of the external lending pool the engine falls back to.
 * Implemented by the deployment's pool adapter; token movements stay with the caller of the engine.
 */
public interface LendingPool {

    ReserveConfiguration reserveConfiguration(String underlying);

    /**
     * Total supplied to the pool for this underlying, all depositors included (underlying units).
     */
    BigDecimal totalSupplied(String underlying);

    /**
     * Total debt owed to the pool for this underlying, all borrowers included (underlying units).
     */
    BigDecimal totalBorrowed(String underlying);
}
