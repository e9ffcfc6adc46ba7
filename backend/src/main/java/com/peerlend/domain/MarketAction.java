package com.peerlend.domain;

/**
 * Action types that can be paused independently on each market.
 */
public enum MarketAction {
    SUPPLY,
    SUPPLY_COLLATERAL,
    BORROW,
    REPAY,
    WITHDRAW,
    WITHDRAW_COLLATERAL,
    LIQUIDATE_COLLATERAL,
    LIQUIDATE_BORROW
}
