package com.peerlend.matching.positions;

import com.peerlend.matching.accounting.PoolOperations;

import java.math.BigDecimal;

/**
 * Result of supply, borrow, repay or withdraw, in underlying units except the scaled balances.
 *
 * @param toPool   part settled against the user's pool position
 * @param toPeer   part settled peer-to-peer
 * @param onPool   user's resulting pool balance on the action's side
 * @param inP2P    user's resulting P2P balance on the action's side
 * @param pool     pool legs the caller executes to settle the action
 */
public record ActionResult(
        BigDecimal toPool,
        BigDecimal toPeer,
        BigDecimal onPool,
        BigDecimal inP2P,
        BigDecimal scaledOnPool,
        BigDecimal scaledInP2P,
        PoolOperations pool
) {
}
