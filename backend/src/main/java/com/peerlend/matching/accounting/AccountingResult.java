package com.peerlend.matching.accounting;

import java.math.BigDecimal;

/**
 * Outcome of accounting one supply, borrow, repay or withdraw.
 *
 * @param toPool       part of the user's amount settled against their own pool position
 * @param toPeer       part settled peer-to-peer (matched, delta, idle or broken P2P)
 * @param pool         pool legs to execute
 * @param scaledOnPool resulting pool balance of the user on the action's side (pool-index units)
 * @param scaledInP2P  resulting P2P balance of the user on the action's side (P2P-index units)
 */
public record AccountingResult(
        BigDecimal toPool,
        BigDecimal toPeer,
        PoolOperations pool,
        BigDecimal scaledOnPool,
        BigDecimal scaledInP2P
) {
}
