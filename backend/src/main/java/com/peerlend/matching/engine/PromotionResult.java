package com.peerlend.matching.engine;

import java.math.BigDecimal;

/**
 * @param promoted       volume moved from pool to P2P (underlying units)
 * @param remaining      part of the requested amount left for the pool
 * @param iterationsLeft unused part of the iteration budget
 */
public record PromotionResult(BigDecimal promoted, BigDecimal remaining, int iterationsLeft) {
}
