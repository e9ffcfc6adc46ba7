package com.peerlend.matching.engine;

import java.math.BigDecimal;

/**
 * Volume moved by one queue walk (underlying units) and the number of counterparts visited.
 */
public record MatchingOutcome(BigDecimal processed, int iterations) {

    static MatchingOutcome none() {
        return new MatchingOutcome(BigDecimal.ZERO, 0);
    }
}
