package com.peerlend.matching.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Engine-wide matching and risk settings. Iteration defaults apply when the caller does not pass its own budget.
 */
@ConfigurationProperties(prefix = "peerlend.matching")
@NoArgsConstructor
@Getter
@Setter
public class MatchingProperties {

    private Iterations defaultIterations = new Iterations();

    /** Risk category (e-mode) of the engine's pool account. 0 = none, borrows of any category allowed. */
    private int riskCategoryId;

    private Liquidation liquidation = new Liquidation();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Iterations {
        private int supply = 10;
        private int borrow = 10;
        private int repay = 10;
        private int withdraw = 10;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Liquidation {

        /** Below this health factor the default close factor applies only if the sentinel allows it. */
        private BigDecimal defaultThreshold = BigDecimal.ONE;

        /** Below this health factor the whole debt is liquidatable. */
        private BigDecimal minThreshold = new BigDecimal("0.95");

        private BigDecimal defaultCloseFactor = new BigDecimal("0.5");

        private BigDecimal maxCloseFactor = BigDecimal.ONE;
    }
}
