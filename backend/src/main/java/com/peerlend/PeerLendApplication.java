package com.peerlend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Runs the matching engine with its read side. The host provides the {@link com.peerlend.pool.LendingPool}
 * and {@link com.peerlend.risk.RiskEngine} beans (and optionally a {@link com.peerlend.risk.PriceOracleSentinel}).
 */
@SpringBootApplication
public class PeerLendApplication {

    public static void main(String[] args) {
        SpringApplication.run(PeerLendApplication.class, args);
    }
}
