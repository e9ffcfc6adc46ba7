package com.peerlend.matching.error;

/**
 * Zero address, zero amount, unknown market or empty position.
 */
public class InvalidInputException extends MatchingEngineException {

    public static final String ADDRESS_IS_ZERO = "ADDRESS_IS_ZERO";
    public static final String AMOUNT_IS_ZERO = "AMOUNT_IS_ZERO";
    public static final String MARKET_NOT_CREATED = "MARKET_NOT_CREATED";
    public static final String MARKET_ALREADY_CREATED = "MARKET_ALREADY_CREATED";
    public static final String SUPPLY_IS_ZERO = "SUPPLY_IS_ZERO";
    public static final String DEBT_IS_ZERO = "DEBT_IS_ZERO";
    public static final String COLLATERAL_IS_ZERO = "COLLATERAL_IS_ZERO";

    public InvalidInputException(String errorCode, String message) {
        super(errorCode, message);
    }
}
