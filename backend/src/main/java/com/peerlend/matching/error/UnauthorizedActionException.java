package com.peerlend.matching.error;

/**
 * Risk checks refused the action: health factor, borrowing disabled, risk category, liquidation bands.
 */
public class UnauthorizedActionException extends MatchingEngineException {

    public static final String UNAUTHORIZED_BORROW = "UNAUTHORIZED_BORROW";
    public static final String UNAUTHORIZED_WITHDRAW = "UNAUTHORIZED_WITHDRAW";
    public static final String UNAUTHORIZED_LIQUIDATE = "UNAUTHORIZED_LIQUIDATE";
    public static final String BORROWING_NOT_ENABLED = "BORROWING_NOT_ENABLED";
    public static final String INCONSISTENT_E_MODE = "INCONSISTENT_E_MODE";
    public static final String ASSET_NOT_COLLATERAL = "ASSET_NOT_COLLATERAL";

    public UnauthorizedActionException(String errorCode, String message) {
        super(errorCode, message);
    }
}
