package com.peerlend.matching.error;

import lombok.Getter;

/**
 * Base of every rejection raised by the engine. The action is aborted and no ledger change survives.
 * errorCode is stable and surfaced unchanged to callers (e.g. SUPPLY_IS_PAUSED, BORROW_CAP_EXCEEDED).
 */
@Getter
public abstract class MatchingEngineException extends RuntimeException {

    private final String errorCode;

    protected MatchingEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
