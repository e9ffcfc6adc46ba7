package com.peerlend.matching.error;

import com.peerlend.domain.MarketAction;
import lombok.Getter;

/**
 * The action type is paused on the market. Error code is {@code <ACTION>_IS_PAUSED}.
 */
@Getter
public class MarketPausedException extends MatchingEngineException {

    private final MarketAction action;

    public MarketPausedException(MarketAction action, String underlying) {
        super(action.name() + "_IS_PAUSED", action + " is paused on market " + underlying);
        this.action = action;
    }
}
