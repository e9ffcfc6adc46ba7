package com.peerlend.matching.event;

import com.peerlend.domain.MarketAction;
import com.peerlend.domain.MarketState;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per successful action, after its state was swapped into the ledger.
 * The committed state is never mutated afterwards, so async listeners may read it freely.
 * MarketSnapshotService consumes this to persist market_snapshots.
 */
@Getter
public class ActionCommittedEvent extends ApplicationEvent {

    private final String underlying;
    private final MarketAction action;
    private final MarketState committedState;

    public ActionCommittedEvent(Object source, String underlying, MarketAction action, MarketState committedState) {
        super(source);
        this.underlying = underlying;
        this.action = action;
        this.committedState = committedState;
    }
}
