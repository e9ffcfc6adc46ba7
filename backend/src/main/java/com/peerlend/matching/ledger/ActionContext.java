package com.peerlend.matching.ledger;

import com.peerlend.domain.Indexes;
import com.peerlend.domain.Market;
import com.peerlend.domain.MarketBalances;
import com.peerlend.domain.MarketState;
import com.peerlend.domain.UserMarkets;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Unit of work of one action: private copies of the market state and of the acting user's
 * market memberships, the indexes of the moment, and the observations recorded so far.
 * Nothing here is visible to the ledger until {@link MarketLedger#commit(ActionContext)}.
 */
@Getter
public class ActionContext {

    private final String underlying;
    private final MarketState state;
    private final UserMarkets userMarkets;
    private Indexes indexes;
    private final List<ApplicationEvent> pendingEvents = new ArrayList<>();

    ActionContext(String underlying, MarketState state, UserMarkets userMarkets) {
        this.underlying = underlying;
        this.state = state;
        this.userMarkets = userMarkets;
        this.indexes = state.market().getIndexes();
    }

    public Market market() {
        return state.market();
    }

    public MarketBalances balances() {
        return state.balances();
    }

    /**
     * Moves the market to the indexes of the moment.
     *
     * @throws IllegalStateException if any index is lower than the market's last seen value
     */
    public void applyIndexes(Indexes updated) {
        Indexes previous = market().getIndexes();
        if (!updated.isNotBelow(previous)) {
            throw new IllegalStateException("Indexes of " + underlying + " decreased: " + previous + " -> " + updated);
        }
        market().setIndexes(updated);
        market().setLastUpdatedAt(Instant.now());
        this.indexes = updated;
    }

    public void record(ApplicationEvent event) {
        pendingEvents.add(event);
    }

    public List<ApplicationEvent> pendingEvents() {
        return Collections.unmodifiableList(pendingEvents);
    }
}
