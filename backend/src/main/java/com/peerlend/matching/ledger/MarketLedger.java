package com.peerlend.matching.ledger;

import com.peerlend.domain.Market;
import com.peerlend.domain.MarketBalances;
import com.peerlend.domain.MarketState;
import com.peerlend.domain.UserMarkets;
import com.peerlend.matching.error.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Committed state of every market and every user's market memberships.
 * <p>
 * Actions never touch committed objects: {@link #begin} hands out deep copies and {@link #commit}
 * swaps them in, so an aborted action leaves the ledger as it was and readers on other threads only
 * ever see whole actions. Actions themselves are serialized by the host.
 */
@Component
@Slf4j
public class MarketLedger {

    private final Map<String, MarketState> markets = new ConcurrentHashMap<>();
    private final Map<String, UserMarkets> userMarkets = new ConcurrentHashMap<>();

    /**
     * @throws InvalidInputException MARKET_ALREADY_CREATED if the underlying already has a market
     */
    public MarketState createMarket(String underlying, boolean collateral, int eModeCategoryId) {
        if (underlying == null || underlying.isBlank()) {
            throw new InvalidInputException(InvalidInputException.ADDRESS_IS_ZERO, "underlying is required");
        }
        Market market = new Market();
        market.setUnderlying(underlying);
        market.setCollateral(collateral);
        market.setEModeCategoryId(eModeCategoryId);
        market.setCreatedAt(Instant.now());
        market.setLastUpdatedAt(market.getCreatedAt());
        MarketState state = new MarketState(market, new MarketBalances());
        if (markets.putIfAbsent(underlying, state) != null) {
            throw new InvalidInputException(InvalidInputException.MARKET_ALREADY_CREATED,
                    "Market already created: " + underlying);
        }
        log.info("Market created for {} (collateral={}, eMode={})", underlying, collateral, eModeCategoryId);
        return state;
    }

    /**
     * Applies an administrative change (pause flags, P2P switch, deprecation) as its own unit of work.
     */
    public void configureMarket(String underlying, Consumer<Market> change) {
        MarketState committed = require(underlying);
        MarketState working = committed.copy();
        change.accept(working.market());
        markets.put(underlying, working);
    }

    public Optional<MarketState> find(String underlying) {
        return underlying == null ? Optional.empty() : Optional.ofNullable(markets.get(underlying));
    }

    public Set<String> underlyings() {
        return Set.copyOf(markets.keySet());
    }

    /**
     * Committed memberships of the user; an empty record when the user never interacted.
     */
    public UserMarkets userMarkets(String user) {
        UserMarkets committed = userMarkets.get(user);
        return committed != null ? committed : new UserMarkets(user);
    }

    /**
     * Opens a unit of work on {@code underlying} for the acting {@code user}.
     *
     * @throws InvalidInputException MARKET_NOT_CREATED if the market does not exist
     */
    public ActionContext begin(String underlying, String user) {
        MarketState committed = require(underlying);
        return new ActionContext(underlying, committed.copy(), userMarkets(user).copy());
    }

    /**
     * Makes the unit of work's state the committed state.
     *
     * @return the newly committed market state
     */
    public MarketState commit(ActionContext context) {
        markets.put(context.getUnderlying(), context.getState());
        UserMarkets memberships = context.getUserMarkets();
        userMarkets.put(memberships.getUser(), memberships);
        return context.getState();
    }

    private MarketState require(String underlying) {
        return find(underlying).orElseThrow(() -> new InvalidInputException(
                InvalidInputException.MARKET_NOT_CREATED, "Market not created: " + underlying));
    }
}
