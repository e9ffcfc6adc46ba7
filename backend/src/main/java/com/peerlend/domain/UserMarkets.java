package com.peerlend.domain;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Markets in which a user has collateral, and markets in which a user has debt.
 * Consumed by the risk engine when computing liquidity data.
 */
@Getter
public class UserMarkets {

    private final String user;
    private final Set<String> collaterals;
    private final Set<String> borrows;

    public UserMarkets(String user) {
        this(user, new LinkedHashSet<>(), new LinkedHashSet<>());
    }

    private UserMarkets(String user, Set<String> collaterals, Set<String> borrows) {
        this.user = user;
        this.collaterals = collaterals;
        this.borrows = borrows;
    }

    public Set<String> collateralMarkets() {
        return Collections.unmodifiableSet(collaterals);
    }

    public Set<String> borrowMarkets() {
        return Collections.unmodifiableSet(borrows);
    }

    public UserMarkets copy() {
        return new UserMarkets(user, new LinkedHashSet<>(collaterals), new LinkedHashSet<>(borrows));
    }
}
