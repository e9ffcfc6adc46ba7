package com.peerlend.matching.validation;

import com.peerlend.domain.LiquidityData;
import com.peerlend.domain.Market;
import com.peerlend.domain.MarketAction;
import com.peerlend.domain.MarketSide;
import com.peerlend.domain.ReserveConfiguration;
import com.peerlend.matching.config.MatchingProperties;
import com.peerlend.matching.delta.DeltaTracker;
import com.peerlend.matching.error.CapExceededException;
import com.peerlend.matching.error.InvalidInputException;
import com.peerlend.matching.error.MarketPausedException;
import com.peerlend.matching.error.PermissionDeniedException;
import com.peerlend.matching.error.UnauthorizedActionException;
import com.peerlend.matching.ledger.ActionContext;
import com.peerlend.pool.LendingPool;
import com.peerlend.risk.PriceOracleSentinel;
import com.peerlend.risk.RiskEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Checks run before an action touches the ledger. Every check throws a
 * {@link com.peerlend.matching.error.MatchingEngineException} subtype; none has side effects.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuthorizationGuard {

    private final ManagerRegistry managerRegistry;
    private final LendingPool lendingPool;
    private final RiskEngine riskEngine;
    private final MatchingProperties properties;
    private final Optional<PriceOracleSentinel> priceOracleSentinel;

    /**
     * @throws InvalidInputException ADDRESS_IS_ZERO or AMOUNT_IS_ZERO
     */
    public void validateInput(BigDecimal amount, String... addresses) {
        for (String address : addresses) {
            if (address == null || address.isBlank()) {
                throw new InvalidInputException(InvalidInputException.ADDRESS_IS_ZERO, "Address is required");
            }
        }
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidInputException(InvalidInputException.AMOUNT_IS_ZERO, "Amount must be positive: " + amount);
        }
    }

    /**
     * @throws PermissionDeniedException if {@code manager} is neither {@code delegator} nor approved by them
     */
    public void validatePermission(String delegator, String manager) {
        if (delegator.equals(manager) || managerRegistry.isManagedBy(delegator, manager)) {
            return;
        }
        throw new PermissionDeniedException(delegator, manager);
    }

    public void validateNotPaused(Market market, MarketAction action) {
        if (market.isPaused(action)) {
            throw new MarketPausedException(action, market.getUnderlying());
        }
    }

    /**
     * Side total after the action: requested amount, P2P volume with a real counterpart, and the pool's own total.
     *
     * @throws CapExceededException when the projected total is above a non-zero cap
     */
    public void validateCap(ActionContext context, MarketSide side, BigDecimal amount) {
        String underlying = context.getUnderlying();
        BigDecimal cap = lendingPool.reserveConfiguration(underlying).capInBaseUnits(side);
        if (cap.signum() == 0) {
            return;
        }
        BigDecimal poolTotal = side == MarketSide.SUPPLY
                ? lendingPool.totalSupplied(underlying)
                : lendingPool.totalBorrowed(underlying);
        BigDecimal projected = amount
                .add(DeltaTracker.trueP2P(context.market(), context.getIndexes(), side))
                .add(poolTotal);
        if (projected.compareTo(cap) > 0) {
            throw new CapExceededException(side, underlying, projected, cap);
        }
    }

    public void authorizeSupply(ActionContext context, BigDecimal amount) {
        validateNotPaused(context.market(), MarketAction.SUPPLY);
        validateCap(context, MarketSide.SUPPLY, amount);
    }

    public void authorizeSupplyCollateral(ActionContext context) {
        Market market = context.market();
        if (!market.isCollateral()) {
            throw new UnauthorizedActionException(UnauthorizedActionException.ASSET_NOT_COLLATERAL,
                    market.getUnderlying() + " is not usable as collateral");
        }
        validateNotPaused(market, MarketAction.SUPPLY_COLLATERAL);
    }

    /**
     * Pause, pool borrowing flag, risk category, borrow cap, then the borrower's liquidity with the borrow included.
     */
    public void authorizeBorrow(ActionContext context, String borrower, BigDecimal amount) {
        String underlying = context.getUnderlying();
        validateNotPaused(context.market(), MarketAction.BORROW);

        ReserveConfiguration reserve = lendingPool.reserveConfiguration(underlying);
        if (!reserve.borrowingEnabled()) {
            throw new UnauthorizedActionException(UnauthorizedActionException.BORROWING_NOT_ENABLED,
                    "Borrowing not enabled on the pool for " + underlying);
        }
        int eModeCategoryId = properties.getRiskCategoryId();
        if (eModeCategoryId != 0 && eModeCategoryId != reserve.eModeCategoryId()) {
            throw new UnauthorizedActionException(UnauthorizedActionException.INCONSISTENT_E_MODE,
                    underlying + " is in category " + reserve.eModeCategoryId() + ", engine in " + eModeCategoryId);
        }
        validateCap(context, MarketSide.BORROW, amount);

        LiquidityData liquidity = riskEngine.liquidityData(underlying, borrower, BigDecimal.ZERO, amount);
        if (liquidity.debt().compareTo(liquidity.borrowable()) > 0) {
            throw new UnauthorizedActionException(UnauthorizedActionException.UNAUTHORIZED_BORROW,
                    borrower + " cannot borrow " + amount.toPlainString() + " of " + underlying);
        }
    }

    /**
     * @throws UnauthorizedActionException UNAUTHORIZED_WITHDRAW if the health factor after withdrawal is below 1
     */
    public void authorizeWithdrawCollateral(ActionContext context, String supplier, BigDecimal amount) {
        String underlying = context.getUnderlying();
        validateNotPaused(context.market(), MarketAction.WITHDRAW_COLLATERAL);
        BigDecimal healthFactor = HealthFactor.of(riskEngine.liquidityData(underlying, supplier, amount, BigDecimal.ZERO));
        if (healthFactor.compareTo(properties.getLiquidation().getDefaultThreshold()) < 0) {
            throw new UnauthorizedActionException(UnauthorizedActionException.UNAUTHORIZED_WITHDRAW,
                    supplier + " cannot withdraw " + amount.toPlainString() + " of " + underlying
                            + " collateral (health factor " + healthFactor.stripTrailingZeros().toPlainString() + ")");
        }
    }

    /**
     * Close factor applicable to liquidating {@code borrower}'s debt on {@code borrowMarket}.
     * Bands are evaluated in order: deprecated market, healthy borrower, sentinel-gated band, unhealthy borrower.
     *
     * @return fraction of the debt a liquidator may repay at once
     * @throws UnauthorizedActionException UNAUTHORIZED_LIQUIDATE
     */
    public BigDecimal authorizeLiquidation(Market borrowMarket, Market collateralMarket, String borrower) {
        validateNotPaused(collateralMarket, MarketAction.LIQUIDATE_COLLATERAL);
        validateNotPaused(borrowMarket, MarketAction.LIQUIDATE_BORROW);

        MatchingProperties.Liquidation liquidation = properties.getLiquidation();
        if (borrowMarket.isDeprecated()) {
            return liquidation.getMaxCloseFactor();
        }
        BigDecimal healthFactor = HealthFactor.of(
                riskEngine.liquidityData(borrowMarket.getUnderlying(), borrower, BigDecimal.ZERO, BigDecimal.ZERO));
        if (healthFactor.compareTo(liquidation.getDefaultThreshold()) >= 0) {
            throw new UnauthorizedActionException(UnauthorizedActionException.UNAUTHORIZED_LIQUIDATE,
                    borrower + " is healthy");
        }
        if (healthFactor.compareTo(liquidation.getMinThreshold()) >= 0) {
            boolean allowed = priceOracleSentinel.map(PriceOracleSentinel::isLiquidationAllowed).orElse(true);
            if (!allowed) {
                log.debug("Liquidation of {} refused by the price oracle sentinel", borrower);
                throw new UnauthorizedActionException(UnauthorizedActionException.UNAUTHORIZED_LIQUIDATE,
                        "Liquidation of " + borrower + " not allowed by the price oracle sentinel");
            }
            return liquidation.getDefaultCloseFactor();
        }
        return liquidation.getMaxCloseFactor();
    }
}
