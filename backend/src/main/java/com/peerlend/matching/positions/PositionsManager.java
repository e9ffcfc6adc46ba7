package com.peerlend.matching.positions;

import com.peerlend.common.RayMath;
import com.peerlend.domain.Market;
import com.peerlend.domain.MarketAction;
import com.peerlend.domain.MarketSide;
import com.peerlend.domain.MarketSideDelta;
import com.peerlend.domain.MarketSideIndexes;
import com.peerlend.domain.MarketState;
import com.peerlend.matching.accounting.AccountingResult;
import com.peerlend.matching.accounting.ActionAccountant;
import com.peerlend.matching.config.MatchingProperties;
import com.peerlend.matching.error.InvalidInputException;
import com.peerlend.matching.error.MatchingEngineException;
import com.peerlend.matching.event.ActionCommittedEvent;
import com.peerlend.matching.event.CollateralActionEvent;
import com.peerlend.matching.event.LiquidityActionEvent;
import com.peerlend.matching.ledger.ActionContext;
import com.peerlend.matching.ledger.MarketLedger;
import com.peerlend.matching.validation.AuthorizationGuard;
import com.peerlend.matching.validation.ManagerRegistry;
import com.peerlend.risk.RiskEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.function.Function;

/**
 * Entry point of every state-changing action. Each action runs as one unit of work: inputs and permission
 * are validated, indexes refreshed, the action authorized and accounted on private copies, the delta
 * invariant checked, and only then is the state committed and its observations published. Any exception
 * leaves the ledger untouched and publishes nothing.
 * <p>
 * Callers must serialize actions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PositionsManager {

    private final MarketLedger marketLedger;
    private final RiskEngine riskEngine;
    private final AuthorizationGuard authorizationGuard;
    private final ManagerRegistry managerRegistry;
    private final ActionAccountant actionAccountant;
    private final MatchingProperties properties;
    private final ApplicationEventPublisher applicationEventPublisher;

    public MarketState createMarket(String underlying, boolean collateral, int eModeCategoryId) {
        return marketLedger.createMarket(underlying, collateral, eModeCategoryId);
    }

    public void approveManager(String delegator, String manager, boolean approved) {
        if (delegator == null || delegator.isBlank() || manager == null || manager.isBlank()) {
            throw new InvalidInputException(InvalidInputException.ADDRESS_IS_ZERO, "Delegator and manager are required");
        }
        managerRegistry.approveManager(delegator, manager, approved);
    }

    public ActionResult supply(String underlying, BigDecimal amount, String from, String onBehalf) {
        return supply(underlying, amount, from, onBehalf, properties.getDefaultIterations().getSupply());
    }

    public ActionResult supply(String underlying, BigDecimal amount, String from, String onBehalf, int maxIterations) {
        return execute(MarketAction.SUPPLY, underlying, onBehalf,
                () -> authorizationGuard.validateInput(amount, underlying, from, onBehalf),
                context -> {
                    authorizationGuard.authorizeSupply(context, amount);
                    AccountingResult accounting = actionAccountant.accountSupply(context, amount, onBehalf, maxIterations);
                    context.record(new LiquidityActionEvent(this, LiquidityActionEvent.Type.SUPPLIED, from, onBehalf,
                            underlying, amount, accounting.scaledOnPool(), accounting.scaledInP2P()));
                    return toActionResult(context, MarketSide.SUPPLY, accounting);
                });
    }

    public ActionResult borrow(String underlying, BigDecimal amount, String borrower, String sender) {
        return borrow(underlying, amount, borrower, sender, properties.getDefaultIterations().getBorrow());
    }

    public ActionResult borrow(String underlying, BigDecimal amount, String borrower, String sender, int maxIterations) {
        return execute(MarketAction.BORROW, underlying, borrower,
                () -> {
                    authorizationGuard.validateInput(amount, underlying, borrower, sender);
                    authorizationGuard.validatePermission(borrower, sender);
                },
                context -> {
                    authorizationGuard.authorizeBorrow(context, borrower, amount);
                    AccountingResult accounting = actionAccountant.accountBorrow(context, amount, borrower, maxIterations);
                    context.record(new LiquidityActionEvent(this, LiquidityActionEvent.Type.BORROWED, sender, borrower,
                            underlying, amount, accounting.scaledOnPool(), accounting.scaledInP2P()));
                    return toActionResult(context, MarketSide.BORROW, accounting);
                });
    }

    public ActionResult repay(String underlying, BigDecimal amount, String repayer, String onBehalf) {
        return repay(underlying, amount, repayer, onBehalf, properties.getDefaultIterations().getRepay());
    }

    /**
     * Repays at most the current debt of {@code onBehalf}.
     *
     * @throws InvalidInputException DEBT_IS_ZERO if there is nothing to repay
     */
    public ActionResult repay(String underlying, BigDecimal amount, String repayer, String onBehalf, int maxIterations) {
        return execute(MarketAction.REPAY, underlying, onBehalf,
                () -> authorizationGuard.validateInput(amount, underlying, repayer, onBehalf),
                context -> {
                    authorizationGuard.validateNotPaused(context.market(), MarketAction.REPAY);
                    BigDecimal debt = context.getState().borrowBalance(onBehalf);
                    if (debt.signum() == 0) {
                        throw new InvalidInputException(InvalidInputException.DEBT_IS_ZERO,
                                onBehalf + " has no debt on " + underlying);
                    }
                    BigDecimal toRepay = RayMath.min(amount, debt);
                    AccountingResult accounting = actionAccountant.accountRepay(context, toRepay, onBehalf, maxIterations);
                    context.record(new LiquidityActionEvent(this, LiquidityActionEvent.Type.REPAID, repayer, onBehalf,
                            underlying, toRepay, accounting.scaledOnPool(), accounting.scaledInP2P()));
                    return toActionResult(context, MarketSide.BORROW, accounting);
                });
    }

    public ActionResult withdraw(String underlying, BigDecimal amount, String supplier, String sender) {
        return withdraw(underlying, amount, supplier, sender, properties.getDefaultIterations().getWithdraw());
    }

    /**
     * Withdraws at most the current supply of {@code supplier}.
     *
     * @throws InvalidInputException SUPPLY_IS_ZERO if there is nothing to withdraw
     */
    public ActionResult withdraw(String underlying, BigDecimal amount, String supplier, String sender, int maxIterations) {
        return execute(MarketAction.WITHDRAW, underlying, supplier,
                () -> {
                    authorizationGuard.validateInput(amount, underlying, supplier, sender);
                    authorizationGuard.validatePermission(supplier, sender);
                },
                context -> {
                    authorizationGuard.validateNotPaused(context.market(), MarketAction.WITHDRAW);
                    BigDecimal supplied = context.getState().supplyBalance(supplier);
                    if (supplied.signum() == 0) {
                        throw new InvalidInputException(InvalidInputException.SUPPLY_IS_ZERO,
                                supplier + " has no supply on " + underlying);
                    }
                    BigDecimal toWithdraw = RayMath.min(amount, supplied);
                    AccountingResult accounting = actionAccountant.accountWithdraw(context, toWithdraw, supplier, maxIterations);
                    context.record(new LiquidityActionEvent(this, LiquidityActionEvent.Type.WITHDRAWN, sender, supplier,
                            underlying, toWithdraw, accounting.scaledOnPool(), accounting.scaledInP2P()));
                    return toActionResult(context, MarketSide.SUPPLY, accounting);
                });
    }

    public CollateralResult supplyCollateral(String underlying, BigDecimal amount, String from, String onBehalf) {
        return execute(MarketAction.SUPPLY_COLLATERAL, underlying, onBehalf,
                () -> authorizationGuard.validateInput(amount, underlying, from, onBehalf),
                context -> {
                    authorizationGuard.authorizeSupplyCollateral(context);
                    BigDecimal scaledCollateral = actionAccountant.accountSupplyCollateral(context, amount, onBehalf);
                    context.record(new CollateralActionEvent(this, CollateralActionEvent.Type.SUPPLIED, from, onBehalf,
                            underlying, amount, scaledCollateral));
                    return new CollateralResult(amount, context.getState().collateralBalance(onBehalf), scaledCollateral);
                });
    }

    /**
     * Withdraws at most the current collateral of {@code supplier}, provided the position stays healthy.
     *
     * @throws InvalidInputException COLLATERAL_IS_ZERO if there is no collateral
     */
    public CollateralResult withdrawCollateral(String underlying, BigDecimal amount, String supplier, String sender) {
        return execute(MarketAction.WITHDRAW_COLLATERAL, underlying, supplier,
                () -> {
                    authorizationGuard.validateInput(amount, underlying, supplier, sender);
                    authorizationGuard.validatePermission(supplier, sender);
                },
                context -> {
                    BigDecimal collateral = context.getState().collateralBalance(supplier);
                    if (collateral.signum() == 0) {
                        throw new InvalidInputException(InvalidInputException.COLLATERAL_IS_ZERO,
                                supplier + " has no collateral on " + underlying);
                    }
                    BigDecimal toWithdraw = RayMath.min(amount, collateral);
                    authorizationGuard.authorizeWithdrawCollateral(context, supplier, toWithdraw);
                    BigDecimal scaledCollateral = actionAccountant.accountWithdrawCollateral(context, toWithdraw, supplier);
                    context.record(new CollateralActionEvent(this, CollateralActionEvent.Type.WITHDRAWN, sender, supplier,
                            underlying, toWithdraw, scaledCollateral));
                    return new CollateralResult(toWithdraw, context.getState().collateralBalance(supplier), scaledCollateral);
                });
    }

    /**
     * Close factor a liquidator may apply to {@code borrower}'s debt on {@code underlyingBorrowed}.
     * Reads committed state only.
     */
    public BigDecimal authorizeLiquidation(String underlyingBorrowed, String underlyingCollateral, String borrower) {
        try {
            if (borrower == null || borrower.isBlank()) {
                throw new InvalidInputException(InvalidInputException.ADDRESS_IS_ZERO, "Borrower is required");
            }
            Market borrowMarket = requireMarket(underlyingBorrowed);
            Market collateralMarket = requireMarket(underlyingCollateral);
            BigDecimal closeFactor = authorizationGuard.authorizeLiquidation(borrowMarket, collateralMarket, borrower);
            log.info("Liquidation of {} on {}/{} authorized with close factor {}", borrower, underlyingBorrowed,
                    underlyingCollateral, closeFactor);
            return closeFactor;
        } catch (MatchingEngineException e) {
            log.warn("Liquidation of {} on {}/{} rejected: {} ({})", borrower, underlyingBorrowed, underlyingCollateral,
                    e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    private <T> T execute(MarketAction action, String underlying, String user, Runnable preconditions,
                          Function<ActionContext, T> body) {
        try {
            preconditions.run();
            ActionContext context = marketLedger.begin(underlying, user);
            context.applyIndexes(riskEngine.updatedIndexes(underlying));
            T result = body.apply(context);
            verifyDeltas(context);
            MarketState committed = marketLedger.commit(context);
            context.pendingEvents().forEach(applicationEventPublisher::publishEvent);
            applicationEventPublisher.publishEvent(new ActionCommittedEvent(this, underlying, action, committed));
            log.info("{} on {} for {} committed: {}", action, underlying, user, result);
            return result;
        } catch (MatchingEngineException e) {
            log.warn("{} on {} for {} rejected: {} ({})", action, underlying, user, e.getErrorCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("{} on {} for {} aborted: {}", action, underlying, user, e.getMessage(), e);
            throw e;
        }
    }

    /**
     * P2P volume of a side always covers its delta: {@code scaledP2PTotal * p2pIndex >= scaledDelta * poolIndex}.
     */
    private static void verifyDeltas(ActionContext context) {
        for (MarketSide side : MarketSide.values()) {
            MarketSideDelta delta = context.market().getDeltas().of(side);
            MarketSideIndexes indexes = context.getIndexes().of(side);
            BigDecimal p2pVolume = RayMath.mul(delta.getScaledP2PTotal(), indexes.p2pIndex());
            BigDecimal deltaVolume = RayMath.mul(delta.getScaledDelta(), indexes.poolIndex());
            if (p2pVolume.compareTo(deltaVolume) < 0) {
                throw new IllegalStateException(side + " delta of " + context.getUnderlying() + " exceeds its P2P volume: "
                        + deltaVolume.toPlainString() + " > " + p2pVolume.toPlainString());
            }
        }
    }

    private Market requireMarket(String underlying) {
        return marketLedger.find(underlying)
                .map(MarketState::market)
                .orElseThrow(() -> new InvalidInputException(InvalidInputException.MARKET_NOT_CREATED,
                        "Market not created: " + underlying));
    }

    private static ActionResult toActionResult(ActionContext context, MarketSide side, AccountingResult accounting) {
        MarketSideIndexes indexes = context.getIndexes().of(side);
        BigDecimal onPool = side == MarketSide.SUPPLY
                ? RayMath.mulDown(accounting.scaledOnPool(), indexes.poolIndex())
                : RayMath.mulUp(accounting.scaledOnPool(), indexes.poolIndex());
        BigDecimal inP2P = side == MarketSide.SUPPLY
                ? RayMath.mulDown(accounting.scaledInP2P(), indexes.p2pIndex())
                : RayMath.mulUp(accounting.scaledInP2P(), indexes.p2pIndex());
        return new ActionResult(accounting.toPool(), accounting.toPeer(), onPool, inP2P,
                accounting.scaledOnPool(), accounting.scaledInP2P(), accounting.pool());
    }
}
