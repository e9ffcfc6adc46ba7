package com.peerlend.matching.positions;

import com.peerlend.common.RayMath;
import com.peerlend.domain.Indexes;
import com.peerlend.domain.LiquidityData;
import com.peerlend.domain.MarketAction;
import com.peerlend.domain.MarketSide;
import com.peerlend.domain.MarketSideDelta;
import com.peerlend.domain.MarketSideIndexes;
import com.peerlend.domain.MarketState;
import com.peerlend.domain.ReserveConfiguration;
import com.peerlend.matching.accounting.ActionAccountant;
import com.peerlend.matching.config.MatchingProperties;
import com.peerlend.matching.delta.DeltaTracker;
import com.peerlend.matching.delta.IdleSupplyTracker;
import com.peerlend.matching.engine.MatchingEngine;
import com.peerlend.matching.error.CapExceededException;
import com.peerlend.matching.error.InvalidInputException;
import com.peerlend.matching.error.MarketPausedException;
import com.peerlend.matching.error.MatchingEngineException;
import com.peerlend.matching.error.PermissionDeniedException;
import com.peerlend.matching.error.UnauthorizedActionException;
import com.peerlend.matching.event.ActionCommittedEvent;
import com.peerlend.matching.event.LiquidityActionEvent;
import com.peerlend.matching.ledger.MarketLedger;
import com.peerlend.matching.validation.AuthorizationGuard;
import com.peerlend.matching.validation.ManagerRegistry;
import com.peerlend.pool.LendingPool;
import com.peerlend.risk.RiskEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Actions run end to end on real accounting components; only the pool, the risk engine and the
 * event publisher are mocked.
 */
@ExtendWith(MockitoExtension.class)
class PositionsManagerTest {

    private static final String DAI = "0x6b175474e89094c44da98b954eedeac495271d0f";
    private static final String WETH = "0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2";
    private static final String ALICE = "0x1111111111111111111111111111111111111111";
    private static final String BOB = "0x2222222222222222222222222222222222222222";
    private static final String DAVE = "0x3333333333333333333333333333333333333333";
    private static final String BOT = "0x4444444444444444444444444444444444444444";

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    @Mock
    LendingPool lendingPool;
    @Mock
    RiskEngine riskEngine;
    @Mock
    ApplicationEventPublisher applicationEventPublisher;

    private MarketLedger marketLedger;
    private PositionsManager positionsManager;

    @BeforeEach
    void setUp() {
        lenient().when(lendingPool.reserveConfiguration(anyString()))
                .thenReturn(new ReserveConfiguration(BigDecimal.ZERO, BigDecimal.ZERO, 0, true, 0));
        lenient().when(lendingPool.totalSupplied(anyString())).thenReturn(BigDecimal.ZERO);
        lenient().when(lendingPool.totalBorrowed(anyString())).thenReturn(BigDecimal.ZERO);
        lenient().when(riskEngine.updatedIndexes(anyString())).thenReturn(Indexes.genesis());
        lenient().when(riskEngine.liquidityData(anyString(), anyString(), any(), any()))
                .thenReturn(new LiquidityData(new BigDecimal("1E+30"), new BigDecimal("1E+30"), BigDecimal.ZERO));

        MatchingProperties properties = new MatchingProperties();
        marketLedger = new MarketLedger();
        ManagerRegistry managerRegistry = new ManagerRegistry(applicationEventPublisher);
        AuthorizationGuard guard = new AuthorizationGuard(managerRegistry, lendingPool, riskEngine, properties,
                Optional.empty());
        ActionAccountant accountant = new ActionAccountant(new DeltaTracker(), new IdleSupplyTracker(lendingPool),
                new MatchingEngine());
        positionsManager = new PositionsManager(marketLedger, riskEngine, guard, managerRegistry, accountant,
                properties, applicationEventPublisher);

        positionsManager.createMarket(DAI, false, 0);
        positionsManager.createMarket(WETH, true, 0);
    }

    @Test
    @DisplayName("supply on an empty market goes entirely to the pool")
    void supplyOnEmptyMarket() {
        ActionResult result = positionsManager.supply(DAI, HUNDRED, ALICE, ALICE);

        assertThat(result.toPool()).isEqualByComparingTo("100");
        assertThat(result.toPeer()).isEqualByComparingTo("0");
        assertThat(result.scaledOnPool()).isEqualByComparingTo("100");
        assertThat(result.scaledInP2P()).isEqualByComparingTo("0");
        assertThat(result.pool().toSupply()).isEqualByComparingTo("100");
        assertThat(result.pool().toRepay()).isEqualByComparingTo("0");
        assertThat(state().market().getDeltas().getBorrow().getScaledDelta()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("supply promotes the pool borrower into a P2P match")
    void supplyPromotesPoolBorrower() {
        positionsManager.borrow(DAI, HUNDRED, BOB, BOB);

        ActionResult result = positionsManager.supply(DAI, HUNDRED, ALICE, ALICE, 1);

        assertThat(result.toPeer()).isEqualByComparingTo("100");
        assertThat(result.toPool()).isEqualByComparingTo("0");
        assertThat(result.scaledInP2P()).isEqualByComparingTo("100");
        assertThat(result.scaledOnPool()).isEqualByComparingTo("0");
        assertThat(result.pool().toRepay()).isEqualByComparingTo("100");
        MarketState state = state();
        assertThat(state.balances().scaledPoolBalance(MarketSide.BORROW, BOB)).isEqualByComparingTo("0");
        assertThat(state.balances().scaledP2PBalance(MarketSide.BORROW, BOB)).isEqualByComparingTo("100");
        assertThat(state.market().getDeltas().getSupply().getScaledP2PTotal()).isEqualByComparingTo("100");
        assertThat(state.market().getDeltas().getBorrow().getScaledP2PTotal()).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("withdraw is capped at the supplied balance and clears the position")
    void withdrawCappedAtSupply() {
        positionsManager.supply(DAI, HUNDRED, ALICE, ALICE);

        ActionResult result = positionsManager.withdraw(DAI, new BigDecimal("500"), ALICE, ALICE);

        assertThat(result.toPool()).isEqualByComparingTo("100");
        assertThat(result.onPool()).isEqualByComparingTo("0");
        assertThat(result.inP2P()).isEqualByComparingTo("0");
        assertThat(result.pool().toWithdraw()).isEqualByComparingTo("100");
        assertThat(state().supplyBalance(ALICE)).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("borrow records the market in the borrower's memberships until the debt is repaid")
    void borrowMembership() {
        positionsManager.borrow(DAI, HUNDRED, BOB, BOB);
        assertThat(marketLedger.userMarkets(BOB).borrowMarkets()).containsExactly(DAI);

        ActionResult repaid = positionsManager.repay(DAI, new BigDecimal("150"), BOB, BOB);

        assertThat(repaid.toPool()).isEqualByComparingTo("100");
        assertThat(repaid.pool().toRepay()).isEqualByComparingTo("100");
        assertThat(marketLedger.userMarkets(BOB).borrowMarkets()).isEmpty();
    }

    @Nested
    @DisplayName("with a P2P match between Alice (supplier) and Bob (borrower)")
    class Matched {

        @BeforeEach
        void match() {
            positionsManager.borrow(DAI, HUNDRED, BOB, BOB);
            positionsManager.supply(DAI, HUNDRED, ALICE, ALICE);
        }

        @Test
        @DisplayName("breaking withdraw demotes the borrower back to the pool")
        void withdrawDemotesBorrower() {
            ActionResult result = positionsManager.withdraw(DAI, HUNDRED, ALICE, ALICE);

            assertThat(result.toPeer()).isEqualByComparingTo("100");
            assertThat(result.pool().toBorrow()).isEqualByComparingTo("100");
            assertThat(result.pool().toWithdraw()).isEqualByComparingTo("0");
            MarketState state = state();
            assertThat(state.balances().scaledPoolBalance(MarketSide.BORROW, BOB)).isEqualByComparingTo("100");
            assertThat(state.balances().scaledP2PBalance(MarketSide.BORROW, BOB)).isEqualByComparingTo("0");
            assertThat(state.market().getDeltas().getSupply().getScaledP2PTotal()).isEqualByComparingTo("0");
            assertThat(state.market().getDeltas().getBorrow().getScaledP2PTotal()).isEqualByComparingTo("0");
            assertThat(state.market().getDeltas().getBorrow().getScaledDelta()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("breaking withdraw without iterations leaves the borrower matched and records a borrow delta")
        void withdrawWithoutIterationsIncreasesDelta() {
            ActionResult result = positionsManager.withdraw(DAI, HUNDRED, ALICE, ALICE, 0);

            assertThat(result.pool().toBorrow()).isEqualByComparingTo("100");
            MarketState state = state();
            assertThat(state.balances().scaledP2PBalance(MarketSide.BORROW, BOB)).isEqualByComparingTo("100");
            assertThat(state.market().getDeltas().getBorrow().getScaledDelta()).isEqualByComparingTo("100");
            assertThat(state.market().getDeltas().getBorrow().getScaledP2PTotal()).isEqualByComparingTo("100");
            assertThat(state.market().getDeltas().getSupply().getScaledP2PTotal()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("breaking repay demotes the supplier back to the pool")
        void repayDemotesSupplier() {
            ActionResult result = positionsManager.repay(DAI, HUNDRED, BOB, BOB);

            assertThat(result.toPeer()).isEqualByComparingTo("100");
            assertThat(result.pool().toSupply()).isEqualByComparingTo("100");
            assertThat(result.pool().toRepay()).isEqualByComparingTo("0");
            MarketState state = state();
            assertThat(state.balances().scaledPoolBalance(MarketSide.SUPPLY, ALICE)).isEqualByComparingTo("100");
            assertThat(state.balances().scaledP2PBalance(MarketSide.SUPPLY, ALICE)).isEqualByComparingTo("0");
            assertThat(state.market().getDeltas().getSupply().getScaledP2PTotal()).isEqualByComparingTo("0");
            assertThat(state.market().getDeltas().getBorrow().getScaledP2PTotal()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("breaking repay above the supply cap keeps the excess idle, which the next borrower takes first")
        void repayAboveSupplyCapKeepsIdleSupply() {
            when(lendingPool.reserveConfiguration(DAI))
                    .thenReturn(new ReserveConfiguration(new BigDecimal("50"), BigDecimal.ZERO, 0, true, 0));
            when(lendingPool.totalSupplied(DAI)).thenReturn(new BigDecimal("20"));

            ActionResult result = positionsManager.repay(DAI, HUNDRED, BOB, BOB);

            assertThat(result.pool().toSupply()).isEqualByComparingTo("30");
            MarketState state = state();
            assertThat(state.market().getIdleSupply()).isEqualByComparingTo("70");
            assertThat(state.balances().scaledPoolBalance(MarketSide.SUPPLY, ALICE)).isEqualByComparingTo("30");
            assertThat(state.balances().scaledP2PBalance(MarketSide.SUPPLY, ALICE)).isEqualByComparingTo("70");
            assertThat(state.market().getDeltas().getSupply().getScaledP2PTotal()).isEqualByComparingTo("70");

            ActionResult borrowed = positionsManager.borrow(DAI, new BigDecimal("40"), DAVE, DAVE);

            assertThat(borrowed.toPeer()).isEqualByComparingTo("40");
            assertThat(borrowed.toPool()).isEqualByComparingTo("0");
            assertThat(borrowed.pool().toBorrow()).isEqualByComparingTo("0");
            assertThat(borrowed.pool().toWithdraw()).isEqualByComparingTo("0");
            assertThat(state().market().getIdleSupply()).isEqualByComparingTo("30");
            assertThat(state().balances().scaledP2PBalance(MarketSide.BORROW, DAVE)).isEqualByComparingTo("40");
        }

        @Test
        @DisplayName("repay pays the accrued P2P fee before demoting suppliers")
        void repayPaysFeeFirst() {
            when(riskEngine.updatedIndexes(DAI)).thenReturn(new Indexes(
                    new MarketSideIndexes(BigDecimal.ONE, new BigDecimal("1.1")),
                    new MarketSideIndexes(BigDecimal.ONE, new BigDecimal("1.2"))));

            ActionResult result = positionsManager.repay(DAI, new BigDecimal("120"), BOB, BOB);

            assertThat(result.toPeer()).isEqualByComparingTo("120");
            assertThat(result.pool().toSupply()).isEqualByComparingTo("110");
            MarketState state = state();
            assertThat(state.balances().scaledPoolBalance(MarketSide.SUPPLY, ALICE)).isEqualByComparingTo("110");
            assertThat(state.balances().scaledP2PBalance(MarketSide.SUPPLY, ALICE)).isEqualByComparingTo("0");
            assertThat(state.market().getDeltas().getBorrow().getScaledP2PTotal()).isEqualByComparingTo("0");
            assertThat(state.market().getDeltas().getSupply().getScaledP2PTotal()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("a failure inside the action leaves the ledger untouched and publishes nothing")
        void failureRollsBack() {
            clearInvocations(applicationEventPublisher);
            when(lendingPool.reserveConfiguration(DAI)).thenThrow(new IllegalStateException("pool unavailable"));

            assertThatThrownBy(() -> positionsManager.repay(DAI, HUNDRED, BOB, BOB))
                    .isInstanceOf(IllegalStateException.class);

            MarketState state = state();
            assertThat(state.balances().scaledP2PBalance(MarketSide.BORROW, BOB)).isEqualByComparingTo("100");
            assertThat(state.balances().scaledP2PBalance(MarketSide.SUPPLY, ALICE)).isEqualByComparingTo("100");
            assertThat(state.market().getDeltas().getBorrow().getScaledP2PTotal()).isEqualByComparingTo("100");
            assertThat(marketLedger.userMarkets(BOB).borrowMarkets()).containsExactly(DAI);
            verifyNoInteractions(applicationEventPublisher);
        }
    }

    @Test
    @DisplayName("borrow above the pool's borrow cap is rejected")
    void borrowCapExceeded() {
        when(lendingPool.reserveConfiguration(DAI))
                .thenReturn(new ReserveConfiguration(BigDecimal.ZERO, new BigDecimal("1000"), 0, true, 0));
        when(lendingPool.totalBorrowed(DAI)).thenReturn(new BigDecimal("950"));

        assertThatThrownBy(() -> positionsManager.borrow(DAI, HUNDRED, BOB, BOB))
                .isInstanceOf(CapExceededException.class)
                .satisfies(e -> assertThat(((MatchingEngineException) e).getErrorCode())
                        .isEqualTo(CapExceededException.BORROW_CAP_EXCEEDED));
        assertThat(state().borrowBalance(BOB)).isEqualByComparingTo("0");
        verifyNoInteractions(applicationEventPublisher);
    }

    @Test
    @DisplayName("withdraw by a third party needs the supplier's approval")
    void withdrawOnBehalfNeedsApproval() {
        positionsManager.supply(DAI, HUNDRED, ALICE, ALICE);

        assertThatThrownBy(() -> positionsManager.withdraw(DAI, BigDecimal.TEN, ALICE, BOT))
                .isInstanceOf(PermissionDeniedException.class);

        positionsManager.approveManager(ALICE, BOT, true);
        positionsManager.withdraw(DAI, new BigDecimal("50"), ALICE, BOT);

        assertThat(state().supplyBalance(ALICE)).isEqualByComparingTo("50");
    }

    @Test
    @DisplayName("supplying on behalf of someone else needs no approval")
    void supplyOnBehalfIsOpen() {
        ActionResult result = positionsManager.supply(DAI, HUNDRED, BOT, ALICE);

        assertThat(result.scaledOnPool()).isEqualByComparingTo("100");
        assertThat(state().supplyBalance(ALICE)).isEqualByComparingTo("100");
        assertThat(state().supplyBalance(BOT)).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("invalid inputs are rejected before the ledger is touched")
    void invalidInputs() {
        assertThatThrownBy(() -> positionsManager.supply(DAI, BigDecimal.ZERO, ALICE, ALICE))
                .satisfies(e -> assertThat(((MatchingEngineException) e).getErrorCode())
                        .isEqualTo(InvalidInputException.AMOUNT_IS_ZERO));
        assertThatThrownBy(() -> positionsManager.supply(DAI, HUNDRED, "", ALICE))
                .satisfies(e -> assertThat(((MatchingEngineException) e).getErrorCode())
                        .isEqualTo(InvalidInputException.ADDRESS_IS_ZERO));
        assertThatThrownBy(() -> positionsManager.supply(DAVE, HUNDRED, ALICE, ALICE))
                .satisfies(e -> assertThat(((MatchingEngineException) e).getErrorCode())
                        .isEqualTo(InvalidInputException.MARKET_NOT_CREATED));
        assertThatThrownBy(() -> positionsManager.repay(DAI, HUNDRED, BOB, BOB))
                .satisfies(e -> assertThat(((MatchingEngineException) e).getErrorCode())
                        .isEqualTo(InvalidInputException.DEBT_IS_ZERO));
        assertThatThrownBy(() -> positionsManager.withdraw(DAI, HUNDRED, ALICE, ALICE))
                .satisfies(e -> assertThat(((MatchingEngineException) e).getErrorCode())
                        .isEqualTo(InvalidInputException.SUPPLY_IS_ZERO));
        verifyNoInteractions(applicationEventPublisher);
    }

    @Test
    @DisplayName("paused supply is rejected")
    void pausedSupply() {
        marketLedger.configureMarket(DAI, market -> market.setPaused(MarketAction.SUPPLY, true));

        assertThatThrownBy(() -> positionsManager.supply(DAI, HUNDRED, ALICE, ALICE))
                .isInstanceOf(MarketPausedException.class)
                .satisfies(e -> assertThat(((MatchingEngineException) e).getErrorCode()).isEqualTo("SUPPLY_IS_PAUSED"));
    }

    @Test
    @DisplayName("a delta larger than its P2P volume aborts the action")
    void deltaInvariantViolation() {
        marketLedger.configureMarket(DAI, market -> market.getDeltas().getBorrow().setScaledDelta(new BigDecimal("50")));

        assertThatThrownBy(() -> positionsManager.supply(DAI, BigDecimal.TEN, ALICE, ALICE))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("BORROW delta");
        assertThat(state().market().getDeltas().getBorrow().getScaledDelta()).isEqualByComparingTo("50");
        assertThat(state().supplyBalance(ALICE)).isEqualByComparingTo("0");
    }

    @Nested
    @DisplayName("at accrued, non-integer indexes")
    class AccruedIndexes {

        private final Indexes accrued = indexes("1.0213", "1.0371", "1.0637", "1.0371");

        @Test
        @DisplayName("full breaking withdraw keeps the borrow delta within the remaining P2P volume")
        void breakingWithdrawDeltaStaysCovered() {
            positionsManager.borrow(DAI, new BigDecimal("56"), BOB, BOB);
            positionsManager.supply(DAI, new BigDecimal("56"), ALICE, ALICE);
            when(riskEngine.updatedIndexes(DAI)).thenReturn(accrued);

            ActionResult result = positionsManager.withdraw(DAI, new BigDecimal("1000000"), ALICE, ALICE, 0);

            assertThat(result.toPeer()).isEqualByComparingTo("58");
            assertThat(result.pool().toBorrow()).isEqualByComparingTo("58");
            MarketState state = state();
            assertThat(state.supplyBalance(ALICE)).isEqualByComparingTo("0");
            assertThat(state.market().getDeltas().getSupply().getScaledP2PTotal()).isEqualByComparingTo("0");
            assertThat(state.market().getDeltas().getBorrow().getScaledP2PTotal()).isEqualByComparingTo("56");
            assertThat(state.market().getDeltas().getBorrow().getScaledDelta()).isEqualByComparingTo("54");
            assertMarketConsistent(state);
        }

        @Test
        @DisplayName("a delta that would round above the P2P volume is rounded down")
        void deltaRoundsDown() {
            positionsManager.borrow(DAI, HUNDRED, BOB, BOB);
            positionsManager.supply(DAI, HUNDRED, ALICE, ALICE);
            when(riskEngine.updatedIndexes(DAI)).thenReturn(indexes("1", "1", "1.5", "1"));

            ActionResult result = positionsManager.withdraw(DAI, HUNDRED, ALICE, ALICE, 0);

            assertThat(result.pool().toBorrow()).isEqualByComparingTo("100");
            assertThat(state().market().getDeltas().getBorrow().getScaledDelta()).isEqualByComparingTo("66");
            assertMarketConsistent(state());
        }

        @Test
        @DisplayName("full repay of a pool-only debt clears it without breaking any match")
        void fullRepayOfPoolDebt() {
            positionsManager.borrow(DAI, HUNDRED, BOB, BOB);
            when(riskEngine.updatedIndexes(DAI)).thenReturn(indexes("1", "1", "1.003", "1.001"));

            ActionResult result = positionsManager.repay(DAI, new BigDecimal("1000"), BOB, BOB);

            assertThat(result.toPool()).isEqualByComparingTo("101");
            assertThat(result.toPeer()).isEqualByComparingTo("0");
            assertThat(result.pool().toRepay()).isEqualByComparingTo("101");
            assertThat(result.pool().toSupply()).isEqualByComparingTo("0");
            MarketState state = state();
            assertThat(state.borrowBalance(BOB)).isEqualByComparingTo("0");
            assertThat(state.market().getDeltas().getSupply().getScaledDelta()).isEqualByComparingTo("0");
            assertThat(marketLedger.userMarkets(BOB).borrowMarkets()).isEmpty();
        }

        @ParameterizedTest
        @ValueSource(longs = {1, 7, 56, 333, 1000, 123457})
        @DisplayName("supplying on the pool then withdrawing everything after accrual leaves nothing behind")
        void poolRoundTrip(long amount) {
            when(riskEngine.updatedIndexes(DAI)).thenReturn(indexes("1.0021", "1.0034", "1.0063", "1.0034"), accrued);

            positionsManager.supply(DAI, BigDecimal.valueOf(amount), ALICE, ALICE);
            ActionResult result = positionsManager.withdraw(DAI, BigDecimal.valueOf(amount * 2), ALICE, ALICE);

            assertThat(result.scaledOnPool()).isEqualByComparingTo("0");
            assertThat(result.scaledInP2P()).isEqualByComparingTo("0");
            assertThat(state().balances().pool(MarketSide.SUPPLY).total()).isEqualByComparingTo("0");
            assertMarketConsistent(state());
        }

        @ParameterizedTest
        @ValueSource(longs = {1, 7, 56, 333, 1000, 123457})
        @DisplayName("supplying against a pool borrower then withdrawing everything leaves nothing behind")
        void matchedRoundTrip(long amount) {
            when(riskEngine.updatedIndexes(DAI)).thenReturn(accrued);
            positionsManager.borrow(DAI, new BigDecimal("60"), BOB, BOB);

            positionsManager.supply(DAI, BigDecimal.valueOf(amount), ALICE, ALICE);
            assertMarketConsistent(state());
            ActionResult result = positionsManager.withdraw(DAI, BigDecimal.valueOf(amount * 2), ALICE, ALICE);

            assertThat(result.scaledOnPool()).isEqualByComparingTo("0");
            assertThat(result.scaledInP2P()).isEqualByComparingTo("0");
            assertThat(state().supplyBalance(ALICE)).isEqualByComparingTo("0");
            assertMarketConsistent(state());
        }

        @Test
        @DisplayName("every step of a mixed sequence keeps deltas covered and pool queues balanced")
        void sequenceKeepsMarketConsistent() {
            when(riskEngine.updatedIndexes(DAI)).thenReturn(
                    Indexes.genesis(),
                    indexes("1.0021", "1.0034", "1.0063", "1.0041"),
                    indexes("1.0213", "1.0371", "1.0637", "1.0402"),
                    indexes("1.0458", "1.0702", "1.1190", "1.0815"),
                    indexes("1.0731", "1.1044", "1.1717", "1.1263"),
                    indexes("1.0904", "1.1358", "1.2245", "1.1690"),
                    indexes("1.1187", "1.1709", "1.2801", "1.2158"),
                    indexes("1.1342", "1.2032", "1.3377", "1.2611"),
                    indexes("1.1579", "1.2406", "1.3950", "1.3094"));
            BigDecimal all = new BigDecimal("1000000");
            List<Runnable> steps = List.of(
                    () -> positionsManager.borrow(DAI, new BigDecimal("1000"), BOB, BOB),
                    () -> positionsManager.supply(DAI, new BigDecimal("700"), ALICE, ALICE),
                    () -> positionsManager.supply(DAI, new BigDecimal("500"), DAVE, DAVE),
                    () -> positionsManager.repay(DAI, new BigDecimal("300"), BOB, BOB),
                    () -> positionsManager.withdraw(DAI, new BigDecimal("400"), ALICE, ALICE),
                    () -> positionsManager.borrow(DAI, new BigDecimal("200"), BOB, BOB),
                    () -> positionsManager.withdraw(DAI, all, ALICE, ALICE, 0),
                    () -> positionsManager.repay(DAI, all, BOB, BOB, 0),
                    () -> positionsManager.withdraw(DAI, all, DAVE, DAVE));

            for (Runnable step : steps) {
                step.run();
                assertMarketConsistent(state());
            }

            MarketState state = state();
            assertThat(state.supplyBalance(ALICE)).isEqualByComparingTo("0");
            assertThat(state.supplyBalance(DAVE)).isEqualByComparingTo("0");
            assertThat(state.borrowBalance(BOB)).isEqualByComparingTo("0");
            assertThat(marketLedger.userMarkets(BOB).borrowMarkets()).isEmpty();
        }
    }

    @Test
    @ExtendWith(OutputCaptureExtension.class)
    @DisplayName("an unexpected failure is logged as an error with the action context and rethrown")
    void unexpectedFailureLoggedAndRethrown(CapturedOutput output) {
        marketLedger.configureMarket(DAI, market -> market.setIndexes(indexes("1.1", "1.1", "1.1", "1.1")));

        assertThatThrownBy(() -> positionsManager.supply(DAI, HUNDRED, ALICE, ALICE))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("decreased");

        assertThat(output).contains("ERROR").contains("SUPPLY on " + DAI + " for " + ALICE + " aborted");
        assertThat(state().supplyBalance(ALICE)).isEqualByComparingTo("0");
        verifyNoInteractions(applicationEventPublisher);
    }

    @Test
    @DisplayName("observations are published after commit, followed by the committed event")
    void publishesEventsAfterCommit() {
        positionsManager.supply(DAI, HUNDRED, ALICE, ALICE);

        ArgumentCaptor<ApplicationEvent> captor = ArgumentCaptor.forClass(ApplicationEvent.class);
        verify(applicationEventPublisher, times(2)).publishEvent(captor.capture());
        List<ApplicationEvent> events = captor.getAllValues();
        LiquidityActionEvent supplied = (LiquidityActionEvent) events.get(0);
        assertThat(supplied.getType()).isEqualTo(LiquidityActionEvent.Type.SUPPLIED);
        assertThat(supplied.getOnBehalf()).isEqualTo(ALICE);
        assertThat(supplied.getScaledOnPool()).isEqualByComparingTo("100");
        ActionCommittedEvent committed = (ActionCommittedEvent) events.get(1);
        assertThat(committed.getAction()).isEqualTo(MarketAction.SUPPLY);
        assertThat(committed.getCommittedState()).isSameAs(state());
    }

    @Nested
    @DisplayName("collateral")
    class Collateral {

        @Test
        @DisplayName("only collateral markets accept collateral")
        void nonCollateralMarket() {
            assertThatThrownBy(() -> positionsManager.supplyCollateral(DAI, HUNDRED, ALICE, ALICE))
                    .satisfies(e -> assertThat(((MatchingEngineException) e).getErrorCode())
                            .isEqualTo(UnauthorizedActionException.ASSET_NOT_COLLATERAL));
        }

        @Test
        @DisplayName("supply and full withdrawal toggle the collateral membership")
        void membership() {
            CollateralResult supplied = positionsManager.supplyCollateral(WETH, BigDecimal.TEN, ALICE, ALICE);

            assertThat(supplied.collateral()).isEqualByComparingTo("10");
            assertThat(marketLedger.userMarkets(ALICE).collateralMarkets()).containsExactly(WETH);

            CollateralResult withdrawn = positionsManager.withdrawCollateral(WETH, HUNDRED, ALICE, ALICE);

            assertThat(withdrawn.amount()).isEqualByComparingTo("10");
            assertThat(withdrawn.scaledCollateral()).isEqualByComparingTo("0");
            assertThat(marketLedger.userMarkets(ALICE).collateralMarkets()).isEmpty();
        }

        @Test
        @DisplayName("withdrawal that would make the position unhealthy is refused")
        void unhealthyWithdrawal() {
            positionsManager.supplyCollateral(WETH, BigDecimal.TEN, ALICE, ALICE);
            when(riskEngine.liquidityData(eq(WETH), eq(ALICE), any(), any()))
                    .thenReturn(new LiquidityData(BigDecimal.ZERO, new BigDecimal("50"), HUNDRED));

            assertThatThrownBy(() -> positionsManager.withdrawCollateral(WETH, BigDecimal.TEN, ALICE, ALICE))
                    .satisfies(e -> assertThat(((MatchingEngineException) e).getErrorCode())
                            .isEqualTo(UnauthorizedActionException.UNAUTHORIZED_WITHDRAW));
            assertThat(marketLedger.find(WETH).orElseThrow().collateralBalance(ALICE)).isEqualByComparingTo("10");
        }
    }

    @Test
    @DisplayName("liquidation of a healthy borrower is refused; unknown markets are reported")
    void liquidation() {
        assertThatThrownBy(() -> positionsManager.authorizeLiquidation(DAI, WETH, BOB))
                .satisfies(e -> assertThat(((MatchingEngineException) e).getErrorCode())
                        .isEqualTo(UnauthorizedActionException.UNAUTHORIZED_LIQUIDATE));
        assertThatThrownBy(() -> positionsManager.authorizeLiquidation(DAI, DAVE, BOB))
                .satisfies(e -> assertThat(((MatchingEngineException) e).getErrorCode())
                        .isEqualTo(InvalidInputException.MARKET_NOT_CREATED));
    }

    private MarketState state() {
        return marketLedger.find(DAI).orElseThrow();
    }

    private static Indexes indexes(String poolSupply, String p2pSupply, String poolBorrow, String p2pBorrow) {
        return new Indexes(new MarketSideIndexes(new BigDecimal(poolSupply), new BigDecimal(p2pSupply)),
                new MarketSideIndexes(new BigDecimal(poolBorrow), new BigDecimal(p2pBorrow)));
    }

    private static void assertMarketConsistent(MarketState state) {
        for (MarketSide side : MarketSide.values()) {
            MarketSideIndexes sideIndexes = state.market().getIndexes().of(side);
            MarketSideDelta delta = state.market().getDeltas().of(side);
            assertThat(RayMath.mul(delta.getScaledP2PTotal(), sideIndexes.p2pIndex()))
                    .as("%s P2P volume covers its delta", side)
                    .isGreaterThanOrEqualTo(RayMath.mul(delta.getScaledDelta(), sideIndexes.poolIndex()));
            Map<String, BigDecimal> onPool = state.balances().pool(side).values();
            assertThat(onPool.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add))
                    .as("%s pool queue sums to its total", side)
                    .isEqualByComparingTo(state.balances().pool(side).total());
        }
    }
}
