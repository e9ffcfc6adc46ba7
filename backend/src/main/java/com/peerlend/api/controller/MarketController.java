package com.peerlend.api.controller;

import com.peerlend.api.dto.MarketResponse;
import com.peerlend.api.dto.PositionResponse;
import com.peerlend.api.dto.SnapshotResponse;
import com.peerlend.api.validation.AssetAddress;
import com.peerlend.domain.Market;
import com.peerlend.domain.MarketBalances;
import com.peerlend.domain.MarketSide;
import com.peerlend.domain.MarketSideDelta;
import com.peerlend.domain.MarketSideIndexes;
import com.peerlend.domain.MarketSnapshot;
import com.peerlend.domain.MarketState;
import com.peerlend.domain.UserMarkets;
import com.peerlend.matching.delta.DeltaTracker;
import com.peerlend.matching.ledger.MarketLedger;
import com.peerlend.snapshot.MarketSnapshotService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of committed markets and positions:
 * GET /markets, GET /markets/{underlying}, GET /markets/{underlying}/positions/{user},
 * GET /markets/{underlying}/snapshots/latest.
 */
@RestController
@RequestMapping("/api/v1/markets")
@RequiredArgsConstructor
@Validated
public class MarketController {

    private final MarketLedger marketLedger;
    private final MarketSnapshotService marketSnapshotService;

    @GetMapping
    public ResponseEntity<List<MarketResponse>> listMarkets() {
        List<MarketResponse> markets = marketLedger.underlyings().stream()
                .sorted()
                .map(marketLedger::find)
                .flatMap(Optional::stream)
                .map(MarketController::toMarketResponse)
                .toList();
        return ResponseEntity.ok(markets);
    }

    @GetMapping("/{underlying}")
    public ResponseEntity<?> getMarket(@PathVariable @AssetAddress String underlying) {
        return marketLedger.find(underlying.trim())
                .map(state -> ResponseEntity.ok(toMarketResponse(state)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{underlying}/positions/{user}")
    public ResponseEntity<?> getPosition(@PathVariable @AssetAddress String underlying,
                                         @PathVariable @AssetAddress String user) {
        String addr = user.trim();
        return marketLedger.find(underlying.trim())
                .map(state -> ResponseEntity.ok(toPositionResponse(state, addr, marketLedger.userMarkets(addr))))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{underlying}/snapshots/latest")
    public ResponseEntity<?> getLatestSnapshot(@PathVariable @AssetAddress String underlying) {
        return marketSnapshotService.latest(underlying.trim())
                .map(snapshot -> ResponseEntity.ok(toSnapshotResponse(snapshot)))
                .orElse(ResponseEntity.notFound().build());
    }

    private static MarketResponse toMarketResponse(MarketState state) {
        Market market = state.market();
        return new MarketResponse(
                market.getUnderlying(),
                market.isCollateral(),
                market.isP2pDisabled(),
                market.isDeprecated(),
                market.getEModeCategoryId(),
                market.getPausedActions().stream().map(Enum::name).sorted().toList(),
                market.getIdleSupply(),
                toSideResponse(state, MarketSide.SUPPLY),
                toSideResponse(state, MarketSide.BORROW),
                market.getLastUpdatedAt());
    }

    private static MarketResponse.SideResponse toSideResponse(MarketState state, MarketSide side) {
        Market market = state.market();
        MarketSideIndexes indexes = market.getIndexes().of(side);
        MarketSideDelta delta = market.getDeltas().of(side);
        MarketBalances balances = state.balances();
        return new MarketResponse.SideResponse(
                indexes.poolIndex(),
                indexes.p2pIndex(),
                delta.getScaledDelta(),
                delta.getScaledP2PTotal(),
                balances.pool(side).total(),
                DeltaTracker.trueP2P(market, market.getIndexes(), side),
                balances.pool(side).size(),
                balances.p2p(side).size());
    }

    private static PositionResponse toPositionResponse(MarketState state, String user, UserMarkets userMarkets) {
        MarketBalances balances = state.balances();
        String underlying = state.market().getUnderlying();
        return new PositionResponse(
                underlying,
                user,
                state.supplyBalance(user),
                balances.scaledPoolBalance(MarketSide.SUPPLY, user),
                balances.scaledP2PBalance(MarketSide.SUPPLY, user),
                state.borrowBalance(user),
                balances.scaledPoolBalance(MarketSide.BORROW, user),
                balances.scaledP2PBalance(MarketSide.BORROW, user),
                state.collateralBalance(user),
                balances.scaledCollateral(user),
                userMarkets.collateralMarkets().contains(underlying),
                userMarkets.borrowMarkets().contains(underlying));
    }

    private static SnapshotResponse toSnapshotResponse(MarketSnapshot s) {
        return new SnapshotResponse(
                s.getUnderlying(),
                s.getAction() != null ? s.getAction().name() : null,
                s.getCapturedAt(),
                s.getSupplyScaledDelta(),
                s.getSupplyScaledP2PTotal(),
                s.getBorrowScaledDelta(),
                s.getBorrowScaledP2PTotal(),
                s.getIdleSupply(),
                s.getScaledPoolSupplyTotal(),
                s.getScaledPoolBorrowTotal(),
                s.getPoolSupplyIndex(),
                s.getP2pSupplyIndex(),
                s.getPoolBorrowIndex(),
                s.getP2pBorrowIndex());
    }
}
