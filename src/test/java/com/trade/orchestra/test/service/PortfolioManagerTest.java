package com.trade.orchestra.test.service;

import com.trade.orchestra.bus.InMemoryEventBus;
import com.trade.orchestra.common.exception.PortfolioNotInitializedException;
import com.trade.orchestra.dto.PositionPayload;
import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.EventPriority;
import com.trade.orchestra.enums.ExchangeCode;
import com.trade.orchestra.enums.PositionSide;
import com.trade.orchestra.enums.RebalancePriority;
import com.trade.orchestra.enums.RebalanceType;
import com.trade.orchestra.model.Event;
import com.trade.orchestra.model.exchange.AccountSnapshot;
import com.trade.orchestra.model.exchange.BalanceSnapshot;
import com.trade.orchestra.model.exchange.PositionSnapshot;
import com.trade.orchestra.model.portfolio.AllocationTarget;
import com.trade.orchestra.model.portfolio.PerformanceMetrics;
import com.trade.orchestra.model.portfolio.PortfolioSummary;
import com.trade.orchestra.model.portfolio.RebalanceAction;
import com.trade.orchestra.model.portfolio.UnifiedPosition;
import com.trade.orchestra.model.risk.PositionExposure;
import com.trade.orchestra.service.portfolio.PortfolioManager;
import com.trade.orchestra.test.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PortfolioManagerTest {

    private InMemoryEventBus bus;
    private MutableClock clock;
    private PortfolioManager portfolio;

    @BeforeEach
    void setUp() {
        bus = new InMemoryEventBus();
        bus.connect();
        clock = new MutableClock(Instant.parse("2026-01-05T10:00:00Z"));
        portfolio = new PortfolioManager("main", "Main portfolio", bus, clock);
        portfolio.initialize(10_000);
    }

    private static PositionSnapshot position(String symbol, ExchangeCode ex, double qty, double entry, double mark) {
        PositionSide side = qty < 0 ? PositionSide.SHORT : PositionSide.LONG;
        double notional = Math.abs(qty) * mark;
        double pnl = (mark - entry) * qty;
        return new PositionSnapshot(symbol + "-" + ex, symbol, ex, side, entry, mark, qty, notional, pnl, 0,
                5, notional / 5, null, 1_000L, 2_000L);
    }

    private static AccountSnapshot account(ExchangeCode ex, double equity, BalanceSnapshot... balances) {
        return new AccountSnapshot(ex, List.of(balances), equity, equity, 0, 0, null, 0L);
    }

    private static BalanceSnapshot balance(String asset, ExchangeCode ex, double free, double locked, double usd) {
        return new BalanceSnapshot(asset, ex, free, locked, free + locked, usd);
    }

    @Test
    void averageEntryIsWeightedAcrossExchanges() {
        portfolio.updatePosition(position("BTCUSDT", ExchangeCode.BINANCE, 1, 100, 130), BotCode.GRD);
        portfolio.updatePosition(position("BTCUSDT", ExchangeCode.BYBIT, 3, 120, 130), BotCode.DCA);

        UnifiedPosition p = portfolio.getPosition("BTCUSDT").orElseThrow();

        assertThat(p.getAvgEntryPrice()).isCloseTo(115, within(1e-9));
        assertThat(p.getTotalQuantity()).isEqualTo(4);
        assertThat(p.getTotalNotionalValue()).isEqualTo(520);
        assertThat(p.getUnrealizedPnl()).isEqualTo(60);
        assertThat(p.getBaseAsset()).isEqualTo("BTC");
        assertThat(p.getQuoteAsset()).isEqualTo("USDT");
        assertThat(p.getByBot()).containsOnlyKeys(BotCode.GRD, BotCode.DCA);
    }

    @Test
    void repeatedSnapshotOverwritesItsOwnSlot() {
        portfolio.updatePosition(position("BTCUSDT", ExchangeCode.BINANCE, 1, 100, 100), BotCode.GRD);
        portfolio.updatePosition(position("BTCUSDT", ExchangeCode.BYBIT, 3, 120, 120), BotCode.DCA);

        portfolio.updatePosition(position("BTCUSDT", ExchangeCode.BINANCE, 2, 110, 110), BotCode.GRD);
        portfolio.updatePosition(position("BTCUSDT", ExchangeCode.BINANCE, 2, 110, 110), BotCode.GRD);

        UnifiedPosition p = portfolio.getPosition("BTCUSDT").orElseThrow();
        assertThat(p.getTotalQuantity()).isEqualTo(5);
        assertThat(p.getAvgEntryPrice()).isCloseTo((2 * 110 + 3 * 120) / 5.0, within(1e-9));
    }

    @Test
    void zeroQuantityClosesSlotAndThenSymbol() {
        portfolio.updatePosition(position("ETHUSDT", ExchangeCode.BINANCE, 2, 2_000, 2_100), BotCode.GRD);
        portfolio.updatePosition(position("ETHUSDT", ExchangeCode.OKX, -1, 2_050, 2_100), BotCode.ARB);

        portfolio.updatePosition(position("ETHUSDT", ExchangeCode.BINANCE, 0, 2_000, 2_100), BotCode.GRD);

        UnifiedPosition p = portfolio.getPosition("ETHUSDT").orElseThrow();
        assertThat(p.getByExchange()).containsOnlyKeys(ExchangeCode.OKX);
        assertThat(p.getByBot()).containsOnlyKeys(BotCode.ARB);
        assertThat(p.getTotalQuantity()).isEqualTo(-1);

        portfolio.updatePosition(position("ETHUSDT", ExchangeCode.OKX, 0, 2_050, 2_100), BotCode.ARB);

        assertThat(portfolio.getPosition("ETHUSDT")).isEmpty();
        assertThat(portfolio.getPositions()).isEmpty();
    }

    @Test
    void oneBotOnTwoExchangesKeepsBothLegs() {
        portfolio.updatePosition(position("BTCUSDT", ExchangeCode.BINANCE, 1, 100, 100), BotCode.GRD);
        portfolio.updatePosition(position("BTCUSDT", ExchangeCode.BYBIT, 3, 120, 120), BotCode.GRD);

        UnifiedPosition p = portfolio.getPosition("BTCUSDT").orElseThrow();
        assertThat(p.getByBot()).containsOnlyKeys(BotCode.GRD);
        assertThat(p.getByBot().get(BotCode.GRD)).containsOnlyKeys(ExchangeCode.BINANCE, ExchangeCode.BYBIT);
        assertThat(p.getByBot().get(BotCode.GRD).get(ExchangeCode.BINANCE).quantity()).isEqualTo(1);

        portfolio.updatePosition(position("BTCUSDT", ExchangeCode.BYBIT, 0, 120, 120), BotCode.GRD);

        p = portfolio.getPosition("BTCUSDT").orElseThrow();
        assertThat(p.getByExchange()).containsOnlyKeys(ExchangeCode.BINANCE);
        assertThat(p.getByBot().get(BotCode.GRD)).containsOnlyKeys(ExchangeCode.BINANCE);
        assertThat(p.getTotalQuantity()).isEqualTo(1);
    }

    @Test
    void returnedPositionsAreCopies() {
        portfolio.updatePosition(position("BTCUSDT", ExchangeCode.BINANCE, 1, 100, 100), BotCode.GRD);

        portfolio.getPosition("BTCUSDT").orElseThrow().getByExchange().clear();

        assertThat(portfolio.getPosition("BTCUSDT").orElseThrow().getByExchange()).hasSize(1);
    }

    @Test
    void equityIsSumOfExchangesAndAllocationsFollow() {
        portfolio.updateFromExchange(ExchangeCode.BINANCE, account(ExchangeCode.BINANCE, 6_000,
                balance("USDT", ExchangeCode.BINANCE, 5_000, 1_000, 6_000.0)));
        portfolio.updateFromExchange(ExchangeCode.BYBIT, account(ExchangeCode.BYBIT, 4_000,
                balance("BTC", ExchangeCode.BYBIT, 0.1, 0, 4_000.0)));

        assertThat(portfolio.getTotalEquity()).isEqualTo(10_000);
        assertThat(portfolio.getBalance("USDT").orElseThrow().getAllocationPercent()).isCloseTo(60, within(1e-9));
        assertThat(portfolio.getAvailableBalance()).isCloseTo(9_000, within(1e-9));

        portfolio.updateFromExchange(ExchangeCode.BINANCE, account(ExchangeCode.BINANCE, 8_000,
                balance("USDT", ExchangeCode.BINANCE, 8_000, 0, 8_000.0)));

        assertThat(portfolio.getTotalEquity()).isEqualTo(12_000);
        assertThat(portfolio.getBalance("BTC").orElseThrow().getAllocationPercent()).isCloseTo(33.333, within(1e-3));
        assertThat(portfolio.getBalance("USDT").orElseThrow().getByExchange()).containsOnlyKeys(ExchangeCode.BINANCE);
    }

    @Test
    void metricsOverTradeHistory() {
        portfolio.recordTrade("BTCUSDT", ExchangeCode.BINANCE, BotCode.GRD, 100);
        portfolio.recordTrade("BTCUSDT", ExchangeCode.BINANCE, BotCode.GRD, 200);
        portfolio.recordTrade("ETHUSDT", ExchangeCode.BYBIT, BotCode.DCA, -50);
        portfolio.recordTrade("ETHUSDT", ExchangeCode.BYBIT, BotCode.DCA, -50);

        PerformanceMetrics m = portfolio.getPerformanceMetrics();

        assertThat(m.totalTrades()).isEqualTo(4);
        assertThat(m.winRate()).isEqualTo(50);
        assertThat(m.avgWin()).isEqualTo(150);
        assertThat(m.avgLoss()).isEqualTo(50);
        assertThat(m.profitFactor()).isEqualTo(3);
        assertThat(m.sharpeRatio()).isCloseTo(50 / Math.sqrt(11_250), within(1e-9));
        assertThat(m.sortinoRatio()).isCloseTo(1.0, within(1e-9));
        assertThat(m.maxConsecutiveWins()).isEqualTo(2);
        assertThat(m.maxConsecutiveLosses()).isEqualTo(2);
        assertThat(m.largestWin()).isEqualTo(200);
        assertThat(m.largestLoss()).isEqualTo(-50);
    }

    @Test
    void metricsWithoutTradesAreZero() {
        PerformanceMetrics m = portfolio.getPerformanceMetrics();

        assertThat(m.totalTrades()).isZero();
        assertThat(m.winRate()).isZero();
        assertThat(m.profitFactor()).isZero();
        assertThat(m.sharpeRatio()).isZero();
    }

    @Test
    void recordTradePublishesPositionUpdate() {
        portfolio.updatePosition(position("BTCUSDT", ExchangeCode.BINANCE, 1, 100, 110), BotCode.GRD);

        portfolio.recordTrade("BTCUSDT", ExchangeCode.BINANCE, BotCode.GRD, 42);

        List<Event<?>> events = bus.getHistory("trading.position.updated");
        assertThat(events).hasSize(1);
        assertThat(events.get(0).source()).isEqualTo(BotCode.GRD);
        PositionPayload p = (PositionPayload) events.get(0).payload();
        assertThat(p.symbol()).isEqualTo("BTCUSDT");
        assertThat(p.realizedPnl()).isEqualTo(42);
        assertThat(p.side()).isEqualTo(PositionSide.LONG);
        assertThat(portfolio.getTradeHistory()).singleElement()
                .satisfies(t -> assertThat(t.timestamp()).isEqualTo(clock.millis()));
    }

    @Test
    void rebalanceActionsAreSortedByUrgency() {
        portfolio.updateFromExchange(ExchangeCode.BINANCE, account(ExchangeCode.BINANCE, 10_000,
                balance("USDT", ExchangeCode.BINANCE, 6_500, 0, 6_500.0),
                balance("BTC", ExchangeCode.BINANCE, 0.05, 0, 3_000.0),
                balance("ETH", ExchangeCode.BINANCE, 1, 0, 500.0)));
        portfolio.setAllocationTargets(List.of(
                new AllocationTarget("ETH", 10, 10, 2),
                new AllocationTarget("BTC", 30, 5, 2),
                new AllocationTarget("SOL", 5, 5, 1),
                new AllocationTarget("USDT", 50, 10, 2)));

        List<RebalanceAction> actions = portfolio.getRebalanceActions();

        assertThat(actions).extracting(RebalanceAction::asset).containsExactly("USDT", "ETH");
        RebalanceAction sell = actions.get(0);
        assertThat(sell.type()).isEqualTo(RebalanceType.SELL);
        assertThat(sell.priority()).isEqualTo(RebalancePriority.HIGH);
        assertThat(sell.estimatedValue()).isCloseTo(1_500, within(1e-6));
        assertThat(sell.reason()).isEqualTo("Allocation 65.0% differs from target 50%");
        RebalanceAction buy = actions.get(1);
        assertThat(buy.type()).isEqualTo(RebalanceType.BUY);
        assertThat(buy.priority()).isEqualTo(RebalancePriority.MEDIUM);
        assertThat(buy.quantity()).isCloseTo(1, within(1e-9));
        assertThat(portfolio.getBalance("ETH").orElseThrow().getTargetAllocation()).isEqualTo(10);
    }

    @Test
    void summaryCombinesPositionsAndPublishes() {
        portfolio.updateFromExchange(ExchangeCode.BINANCE, account(ExchangeCode.BINANCE, 10_000,
                balance("USDT", ExchangeCode.BINANCE, 10_000, 0, 10_000.0)));
        portfolio.updatePosition(position("BTCUSDT", ExchangeCode.BINANCE, 1, 100, 100), BotCode.GRD);
        portfolio.updatePosition(position("ETHUSDT", ExchangeCode.OKX, -1, 100, 100), BotCode.ARB);

        PortfolioSummary s = portfolio.publishSummary();

        assertThat(s.id()).isEqualTo("main");
        assertThat(s.openPositions()).isEqualTo(2);
        assertThat(s.longValue()).isEqualTo(100);
        assertThat(s.shortValue()).isEqualTo(100);
        assertThat(s.netExposure()).isZero();
        assertThat(s.hedgeRatio()).isEqualTo(1);
        assertThat(s.avgLeverage()).isEqualTo(5);
        assertThat(s.positionsByExchange()).containsEntry(ExchangeCode.BINANCE, 1).containsEntry(ExchangeCode.OKX, 1);
        assertThat(s.positionsByBot()).containsEntry(BotCode.GRD, 1);

        List<Event<?>> events = bus.getHistory("risk.portfolio.updated");
        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.priority()).isEqualTo(EventPriority.LOW);
            assertThat(e.payload()).isEqualTo(s);
        });
    }

    @Test
    void exposuresCarryReporterAndSide() {
        portfolio.updatePosition(position("ETHUSDT", ExchangeCode.OKX, -2, 100, 90), BotCode.ARB);

        List<PositionExposure> exposures = portfolio.getExposures();

        assertThat(exposures).singleElement().satisfies(e -> {
            assertThat(e.side()).isEqualTo(PositionSide.SHORT);
            assertThat(e.botCode()).isEqualTo(BotCode.ARB);
            assertThat(e.quantity()).isEqualTo(2);
            assertThat(e.pnl()).isEqualTo(20);
            assertThat(e.pnlPercent()).isCloseTo(10, within(1e-9));
        });
    }

    @Test
    void periodResetsMoveBaselines() {
        portfolio.updateFromExchange(ExchangeCode.BINANCE, account(ExchangeCode.BINANCE, 11_000));
        assertThat(portfolio.getSummary().dailyPnl()).isEqualTo(1_000);

        portfolio.resetDaily();
        portfolio.updateFromExchange(ExchangeCode.BINANCE, account(ExchangeCode.BINANCE, 10_500));

        PortfolioSummary s = portfolio.getSummary();
        assertThat(s.dailyPnl()).isEqualTo(-500);
        assertThat(s.weeklyPnl()).isEqualTo(500);
        assertThat(s.maxDrawdown()).isEqualTo(500);
    }

    @Test
    void uninitializedPortfolioRejectsUpdates() {
        PortfolioManager fresh = new PortfolioManager("other", "Other", bus, clock);

        assertThat(fresh.isInitialized()).isFalse();
        assertThatThrownBy(() -> fresh.updatePosition(position("BTCUSDT", ExchangeCode.BINANCE, 1, 1, 1), null))
                .isInstanceOf(PortfolioNotInitializedException.class);
        assertThatThrownBy(fresh::getSummary).isInstanceOf(PortfolioNotInitializedException.class);
    }
}
