package com.trade.orchestra.test.service;

import com.trade.orchestra.bus.InMemoryEventBus;
import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.ExchangeCode;
import com.trade.orchestra.enums.PositionSide;
import com.trade.orchestra.model.exchange.AccountSnapshot;
import com.trade.orchestra.model.exchange.BalanceSnapshot;
import com.trade.orchestra.model.exchange.PositionSnapshot;
import com.trade.orchestra.model.risk.PortfolioRiskLimits;
import com.trade.orchestra.model.risk.RiskState;
import com.trade.orchestra.service.portfolio.ExchangeAccountProvider;
import com.trade.orchestra.service.portfolio.PortfolioManager;
import com.trade.orchestra.service.portfolio.PortfolioSyncService;
import com.trade.orchestra.service.risk.RiskManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PortfolioSyncServiceTest {

    private PortfolioManager portfolio;
    private RiskManager risk;

    @BeforeEach
    void setUp() {
        InMemoryEventBus bus = new InMemoryEventBus();
        bus.connect();
        Clock clock = Clock.systemUTC();
        portfolio = new PortfolioManager("main", "Main", bus, clock);
        portfolio.initialize(10_000);
        risk = new RiskManager(bus, PortfolioRiskLimits.defaults(), clock);
        risk.initialize("main", 10_000);
    }

    private static AccountSnapshot account(ExchangeCode ex, double equity) {
        return new AccountSnapshot(ex, List.of(new BalanceSnapshot("USDT", ex, equity, 0, equity, equity)),
                equity, equity, 0, 0, null, 0L);
    }

    private static PositionSnapshot btc(ExchangeCode ex, double qty) {
        return new PositionSnapshot("p1", "BTCUSDT", ex, PositionSide.LONG, 50_000, 50_000, qty, qty * 50_000,
                0, 0, 5, qty * 10_000, null, 1L, 1L);
    }

    private static ExchangeAccountProvider provider(ExchangeCode ex, BotCode owner) {
        ExchangeAccountProvider p = mock(ExchangeAccountProvider.class);
        when(p.exchange()).thenReturn(ex);
        when(p.owner()).thenReturn(owner);
        return p;
    }

    @Test
    void syncFeedsPortfolioAndRisk() throws Exception {
        ExchangeAccountProvider binance = provider(ExchangeCode.BINANCE, BotCode.GRD);
        when(binance.fetchAccount()).thenReturn(account(ExchangeCode.BINANCE, 6_000));
        when(binance.fetchPositions()).thenReturn(List.of(btc(ExchangeCode.BINANCE, 0.02)));
        ExchangeAccountProvider bybit = provider(ExchangeCode.BYBIT, null);
        when(bybit.fetchAccount()).thenReturn(account(ExchangeCode.BYBIT, 4_000));
        when(bybit.fetchPositions()).thenReturn(List.of());

        int ok = new PortfolioSyncService(portfolio, risk, List.of(binance, bybit)).syncAll();

        assertThat(ok).isEqualTo(2);
        assertThat(portfolio.getTotalEquity()).isEqualTo(10_000);
        assertThat(portfolio.getPosition("BTCUSDT").orElseThrow().getByBot()).containsOnlyKeys(BotCode.GRD);

        RiskState s = risk.getState("main");
        assertThat(s.getTotalEquity()).isEqualTo(10_000);
        assertThat(s.getExposure()).isEqualTo(1_000);
        assertThat(s.getOpenPositions()).isEqualTo(1);
        assertThat(s.getLeverage()).isEqualTo(5);
    }

    @Test
    void failingExchangeIsSkipped() throws Exception {
        ExchangeAccountProvider broken = provider(ExchangeCode.OKX, null);
        when(broken.fetchAccount()).thenThrow(new IOException("timeout"));
        ExchangeAccountProvider binance = provider(ExchangeCode.BINANCE, null);
        when(binance.fetchAccount()).thenReturn(account(ExchangeCode.BINANCE, 9_000));
        when(binance.fetchPositions()).thenReturn(List.of());

        int ok = new PortfolioSyncService(portfolio, risk, List.of(broken, binance)).syncAll();

        assertThat(ok).isEqualTo(1);
        assertThat(risk.getState("main").getTotalEquity()).isEqualTo(9_000);
        assertThat(risk.getState("main").getDrawdownPercent()).isCloseTo(10, within(1e-9));
    }

    @Test
    void openOrdersAreSummedAcrossExchanges() throws Exception {
        ExchangeAccountProvider binance = provider(ExchangeCode.BINANCE, null);
        when(binance.fetchAccount()).thenReturn(account(ExchangeCode.BINANCE, 6_000));
        when(binance.fetchPositions()).thenReturn(List.of());
        when(binance.fetchOpenOrderCount()).thenReturn(3, 1);
        ExchangeAccountProvider bybit = provider(ExchangeCode.BYBIT, null);
        when(bybit.fetchAccount()).thenReturn(account(ExchangeCode.BYBIT, 4_000))
                .thenThrow(new IOException("timeout"));
        when(bybit.fetchPositions()).thenReturn(List.of());
        when(bybit.fetchOpenOrderCount()).thenReturn(2);
        PortfolioSyncService sync = new PortfolioSyncService(portfolio, risk, List.of(binance, bybit));

        sync.syncAll();
        assertThat(risk.getState("main").getOpenOrders()).isEqualTo(5);

        // bybit keeps its last known count while it is failing
        sync.syncAll();
        assertThat(risk.getState("main").getOpenOrders()).isEqualTo(3);
    }

    @Test
    void positionMissingFromSnapshotIsClosed() throws Exception {
        ExchangeAccountProvider binance = provider(ExchangeCode.BINANCE, BotCode.GRD);
        when(binance.fetchAccount()).thenReturn(account(ExchangeCode.BINANCE, 10_000));
        when(binance.fetchPositions()).thenReturn(List.of(btc(ExchangeCode.BINANCE, 0.02)), List.of());
        PortfolioSyncService sync = new PortfolioSyncService(portfolio, risk, List.of(binance));

        sync.syncAll();
        assertThat(portfolio.getPositions()).hasSize(1);

        sync.syncAll();
        assertThat(portfolio.getPositions()).isEmpty();
        assertThat(risk.getExposureSummary("main").totalExposure()).isZero();
    }
}
