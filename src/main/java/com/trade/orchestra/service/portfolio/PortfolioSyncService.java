package com.trade.orchestra.service.portfolio;

import com.trade.orchestra.enums.ExchangeCode;
import com.trade.orchestra.model.exchange.AccountSnapshot;
import com.trade.orchestra.model.exchange.PositionSnapshot;
import com.trade.orchestra.model.portfolio.UnifiedPosition;
import com.trade.orchestra.model.risk.RiskState;
import com.trade.orchestra.service.risk.RiskManager;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pulls snapshots from every registered exchange into the portfolio, then refreshes the risk
 * state from the resulting unified view. A failing exchange is skipped; the others still sync.
 */
@Slf4j
public class PortfolioSyncService {

    private final PortfolioManager portfolio;
    private final RiskManager risk;
    private final List<ExchangeAccountProvider> providers;
    // last count each exchange reported; kept while an exchange is failing
    private final Map<ExchangeCode, Integer> openOrders = new EnumMap<>(ExchangeCode.class);

    public PortfolioSyncService(PortfolioManager portfolio, RiskManager risk, List<ExchangeAccountProvider> providers) {
        this.portfolio = portfolio;
        this.risk = risk;
        this.providers = providers == null ? List.of() : List.copyOf(providers);
    }

    /**
     * @return number of exchanges synced successfully
     */
    public synchronized int syncAll() {
        int ok = 0;
        for (ExchangeAccountProvider p : providers) {
            try {
                syncOne(p);
                ok++;
            } catch (Exception e) {
                log.warn("Portfolio sync failed for {}: {}", p.exchange(), e.toString());
            }
        }

        RiskState state = risk.updateState(portfolio.getPortfolioId(), portfolio.getTotalEquity(),
                portfolio.getAvailableBalance(), portfolio.getExposures(), totalOpenOrders());
        log.debug("Portfolio {} synced {}/{} exchanges, risk score={} level={}",
                portfolio.getPortfolioId(), ok, providers.size(), state.getRiskScore(), state.getRiskLevel());
        return ok;
    }

    private int totalOpenOrders() {
        int total = 0;
        for (int n : openOrders.values()) total += n;
        return total;
    }

    private static PositionSnapshot closed(String symbol, ExchangeCode exchange, UnifiedPosition.ExchangeLeg leg) {
        long now = System.currentTimeMillis();
        return new PositionSnapshot(symbol, symbol, exchange, leg.side(), leg.entryPrice(), leg.markPrice(),
                0, 0, 0, leg.realizedPnl(), leg.leverage(), 0, null, now, now);
    }

    private void syncOne(ExchangeAccountProvider p) throws Exception {
        AccountSnapshot account = p.fetchAccount();
        List<PositionSnapshot> fetched = p.fetchPositions();
        int orders = p.fetchOpenOrderCount();

        portfolio.updateFromExchange(p.exchange(), account);
        openOrders.put(p.exchange(), Math.max(0, orders));

        Set<String> seen = new HashSet<>();
        for (PositionSnapshot ps : fetched) {
            portfolio.updatePosition(ps, p.owner());
            seen.add(ps.symbol());
        }
        // symbols the exchange no longer reports were closed there
        for (UnifiedPosition up : portfolio.getPositions()) {
            UnifiedPosition.ExchangeLeg leg = up.getByExchange().get(p.exchange());
            if (leg != null && !seen.contains(up.getSymbol())) {
                portfolio.updatePosition(closed(up.getSymbol(), p.exchange(), leg), leg.reportedBy());
            }
        }
    }
}
