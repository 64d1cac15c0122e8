package com.trade.orchestra.service.portfolio;

import com.trade.orchestra.bus.EventBus;
import com.trade.orchestra.bus.EventTopics;
import com.trade.orchestra.bus.Events;
import com.trade.orchestra.common.exception.EventBusException;
import com.trade.orchestra.common.exception.PortfolioNotInitializedException;
import com.trade.orchestra.dto.PositionPayload;
import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.EventAction;
import com.trade.orchestra.enums.EventDomain;
import com.trade.orchestra.enums.EventEntity;
import com.trade.orchestra.enums.EventPriority;
import com.trade.orchestra.enums.ExchangeCode;
import com.trade.orchestra.enums.PositionSide;
import com.trade.orchestra.enums.PositionStatus;
import com.trade.orchestra.enums.RebalancePriority;
import com.trade.orchestra.enums.RebalanceType;
import com.trade.orchestra.model.exchange.AccountSnapshot;
import com.trade.orchestra.model.exchange.BalanceSnapshot;
import com.trade.orchestra.model.exchange.PositionSnapshot;
import com.trade.orchestra.model.portfolio.AllocationTarget;
import com.trade.orchestra.model.portfolio.PerformanceMetrics;
import com.trade.orchestra.model.portfolio.PortfolioSummary;
import com.trade.orchestra.model.portfolio.RebalanceAction;
import com.trade.orchestra.model.portfolio.TradeRecord;
import com.trade.orchestra.model.portfolio.UnifiedBalance;
import com.trade.orchestra.model.portfolio.UnifiedPosition;
import com.trade.orchestra.model.risk.PositionExposure;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unified view of one portfolio across exchanges and bots.
 * <p>
 * Every snapshot overwrites only its own exchange (and bot) slot; the aggregates are then rebuilt
 * from all slots, so a stale or repeated snapshot from one exchange cannot corrupt another.
 * Performance statistics come from the append-only trade history.
 */
@Slf4j
public class PortfolioManager {

    private static final Set<String> STABLES = Set.of("USDT", "USDC", "BUSD");

    @Getter
    private final String portfolioId;
    @Getter
    private final String name;
    private final EventBus bus;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, UnifiedPosition> positions = new LinkedHashMap<>();
    private final Map<String, UnifiedBalance> balances = new LinkedHashMap<>();
    private final Map<String, AllocationTarget> allocations = new LinkedHashMap<>();
    private final Map<ExchangeCode, Double> equityByExchange = new EnumMap<>(ExchangeCode.class);
    private final List<TradeRecord> trades = new ArrayList<>();

    private boolean initialized;
    private double totalEquity;
    private double peakEquity;
    private double dailyStartEquity;
    private double weeklyStartEquity;
    private double monthlyStartEquity;

    public PortfolioManager(String portfolioId, String name, EventBus bus, Clock clock) {
        this.portfolioId = portfolioId;
        this.name = name;
        this.bus = bus;
        this.clock = clock;
    }

    public void initialize(double startingEquity) {
        lock.lock();
        try {
            totalEquity = startingEquity;
            peakEquity = startingEquity;
            dailyStartEquity = startingEquity;
            weeklyStartEquity = startingEquity;
            monthlyStartEquity = startingEquity;
            initialized = true;
        } finally {
            lock.unlock();
        }
        log.info("Portfolio {} ({}) initialized equity={}", portfolioId, name, startingEquity);
    }

    public boolean isInitialized() {
        return initialized;
    }

    // ---------------------------------------------------------------- exchange snapshots

    /**
     * Take an exchange's account snapshot. Portfolio equity is the sum of the latest equity
     * reported by each exchange.
     */
    public void updateFromExchange(ExchangeCode exchange, AccountSnapshot account) {
        lock.lock();
        try {
            requireInitialized();
            equityByExchange.put(exchange, account.totalEquity());
            double sum = 0;
            for (double e : equityByExchange.values()) sum += e;
            totalEquity = sum;
            if (totalEquity > peakEquity) peakEquity = totalEquity;

            for (BalanceSnapshot b : account.balances()) {
                putBalance(exchange, b);
            }
            for (UnifiedBalance ub : balances.values()) {
                ub.reallocate(totalEquity);
            }
        } finally {
            lock.unlock();
        }
        log.debug("Portfolio {} synced {} equity={} total={}", portfolioId, exchange, account.totalEquity(), totalEquity);
    }

    public void updateBalance(ExchangeCode exchange, BalanceSnapshot balance) {
        lock.lock();
        try {
            requireInitialized();
            putBalance(exchange, balance);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Write the position into its exchange and bot slots and rebuild the symbol aggregate.
     * A zero quantity clears the slots; the symbol disappears once no slot is left.
     */
    public void updatePosition(PositionSnapshot position, BotCode bot) {
        lock.lock();
        try {
            requireInitialized();
            long now = clock.millis();
            UnifiedPosition up = positions.get(position.symbol());
            if (up == null) {
                if (position.quantity() == 0) return;
                up = UnifiedPosition.open(position.symbol(), position.openedAt() > 0 ? position.openedAt() : now);
                positions.put(position.symbol(), up);
            }

            if (position.quantity() == 0) {
                up.getByExchange().remove(position.exchange());
                up.removeBotLegs(position.exchange());
            } else {
                up.getByExchange().put(position.exchange(), new UnifiedPosition.ExchangeLeg(
                        position.side(), position.quantity(), position.entryPrice(), position.markPrice(),
                        Math.abs(position.notionalValue()), position.unrealizedPnl(), position.realizedPnl(),
                        position.margin(), position.leverage(), position.liquidationPrice(), bot));
                if (bot != null) {
                    up.putBotLeg(bot, new UnifiedPosition.BotLeg(position.exchange(), position.quantity(),
                            position.entryPrice(), Math.abs(position.notionalValue()), position.unrealizedPnl()));
                }
            }

            if (up.isEmpty()) {
                positions.remove(position.symbol());
                log.info("Portfolio {} closed {}", portfolioId, position.symbol());
            } else {
                up.recalculate(now);
            }
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- trades

    /**
     * Append a closed trade's PnL to the history and announce it on {@code trading.position.updated}.
     */
    public void recordTrade(String symbol, ExchangeCode exchange, BotCode bot, double pnl) {
        PositionPayload payload;
        lock.lock();
        try {
            requireInitialized();
            long now = clock.millis();
            trades.add(new TradeRecord(now, pnl, symbol, exchange, bot));
            payload = positionPayload(symbol, exchange, bot, pnl, now);
        } finally {
            lock.unlock();
        }
        try {
            bus.publish(Events.create(EventDomain.TRADING, EventEntity.POSITION, EventAction.UPDATED, bot, payload));
        } catch (EventBusException e) {
            log.warn("Failed to publish {} for {}: {}", EventTopics.POSITION_UPDATED, symbol, e.getMessage());
        }
    }

    private PositionPayload positionPayload(String symbol, ExchangeCode exchange, BotCode bot, double pnl, long now) {
        UnifiedPosition up = positions.get(symbol);
        if (up == null) {
            return new PositionPayload(symbol, symbol, exchange == null ? null : exchange.name(), null,
                    PositionStatus.CLOSED, 0, 0, 0, 0, 0, pnl, 1, 0, null, now, bot);
        }
        UnifiedPosition.ExchangeLeg leg = exchange == null ? null : up.getByExchange().get(exchange);
        PositionSide side = up.getTotalQuantity() < 0 ? PositionSide.SHORT : PositionSide.LONG;
        return new PositionPayload(up.getId(), symbol, exchange == null ? null : exchange.name(), side,
                PositionStatus.OPEN, up.getAvgEntryPrice(), leg == null ? 0 : leg.markPrice(),
                Math.abs(up.getTotalQuantity()), up.getTotalNotionalValue(), up.getUnrealizedPnl(), pnl,
                leg == null ? 1 : leg.leverage(), up.totalMargin(), up.getOpenedAt(), null, bot);
    }

    // ---------------------------------------------------------------- reporting

    public PortfolioSummary getSummary() {
        lock.lock();
        try {
            requireInitialized();
            double longValue = 0;
            double shortValue = 0;
            double margin = 0;
            double levSum = 0;
            int levCount = 0;
            double maxLev = 1;
            Map<ExchangeCode, Integer> byExchange = new EnumMap<>(ExchangeCode.class);
            Map<BotCode, Integer> byBot = new EnumMap<>(BotCode.class);

            for (UnifiedPosition p : positions.values()) {
                for (Map.Entry<ExchangeCode, UnifiedPosition.ExchangeLeg> e : p.getByExchange().entrySet()) {
                    UnifiedPosition.ExchangeLeg leg = e.getValue();
                    if (isShort(leg)) shortValue += leg.notionalValue();
                    else longValue += leg.notionalValue();
                    margin += leg.margin();
                    levSum += leg.leverage();
                    levCount++;
                    maxLev = Math.max(maxLev, leg.leverage());
                    byExchange.merge(e.getKey(), 1, Integer::sum);
                }
                for (BotCode b : p.getByBot().keySet()) {
                    byBot.merge(b, 1, Integer::sum);
                }
            }

            double exposure = longValue + shortValue;
            double net = longValue - shortValue;
            double totalPnl = 0;
            for (TradeRecord t : trades) totalPnl += t.pnl();
            double dailyPnl = totalEquity - dailyStartEquity;
            double weeklyPnl = totalEquity - weeklyStartEquity;
            double monthlyPnl = totalEquity - monthlyStartEquity;
            PerformanceMetrics m = metrics();

            return new PortfolioSummary(
                    portfolioId, name, totalEquity, availableBalance(), margin,
                    totalPnl, percentOf(totalPnl, totalEquity - totalPnl),
                    dailyPnl, percentOf(dailyPnl, dailyStartEquity),
                    weeklyPnl, percentOf(weeklyPnl, weeklyStartEquity),
                    monthlyPnl, percentOf(monthlyPnl, monthlyStartEquity),
                    positions.size(), exposure, longValue, shortValue, byExchange, byBot,
                    exposure, percentOf(exposure, totalEquity), net,
                    exposure > 0 ? 1 - Math.abs(net) / exposure : 0,
                    levCount > 0 ? levSum / levCount : 1, maxLev,
                    m.winRate(), m.profitFactor(), m.sharpeRatio(), m.sortinoRatio(), m.calmarRatio(),
                    m.maxDrawdown(), m.maxDrawdownPercent(),
                    clock.millis());
        } finally {
            lock.unlock();
        }
    }

    public PerformanceMetrics getPerformanceMetrics() {
        lock.lock();
        try {
            requireInitialized();
            return metrics();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Publish the current summary on {@code risk.portfolio.updated}.
     */
    public PortfolioSummary publishSummary() {
        PortfolioSummary summary = getSummary();
        try {
            bus.publish(Events.create(EventDomain.RISK, EventEntity.PORTFOLIO, EventAction.UPDATED,
                    BotCode.WLF, summary, EventPriority.LOW, null, null, null));
        } catch (EventBusException e) {
            log.warn("Failed to publish {} for {}: {}", EventTopics.RISK_PORTFOLIO_UPDATED, portfolioId, e.getMessage());
        }
        return summary;
    }

    private PerformanceMetrics metrics() {
        int n = trades.size();
        int wins = 0;
        int losses = 0;
        double grossProfit = 0;
        double grossLoss = 0;
        double largestWin = 0;
        double largestLoss = 0;
        double sum = 0;
        double negSquares = 0;
        int curWins = 0;
        int curLosses = 0;
        int maxWins = 0;
        int maxLosses = 0;

        for (TradeRecord t : trades) {
            double pnl = t.pnl();
            sum += pnl;
            if (pnl > 0) {
                wins++;
                grossProfit += pnl;
                largestWin = Math.max(largestWin, pnl);
                curWins++;
                curLosses = 0;
            } else if (pnl < 0) {
                losses++;
                grossLoss += pnl;
                largestLoss = Math.min(largestLoss, pnl);
                negSquares += pnl * pnl;
                curLosses++;
                curWins = 0;
            } else {
                curWins = 0;
                curLosses = 0;
            }
            maxWins = Math.max(maxWins, curWins);
            maxLosses = Math.max(maxLosses, curLosses);
        }

        double mean = n > 0 ? sum / n : 0;
        double sharpe = 0;
        double sortino = 0;
        if (n >= 2) {
            double var = 0;
            for (TradeRecord t : trades) var += (t.pnl() - mean) * (t.pnl() - mean);
            double sd = Math.sqrt(var / n);
            sharpe = sd > 0 ? mean / sd : 0;
            // downside deviation: root mean square of the losing trades
            double downDev = losses > 0 ? Math.sqrt(negSquares / losses) : 0;
            sortino = downDev > 0 ? mean / downDev : 0;
        }

        double drawdown = peakEquity - totalEquity;
        double drawdownPct = percentOf(drawdown, peakEquity);
        // naive annualisation of the month to date
        double calmar = drawdownPct > 0 ? (totalEquity - monthlyStartEquity) * 12 / drawdownPct : 0;

        return new PerformanceMetrics(
                n, wins, losses,
                n > 0 ? (double) wins / n * 100 : 0,
                wins > 0 ? grossProfit / wins : 0,
                losses > 0 ? Math.abs(grossLoss / losses) : 0,
                grossLoss < 0 ? grossProfit / Math.abs(grossLoss) : 0,
                sharpe, sortino, calmar,
                drawdown, drawdownPct,
                maxWins, maxLosses, largestWin, largestLoss);
    }

    // ---------------------------------------------------------------- read models

    public double getTotalEquity() {
        lock.lock();
        try {
            return totalEquity;
        } finally {
            lock.unlock();
        }
    }

    public double getAvailableBalance() {
        lock.lock();
        try {
            return availableBalance();
        } finally {
            lock.unlock();
        }
    }

    public List<UnifiedPosition> getPositions() {
        lock.lock();
        try {
            List<UnifiedPosition> out = new ArrayList<>(positions.size());
            for (UnifiedPosition p : positions.values()) out.add(p.copy());
            return out;
        } finally {
            lock.unlock();
        }
    }

    public Optional<UnifiedPosition> getPosition(String symbol) {
        lock.lock();
        try {
            UnifiedPosition p = positions.get(symbol);
            return p == null ? Optional.empty() : Optional.of(p.copy());
        } finally {
            lock.unlock();
        }
    }

    public List<UnifiedBalance> getBalances() {
        lock.lock();
        try {
            List<UnifiedBalance> out = new ArrayList<>(balances.size());
            for (UnifiedBalance b : balances.values()) out.add(b.copy());
            return out;
        } finally {
            lock.unlock();
        }
    }

    public Optional<UnifiedBalance> getBalance(String asset) {
        lock.lock();
        try {
            UnifiedBalance b = balances.get(asset);
            return b == null ? Optional.empty() : Optional.of(b.copy());
        } finally {
            lock.unlock();
        }
    }

    public List<TradeRecord> getTradeHistory() {
        lock.lock();
        try {
            return List.copyOf(trades);
        } finally {
            lock.unlock();
        }
    }

    /**
     * One exposure per exchange slot, attributed to the bot that last reported it. Feeds
     * {@code RiskManager#updateState}.
     */
    public List<PositionExposure> getExposures() {
        lock.lock();
        try {
            List<PositionExposure> out = new ArrayList<>();
            for (UnifiedPosition p : positions.values()) {
                for (Map.Entry<ExchangeCode, UnifiedPosition.ExchangeLeg> e : p.getByExchange().entrySet()) {
                    UnifiedPosition.ExchangeLeg leg = e.getValue();
                    double basis = Math.abs(leg.quantity()) * leg.entryPrice();
                    out.add(new PositionExposure(p.getSymbol(), e.getKey(), leg.reportedBy(),
                            isShort(leg) ? PositionSide.SHORT : PositionSide.LONG,
                            Math.abs(leg.quantity()), leg.notionalValue(), leg.margin(), leg.leverage(),
                            leg.pnl(), percentOf(leg.pnl(), basis), leg.entryPrice(), leg.markPrice(),
                            leg.liquidationPrice()));
                }
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- allocation

    /**
     * Add or replace targets by asset. Targets for other assets stay in place.
     */
    public void setAllocationTargets(List<AllocationTarget> targets) {
        lock.lock();
        try {
            for (AllocationTarget t : targets) {
                allocations.put(t.asset(), t);
                UnifiedBalance b = balances.get(t.asset());
                if (b != null) b.setTargetAllocation(t.targetPercent());
            }
        } finally {
            lock.unlock();
        }
    }

    public List<AllocationTarget> getAllocationTargets() {
        lock.lock();
        try {
            return new ArrayList<>(allocations.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Actions closing each allocation gap above its threshold, most urgent first.
     * Assets with a target but no balance are skipped.
     */
    public List<RebalanceAction> getRebalanceActions() {
        lock.lock();
        try {
            requireInitialized();
            List<RebalanceAction> actions = new ArrayList<>();
            for (AllocationTarget target : allocations.values()) {
                UnifiedBalance b = balances.get(target.asset());
                if (b == null) continue;

                double deviation = b.getAllocationPercent() - target.targetPercent();
                double gap = Math.abs(deviation);
                if (gap <= target.rebalanceThreshold()) continue;

                double value = gap / 100 * totalEquity;
                double unit = b.unitPrice();
                actions.add(new RebalanceAction(
                        deviation > 0 ? RebalanceType.SELL : RebalanceType.BUY,
                        target.asset(), null, null,
                        unit > 0 ? value / unit : 0,
                        value,
                        String.format(Locale.ROOT, "Allocation %.1f%% differs from target %s%%",
                                b.getAllocationPercent(), num(target.targetPercent())),
                        gap > target.tolerancePercent() ? RebalancePriority.HIGH : RebalancePriority.MEDIUM));
            }
            actions.sort(Comparator.comparing(RebalanceAction::priority));
            return actions;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- period resets

    public void resetDaily() {
        lock.lock();
        try {
            dailyStartEquity = totalEquity;
        } finally {
            lock.unlock();
        }
    }

    public void resetWeekly() {
        lock.lock();
        try {
            weeklyStartEquity = totalEquity;
        } finally {
            lock.unlock();
        }
    }

    public void resetMonthly() {
        lock.lock();
        try {
            monthlyStartEquity = totalEquity;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- internals

    private void requireInitialized() {
        if (!initialized) throw new PortfolioNotInitializedException(portfolioId);
    }

    private void putBalance(ExchangeCode exchange, BalanceSnapshot b) {
        UnifiedBalance ub = balances.computeIfAbsent(b.asset(), UnifiedBalance::of);
        double usd = b.usdValue() != null ? b.usdValue() : b.total();
        ub.getByExchange().put(exchange, new UnifiedBalance.Leg(b.free(), b.locked(), usd));
        AllocationTarget target = allocations.get(b.asset());
        if (target != null) ub.setTargetAllocation(target.targetPercent());
        ub.recalculate(totalEquity);
    }

    /**
     * Free stablecoins at face value plus the free share of every other asset's USD value.
     */
    private double availableBalance() {
        double available = 0;
        for (UnifiedBalance b : balances.values()) {
            if (STABLES.contains(b.getAsset())) {
                available += b.getTotalFree();
            } else if (b.getTotalBalance() > 0) {
                available += b.getUsdValue() * (b.getTotalFree() / b.getTotalBalance());
            }
        }
        return available;
    }

    private static boolean isShort(UnifiedPosition.ExchangeLeg leg) {
        return leg.side() == PositionSide.SHORT || (leg.side() == null && leg.quantity() < 0);
    }

    private static double percentOf(double value, double base) {
        return base > 0 ? (value / base) * 100 : 0;
    }

    private static String num(double v) {
        if (v == Math.rint(v) && !Double.isInfinite(v)) return String.valueOf((long) v);
        return String.valueOf(v);
    }
}
