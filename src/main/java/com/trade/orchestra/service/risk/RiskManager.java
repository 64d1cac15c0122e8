package com.trade.orchestra.service.risk;

import com.trade.orchestra.bus.EventBus;
import com.trade.orchestra.bus.EventTopics;
import com.trade.orchestra.bus.Events;
import com.trade.orchestra.common.exception.EventBusException;
import com.trade.orchestra.common.exception.PortfolioNotInitializedException;
import com.trade.orchestra.common.exception.ValidationException;
import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.EventAction;
import com.trade.orchestra.enums.EventDomain;
import com.trade.orchestra.enums.EventEntity;
import com.trade.orchestra.enums.EventPriority;
import com.trade.orchestra.enums.ExchangeCode;
import com.trade.orchestra.enums.LimitScope;
import com.trade.orchestra.enums.OrderSide;
import com.trade.orchestra.enums.PositionSide;
import com.trade.orchestra.enums.RiskLevel;
import com.trade.orchestra.enums.RiskLimitType;
import com.trade.orchestra.model.risk.ExposureSummary;
import com.trade.orchestra.model.risk.OrderCheckResult;
import com.trade.orchestra.model.risk.PortfolioRiskLimits;
import com.trade.orchestra.model.risk.PositionExposure;
import com.trade.orchestra.model.risk.RiskState;
import com.trade.orchestra.model.risk.RiskWarning;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Pre-trade gate and risk monitor, one {@link RiskState} per portfolio.
 * <p>
 * State changes only through {@link #initialize}, {@link #updateState}, {@link #checkOrderAllowed},
 * the period resets and {@link #acknowledgeWarning}. Each portfolio is guarded by its own lock;
 * alerts are published after the lock is released so a slow subscriber never holds it.
 */
@Slf4j
public class RiskManager {

    private static final long RATE_WINDOW_SECONDS = 60;
    private static final double WARN_FRACTION = 0.8;

    private final EventBus bus;
    private final PortfolioRiskLimits defaultLimits;
    private final Clock clock;
    private final Map<String, RiskBook> books = new ConcurrentHashMap<>();

    public RiskManager(EventBus bus, PortfolioRiskLimits defaultLimits, Clock clock) {
        this.bus = bus;
        this.defaultLimits = defaultLimits.copy().validate();
        this.clock = clock;
    }

    /**
     * Mutable per-portfolio record. Only touched while holding {@link #lock}.
     */
    private static final class RiskBook {
        final ReentrantLock lock = new ReentrantLock();
        final String portfolioId;
        PortfolioRiskLimits limits;
        RiskState state;
        List<PositionExposure> exposures = List.of();
        final List<RiskWarning> warnings = new ArrayList<>();
        final Deque<Instant> orderTimestamps = new ArrayDeque<>();
        double peakEquity;
        double dailyStartEquity;
        double weeklyStartEquity;
        double monthlyStartEquity;

        RiskBook(String portfolioId, PortfolioRiskLimits limits) {
            this.portfolioId = portfolioId;
            this.limits = limits;
        }
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * Register (or re-register) a portfolio. Peak and all period baselines start at {@code startingEquity}.
     */
    public RiskState initialize(String portfolioId, double startingEquity) {
        if (portfolioId == null || portfolioId.isBlank()) {
            throw new ValidationException("portfolioId is required");
        }
        RiskBook book = new RiskBook(portfolioId, defaultLimits.copy());
        book.peakEquity = startingEquity;
        book.dailyStartEquity = startingEquity;
        book.weeklyStartEquity = startingEquity;
        book.monthlyStartEquity = startingEquity;
        book.state = RiskState.builder()
                .portfolioId(portfolioId)
                .totalEquity(startingEquity)
                .availableBalance(startingEquity)
                .peakEquity(startingEquity)
                .leverage(1)
                .riskLevel(RiskLevel.LOW)
                .timestamp(clock.millis())
                .build();
        books.put(portfolioId, book);
        log.info("Risk manager initialized portfolio={} equity={}", portfolioId, startingEquity);
        return book.state.copy();
    }

    public boolean isInitialized(String portfolioId) {
        return books.containsKey(portfolioId);
    }

    // ---------------------------------------------------------------- state

    /**
     * Recompute every risk number of the portfolio from the given snapshot.
     */
    public RiskState updateState(String portfolioId, double totalEquity, double availableBalance,
                                 List<PositionExposure> positions, int openOrders) {
        RiskBook book = book(portfolioId);
        List<PositionExposure> ps = positions == null ? List.of() : List.copyOf(positions);
        List<RiskWarning> raised;
        RiskState snapshot;

        book.lock.lock();
        try {
            PortfolioRiskLimits l = book.limits;
            book.exposures = ps;

            double exposure = 0;
            double margin = 0;
            double upnl = 0;
            for (PositionExposure p : ps) {
                exposure += p.notionalValue();
                margin += p.margin();
                upnl += p.pnl();
            }

            if (totalEquity > book.peakEquity) book.peakEquity = totalEquity;
            double drawdown = book.peakEquity - totalEquity;
            double drawdownPct = percentOf(drawdown, book.peakEquity);

            double dailyPnl = totalEquity - book.dailyStartEquity;
            double dailyPnlPct = percentOf(dailyPnl, book.dailyStartEquity);

            double leverage = margin > 0 ? exposure / margin : 1;
            double exposurePct = percentOf(exposure, totalEquity);
            double correlation = correlationRisk(ps);

            double score = riskScore(l, drawdownPct, dailyPnlPct, leverage, exposurePct, correlation);

            raised = evaluateWarnings(book, ps, drawdownPct, dailyPnlPct, leverage, correlation);

            book.state = RiskState.builder()
                    .portfolioId(portfolioId)
                    .totalEquity(totalEquity)
                    .availableBalance(availableBalance)
                    .usedMargin(margin)
                    .unrealizedPnl(upnl)
                    .dailyPnl(dailyPnl)
                    .dailyPnlPercent(dailyPnlPct)
                    .weeklyPnl(totalEquity - book.weeklyStartEquity)
                    .monthlyPnl(totalEquity - book.monthlyStartEquity)
                    .drawdown(drawdown)
                    .drawdownPercent(drawdownPct)
                    .peakEquity(book.peakEquity)
                    .leverage(leverage)
                    .exposure(exposure)
                    .exposurePercent(exposurePct)
                    .openPositions(ps.size())
                    .openOrders(openOrders)
                    .correlationRisk(correlation)
                    .riskScore(score)
                    .riskLevel(RiskLevel.fromScore(score))
                    .warnings(unacknowledged(book))
                    .timestamp(clock.millis())
                    .build();
            snapshot = book.state.copy();
        } finally {
            book.lock.unlock();
        }

        for (RiskWarning w : raised) {
            publishAlert(w);
        }
        return snapshot;
    }

    public RiskState getState(String portfolioId) {
        RiskBook book = book(portfolioId);
        book.lock.lock();
        try {
            return book.state.copy();
        } finally {
            book.lock.unlock();
        }
    }

    // ---------------------------------------------------------------- pre-trade gate

    /**
     * Ordered pre-trade checks; the first violation wins. Passing orders count towards the
     * per-minute rate limit.
     */
    public OrderCheckResult checkOrderAllowed(String portfolioId, BotCode bot, String symbol, ExchangeCode exchange,
                                              OrderSide side, double quantity, double price, double leverage) {
        RiskBook book = book(portfolioId);
        OrderCheckResult result;
        book.lock.lock();
        try {
            result = evaluateOrder(book, bot, exchange, quantity, price, leverage);
        } finally {
            book.lock.unlock();
        }
        if (!result.allowed()) {
            log.warn("Order rejected portfolio={} bot={} {} {} {}@{} x{}: {}",
                    portfolioId, bot, side, symbol, quantity, price, leverage, result.reason());
        }
        return result;
    }

    private OrderCheckResult evaluateOrder(RiskBook book, BotCode bot, ExchangeCode exchange,
                                           double quantity, double price, double leverage) {
        PortfolioRiskLimits l = book.limits;
        RiskState s = book.state;
        Instant now = clock.instant();

        // 1) orders per minute, sliding window
        evictOlderThan(book, now.minusSeconds(RATE_WINDOW_SECONDS));
        if (book.orderTimestamps.size() >= l.getMaxOrdersPerMinute()) {
            return OrderCheckResult.reject(RiskLimitType.MAX_ORDERS_PER_MINUTE, "Order rate limit exceeded");
        }

        // 2) open positions
        if (s.getOpenPositions() >= l.getMaxOpenPositions()) {
            return OrderCheckResult.reject(RiskLimitType.MAX_OPEN_POSITIONS, "Maximum open positions reached");
        }

        // 3) leverage
        if (leverage > l.getMaxLeverage()) {
            return OrderCheckResult.reject(RiskLimitType.MAX_LEVERAGE,
                    String.format(Locale.ROOT, "Leverage %sx exceeds limit %sx", num(leverage), num(l.getMaxLeverage())));
        }

        // 4) position size; without positive equity every percentage check would pass on 0
        double orderValue = quantity * price * leverage;
        if (s.getTotalEquity() <= 0) {
            return OrderCheckResult.reject(RiskLimitType.MAX_POSITION_SIZE, LimitScope.SYMBOL,
                    String.format(Locale.ROOT, "No equity to size the order against (equity %s)", num(s.getTotalEquity())));
        }
        double sizePct = percentOf(orderValue, s.getTotalEquity());
        if (sizePct > l.getMaxPositionSizePercent()) {
            return OrderCheckResult.reject(RiskLimitType.MAX_POSITION_SIZE, LimitScope.SYMBOL,
                    String.format(Locale.ROOT, "Position size %.1f%% exceeds limit %s%%", sizePct, num(l.getMaxPositionSizePercent())));
        }

        // 5) projected total exposure
        double exposurePct = percentOf(s.getExposure() + orderValue, s.getTotalEquity());
        if (exposurePct > l.getMaxExposurePercent()) {
            return OrderCheckResult.reject(RiskLimitType.MAX_EXPOSURE,
                    String.format(Locale.ROOT, "Exposure would exceed %s%%", num(l.getMaxExposurePercent())));
        }

        // 6) minimum balance reserve
        double requiredMargin = leverage > 0 ? orderValue / leverage : orderValue;
        double reserve = s.getTotalEquity() * (l.getMinBalancePercent() / 100);
        if (s.getAvailableBalance() - requiredMargin < reserve) {
            return OrderCheckResult.reject(RiskLimitType.MIN_BALANCE, "Insufficient balance (minimum reserve required)");
        }

        // 7) drawdown
        if (s.getDrawdownPercent() >= l.getMaxDrawdownPercent()) {
            return OrderCheckResult.reject(RiskLimitType.MAX_DRAWDOWN,
                    String.format(Locale.ROOT, "Drawdown %.1f%% at limit", s.getDrawdownPercent()));
        }

        // 8) daily loss
        if (s.getDailyPnlPercent() <= -l.getMaxDailyLossPercent()) {
            return OrderCheckResult.reject(RiskLimitType.MAX_DAILY_LOSS,
                    String.format(Locale.ROOT, "Daily loss limit reached (%s%%)", num(l.getMaxDailyLossPercent())));
        }

        // 9) per-exchange exposure
        double exchangePct = percentOf(exposureWhere(book, e -> e.exchange() == exchange) + orderValue, s.getTotalEquity());
        if (exchangePct > l.getMaxExposurePerExchange()) {
            return OrderCheckResult.reject(RiskLimitType.MAX_EXPOSURE, LimitScope.EXCHANGE,
                    String.format(Locale.ROOT, "Exchange exposure would exceed %s%%", num(l.getMaxExposurePerExchange())));
        }

        // 10) per-bot exposure
        double botPct = percentOf(exposureWhere(book, e -> e.botCode() == bot) + orderValue, s.getTotalEquity());
        if (botPct > l.getMaxExposurePerBot()) {
            return OrderCheckResult.reject(RiskLimitType.MAX_EXPOSURE, LimitScope.BOT,
                    String.format(Locale.ROOT, "Bot exposure would exceed %s%%", num(l.getMaxExposurePerBot())));
        }

        book.orderTimestamps.addLast(now);

        if (s.getRiskLevel() != null && s.getRiskLevel().isAtLeast(RiskLevel.HIGH)) {
            return OrderCheckResult.allowWithWarning("Risk level is " + s.getRiskLevel() + ". Proceed with caution.");
        }
        return OrderCheckResult.allow();
    }

    /**
     * Count an order placed outside {@link #checkOrderAllowed} towards the rate limit.
     */
    public void recordOrder(String portfolioId) {
        RiskBook book = book(portfolioId);
        book.lock.lock();
        try {
            book.orderTimestamps.addLast(clock.instant());
            evictOlderThan(book, clock.instant().minusSeconds(RATE_WINDOW_SECONDS));
        } finally {
            book.lock.unlock();
        }
    }

    // ---------------------------------------------------------------- limits & exposure

    public PortfolioRiskLimits getLimits(String portfolioId) {
        RiskBook book = book(portfolioId);
        book.lock.lock();
        try {
            return book.limits.copy();
        } finally {
            book.lock.unlock();
        }
    }

    /**
     * Apply a change to a copy of the current limits; the result must be valid or nothing changes.
     */
    public PortfolioRiskLimits updateLimits(String portfolioId, UnaryOperator<PortfolioRiskLimits> change) {
        RiskBook book = book(portfolioId);
        book.lock.lock();
        try {
            PortfolioRiskLimits next = change.apply(book.limits.copy()).validate();
            book.limits = next;
            log.info("Risk limits updated portfolio={} limits={}", portfolioId, next);
            return next.copy();
        } finally {
            book.lock.unlock();
        }
    }

    public ExposureSummary getExposureSummary(String portfolioId) {
        RiskBook book = book(portfolioId);
        List<PositionExposure> ps;
        book.lock.lock();
        try {
            ps = book.exposures;
        } finally {
            book.lock.unlock();
        }

        Map<ExchangeCode, Double> byExchange = new EnumMap<>(ExchangeCode.class);
        Map<String, Double> bySymbol = new LinkedHashMap<>();
        Map<BotCode, Double> byBot = new EnumMap<>(BotCode.class);
        double longExp = 0;
        double shortExp = 0;
        for (PositionExposure p : ps) {
            if (p.exchange() != null) byExchange.merge(p.exchange(), p.notionalValue(), Double::sum);
            bySymbol.merge(p.symbol(), p.notionalValue(), Double::sum);
            if (p.botCode() != null) byBot.merge(p.botCode(), p.notionalValue(), Double::sum);
            if (p.side() == PositionSide.LONG) longExp += p.notionalValue();
            else shortExp += p.notionalValue();
        }
        double total = longExp + shortExp;
        double net = longExp - shortExp;
        double hedge = total > 0 ? 1 - Math.abs(net) / total : 0;
        return new ExposureSummary(total, byExchange, bySymbol, byBot, longExp, shortExp, net, hedge);
    }

    // ---------------------------------------------------------------- warnings

    /**
     * Every warning still held for the portfolio, acknowledged ones included.
     */
    public List<RiskWarning> getWarnings(String portfolioId) {
        RiskBook book = book(portfolioId);
        book.lock.lock();
        try {
            List<RiskWarning> out = new ArrayList<>(book.warnings.size());
            for (RiskWarning w : book.warnings) out.add(w.copy());
            return out;
        } finally {
            book.lock.unlock();
        }
    }

    public boolean acknowledgeWarning(String portfolioId, String warningId) {
        RiskBook book = book(portfolioId);
        book.lock.lock();
        try {
            for (RiskWarning w : book.warnings) {
                if (w.getId().equals(warningId)) {
                    w.setAcknowledged(true);
                    w.setAcknowledgedAt(clock.millis());
                    book.state.setWarnings(unacknowledged(book));
                    log.info("Risk warning {} ({}) acknowledged portfolio={}", warningId, w.getType(), portfolioId);
                    return true;
                }
            }
            return false;
        } finally {
            book.lock.unlock();
        }
    }

    // ---------------------------------------------------------------- period resets

    /**
     * New daily baseline at current equity. Non-critical warnings are dropped.
     */
    public void resetDaily(String portfolioId) {
        RiskBook book = book(portfolioId);
        book.lock.lock();
        try {
            book.dailyStartEquity = book.state.getTotalEquity();
            book.warnings.removeIf(w -> w.getSeverity() != RiskLevel.CRITICAL);
            book.state.setDailyPnl(0);
            book.state.setDailyPnlPercent(0);
            book.state.setWarnings(unacknowledged(book));
        } finally {
            book.lock.unlock();
        }
        log.info("Risk daily baseline reset portfolio={}", portfolioId);
    }

    public void resetWeekly(String portfolioId) {
        RiskBook book = book(portfolioId);
        book.lock.lock();
        try {
            book.weeklyStartEquity = book.state.getTotalEquity();
            book.state.setWeeklyPnl(0);
        } finally {
            book.lock.unlock();
        }
        log.info("Risk weekly baseline reset portfolio={}", portfolioId);
    }

    public void resetMonthly(String portfolioId) {
        RiskBook book = book(portfolioId);
        book.lock.lock();
        try {
            book.monthlyStartEquity = book.state.getTotalEquity();
            book.state.setMonthlyPnl(0);
        } finally {
            book.lock.unlock();
        }
        log.info("Risk monthly baseline reset portfolio={}", portfolioId);
    }

    // ---------------------------------------------------------------- internals

    private RiskBook book(String portfolioId) {
        RiskBook book = portfolioId == null ? null : books.get(portfolioId);
        if (book == null) throw new PortfolioNotInitializedException(portfolioId);
        return book;
    }

    /**
     * Five components, each capped at its budget: drawdown 30, daily loss 25, leverage 20,
     * exposure 15, correlation 10.
     */
    static double riskScore(PortfolioRiskLimits l, double drawdownPct, double dailyPnlPct,
                            double leverage, double exposurePct, double correlation) {
        double score = 0;
        score += capped(drawdownPct / l.getMaxDrawdownPercent() * 30, 30);
        score += capped(Math.abs(Math.min(0, dailyPnlPct)) / l.getMaxDailyLossPercent() * 25, 25);
        score += capped(leverage / l.getMaxLeverage() * 20, 20);
        score += capped(exposurePct / l.getMaxExposurePercent() * 15, 15);
        score += capped(correlation * 10, 10);
        return Math.min(100, Math.round(score));
    }

    /**
     * Share of positions on the majority side; 0 below two positions.
     */
    static double correlationRisk(List<PositionExposure> ps) {
        if (ps.size() < 2) return 0;
        int longs = 0;
        int shorts = 0;
        for (PositionExposure p : ps) {
            if (p.side() == PositionSide.LONG) longs++;
            else shorts++;
        }
        return (double) Math.max(longs, shorts) / ps.size();
    }

    private List<RiskWarning> evaluateWarnings(RiskBook book, List<PositionExposure> ps, double drawdownPct,
                                               double dailyPnlPct, double leverage, double correlation) {
        PortfolioRiskLimits l = book.limits;
        List<RiskWarning> raised = new ArrayList<>();

        if (drawdownPct >= l.getMaxDrawdownPercent() * WARN_FRACTION) {
            raised.add(addWarning(book, RiskWarning.builder()
                    .type(RiskLimitType.MAX_DRAWDOWN)
                    .severity(drawdownPct >= l.getMaxDrawdownPercent() ? RiskLevel.CRITICAL : RiskLevel.HIGH)
                    .message(String.format(Locale.ROOT, "Drawdown at %.1f%% of %s%% limit", drawdownPct, num(l.getMaxDrawdownPercent())))
                    .currentValue(drawdownPct)
                    .limitValue(l.getMaxDrawdownPercent())
                    .affectedBots(bots(ps))
                    .affectedSymbols(symbols(ps))
                    .affectedExchanges(exchanges(ps))
                    .recommendation("Consider reducing positions or stopping trading")));
        }

        if (dailyPnlPct <= -l.getMaxDailyLossPercent() * WARN_FRACTION) {
            raised.add(addWarning(book, RiskWarning.builder()
                    .type(RiskLimitType.MAX_DAILY_LOSS)
                    .severity(dailyPnlPct <= -l.getMaxDailyLossPercent() ? RiskLevel.CRITICAL : RiskLevel.HIGH)
                    .message(String.format(Locale.ROOT, "Daily loss at %.1f%% of %s%% limit", Math.abs(dailyPnlPct), num(l.getMaxDailyLossPercent())))
                    .currentValue(Math.abs(dailyPnlPct))
                    .limitValue(l.getMaxDailyLossPercent())
                    .affectedBots(bots(ps))
                    .affectedSymbols(List.of())
                    .affectedExchanges(List.of())
                    .recommendation("Stop trading for the day to preserve capital")));
        }

        if (leverage >= l.getMaxLeverage() * WARN_FRACTION) {
            raised.add(addWarning(book, RiskWarning.builder()
                    .type(RiskLimitType.MAX_LEVERAGE)
                    .severity(leverage >= l.getMaxLeverage() ? RiskLevel.CRITICAL : RiskLevel.MEDIUM)
                    .message(String.format(Locale.ROOT, "Leverage at %.1fx of %sx limit", leverage, num(l.getMaxLeverage())))
                    .currentValue(leverage)
                    .limitValue(l.getMaxLeverage())
                    .affectedBots(bots(ps))
                    .affectedSymbols(List.of())
                    .affectedExchanges(List.of())
                    .recommendation("Reduce position sizes to lower leverage")));
        }

        if (correlation >= l.getMaxCorrelation() * WARN_FRACTION) {
            raised.add(addWarning(book, RiskWarning.builder()
                    .type(RiskLimitType.MAX_CORRELATION)
                    .severity(correlation >= l.getMaxCorrelation() ? RiskLevel.HIGH : RiskLevel.MEDIUM)
                    .message(String.format(Locale.ROOT, "Position correlation at %.0f%%", correlation * 100))
                    .currentValue(correlation)
                    .limitValue(l.getMaxCorrelation())
                    .affectedBots(bots(ps))
                    .affectedSymbols(symbols(ps))
                    .affectedExchanges(List.of())
                    .recommendation("Diversify positions to reduce correlation risk")));
        }
        return raised;
    }

    /**
     * At most one unacknowledged warning per type: a repeat breach takes over the slot of the
     * previous one, otherwise the warning is appended.
     */
    private RiskWarning addWarning(RiskBook book, RiskWarning.RiskWarningBuilder draft) {
        RiskWarning w = draft
                .id("warn_" + UUID.randomUUID())
                .portfolioId(book.portfolioId)
                .scope(LimitScope.PORTFOLIO)
                .createdAt(clock.millis())
                .acknowledged(false)
                .build();

        int slot = -1;
        for (int i = 0; i < book.warnings.size(); i++) {
            RiskWarning existing = book.warnings.get(i);
            if (existing.getType() == w.getType() && !existing.isAcknowledged()) {
                slot = i;
                break;
            }
        }
        if (slot >= 0) {
            book.warnings.set(slot, w);
        } else {
            book.warnings.add(w);
            log.warn("Risk warning raised portfolio={} type={} severity={}: {}",
                    book.portfolioId, w.getType(), w.getSeverity(), w.getMessage());
        }
        return w.copy();
    }

    private void publishAlert(RiskWarning w) {
        EventPriority priority = w.getSeverity() == RiskLevel.CRITICAL ? EventPriority.CRITICAL : EventPriority.HIGH;
        try {
            bus.publish(Events.onTopic(EventTopics.riskAlert(w.getSeverity().name().toLowerCase(Locale.ROOT)),
                    EventDomain.RISK, EventEntity.ALERT, EventAction.TRIGGERED, BotCode.WLF, w, priority));
        } catch (EventBusException e) {
            log.warn("Failed to publish risk alert {} ({}): {}", w.getId(), w.getType(), e.getMessage());
        }
    }

    private static List<RiskWarning> unacknowledged(RiskBook book) {
        List<RiskWarning> out = new ArrayList<>();
        for (RiskWarning w : book.warnings) {
            if (!w.isAcknowledged()) out.add(w.copy());
        }
        return out;
    }

    private static void evictOlderThan(RiskBook book, Instant cutoff) {
        while (!book.orderTimestamps.isEmpty() && !book.orderTimestamps.peekFirst().isAfter(cutoff)) {
            book.orderTimestamps.removeFirst();
        }
    }

    private static double exposureWhere(RiskBook book, Predicate<PositionExposure> filter) {
        double sum = 0;
        for (PositionExposure e : book.exposures) {
            if (filter.test(e)) sum += e.notionalValue();
        }
        return sum;
    }

    /**
     * {@code value} as percent of {@code base}; 0 when the base is not positive.
     */
    private static double percentOf(double value, double base) {
        return base > 0 ? (value / base) * 100 : 0;
    }

    private static double capped(double v, double budget) {
        return Math.max(0, Math.min(budget, v));
    }

    private static List<BotCode> bots(List<PositionExposure> ps) {
        LinkedHashSet<BotCode> s = new LinkedHashSet<>();
        for (PositionExposure p : ps) if (p.botCode() != null) s.add(p.botCode());
        return new ArrayList<>(s);
    }

    private static List<String> symbols(List<PositionExposure> ps) {
        LinkedHashSet<String> s = new LinkedHashSet<>();
        for (PositionExposure p : ps) s.add(p.symbol());
        return new ArrayList<>(s);
    }

    private static List<ExchangeCode> exchanges(List<PositionExposure> ps) {
        LinkedHashSet<ExchangeCode> s = new LinkedHashSet<>();
        for (PositionExposure p : ps) if (p.exchange() != null) s.add(p.exchange());
        return new ArrayList<>(s);
    }

    /**
     * Plain number rendering: 20.0 prints as "20", 0.7 as "0.7".
     */
    private static String num(double v) {
        if (v == Math.rint(v) && !Double.isInfinite(v)) return String.valueOf((long) v);
        return String.valueOf(v);
    }
}
