package com.trade.orchestra.model.portfolio;

import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.ExchangeCode;
import com.trade.orchestra.enums.PositionSide;
import lombok.Data;

import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One symbol aggregated across exchanges and bots.
 * <p>
 * Aggregates are derived from {@link #byExchange} only and recomputed from scratch by
 * {@link #recalculate(long)}; nothing is adjusted incrementally.
 */
@Data
public class UnifiedPosition {

    private static final Pattern QUOTE = Pattern.compile("^([A-Z0-9]+?)(USDT|USDC|BUSD|BTC|ETH)$");

    private String id;
    private String symbol;
    private String baseAsset;
    private String quoteAsset;

    private double totalQuantity;
    private double totalNotionalValue;
    private double avgEntryPrice;

    private Map<ExchangeCode, ExchangeLeg> byExchange = new EnumMap<>(ExchangeCode.class);
    /** Bot, then the exchange the bot holds the leg on. */
    private Map<BotCode, Map<ExchangeCode, BotLeg>> byBot = new EnumMap<>(BotCode.class);

    private double totalPnl;
    private double totalPnlPercent;
    private double unrealizedPnl;
    private double realizedPnl;

    private long openedAt;
    private long updatedAt;

    /**
     * Latest snapshot reported by one exchange for this symbol.
     *
     * @param reportedBy bot whose report last wrote this slot
     */
    public record ExchangeLeg(PositionSide side, double quantity, double entryPrice, double markPrice,
                              double notionalValue, double pnl, double realizedPnl, double margin,
                              double leverage, Double liquidationPrice, BotCode reportedBy) {
    }

    public record BotLeg(ExchangeCode exchange, double quantity, double entryPrice, double notionalValue, double pnl) {
    }

    public static UnifiedPosition open(String symbol, long openedAt) {
        UnifiedPosition p = new UnifiedPosition();
        p.setId(symbol);
        p.setSymbol(symbol);
        Matcher m = QUOTE.matcher(symbol == null ? "" : symbol.toUpperCase());
        if (m.matches()) {
            p.setBaseAsset(m.group(1));
            p.setQuoteAsset(m.group(2));
        } else {
            p.setBaseAsset(symbol);
            p.setQuoteAsset("USDT");
        }
        p.setOpenedAt(openedAt);
        p.setUpdatedAt(openedAt);
        return p;
    }

    /**
     * Average entry is weighted by absolute quantity so a short leg does not cancel a long one.
     */
    public void recalculate(long now) {
        double qty = 0;
        double weightQty = 0;
        double notional = 0;
        double weighted = 0;
        double pnl = 0;
        double realized = 0;

        for (ExchangeLeg leg : byExchange.values()) {
            double abs = Math.abs(leg.quantity());
            qty += leg.quantity();
            weightQty += abs;
            notional += leg.notionalValue();
            weighted += leg.entryPrice() * abs;
            pnl += leg.pnl();
            realized += leg.realizedPnl();
        }

        this.totalQuantity = qty;
        this.totalNotionalValue = notional;
        this.avgEntryPrice = weightQty > 0 ? weighted / weightQty : 0;
        this.totalPnl = pnl;
        this.unrealizedPnl = pnl;
        this.realizedPnl = realized;
        double basis = avgEntryPrice * weightQty;
        this.totalPnlPercent = basis > 0 ? (pnl / basis) * 100 : 0;
        this.updatedAt = now;
    }

    public void putBotLeg(BotCode bot, BotLeg leg) {
        byBot.computeIfAbsent(bot, b -> new EnumMap<>(ExchangeCode.class)).put(leg.exchange(), leg);
    }

    /**
     * Drop every bot's leg on the exchange; bots left without legs disappear.
     */
    public void removeBotLegs(ExchangeCode exchange) {
        byBot.values().forEach(legs -> legs.remove(exchange));
        byBot.values().removeIf(Map::isEmpty);
    }

    public boolean isEmpty() {
        return byExchange.isEmpty() && byBot.isEmpty();
    }

    public double totalMargin() {
        double m = 0;
        for (ExchangeLeg leg : byExchange.values()) m += leg.margin();
        return m;
    }

    public UnifiedPosition copy() {
        UnifiedPosition c = new UnifiedPosition();
        c.id = id;
        c.symbol = symbol;
        c.baseAsset = baseAsset;
        c.quoteAsset = quoteAsset;
        c.totalQuantity = totalQuantity;
        c.totalNotionalValue = totalNotionalValue;
        c.avgEntryPrice = avgEntryPrice;
        c.byExchange = new EnumMap<>(ExchangeCode.class);
        c.byExchange.putAll(byExchange);
        c.byBot = new EnumMap<>(BotCode.class);
        byBot.forEach((bot, legs) -> c.byBot.put(bot, new EnumMap<>(legs)));
        c.totalPnl = totalPnl;
        c.totalPnlPercent = totalPnlPercent;
        c.unrealizedPnl = unrealizedPnl;
        c.realizedPnl = realizedPnl;
        c.openedAt = openedAt;
        c.updatedAt = updatedAt;
        return c;
    }
}
