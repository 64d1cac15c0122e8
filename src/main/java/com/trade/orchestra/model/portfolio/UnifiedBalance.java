package com.trade.orchestra.model.portfolio;

import com.trade.orchestra.enums.ExchangeCode;
import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

/**
 * One asset aggregated across exchanges.
 */
@Data
public class UnifiedBalance {

    private String asset;
    private double totalFree;
    private double totalLocked;
    private double totalBalance;
    private double usdValue;
    private Map<ExchangeCode, Leg> byExchange = new EnumMap<>(ExchangeCode.class);
    private double allocationPercent;
    private Double targetAllocation;

    public record Leg(double free, double locked, double usdValue) {
    }

    public static UnifiedBalance of(String asset) {
        UnifiedBalance b = new UnifiedBalance();
        b.setAsset(asset);
        return b;
    }

    public void recalculate(double totalEquity) {
        double free = 0;
        double locked = 0;
        double usd = 0;
        for (Leg leg : byExchange.values()) {
            free += leg.free();
            locked += leg.locked();
            usd += leg.usdValue();
        }
        this.totalFree = free;
        this.totalLocked = locked;
        this.totalBalance = free + locked;
        this.usdValue = usd;
        reallocate(totalEquity);
    }

    public void reallocate(double totalEquity) {
        this.allocationPercent = totalEquity > 0 ? (usdValue / totalEquity) * 100 : 0;
    }

    /**
     * USD price of one unit, or 0 when nothing is held.
     */
    public double unitPrice() {
        return totalBalance > 0 ? usdValue / totalBalance : 0;
    }

    public UnifiedBalance copy() {
        UnifiedBalance c = new UnifiedBalance();
        c.asset = asset;
        c.totalFree = totalFree;
        c.totalLocked = totalLocked;
        c.totalBalance = totalBalance;
        c.usdValue = usdValue;
        c.byExchange = new EnumMap<>(ExchangeCode.class);
        c.byExchange.putAll(byExchange);
        c.allocationPercent = allocationPercent;
        c.targetAllocation = targetAllocation;
        return c;
    }
}
