package com.trade.orchestra.model.risk;

import com.trade.orchestra.enums.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Risk numbers of one portfolio. Recomputed wholesale on every state update;
 * callers only ever receive copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RiskState {
    private String portfolioId;
    private double totalEquity;
    private double availableBalance;
    private double usedMargin;
    private double unrealizedPnl;
    private double dailyPnl;
    private double dailyPnlPercent;
    private double weeklyPnl;
    private double monthlyPnl;
    private double drawdown;
    private double drawdownPercent;
    private double peakEquity;
    private double leverage;
    private double exposure;
    private double exposurePercent;
    private int openPositions;
    private int openOrders;
    private double correlationRisk;
    private double riskScore;
    private RiskLevel riskLevel;
    @Builder.Default
    private List<RiskWarning> warnings = new ArrayList<>();
    private long timestamp;

    public RiskState copy() {
        List<RiskWarning> ws = new ArrayList<>(warnings == null ? 0 : warnings.size());
        if (warnings != null) {
            for (RiskWarning w : warnings) ws.add(w.copy());
        }
        return toBuilder().warnings(ws).build();
    }
}
