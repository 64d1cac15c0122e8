package com.trade.orchestra.model.risk;

import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.ExchangeCode;
import com.trade.orchestra.enums.LimitScope;
import com.trade.orchestra.enums.RiskLevel;
import com.trade.orchestra.enums.RiskLimitType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A limit approach or breach. Also the payload of {@code risk.alert.<severity>} events.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RiskWarning {
    private String id;
    private String portfolioId;
    private RiskLimitType type;
    private RiskLevel severity;
    private String message;
    private double currentValue;
    private double limitValue;
    private LimitScope scope;
    private List<BotCode> affectedBots;
    private List<String> affectedSymbols;
    private List<ExchangeCode> affectedExchanges;
    private String recommendation;
    private long createdAt;
    private boolean acknowledged;
    private Long acknowledgedAt;

    public RiskWarning copy() {
        return toBuilder()
                .affectedBots(affectedBots == null ? List.of() : List.copyOf(affectedBots))
                .affectedSymbols(affectedSymbols == null ? List.of() : List.copyOf(affectedSymbols))
                .affectedExchanges(affectedExchanges == null ? List.of() : List.copyOf(affectedExchanges))
                .build();
    }
}
