package com.trade.orchestra.config;

import com.trade.orchestra.model.risk.PortfolioRiskLimits;
import jakarta.validation.Valid;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Default limits applied to every portfolio registered with the risk manager.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "orchestra.risk")
public class RiskProperties {

    @Valid
    private PortfolioRiskLimits limits = PortfolioRiskLimits.defaults();
}
