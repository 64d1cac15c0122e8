package com.trade.orchestra.config;

import com.trade.orchestra.bus.EventBus;
import com.trade.orchestra.service.portfolio.ExchangeAccountProvider;
import com.trade.orchestra.service.portfolio.PortfolioManager;
import com.trade.orchestra.service.portfolio.PortfolioSyncService;
import com.trade.orchestra.service.risk.RiskManager;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.stream.Collectors;

/**
 * Risk and portfolio wiring for the configured portfolio. Both are registered with
 * {@code orchestra.portfolio.starting-equity} before anything can call them.
 */
@Configuration
@EnableConfigurationProperties({RiskProperties.class, PortfolioProperties.class})
public class OrchestraConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RiskManager riskManager(EventBus bus, RiskProperties risk, PortfolioProperties portfolio, Clock clock) {
        RiskManager rm = new RiskManager(bus, risk.getLimits(), clock);
        rm.initialize(portfolio.getId(), portfolio.getStartingEquity());
        return rm;
    }

    @Bean
    public PortfolioManager portfolioManager(EventBus bus, PortfolioProperties props, Clock clock) {
        PortfolioManager pm = new PortfolioManager(props.getId(), props.getName(), bus, clock);
        pm.initialize(props.getStartingEquity());
        return pm;
    }

    @Bean
    public PortfolioSyncService portfolioSyncService(PortfolioManager portfolio, RiskManager risk,
                                                     ObjectProvider<ExchangeAccountProvider> providers) {
        return new PortfolioSyncService(portfolio, risk, providers.orderedStream().collect(Collectors.toList()));
    }
}
