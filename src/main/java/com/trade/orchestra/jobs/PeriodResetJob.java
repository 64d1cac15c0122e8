package com.trade.orchestra.jobs;

import com.trade.orchestra.service.portfolio.PortfolioManager;
import com.trade.orchestra.service.risk.RiskManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Rolls the daily, weekly and monthly PnL baselines of the portfolio and its risk state.
 * <p>
 * Configure (optional):
 * orchestra.schedule.zone=UTC
 * orchestra.schedule.daily-cron=0 0 0 * * *
 * orchestra.schedule.weekly-cron=0 0 0 * * MON
 * orchestra.schedule.monthly-cron=0 0 0 1 * *
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PeriodResetJob {

    private final PortfolioManager portfolio;
    private final RiskManager risk;

    @Scheduled(cron = "${orchestra.schedule.daily-cron:0 0 0 * * *}", zone = "${orchestra.schedule.zone:UTC}")
    public void resetDaily() {
        try {
            portfolio.resetDaily();
            risk.resetDaily(portfolio.getPortfolioId());
            log.info("Daily baselines reset for {}", portfolio.getPortfolioId());
        } catch (Exception t) {
            log.warn("Daily reset error: {}", t.getMessage(), t);
        }
    }

    @Scheduled(cron = "${orchestra.schedule.weekly-cron:0 0 0 * * MON}", zone = "${orchestra.schedule.zone:UTC}")
    public void resetWeekly() {
        try {
            portfolio.resetWeekly();
            risk.resetWeekly(portfolio.getPortfolioId());
            log.info("Weekly baselines reset for {}", portfolio.getPortfolioId());
        } catch (Exception t) {
            log.warn("Weekly reset error: {}", t.getMessage(), t);
        }
    }

    @Scheduled(cron = "${orchestra.schedule.monthly-cron:0 0 0 1 * *}", zone = "${orchestra.schedule.zone:UTC}")
    public void resetMonthly() {
        try {
            portfolio.resetMonthly();
            risk.resetMonthly(portfolio.getPortfolioId());
            log.info("Monthly baselines reset for {}", portfolio.getPortfolioId());
        } catch (Exception t) {
            log.warn("Monthly reset error: {}", t.getMessage(), t);
        }
    }
}
