package com.trade.orchestra.jobs;

import com.trade.orchestra.service.portfolio.PortfolioManager;
import com.trade.orchestra.service.portfolio.PortfolioSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically pulls exchange snapshots into the portfolio, refreshes risk and publishes
 * the portfolio summary.
 * <p>
 * Configure:
 * orchestra.portfolio.sync-enabled=true
 * orchestra.portfolio.sync-interval-ms=15000
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "orchestra.portfolio.sync-enabled", havingValue = "true")
public class PortfolioSyncJob {

    private final PortfolioSyncService sync;
    private final PortfolioManager portfolio;

    @Scheduled(fixedDelayString = "${orchestra.portfolio.sync-interval-ms:15000}",
            initialDelayString = "${orchestra.portfolio.sync-interval-ms:15000}")
    public void sync() {
        long t0 = System.currentTimeMillis();
        try {
            int ok = sync.syncAll();
            portfolio.publishSummary();
            log.info("Portfolio sync done: {} exchange(s) ({} ms)", ok, System.currentTimeMillis() - t0);
        } catch (Exception t) {
            log.warn("Portfolio sync error: {}", t.getMessage(), t);
        }
    }
}
