package com.trade.orchestra.bus;

/**
 * Well-known topics and subscription patterns.
 */
public final class EventTopics {

    private EventTopics() {
    }

    public static final String ALL = ">";

    public static final String TRADING_SIGNALS = "trading.signal.*";

    public static final String TRADING_ORDERS = "trading.order.*";

    public static final String TRADING_POSITIONS = "trading.position.*";

    public static final String POSITION_UPDATED = "trading.position.updated";

    public static final String RISK_ALERTS = "risk.alert.*";

    public static final String RISK_PORTFOLIO_UPDATED = "risk.portfolio.updated";

    public static final String SYSTEM_BOTS = "system.bot.*";

    public static final String REPLY_SUFFIX = ".reply";

    public static String riskAlert(String severity) {
        return "risk.alert." + severity;
    }

    public static String botSignals(String botCode) {
        return "trading.signal." + botCode;
    }
}
