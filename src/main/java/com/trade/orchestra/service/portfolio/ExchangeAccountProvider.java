package com.trade.orchestra.service.portfolio;

import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.ExchangeCode;
import com.trade.orchestra.model.exchange.AccountSnapshot;
import com.trade.orchestra.model.exchange.PositionSnapshot;

import java.util.List;

/**
 * Read side of an exchange client. Implementations live outside this module; the portfolio
 * only consumes their snapshots.
 */
public interface ExchangeAccountProvider {

    ExchangeCode exchange();

    AccountSnapshot fetchAccount() throws Exception;

    List<PositionSnapshot> fetchPositions() throws Exception;

    /**
     * Orders resting on the exchange for this account.
     */
    default int fetchOpenOrderCount() throws Exception {
        return 0;
    }

    /**
     * Bot credited with positions from this account, or null when unknown.
     */
    default BotCode owner() {
        return null;
    }
}
