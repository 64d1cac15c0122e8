package com.trade.orchestra.dto;

import com.trade.orchestra.enums.OrderSide;
import com.trade.orchestra.enums.OrderStatus;
import com.trade.orchestra.enums.OrderType;

public record OrderPayload(
        String orderId,
        String clientOrderId,
        String symbol,
        String exchange,
        OrderSide side,
        OrderType type,
        OrderStatus status,
        Double price,
        double quantity,
        Double filledQuantity,
        Double avgPrice,
        Double stopPrice,
        Boolean reduceOnly,
        Double commission,
        String commissionAsset,
        long createdAt,
        Long updatedAt,
        String errorCode,
        String errorMessage
) {
}
