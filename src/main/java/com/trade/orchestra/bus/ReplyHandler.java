package com.trade.orchestra.bus;

/**
 * Computes the reply payload for a request payload.
 */
@FunctionalInterface
public interface ReplyHandler<T, R> {
    R handle(T payload) throws Exception;
}
