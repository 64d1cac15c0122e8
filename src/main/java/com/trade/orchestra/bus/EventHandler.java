package com.trade.orchestra.bus;

import com.trade.orchestra.model.Event;

@FunctionalInterface
public interface EventHandler<T> {
    void handle(Event<T> event) throws Exception;
}
