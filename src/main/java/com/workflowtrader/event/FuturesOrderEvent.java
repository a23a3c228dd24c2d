package com.workflowtrader.event;

import com.workflowtrader.domain.enums.FuturesOrderStatus;
import org.springframework.context.ApplicationEvent;

/** Published when a futures action outcome is recorded. */
public class FuturesOrderEvent extends ApplicationEvent {

    private final Long futuresOrderId;
    private final String symbol;
    private final FuturesOrderStatus status;

    public FuturesOrderEvent(Object source, Long futuresOrderId, String symbol, FuturesOrderStatus status) {
        super(source);
        this.futuresOrderId = futuresOrderId;
        this.symbol = symbol;
        this.status = status;
    }

    public Long getFuturesOrderId() {
        return futuresOrderId;
    }

    public String getSymbol() {
        return symbol;
    }

    public FuturesOrderStatus getStatus() {
        return status;
    }
}
