package com.workflowtrader.exchange.model;

import lombok.Builder;
import lombok.Data;

/**
 * Exchange view of a single order, as returned by place, cancel and fetch calls.
 * {@code status} is the exchange's raw status string (NEW, FILLED, CANCELED, ...).
 */
@Data
@Builder
public class ExchangeOrderState {

    public static final String FILLED = "FILLED";

    private String orderId;
    private String status;

    public boolean isFilled() {
        return FILLED.equalsIgnoreCase(status);
    }
}
