package com.workflowtrader.exchange.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SpotBalance {

    private String asset;
    private BigDecimal free;
    private BigDecimal locked;

    public BigDecimal total() {
        BigDecimal f = free != null ? free : BigDecimal.ZERO;
        BigDecimal l = locked != null ? locked : BigDecimal.ZERO;
        return f.add(l);
    }
}
