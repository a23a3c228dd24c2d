package com.workflowtrader.exchange.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** Trading rules of a spot symbol. Precisions are decimal places. */
@Data
@Builder
public class SpotMarket {

    private String symbol;
    private String baseAsset;
    private String quoteAsset;
    private int pricePrecision;
    private int quantityPrecision;
    private BigDecimal minNotional;
}
