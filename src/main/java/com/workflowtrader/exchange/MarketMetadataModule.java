package com.workflowtrader.exchange;

import com.workflowtrader.exchange.model.Candle;
import com.workflowtrader.exchange.model.SpotMarket;
import java.math.BigDecimal;
import java.util.List;

/** Public market data. No credentials required. */
public interface MarketMetadataModule {

    SpotMarket fetchMarket(String baseAsset, String quoteAsset);

    /** Last traded price of {@code symbol}. */
    BigDecimal fetchTicker(String symbol);

    /** Most recent closed candles, oldest first. */
    List<Candle> fetchKlines(String symbol, String interval, int limit);
}
