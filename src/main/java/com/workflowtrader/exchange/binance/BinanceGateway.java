package com.workflowtrader.exchange.binance;

import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.exchange.ExchangeGateway;
import com.workflowtrader.exchange.FuturesTradingModule;
import com.workflowtrader.exchange.MarketMetadataModule;
import com.workflowtrader.exchange.SpotTradingModule;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Binance supports metadata, spot and futures. */
@Component
public class BinanceGateway implements ExchangeGateway {

    private final BinanceMetadataModule metadataModule;
    private final BinanceSpotModule spotModule;
    private final BinanceFuturesModule futuresModule;

    public BinanceGateway(
            BinanceMetadataModule metadataModule, BinanceSpotModule spotModule, BinanceFuturesModule futuresModule) {
        this.metadataModule = metadataModule;
        this.spotModule = spotModule;
        this.futuresModule = futuresModule;
    }

    @Override
    public SupportedExchange exchange() {
        return SupportedExchange.BINANCE;
    }

    @Override
    public MarketMetadataModule metadata() {
        return metadataModule;
    }

    @Override
    public Optional<SpotTradingModule> spot() {
        return Optional.of(spotModule);
    }

    @Override
    public Optional<FuturesTradingModule> futures() {
        return Optional.of(futuresModule);
    }
}
