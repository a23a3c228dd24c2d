package com.workflowtrader.exchange.bybit;

import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.exchange.ExchangeGateway;
import com.workflowtrader.exchange.FuturesTradingModule;
import com.workflowtrader.exchange.MarketMetadataModule;
import com.workflowtrader.exchange.SpotTradingModule;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Bybit is wired for futures only; spot workflows on Bybit are rejected per order. */
@Component
public class BybitGateway implements ExchangeGateway {

    private final BybitMetadataModule metadataModule;
    private final BybitFuturesModule futuresModule;

    public BybitGateway(BybitMetadataModule metadataModule, BybitFuturesModule futuresModule) {
        this.metadataModule = metadataModule;
        this.futuresModule = futuresModule;
    }

    @Override
    public SupportedExchange exchange() {
        return SupportedExchange.BYBIT;
    }

    @Override
    public MarketMetadataModule metadata() {
        return metadataModule;
    }

    @Override
    public Optional<SpotTradingModule> spot() {
        return Optional.empty();
    }

    @Override
    public Optional<FuturesTradingModule> futures() {
        return Optional.of(futuresModule);
    }
}
