package com.workflowtrader.exchange;

import com.workflowtrader.domain.enums.SupportedExchange;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Looks up the gateway registered for an exchange. */
@Component
public class ExchangeGatewayRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExchangeGatewayRegistry.class);

    private final Map<SupportedExchange, ExchangeGateway> gateways = new EnumMap<>(SupportedExchange.class);

    public ExchangeGatewayRegistry(List<ExchangeGateway> gateways) {
        for (ExchangeGateway gateway : gateways) {
            this.gateways.put(gateway.exchange(), gateway);
            log.info(
                    "Exchange gateway registered: exchange={}, spot={}, futures={}",
                    gateway.exchange(),
                    gateway.spot().isPresent(),
                    gateway.futures().isPresent());
        }
    }

    public ExchangeGateway forExchange(SupportedExchange exchange) {
        ExchangeGateway gateway = gateways.get(exchange);
        if (gateway == null) {
            throw new IllegalStateException("No exchange gateway registered for " + exchange);
        }
        return gateway;
    }
}
