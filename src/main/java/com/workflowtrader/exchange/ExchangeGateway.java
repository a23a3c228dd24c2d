package com.workflowtrader.exchange;

import com.workflowtrader.domain.enums.SupportedExchange;
import java.util.Optional;

/**
 * Capability-tagged adapter for one exchange.
 *
 * <p>Every exchange exposes market metadata. Spot and futures trading are optional modules:
 * an empty {@link Optional} means the exchange does not support that mode, which callers
 * treat as a normal, recorded outcome rather than a failure to crash on.
 *
 * <p>Exchange-specific encodings (signing, side mapping, hedge-mode flags) stay inside the
 * adapter; callers only see the module interfaces.
 */
public interface ExchangeGateway {

    SupportedExchange exchange();

    MarketMetadataModule metadata();

    Optional<SpotTradingModule> spot();

    Optional<FuturesTradingModule> futures();
}
