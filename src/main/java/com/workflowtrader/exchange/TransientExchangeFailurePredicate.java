package com.workflowtrader.exchange;

import com.workflowtrader.exception.BaseException;
import com.workflowtrader.exception.ExchangeException;
import java.util.function.Predicate;

/**
 * Circuit breaker failure predicate for the exchange adapters.
 *
 * <p>The breakers are shared by every user, so only transport failures count towards opening
 * them. An exchange rejecting an order (precision, notional, unknown order) is a normal
 * per-order outcome, and a user's missing or incomplete key is that user's problem; neither
 * is recorded. Unexpected runtime errors (I/O wrapping, parse failures) still count.
 */
public class TransientExchangeFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof ExchangeException exchangeException) {
            return exchangeException.isTransient();
        }
        return !(throwable instanceof BaseException);
    }
}
