package com.workflowtrader.review;

import com.workflowtrader.agent.FuturesActionInstruction;
import com.workflowtrader.agent.FuturesDecision;
import com.workflowtrader.agent.SpotDecision;
import com.workflowtrader.agent.SpotOrderInstruction;
import com.workflowtrader.domain.enums.FuturesActionType;
import com.workflowtrader.domain.model.Workflow;
import com.workflowtrader.oms.TradingPair;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Checks a decision against the workflow's token set before anything is persisted as
 * executable. Returns the first problem found as a message, or null when the decision may be
 * executed.
 */
@Component
public class DecisionValidator {

    public String validateSpot(Workflow workflow, SpotDecision decision) {
        Set<String> allowed = workflow.allowedTokens();
        int index = 0;
        for (SpotOrderInstruction order : decision.getOrders()) {
            index++;
            Optional<TradingPair> pair = TradingPair.parse(order.getPair());
            if (pair.isEmpty()) {
                return "order " + index + ": unknown pair " + order.getPair();
            }
            if (!allowed.contains(pair.get().base()) || !allowed.contains(pair.get().quote())) {
                return "order " + index + ": pair " + pair.get().symbol() + " is outside the workflow tokens";
            }
            if (order.getToken() == null || !pair.get().contains(order.getToken())) {
                return "order " + index + ": token " + order.getToken() + " is not a leg of " + pair.get().symbol();
            }
            if (!isPositive(order.getQuantity())) {
                return "order " + index + ": quantity must be positive";
            }
        }
        return null;
    }

    public String validateFutures(Workflow workflow, FuturesDecision decision) {
        Set<String> allowed = workflow.allowedTokens();
        String cash = workflow.getCashToken().toUpperCase(Locale.ROOT);
        int index = 0;
        for (FuturesActionInstruction action : decision.getActions()) {
            index++;
            String symbol = action.getSymbol() == null ? "" : action.getSymbol().trim().toUpperCase(Locale.ROOT);
            String base = symbol.endsWith(cash) ? symbol.substring(0, symbol.length() - cash.length()) : symbol;
            if (base.isEmpty() || base.equals(cash) || !allowed.contains(base)) {
                return "action " + index + ": symbol " + action.getSymbol() + " is outside the workflow tokens";
            }
            if (action.getAction() != FuturesActionType.HOLD && !isPositive(action.getQuantity())) {
                return "action " + index + ": quantity must be positive";
            }
        }
        return null;
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
