package com.workflowtrader.domain.model;

import com.workflowtrader.domain.enums.MarginMode;
import com.workflowtrader.domain.enums.ReviewInterval;
import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.domain.enums.TradeMode;
import com.workflowtrader.domain.enums.WorkflowStatus;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.Builder;
import lombok.Data;

/**
 * A user's recurring trading strategy.
 *
 * <p>A workflow is reviewed on its {@link ReviewInterval} while ACTIVE. Each review asks the
 * configured model for a decision over the configured tokens plus the cash token, and realizes
 * it on the workflow's exchange in either spot or futures mode.
 *
 * <p>When {@code manualRebalance} is set a run stores its decision without executing it; the
 * user then executes stored orders one at a time.
 */
@Data
@Builder
public class Workflow {

    private Long id;
    private String userId;
    private String name;
    private TradeMode mode;
    private SupportedExchange exchange;
    private WorkflowStatus status;

    /** Quote asset the portfolio is valued in, e.g. USDT. */
    private String cashToken;

    @Builder.Default
    private List<WorkflowToken> tokens = new ArrayList<>();

    private ReviewInterval reviewInterval;
    private String model;
    private Long aiApiKeyId;
    private Long exchangeApiKeyId;
    private String agentInstructions;
    private boolean manualRebalance;

    /** Leverage used for futures actions that do not carry their own. Null means leave unchanged. */
    private Integer futuresDefaultLeverage;

    private MarginMode futuresMarginMode;
    private LocalDateTime createdAt;

    public boolean isActive() {
        return status == WorkflowStatus.ACTIVE;
    }

    /** Configured tokens plus the cash token, upper-cased. */
    public Set<String> allowedTokens() {
        Set<String> allowed = new LinkedHashSet<>();
        for (WorkflowToken token : tokens) {
            allowed.add(token.getToken().toUpperCase(Locale.ROOT));
        }
        if (cashToken != null) {
            allowed.add(cashToken.toUpperCase(Locale.ROOT));
        }
        return allowed;
    }
}
