package com.workflowtrader.analysis;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One analyst's view of one token. {@code available} is false for the fallback report
 * produced when the analyst failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalystReport {

    public static final String UNAVAILABLE_COMMENT = "Analysis unavailable";

    private String analyst;
    private String token;
    private boolean available;

    /** Bullishness from 0 to 10. */
    private BigDecimal score;

    private String comment;

    @Builder.Default
    private Map<String, BigDecimal> metrics = new LinkedHashMap<>();

    public static AnalystReport unavailable(String analyst, String token) {
        return AnalystReport.builder()
                .analyst(analyst)
                .token(token)
                .available(false)
                .score(BigDecimal.ZERO)
                .comment(UNAVAILABLE_COMMENT)
                .build();
    }
}
