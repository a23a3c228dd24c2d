package com.workflowtrader.analysis;

import com.workflowtrader.domain.model.Workflow;

/**
 * Enriches a snapshot with an opinion about one token. Implementations may throw; the
 * coordinator replaces a failed report with {@link AnalystReport#unavailable}.
 */
public interface Analyst {

    String name();

    AnalystReport analyze(Workflow workflow, String token);
}
