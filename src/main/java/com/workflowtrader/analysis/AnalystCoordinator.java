package com.workflowtrader.analysis;

import com.workflowtrader.config.PipelineConfig;
import com.workflowtrader.domain.model.Workflow;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs every registered {@link Analyst} for every non-cash token in parallel.
 * Never throws: a failed or timed-out analyst contributes its fallback report.
 */
@Service
public class AnalystCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AnalystCoordinator.class);

    private final List<Analyst> analysts;
    private final Executor analysisExecutor;
    private final PipelineConfig pipelineConfig;

    public AnalystCoordinator(
            List<Analyst> analysts,
            @Qualifier("analysisExecutor") Executor analysisExecutor,
            PipelineConfig pipelineConfig) {
        this.analysts = analysts;
        this.analysisExecutor = analysisExecutor;
        this.pipelineConfig = pipelineConfig;
    }

    /** Reports keyed by upper-case token, in token order. */
    public Map<String, List<AnalystReport>> analyze(Workflow workflow) {
        String cash = workflow.getCashToken().toUpperCase(Locale.ROOT);
        Map<String, List<CompletableFuture<AnalystReport>>> pending = new LinkedHashMap<>();

        for (String token : workflow.allowedTokens()) {
            if (token.equals(cash)) {
                continue;
            }
            List<CompletableFuture<AnalystReport>> futures = new ArrayList<>();
            for (Analyst analyst : analysts) {
                futures.add(CompletableFuture.supplyAsync(() -> analyst.analyze(workflow, token), analysisExecutor)
                        .orTimeout(pipelineConfig.getAnalysis().getTimeoutSeconds(), TimeUnit.SECONDS)
                        .exceptionally(e -> {
                            log.warn(
                                    "Analyst failed, using fallback: analyst={}, token={}, error={}",
                                    analyst.name(),
                                    token,
                                    e.getMessage());
                            return AnalystReport.unavailable(analyst.name(), token);
                        }));
            }
            pending.put(token, futures);
        }

        Map<String, List<AnalystReport>> reports = new LinkedHashMap<>();
        pending.forEach((token, futures) ->
                reports.put(token, futures.stream().map(CompletableFuture::join).toList()));
        return reports;
    }
}
