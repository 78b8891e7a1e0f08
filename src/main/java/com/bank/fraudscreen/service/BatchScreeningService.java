package com.bank.fraudscreen.service;

import com.bank.fraudscreen.config.WorkflowConfig;
import com.bank.fraudscreen.engine.FraudWorkflow;
import com.bank.fraudscreen.engine.WorkflowException;
import com.bank.fraudscreen.model.AlertOutcome;
import com.bank.fraudscreen.model.AlertOutcomeType;
import com.bank.fraudscreen.model.AuditReport;
import com.bank.fraudscreen.model.BatchScreeningSummary;
import com.bank.fraudscreen.model.BranchResult;
import com.bank.fraudscreen.model.WorkflowResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Screens a list of transactions one after another. A failed transaction is recorded in
 * the summary and the run moves on to the next id.
 */
@Service
public class BatchScreeningService {

    private static final Logger log = LoggerFactory.getLogger(BatchScreeningService.class);

    private final FraudWorkflow workflow;
    private final WorkflowConfig workflowConfig;

    public BatchScreeningService(FraudWorkflow workflow, WorkflowConfig workflowConfig) {
        this.workflow = workflow;
        this.workflowConfig = workflowConfig;
    }

    public BatchScreeningSummary screenAll(List<String> transactionIds) {
        if (transactionIds == null || transactionIds.isEmpty()) {
            throw new IllegalArgumentException("transactionIds must not be empty");
        }
        if (transactionIds.size() > workflowConfig.getMaxBatchSize()) {
            throw new IllegalArgumentException("At most " + workflowConfig.getMaxBatchSize()
                    + " transactions can be screened per batch, got " + transactionIds.size());
        }

        List<BatchScreeningSummary.Entry> entries = new ArrayList<>();
        int completed = 0;
        int partial = 0;
        int failed = 0;
        int alertsDispatched = 0;

        for (String transactionId : transactionIds) {
            long started = System.currentTimeMillis();
            try {
                WorkflowResult result = workflow.runWorkflow(transactionId);
                BatchScreeningSummary.Entry entry = toEntry(result);
                entries.add(entry);

                if (result.isComplete()) {
                    completed++;
                } else {
                    partial++;
                }
                if (entry.getAlertOutcome() == AlertOutcomeType.ALERT_DISPATCHED) {
                    alertsDispatched++;
                }
            } catch (WorkflowException e) {
                failed++;
                log.warn("Batch screening of txn {} failed: {}", transactionId, e.getMessage());
                entries.add(BatchScreeningSummary.Entry.builder()
                        .transactionId(transactionId)
                        .status("FAILED")
                        .error(e.getMessage())
                        .durationMs(System.currentTimeMillis() - started)
                        .build());
            }
        }

        log.info("Batch screening finished: processed={}, completed={}, partial={}, failed={}, alerts={}",
                transactionIds.size(), completed, partial, failed, alertsDispatched);

        return BatchScreeningSummary.builder()
                .processed(transactionIds.size())
                .completed(completed)
                .partial(partial)
                .failed(failed)
                .alertsDispatched(alertsDispatched)
                .results(entries)
                .build();
    }

    private static BatchScreeningSummary.Entry toEntry(WorkflowResult result) {
        BranchResult<AuditReport> audit = result.getAudit();
        BranchResult<AlertOutcome> alert = result.getAlert();

        List<String> errors = new ArrayList<>();
        if (!audit.isSucceeded()) {
            errors.add(audit.getStage() + ": " + audit.getError());
        }
        if (!alert.isSucceeded()) {
            errors.add(alert.getStage() + ": " + alert.getError());
        }

        return BatchScreeningSummary.Entry.builder()
                .transactionId(result.getTransactionId())
                .status(result.isComplete() ? "COMPLETED" : "PARTIAL")
                .riskScore(result.getRiskAssessment().getScore())
                .recommendation(result.getRiskAssessment().getRecommendation())
                .complianceRating(audit.isSucceeded() ? audit.getValue().getComplianceRating() : null)
                .alertOutcome(alert.isSucceeded() ? alert.getValue().getType() : null)
                .error(errors.isEmpty() ? null : String.join("; ", errors))
                .durationMs(result.getDurationMs())
                .build();
    }
}
