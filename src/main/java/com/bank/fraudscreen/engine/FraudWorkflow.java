package com.bank.fraudscreen.engine;

import com.bank.fraudscreen.config.MetricsConfig;
import com.bank.fraudscreen.config.WorkflowConfig;
import com.bank.fraudscreen.model.AlertOutcome;
import com.bank.fraudscreen.model.AuditReport;
import com.bank.fraudscreen.model.BranchResult;
import com.bank.fraudscreen.model.EnrichedContext;
import com.bank.fraudscreen.model.RiskAssessment;
import com.bank.fraudscreen.model.WorkflowResult;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the screening graph for one transaction.
 *
 * Flow:
 * 1. Enrichment: load the transaction, customer and history (transaction not found aborts the run)
 * 2. Risk scoring: rules plus reasoning narrative, reconciled into one assessment
 * 3. Compliance audit and fraud alert run concurrently on the same assessment
 * 4. Both branch results are collected; a failed branch never discards the other one
 */
@Service
public class FraudWorkflow {

    private static final Logger log = LoggerFactory.getLogger(FraudWorkflow.class);

    private final WorkflowStage<String, EnrichedContext> enrichmentStage;
    private final WorkflowStage<EnrichedContext, RiskAssessment> scoringStage;
    private final WorkflowStage<RiskAssessment, AuditReport> auditStage;
    private final WorkflowStage<RiskAssessment, AlertOutcome> alertStage;
    private final ExecutorService sinkExecutor;
    private final WorkflowConfig workflowConfig;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public FraudWorkflow(WorkflowStage<String, EnrichedContext> enrichmentStage,
                         WorkflowStage<EnrichedContext, RiskAssessment> scoringStage,
                         WorkflowStage<RiskAssessment, AuditReport> auditStage,
                         WorkflowStage<RiskAssessment, AlertOutcome> alertStage,
                         @Qualifier("sinkExecutor") ExecutorService sinkExecutor,
                         WorkflowConfig workflowConfig,
                         Tracer tracer,
                         MetricsConfig metricsConfig) {
        requireLink(enrichmentStage, scoringStage);
        requireLink(scoringStage, auditStage);
        requireLink(scoringStage, alertStage);

        this.enrichmentStage = enrichmentStage;
        this.scoringStage = scoringStage;
        this.auditStage = auditStage;
        this.alertStage = alertStage;
        this.sinkExecutor = sinkExecutor;
        this.workflowConfig = workflowConfig;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        log.info("Workflow graph: {} -> {} -> [{}, {}]", enrichmentStage.getName(), scoringStage.getName(),
                auditStage.getName(), alertStage.getName());
    }

    /**
     * Screen one transaction.
     *
     * @throws TransactionNotFoundException if the transaction does not exist
     * @throws StageExecutionException if enrichment or scoring fails; no branch runs in that case
     */
    public WorkflowResult runWorkflow(String transactionId) {
        long started = System.nanoTime();
        Span workflowSpan = tracer.nextSpan()
                .name("fraud.workflow")
                .tag("txn.id", String.valueOf(transactionId))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(workflowSpan)) {
            EnrichedContext context = runUpstream(enrichmentStage, transactionId, workflowSpan);
            RiskAssessment assessment = runUpstream(scoringStage, context, workflowSpan);

            CompletableFuture<BranchResult<AuditReport>> auditFuture = startBranch(auditStage, assessment, workflowSpan);
            CompletableFuture<BranchResult<AlertOutcome>> alertFuture = startBranch(alertStage, assessment, workflowSpan);

            // one deadline shared by both branches
            long deadline = System.nanoTime() + workflowConfig.getBranchTimeout().toNanos();
            BranchResult<AuditReport> audit = awaitBranch(auditFuture, auditStage.getName(), deadline);
            BranchResult<AlertOutcome> alert = awaitBranch(alertFuture, alertStage.getName(), deadline);

            WorkflowResult result = WorkflowResult.builder()
                    .transactionId(transactionId)
                    .riskAssessment(assessment)
                    .audit(audit)
                    .alert(alert)
                    .durationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started))
                    .build();

            String outcome = result.isComplete() ? "COMPLETED" : "PARTIAL";
            workflowSpan.tag("workflow.outcome", outcome);
            workflowSpan.tag("risk.score", String.valueOf(assessment.getScore()));
            metricsConfig.recordWorkflow(outcome);

            if (!result.isComplete()) {
                log.warn("Workflow for txn {} finished partially: audit={} alert={}",
                        transactionId, audit.getStatus(), alert.getStatus());
            }
            return result;
        } catch (WorkflowException e) {
            workflowSpan.error(e);
            workflowSpan.tag("workflow.outcome", "FAILED");
            metricsConfig.recordWorkflow("FAILED");
            log.error("Workflow for txn {} aborted at stage '{}': {}", transactionId, e.getStage(), e.getMessage());
            throw e;
        } finally {
            workflowSpan.end();
        }
    }

    private <I, O> O runUpstream(WorkflowStage<I, O> stage, I input, Span parent) {
        try {
            return executeStage(stage, input, parent);
        } catch (WorkflowException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StageExecutionException(stage.getName(), e);
        }
    }

    private <O> CompletableFuture<BranchResult<O>> startBranch(WorkflowStage<RiskAssessment, O> stage,
                                                               RiskAssessment assessment, Span parent) {
        return CompletableFuture
                .supplyAsync(() -> BranchResult.success(stage.getName(), executeStage(stage, assessment, parent)),
                        sinkExecutor)
                .exceptionally(ex -> {
                    Throwable cause = unwrap(ex);
                    log.error("Branch '{}' failed for txn {}: {}", stage.getName(),
                            assessment.getTransactionId(), cause.getMessage(), cause);
                    return BranchResult.failure(stage.getName(), describe(cause));
                });
    }

    private <O> BranchResult<O> awaitBranch(CompletableFuture<BranchResult<O>> future, String stageName,
                                            long deadlineNanos) {
        long timeoutMs = workflowConfig.getBranchTimeout().toMillis();
        long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Branch '{}' did not finish within {} ms", stageName, timeoutMs);
            return BranchResult.failure(stageName, "Branch timed out after " + timeoutMs + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return BranchResult.failure(stageName, "Interrupted while waiting for branch");
        } catch (ExecutionException e) {
            return BranchResult.failure(stageName, describe(unwrap(e)));
        }
    }

    private <I, O> O executeStage(WorkflowStage<I, O> stage, I input, Span parent) {
        Span span = tracer.nextSpan(parent)
                .name("stage." + stage.getName())
                .start();
        long started = System.nanoTime();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            O output = stage.execute(input);
            metricsConfig.recordStage(stage.getName(), "success", System.nanoTime() - started);
            return output;
        } catch (RuntimeException e) {
            span.error(e);
            metricsConfig.recordStage(stage.getName(), "failure", System.nanoTime() - started);
            throw e;
        } finally {
            span.end();
        }
    }

    private static void requireLink(WorkflowStage<?, ?> from, WorkflowStage<?, ?> to) {
        if (from.outputType() == null || to.inputType() == null
                || !to.inputType().isAssignableFrom(from.outputType())) {
            throw new IllegalStateException(String.format(
                    "Stage '%s' produces %s but '%s' expects %s",
                    from.getName(), from.outputType(), to.getName(), to.inputType()));
        }
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
