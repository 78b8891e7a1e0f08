package com.bank.fraudscreen.controller;

import com.bank.fraudscreen.engine.FraudWorkflow;
import com.bank.fraudscreen.model.BatchScreeningRequest;
import com.bank.fraudscreen.model.BatchScreeningSummary;
import com.bank.fraudscreen.model.WorkflowResult;
import com.bank.fraudscreen.service.BatchScreeningService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/screenings")
@Tag(name = "Screenings", description = "Run fraud and compliance screening for stored transactions")
public class ScreeningController {

    private final FraudWorkflow workflow;
    private final BatchScreeningService batchScreeningService;

    public ScreeningController(FraudWorkflow workflow, BatchScreeningService batchScreeningService) {
        this.workflow = workflow;
        this.batchScreeningService = batchScreeningService;
    }

    @Operation(summary = "Screen a transaction",
            description = "Enriches the transaction, scores it with the rule engine and the reasoning service, then " +
                    "runs the compliance audit and fraud alert branches in parallel. A failed branch is reported " +
                    "in its own result; the other branch's output is still returned.")
    @PostMapping("/{transactionId}")
    public ResponseEntity<WorkflowResult> screen(
            @Parameter(description = "Transaction ID", example = "TX1012")
            @PathVariable String transactionId) {
        return ResponseEntity.ok(workflow.runWorkflow(transactionId));
    }

    @Operation(summary = "Screen several transactions",
            description = "Screens each transaction in order and returns a per-transaction summary. " +
                    "Unknown transactions are reported as FAILED without stopping the batch.")
    @PostMapping("/batch")
    public ResponseEntity<BatchScreeningSummary> screenBatch(@RequestBody BatchScreeningRequest request) {
        return ResponseEntity.ok(batchScreeningService.screenAll(request.transactionIds()));
    }
}
