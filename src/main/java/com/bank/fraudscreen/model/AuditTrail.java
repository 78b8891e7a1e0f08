package com.bank.fraudscreen.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Schema(description = "Provenance of the analysis an audit report was derived from")
public class AuditTrail {

    @Schema(example = "Automated risk assessment")
    String analysisMethod;

    @Schema(example = "[\"Transaction Data\", \"Customer Profile\", \"Regulatory Database\"]")
    List<String> dataSources;

    Instant sourceAssessedAt;
}
