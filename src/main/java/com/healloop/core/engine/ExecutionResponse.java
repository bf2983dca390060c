package com.healloop.core.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.healloop.core.contract.ExecutionContract;
import com.healloop.core.telemetry.TelemetrySummary;

import java.util.List;

/**
 * Terminal envelope of an execution. Every envelope carries a readable summary, the
 * contract used and a telemetry summary; the other fields depend on the status.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResponse(
    ExecutionStatus status,
    String executionId,
    String tool,
    Object result,
    String error,
    String summary,
    ExecutionContract contract,
    TelemetrySummary telemetrySummary,
    int attempts,
    List<String> missingFields,
    List<String> validationIssues,
    String breachReason,
    String alternativeApproach,
    ProposalSummary proposal,
    String backupPath
) {
    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }
}
