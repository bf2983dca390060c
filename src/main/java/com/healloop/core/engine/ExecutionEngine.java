package com.healloop.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healloop.core.autofix.ApplyOutcome;
import com.healloop.core.autofix.AutoFixGate;
import com.healloop.core.contract.ContractBuilder;
import com.healloop.core.contract.ExecutionContract;
import com.healloop.core.events.EventBus;
import com.healloop.core.events.HealloopEvent;
import com.healloop.core.guardrail.GuardrailEvaluator;
import com.healloop.core.guardrail.Guardrails;
import com.healloop.core.guardrail.RetryPolicy;
import com.healloop.core.learning.ComplexityAnalysis;
import com.healloop.core.learning.ComplexityAnalyzer;
import com.healloop.core.learning.FailureAnalysis;
import com.healloop.core.learning.FailureAnalyzer;
import com.healloop.core.learning.FixType;
import com.healloop.core.logging.MdcContext;
import com.healloop.core.memory.ExecutionMemory;
import com.healloop.core.memory.MemorySnapshot;
import com.healloop.core.memory.Recommendation;
import com.healloop.core.memory.RecommendationLog;
import com.healloop.core.metrics.HealloopMetrics;
import com.healloop.core.patch.PatchPlan;
import com.healloop.core.patch.PatchProposer;
import com.healloop.core.proposal.EnhancementProposal;
import com.healloop.core.proposal.ProposalRegistry;
import com.healloop.core.scoring.ConfidenceRiskScorer;
import com.healloop.core.scoring.FixAssessment;
import com.healloop.core.telemetry.TelemetryRecord;
import com.healloop.core.telemetry.TelemetryRecorder;
import com.healloop.core.telemetry.TelemetryStatus;
import com.healloop.core.telemetry.TelemetrySummary;
import com.healloop.core.validation.GroundTruthValidatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one tool invocation through contract negotiation, guarded retries, ground-truth
 * validation and, on failure, the patch-proposal pipeline.
 * <p>
 * Each call runs synchronously on the caller's thread. Expected outcomes (tool errors,
 * validator issues, guardrail breaches, oracle failures) always come back as an
 * {@link ExecutionResponse}; nothing thrown by the tool escapes {@link #execute}.
 */
@Service
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);
    private static final AtomicInteger EXECUTION_COUNTER = new AtomicInteger(0);

    /** Share of the duration budget above which a success earns a future-enhancement idea. */
    static final double SLOW_SUCCESS_RATIO = 0.8;

    static final String TRIGGER_EXHAUSTED = "attempts_exhausted";
    static final String TRIGGER_BREACH = "guardrail_breach";
    static final String TRIGGER_EXCEPTION = "terminal_exception";

    private final ContractBuilder contractBuilder;
    private final ComplexityAnalyzer complexityAnalyzer;
    private final GuardrailEvaluator guardrailEvaluator;
    private final GroundTruthValidatorRegistry validators;
    private final TelemetryRecorder telemetry;
    private final FailureAnalyzer failureAnalyzer;
    private final PatchProposer patchProposer;
    private final ConfidenceRiskScorer scorer;
    private final ProposalRegistry registry;
    private final AutoFixGate autoFixGate;
    private final ExecutionMemory memory;
    private final RecommendationLog recommendations;
    private final EngineProperties properties;
    private final ObjectMapper objectMapper;
    private final HealloopMetrics metrics;
    private final EventBus eventBus;

    public ExecutionEngine(ContractBuilder contractBuilder,
                           ComplexityAnalyzer complexityAnalyzer,
                           GuardrailEvaluator guardrailEvaluator,
                           GroundTruthValidatorRegistry validators,
                           TelemetryRecorder telemetry,
                           FailureAnalyzer failureAnalyzer,
                           PatchProposer patchProposer,
                           ConfidenceRiskScorer scorer,
                           ProposalRegistry registry,
                           AutoFixGate autoFixGate,
                           ExecutionMemory memory,
                           RecommendationLog recommendations,
                           EngineProperties properties,
                           ObjectMapper objectMapper,
                           HealloopMetrics metrics,
                           EventBus eventBus) {
        this.contractBuilder = contractBuilder;
        this.complexityAnalyzer = complexityAnalyzer;
        this.guardrailEvaluator = guardrailEvaluator;
        this.validators = validators;
        this.telemetry = telemetry;
        this.failureAnalyzer = failureAnalyzer;
        this.patchProposer = patchProposer;
        this.scorer = scorer;
        this.registry = registry;
        this.autoFixGate = autoFixGate;
        this.memory = memory;
        this.recommendations = recommendations;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    public ExecutionResponse execute(String request, String tool, Map<String, Object> params, ToolCallback callback) {
        return execute(ExecutionRequest.of(request, tool, params), callback);
    }

    public ExecutionResponse execute(ExecutionRequest request, ToolCallback callback) {
        String executionId = generateExecutionId();
        MdcContext.setExecution(executionId, request.tool());
        try {
            log.info("Execution {} started for tool {}", executionId, request.tool());
            eventBus.publish(HealloopEvent.of(HealloopEvent.EXECUTION_STARTED, executionId, request.tool(),
                    Map.of("request", request.request())));
            ExecutionResponse response = run(executionId, request, callback);
            metrics.recordExecutionResult(request.tool(), response.status().wireValue());
            metrics.recordAttemptsPerExecution(response.attempts());
            eventBus.publish(HealloopEvent.of(HealloopEvent.EXECUTION_COMPLETED, executionId, request.tool(),
                    Map.of("status", response.status().wireValue(), "attempts", response.attempts())));
            log.info("Execution {} finished: {} after {} attempt(s)",
                    executionId, response.status().wireValue(), response.attempts());
            return response;
        } finally {
            MdcContext.clear();
        }
    }

    public String generateExecutionId() {
        int count = EXECUTION_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(java.time.ZoneOffset.UTC).getYear();
        return String.format("EXEC-%d-%04d", year, count);
    }

    private ExecutionResponse run(String executionId, ExecutionRequest request, ToolCallback callback) {
        String tool = request.tool();

        enter(executionId, ExecutionPhase.BUILD_CONTRACT);
        ComplexityAnalysis complexity = request.complexity() != null
                ? request.complexity()
                : complexityAnalyzer.analyze(request.request(), tool);
        ExecutionContract contract = contractBuilder.build(request.request(), tool, request.params(),
                complexity, memory.recent(properties.getMemoryContextSize()));
        if (contract.fallback()) {
            metrics.recordContractFallback(tool);
        }
        Guardrails guardrails = guardrailEvaluator.derive(contract);
        log.debug("Guardrails: {}", guardrails);

        enter(executionId, ExecutionPhase.VALIDATE_PAYLOAD);
        Map<String, Object> payload = contract.finalPayload(request.params());
        List<String> missing = contract.missingFields(payload);
        List<String> parameterIssues = validators.validateParameters(tool, payload);
        if (!missing.isEmpty() || !parameterIssues.isEmpty()) {
            return validationFailure(executionId, tool, contract, missing, parameterIssues);
        }

        var run = new Run(executionId, request, contract, guardrails, complexity, payload, payloadSize(payload));
        RetryPolicy policy = guardrailEvaluator.retryPolicy(guardrails, request.cancellation());
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            enter(executionId, ExecutionPhase.ATTEMPT);
            ExecutionPhase verdict;
            try {
                MdcContext.setAttempt(attempt);
                verdict = attempt(run, attempt, policy, callback);
            } finally {
                MdcContext.clearAttempt();
            }
            enter(executionId, verdict);
            if (verdict == ExecutionPhase.SUCCESS) {
                return finalizeSuccess(run, policy);
            }
            if (verdict != ExecutionPhase.RETRY) {
                break;
            }
        }
        return finalizeFailure(run, policy);
    }

    private ExecutionPhase attempt(Run run, int attempt, RetryPolicy policy, ToolCallback callback) {
        String tool = run.request.tool();
        long start = System.currentTimeMillis();
        ToolOutcome outcome = null;
        Exception thrown = null;
        try {
            outcome = callback.execute(tool, run.payload);
            if (outcome == null) {
                outcome = ToolOutcome.error("Tool returned no outcome");
            }
        } catch (Exception e) {
            thrown = e;
        }
        long durationMs = System.currentTimeMillis() - start;

        TelemetryStatus status = thrown != null ? TelemetryStatus.EXCEPTION
                : outcome.isSuccess() ? TelemetryStatus.SUCCESS : TelemetryStatus.ERROR;
        String error = thrown != null ? describe(thrown) : outcome.isSuccess() ? null : outcomeError(outcome);
        run.records.add(telemetry.record(run.executionId, tool, attempt, durationMs, status, error, run.payloadSize));
        run.attempts = attempt;
        metrics.recordAttempt(tool, status.wireValue(), durationMs);
        eventBus.publish(HealloopEvent.of(HealloopEvent.EXECUTION_ATTEMPT, run.executionId, tool,
                Map.of("attempt", attempt, "status", status.wireValue(), "duration_ms", durationMs)));

        if (run.payloadSize > run.guardrails.maxPayloadChars()) {
            return breach(run, Guardrails.MAX_PAYLOAD_CHARS, "Payload size " + run.payloadSize
                    + " exceeds max_payload_chars " + run.guardrails.maxPayloadChars());
        }

        boolean last = policy.isLastAttempt(attempt);
        if (thrown != null) {
            run.lastError = error;
            log.warn("Attempt {}/{} of {} threw: {}", attempt, policy.maxAttempts(), tool, error);
            if (last) {
                run.terminalException = true;
                return ExecutionPhase.TERMINAL_EXCEPTION;
            }
            return between(run, policy, false);
        }

        if (outcome.isSuccess()) {
            List<String> issues = validators.validateResult(tool, outcome.result());
            if (issues.isEmpty()) {
                run.result = outcome.result();
                return ExecutionPhase.SUCCESS;
            }
            run.validationIssues = issues;
            error = "Ground-truth validation failed: " + String.join("; ", issues);
        }
        run.lastError = error;
        log.warn("Attempt {}/{} of {} failed: {}", attempt, policy.maxAttempts(), tool, error);

        FailureAnalysis analysis = failureAnalyzer.analyze(tool, error, failureContext(run, attempt));
        run.lastAnalysis = analysis;
        if (last) {
            run.alternativeApproach = failureAnalyzer
                    .suggestAlternative(run.request.request(), describeApproach(run), error)
                    .orElse(null);
            if (policy.deadlineExceeded()) {
                return durationBreach(run, policy);
            }
            return ExecutionPhase.RETRY;
        }
        return between(run, policy, analysis.fixType() == FixType.CONFIG);
    }

    /** Checks deadline and cancellation, then waits out the backoff unless told to retry immediately. */
    private ExecutionPhase between(Run run, RetryPolicy policy, boolean immediate) {
        if (policy.deadlineExceeded()) {
            return durationBreach(run, policy);
        }
        if (policy.isCancelled()) {
            return breach(run, "cancelled", "Execution cancelled after attempt " + run.attempts);
        }
        if (!immediate && !policy.pause()) {
            return breach(run, "cancelled", "Interrupted while waiting to retry");
        }
        return ExecutionPhase.RETRY;
    }

    private ExecutionPhase durationBreach(Run run, RetryPolicy policy) {
        return breach(run, Guardrails.MAX_DURATION_SECONDS, "Elapsed " + policy.elapsedMillis()
                + "ms exceeds max_duration_seconds " + run.guardrails.maxDurationSeconds());
    }

    private ExecutionPhase breach(Run run, String guardrail, String reason) {
        log.warn("Guardrail breach on {}: {}", run.request.tool(), reason);
        metrics.recordGuardrailBreach(guardrail);
        run.breachReason = reason;
        if (run.lastError == null) {
            run.lastError = reason;
        } else {
            run.lastError = reason + " (last error: " + run.lastError + ")";
        }
        return ExecutionPhase.GUARDRAIL_BREACH;
    }

    private ExecutionResponse finalizeSuccess(Run run, RetryPolicy policy) {
        enter(run.executionId, ExecutionPhase.FINALIZE);
        long durationMs = policy.elapsedMillis();
        remember(run, ExecutionStatus.SUCCESS, run.result, durationMs,
                run.contract.fallback() ? "fallback contract" : "");
        recommendIfWarranted(run, durationMs);
        return new ExecutionResponse(ExecutionStatus.SUCCESS, run.executionId, run.request.tool(), run.result, null,
                "Succeeded on attempt " + run.attempts + " of " + run.guardrails.maxAttempts(),
                run.contract, TelemetrySummary.of(run.records), run.attempts,
                null, null, null, null, null, null);
    }

    private void recommendIfWarranted(Run run, long durationMs) {
        boolean slow = durationMs > SLOW_SUCCESS_RATIO * run.guardrails.maxDurationMillis();
        boolean complex = run.complexity.complexity().isComplex();
        if (!slow && !complex) {
            return;
        }
        String reason = slow
                ? "slow (" + durationMs + "ms of a " + run.guardrails.maxDurationMillis() + "ms budget)"
                : "classified as " + run.complexity.complexity().wireValue();
        patchProposer.suggestFutureEnhancement(run.request.request(), run.request.tool(), reason)
                .ifPresent(suggestion -> {
                    recommendations.add(new Recommendation(Instant.now(), run.request.request(),
                            run.request.tool(), reason, suggestion));
                    log.info("Stored future enhancement idea for {} ({})", run.request.tool(), reason);
                });
    }

    private ExecutionResponse finalizeFailure(Run run, RetryPolicy policy) {
        enter(run.executionId, ExecutionPhase.FINALIZE);
        String tool = run.request.tool();
        String error = run.lastError != null ? run.lastError : "Execution failed";
        String trigger = run.breachReason != null ? TRIGGER_BREACH
                : run.terminalException ? TRIGGER_EXCEPTION : TRIGGER_EXHAUSTED;
        remember(run, ExecutionStatus.ERROR, error, policy.elapsedMillis(),
                run.breachReason != null ? run.breachReason : trigger);
        TelemetrySummary summary = TelemetrySummary.of(run.records);

        Optional<PatchPlan> plan = patchProposer.propose(trigger, run.request.request(), tool, error,
                patchContext(run, trigger, summary));
        if (plan.isEmpty()) {
            return failure(run, ExecutionStatus.ERROR, error,
                    "Failed after " + run.attempts + " attempt(s); no patch could be proposed",
                    summary, null, null);
        }

        FixAssessment assessment = scorer.assess(plan.get(), error, (int) telemetry.attemptsFor(tool));
        EnhancementProposal proposal;
        try {
            proposal = registry.registerProposal(EnhancementProposal.pending(trigger, run.request.request(), tool,
                    error, analysisSnapshot(run.lastAnalysis), plan.get(), assessment, proposalMetadata(run)));
        } catch (RuntimeException e) {
            log.error("Could not register proposal for {}: {}", tool, e.getMessage());
            return failure(run, ExecutionStatus.ERROR, error,
                    "Failed after " + run.attempts + " attempt(s); proposal could not be stored",
                    summary, null, null);
        }
        metrics.recordProposal(proposal.riskLevel().wireValue());
        eventBus.publish(HealloopEvent.of(HealloopEvent.PROPOSAL_REGISTERED, run.executionId, tool,
                Map.of("proposal_id", proposal.id(), "confidence", proposal.confidence(),
                        "risk_level", proposal.riskLevel().wireValue())));

        ApplyOutcome outcome = autoFixGate.applyFix(proposal, false);
        if (outcome.applied()) {
            eventBus.publish(HealloopEvent.of(HealloopEvent.PROPOSAL_AUTO_APPLIED, run.executionId, tool,
                    Map.of("proposal_id", proposal.id(), "backup_path", outcome.backupPath())));
            return failure(run, ExecutionStatus.AUTO_APPLIED, error,
                    "Failed after " + run.attempts + " attempt(s); fix " + proposal.id()
                            + " was applied automatically",
                    summary, ProposalSummary.of(proposal), outcome.backupPath());
        }
        String note = outcome.success() ? "" : " (automatic apply failed: " + outcome.error() + ")";
        return failure(run, ExecutionStatus.PENDING_APPROVAL, error,
                "Failed after " + run.attempts + " attempt(s); fix " + proposal.id()
                        + " awaits approval" + note,
                summary, ProposalSummary.of(proposal), outcome.backupPath());
    }

    private ExecutionResponse failure(Run run, ExecutionStatus status, String error, String summaryText,
                                      TelemetrySummary summary, ProposalSummary proposal, String backupPath) {
        return new ExecutionResponse(status, run.executionId, run.request.tool(), null, error, summaryText,
                run.contract, summary, run.attempts, null,
                run.validationIssues, run.breachReason, run.alternativeApproach, proposal, backupPath);
    }

    private ExecutionResponse validationFailure(String executionId, String tool, ExecutionContract contract,
                                                List<String> missing, List<String> parameterIssues) {
        var problems = new ArrayList<String>();
        if (!missing.isEmpty()) {
            problems.add("missing required fields " + missing);
        }
        problems.addAll(parameterIssues);
        String error = "Payload validation failed: " + String.join("; ", problems);
        log.warn("Execution {} rejected before any attempt: {}", executionId, error);
        return new ExecutionResponse(ExecutionStatus.VALIDATION_ERROR, executionId, tool, null, error,
                "No attempt made; the payload is incomplete or invalid",
                contract, TelemetrySummary.EMPTY, 0,
                missing.isEmpty() ? null : missing,
                parameterIssues.isEmpty() ? null : parameterIssues,
                null, null, null, null);
    }

    private void remember(Run run, ExecutionStatus status, Object result, long durationMs, String notes) {
        memory.remember(new MemorySnapshot(Instant.now(), run.request.request(), run.request.tool(),
                status.wireValue(), MemorySnapshot.excerpt(result), run.contract.intent(),
                run.attempts, durationMs, notes));
    }

    private Map<String, Object> failureContext(Run run, int attempt) {
        var context = new LinkedHashMap<String, Object>();
        context.put("request", run.request.request());
        context.put("intent", run.contract.intent());
        context.put("attempt", attempt);
        context.put("max_attempts", run.guardrails.maxAttempts());
        context.put("payload", run.payload);
        return context;
    }

    private Map<String, Object> patchContext(Run run, String trigger, TelemetrySummary summary) {
        var context = new LinkedHashMap<String, Object>();
        context.put("trigger", trigger);
        context.put("intent", run.contract.intent());
        context.put("success_criteria", run.contract.successCriteria());
        context.put("payload", run.payload);
        context.put("attempts", run.attempts);
        context.put("telemetry", summary);
        if (run.lastAnalysis != null) {
            context.put("analysis", analysisSnapshot(run.lastAnalysis));
        }
        if (run.validationIssues != null) {
            context.put("validation_issues", run.validationIssues);
        }
        if (run.breachReason != null) {
            context.put("breach_reason", run.breachReason);
        }
        return context;
    }

    private static Map<String, Object> analysisSnapshot(FailureAnalysis analysis) {
        if (analysis == null) {
            return Map.of();
        }
        var snapshot = new LinkedHashMap<String, Object>();
        snapshot.put("root_cause", analysis.rootCause());
        snapshot.put("fix_type", analysis.fixType().wireValue());
        snapshot.put("suggested_fix", analysis.suggestedFix());
        snapshot.put("prevention", analysis.prevention());
        snapshot.put("recurrence_count", analysis.recurrenceCount());
        return snapshot;
    }

    private static Map<String, Object> proposalMetadata(Run run) {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("execution_id", run.executionId);
        metadata.put("attempts", run.attempts);
        metadata.put("contract_fallback", run.contract.fallback());
        if (run.breachReason != null) {
            metadata.put("breach_reason", run.breachReason);
        }
        return metadata;
    }

    private static String describeApproach(Run run) {
        return "Called " + run.request.tool() + " with " + run.payload.keySet() + " to " + run.contract.intent();
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null || message.isBlank() ? "" : ": " + message);
    }

    private static String outcomeError(ToolOutcome outcome) {
        if (outcome.error() != null && !outcome.error().isBlank()) {
            return outcome.error();
        }
        return "Tool reported status=" + outcome.status();
    }

    private int payloadSize(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload).length();
        } catch (JsonProcessingException e) {
            return String.valueOf(payload).length();
        }
    }

    private static void enter(String executionId, ExecutionPhase phase) {
        log.debug("Execution {} -> {}", executionId, phase);
    }

    /** Per-execution state; never shared between threads. */
    private static final class Run {
        final String executionId;
        final ExecutionRequest request;
        final ExecutionContract contract;
        final Guardrails guardrails;
        final ComplexityAnalysis complexity;
        final Map<String, Object> payload;
        final int payloadSize;
        final List<TelemetryRecord> records = new ArrayList<>();

        int attempts;
        Object result;
        String lastError;
        FailureAnalysis lastAnalysis;
        List<String> validationIssues;
        String alternativeApproach;
        String breachReason;
        boolean terminalException;

        Run(String executionId, ExecutionRequest request, ExecutionContract contract, Guardrails guardrails,
            ComplexityAnalysis complexity, Map<String, Object> payload, int payloadSize) {
            this.executionId = executionId;
            this.request = request;
            this.contract = contract;
            this.guardrails = guardrails;
            this.complexity = complexity;
            this.payload = payload;
            this.payloadSize = payloadSize;
        }
    }
}
