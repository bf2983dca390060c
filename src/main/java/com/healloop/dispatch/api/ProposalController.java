package com.healloop.dispatch.api;

import com.healloop.core.autofix.ApplyOutcome;
import com.healloop.core.autofix.AutoFixGate;
import com.healloop.core.proposal.EnhancementProposal;
import com.healloop.core.proposal.EnhancementReviewer;
import com.healloop.core.proposal.ProposalNotFoundException;
import com.healloop.core.proposal.ProposalRegistry;
import com.healloop.core.proposal.ProposalReview;
import com.healloop.core.proposal.ProposalStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the human review queue of enhancement proposals.
 */
@RestController
@RequestMapping("/api/v1/proposals")
public class ProposalController {

    private static final Logger log = LoggerFactory.getLogger(ProposalController.class);

    private final ProposalRegistry registry;
    private final AutoFixGate autoFixGate;
    private final EnhancementReviewer reviewer;

    public ProposalController(ProposalRegistry registry, AutoFixGate autoFixGate, EnhancementReviewer reviewer) {
        this.registry = registry;
        this.autoFixGate = autoFixGate;
        this.reviewer = reviewer;
    }

    /**
     * GET /api/v1/proposals — List proposals, newest first, optionally filtered by status.
     */
    @GetMapping
    public List<EnhancementProposal> list(@RequestParam(required = false) String status) {
        ProposalStatus filter = status == null || status.isBlank() ? null : ProposalStatus.fromWire(status);
        return registry.listEnhancements(filter);
    }

    @GetMapping("/{id}")
    public EnhancementProposal get(@PathVariable String id) {
        return registry.getProposal(id).orElseThrow(() -> new ProposalNotFoundException(id));
    }

    /**
     * POST /api/v1/proposals/{id}/apply — Apply through the auto-fix gate.
     * A human call forces the apply unless {@code force=false}; then the gate's policy decides.
     * Returns 200 when applied, 202 when left queued, 409 when the apply failed.
     */
    @PostMapping("/{id}/apply")
    public ResponseEntity<ApplyOutcome> apply(@PathVariable String id,
                                              @RequestParam(defaultValue = "true") boolean force) {
        EnhancementProposal proposal = get(id);
        log.info("Apply requested for proposal {} (force={})", id, force);
        ApplyOutcome outcome = autoFixGate.applyFix(proposal, force);
        if (!outcome.success()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(outcome);
        }
        if (outcome.queuedForReview()) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(outcome);
        }
        return ResponseEntity.ok(outcome);
    }

    @PostMapping("/{id}/reject")
    public EnhancementProposal reject(@PathVariable String id,
                                      @RequestBody(required = false) RejectRequest request) {
        return registry.rejectProposal(id, request == null ? null : request.reason());
    }

    @PostMapping("/{id}/review")
    public ProposalReview review(@PathVariable String id) {
        return reviewer.review(id);
    }
}
