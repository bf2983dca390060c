package com.healloop.core.autofix;

import com.healloop.core.knowledge.ErrorSolution;
import com.healloop.core.knowledge.KnowledgeStore;
import com.healloop.core.metrics.HealloopMetrics;
import com.healloop.core.patch.FileChange;
import com.healloop.core.proposal.EnhancementProposal;
import com.healloop.core.proposal.PatchApplier;
import com.healloop.core.proposal.ProposalRegistry;
import com.healloop.core.scoring.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Decides whether a proposal is applied without a human, and applies it with a backup.
 * <p>
 * A proposal is approved when auto-fix is enabled and either its confidence reaches the
 * threshold with low risk, or the knowledge store holds a solution for its error with a
 * success rate above 0.9. Files are always backed up before the registry touches them;
 * a failed apply is reported together with the backup location and is never restored
 * automatically.
 */
@Service
public class AutoFixGate {

    private static final Logger log = LoggerFactory.getLogger(AutoFixGate.class);

    static final double KNOWN_FIX_RATE = 0.9;
    static final double SUCCESS_BOOST = 0.1;
    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final AutoFixProperties properties;
    private final ProposalRegistry registry;
    private final KnowledgeStore knowledge;
    private final PatchApplier applier;
    private final HealloopMetrics metrics;

    public AutoFixGate(AutoFixProperties properties, ProposalRegistry registry, KnowledgeStore knowledge,
                       PatchApplier applier, HealloopMetrics metrics) {
        this.properties = properties;
        this.registry = registry;
        this.knowledge = knowledge;
        this.applier = applier;
        this.metrics = metrics;
        log.info("Auto-fix {} (confidence threshold {})",
                properties.isEnabled() ? "enabled" : "disabled", properties.getConfidenceThreshold());
    }

    public boolean shouldAutoApply(EnhancementProposal proposal) {
        if (!properties.isEnabled()) {
            return false;
        }
        if (proposal.confidence() >= properties.getConfidenceThreshold() && proposal.riskLevel() == RiskLevel.LOW) {
            return true;
        }
        return knownSolution(proposal)
                .map(solution -> solution.successRate() > KNOWN_FIX_RATE)
                .orElse(false);
    }

    /**
     * Applies {@code proposal} when approved or forced; otherwise leaves it queued and
     * touches nothing. A forced apply is recorded as a human apply, an approved one as
     * auto-applied.
     */
    public ApplyOutcome applyFix(EnhancementProposal proposal, boolean force) {
        boolean auto = !force && shouldAutoApply(proposal);
        if (!force && !auto) {
            log.info("Proposal {} queued for review (confidence {}, risk {})",
                    proposal.id(), proposal.confidence(), proposal.riskLevel().wireValue());
            metrics.recordAutoFixDecision("queued");
            return ApplyOutcome.queued(proposal.id());
        }

        ApplyOutcome.Backup backup;
        try {
            backup = createBackup(proposal);
        } catch (IOException | RuntimeException e) {
            log.error("Backup for proposal {} failed, not applying: {}", proposal.id(), e.getMessage());
            metrics.recordAutoFixDecision("failed");
            return ApplyOutcome.failed(proposal.id(), null, "Backup failed: " + e.getMessage());
        }

        try {
            registry.applyProposal(proposal.id());
        } catch (RuntimeException e) {
            log.error("Applying proposal {} failed (backup at {}): {}", proposal.id(), backup.path(), e.getMessage());
            metrics.recordAutoFixDecision("failed");
            return ApplyOutcome.failed(proposal.id(), backup, e.getMessage());
        }
        if (auto) {
            try {
                registry.markAutoApplied(proposal.id());
            } catch (RuntimeException e) {
                log.warn("Proposal {} applied but not marked auto-applied: {}", proposal.id(), e.getMessage());
            }
        }

        log.info("{} proposal {}: {} (backup at {})", auto ? "Auto-applied" : "Applied",
                proposal.id(), proposal.summary(), backup.path());
        metrics.recordAutoFixDecision(auto ? "auto_applied" : "applied");
        recordFixSuccess(proposal, auto);
        return ApplyOutcome.applied(proposal.id(), backup);
    }

    ApplyOutcome.Backup createBackup(EnhancementProposal proposal) throws IOException {
        Path backupDir = Path.of(properties.getBackupDir())
                .resolve("fix_" + proposal.id() + "_" + LocalDateTime.now().format(BACKUP_STAMP));
        Files.createDirectories(backupDir);
        var copied = new ArrayList<String>();
        for (FileChange change : proposal.files()) {
            Path source = applier.resolve(change.path());
            if (!Files.isRegularFile(source)) {
                continue;
            }
            Path target = backupDir.resolve(applier.workspaceRoot().relativize(source));
            Files.createDirectories(target.getParent());
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            copied.add(target.toString());
        }
        return new ApplyOutcome.Backup(backupDir.toString(), copied);
    }

    private void recordFixSuccess(EnhancementProposal proposal, boolean auto) {
        String pattern = proposal.errorPattern();
        if (pattern == null || pattern.isBlank() || proposal.summary() == null || proposal.summary().isBlank()) {
            return;
        }
        try {
            Optional<ErrorSolution> existing = knowledge.findErrorSolution(pattern);
            if (existing.isPresent()) {
                double rate = Math.min(1.0, existing.get().successRate() + SUCCESS_BOOST);
                knowledge.updateSuccessRate(existing.get().pattern(), rate);
            } else {
                var metadata = new LinkedHashMap<String, Object>();
                metadata.put(KnowledgeStore.SUCCESS_RATE, KNOWN_FIX_RATE);
                metadata.put("auto_applied", auto);
                metadata.put("tool", proposal.tool());
                metadata.put("proposal_id", proposal.id());
                knowledge.addErrorSolution(pattern, proposal.summary(), metadata);
            }
        } catch (RuntimeException e) {
            log.warn("Could not record fix success for proposal {}: {}", proposal.id(), e.getMessage());
        }
    }

    private Optional<ErrorSolution> knownSolution(EnhancementProposal proposal) {
        try {
            return knowledge.findErrorSolution(proposal.errorPattern());
        } catch (RuntimeException e) {
            log.warn("Knowledge lookup failed for proposal {}: {}", proposal.id(), e.getMessage());
            return Optional.empty();
        }
    }
}
