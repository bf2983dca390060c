package com.healloop.core.health;

import com.healloop.core.autofix.AutoFixProperties;
import com.healloop.core.knowledge.KnowledgeStore;
import com.healloop.core.proposal.ProposalRegistry;
import com.healloop.core.proposal.ProposalStatus;
import com.healloop.core.validation.GroundTruthValidatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);
    static final String API_KEY_NOT_SET = "not-set";

    private final ProposalRegistry proposalRegistry;
    private final KnowledgeStore knowledgeStore;
    private final GroundTruthValidatorRegistry validators;
    private final AutoFixProperties autoFixProperties;
    private final String apiKey;

    public HealthCheckService(ProposalRegistry proposalRegistry,
                              KnowledgeStore knowledgeStore,
                              GroundTruthValidatorRegistry validators,
                              AutoFixProperties autoFixProperties,
                              @Value("${spring.ai.openai.api-key:" + API_KEY_NOT_SET + "}") String apiKey) {
        this.proposalRegistry = proposalRegistry;
        this.knowledgeStore = knowledgeStore;
        this.validators = validators;
        this.autoFixProperties = autoFixProperties;
        this.apiKey = apiKey;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkOracle());
        results.add(checkProposalStore());
        results.add(checkKnowledgeStore());
        results.add(checkBackupDir());
        results.add(checkValidators());
        return results;
    }

    // Contracts and patches fall back without an oracle, so a missing key only degrades.
    private HealthStatus checkOracle() {
        if (apiKey == null || apiKey.isBlank() || API_KEY_NOT_SET.equals(apiKey)) {
            return new HealthStatus("oracle", HealthStatus.Status.DEGRADED,
                    "No API key configured; fallback contracts only", Map.of());
        }
        return new HealthStatus("oracle", HealthStatus.Status.UP, "API key configured", Map.of());
    }

    private HealthStatus checkProposalStore() {
        try {
            int pending = proposalRegistry.listEnhancements(ProposalStatus.PENDING).size();
            return new HealthStatus("proposals", HealthStatus.Status.UP,
                    pending + " proposal(s) pending", Map.of("pending", String.valueOf(pending)));
        } catch (Exception e) {
            log.warn("Proposal store health check failed: {}", e.getMessage());
            return new HealthStatus("proposals", HealthStatus.Status.DOWN,
                    "Proposal store error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkKnowledgeStore() {
        try {
            int solutions = knowledgeStore.all().size();
            return new HealthStatus("knowledge", HealthStatus.Status.UP,
                    solutions + " known solution(s)", Map.of("solutions", String.valueOf(solutions)));
        } catch (Exception e) {
            log.warn("Knowledge store health check failed: {}", e.getMessage());
            return new HealthStatus("knowledge", HealthStatus.Status.DOWN,
                    "Knowledge store error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkBackupDir() {
        Path dir = Path.of(autoFixProperties.getBackupDir()).toAbsolutePath();
        Path existing = dir;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing != null && Files.isDirectory(existing) && Files.isWritable(existing)) {
            return new HealthStatus("backups", HealthStatus.Status.UP,
                    "Backup directory writable", Map.of("path", dir.toString()));
        }
        return new HealthStatus("backups", HealthStatus.Status.DOWN,
                "Backup directory not writable", Map.of("path", dir.toString()));
    }

    private HealthStatus checkValidators() {
        var tools = validators.registeredTools();
        return new HealthStatus("validators", HealthStatus.Status.UP,
                tools.size() + " tool validator(s) registered", Map.of("tools", String.join(",", tools)));
    }
}
