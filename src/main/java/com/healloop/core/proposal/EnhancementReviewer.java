package com.healloop.core.proposal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healloop.core.llm.OracleCall;
import com.healloop.core.patch.FileChange;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Asks the oracle to review a proposal for code quality, security risks, side effects
 * and performance before a human applies it.
 */
@Service
public class EnhancementReviewer {

    private static final Set<String> RECOMMENDATIONS = Set.of("approve", "reject", "modify");
    private static final int CHANGES_CHARS = 2000;
    private static final TypeReference<List<FileChange>> FILES_TYPE = new TypeReference<>() {};

    private final ProposalRegistry registry;
    private final OracleCall oracleCall;
    private final ObjectMapper objectMapper;

    public EnhancementReviewer(ProposalRegistry registry, OracleCall oracleCall, ObjectMapper objectMapper) {
        this.registry = registry;
        this.oracleCall = oracleCall;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws ProposalNotFoundException when {@code proposalId} is unknown
     */
    public ProposalReview review(String proposalId) {
        EnhancementProposal proposal = registry.getProposal(proposalId)
                .orElseThrow(() -> new ProposalNotFoundException(proposalId));

        String changes = changes(proposal);
        String prompt = """
                Review this code enhancement. Analyze code quality, security risks, side effects
                and performance.

                Summary: %s
                Reason: %s

                Changes:
                %s

                Return JSON only:
                {
                  "recommendation": "approve|reject|modify",
                  "risk_level": "low|medium|high",
                  "concerns": ["..."],
                  "suggestions": ["..."]
                }
                """.formatted(proposal.summary(), proposal.reason(), changes);

        return oracleCall.askJson("proposal review", prompt,
                json -> interpret(proposalId, json),
                () -> ProposalReview.manual(proposalId, "Automated review unavailable"));
    }

    private String changes(EnhancementProposal proposal) {
        String json;
        try {
            json = objectMapper.writerFor(FILES_TYPE).withDefaultPrettyPrinter().writeValueAsString(proposal.files());
        } catch (JsonProcessingException e) {
            json = String.valueOf(proposal.files());
        }
        return json.length() <= CHANGES_CHARS ? json : json.substring(0, CHANGES_CHARS);
    }

    private static Optional<ProposalReview> interpret(String proposalId, JsonNode json) {
        String recommendation = json.path("recommendation").asText("");
        if (!RECOMMENDATIONS.contains(recommendation)) {
            return Optional.empty();
        }
        return Optional.of(new ProposalReview(proposalId, recommendation,
                json.path("risk_level").asText("unknown"),
                strings(json.path("concerns")),
                strings(json.path("suggestions"))));
    }

    private static List<String> strings(JsonNode node) {
        var values = new ArrayList<String>();
        node.forEach(n -> values.add(n.asText()));
        return values;
    }
}
