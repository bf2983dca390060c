package com.healloop.dispatch.cli;

import com.healloop.core.proposal.EnhancementProposal;
import com.healloop.core.proposal.ProposalRegistry;
import com.healloop.core.proposal.ProposalStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: healloop proposals
 * <p>
 * Lists enhancement proposals, newest first, as a table:
 * ID | Status | Risk | Confidence | Tool | Summary (truncated).
 */
@Command(name = "proposals", mixinStandardHelpOptions = true, description = "List enhancement proposals")
@Component
public class ProposalsCommand implements Runnable {

    @Option(names = {"--status", "-s"}, description = "Filter by status: pending, applied, auto_applied, rejected")
    private String status;

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "20")
    private int limit;

    private final ProposalRegistry registry;

    public ProposalsCommand(ProposalRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (limit < 1) {
            ConsoleOutput.error("--limit must be at least 1, got " + limit);
            return;
        }

        ProposalStatus filter;
        try {
            filter = status == null ? null : ProposalStatus.fromWire(status);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        List<EnhancementProposal> proposals = registry.listEnhancements(filter);
        if (proposals.isEmpty()) {
            ConsoleOutput.info("No proposals found.");
            return;
        }

        List<EnhancementProposal> display = proposals.size() > limit ? proposals.subList(0, limit) : proposals;
        ConsoleOutput.info("Proposals (" + display.size() + " of " + proposals.size() + "):");
        System.out.println();
        System.out.printf("  %-10s %-13s %-7s %-6s %-20s %s%n", "ID", "STATUS", "RISK", "CONF", "TOOL", "SUMMARY");
        System.out.println("  " + "-".repeat(86));
        for (EnhancementProposal p : display) {
            System.out.printf("  %-10s %-13s %-7s %-6.2f %-20s %s%n",
                    p.id(), p.status().wireValue(), p.riskLevel().wireValue(), p.confidence(),
                    truncate(p.tool(), 20), truncate(p.summary(), 30));
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
