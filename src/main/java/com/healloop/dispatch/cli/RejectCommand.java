package com.healloop.dispatch.cli;

import com.healloop.core.proposal.PatchApplicationException;
import com.healloop.core.proposal.ProposalNotFoundException;
import com.healloop.core.proposal.ProposalRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: healloop reject &lt;proposal-id&gt; --reason "..."
 */
@Command(name = "reject", mixinStandardHelpOptions = true, description = "Reject a pending proposal")
@Component
public class RejectCommand implements Runnable {

    @Parameters(index = "0", description = "Proposal ID")
    private String proposalId;

    @Option(names = {"--reason", "-r"}, description = "Why the proposal is rejected")
    private String reason;

    private final ProposalRegistry registry;

    public RejectCommand(ProposalRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            registry.rejectProposal(proposalId, reason);
            ConsoleOutput.success("Rejected proposal " + proposalId
                    + (reason == null || reason.isBlank() ? "" : ": " + reason));
        } catch (ProposalNotFoundException | PatchApplicationException e) {
            ConsoleOutput.error(e.getMessage());
        }
    }
}
