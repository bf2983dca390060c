package com.healloop.dispatch.cli;

import com.healloop.core.proposal.ProposalRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: healloop show &lt;proposal-id&gt;
 */
@Command(name = "show", mixinStandardHelpOptions = true, description = "Show one proposal with its file changes")
@Component
public class ShowCommand implements Runnable {

    @Parameters(index = "0", description = "Proposal ID")
    private String proposalId;

    private final ProposalRegistry registry;

    public ShowCommand(ProposalRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        registry.getProposal(proposalId).ifPresentOrElse(
                ConsoleOutput::proposal,
                () -> ConsoleOutput.error("Proposal not found: " + proposalId));
    }
}
