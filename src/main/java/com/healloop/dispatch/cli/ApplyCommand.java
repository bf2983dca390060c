package com.healloop.dispatch.cli;

import com.healloop.core.autofix.AutoFixGate;
import com.healloop.core.proposal.EnhancementProposal;
import com.healloop.core.proposal.ProposalRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Optional;

/**
 * CLI command: healloop apply &lt;proposal-id&gt; [--no-force]
 * <p>
 * Applies a proposal through the auto-fix gate. A human apply is forced by default;
 * with {@code --no-force} the gate's confidence/risk policy decides.
 */
@Command(name = "apply", mixinStandardHelpOptions = true, description = "Apply a pending proposal (with backup)")
@Component
public class ApplyCommand implements Runnable {

    @Parameters(index = "0", description = "Proposal ID")
    private String proposalId;

    @Option(names = "--force", negatable = true, defaultValue = "true",
            description = "Bypass the auto-fix policy (default: ${DEFAULT-VALUE})")
    private boolean force;

    private final ProposalRegistry registry;
    private final AutoFixGate autoFixGate;

    public ApplyCommand(ProposalRegistry registry, AutoFixGate autoFixGate) {
        this.registry = registry;
        this.autoFixGate = autoFixGate;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        Optional<EnhancementProposal> proposal = registry.getProposal(proposalId);
        if (proposal.isEmpty()) {
            ConsoleOutput.error("Proposal not found: " + proposalId);
            return;
        }
        ConsoleOutput.info("Applying " + proposalId + ": " + proposal.get().summary());
        proposal.get().files().forEach(ConsoleOutput::fileChange);
        ConsoleOutput.applyOutcome(autoFixGate.applyFix(proposal.get(), force));
    }
}
