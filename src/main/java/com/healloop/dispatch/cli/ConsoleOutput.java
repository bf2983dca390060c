package com.healloop.dispatch.cli;

import com.healloop.core.autofix.ApplyOutcome;
import com.healloop.core.patch.FileChange;
import com.healloop.core.proposal.EnhancementProposal;
import com.healloop.core.proposal.ProposalStatus;
import com.healloop.core.scoring.RiskLevel;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for Healloop CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) HEALLOOP v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [HEALLOOP]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void fileChange(FileChange change) {
        String symbol = switch (change.operation()) {
            case CREATE -> "+";
            case APPEND -> ">";
            case REPLACE -> "~";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) " + symbol + "|@ " + change.path()
                        + (change.description() == null ? "" : " (" + change.description() + ")")));
    }

    public static void proposal(EnhancementProposal p) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold PROPOSAL " + p.id() + "|@"));
        System.out.println("Summary:  " + p.summary());
        System.out.println("Reason:   " + p.reason());
        System.out.println("Trigger:  " + p.trigger() + " on " + p.tool());
        System.out.println("Request:  " + p.userRequest());
        if (p.error() != null) {
            System.out.println("Error:    " + p.error());
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "Status:   " + status(p.status()) + "   Risk: " + risk(p.riskLevel())
                        + "   Confidence: " + String.format("%.2f", p.confidence())));
        Object rootCause = p.analysis().get("root_cause");
        if (rootCause != null) {
            System.out.println("Root cause: " + rootCause + " [" + p.analysis().getOrDefault("fix_type", "unknown") + "]");
        }
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Files|@"));
        p.files().forEach(ConsoleOutput::fileChange);
        if (p.testPlan() != null && !p.testPlan().isBlank()) {
            System.out.println();
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Test plan|@"));
            System.out.println("  " + p.testPlan());
        }
    }

    public static void applyOutcome(ApplyOutcome outcome) {
        if (!outcome.success()) {
            error("Apply failed for " + outcome.proposalId() + ": " + outcome.error());
            if (outcome.backupPath() != null) {
                info("Backup left at " + outcome.backupPath());
            }
        } else if (outcome.queuedForReview()) {
            info("Proposal " + outcome.proposalId() + " did not pass the auto-fix gate; still queued for review");
        } else {
            success("Applied proposal " + outcome.proposalId());
            info("Backup at " + outcome.backupPath()
                    + " (" + outcome.backedUpFiles().size() + " file(s) saved)");
        }
    }

    static String status(ProposalStatus status) {
        return switch (status) {
            case PENDING -> "@|fg(yellow) pending|@";
            case APPLIED, AUTO_APPLIED -> "@|fg(green) " + status.wireValue() + "|@";
            case REJECTED -> "@|fg(red) rejected|@";
        };
    }

    static String risk(RiskLevel risk) {
        return switch (risk) {
            case LOW -> "@|fg(green) low|@";
            case MEDIUM -> "@|fg(yellow) medium|@";
            case HIGH -> "@|fg(red) high|@";
        };
    }
}
