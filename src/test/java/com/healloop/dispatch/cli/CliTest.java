package com.healloop.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.healloop.core.autofix.AutoFixGate;
import com.healloop.core.autofix.AutoFixProperties;
import com.healloop.core.health.HealthCheckService;
import com.healloop.core.health.HealthStatus;
import com.healloop.core.knowledge.JsonFileKnowledgeStore;
import com.healloop.core.metrics.HealloopMetrics;
import com.healloop.core.patch.FileChange;
import com.healloop.core.proposal.EnhancementProposal;
import com.healloop.core.proposal.JsonFileProposalRegistry;
import com.healloop.core.proposal.PatchApplier;
import com.healloop.core.proposal.ProposalFixtures;
import com.healloop.core.proposal.ProposalStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the Healloop CLI command structure.
 * Commands run through picocli directly, without a Spring context, against a
 * file-backed registry in a temporary workspace.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path workspace;

    private JsonFileProposalRegistry registry;
    private AutoFixGate autoFixGate;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() throws Exception {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
        PatchApplier applier = new PatchApplier(workspace);
        registry = new JsonFileProposalRegistry(workspace.resolve("data/proposals.json"), applier, mapper);
        var properties = new AutoFixProperties();
        properties.setBackupDir(workspace.resolve("backups").toString());
        autoFixGate = new AutoFixGate(properties, registry,
                new JsonFileKnowledgeStore(workspace.resolve("data/knowledge.json"), mapper),
                applier, new HealloopMetrics(new SimpleMeterRegistry()));
        healthCheckService = mock(HealthCheckService.class);

        Files.createDirectories(workspace.resolve("src"));
        Files.writeString(workspace.resolve("src/Export.java"), "import a.Csv;\nclass Export {}\n");
    }

    private EnhancementProposal registerPending() {
        return registry.registerProposal(ProposalFixtures.pending(
                new FileChange.Replace("src/Export.java", "swap import", "import a.Csv;", "import b.Csv;")));
    }

    /**
     * Custom picocli IFactory that wires commands to the test workspace.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ProposalsCommand.class) {
                    return (K) new ProposalsCommand(registry);
                }
                if (cls == ShowCommand.class) {
                    return (K) new ShowCommand(registry);
                }
                if (cls == ApplyCommand.class) {
                    return (K) new ApplyCommand(registry, autoFixGate);
                }
                if (cls == RejectCommand.class) {
                    return (K) new RejectCommand(registry);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new HealloopCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help and version")
    class HelpAndVersion {

        @Test
        @DisplayName("--help lists every subcommand")
        void help() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String sub : List.of("proposals", "show", "apply", "reject", "health", "serve")) {
                assertTrue(result.output().contains(sub), "help should mention " + sub);
            }
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Healloop 0.1.0"));
        }

        @Test
        @DisplayName("apply --help documents the negatable --force option")
        void applyHelp() {
            CliResult result = execute("apply", "--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--[no-]force"));
        }

        @Test
        @DisplayName("show without an id is a usage error")
        void showWithoutId() {
            CliResult result = execute("show");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
        }
    }

    @Nested
    @DisplayName("proposals")
    class Proposals {

        @Test
        @DisplayName("An empty registry prints a notice")
        void empty() {
            CliResult result = execute("proposals");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No proposals found."));
        }

        @Test
        @DisplayName("Registered proposals are listed with status and tool")
        void listed() {
            EnhancementProposal proposal = registerPending();

            CliResult result = execute("proposals");

            assertTrue(result.output().contains(proposal.id()));
            assertTrue(result.output().contains("pending"));
            assertTrue(result.output().contains("aws_export_data"));
        }

        @Test
        @DisplayName("--status filters and --limit caps the table")
        void filteredAndLimited() {
            registerPending();
            registerPending();
            EnhancementProposal rejected = registerPending();
            registry.rejectProposal(rejected.id(), "duplicate");

            assertTrue(execute("proposals", "--status", "pending", "-n", "1").output()
                    .contains("Proposals (1 of 2)"));
            assertTrue(execute("proposals", "-s", "rejected").output().contains(rejected.id()));
        }

        @Test
        @DisplayName("A non-positive --limit is reported, not thrown")
        void negativeLimit() {
            registerPending();

            CliResult result = execute("proposals", "--limit", "-1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--limit must be at least 1"));
            assertFalse(result.output().contains("Proposals ("));
        }

        @Test
        @DisplayName("An unknown status is reported, not thrown")
        void unknownStatus() {
            CliResult result = execute("proposals", "--status", "merged");

            assertEquals(0, result.exitCode());
            assertFalse(result.output().contains("Proposals ("));
        }
    }

    @Nested
    @DisplayName("show")
    class Show {

        @Test
        @DisplayName("show prints summary, file changes and test plan")
        void show() {
            EnhancementProposal proposal = registerPending();

            CliResult result = execute("show", proposal.id());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("PROPOSAL " + proposal.id()));
            assertTrue(result.output().contains("Add missing import"));
            assertTrue(result.output().contains("src/Export.java (swap import)"));
            assertTrue(result.output().contains("Run the export again"));
        }

        @Test
        @DisplayName("show with an unknown id reports it")
        void unknown() {
            assertTrue(execute("show", "nope").output().contains("Proposal not found: nope"));
        }
    }

    @Nested
    @DisplayName("apply and reject")
    class ApplyAndReject {

        @Test
        @DisplayName("apply writes the patch, backs up the file and marks the proposal applied")
        void apply() throws Exception {
            EnhancementProposal proposal = registerPending();

            CliResult result = execute("apply", proposal.id());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Applied proposal " + proposal.id()));
            assertTrue(result.output().contains("1 file(s) saved"));
            assertEquals("import b.Csv;\nclass Export {}\n", Files.readString(workspace.resolve("src/Export.java")));
            assertEquals(ProposalStatus.APPLIED, registry.getProposal(proposal.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("apply --no-force leaves a proposal that fails the gate queued")
        void applyWithoutForce() throws Exception {
            EnhancementProposal proposal = registerPending();

            CliResult result = execute("apply", proposal.id(), "--no-force");

            assertTrue(result.output().contains("still queued for review"));
            assertEquals("import a.Csv;\nclass Export {}\n", Files.readString(workspace.resolve("src/Export.java")));
            assertEquals(ProposalStatus.PENDING, registry.getProposal(proposal.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("apply reports a failed patch and the backup location")
        void applyFails() throws Exception {
            EnhancementProposal proposal = registerPending();
            Files.writeString(workspace.resolve("src/Export.java"), "class Export {}\n");

            CliResult result = execute("apply", proposal.id());

            assertTrue(result.output().contains("Apply failed for " + proposal.id()));
            assertTrue(result.output().contains("Backup left at"));
            assertEquals(ProposalStatus.PENDING, registry.getProposal(proposal.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("reject records the reason")
        void reject() {
            EnhancementProposal proposal = registerPending();

            CliResult result = execute("reject", proposal.id(), "--reason", "too broad");

            assertTrue(result.output().contains("Rejected proposal " + proposal.id() + ": too broad"));
            assertEquals(ProposalStatus.REJECTED, registry.getProposal(proposal.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("reject of an already rejected proposal is reported")
        void rejectTwice() {
            EnhancementProposal proposal = registerPending();
            execute("reject", proposal.id());

            CliResult result = execute("reject", proposal.id());

            assertEquals(0, result.exitCode());
            assertFalse(result.output().contains("Rejected proposal"));
        }
    }

    @Nested
    @DisplayName("health")
    class Health {

        @Test
        @DisplayName("All components UP -> operational")
        void allUp() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("oracle", HealthStatus.Status.UP, "API key configured", Map.of())));

            CliResult result = execute("health");

            assertTrue(result.output().contains("oracle: API key configured"));
            assertTrue(result.output().contains("all systems operational"));
        }

        @Test
        @DisplayName("A DEGRADED component is reported in the overall line")
        void degraded() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("oracle", HealthStatus.Status.DEGRADED, "No API key configured", Map.of()),
                    new HealthStatus("proposals", HealthStatus.Status.UP, "0 proposal(s) pending", Map.of())));

            CliResult result = execute("health");

            assertTrue(result.output().contains("one or more components degraded or down"));
        }
    }
}
