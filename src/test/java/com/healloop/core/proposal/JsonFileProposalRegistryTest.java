package com.healloop.core.proposal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.healloop.core.patch.FileChange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileProposalRegistryTest {

    @TempDir
    Path workspace;

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private Path storeFile;
    private JsonFileProposalRegistry registry;

    @BeforeEach
    void setUp() {
        storeFile = workspace.resolve("data/proposals.json");
        registry = new JsonFileProposalRegistry(storeFile, new PatchApplier(workspace), mapper);
    }

    @Test
    @DisplayName("Registered proposals survive a new registry instance")
    void persisted() {
        var proposal = registry.registerProposal(ProposalFixtures.pending(
                new FileChange.Replace("A.java", "fix", "import a;", "import b;")));

        var reopened = new JsonFileProposalRegistry(storeFile, new PatchApplier(workspace), mapper);
        var loaded = reopened.getProposal(proposal.id()).orElseThrow();

        assertEquals(proposal.summary(), loaded.summary());
        assertEquals(ProposalStatus.PENDING, loaded.status());
        assertInstanceOf(FileChange.Replace.class, loaded.files().get(0));
        assertEquals("missing import", loaded.analysis().get("root_cause"));
    }

    @Test
    @DisplayName("listEnhancements filters by status and sorts newest first")
    void list() {
        var older = ProposalFixtures.pending(new FileChange.Create("a.txt", "", "a"));
        var newer = ProposalFixtures.pending(new FileChange.Create("b.txt", "", "b"));
        registry.registerProposal(older.withStatus(ProposalStatus.PENDING, null));
        registry.registerProposal(new EnhancementProposal(newer.id(), newer.trigger(), newer.userRequest(),
                newer.tool(), newer.error(), newer.analysis(), newer.summary(), newer.reason(), newer.files(),
                newer.testPlan(), newer.metadata(), newer.confidence(), newer.riskLevel(), newer.status(),
                older.createdAt().plusSeconds(60), null));
        registry.rejectProposal(older.id(), "not needed");

        var all = registry.listEnhancements(null);
        assertEquals(newer.id(), all.get(0).id());
        assertEquals(1, registry.listEnhancements(ProposalStatus.PENDING).size());
        assertEquals(older.id(), registry.listEnhancements(ProposalStatus.REJECTED).get(0).id());
    }

    @Nested
    @DisplayName("applyProposal")
    class Apply {

        @Test
        @DisplayName("Writes the patch and marks the proposal applied")
        void applies() throws Exception {
            Files.writeString(workspace.resolve("A.java"), "import a;\nclass A {}\n");
            var proposal = registry.registerProposal(ProposalFixtures.pending(
                    new FileChange.Replace("A.java", "", "import a;", "import b;")));

            var applied = registry.applyProposal(proposal.id());

            assertEquals(ProposalStatus.APPLIED, applied.status());
            assertNotNull(applied.appliedAt());
            assertEquals("import b;\nclass A {}\n", Files.readString(workspace.resolve("A.java")));
        }

        @Test
        @DisplayName("A failing patch throws and leaves the proposal pending")
        void failureLeavesPending() {
            var proposal = registry.registerProposal(ProposalFixtures.pending(
                    new FileChange.Replace("Missing.java", "", "x", "y")));

            assertThrows(PatchApplicationException.class, () -> registry.applyProposal(proposal.id()));
            assertEquals(ProposalStatus.PENDING, registry.getProposal(proposal.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("Only pending proposals can be applied")
        void onlyPending() {
            var proposal = registry.registerProposal(ProposalFixtures.pending(new FileChange.Create("n.txt", "", "")));
            registry.rejectProposal(proposal.id(), "no");
            assertThrows(PatchApplicationException.class, () -> registry.applyProposal(proposal.id()));
        }

        @Test
        @DisplayName("Unknown ids throw ProposalNotFoundException")
        void unknown() {
            var ex = assertThrows(ProposalNotFoundException.class, () -> registry.applyProposal("nope"));
            assertEquals("Proposal not found: nope", ex.getMessage());
        }
    }

    @Test
    @DisplayName("markAutoApplied keeps the applied timestamp")
    void markAutoApplied() throws Exception {
        Files.writeString(workspace.resolve("A.java"), "import a;");
        var proposal = registry.registerProposal(ProposalFixtures.pending(
                new FileChange.Replace("A.java", "", "import a;", "import b;")));
        Instant appliedAt = registry.applyProposal(proposal.id()).appliedAt();

        var marked = registry.markAutoApplied(proposal.id());

        assertEquals(ProposalStatus.AUTO_APPLIED, marked.status());
        assertEquals(appliedAt, marked.appliedAt());
    }

    @Test
    @DisplayName("rejectProposal records the reason")
    void reject() {
        var proposal = registry.registerProposal(ProposalFixtures.pending(new FileChange.Create("n.txt", "", "")));
        var rejected = registry.rejectProposal(proposal.id(), "touches the wrong module");
        assertEquals(ProposalStatus.REJECTED, rejected.status());
        assertEquals("touches the wrong module", rejected.metadata().get("rejection_reason"));
    }
}
