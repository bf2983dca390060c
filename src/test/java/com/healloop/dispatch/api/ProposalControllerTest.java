package com.healloop.dispatch.api;

import com.healloop.core.autofix.ApplyOutcome;
import com.healloop.core.autofix.AutoFixGate;
import com.healloop.core.knowledge.StoreException;
import com.healloop.core.patch.FileChange;
import com.healloop.core.proposal.EnhancementProposal;
import com.healloop.core.proposal.EnhancementReviewer;
import com.healloop.core.proposal.PatchApplicationException;
import com.healloop.core.proposal.ProposalFixtures;
import com.healloop.core.proposal.ProposalNotFoundException;
import com.healloop.core.proposal.ProposalRegistry;
import com.healloop.core.proposal.ProposalReview;
import com.healloop.core.proposal.ProposalStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ProposalController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ProposalControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProposalRegistry registry;

    @MockitoBean
    private AutoFixGate autoFixGate;

    @MockitoBean
    private EnhancementReviewer reviewer;

    private EnhancementProposal stored() {
        EnhancementProposal proposal = ProposalFixtures.pending(
                new FileChange.Replace("src/Export.java", "fix import", "import a.Csv;", "import b.Csv;"));
        when(registry.getProposal(proposal.id())).thenReturn(Optional.of(proposal));
        return proposal;
    }

    // ── GET /api/v1/proposals ────────────────────────────────────────

    @Test
    @DisplayName("GET /proposals lists proposals in snake_case")
    void listProposals() throws Exception {
        EnhancementProposal proposal = stored();
        when(registry.listEnhancements(null)).thenReturn(List.of(proposal));

        mockMvc.perform(get("/api/v1/proposals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value(proposal.id()))
                .andExpect(jsonPath("$[0].status").value("pending"))
                .andExpect(jsonPath("$[0].risk_level").value("medium"))
                .andExpect(jsonPath("$[0].files[0].operation").value("replace"));
    }

    @Test
    @DisplayName("GET /proposals?status=pending filters by status")
    void listByStatus() throws Exception {
        when(registry.listEnhancements(ProposalStatus.PENDING)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/proposals").param("status", "pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));

        verify(registry).listEnhancements(ProposalStatus.PENDING);
    }

    @Test
    @DisplayName("GET /proposals with an unknown status returns 400")
    void listUnknownStatus() throws Exception {
        mockMvc.perform(get("/api/v1/proposals").param("status", "merged"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    @DisplayName("GET /proposals returns 500 when the store is unreadable")
    void storeFailure() throws Exception {
        when(registry.listEnhancements(null)).thenThrow(new StoreException("proposals.json is corrupt", null));

        mockMvc.perform(get("/api/v1/proposals"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("store_error"));
    }

    // ── GET /api/v1/proposals/{id} ───────────────────────────────────

    @Test
    @DisplayName("GET /proposals/{id} returns the proposal")
    void getProposal() throws Exception {
        EnhancementProposal proposal = stored();

        mockMvc.perform(get("/api/v1/proposals/" + proposal.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary").value("Add missing import"))
                .andExpect(jsonPath("$.tool").value("aws_export_data"));
    }

    @Test
    @DisplayName("GET /proposals/{id} returns 404 for an unknown id")
    void getUnknown() throws Exception {
        when(registry.getProposal("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/proposals/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"))
                .andExpect(jsonPath("$.message", containsString("nope")));
    }

    // ── POST /api/v1/proposals/{id}/apply ────────────────────────────

    @Test
    @DisplayName("POST /apply forces the apply by default and returns 200")
    void applyForced() throws Exception {
        EnhancementProposal proposal = stored();
        when(autoFixGate.applyFix(any(), eq(true))).thenReturn(ApplyOutcome.applied(proposal.id(),
                new ApplyOutcome.Backup("backups/fix_x", List.of("backups/fix_x/src/Export.java"))));

        mockMvc.perform(post("/api/v1/proposals/" + proposal.id() + "/apply"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.applied").value(true))
                .andExpect(jsonPath("$.proposal_id").value(proposal.id()))
                .andExpect(jsonPath("$.backup_path").value("backups/fix_x"));
    }

    @Test
    @DisplayName("POST /apply?force=false returns 202 when the gate queues the proposal")
    void applyQueued() throws Exception {
        EnhancementProposal proposal = stored();
        when(autoFixGate.applyFix(any(), eq(false))).thenReturn(ApplyOutcome.queued(proposal.id()));

        mockMvc.perform(post("/api/v1/proposals/" + proposal.id() + "/apply").param("force", "false"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.queued_for_review").value(true));
    }

    @Test
    @DisplayName("POST /apply returns 409 with the backup location when the apply fails")
    void applyFailed() throws Exception {
        EnhancementProposal proposal = stored();
        when(autoFixGate.applyFix(any(), anyBoolean())).thenReturn(ApplyOutcome.failed(proposal.id(),
                new ApplyOutcome.Backup("backups/fix_y", List.of()), "search text not found"));

        mockMvc.perform(post("/api/v1/proposals/" + proposal.id() + "/apply"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("search text not found"))
                .andExpect(jsonPath("$.backup_path").value("backups/fix_y"));
    }

    @Test
    @DisplayName("POST /apply for an unknown id returns 404 without touching the gate")
    void applyUnknown() throws Exception {
        when(registry.getProposal("nope")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/proposals/nope/apply"))
                .andExpect(status().isNotFound());

        verify(autoFixGate, never()).applyFix(any(), anyBoolean());
    }

    // ── POST /api/v1/proposals/{id}/reject ───────────────────────────

    @Test
    @DisplayName("POST /reject passes the reason to the registry")
    void reject() throws Exception {
        EnhancementProposal proposal = stored();
        when(registry.rejectProposal(proposal.id(), "too broad"))
                .thenReturn(proposal.withStatus(ProposalStatus.REJECTED, null));

        mockMvc.perform(post("/api/v1/proposals/" + proposal.id() + "/reject")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"too broad\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("rejected"));
    }

    @Test
    @DisplayName("POST /reject works without a body")
    void rejectWithoutReason() throws Exception {
        EnhancementProposal proposal = stored();
        when(registry.rejectProposal(eq(proposal.id()), isNull()))
                .thenReturn(proposal.withStatus(ProposalStatus.REJECTED, null));

        mockMvc.perform(post("/api/v1/proposals/" + proposal.id() + "/reject"))
                .andExpect(status().isOk());

        verify(registry).rejectProposal(proposal.id(), null);
    }

    @Test
    @DisplayName("POST /reject on a decided proposal returns 409")
    void rejectDecided() throws Exception {
        when(registry.rejectProposal(eq("p-1"), any()))
                .thenThrow(new PatchApplicationException("Proposal p-1 is applied"));

        mockMvc.perform(post("/api/v1/proposals/p-1/reject"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("conflict"));
    }

    // ── POST /api/v1/proposals/{id}/review ───────────────────────────

    @Test
    @DisplayName("POST /review returns the reviewer's opinion")
    void review() throws Exception {
        when(reviewer.review("p-1")).thenReturn(new ProposalReview("p-1", "approve", "low",
                List.of(), List.of("Add a regression test")));

        mockMvc.perform(post("/api/v1/proposals/p-1/review"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recommendation").value("approve"))
                .andExpect(jsonPath("$.risk_level").value("low"))
                .andExpect(jsonPath("$.suggestions[0]").value("Add a regression test"));
    }

    @Test
    @DisplayName("POST /review for an unknown id returns 404")
    void reviewUnknown() throws Exception {
        when(reviewer.review("nope")).thenThrow(new ProposalNotFoundException("nope"));

        mockMvc.perform(post("/api/v1/proposals/nope/review"))
                .andExpect(status().isNotFound());
    }
}
