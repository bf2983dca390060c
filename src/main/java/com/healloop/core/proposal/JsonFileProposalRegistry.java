package com.healloop.core.proposal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healloop.core.knowledge.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * {@link ProposalRegistry} kept in a single JSON file so the server and the command line
 * see the same queue. The file is re-read on every call; writes are serialized by a lock
 * and replace the file atomically.
 */
public class JsonFileProposalRegistry implements ProposalRegistry {

    private static final Logger log = LoggerFactory.getLogger(JsonFileProposalRegistry.class);
    private static final TypeReference<List<EnhancementProposal>> LIST_TYPE = new TypeReference<>() {};

    private final Path storeFile;
    private final PatchApplier applier;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonFileProposalRegistry(Path storeFile, PatchApplier applier, ObjectMapper objectMapper) {
        this.storeFile = storeFile;
        this.applier = applier;
        this.objectMapper = objectMapper;
    }

    @Override
    public EnhancementProposal registerProposal(EnhancementProposal proposal) {
        lock.lock();
        try {
            var proposals = load();
            proposals.add(proposal);
            save(proposals);
            log.info("Registered proposal {} for {}: {} (confidence {}, risk {})", proposal.id(),
                    proposal.tool(), proposal.summary(), proposal.confidence(), proposal.riskLevel().wireValue());
            return proposal;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<EnhancementProposal> getProposal(String id) {
        lock.lock();
        try {
            return load().stream().filter(p -> p.id().equals(id)).findFirst();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<EnhancementProposal> listEnhancements(ProposalStatus status) {
        lock.lock();
        try {
            return load().stream()
                    .filter(p -> status == null || p.status() == status)
                    .sorted(Comparator.comparing(EnhancementProposal::createdAt).reversed())
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public EnhancementProposal applyProposal(String id) {
        return update(id, proposal -> {
            requirePending(proposal, "apply");
            List<Path> written = applier.apply(proposal.files());
            log.info("Applied proposal {} ({} file(s))", id, written.size());
            return proposal.withStatus(ProposalStatus.APPLIED, Instant.now());
        });
    }

    @Override
    public EnhancementProposal markAutoApplied(String id) {
        return update(id, proposal -> {
            if (proposal.status() != ProposalStatus.APPLIED && proposal.status() != ProposalStatus.PENDING) {
                throw new PatchApplicationException("Proposal " + id + " is " + proposal.status().wireValue());
            }
            Instant appliedAt = proposal.appliedAt() != null ? proposal.appliedAt() : Instant.now();
            return proposal.withStatus(ProposalStatus.AUTO_APPLIED, appliedAt);
        });
    }

    @Override
    public EnhancementProposal rejectProposal(String id, String reason) {
        return update(id, proposal -> {
            requirePending(proposal, "reject");
            log.info("Rejected proposal {}: {}", id, reason);
            return proposal.withStatus(ProposalStatus.REJECTED, null)
                    .withMetadata("rejection_reason", reason == null ? "" : reason);
        });
    }

    private EnhancementProposal update(String id, UnaryOperator<EnhancementProposal> change) {
        lock.lock();
        try {
            var proposals = load();
            for (int i = 0; i < proposals.size(); i++) {
                if (proposals.get(i).id().equals(id)) {
                    EnhancementProposal updated = change.apply(proposals.get(i));
                    proposals.set(i, updated);
                    save(proposals);
                    return updated;
                }
            }
            throw new ProposalNotFoundException(id);
        } finally {
            lock.unlock();
        }
    }

    private static void requirePending(EnhancementProposal proposal, String action) {
        if (proposal.status() != ProposalStatus.PENDING) {
            throw new PatchApplicationException("Cannot " + action + " proposal " + proposal.id()
                    + ": it is " + proposal.status().wireValue());
        }
    }

    private List<EnhancementProposal> load() {
        if (!Files.exists(storeFile)) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(storeFile.toFile(), LIST_TYPE));
        } catch (IOException e) {
            throw new StoreException("Cannot read proposal store " + storeFile, e);
        }
    }

    private void save(List<EnhancementProposal> proposals) {
        try {
            Path parent = storeFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, "proposals", ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), proposals);
            Files.move(temp, storeFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StoreException("Cannot write proposal store " + storeFile, e);
        }
    }
}
