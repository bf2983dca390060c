package com.healloop.core.proposal;

import com.healloop.core.patch.FileChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies a list of {@link FileChange}s as one transaction.
 * <p>
 * Every change is first staged in memory against the current file contents: a replace's
 * search text must occur exactly once, and a create must not target an existing file.
 * Files are written only when every change stages cleanly, and a failed write restores
 * the files already written.
 */
public class PatchApplier {

    private static final Logger log = LoggerFactory.getLogger(PatchApplier.class);

    private final Path workspaceRoot;

    public PatchApplier(Path workspaceRoot) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
    }

    public Path workspaceRoot() {
        return workspaceRoot;
    }

    /**
     * Resolves a patch path against the workspace root, rejecting paths that escape it.
     */
    public Path resolve(String path) {
        Path resolved = workspaceRoot.resolve(path).normalize();
        if (!resolved.startsWith(workspaceRoot)) {
            throw new PatchApplicationException("Path escapes workspace: " + path);
        }
        return resolved;
    }

    /** @return the files written, in order */
    public List<Path> apply(List<FileChange> changes) {
        if (changes == null || changes.isEmpty()) {
            throw new PatchApplicationException("Patch contains no file changes");
        }
        Map<Path, String> staged = stage(changes);

        Map<Path, Optional<String>> originals = new LinkedHashMap<>();
        try {
            for (var entry : staged.entrySet()) {
                Path target = entry.getKey();
                originals.put(target, Files.exists(target) ? Optional.of(read(target)) : Optional.empty());
                if (target.getParent() != null) {
                    Files.createDirectories(target.getParent());
                }
                Files.writeString(target, entry.getValue(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            rollback(originals);
            throw new PatchApplicationException("Writing patch failed, changes rolled back: " + e.getMessage(), e);
        }
        log.info("Applied {} change(s) to {} file(s)", changes.size(), staged.size());
        return new ArrayList<>(staged.keySet());
    }

    private Map<Path, String> stage(List<FileChange> changes) {
        Map<Path, String> staged = new LinkedHashMap<>();
        for (FileChange change : changes) {
            Path target = resolve(change.path());
            String current = staged.containsKey(target) ? staged.get(target) : readIfExists(target);
            if (change instanceof FileChange.Replace r) {
                if (current == null) {
                    throw new PatchApplicationException("Cannot replace in missing file: " + r.path());
                }
                int occurrences = occurrences(current, r.search());
                if (occurrences != 1) {
                    throw new PatchApplicationException("Search text must occur exactly once in "
                            + r.path() + " but occurs " + occurrences + " time(s)");
                }
                staged.put(target, current.replace(r.search(), r.replace()));
            } else if (change instanceof FileChange.Create c) {
                if (current != null) {
                    throw new PatchApplicationException("Cannot create existing file: " + c.path());
                }
                staged.put(target, c.content());
            } else if (change instanceof FileChange.Append a) {
                staged.put(target, (current == null ? "" : current) + a.content());
            }
        }
        return staged;
    }

    private void rollback(Map<Path, Optional<String>> originals) {
        for (var entry : originals.entrySet()) {
            try {
                if (entry.getValue().isPresent()) {
                    Files.writeString(entry.getKey(), entry.getValue().get(), StandardCharsets.UTF_8);
                } else {
                    Files.deleteIfExists(entry.getKey());
                }
            } catch (IOException e) {
                log.error("Rollback of {} failed: {}", entry.getKey(), e.getMessage());
            }
        }
    }

    private String readIfExists(Path target) {
        if (!Files.exists(target)) {
            return null;
        }
        try {
            return read(target);
        } catch (IOException e) {
            throw new PatchApplicationException("Cannot read " + target + ": " + e.getMessage(), e);
        }
    }

    private static String read(Path target) throws IOException {
        return Files.readString(target, StandardCharsets.UTF_8);
    }

    static int occurrences(String text, String search) {
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(search, from)) >= 0) {
            count++;
            from += search.length();
        }
        return count;
    }
}
