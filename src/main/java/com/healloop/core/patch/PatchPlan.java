package com.healloop.core.patch;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A proposed code change: what it does, why, which files it touches and how to verify it.
 */
public record PatchPlan(
    String summary,
    String reason,
    List<FileChange> files,
    @JsonProperty("test_plan") String testPlan
) {
    public PatchPlan {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public List<String> paths() {
        return files.stream().map(FileChange::path).toList();
    }
}
