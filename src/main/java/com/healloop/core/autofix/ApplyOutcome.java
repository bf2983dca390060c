package com.healloop.core.autofix;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Result of {@link AutoFixGate#applyFix}.
 *
 * @param success          false only when an approved apply failed
 * @param applied          true when the patch was written
 * @param queuedForReview  true when the gate declined and left the proposal pending
 * @param proposalId       proposal concerned
 * @param backupPath       backup directory, when a backup was taken
 * @param backedUpFiles    files copied into the backup directory
 * @param error            failure description, when the apply failed
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApplyOutcome(
    boolean success,
    boolean applied,
    boolean queuedForReview,
    String proposalId,
    String backupPath,
    List<String> backedUpFiles,
    String error
) {
    public static ApplyOutcome queued(String proposalId) {
        return new ApplyOutcome(true, false, true, proposalId, null, List.of(), null);
    }

    public static ApplyOutcome applied(String proposalId, Backup backup) {
        return new ApplyOutcome(true, true, false, proposalId, backup.path(), backup.files(), null);
    }

    public static ApplyOutcome failed(String proposalId, Backup backup, String error) {
        return new ApplyOutcome(false, false, false, proposalId,
                backup == null ? null : backup.path(),
                backup == null ? List.of() : backup.files(), error);
    }

    /** Where the pre-apply copies of the patched files were written. */
    public record Backup(String path, List<String> files) {}
}
