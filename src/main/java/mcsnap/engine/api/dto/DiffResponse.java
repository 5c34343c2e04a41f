package mcsnap.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import mcsnap.engine.model.DiffResult;
import mcsnap.engine.model.FileChange;

import java.util.List;

/**
 * Response DTO for a diff between two artifacts.
 */
public record DiffResponse(
        @JsonProperty("baseSnapshotId") String baseSnapshotId,
        @JsonProperty("compareSnapshotId") String compareSnapshotId,
        @JsonProperty("changes") List<Change> changes,
        @JsonProperty("summary") Summary summary,
        @JsonProperty("hasChanges") boolean hasChanges) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Change(
            @JsonProperty("path") String path,
            @JsonProperty("status") String status,
            @JsonProperty("oldHash") String oldHash,
            @JsonProperty("newHash") String newHash,
            @JsonProperty("oldContent") String oldContent,
            @JsonProperty("newContent") String newContent) {

        static Change from(FileChange change) {
            return new Change(change.path(), change.status().wire(), change.oldHash(), change.newHash(),
                    change.oldContent(), change.newContent());
        }
    }

    public record Summary(
            @JsonProperty("added") int added,
            @JsonProperty("modified") int modified,
            @JsonProperty("deleted") int deleted) {
    }

    /** Create response from domain model */
    public static DiffResponse from(DiffResult diff) {
        return new DiffResponse(
                diff.baseId(),
                diff.compareId(),
                diff.changes().stream().map(Change::from).toList(),
                new Summary(diff.summary().added(), diff.summary().modified(), diff.summary().deleted()),
                diff.hasChanges());
    }
}
