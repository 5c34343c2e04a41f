package mcsnap.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import mcsnap.engine.model.Artifact;
import mcsnap.engine.model.ArtifactEntry;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for an artifact. File-set artifacts carry {@code files};
 * versioned-push artifacts carry {@code versionRef}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ArtifactResponse(
        @JsonProperty("id") String id,
        @JsonProperty("kind") String kind,
        @JsonProperty("serverName") String serverName,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("description") String description,
        @JsonProperty("scheduleId") String scheduleId,
        @JsonProperty("fileCount") int fileCount,
        @JsonProperty("totalSize") long totalSize,
        @JsonProperty("versionRef") String versionRef,
        @JsonProperty("files") List<ArtifactEntry> files) {

    /** Create response from domain model */
    public static ArtifactResponse from(Artifact artifact) {
        return new ArtifactResponse(
                artifact.id(),
                ScheduleKinds.wire(artifact.kind()),
                artifact.target().value(),
                artifact.createdAt(),
                artifact.description(),
                artifact.scheduleId(),
                artifact.entries().size(),
                artifact.totalSize(),
                artifact.versionRef(),
                artifact.kind().isFileSet() ? artifact.entries() : null);
    }

    /** Compact version for list responses */
    public ArtifactResponse compact() {
        return new ArtifactResponse(id, kind, serverName, createdAt, description, scheduleId,
                fileCount, totalSize, versionRef, null);
    }
}
