package mcsnap.engine.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import mcsnap.engine.api.dto.ArtifactResponse;

/**
 * Outcome of a restore.
 *
 * @param safetyArtifact artifact captured just before the restore, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RestoreResult(
        @JsonProperty("restored") ArtifactResponse restored,
        @JsonProperty("filesRestored") int filesRestored,
        @JsonProperty("safetySnapshot") ArtifactResponse safetyArtifact) {
}
