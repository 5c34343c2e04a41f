package mcsnap.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One file captured in a file-set artifact. {@code path} is relative to the
 * target's root and always uses forward slashes.
 */
public record ArtifactEntry(
        @JsonProperty("path") String path,
        @JsonProperty("hash") String hash,
        @JsonProperty("size") long size) {
}
