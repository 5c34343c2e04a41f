package mcsnap.engine.execution;

import mcsnap.engine.model.ArtifactEntry;
import mcsnap.engine.util.Hashing;

/**
 * A file read from a target directory, ready to be stored in a file-set artifact.
 *
 * @param path relative path with forward slashes
 */
public record CollectedFile(String path, byte[] content) {

    public ArtifactEntry toEntry() {
        return new ArtifactEntry(path, Hashing.sha256Hex(content), content.length);
    }
}
