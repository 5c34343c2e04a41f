package mcsnap.engine.execution;

import mcsnap.engine.model.TargetName;

import java.util.List;

/**
 * Collects the files that make up a file-set artifact for a target.
 */
public interface FileCollector {

    /**
     * Collect trackable files for the target, sorted by path.
     * Returns an empty list if the target directory does not exist.
     */
    List<CollectedFile> collect(TargetName target);
}
