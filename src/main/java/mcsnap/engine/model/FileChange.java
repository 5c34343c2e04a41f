package mcsnap.engine.model;

/**
 * One changed path in a diff. Hash and content fields are null where the side
 * does not exist (or where a versioned-push diff carries no content).
 */
public record FileChange(
        String path,
        ChangeStatus status,
        String oldHash,
        String newHash,
        String oldContent,
        String newContent) {

    public static FileChange added(String path, String newHash, String newContent) {
        return new FileChange(path, ChangeStatus.ADDED, null, newHash, null, newContent);
    }

    public static FileChange deleted(String path, String oldHash, String oldContent) {
        return new FileChange(path, ChangeStatus.DELETED, oldHash, null, oldContent, null);
    }

    public static FileChange modified(String path, String oldHash, String newHash,
            String oldContent, String newContent) {
        return new FileChange(path, ChangeStatus.MODIFIED, oldHash, newHash, oldContent, newContent);
    }
}
