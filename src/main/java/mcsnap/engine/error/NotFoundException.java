package mcsnap.engine.error;

/**
 * Unknown schedule or artifact id, or an artifact that belongs to a different
 * target than the one requested.
 */
public class NotFoundException extends EngineException {

    private final String resourceType;
    private final String resourceId;

    public NotFoundException(String resourceType, String resourceId) {
        super(resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static NotFoundException schedule(String id) {
        return new NotFoundException("Schedule", id);
    }

    public static NotFoundException artifact(String id) {
        return new NotFoundException("Artifact", id);
    }

    public String resourceType() {
        return resourceType;
    }

    public String resourceId() {
        return resourceId;
    }
}
