package mcsnap.engine.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, timestamped capture of a target. A file-set artifact carries
 * entries; a versioned-push artifact carries the commit reference it produced.
 */
public final class Artifact {
    private final String id;
    private final ActionKind kind;
    private final TargetName target;
    private final Instant createdAt;
    private final String scheduleId;
    private final String description;
    private final List<ArtifactEntry> entries;
    private final String versionRef;

    private Artifact(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.target = Objects.requireNonNull(builder.target, "target is required");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt is required");
        this.scheduleId = builder.scheduleId;
        this.description = builder.description != null ? builder.description : "";
        this.entries = builder.entries != null ? List.copyOf(builder.entries) : List.of();
        this.versionRef = builder.versionRef;
        if (kind == ActionKind.WORLD_BACKUP && versionRef == null) {
            throw new IllegalArgumentException("versionRef is required for " + kind);
        }
    }

    public String id() {
        return id;
    }

    public ActionKind kind() {
        return kind;
    }

    public TargetName target() {
        return target;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /** Owning schedule, or null for a manual capture */
    public String scheduleId() {
        return scheduleId;
    }

    public String description() {
        return description;
    }

    public List<ArtifactEntry> entries() {
        return entries;
    }

    public String versionRef() {
        return versionRef;
    }

    public long totalSize() {
        long total = 0;
        for (ArtifactEntry entry : entries) {
            total += entry.size();
        }
        return total;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private ActionKind kind = ActionKind.CONFIG_SNAPSHOT;
        private TargetName target;
        private Instant createdAt;
        private String scheduleId;
        private String description;
        private List<ArtifactEntry> entries;
        private String versionRef;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(ActionKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder target(TargetName target) {
            this.target = target;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder scheduleId(String scheduleId) {
            this.scheduleId = scheduleId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder entries(List<ArtifactEntry> entries) {
            this.entries = entries;
            return this;
        }

        public Builder versionRef(String versionRef) {
            this.versionRef = versionRef;
            return this;
        }

        public Artifact build() {
            return new Artifact(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Artifact artifact))
            return false;
        return Objects.equals(id, artifact.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Artifact{id='" + id + "', kind=" + kind + ", target=" + target + ", createdAt=" + createdAt
                + (versionRef != null ? ", ref=" + versionRef : ", entries=" + entries.size()) + "}";
    }
}
