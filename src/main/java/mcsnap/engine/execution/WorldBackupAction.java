package mcsnap.engine.execution;

import mcsnap.engine.config.EngineConfig;
import mcsnap.engine.error.ActionFailedException;
import mcsnap.engine.error.PreconditionFailedException;
import mcsnap.engine.error.ValidationException;
import mcsnap.engine.model.ActionKind;
import mcsnap.engine.model.Artifact;
import mcsnap.engine.model.TargetName;
import mcsnap.engine.repository.ArtifactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Versioned-push action: pushes world data through the platform backup script,
 * or through plain git in the backup repository when the script is absent.
 * The resulting commit reference identifies the artifact.
 */
public class WorldBackupAction {

    private static final Logger log = LoggerFactory.getLogger(WorldBackupAction.class);

    private static final Pattern REF_PATTERN = Pattern.compile("^[0-9a-fA-F]{4,40}$");

    static final String ROOT_ENV = "MCSNAP_ROOT";
    /** Name existing backup.sh scripts read the platform root from. */
    static final String LEGACY_ROOT_ENV = "MCCTL_ROOT";

    private final Path platformDir;
    private final Path worldsDir;
    private final Path backupScript;
    private final Path backupRepoDir;
    private final Duration timeout;
    private final ProcessRunner runner;
    private final ArtifactRepository artifacts;

    public WorldBackupAction(EngineConfig config, ProcessRunner runner, ArtifactRepository artifacts) {
        this.platformDir = config.platformDir();
        this.worldsDir = config.worldsDir();
        this.backupScript = config.backupScript();
        this.backupRepoDir = config.backupRepoDir();
        this.timeout = config.actionTimeout();
        this.runner = runner;
        this.artifacts = artifacts;
    }

    public void checkPreconditions() {
        if (!Files.isDirectory(worldsDir)) {
            throw new PreconditionFailedException("Worlds directory not found");
        }
    }

    /**
     * Push the current world state.
     *
     * @param message commit message, passed as a single argument
     */
    public ActionResult push(TargetName target, String message, String scheduleId) {
        checkPreconditions();

        List<ProcessCommand> steps;
        if (Files.isRegularFile(backupScript)) {
            steps = List.of(scriptCommand(List.of(backupScript.toString(), "push", "--message", message)));
        } else {
            steps = List.of(
                    git(List.of("add", "-A")),
                    git(List.of("commit", "-m", message)),
                    git(List.of("push")));
        }

        for (ProcessCommand step : steps) {
            ProcessResult result = runner.run(step);
            switch (OutcomeClassifier.classify(result)) {
                case SUCCESS:
                    break;
                case NO_CHANGES:
                    log.info("Nothing to push for {}", target);
                    return ActionResult.noChanges();
                default:
                    throw new ActionFailedException(result.diagnostic());
            }
        }

        String ref = readHead();
        if (ref == null) {
            log.warn("Backup pushed for {} but the commit reference could not be read", target);
            return ActionResult.withoutArtifact("Backup complete");
        }

        Artifact artifact = Artifact.builder()
                .id(artifacts.generateId())
                .kind(ActionKind.WORLD_BACKUP)
                .target(target)
                .createdAt(Instant.now())
                .scheduleId(scheduleId)
                .description(message)
                .versionRef(ref)
                .build();
        artifacts.save(artifact);

        log.info("World backup {} recorded for {} at {}", artifact.id(), target, ref);
        return ActionResult.created(artifact, "Backup complete (" + ref + ")");
    }

    /**
     * Restore world data to the given artifact's commit.
     */
    public void restore(Artifact artifact) {
        String ref = requireValidRef(artifact.versionRef());
        ProcessCommand command = Files.isRegularFile(backupScript)
                ? scriptCommand(List.of(backupScript.toString(), "restore", ref))
                : git(List.of("checkout", ref, "--", "."));

        ProcessResult result = runner.run(command);
        if (!result.succeeded()) {
            throw new ActionFailedException("Restore of " + ref + " failed: " + result.diagnostic());
        }
        log.info("Restored world backup {} ({})", artifact.id(), ref);
    }

    /**
     * Validate a commit reference before it is used as a git argument.
     *
     * @throws ValidationException if the value is not an abbreviated or full hex hash
     */
    public static String requireValidRef(String ref) {
        if (ref == null || !REF_PATTERN.matcher(ref).matches()) {
            throw new ValidationException("Invalid commit reference: " + ref);
        }
        return ref;
    }

    private String readHead() {
        try {
            ProcessResult result = runner.run(ProcessCommand.of("git", List.of("rev-parse", "--short", "HEAD"),
                    backupRepoDir, timeout));
            if (!result.succeeded()) {
                log.warn("git rev-parse failed: {}", result.diagnostic());
                return null;
            }
            String ref = result.stdout().trim();
            return REF_PATTERN.matcher(ref).matches() ? ref : null;
        } catch (ActionFailedException e) {
            log.warn("git rev-parse could not run: {}", e.getMessage());
            return null;
        }
    }

    private ProcessCommand scriptCommand(List<String> args) {
        String root = platformDir.toAbsolutePath().toString();
        return ProcessCommand.of("bash", args, platformDir, timeout)
                .withEnv(Map.of(ROOT_ENV, root, LEGACY_ROOT_ENV, root));
    }

    private ProcessCommand git(List<String> args) {
        return ProcessCommand.of("git", args, backupRepoDir, timeout);
    }
}
