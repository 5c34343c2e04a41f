package mcsnap.engine.execution;

import mcsnap.engine.error.ActionFailedException;
import mcsnap.engine.error.ValidationException;
import mcsnap.engine.model.ChangeStatus;
import mcsnap.engine.model.FileChange;
import mcsnap.engine.support.ScriptedProcessRunner;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GitVersionDifferTest {

    @Test
    void parsesNameStatusOutput() {
        List<FileChange> changes = GitVersionDiffer.parse(
                "M\tsurvival/level.dat\nA\tcreative/region/r.0.0.mca\nD\told/session.lock\n"
                        + "R100\tlobby/a.dat\tlobby/b.dat\n");

        assertEquals(List.of("creative/region/r.0.0.mca", "lobby/a.dat", "lobby/b.dat", "old/session.lock",
                "survival/level.dat"), changes.stream().map(FileChange::path).toList());
        assertEquals(ChangeStatus.ADDED, changes.get(0).status());
        assertEquals(ChangeStatus.DELETED, changes.get(1).status());
        assertEquals(ChangeStatus.ADDED, changes.get(2).status());
        assertEquals(ChangeStatus.MODIFIED, changes.get(4).status());
    }

    @Test
    void runsGitDiffInBackupRepository() {
        ScriptedProcessRunner runner = new ScriptedProcessRunner()
                .on("git", ProcessResult.ok("A\tnew.dat\n"));
        Path repo = Path.of("/srv/backup");

        List<FileChange> changes = new GitVersionDiffer(repo, Duration.ofMinutes(1), runner).diff("abc1234", "def5678");

        assertEquals(1, changes.size());
        ProcessCommand command = runner.commands().get(0);
        assertEquals(repo, command.workDir());
        assertEquals(List.of("-c", "core.quotepath=off", "diff", "--name-status", "--no-renames",
                "abc1234", "def5678"), command.args());
    }

    @Test
    void rejectsNonHashReferences() {
        GitVersionDiffer differ = new GitVersionDiffer(Path.of("."), Duration.ofMinutes(1),
                new ScriptedProcessRunner());
        assertThrows(ValidationException.class, () -> differ.diff("HEAD~1", "abc1234"));
        assertThrows(ValidationException.class, () -> differ.diff("abc1234", "--output=/tmp/x"));
    }

    @Test
    void gitFailureSurfaces() {
        ScriptedProcessRunner runner = new ScriptedProcessRunner()
                .on("git", ProcessResult.failed(128, "", "fatal: bad object abc1234"));
        GitVersionDiffer differ = new GitVersionDiffer(Path.of("."), Duration.ofMinutes(1), runner);

        ActionFailedException e = assertThrows(ActionFailedException.class, () -> differ.diff("abc1234", "def5678"));
        assertTrue(e.getMessage().contains("bad object"));
    }
}
