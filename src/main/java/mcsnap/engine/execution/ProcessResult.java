package mcsnap.engine.execution;

/**
 * Captured outcome of a finished (or timed-out) process.
 */
public record ProcessResult(int exitCode, String stdout, String stderr, boolean timedOut) {

    public static ProcessResult ok(String stdout) {
        return new ProcessResult(0, stdout, "", false);
    }

    public static ProcessResult failed(int exitCode, String stdout, String stderr) {
        return new ProcessResult(exitCode, stdout, stderr, false);
    }

    public boolean succeeded() {
        return exitCode == 0 && !timedOut;
    }

    /**
     * Best human-readable explanation of a failure: stderr, else stdout, else the exit code.
     */
    public String diagnostic() {
        if (timedOut) {
            return "Timed out" + (hasText(stderr) ? ": " + stderr.trim() : "");
        }
        if (hasText(stderr)) {
            return stderr.trim();
        }
        if (hasText(stdout)) {
            return stdout.trim();
        }
        return "Exit code " + exitCode;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
