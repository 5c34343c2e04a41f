package mcsnap.engine.execution;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An argument-vector process invocation. {@code program} is always a fixed
 * literal chosen by the engine; every caller-derived string travels in
 * {@code args} as a discrete element and is never joined into a shell line.
 *
 * @param timeout maximum run time, or null to wait indefinitely
 */
public record ProcessCommand(
        String program,
        List<String> args,
        Path workDir,
        Map<String, String> env,
        Duration timeout) {

    public ProcessCommand {
        Objects.requireNonNull(program, "program is required");
        if (program.isBlank()) {
            throw new IllegalArgumentException("program must not be blank");
        }
        args = List.copyOf(args);
        env = env != null ? Map.copyOf(env) : Map.of();
    }

    public static ProcessCommand of(String program, List<String> args, Path workDir, Duration timeout) {
        return new ProcessCommand(program, args, workDir, Map.of(), timeout);
    }

    public ProcessCommand withEnv(Map<String, String> env) {
        return new ProcessCommand(program, args, workDir, env, timeout);
    }

    /** Full argv: program followed by its arguments */
    public List<String> argv() {
        List<String> argv = new ArrayList<>(args.size() + 1);
        argv.add(program);
        argv.addAll(args);
        return argv;
    }
}
