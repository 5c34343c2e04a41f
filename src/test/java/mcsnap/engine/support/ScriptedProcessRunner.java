package mcsnap.engine.support;

import mcsnap.engine.execution.ProcessCommand;
import mcsnap.engine.execution.ProcessResult;
import mcsnap.engine.execution.ProcessRunner;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * ProcessRunner that records every command and answers from a script keyed
 * by program and first argument (e.g. {@code "git commit"}, {@code "bash"}).
 */
public class ScriptedProcessRunner implements ProcessRunner {

    private final List<ProcessCommand> commands = new ArrayList<>();
    private final Map<String, ProcessResult> responses = new HashMap<>();

    public ScriptedProcessRunner() {
        responses.put("git rev-parse", ProcessResult.ok("abc1234\n"));
    }

    public ScriptedProcessRunner on(String key, ProcessResult result) {
        responses.put(key, result);
        return this;
    }

    @Override
    public synchronized ProcessResult run(ProcessCommand command) {
        commands.add(command);
        String first = command.args().isEmpty() ? "" : command.args().get(0);
        ProcessResult scripted = responses.get(command.program() + " " + first);
        if (scripted == null) {
            scripted = responses.get(command.program());
        }
        return scripted != null ? scripted : ProcessResult.ok("");
    }

    public synchronized List<ProcessCommand> commands() {
        return List.copyOf(commands);
    }

    public synchronized List<List<String>> argvs() {
        return commands.stream().map(ProcessCommand::argv).toList();
    }
}
