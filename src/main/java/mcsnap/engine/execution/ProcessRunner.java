package mcsnap.engine.execution;

/**
 * Runs external programs. Only argument-vector invocations exist: there is
 * deliberately no method that accepts a command line string.
 */
public interface ProcessRunner {

    /**
     * Run the command to completion (or until its timeout) and capture its output.
     *
     * @throws mcsnap.engine.error.ActionFailedException if the process cannot be started
     */
    ProcessResult run(ProcessCommand command);
}
