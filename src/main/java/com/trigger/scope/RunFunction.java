package com.trigger.scope;

import com.trigger.exception.ArgumentException;
import com.trigger.lisp.Callable;
import com.trigger.value.StringValue;
import com.trigger.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code (run "program" "arg"...)}: starts an external command and waits for it to exit.
 * <p>
 * A command that cannot be started, or exits with a non-zero status, is logged and
 * otherwise ignored so it never aborts the calling rule. Always returns {@code nil}.
 */
class RunFunction implements Callable {

    private static final Logger log = LoggerFactory.getLogger(RunFunction.class);

    @Override
    public Value call(List<Value> args) {
        if (args.isEmpty()) {
            throw new ArgumentException("run takes at least one argument");
        }

        List<String> command = new ArrayList<>(args.size());
        for (Value arg : args) {
            if (!(arg instanceof StringValue s)) {
                throw new ArgumentException("run only takes string arguments, got " + arg);
            }
            command.add(s.value());
        }

        execute(command);
        return Value.nil();
    }

    void execute(List<String> command) {
        ProcessBuilder builder = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        try {
            Process process = builder.start();
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.warn("Command {} exited with status {}", command, exitCode);
            } else {
                log.debug("Command {} completed", command);
            }
        } catch (IOException e) {
            log.warn("Failed to start command {}: {}", command, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for command {}", command);
        }
    }
}
