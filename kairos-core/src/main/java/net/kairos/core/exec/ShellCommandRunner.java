package net.kairos.core.exec;

import net.kairos.core.model.ExecutionKind;
import net.kairos.core.model.Job;
import net.kairos.core.support.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the command through the platform shell with stderr folded into stdout.
 * The process tree is killed once the deadline passes.
 */
public final class ShellCommandRunner implements CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(ShellCommandRunner.class);
    private static final long DRAIN_MILLIS = 1_000;

    private final ExecutorService readers = Executors.newCachedThreadPool(new NamedThreadFactory("kairos-shell-out"));

    @Override
    public ExecutionKind kind() {
        return ExecutionKind.SHELL;
    }

    @Override
    public String run(Job job, Deadline deadline) throws ExecutionFailureException {
        ProcessBuilder pb = new ProcessBuilder(shellCommand(job.command()));
        pb.redirectErrorStream(true);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ExecutionFailureException("failed to start command: " + e.getMessage(), null, e);
        }

        StringBuffer captured = new StringBuffer();
        Future<?> output = readers.submit(() -> {
            readInto(process, captured);
            return null;
        });
        try {
            long waitNanos = deadline.remaining().toNanos();
            if (!process.waitFor(waitNanos, TimeUnit.NANOSECONDS)) {
                kill(process);
                throw new ExecutionTimeoutException(deadline.timeout(), drain(output, captured));
            }
        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
            throw new ExecutionTimeoutException(deadline.timeout(), drain(output, captured));
        }

        String out = drain(output, captured);
        int exit = process.exitValue();
        if (exit != 0) {
            throw new ExecutionFailureException("command exited with code " + exit, out);
        }
        return out;
    }

    static String[] shellCommand(String command) {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) return new String[]{"cmd.exe", "/c", command};
        return new String[]{"/bin/sh", "-c", command};
    }

    private static void readInto(Process process, StringBuffer sink) throws IOException {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            char[] buf = new char[4096];
            int n;
            while ((n = reader.read(buf)) != -1) {
                sink.append(buf, 0, n);
            }
        }
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    /**
     * Waits briefly for the reader to reach end of stream. A background child that keeps the pipe
     * open only costs the wait; whatever was read by then is the output.
     */
    private static String drain(Future<?> output, StringBuffer captured) {
        try {
            output.get(DRAIN_MILLIS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            output.cancel(true);
        } catch (ExecutionException e) {
            log.debug("reading command output failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return captured.toString();
    }
}
