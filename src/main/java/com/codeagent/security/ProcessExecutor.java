package com.codeagent.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/** Runs commands as local subprocesses rooted at the workspace, with a sanitized environment. */
public class ProcessExecutor implements ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessExecutor.class);

    private static final Set<String> PASSTHROUGH_ENV = Set.of(
            "PATH", "HOME", "TERM", "LANG", "LC_ALL", "USER", "SHELL", "TMPDIR",
            "JAVA_HOME", "PYTHONPATH", "VIRTUAL_ENV");
    private static final long DRAIN_JOIN_MS = 5000;
    static final int DEFAULT_MAX_CAPTURED_BYTES = 1024 * 1024;

    private final int maxCapturedBytes;

    public ProcessExecutor() {
        this(DEFAULT_MAX_CAPTURED_BYTES);
    }

    /** @param maxCapturedBytes bytes kept per stream; the rest is read and discarded */
    public ProcessExecutor(int maxCapturedBytes) {
        if (maxCapturedBytes <= 0) throw new IllegalArgumentException("maxCapturedBytes must be positive");
        this.maxCapturedBytes = maxCapturedBytes;
    }

    @Override
    public ExecutionResult execute(List<String> command, Path workDir, Duration timeout) {
        var pb = new ProcessBuilder(command);
        pb.directory(workDir.toFile());
        pb.environment().keySet().retainAll(PASSTHROUGH_ENV);
        Process proc;
        try {
            proc = pb.start();
        } catch (IOException e) {
            throw new RuntimeException("Failed to start process: " + command.get(0), e);
        }
        closeQuietly(proc);

        var stdout = new CappedBuffer(maxCapturedBytes);
        var stderr = new CappedBuffer(maxCapturedBytes);
        var outReader = drain(proc.getInputStream(), stdout);
        var errReader = drain(proc.getErrorStream(), stderr);
        try {
            if (!proc.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                proc.destroyForcibly();
                outReader.join(DRAIN_JOIN_MS);
                errReader.join(DRAIN_JOIN_MS);
                log.warn("Command timed out after {}s in {}", timeout.toSeconds(), workDir);
                return new ExecutionResult(text(stdout), text(stderr), -1, true);
            }
            outReader.join(DRAIN_JOIN_MS);
            errReader.join(DRAIN_JOIN_MS);
            return new ExecutionResult(text(stdout), text(stderr), proc.exitValue(), false);
        } catch (InterruptedException ie) {
            proc.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for process", ie);
        }
    }

    private static Thread drain(InputStream in, CappedBuffer sink) {
        var t = new Thread(() -> {
            try (in) {
                var chunk = new byte[8192];
                int n;
                while ((n = in.read(chunk)) != -1) {
                    sink.write(chunk, n);
                }
            } catch (IOException e) {
                log.debug("Process stream closed early: {}", e.getMessage());
            }
        }, "process-drain");
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static void closeQuietly(Process proc) {
        try {
            proc.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Failed to close process stdin: {}", e.getMessage());
        }
    }

    private static String text(CappedBuffer buf) {
        return buf.text();
    }

    /** Keeps the first {@code limit} bytes of a stream and counts what it drops. */
    static final class CappedBuffer {

        private final ByteArrayOutputStream kept = new ByteArrayOutputStream();
        private final int limit;
        private long discarded;

        CappedBuffer(int limit) {
            this.limit = limit;
        }

        synchronized void write(byte[] chunk, int length) {
            int room = Math.max(0, limit - kept.size());
            int take = Math.min(room, length);
            kept.write(chunk, 0, take);
            discarded += length - take;
        }

        synchronized String text() {
            var out = kept.toString(StandardCharsets.UTF_8);
            return discarded == 0 ? out : out + "\n[output truncated: " + discarded + " bytes discarded]";
        }
    }
}
