package com.projectdesk.tools;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Runs one shell command with a working directory, a timeout and a cap on captured output.
 */
public class ShellRunner {

    public static final long DEFAULT_TIMEOUT_MS = 60_000;
    public static final int DEFAULT_OUTPUT_CAP = 64 * 1024;

    private final long timeoutMs;
    private final int outputCap;

    public ShellRunner() {
        this(DEFAULT_TIMEOUT_MS, DEFAULT_OUTPUT_CAP);
    }

    public ShellRunner(long timeoutMs, int outputCap) {
        this.timeoutMs = timeoutMs;
        this.outputCap = outputCap;
    }

    public record ShellResult(int exitCode, String output, boolean timedOut, boolean truncated) {
    }

    public ShellResult run(String command, Path workDir) throws IOException, InterruptedException {
        ProcessBuilder builder = new ProcessBuilder(shellCommand(command))
            .directory(workDir.toFile())
            .redirectErrorStream(true);
        Process process = builder.start();
        process.getOutputStream().close();

        OutputCollector collector = new OutputCollector(process.getInputStream(), outputCap);
        Thread reader = new Thread(collector, "shell-output");
        reader.setDaemon(true);
        reader.start();

        boolean finished;
        try {
            finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
        if (!finished) {
            process.destroyForcibly();
            process.waitFor(5, TimeUnit.SECONDS);
        }
        reader.join(2000);
        int exit = finished ? process.exitValue() : -1;
        return new ShellResult(exit, collector.text(), !finished, collector.truncated());
    }

    static List<String> shellCommand(String command) {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            return List.of("cmd.exe", "/c", command);
        }
        return List.of("/bin/sh", "-c", command);
    }

    private static final class OutputCollector implements Runnable {
        private final InputStream in;
        private final int cap;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private volatile boolean truncated;

        OutputCollector(InputStream in, int cap) {
            this.in = in;
            this.cap = cap;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[8192];
            try (InputStream stream = in) {
                int n;
                while ((n = stream.read(chunk)) != -1) {
                    synchronized (buffer) {
                        int room = cap - buffer.size();
                        if (room > 0) {
                            buffer.write(chunk, 0, Math.min(room, n));
                        }
                        if (n > room) {
                            // keep draining so the process never blocks on a full pipe
                            truncated = true;
                        }
                    }
                }
            } catch (IOException e) {
                // stream closed by destroyForcibly after a timeout
                truncated = truncated || buffer.size() >= cap;
            }
        }

        String text() {
            synchronized (buffer) {
                return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
            }
        }

        boolean truncated() {
            return truncated;
        }
    }
}
