package com.eyelevel.paperprocessor.common.processexec;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Serial;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

@Component
@Slf4j
public class ProcessExecutor {

    /**
     * A safe limit for the amount of stdout/stderr to capture in memory.
     * 16 KB is enough to capture most error messages without risking OutOfMemoryError.
     */
    private static final int MAX_CAPTURE_BYTES = 16 * 1024;
    private static final long STREAM_DRAIN_SECONDS = 5;

    /**
     * Executes a command-line process with a timeout and memory-safe stream handling.
     *
     * @param command     The command and its arguments to execute.
     * @param workingDir  The working directory of the process.
     * @param contextInfo A string for logging context (e.g., the paper ID).
     * @param timeout     The maximum time to wait for the process to complete.
     * @param processName A descriptive name for the process (e.g., "pdflatex").
     * @return A ProcessResult containing the exit code and a truncated portion of stdout and stderr.
     * @throws ProcessLaunchException  if the executable cannot be started.
     * @throws ProcessTimeoutException if the process does not finish within {@code timeout}; it is killed.
     * @throws IOException             if another I/O error occurs.
     * @throws InterruptedException    if the waiting thread is interrupted; the process is killed.
     */
    public ProcessResult execute(List<String> command, Path workingDir, String contextInfo, Duration timeout,
                                 String processName) throws IOException, InterruptedException {

        Process process;
        try {
            process = new ProcessBuilder(command).directory(workingDir.toFile()).start();
        } catch (IOException e) {
            throw new ProcessLaunchException(processName + " could not be started: " + e.getMessage(), e);
        }
        // Nothing is ever written to the child's stdin; close it so it sees EOF instead of waiting for a terminal.
        process.getOutputStream().close();

        StringBuffer stdoutCapture = new StringBuffer();
        StringBuffer stderrCapture = new StringBuffer();
        ExecutorService executor = Executors.newFixedThreadPool(2, r -> {
            Thread thread = new Thread(r, processName + "-stream");
            thread.setDaemon(true);
            return thread;
        });

        try {
            Future<?> stdout = executor.submit(new StreamConsumer(process.getInputStream(), stdoutCapture::append, null));
            Future<?> stderr = executor.submit(new StreamConsumer(process.getErrorStream(), stderrCapture::append,
                    line -> log.warn("[{}] [{}-stderr] {}", contextInfo, processName, line)));

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                destroy(process);
                throw new ProcessTimeoutException(
                        processName + " process timed out after " + timeout.toSeconds() + " seconds.");
            }
            awaitDrained(stdout, contextInfo);
            awaitDrained(stderr, contextInfo);
        } catch (InterruptedException e) {
            destroy(process);
            throw e;
        } finally {
            executor.shutdownNow();
        }

        return new ProcessResult(process.exitValue(), stdoutCapture.toString().trim(), stderrCapture.toString().trim());
    }

    private void destroy(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            // Wait for the kill to land so callers can safely remove the working directory.
            if (!process.waitFor(STREAM_DRAIN_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Process {} did not exit after being killed.", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void awaitDrained(Future<?> consumer, String contextInfo) throws InterruptedException {
        try {
            consumer.get(STREAM_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[{}] Process output was not fully captured: {}", contextInfo, e.toString());
        }
    }

    /**
     * A Runnable that consumes an InputStream, captures its content up to a limit,
     * and optionally logs each line. This prevents both deadlocks and OutOfMemoryErrors.
     */
    private static class StreamConsumer implements Runnable {
        private final InputStream inputStream;
        private final Consumer<String> captureConsumer;
        private final Consumer<String> lineLogger;
        private int bytesCaptured = 0;

        StreamConsumer(InputStream inputStream, Consumer<String> captureConsumer, Consumer<String> lineLogger) {
            this.inputStream = inputStream;
            this.captureConsumer = captureConsumer;
            this.lineLogger = lineLogger;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (lineLogger != null) {
                        lineLogger.accept(line);
                    }
                    if (bytesCaptured < MAX_CAPTURE_BYTES) {
                        String lineWithNewline = line + "\n";
                        captureConsumer.accept(lineWithNewline);
                        bytesCaptured += lineWithNewline.getBytes(StandardCharsets.UTF_8).length;
                    }
                }
            } catch (IOException e) {
                log.error("Error reading process stream.", e);
            }
        }
    }

    /**
     * A record to hold the result of an external process execution.
     *
     * @param exitCode The exit code of the process. 0 typically means success.
     * @param stdout   The captured standard output (truncated to a safe limit).
     * @param stderr   The captured standard error output (truncated to a safe limit).
     */
    public record ProcessResult(int exitCode, String stdout, String stderr) {
    }

    /**
     * Thrown when the executable cannot be launched at all, typically because it is not installed.
     */
    public static class ProcessLaunchException extends IOException {
        @Serial
        private static final long serialVersionUID = -6024361512993013517L;

        public ProcessLaunchException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Thrown when a process exceeds its timeout. The process has already been killed.
     */
    public static class ProcessTimeoutException extends IOException {
        @Serial
        private static final long serialVersionUID = 3300714580128857296L;

        public ProcessTimeoutException(String message) {
            super(message);
        }
    }
}
