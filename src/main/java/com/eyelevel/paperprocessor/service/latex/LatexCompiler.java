package com.eyelevel.paperprocessor.service.latex;

import com.eyelevel.paperprocessor.common.processexec.ProcessExecutor;
import com.eyelevel.paperprocessor.common.processexec.ProcessExecutor.ProcessLaunchException;
import com.eyelevel.paperprocessor.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.paperprocessor.common.processexec.ProcessExecutor.ProcessTimeoutException;
import com.eyelevel.paperprocessor.config.PaperProcessingConfig;
import com.eyelevel.paperprocessor.exception.CompilationException;
import com.eyelevel.paperprocessor.model.CompilationFailureKind;
import com.eyelevel.paperprocessor.model.CompilationOutcome;
import com.eyelevel.paperprocessor.model.FileSet;
import com.eyelevel.paperprocessor.service.archive.ArchivePathGuard;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typesets a source tree with pdflatex in a throw-away working directory.
 * <p>
 * pdflatex runs twice so cross-references resolve; each pass gets the full timeout. A failed first pass is
 * tolerated, because undefined references are expected there. The working directory is removed on every
 * path, including timeouts and interruption.
 */
@Slf4j
@Service
public class LatexCompiler {

    static final String PROCESS_NAME = "pdflatex";
    private static final String WORK_DIR_PREFIX = "paper-compile-";
    private static final int PASSES = 2;
    private static final int TAIL_LINES = 10;

    private final ProcessExecutor processExecutor;
    private final PaperProcessingConfig.Compilation config;

    public LatexCompiler(ProcessExecutor processExecutor, PaperProcessingConfig config) {
        this.processExecutor = processExecutor;
        this.config = config.getCompilation();
    }

    /**
     * Compiles {@code mainFile} and returns the PDF, or a classified failure.
     *
     * @param files       The complete source tree.
     * @param mainFile    Path of the root document inside {@code files}.
     * @param timeout     Upper bound for each pdflatex pass.
     * @param contextInfo The paper ID, for logging.
     * @return A {@link CompilationOutcome.Success} with the PDF bytes or a {@link CompilationOutcome.Failure}.
     * @throws IllegalArgumentException if {@code mainFile} is not part of {@code files}.
     * @throws InterruptedException     if the thread is interrupted; the running pdflatex is killed first.
     */
    public CompilationOutcome compile(final FileSet files, final String mainFile, final Duration timeout,
                                      final String contextInfo) throws InterruptedException {
        if (!files.paths().contains(mainFile)) {
            throw new IllegalArgumentException("Main file '" + mainFile + "' is not part of the source tree");
        }

        Path workDir = null;
        try {
            workDir = createWorkDir();
            writeFiles(workDir, files);
            final Path mainPath = ArchivePathGuard.resolveInside(workDir, mainFile);
            log.info("[{}] Compiling '{}' in {} (timeout per pass: {}s).", contextInfo, mainFile, workDir,
                    timeout.toSeconds());

            runPasses(workDir, mainPath, timeout, contextInfo);

            final Path pdf = workDir.resolve(FilenameUtils.getBaseName(mainFile) + ".pdf");
            if (!Files.isRegularFile(pdf)) {
                throw new CompilationException(CompilationFailureKind.ARTIFACT_MISSING,
                        "pdflatex finished but produced no " + pdf.getFileName());
            }
            final byte[] bytes = Files.readAllBytes(pdf);
            log.info("[{}] Compilation produced {} ({} bytes).", contextInfo, pdf.getFileName(), bytes.length);
            return CompilationOutcome.success(bytes);
        } catch (CompilationException e) {
            log.warn("[{}] Compilation failed ({}): {}", contextInfo, e.getKind(), e.getMessage());
            return CompilationOutcome.failure(e.getKind(), e.getMessage());
        } catch (IOException e) {
            log.error("[{}] Could not prepare the compilation workspace.", contextInfo, e);
            return CompilationOutcome.failure(CompilationFailureKind.WORKSPACE_ERROR,
                    "Could not prepare the compilation workspace: " + e.getMessage());
        } finally {
            cleanup(workDir, contextInfo);
        }
    }

    private void runPasses(final Path workDir, final Path mainPath, final Duration timeout, final String contextInfo)
            throws InterruptedException {
        final List<String> command = buildCommand(workDir, mainPath);
        final Path processDir = mainPath.getParent();

        for (int pass = 1; pass <= PASSES; pass++) {
            log.debug("[{}] pdflatex pass {}/{}: {}", contextInfo, pass, PASSES, command);
            final ProcessResult result;
            try {
                result = processExecutor.execute(command, processDir, contextInfo, timeout, PROCESS_NAME);
            } catch (ProcessTimeoutException e) {
                throw new CompilationException(CompilationFailureKind.TIMEOUT,
                        "Compilation timed out after " + timeout.toSeconds() + " seconds", e);
            } catch (ProcessLaunchException e) {
                throw new CompilationException(CompilationFailureKind.BINARY_NOT_FOUND,
                        "LaTeX binary '" + config.getBinary() + "' could not be started", e);
            } catch (IOException e) {
                throw new CompilationException(CompilationFailureKind.NON_ZERO_EXIT,
                        "pdflatex run failed: " + e.getMessage(), e);
            }

            if (result.exitCode() != 0) {
                if (pass < PASSES) {
                    log.debug("[{}] pdflatex pass {} exited with {}; continuing.", contextInfo, pass,
                            result.exitCode());
                    continue;
                }
                final String detail = extractLatexError(readLog(workDir, mainPath, result));
                throw new CompilationException(CompilationFailureKind.NON_ZERO_EXIT,
                        "LaTeX compilation failed (exit code: " + result.exitCode() + "): " + detail);
            }
        }
    }

    private List<String> buildCommand(final Path workDir, final Path mainPath) {
        final List<String> command = new ArrayList<>();
        command.add(config.getBinary());
        command.addAll(config.getOptions());
        command.add("-output-directory");
        command.add(workDir.toString());
        command.add(mainPath.toString());
        return command;
    }

    private Path createWorkDir() throws IOException {
        final Path parent = StringUtils.hasText(config.getWorkDir())
                ? Files.createDirectories(Paths.get(config.getWorkDir()))
                : Paths.get(System.getProperty("java.io.tmpdir"));
        if (config.isEnableSandboxing() && supportsPosix()) {
            return Files.createTempDirectory(parent, WORK_DIR_PREFIX,
                    PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwx------")));
        }
        return Files.createTempDirectory(parent, WORK_DIR_PREFIX);
    }

    private static boolean supportsPosix() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    }

    private void writeFiles(final Path workDir, final FileSet files) throws IOException {
        for (Map.Entry<String, byte[]> entry : files.asMap().entrySet()) {
            final Path target = ArchivePathGuard.resolveInside(workDir, entry.getKey());
            Files.createDirectories(target.getParent());
            Files.write(target, entry.getValue());
        }
    }

    /**
     * Prefers the pdflatex log file, since captured stdout is truncated from the start.
     */
    private String readLog(final Path workDir, final Path mainPath, final ProcessResult result) {
        final Path logFile = workDir.resolve(FilenameUtils.getBaseName(mainPath.toString()) + ".log");
        if (Files.isRegularFile(logFile)) {
            try {
                return new String(Files.readAllBytes(logFile), StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.debug("Could not read {}: {}", logFile, e.getMessage());
            }
        }
        return result.stdout() + "\n" + result.stderr();
    }

    /**
     * Extracts relevant error lines from pdflatex output, falling back to the last lines of output.
     */
    static String extractLatexError(final String output) {
        final StringBuilder errors = new StringBuilder();
        final String[] lines = output.split("\\R");
        for (String line : lines) {
            if (line.startsWith("!") || line.contains("Error") || line.contains("error")) {
                errors.append(line.trim()).append("; ");
            }
        }
        if (errors.isEmpty()) {
            final int start = Math.max(0, lines.length - TAIL_LINES);
            for (int i = start; i < lines.length; i++) {
                errors.append(lines[i].trim()).append("\n");
            }
        }
        return errors.toString().trim();
    }

    private void cleanup(final Path workDir, final String contextInfo) {
        if (workDir == null) {
            return;
        }
        try {
            FileUtils.deleteDirectory(workDir.toFile());
            log.debug("[{}] Removed compilation directory {}.", contextInfo, workDir);
        } catch (IOException e) {
            log.error("[{}] Failed to remove compilation directory {}.", contextInfo, workDir, e);
        }
    }
}
