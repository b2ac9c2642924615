package com.maestro.core.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Detects the project's build system and runs its build and test commands.
 * The pipeline only interprets the pass/fail result.
 */
public class BuildRunner {

    private static final Logger log = LoggerFactory.getLogger(BuildRunner.class);

    private static final int OUTPUT_TAIL_LINES = 40;

    static final Set<String> SOURCE_EXTENSIONS = Set.of(
            "ts", "tsx", "js", "jsx", "cs", "py", "go", "rs", "java",
            "vue", "svelte", "rb", "php", "swift", "kt", "scala");

    static final Set<String> IGNORED_DIRS = Set.of(
            "node_modules", ".git", "dist", "build", ".next", "__pycache__",
            "target", "bin", "obj", ".cache", "coverage", ".turbo", "state", "stages");

    private final int timeoutSeconds;

    public BuildRunner(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * Result of one command.
     *
     * @param name     "build" or "test"
     * @param passed   exit code 0 within the timeout
     * @param summary  last lines of the combined output
     */
    public record CommandResult(String name, boolean passed, String summary) {}

    public Optional<ProjectType> detect(Path projectRoot) {
        return ProjectType.detect(projectRoot);
    }

    /** Build then test; the test step is skipped when the build fails. */
    public List<CommandResult> buildAndTest(Path projectRoot, ProjectType type) {
        var results = new ArrayList<CommandResult>();
        CommandResult build = run("build", type.buildCommand(), projectRoot);
        results.add(build);
        if (build.passed()) {
            results.add(run("test", type.testCommand(), projectRoot));
        }
        return results;
    }

    public CommandResult run(String name, String command, Path workDir) {
        log.info("Running {}: {}", name, command);
        var cmd = new ArrayList<>(Arrays.asList(command.trim().split("\\s+")));
        try {
            var process = new ProcessBuilder(cmd)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();

            var tail = new ArrayList<String>();
            var reader = new Thread(() -> drain(process, tail), "build-output-" + name);
            reader.setDaemon(true);
            reader.start();

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return new CommandResult(name, false, name + " timed out after " + timeoutSeconds + "s");
            }
            reader.join(TimeUnit.SECONDS.toMillis(5));
            int exit = process.exitValue();
            String summary;
            synchronized (tail) {
                summary = String.join("\n", tail);
            }
            if (exit != 0) {
                log.warn("{} failed with exit code {}", name, exit);
            }
            return new CommandResult(name, exit == 0, summary);
        } catch (IOException e) {
            return new CommandResult(name, false, "could not run '" + command + "': " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new CommandResult(name, false, name + " interrupted");
        }
    }

    /**
     * Counts source files under the project root, skipping build output, dependencies and pipeline state.
     */
    public int countSourceFiles(Path projectRoot) {
        if (!Files.isDirectory(projectRoot)) {
            return 0;
        }
        int[] count = {0};
        try {
            Files.walkFileTree(projectRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(projectRoot) && IGNORED_DIRS.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    String name = file.getFileName().toString();
                    int dot = name.lastIndexOf('.');
                    if (dot > 0 && SOURCE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT))) {
                        count[0]++;
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return count[0];
    }

    private static void drain(Process process, List<String> tail) {
        try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("build: {}", line);
                synchronized (tail) {
                    tail.add(line);
                    if (tail.size() > OUTPUT_TAIL_LINES) {
                        tail.remove(0);
                    }
                }
            }
        } catch (IOException e) {
            log.debug("Build output stream closed: {}", e.getMessage());
        }
    }
}
