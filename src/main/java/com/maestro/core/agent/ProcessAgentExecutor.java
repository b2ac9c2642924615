package com.maestro.core.agent;

import com.maestro.core.exception.AgentInvocationException;
import com.maestro.core.metrics.MaestroMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link AgentExecutor} that runs an external agent CLI (for example {@code claude -p}),
 * writing the directive to stdin and reading the answer from stdout.
 * The model hint is passed as {@code --model <tier>}.
 */
public class ProcessAgentExecutor implements AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessAgentExecutor.class);

    private final List<String> baseCommand;
    private final int timeoutSeconds;
    private final MaestroMetrics metrics;

    public ProcessAgentExecutor(String command, int timeoutSeconds, MaestroMetrics metrics) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Agent command must not be blank");
        }
        this.baseCommand = List.copyOf(Arrays.asList(command.trim().split("\\s+")));
        this.timeoutSeconds = timeoutSeconds;
        this.metrics = metrics;
    }

    @Override
    public String invoke(AgentRequest request) {
        var command = buildCommand(request);
        log.debug("Invoking agent '{}' for stage {}: {}", request.role(), request.stageId(), command);
        boolean success = false;
        Process process = null;
        try {
            process = new ProcessBuilder(command)
                    .directory(request.workingDir().toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();

            Process running = process;
            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(running.getInputStream()));
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(request.directive().getBytes(StandardCharsets.UTF_8));
            }

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                throw new AgentInvocationException("Agent '" + request.role() + "' timed out after "
                        + timeoutSeconds + "s in stage " + request.stageId());
            }
            String output = stdout.get();
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new AgentInvocationException("Agent '" + request.role() + "' exited with code "
                        + exitCode + " in stage " + request.stageId());
            }
            if (output.isBlank()) {
                throw new AgentInvocationException("Agent '" + request.role() + "' returned no output in stage "
                        + request.stageId());
            }
            success = true;
            return output;
        } catch (IOException | ExecutionException e) {
            throw new AgentInvocationException("Agent '" + request.role() + "' could not be run: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentInvocationException("Interrupted while waiting for agent '" + request.role() + "'", e);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            metrics.recordAgentInvocation(request.modelTier().roleName(), success);
        }
    }

    List<String> buildCommand(AgentRequest request) {
        var command = new ArrayList<>(baseCommand);
        command.add("--model");
        command.add(request.modelTier().tierKey());
        return command;
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
