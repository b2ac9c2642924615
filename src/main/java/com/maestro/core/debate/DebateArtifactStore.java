package com.maestro.core.debate;

import com.maestro.core.config.ProjectLayout;
import com.maestro.core.exception.MaestroException;
import com.maestro.core.model.DebateRound;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;

/**
 * Writes debate rounds, sequential steps and final stage artifacts to the project tree.
 * Round files are written once and never rewritten.
 */
public class DebateArtifactStore {

    private final ProjectLayout layout;

    public DebateArtifactStore(ProjectLayout layout) {
        this.layout = layout;
    }

    /** {@code state/debates/<stage>/round-<n>/<role>.md} for every output of the round. */
    public void writeRound(String stageId, DebateRound round) {
        Path dir = roundDir(stageId, round.number());
        for (Map.Entry<String, String> e : round.outputs().entrySet()) {
            write(dir.resolve(fileName(e.getKey())), e.getValue());
        }
    }

    public Path roundDir(String stageId, int round) {
        return layout.debateDir(stageId).resolve("round-" + round);
    }

    /** Clears rounds left over from an earlier attempt of the stage. */
    public void resetDebate(String stageId) {
        deleteTree(layout.debateDir(stageId));
        deleteTree(layout.stepsDir(stageId));
    }

    public void writeStep(String stageId, int index, String step, String output) {
        write(layout.stepsDir(stageId).resolve(String.format("%02d-%s", index, fileName(step))), output);
    }

    /** Writes the stage's final artifact to {@code stages/<id>/outputs/<file>}. */
    public Path writeFinal(String stageId, String fileName, String content) {
        Path target = layout.outputsDir(stageId).resolve(fileName);
        write(target, content);
        return target;
    }

    static String fileName(String role) {
        return role.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "") + ".md";
    }

    private static void write(Path target, String content) {
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MaestroException("Failed to write artifact " + target, e);
        }
    }

    private static void deleteTree(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (var paths = Files.walk(dir)) {
            for (Path p : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        } catch (IOException e) {
            throw new MaestroException("Failed to clear " + dir, e);
        }
    }
}
