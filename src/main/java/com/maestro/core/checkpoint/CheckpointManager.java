package com.maestro.core.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.maestro.core.config.ProjectLayout;
import com.maestro.core.exception.CheckpointException;
import com.maestro.core.model.Checkpoint;
import com.maestro.core.state.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Snapshots and restores a project's mutable trees as named checkpoints under
 * {@code state/checkpoints/<id>/}.
 * <p>
 * Each checkpoint directory holds copies of the selected trees plus an immutable
 * {@code metadata.json}. The checkpoints directory itself is never copied and never deleted
 * by a restore. This class does not touch pipeline progress; recording references is left
 * to the pipeline state machine.
 */
public class CheckpointManager {

    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);

    static final String METADATA = "metadata.json";

    private static final DateTimeFormatter ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss").withZone(ZoneOffset.UTC);

    private final ProjectLayout layout;
    private final FileTreeCopier copier;
    private final ObjectMapper mapper;
    private final Clock clock;

    public CheckpointManager(ProjectLayout layout, FileTreeCopier copier, ObjectMapper mapper, Clock clock) {
        this.layout = layout;
        this.copier = copier;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Copies the selected trees into a new checkpoint directory and writes its metadata.
     * On any failure the partial checkpoint directory is removed.
     *
     * @throws CheckpointException when the snapshot cannot be completed
     */
    public synchronized Checkpoint create(String stageId, String description, CheckpointOptions options) {
        Instant now = clock.instant();
        String id = uniqueId(stageId, now);
        Path dir = layout.checkpointsDir().resolve(id);
        var includes = new ArrayList<String>();
        try {
            Files.createDirectories(dir);
            if (options.includeStages() && Files.isDirectory(layout.stagesDir())) {
                copier.copy(layout.stagesDir(), dir.resolve(ProjectLayout.STAGES));
                includes.add(ProjectLayout.STAGES);
            }
            if (options.includeState() && Files.isDirectory(layout.stateDir())) {
                Path checkpoints = layout.checkpointsDir();
                copier.copy(layout.stateDir(), dir.resolve(ProjectLayout.STATE), p -> p.startsWith(checkpoints));
                includes.add(ProjectLayout.STATE);
            }
            if (options.includeConfig() && Files.isDirectory(layout.configDir())) {
                copier.copy(layout.configDir(), dir.resolve(ProjectLayout.CONFIG));
                includes.add(ProjectLayout.CONFIG);
            }
            var checkpoint = new Checkpoint(id, stageId, now, description, includes);
            JsonSupport.writeAtomically(mapper, dir.resolve(METADATA), checkpoint);
            log.info("Created checkpoint {} ({})", id, String.join(", ", includes));
            return checkpoint;
        } catch (IOException | RuntimeException e) {
            removeQuietly(dir, e);
            throw new CheckpointException("Failed to create checkpoint for stage " + stageId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Full restore replaces each selected tree wholesale; partial restore copies only the named paths.
     * Not transactional: on failure the destination is left as it is.
     *
     * @throws CheckpointException when the checkpoint does not exist or a copy fails
     */
    public synchronized Checkpoint restore(String checkpointId, RestoreOptions options) {
        Checkpoint checkpoint = get(checkpointId)
                .orElseThrow(() -> new CheckpointException("Checkpoint not found: " + checkpointId));
        Path dir = layout.checkpointsDir().resolve(checkpointId);
        try {
            if (options.isPartial()) {
                for (String file : options.files()) {
                    Path src = dir.resolve(file).normalize();
                    if (!src.startsWith(dir)) {
                        throw new CheckpointException("Path escapes checkpoint: " + file);
                    }
                    if (!Files.exists(src)) {
                        log.warn("Checkpoint {} does not contain {}; skipped", checkpointId, file);
                        continue;
                    }
                    Path dest = layout.root().resolve(file).normalize();
                    if (dest.startsWith(layout.checkpointsDir())) {
                        throw new CheckpointException("Refusing to restore into the checkpoints directory: " + file);
                    }
                    copier.copy(src, dest);
                }
            } else {
                if (options.restoreStages()) {
                    replaceTree(dir.resolve(ProjectLayout.STAGES), layout.stagesDir());
                }
                if (options.restoreState()) {
                    replaceState(dir.resolve(ProjectLayout.STATE));
                }
                if (options.restoreConfig()) {
                    replaceTree(dir.resolve(ProjectLayout.CONFIG), layout.configDir());
                }
            }
            log.info("Restored checkpoint {}{}", checkpointId, options.isPartial() ? " (partial)" : "");
            return checkpoint;
        } catch (IOException e) {
            throw new CheckpointException("Failed to restore checkpoint " + checkpointId + ": " + e.getMessage(), e);
        }
    }

    /** All checkpoints, newest first. */
    public List<Checkpoint> list() {
        Path root = layout.checkpointsDir();
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        var result = new ArrayList<Checkpoint>();
        try (Stream<Path> dirs = Files.list(root)) {
            for (Path dir : dirs.filter(Files::isDirectory).toList()) {
                readMetadata(dir).ifPresent(result::add);
            }
        } catch (IOException e) {
            throw new CheckpointException("Failed to list checkpoints in " + root, e);
        }
        result.sort(Comparator.comparing(Checkpoint::createdAt).thenComparing(Checkpoint::id).reversed());
        return result;
    }

    public Optional<Checkpoint> get(String checkpointId) {
        if (checkpointId == null || checkpointId.isBlank() || checkpointId.contains("..")
                || checkpointId.contains("/") || checkpointId.contains("\\")) {
            return Optional.empty();
        }
        return readMetadata(layout.checkpointsDir().resolve(checkpointId));
    }

    /**
     * @return true when the checkpoint existed and was deleted
     */
    public synchronized boolean delete(String checkpointId) {
        if (get(checkpointId).isEmpty()) {
            return false;
        }
        try {
            copier.delete(layout.checkpointsDir().resolve(checkpointId));
            log.info("Deleted checkpoint {}", checkpointId);
            return true;
        } catch (IOException e) {
            throw new CheckpointException("Failed to delete checkpoint " + checkpointId, e);
        }
    }

    /**
     * Deletes the oldest checkpoints until at most {@code maxRetention} remain, skipping
     * milestone checkpoints when {@code preserveMilestones} is set. Preserved milestones still
     * count towards the total, so fewer checkpoints may be deleted than the excess when
     * milestones are the oldest.
     *
     * @return ids of the deleted checkpoints, oldest first
     */
    public synchronized List<String> cleanup(int maxRetention, boolean preserveMilestones) {
        List<Checkpoint> all = list();
        int excess = all.size() - Math.max(0, maxRetention);
        if (excess <= 0) {
            return List.of();
        }
        var oldestFirst = new ArrayList<>(all);
        Collections.reverse(oldestFirst);
        var deleted = new ArrayList<String>();
        for (Checkpoint cp : oldestFirst) {
            if (deleted.size() >= excess) break;
            if (preserveMilestones && cp.milestone()) continue;
            if (delete(cp.id())) {
                deleted.add(cp.id());
            }
        }
        log.info("Checkpoint cleanup removed {} of {} checkpoints (retention {})", deleted.size(), all.size(), maxRetention);
        return deleted;
    }

    private String uniqueId(String stageId, Instant now) {
        String base = stageId + "_" + ID_FORMAT.format(now);
        String id = base;
        int n = 2;
        while (Files.exists(layout.checkpointsDir().resolve(id))) {
            id = base + "-" + n++;
        }
        return id;
    }

    private void replaceTree(Path source, Path target) throws IOException {
        if (!Files.isDirectory(source)) {
            return;
        }
        copier.delete(target);
        copier.copy(source, target);
    }

    /** Clears {@code state/} except the checkpoints directory, then copies the snapshot back. */
    private void replaceState(Path source) throws IOException {
        if (!Files.isDirectory(source)) {
            return;
        }
        Path stateDir = layout.stateDir();
        if (Files.isDirectory(stateDir)) {
            try (Stream<Path> entries = Files.list(stateDir)) {
                for (Path entry : entries.toList()) {
                    if (!entry.equals(layout.checkpointsDir())) {
                        copier.delete(entry);
                    }
                }
            }
        }
        copier.copy(source, stateDir);
    }

    private Optional<Checkpoint> readMetadata(Path dir) {
        Path metadata = dir.resolve(METADATA);
        if (!Files.isRegularFile(metadata)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(metadata.toFile(), Checkpoint.class));
        } catch (IOException e) {
            log.warn("Ignoring checkpoint with unreadable metadata: {}", dir.getFileName());
            return Optional.empty();
        }
    }

    private void removeQuietly(Path dir, Exception cause) {
        try {
            copier.delete(dir);
        } catch (IOException e) {
            cause.addSuppressed(e);
            log.error("Could not remove partial checkpoint {}", dir, e);
        }
    }
}
