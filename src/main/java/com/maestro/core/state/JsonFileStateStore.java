package com.maestro.core.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.maestro.core.config.ProjectLayout;
import com.maestro.core.exception.PipelineStateException;
import com.maestro.core.exception.StateStoreException;
import com.maestro.core.model.PipelineSnapshot;
import com.maestro.core.model.PipelineState;
import com.maestro.core.model.Progress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * {@link StateStore} backed by {@code state/pipeline.json} and {@code state/progress.json}.
 * <p>
 * Both files are rewritten through a temp file and an atomic move. Transitions are serialized
 * on this instance, which is the only writer within the orchestrator process.
 */
public class JsonFileStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStateStore.class);

    private final ProjectLayout layout;
    private final ObjectMapper mapper;

    public JsonFileStateStore(ProjectLayout layout, ObjectMapper mapper) {
        this.layout = layout;
        this.mapper = mapper;
    }

    @Override
    public synchronized Optional<PipelineSnapshot> load() {
        Path pipelineFile = layout.pipelineFile();
        Path progressFile = layout.progressFile();
        if (!Files.exists(pipelineFile) || !Files.exists(progressFile)) {
            return Optional.empty();
        }
        try {
            var pipeline = mapper.readValue(pipelineFile.toFile(), PipelineState.class);
            var progress = mapper.readValue(progressFile.toFile(), Progress.class);
            return Optional.of(new PipelineSnapshot(pipeline, progress));
        } catch (IOException e) {
            throw new StateStoreException("Failed to read pipeline state from " + layout.stateDir(), e);
        }
    }

    @Override
    public synchronized void save(PipelineSnapshot snapshot) {
        JsonSupport.writeAtomically(mapper, layout.progressFile(), snapshot.progress());
        JsonSupport.writeAtomically(mapper, layout.pipelineFile(), snapshot.pipeline());
        log.debug("Saved pipeline state: stage={} status={}",
                snapshot.pipeline().currentStage(), snapshot.pipeline().status());
    }

    @Override
    public synchronized PipelineSnapshot transition(UnaryOperator<PipelineSnapshot> change) {
        PipelineSnapshot current = load().orElseThrow(() -> new PipelineStateException(
                "Project at " + layout.root() + " is not initialized; run 'maestro init' first"));
        PipelineSnapshot next = change.apply(current);
        save(next);
        return next;
    }
}
