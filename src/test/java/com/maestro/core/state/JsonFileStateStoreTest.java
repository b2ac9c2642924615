package com.maestro.core.state;

import com.maestro.core.config.ProjectLayout;
import com.maestro.core.exception.PipelineStateException;
import com.maestro.core.exception.StateStoreException;
import com.maestro.core.model.CheckpointRef;
import com.maestro.core.model.PipelineSnapshot;
import com.maestro.core.model.PipelineState;
import com.maestro.core.model.PipelineStatus;
import com.maestro.core.model.Progress;
import com.maestro.core.model.RetryState;
import com.maestro.core.model.StageStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileStateStoreTest {

    private static final Instant STARTED = Instant.parse("2025-06-01T09:00:00Z");

    @TempDir
    Path root;

    private ProjectLayout layout;
    private JsonFileStateStore store;

    @BeforeEach
    void setUp() {
        layout = new ProjectLayout(root);
        store = new JsonFileStateStore(layout, JsonSupport.newMapper());
    }

    private static PipelineSnapshot initial() {
        return new PipelineSnapshot(PipelineState.initial("01-planning", STARTED),
                Progress.initial("demo", "compact", List.of("01-planning", "02-ui-ux"), STARTED));
    }

    @Test
    @DisplayName("load is empty before the first save")
    void emptyBeforeSave() {
        assertTrue(store.load().isEmpty());
        assertFalse(store.isInitialized());
    }

    @Test
    @DisplayName("save then load returns an equal snapshot")
    void roundTrip() {
        var snapshot = initial();
        var withDetails = snapshot
                .withPipeline(snapshot.pipeline().withRetryState(
                        new RetryState("01-planning", 1, List.of("missing file"), Instant.parse("2025-06-01T10:00:00Z"))))
                .withProgress(snapshot.progress().withCheckpoint(
                        new CheckpointRef("01-planning_2025-06-01T10-00-00", "01-planning",
                                Instant.parse("2025-06-01T10:00:00Z"), "manual")));
        store.save(withDetails);

        var loaded = store.load().orElseThrow();
        assertEquals(withDetails.pipeline(), loaded.pipeline());
        assertEquals(withDetails.progress().stages(), loaded.progress().stages());
        assertEquals(withDetails.progress().checkpoints(), loaded.progress().checkpoints());
        assertTrue(Files.exists(layout.pipelineFile()));
        assertTrue(Files.exists(layout.progressFile()));
    }

    @Test
    @DisplayName("transition applies and persists the change")
    void transition() {
        store.save(initial());

        store.transition(s -> s.withPipeline(s.pipeline().withStatus(PipelineStatus.PAUSED, "manual")));

        var loaded = store.load().orElseThrow();
        assertEquals(PipelineStatus.PAUSED, loaded.pipeline().status());
        assertEquals("manual", loaded.pipeline().pauseReason());
        assertEquals(StageStatus.PENDING, loaded.progress().stage("01-planning").status());
    }

    @Test
    @DisplayName("transition on an uninitialized project is rejected")
    void transitionUninitialized() {
        assertThrows(PipelineStateException.class, () -> store.transition(s -> s));
    }

    @Test
    @DisplayName("corrupt state surfaces as StateStoreException")
    void corruptState() throws IOException {
        store.save(initial());
        Files.writeString(layout.progressFile(), "{ not json");

        assertThrows(StateStoreException.class, store::load);
    }
}
