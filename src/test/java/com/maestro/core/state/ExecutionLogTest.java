package com.maestro.core.state;

import com.maestro.core.config.ProjectLayout;
import com.maestro.core.model.ExecutionEvent;
import com.maestro.core.model.ExecutionType;
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

class ExecutionLogTest {

    @TempDir
    Path root;

    private ProjectLayout layout;
    private ExecutionLog executionLog;

    @BeforeEach
    void setUp() {
        layout = new ProjectLayout(root);
        executionLog = new ExecutionLog(layout, JsonSupport.newMapper());
    }

    @Test
    @DisplayName("appends one JSON line per event")
    void appendsLines() throws IOException {
        executionLog.append(new ExecutionEvent("01-brainstorm", ExecutionType.DEBATE, 3, 3,
                List.of(0.9, 0.6, 0.2), Instant.parse("2025-06-01T10:00:00Z")));
        executionLog.append(new ExecutionEvent("05-task-management", ExecutionType.SEQUENTIAL, 2, 2,
                List.of(), Instant.parse("2025-06-01T11:00:00Z")));

        assertEquals(2, Files.readAllLines(layout.executionLog()).size());
        var events = executionLog.read();
        assertEquals(ExecutionType.DEBATE, events.get(0).type());
        assertEquals(List.of(0.9, 0.6, 0.2), events.get(0).scores());
        assertEquals("05-task-management", events.get(1).stage());
    }

    @Test
    @DisplayName("read on a missing log is empty")
    void missingLog() {
        assertTrue(executionLog.read().isEmpty());
    }

    @Test
    @DisplayName("missingStages lists stages without events, in order")
    void missingStages() {
        executionLog.append(new ExecutionEvent("02-research", ExecutionType.SINGLE_AGENT, 1, 1,
                List.of(), Instant.now()));

        assertEquals(List.of("01-brainstorm", "03-planning"),
                executionLog.missingStages(List.of("01-brainstorm", "02-research", "03-planning")));
    }
}
