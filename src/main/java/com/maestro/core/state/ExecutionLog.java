package com.maestro.core.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.maestro.core.config.ProjectLayout;
import com.maestro.core.exception.StateStoreException;
import com.maestro.core.model.ExecutionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Append-only JSON-lines log of stage executions ({@code state/execution_log.jsonl}),
 * used to audit that every stage actually went through a protocol.
 */
public class ExecutionLog {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLog.class);

    private final ProjectLayout layout;
    private final ObjectMapper mapper;

    public ExecutionLog(ProjectLayout layout, ObjectMapper mapper) {
        this.layout = layout;
        this.mapper = mapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
    }

    public synchronized void append(ExecutionEvent event) {
        try {
            Files.createDirectories(layout.stateDir());
            String line = mapper.writeValueAsString(event) + System.lineSeparator();
            Files.writeString(layout.executionLog(), line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            log.debug("Recorded {} execution for stage {}", event.type(), event.stage());
        } catch (IOException e) {
            throw new StateStoreException("Failed to append to " + layout.executionLog(), e);
        }
    }

    public synchronized List<ExecutionEvent> read() {
        if (!Files.exists(layout.executionLog())) {
            return List.of();
        }
        var events = new ArrayList<ExecutionEvent>();
        try {
            for (String line : Files.readAllLines(layout.executionLog(), StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    events.add(mapper.readValue(line, ExecutionEvent.class));
                }
            }
        } catch (IOException e) {
            throw new StateStoreException("Failed to read " + layout.executionLog(), e);
        }
        return events;
    }

    /**
     * Stages among {@code requiredStages} that have no recorded execution event, in the given order.
     */
    public List<String> missingStages(Collection<String> requiredStages) {
        Set<String> recorded = new HashSet<>();
        read().forEach(e -> recorded.add(e.stage()));
        return requiredStages.stream().filter(s -> !recorded.contains(s)).toList();
    }
}
