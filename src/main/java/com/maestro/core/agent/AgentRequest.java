package com.maestro.core.agent;

import com.maestro.core.model.ModelTier;

import java.io.Serializable;
import java.nio.file.Path;

/**
 * One agent invocation.
 *
 * @param stageId     stage being executed
 * @param role        debate role, sequential step or synthesizer name
 * @param round       debate round or step number (1-based); 0 for synthesis
 * @param directive   full directive text sent to the agent
 * @param modelTier   model hint for the agent
 * @param workingDir  directory the agent runs in (the project root)
 */
public record AgentRequest(
        String stageId,
        String role,
        int round,
        String directive,
        ModelTier modelTier,
        Path workingDir
) implements Serializable {}
