package com.maestro.core.debate;

import com.maestro.core.agent.AgentExecutor;
import com.maestro.core.agent.AgentRequest;
import com.maestro.core.events.EventBus;
import com.maestro.core.events.MaestroEvent;
import com.maestro.core.model.ExecutionType;
import com.maestro.core.model.Stage;
import com.maestro.core.model.StageDirective;
import com.maestro.core.model.StageOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Executes a stage's protocol: debate stages through {@link DebateEngine}, degrading to one
 * agent only when every round 1 agent failed, and sequential stages through {@link SequentialExecutor}.
 */
public class StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    private final DebateEngine debateEngine;
    private final SequentialExecutor sequentialExecutor;
    private final AgentExecutor agentExecutor;
    private final DebateArtifactStore artifactStore;
    private final EventBus eventBus;
    private final Path workingDir;

    public StageExecutor(DebateEngine debateEngine, SequentialExecutor sequentialExecutor,
                         AgentExecutor agentExecutor, DebateArtifactStore artifactStore,
                         EventBus eventBus, Path workingDir) {
        this.debateEngine = debateEngine;
        this.sequentialExecutor = sequentialExecutor;
        this.agentExecutor = agentExecutor;
        this.artifactStore = artifactStore;
        this.eventBus = eventBus;
        this.workingDir = workingDir;
    }

    /**
     * @throws com.maestro.core.exception.AgentInvocationException when no protocol produced an artifact
     * @throws com.maestro.core.exception.ConfigurationException   when the stage's debate settings are invalid
     */
    public StageOutcome execute(StageDirective directive) {
        Stage stage = directive.stage();
        if (!stage.isDebate()) {
            return sequentialExecutor.run(directive);
        }
        DebateEngine.checkSettings(stage);
        // only an empty round 1 degrades; later failures propagate with the rounds already written
        return debateEngine.run(directive).orElseGet(() -> {
            eventBus.publish(MaestroEvent.of("stage.degraded", stage.id(), Map.of("protocol", "single-agent")));
            return singleAgent(directive);
        });
    }

    StageOutcome singleAgent(StageDirective directive) {
        Stage stage = directive.stage();
        log.warn("Falling back to single-agent execution for {}", stage.id());
        String artifact = agentExecutor.invoke(new AgentRequest(stage.id(), stage.roles().get(0), 1,
                DebatePrompts.singleAgent(stage, directive.text()), directive.modelTier(), workingDir));
        artifactStore.writeFinal(stage.id(), stage.primaryOutput(), artifact);
        return new StageOutcome(stage.id(), ExecutionType.SINGLE_AGENT, artifact, List.of(), List.of(),
                1, true, null);
    }
}
