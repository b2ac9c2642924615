package com.maestro.core.debate;

import com.maestro.core.agent.AgentExecutor;
import com.maestro.core.agent.AgentRequest;
import com.maestro.core.events.EventBus;
import com.maestro.core.events.MaestroEvent;
import com.maestro.core.exception.StagePausedException;
import com.maestro.core.logging.MdcContext;
import com.maestro.core.model.ExecutionType;
import com.maestro.core.model.Stage;
import com.maestro.core.model.StageDirective;
import com.maestro.core.model.StageOutcome;
import com.maestro.core.models.ModelTierResolver;
import com.maestro.core.state.PauseSignal;
import com.maestro.core.validation.BuildRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs a sequential stage: a fixed ordered list of steps, one at a time, each seeing all
 * previous steps' outputs. Code-producing stages end with a build/test gate.
 */
public class SequentialExecutor {

    private static final Logger log = LoggerFactory.getLogger(SequentialExecutor.class);

    private final AgentExecutor agentExecutor;
    private final ModelTierResolver tierResolver;
    private final DebateArtifactStore artifactStore;
    private final BuildRunner buildRunner;
    private final EventBus eventBus;
    private final PauseSignal pauseSignal;
    private final Path workingDir;

    public SequentialExecutor(AgentExecutor agentExecutor, ModelTierResolver tierResolver,
                              DebateArtifactStore artifactStore, BuildRunner buildRunner,
                              EventBus eventBus, PauseSignal pauseSignal, Path workingDir) {
        this.agentExecutor = agentExecutor;
        this.tierResolver = tierResolver;
        this.artifactStore = artifactStore;
        this.buildRunner = buildRunner;
        this.eventBus = eventBus;
        this.pauseSignal = pauseSignal;
        this.workingDir = workingDir;
    }

    /**
     * @throws com.maestro.core.exception.AgentInvocationException when a step fails; later steps depend on it
     * @throws StagePausedException when a pause was requested between steps
     */
    public StageOutcome run(StageDirective directive) {
        Stage stage = directive.stage();
        artifactStore.resetDebate(stage.id());
        List<String> outputs = new ArrayList<>();
        for (int i = 0; i < stage.roles().size(); i++) {
            String step = stage.roles().get(i);
            int index = i + 1;
            MdcContext.setAgent(stage.id(), index, step);
            try {
                String output = agentExecutor.invoke(new AgentRequest(stage.id(), step, index,
                        DebatePrompts.step(stage, directive.text(), step, index, outputs),
                        tierResolver.tierFor(stage.id(), i), workingDir));
                outputs.add(output);
                artifactStore.writeStep(stage.id(), index, step, output);
                eventBus.publish(MaestroEvent.of("step.completed", stage.id(), Map.of("step", step, "index", index)));
                log.info("Step {}/{} ({}) of {} completed", index, stage.roles().size(), step, stage.id());
            } finally {
                MdcContext.clearAgent();
            }
            if (index < stage.roles().size() && pauseSignal.isRequested()) {
                log.info("Pause requested; stopping {} after step {}", stage.id(), step);
                throw new StagePausedException(stage.id(), "step " + step);
            }
        }

        String artifact = outputs.get(outputs.size() - 1);
        artifactStore.writeFinal(stage.id(), stage.primaryOutput(), combine(stage, outputs));

        boolean gatePassed = true;
        String gateFailure = null;
        if (stage.codeProducing()) {
            var type = buildRunner.detect(workingDir);
            if (type.isEmpty()) {
                gatePassed = false;
                gateFailure = "Build gate: no recognized project manifest";
            } else {
                var failed = buildRunner.buildAndTest(workingDir, type.get()).stream()
                        .filter(r -> !r.passed())
                        .map(r -> "Build gate: " + r.name() + " failed")
                        .collect(Collectors.joining("; "));
                gatePassed = failed.isEmpty();
                gateFailure = gatePassed ? null : failed;
            }
            log.info("Build gate for {}: {}", stage.id(), gatePassed ? "passed" : gateFailure);
        }
        return new StageOutcome(stage.id(), ExecutionType.SEQUENTIAL, artifact, List.of(), outputs,
                outputs.size(), gatePassed, gateFailure);
    }

    private static String combine(Stage stage, List<String> outputs) {
        var sb = new StringBuilder("# ").append(stage.name()).append("\n\n");
        for (int i = 0; i < outputs.size(); i++) {
            sb.append("## ").append(stage.roles().get(i)).append("\n\n").append(outputs.get(i).strip()).append("\n\n");
        }
        return sb.toString();
    }
}
