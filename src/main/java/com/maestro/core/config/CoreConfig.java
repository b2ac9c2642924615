package com.maestro.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.maestro.core.agent.AgentExecutor;
import com.maestro.core.agent.ProcessAgentExecutor;
import com.maestro.core.checkpoint.CheckpointManager;
import com.maestro.core.checkpoint.FileTreeCopier;
import com.maestro.core.checkpoint.NioFileTreeCopier;
import com.maestro.core.debate.ContentionEvaluator;
import com.maestro.core.debate.DebateArtifactStore;
import com.maestro.core.debate.DebateEngine;
import com.maestro.core.debate.SequentialExecutor;
import com.maestro.core.debate.StageExecutor;
import com.maestro.core.engine.PipelineDriver;
import com.maestro.core.engine.PipelineStateMachine;
import com.maestro.core.engine.StageDirectiveBuilder;
import com.maestro.core.events.EventBus;
import com.maestro.core.handoff.HandoffGenerator;
import com.maestro.core.handoff.MarkdownHandoffGenerator;
import com.maestro.core.metrics.MaestroMetrics;
import com.maestro.core.models.BuiltinAvailabilitySource;
import com.maestro.core.models.ManifestAvailabilitySource;
import com.maestro.core.models.ModelAvailabilitySource;
import com.maestro.core.models.ModelTierResolver;
import com.maestro.core.state.ExecutionLog;
import com.maestro.core.state.JsonFileStateStore;
import com.maestro.core.state.JsonSupport;
import com.maestro.core.state.PauseSignal;
import com.maestro.core.state.StateStore;
import com.maestro.core.validation.BuildRunner;
import com.maestro.core.validation.ManifestOutputValidator;
import com.maestro.core.validation.OutputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the pipeline core from {@link MaestroProperties}. The pipeline definition is built and
 * validated here, once, so a bad layout fails startup.
 */
@Configuration
public class CoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CoreConfig.class);

    @Bean
    @Primary
    public ObjectMapper maestroObjectMapper() {
        return JsonSupport.newMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProjectLayout projectLayout(MaestroProperties properties) {
        return ProjectLayout.of(properties);
    }

    @Bean
    public PipelineDefinition pipelineDefinition(MaestroProperties properties) {
        var definition = PipelineDefinition.of(properties.getPipelineVersion(),
                properties.getDebate().getStageIntensity());
        log.info("Pipeline '{}' with {} stages", definition.version(), definition.stages().size());
        return definition;
    }

    @Bean
    public StateStore stateStore(ProjectLayout layout, ObjectMapper mapper) {
        return new JsonFileStateStore(layout, mapper);
    }

    @Bean
    public ExecutionLog executionLog(ProjectLayout layout, ObjectMapper mapper) {
        return new ExecutionLog(layout, mapper);
    }

    @Bean
    public PauseSignal pauseSignal(StateStore stateStore) {
        return new PauseSignal(stateStore);
    }

    @Bean
    public ModelTierResolver modelTierResolver(PipelineDefinition pipeline, MaestroProperties properties,
                                               ObjectMapper mapper) {
        var models = properties.getModels();
        List<ModelAvailabilitySource> sources = new ArrayList<>();
        if (models.hasManifestUrl()) {
            sources.add(new ManifestAvailabilitySource(models.getManifestUrl(),
                    Duration.ofMillis(models.getFetchTimeoutMs()), mapper));
        }
        sources.add(new BuiltinAvailabilitySource());
        return new ModelTierResolver(pipeline, sources);
    }

    @Bean
    public AgentExecutor agentExecutor(MaestroProperties properties, MaestroMetrics metrics) {
        var agent = properties.getAgent();
        return new ProcessAgentExecutor(agent.getCommand(), agent.getTimeoutSeconds(), metrics);
    }

    /**
     * Fan-out pool for concurrent debate agents. Bounded by {@code maestro.debate.max-parallel-agents}.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService debateExecutor(MaestroProperties properties) {
        int size = Math.max(1, properties.getDebate().getMaxParallelAgents());
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "debate-agent-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public DebateArtifactStore debateArtifactStore(ProjectLayout layout) {
        return new DebateArtifactStore(layout);
    }

    @Bean
    public ContentionEvaluator contentionEvaluator(AgentExecutor agentExecutor, ObjectMapper mapper,
                                                   MaestroProperties properties) {
        var debate = properties.getDebate();
        return new ContentionEvaluator(agentExecutor, mapper, debate.getSynthesizerRole(),
                debate.getContentionThreshold());
    }

    @Bean
    public DebateEngine debateEngine(AgentExecutor agentExecutor, ContentionEvaluator contentionEvaluator,
                                     ModelTierResolver tierResolver, DebateArtifactStore artifactStore,
                                     ExecutorService debateExecutor, EventBus eventBus, MaestroMetrics metrics,
                                     PauseSignal pauseSignal, MaestroProperties properties, ProjectLayout layout) {
        var debate = properties.getDebate();
        return new DebateEngine(agentExecutor, contentionEvaluator, tierResolver, artifactStore,
                debateExecutor, eventBus, metrics, pauseSignal, debate.getSynthesizerRole(),
                debate.getMaxArtifactChars(), layout.root());
    }

    @Bean
    public BuildRunner buildRunner(MaestroProperties properties) {
        return new BuildRunner(properties.getBuild().getTimeoutSeconds());
    }

    @Bean
    public SequentialExecutor sequentialExecutor(AgentExecutor agentExecutor, ModelTierResolver tierResolver,
                                                 DebateArtifactStore artifactStore, BuildRunner buildRunner,
                                                 EventBus eventBus, PauseSignal pauseSignal,
                                                 ProjectLayout layout) {
        return new SequentialExecutor(agentExecutor, tierResolver, artifactStore, buildRunner, eventBus,
                pauseSignal, layout.root());
    }

    @Bean
    public StageExecutor stageExecutor(DebateEngine debateEngine, SequentialExecutor sequentialExecutor,
                                       AgentExecutor agentExecutor, DebateArtifactStore artifactStore,
                                       EventBus eventBus, ProjectLayout layout) {
        return new StageExecutor(debateEngine, sequentialExecutor, agentExecutor, artifactStore, eventBus,
                layout.root());
    }

    @Bean
    public OutputValidator outputValidator(ProjectLayout layout, BuildRunner buildRunner,
                                           MaestroProperties properties) {
        return new ManifestOutputValidator(layout, buildRunner, properties.getBuild().getMinSourceFiles());
    }

    @Bean
    public FileTreeCopier fileTreeCopier() {
        return new NioFileTreeCopier();
    }

    @Bean
    public CheckpointManager checkpointManager(ProjectLayout layout, FileTreeCopier copier, ObjectMapper mapper,
                                               Clock clock) {
        return new CheckpointManager(layout, copier, mapper, clock);
    }

    @Bean
    public HandoffGenerator handoffGenerator(ProjectLayout layout, Clock clock) {
        return new MarkdownHandoffGenerator(layout, clock);
    }

    @Bean
    public StageDirectiveBuilder stageDirectiveBuilder(ProjectLayout layout, PipelineDefinition pipeline) {
        return new StageDirectiveBuilder(layout, pipeline);
    }

    @Bean
    public PipelineStateMachine pipelineStateMachine(PipelineDefinition pipeline, ProjectLayout layout,
                                                     StateStore stateStore, ExecutionLog executionLog,
                                                     StageDirectiveBuilder directiveBuilder,
                                                     ModelTierResolver tierResolver, OutputValidator validator,
                                                     HandoffGenerator handoffGenerator,
                                                     CheckpointManager checkpointManager,
                                                     MaestroProperties properties, EventBus eventBus,
                                                     MaestroMetrics metrics, Clock clock) {
        return new PipelineStateMachine(pipeline, layout, stateStore, executionLog, directiveBuilder,
                tierResolver, validator, handoffGenerator, checkpointManager, properties, eventBus, metrics, clock);
    }

    @Bean
    public PipelineDriver pipelineDriver(PipelineStateMachine stateMachine, StageExecutor stageExecutor,
                                         MaestroMetrics metrics) {
        return new PipelineDriver(stateMachine, stageExecutor, metrics);
    }
}
