package com.maestro.core.debate;

import com.maestro.core.agent.AgentExecutor;
import com.maestro.core.agent.AgentRequest;
import com.maestro.core.events.EventBus;
import com.maestro.core.events.MaestroEvent;
import com.maestro.core.exception.ConfigurationException;
import com.maestro.core.exception.StagePausedException;
import com.maestro.core.fallback.FallbackChain;
import com.maestro.core.logging.MdcContext;
import com.maestro.core.metrics.MaestroMetrics;
import com.maestro.core.model.DebateRound;
import com.maestro.core.model.DebateSettings;
import com.maestro.core.model.ExecutionType;
import com.maestro.core.model.Intensity;
import com.maestro.core.model.Recommendation;
import com.maestro.core.model.Stage;
import com.maestro.core.model.StageDirective;
import com.maestro.core.model.StageOutcome;
import com.maestro.core.models.ModelTierResolver;
import com.maestro.core.state.PauseSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Runs the multi-agent debate protocol for one stage.
 * <ol>
 *   <li>Round 1: every role produces an artifact concurrently, without seeing the others.</li>
 *   <li>Round 2 (not at light intensity): every surviving role cross-reviews all round 1 artifacts.</li>
 *   <li>Rounds 3+: surviving roles address only the unresolved contention items.</li>
 * </ol>
 * For full and standard intensity the synthesizer scores contention after every round and
 * {@link ContentionPolicy} decides whether to extend. The debate then ends in one synthesis pass.
 * <p>
 * Each round is a fan-out/fan-in barrier: all invocations of a round settle before the next starts.
 */
public class DebateEngine {

    private static final Logger log = LoggerFactory.getLogger(DebateEngine.class);

    private final AgentExecutor agentExecutor;
    private final ContentionEvaluator contentionEvaluator;
    private final ModelTierResolver tierResolver;
    private final DebateArtifactStore artifactStore;
    private final ExecutorService executor;
    private final EventBus eventBus;
    private final MaestroMetrics metrics;
    private final PauseSignal pauseSignal;
    private final String synthesizerRole;
    private final int maxArtifactChars;
    private final Path workingDir;

    public DebateEngine(AgentExecutor agentExecutor, ContentionEvaluator contentionEvaluator,
                        ModelTierResolver tierResolver, DebateArtifactStore artifactStore,
                        ExecutorService executor, EventBus eventBus, MaestroMetrics metrics,
                        PauseSignal pauseSignal, String synthesizerRole, int maxArtifactChars, Path workingDir) {
        this.agentExecutor = agentExecutor;
        this.contentionEvaluator = contentionEvaluator;
        this.tierResolver = tierResolver;
        this.artifactStore = artifactStore;
        this.executor = executor;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.pauseSignal = pauseSignal;
        this.synthesizerRole = synthesizerRole;
        this.maxArtifactChars = maxArtifactChars;
        this.workingDir = workingDir;
    }

    /**
     * Runs the debate and writes the synthesized artifact.
     *
     * @return the outcome, or empty when every round 1 agent failed
     * @throws ConfigurationException when the stage's round bounds are invalid for its intensity
     * @throws StagePausedException   when a pause was requested; checked after every settled round
     */
    public Optional<StageOutcome> run(StageDirective directive) {
        Stage stage = directive.stage();
        DebateSettings settings = stage.debate();
        checkSettings(stage);

        List<String> roles = stage.roles().subList(0, settings.agents());
        List<DebateRound> rounds = new ArrayList<>();
        artifactStore.resetDebate(stage.id());

        RoundResult first = fanOut(stage, 1, roles,
                role -> DebatePrompts.production(stage, directive.text(), role));
        if (first.outputs().isEmpty()) {
            log.warn("All {} round 1 agents failed for {}", roles.size(), stage.id());
            return Optional.empty();
        }
        DebateRound current = new DebateRound(1, first.outputs(), Map.of(), first.failed(), List.of(), null);
        record(stage, rounds, current);

        List<String> active = new ArrayList<>(first.outputs().keySet());
        List<String> focus = List.of();
        Map<String, String> roundOne = first.outputs();

        while (stage.intensity().contentionEvaluation()) {
            var score = contentionEvaluator.evaluate(stage, current, settings,
                    tierResolver.personaTier(stage.id()), workingDir);
            current = current.withContention(score);
            rounds.set(rounds.size() - 1, current);
            metrics.recordContention(stage.id(), score.score());
            publish("debate.contention.scored", stage, Map.of("round", current.number(), "score", score.score(),
                    "recommendation", score.recommendation().name()));
            if (score.recommendation() == Recommendation.SYNTHESIZE) {
                break;
            }

            int next = current.number() + 1;
            focus = ContentionPolicy.narrowFocus(focus, score.unresolved());
            RoundResult result;
            if (next == 2 && stage.intensity().crossReview()) {
                result = fanOut(stage, next, active,
                        role -> DebatePrompts.review(stage, directive.text(), role, roundOne));
            } else {
                String context = ArtifactCompressor.render(rounds, maxArtifactChars);
                List<String> nextFocus = focus;
                result = fanOut(stage, next, active,
                        role -> DebatePrompts.extension(stage, directive.text(), role, next, context, nextFocus));
            }
            if (result.outputs().isEmpty()) {
                log.warn("All agents failed in round {} of {}; synthesizing from {} completed rounds",
                        next, stage.id(), rounds.size());
                break;
            }
            active = new ArrayList<>(result.outputs().keySet());
            current = new DebateRound(next, Map.of(), result.outputs(), result.failed(), focus, null);
            record(stage, rounds, current);
        }

        metrics.recordDebateRounds(stage.id(), rounds.size());
        String artifact = synthesize(stage, directive, rounds);
        artifactStore.writeFinal(stage.id(), stage.primaryOutput(), artifact);
        return Optional.of(new StageOutcome(stage.id(), ExecutionType.DEBATE, artifact, rounds, List.of(),
                roundOne.size(), true, null));
    }

    /**
     * Synthesizer role first, then the stage's lead role, then a deterministic merge of all rounds.
     */
    String synthesize(Stage stage, StageDirective directive, List<DebateRound> rounds) {
        String rendered = ArtifactCompressor.render(rounds, maxArtifactChars);
        if (ArtifactCompressor.needsCompression(rounds, maxArtifactChars)) {
            log.info("Compressed prior rounds of {} to fit {} characters", stage.id(), maxArtifactChars);
        }
        String leadRole = stage.roles().get(0);
        var resolution = FallbackChain.<String>named("synthesis")
                .then(synthesizerRole, () -> Optional.of(agentExecutor.invoke(new AgentRequest(stage.id(),
                        synthesizerRole, 0,
                        DebatePrompts.synthesis(stage, directive.text(), synthesizerRole, rendered, rounds),
                        tierResolver.personaTier(stage.id()), workingDir))))
                .then(leadRole, () -> Optional.of(agentExecutor.invoke(new AgentRequest(stage.id(),
                        leadRole, 0,
                        DebatePrompts.synthesis(stage, directive.text(), leadRole, rendered, rounds),
                        tierResolver.assignment().defaultFor(stage.id()), workingDir))))
                .orElse("merge", () -> DebatePrompts.merge(stage, rounds))
                .resolve();
        publish("debate.synthesized", stage, Map.of("rounds", rounds.size(), "synthesizer", resolution.provider()));
        String text = resolution.value();
        if (!text.contains("## Debate Notes")) {
            text = text.stripTrailing() + "\n\n" + DebatePrompts.debateNotes(rounds);
        }
        return text;
    }

    private void record(Stage stage, List<DebateRound> rounds, DebateRound round) {
        rounds.add(round);
        artifactStore.writeRound(stage.id(), round);
        publish("debate.round.completed", stage, Map.of("round", round.number(),
                "outputs", round.outputs().size(), "failed", round.failedRoles().size()));
        log.info("Round {} of {} completed: {} outputs, {} failed",
                round.number(), stage.id(), round.outputs().size(), round.failedRoles().size());
        if (pauseSignal.isRequested()) {
            log.info("Pause requested; stopping {} after round {}", stage.id(), round.number());
            throw new StagePausedException(stage.id(), "debate round " + round.number());
        }
    }

    /**
     * Invokes every role concurrently and waits for all of them. Failed roles are reported, not thrown.
     */
    private RoundResult fanOut(Stage stage, int round, List<String> roles, Function<String, String> prompt) {
        var futures = new LinkedHashMap<String, CompletableFuture<String>>();
        for (String role : roles) {
            int roleIndex = stage.roles().indexOf(role);
            var tier = tierResolver.tierFor(stage.id(), roleIndex);
            futures.put(role, CompletableFuture.supplyAsync(() -> {
                MdcContext.setAgent(stage.id(), round, role);
                try {
                    return agentExecutor.invoke(new AgentRequest(stage.id(), role, round,
                            prompt.apply(role), tier, workingDir));
                } finally {
                    MdcContext.clear();
                }
            }, executor));
        }
        CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new))
                .exceptionally(e -> null)
                .join();

        var outputs = new LinkedHashMap<String, String>();
        var failed = new ArrayList<String>();
        futures.forEach((role, future) -> {
            try {
                outputs.put(role, future.join());
            } catch (RuntimeException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Agent '{}' failed in round {} of {}: {}", role, round, stage.id(), cause.getMessage());
                failed.add(role);
                publish("agent.failed", stage, Map.of("round", round, "role", role,
                        "error", String.valueOf(cause.getMessage())));
            }
        });
        return new RoundResult(outputs, failed);
    }

    /**
     * @throws ConfigurationException when the round bounds or agent count are invalid for the intensity
     */
    public static void checkSettings(Stage stage) {
        DebateSettings s = stage.debate();
        if (stage.intensity() == Intensity.LIGHT && (s.minRounds() != 1 || s.maxRounds() != 1)) {
            throw new ConfigurationException("Stage " + stage.id()
                    + ": light intensity requires min_rounds = max_rounds = 1, got "
                    + s.minRounds() + "/" + s.maxRounds());
        }
        if (s.agents() < 1 || s.agents() > stage.roles().size() || s.minRounds() < 1 || s.maxRounds() < s.minRounds()) {
            throw new ConfigurationException("Stage " + stage.id() + ": invalid debate settings " + s);
        }
    }

    private void publish(String type, Stage stage, Map<String, Object> payload) {
        eventBus.publish(MaestroEvent.of(type, stage.id(), payload));
    }

    private record RoundResult(Map<String, String> outputs, List<String> failed) {}
}
