package com.maestro.core.debate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maestro.core.agent.AgentExecutor;
import com.maestro.core.agent.AgentRequest;
import com.maestro.core.exception.AgentInvocationException;
import com.maestro.core.model.ContentionScore;
import com.maestro.core.model.DebateRound;
import com.maestro.core.model.DebateSettings;
import com.maestro.core.model.ModelTier;
import com.maestro.core.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the synthesizer role to score disagreement in a round, then applies {@link ContentionPolicy}.
 * <p>
 * The agent's answer is parsed as a trailing JSON object; a {@code Score: 0.7} line and a
 * bulleted {@code Unresolved:} list are accepted as a fallback. When the synthesizer fails or
 * its answer cannot be parsed, the round is scored 0.0, which still extends below the minimum
 * round count but otherwise lets the debate converge.
 */
public class ContentionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ContentionEvaluator.class);

    private static final Pattern SCORE_PATTERN =
            Pattern.compile("(?i)\\bscore\\b\\s*[:=]\\s*([01](?:\\.\\d+)?)");
    private static final Pattern BULLET_PATTERN = Pattern.compile("^\\s*[-*]\\s+(.+)$");

    private final AgentExecutor agentExecutor;
    private final ObjectMapper objectMapper;
    private final String synthesizerRole;
    private final double threshold;

    public ContentionEvaluator(AgentExecutor agentExecutor, ObjectMapper objectMapper,
                               String synthesizerRole, double threshold) {
        this.agentExecutor = agentExecutor;
        this.objectMapper = objectMapper;
        this.synthesizerRole = synthesizerRole;
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }

    public ContentionScore evaluate(Stage stage, DebateRound round, DebateSettings settings,
                                    ModelTier tier, Path workingDir) {
        String answer;
        try {
            answer = agentExecutor.invoke(new AgentRequest(stage.id(), synthesizerRole, round.number(),
                    DebatePrompts.contention(stage, round), tier, workingDir));
        } catch (AgentInvocationException e) {
            log.warn("Contention evaluation failed for {} round {}: {}", stage.id(), round.number(), e.getMessage());
            answer = "";
        }
        Parsed parsed = parse(answer);
        var recommendation = ContentionPolicy.decide(round.number(), parsed.score(), settings, threshold);
        log.info("Round {} of {} scored {} -> {}", round.number(), stage.id(),
                String.format("%.2f", parsed.score()), recommendation);
        return new ContentionScore(parsed.score(), recommendation, parsed.unresolved());
    }

    Parsed parse(String answer) {
        if (answer == null || answer.isBlank()) {
            return new Parsed(0.0, List.of());
        }
        int end = answer.lastIndexOf('}');
        int start = end < 0 ? -1 : answer.lastIndexOf("{\"score\"", end);
        if (start < 0 && end >= 0) {
            start = answer.lastIndexOf('{', end);
        }
        if (start >= 0 && end > start) {
            try {
                JsonNode node = objectMapper.readTree(answer.substring(start, end + 1));
                if (node.has("score")) {
                    var unresolved = new ArrayList<String>();
                    node.path("unresolved").forEach(n -> unresolved.add(n.asText()));
                    return new Parsed(node.get("score").asDouble(0.0), unresolved);
                }
            } catch (IOException e) {
                log.debug("Contention answer has no valid JSON object, trying text form");
            }
        }
        return parseText(answer);
    }

    private Parsed parseText(String answer) {
        Matcher m = SCORE_PATTERN.matcher(answer);
        double score = m.find() ? Double.parseDouble(m.group(1)) : 0.0;
        var unresolved = new ArrayList<String>();
        boolean inList = false;
        for (String line : answer.split("\\R")) {
            if (line.toLowerCase().startsWith("unresolved")) {
                inList = true;
                continue;
            }
            if (inList) {
                Matcher bullet = BULLET_PATTERN.matcher(line);
                if (bullet.matches()) {
                    unresolved.add(bullet.group(1).trim());
                } else if (!line.isBlank()) {
                    inList = false;
                }
            }
        }
        return new Parsed(score, unresolved);
    }

    record Parsed(double score, List<String> unresolved) {}
}
