package com.maestro.core.debate;

import com.maestro.core.model.ContentionScore;
import com.maestro.core.model.DebateRound;
import com.maestro.core.model.Stage;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the directive text for every kind of debate and sequential invocation.
 * Pure functions, no Spring dependencies.
 */
public final class DebatePrompts {

    private DebatePrompts() {}

    public static String production(Stage stage, String directive, String role) {
        var sb = new StringBuilder();
        sb.append(directive).append("\n\n");
        sb.append("## Debate Role: ").append(role).append("\n\n");
        sb.append("You are the **").append(role).append("** in an independent multi-agent debate for the ")
          .append(stage.name()).append(" stage.\n");
        sb.append("- Work independently. Other agents are producing their own artifacts in parallel.\n");
        sb.append("- Argue from your role's perspective and make your reasoning explicit.\n");
        sb.append("- Produce one complete markdown artifact.\n");
        return sb.toString();
    }

    public static String review(Stage stage, String directive, String role, Map<String, String> roundOneArtifacts) {
        var sb = new StringBuilder();
        sb.append(directive).append("\n\n");
        sb.append("## Cross-Review: ").append(role).append("\n\n");
        sb.append("Round 1 of the ").append(stage.name()).append(" debate produced the artifacts below. ")
          .append("As the **").append(role).append("**, review them:\n");
        sb.append("- Identify agreements, contradictions and gaps.\n");
        sb.append("- Rebut points you disagree with and explain why.\n");
        sb.append("- Do NOT restate Round 1 content; reference it.\n\n");
        for (Map.Entry<String, String> e : roundOneArtifacts.entrySet()) {
            sb.append("### ").append(e.getKey()).append("\n\n").append(e.getValue().strip()).append("\n\n");
        }
        return sb.toString();
    }

    public static String extension(Stage stage, String directive, String role, int round,
                                   String priorRounds, List<String> focus) {
        var sb = new StringBuilder();
        sb.append(directive).append("\n\n");
        sb.append("## Debate Round ").append(round).append(": ").append(role).append("\n\n");
        sb.append("The ").append(stage.name()).append(" debate has not converged. ")
          .append("Address ONLY these unresolved points:\n");
        for (String item : focus) {
            sb.append("- ").append(item).append("\n");
        }
        sb.append("\nState your final position on each point and any concession you make.\n\n");
        sb.append("# Prior Rounds\n\n").append(priorRounds);
        return sb.toString();
    }

    /**
     * Asks the synthesizer to score disagreement in the latest round. The answer must end with
     * a JSON object {@code {"score": <0..1>, "unresolved": ["..."]}}.
     */
    public static String contention(Stage stage, DebateRound round) {
        var sb = new StringBuilder();
        sb.append("# Contention Evaluation: ").append(stage.name()).append(", round ").append(round.number())
          .append("\n\n");
        sb.append("Read the artifacts below and measure how much the agents still disagree.\n");
        sb.append("- 0.0 means full agreement, 1.0 means fundamental unresolved conflict.\n");
        sb.append("- List each still-unresolved point as a short, self-contained sentence.\n\n");
        sb.append("Answer with a JSON object as the last thing in your reply:\n");
        sb.append("{\"score\": 0.0, \"unresolved\": [\"...\"]}\n\n");
        for (Map.Entry<String, String> e : round.outputs().entrySet()) {
            sb.append("## ").append(e.getKey()).append("\n\n").append(e.getValue().strip()).append("\n\n");
        }
        return sb.toString();
    }

    public static String synthesis(Stage stage, String directive, String synthesizer, String renderedRounds,
                                   List<DebateRound> rounds) {
        var sb = new StringBuilder();
        sb.append(directive).append("\n\n");
        sb.append("## Synthesis: ").append(synthesizer).append("\n\n");
        sb.append("Produce the final ").append(stage.primaryOutput()).append(" for the ").append(stage.name())
          .append(" stage from every round of the debate below. It must contain:\n");
        sb.append("1. Items all agents agree on.\n");
        sb.append("2. Majority items, with dissent notes.\n");
        sb.append("3. Contradictions that were resolved, with the reasoning.\n");
        sb.append("4. Unique contributions, each evaluated.\n");
        sb.append("5. A `## Debate Notes` section with the round count, per-round contention scores, ")
          .append("consensus items, resolved disagreements and preserved minority opinions.\n");
        sb.append("No substantive point may be silently dropped.\n\n");
        sb.append("Rounds: ").append(rounds.size()).append(". Scores: ").append(scoreLine(rounds)).append("\n\n");
        sb.append("# Debate\n\n").append(renderedRounds);
        return sb.toString();
    }

    public static String singleAgent(Stage stage, String directive) {
        return directive + "\n\n## Single-Agent Execution\n\n"
                + "Produce the complete " + stage.primaryOutput() + " for the " + stage.name()
                + " stage on your own, covering every perspective of: " + String.join(", ", stage.roles()) + ".\n";
    }

    public static String step(Stage stage, String directive, String step, int index, List<String> priorOutputs) {
        var sb = new StringBuilder();
        sb.append(directive).append("\n\n");
        sb.append("## Step ").append(index).append(" of ").append(stage.roles().size()).append(": ")
          .append(step).append("\n\n");
        if (priorOutputs.isEmpty()) {
            sb.append("You are the first step of this stage.\n");
        } else {
            sb.append("Build on the outputs of the previous steps:\n\n");
            for (int i = 0; i < priorOutputs.size(); i++) {
                sb.append("### Step ").append(i + 1).append(": ").append(stage.roles().get(i)).append("\n\n")
                  .append(priorOutputs.get(i).strip()).append("\n\n");
            }
        }
        return sb.toString();
    }

    /**
     * Deterministic synthesis used when no agent could synthesize: every artifact of every
     * round concatenated under its role, followed by the debate notes.
     */
    public static String merge(Stage stage, List<DebateRound> rounds) {
        var sb = new StringBuilder();
        sb.append("# ").append(stage.name()).append("\n\n");
        sb.append("> Merged without synthesis: no synthesizer agent was available.\n\n");
        for (DebateRound round : rounds) {
            for (Map.Entry<String, String> e : round.outputs().entrySet()) {
                sb.append("## ").append(e.getKey()).append(" (round ").append(round.number()).append(")\n\n")
                  .append(e.getValue().strip()).append("\n\n");
            }
        }
        sb.append(debateNotes(rounds));
        return sb.toString();
    }

    public static String debateNotes(List<DebateRound> rounds) {
        var sb = new StringBuilder("## Debate Notes\n\n");
        sb.append("- Rounds: ").append(rounds.size()).append("\n");
        sb.append("- Contention scores: ").append(scoreLine(rounds)).append("\n");
        var failed = rounds.stream().flatMap(r -> r.failedRoles().stream()).distinct().toList();
        if (!failed.isEmpty()) {
            sb.append("- Agents that failed: ").append(String.join(", ", failed)).append("\n");
        }
        DebateRound last = rounds.get(rounds.size() - 1);
        if (last.contention() != null && !last.contention().unresolved().isEmpty()) {
            sb.append("- Preserved minority positions:\n");
            last.contention().unresolved().forEach(item -> sb.append("  - ").append(item).append("\n"));
        }
        return sb.toString();
    }

    static String scoreLine(List<DebateRound> rounds) {
        String scores = rounds.stream()
                .filter(r -> r.contention() != null)
                .map(r -> {
                    ContentionScore c = r.contention();
                    return "R" + r.number() + "=" + String.format(Locale.ROOT, "%.2f", c.score());
                })
                .collect(Collectors.joining(", "));
        return scores.isEmpty() ? "not evaluated" : scores;
    }
}
