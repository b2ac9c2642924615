package com.maestro.core.debate;

import com.maestro.core.model.DebateRound;

import java.util.List;
import java.util.Map;

/**
 * Renders debate rounds as prompt context, shrinking earlier rounds to summaries when the
 * full text would exceed a character budget. The latest round is always kept verbatim.
 * Stored rounds are never modified.
 */
public final class ArtifactCompressor {

    static final int MIN_SUMMARY_CHARS = 400;

    private ArtifactCompressor() {}

    public static String render(List<DebateRound> rounds, int maxChars) {
        String full = renderRounds(rounds, Integer.MAX_VALUE);
        if (full.length() <= maxChars || rounds.size() < 2) {
            return full;
        }
        DebateRound latest = rounds.get(rounds.size() - 1);
        String latestText = renderRound(latest, Integer.MAX_VALUE);
        int priorArtifacts = rounds.subList(0, rounds.size() - 1).stream()
                .mapToInt(r -> r.outputs().size())
                .sum();
        int budget = Math.max(MIN_SUMMARY_CHARS,
                (maxChars - latestText.length()) / Math.max(1, priorArtifacts));
        return renderRounds(rounds.subList(0, rounds.size() - 1), budget) + latestText;
    }

    public static boolean needsCompression(List<DebateRound> rounds, int maxChars) {
        return renderRounds(rounds, Integer.MAX_VALUE).length() > maxChars;
    }

    /** Head of the text plus a marker of how much was omitted. */
    public static String summarize(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        int cut = text.lastIndexOf('\n', maxChars);
        if (cut < maxChars / 2) {
            cut = maxChars;
        }
        return text.substring(0, cut).stripTrailing()
                + "\n\n[... summarized: " + (text.length() - cut) + " more characters omitted]\n";
    }

    private static String renderRounds(List<DebateRound> rounds, int perArtifactChars) {
        var sb = new StringBuilder();
        for (DebateRound round : rounds) {
            sb.append(renderRound(round, perArtifactChars));
        }
        return sb.toString();
    }

    private static String renderRound(DebateRound round, int perArtifactChars) {
        var sb = new StringBuilder();
        sb.append("## Round ").append(round.number());
        if (round.number() > 1) {
            sb.append(" (reviews)");
        }
        sb.append("\n\n");
        for (Map.Entry<String, String> e : round.outputs().entrySet()) {
            sb.append("### ").append(e.getKey()).append("\n\n");
            sb.append(summarize(e.getValue(), perArtifactChars).strip()).append("\n\n");
        }
        return sb.toString();
    }
}
