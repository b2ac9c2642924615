package com.maestro.core.debate;

import com.maestro.core.agent.AgentExecutor;
import com.maestro.core.agent.AgentRequest;
import com.maestro.core.exception.AgentInvocationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Agent double for debate tests. Debate roles answer with a fixed artifact; the synthesizer
 * answers contention prompts from a score script and synthesis prompts with a final document.
 */
class ScriptedAgent implements AgentExecutor {

    static final String SYNTHESIZER = "Synthesizer";

    private final Queue<Double> scores = new ConcurrentLinkedQueue<>();
    private final List<AgentRequest> requests = new CopyOnWriteArrayList<>();
    private final List<Predicate<AgentRequest>> failures = new CopyOnWriteArrayList<>();
    private final List<Consumer<AgentRequest>> hooks = new CopyOnWriteArrayList<>();
    private volatile List<String> unresolved = List.of("error handling strategy");

    ScriptedAgent scores(double... values) {
        for (double v : values) {
            scores.add(v);
        }
        return this;
    }

    ScriptedAgent unresolved(List<String> items) {
        this.unresolved = items;
        return this;
    }

    ScriptedAgent failWhen(Predicate<AgentRequest> condition) {
        failures.add(condition);
        return this;
    }

    /** Runs {@code hook} on every invocation before it is answered. */
    ScriptedAgent onInvoke(Consumer<AgentRequest> hook) {
        hooks.add(hook);
        return this;
    }

    @Override
    public String invoke(AgentRequest request) {
        requests.add(request);
        hooks.forEach(h -> h.accept(request));
        for (Predicate<AgentRequest> failure : failures) {
            if (failure.test(request)) {
                throw new AgentInvocationException("scripted failure for " + request.role());
            }
        }
        if (SYNTHESIZER.equals(request.role()) && request.round() > 0) {
            Double score = scores.poll();
            var items = new ArrayList<String>();
            unresolved.forEach(item -> items.add("\"" + item + "\""));
            return "Assessment done.\n{\"score\": " + (score == null ? 0.0 : score)
                    + ", \"unresolved\": [" + String.join(", ", items) + "]}";
        }
        if (request.round() == 0) {
            return "# Final by " + request.role() + "\n\nSynthesized content.\n";
        }
        return "Artifact of " + request.role() + " in round " + request.round();
    }

    List<AgentRequest> requests() {
        return requests;
    }

    long contentionCalls() {
        return requests.stream().filter(r -> SYNTHESIZER.equals(r.role()) && r.round() > 0).count();
    }

    List<AgentRequest> roundCalls(int round) {
        return requests.stream()
                .filter(r -> !SYNTHESIZER.equals(r.role()) && r.round() == round)
                .toList();
    }
}
