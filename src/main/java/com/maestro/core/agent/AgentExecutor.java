package com.maestro.core.agent;

/**
 * Runs one directive through a language-model agent and returns its text output.
 * Implementations own invocation timeouts.
 */
@FunctionalInterface
public interface AgentExecutor {

    /**
     * @return the agent's non-blank output
     * @throws com.maestro.core.exception.AgentInvocationException when the agent fails, times out or returns nothing
     */
    String invoke(AgentRequest request);
}
