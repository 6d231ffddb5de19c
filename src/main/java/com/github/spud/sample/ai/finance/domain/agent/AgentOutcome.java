package com.github.spud.sample.ai.finance.domain.agent;

/**
 * Result of one loop run
 *
 * @param text final assistant text, or the fallback text when exhausted
 * @param iterations completion turns taken
 * @param exhausted whether the iteration budget ran out
 */
public record AgentOutcome(String text, int iterations, boolean exhausted) {

}
