package dev.treebleshooter.model;

import java.util.UUID;

/**
 * One selectable choice on a node.
 * Exactly one of two forms: route to another node, or end with a solution.
 */
public sealed interface Answer {

    String answerId();

    String answerText();

    default boolean isSolution() {
        return this instanceof Solution;
    }

    /** Continue at another node of the same guide. */
    record Route(String answerId, String answerText, String nextNodeId) implements Answer {}

    /** Stop here; the user's problem is resolved by {@code solutionText}. */
    record Solution(String answerId, String answerText, String solutionText) implements Answer {}

    static Route route(String answerText, String nextNodeId) {
        return new Route(newId(), answerText, nextNodeId);
    }

    static Solution solution(String answerText, String solutionText) {
        return new Solution(newId(), answerText, solutionText);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
