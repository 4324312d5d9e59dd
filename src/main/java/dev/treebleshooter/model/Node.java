package dev.treebleshooter.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A single decision point: a question plus the ordered answers a user can pick.
 * Answer order is display order and survives serialization.
 */
public record Node(
    String nodeId,
    String question,
    String description, // nullable
    String helpText, // nullable
    String parentNodeId, // nullable, informational only
    List<Answer> answers
) {
    public Node {
        Objects.requireNonNull(nodeId, "nodeId");
        answers = answers == null ? List.of() : List.copyOf(answers);
    }

    public static Node create(String question) {
        return new Node(UUID.randomUUID().toString(), question, null, null, null, List.of());
    }

    public Node withAnswer(Answer answer) {
        var copy = new ArrayList<>(answers);
        copy.add(answer);
        return new Node(nodeId, question, description, helpText, parentNodeId, copy);
    }

    /**
     * Returns a copy without the given answer, or this node if no answer has that id.
     */
    public Node withoutAnswer(String answerId) {
        var copy = new ArrayList<>(answers);
        if (!copy.removeIf(a -> a.answerId().equals(answerId))) {
            return this;
        }
        return new Node(nodeId, question, description, helpText, parentNodeId, copy);
    }

    public Node withAnswers(List<Answer> newAnswers) {
        return new Node(nodeId, question, description, helpText, parentNodeId, newAnswers);
    }

    public Node withParent(String parentId) {
        return new Node(nodeId, question, description, helpText, parentId, answers);
    }

    public Node withHelp(String newDescription, String newHelpText) {
        return new Node(nodeId, question, newDescription, newHelpText, parentNodeId, answers);
    }

    public Optional<Answer> answer(String answerId) {
        return answers.stream()
            .filter(a -> a.answerId().equals(answerId))
            .findFirst();
    }

    /** True when every answer ends in a solution. */
    public boolean isLeaf() {
        return answers.stream().allMatch(Answer::isSolution);
    }
}
