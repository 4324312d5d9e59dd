package dev.treebleshooter.engine;

import dev.treebleshooter.model.Answer;
import dev.treebleshooter.model.Guide;
import dev.treebleshooter.model.GuideLimits;
import dev.treebleshooter.model.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable execution state for walking a guide. The guide itself is never modified.
 * <p>
 * History is a stack of visits rather than a set of nodes, so going back always
 * restores the exact previous state even when a node was reached by several paths.
 */
public final class GuideNavigator {

    private static final Logger logger = LoggerFactory.getLogger(GuideNavigator.class);

    private final GuideLimits limits;
    private final Deque<NavigatorState> history = new ArrayDeque<>();
    private Guide guide;

    public GuideNavigator() {
        this(GuideLimits.defaults());
    }

    public GuideNavigator(GuideLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    /**
     * Begin walking {@code guide} at its root, discarding any previous walk.
     *
     * @throws NavigationException if the guide has no root or the root node is missing
     */
    public NavigatorState start(Guide guide) {
        Objects.requireNonNull(guide, "guide");
        String rootId = guide.rootNodeId();
        if (rootId == null) {
            throw new NavigationException("Guide '%s' has no root node".formatted(guide.metadata().title()));
        }
        if (!guide.nodes().containsKey(rootId)) {
            throw new NavigationException("Root node '%s' not found in guide '%s'"
                .formatted(rootId, guide.metadata().title()));
        }
        this.guide = guide;
        history.clear();
        history.addLast(new NavigatorState.AtNode(rootId));
        logger.debug("Started guide '{}' at {}", guide.metadata().title(), rootId);
        return state();
    }

    /**
     * Apply an answer of the current node.
     *
     * @throws NavigationException if not at a node, the answer does not belong to the current
     *                             node, the route target is missing, or history is full
     */
    public NavigatorState chooseAnswer(String answerId) {
        if (!(state() instanceof NavigatorState.AtNode at)) {
            throw new NavigationException("Cannot choose an answer while " + describe(state()));
        }
        Node node = guide.nodes().get(at.nodeId());
        Answer answer = node.answer(answerId).orElseThrow(() -> new NavigationException(
            "Answer '%s' does not belong to node '%s'".formatted(answerId, node.nodeId())));

        NavigatorState next;
        if (answer instanceof Answer.Solution solution) {
            next = new NavigatorState.AtSolution(node.nodeId(), solution.answerId(), solution.solutionText());
        } else {
            String target = ((Answer.Route) answer).nextNodeId();
            if (target == null || !guide.nodes().containsKey(target)) {
                throw new NavigationException("Answer '%s' on node '%s' routes to non-existent node '%s'"
                    .formatted(answer.answerText(), node.nodeId(), target));
            }
            next = new NavigatorState.AtNode(target);
        }
        push(next);
        logger.debug("Answer '{}' on {} -> {}", answer.answerText(), node.nodeId(), next);
        return next;
    }

    /**
     * Undo the most recent transition. Going back from the root returns to {@code NotStarted}.
     *
     * @throws NavigationException if there is nothing to go back to
     */
    public NavigatorState goBack() {
        if (history.isEmpty()) {
            throw new NavigationException("Cannot go back: navigation has not started");
        }
        history.removeLast();
        return state();
    }

    /**
     * Clear history and start the same guide again from its root.
     *
     * @throws NavigationException if no guide was ever started
     */
    public NavigatorState restart() {
        if (guide == null) {
            throw new NavigationException("Cannot restart: no guide has been started");
        }
        return start(guide);
    }

    public NavigatorState state() {
        return history.isEmpty() ? NavigatorState.NOT_STARTED : history.peekLast();
    }

    /** Visited states, oldest first. */
    public List<NavigatorState> history() {
        return List.copyOf(history);
    }

    /** Node ids in visit order; a node reached twice appears twice. */
    public List<String> visitedNodeIds() {
        return history.stream()
            .filter(NavigatorState.AtNode.class::isInstance)
            .map(s -> ((NavigatorState.AtNode) s).nodeId())
            .toList();
    }

    public Optional<Node> currentNode() {
        if (state() instanceof NavigatorState.AtNode at) {
            return guide.node(at.nodeId());
        }
        return Optional.empty();
    }

    public List<Answer> availableAnswers() {
        return currentNode().map(Node::answers).orElse(List.of());
    }

    public Optional<Guide> guide() {
        return Optional.ofNullable(guide);
    }

    public boolean canGoBack() {
        return !history.isEmpty();
    }

    public boolean isComplete() {
        return state() instanceof NavigatorState.AtSolution;
    }

    private void push(NavigatorState next) {
        if (history.size() >= limits.maxHistoryLength()) {
            throw new NavigationException("History limit of %d steps reached in guide '%s'; the guide probably loops"
                .formatted(limits.maxHistoryLength(), guide.metadata().title()));
        }
        history.addLast(next);
    }

    private static String describe(NavigatorState state) {
        if (state instanceof NavigatorState.AtSolution solution) {
            return "at a solution on node '" + solution.nodeId() + "'";
        }
        return "navigation has not started";
    }
}
