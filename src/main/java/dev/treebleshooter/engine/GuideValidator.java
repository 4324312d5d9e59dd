package dev.treebleshooter.engine;

import dev.treebleshooter.model.Answer;
import dev.treebleshooter.model.Guide;
import dev.treebleshooter.model.GuideLimits;
import dev.treebleshooter.model.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static dev.treebleshooter.engine.ValidationFinding.error;
import static dev.treebleshooter.engine.ValidationFinding.warning;

/**
 * Validates guide structure before execution. Every check runs, so an author
 * sees all problems at once. An empty result, or one with only warnings,
 * means the guide can be executed.
 */
public final class GuideValidator {

    private static final Logger logger = LoggerFactory.getLogger(GuideValidator.class);

    private GuideValidator() {}

    public static List<ValidationFinding> validate(Guide guide) {
        return validate(guide, GuideLimits.defaults());
    }

    /**
     * Validate a guide against the given limits.
     *
     * @return findings in check order; empty if the guide is clean
     */
    public static List<ValidationFinding> validate(Guide guide, GuideLimits limits) {
        Objects.requireNonNull(guide, "guide");
        Objects.requireNonNull(limits, "limits");
        var findings = new ArrayList<ValidationFinding>();
        Map<String, Node> nodes = guide.nodes();

        // Rule 1: root must be set and present
        String rootId = guide.rootNodeId();
        boolean hasRoot = rootId != null && nodes.containsKey(rootId);
        if (rootId == null || rootId.isBlank()) {
            findings.add(error(null, null, "Guide has no root node"));
        } else if (!hasRoot) {
            findings.add(error(rootId, null, "Root node not found in nodes: " + rootId));
        }

        // Rule 2: every route must reference an existing node
        for (Node node : nodes.values()) {
            for (Answer answer : node.answers()) {
                if (answer instanceof Answer.Route route
                        && !isBlank(route.nextNodeId())
                        && !nodes.containsKey(route.nextNodeId())) {
                    findings.add(error(node.nodeId(), answer.answerId(),
                        "Node '%s': answer '%s' routes to non-existent node '%s'"
                            .formatted(node.nodeId(), answer.answerText(), route.nextNodeId())));
                }
            }
        }

        // Rule 3: every answer is a complete route or a complete solution
        for (Node node : nodes.values()) {
            for (Answer answer : node.answers()) {
                if (isBlank(answer.answerId())) {
                    findings.add(error(node.nodeId(), null,
                        "Node '%s' has an answer without an id".formatted(node.nodeId())));
                }
                if (isBlank(answer.answerText())) {
                    findings.add(error(node.nodeId(), answer.answerId(),
                        "Node '%s' has an answer with empty text".formatted(node.nodeId())));
                }
                if (answer instanceof Answer.Route route && isBlank(route.nextNodeId())) {
                    findings.add(error(node.nodeId(), answer.answerId(),
                        "Node '%s': answer '%s' neither routes to a node nor ends in a solution"
                            .formatted(node.nodeId(), answer.answerText())));
                } else if (answer instanceof Answer.Solution solution && isBlank(solution.solutionText())) {
                    findings.add(error(node.nodeId(), answer.answerId(),
                        "Node '%s': solution answer '%s' has empty solution text"
                            .formatted(node.nodeId(), answer.answerText())));
                }
            }
        }

        // Rule 4: every node has a question and answers
        for (var entry : nodes.entrySet()) {
            String key = entry.getKey();
            Node node = entry.getValue();
            if (!key.equals(node.nodeId())) {
                findings.add(error(key, null,
                    "Node stored under '%s' declares id '%s'".formatted(key, node.nodeId())));
            }
            if (isBlank(node.question())) {
                findings.add(error(node.nodeId(), null,
                    "Node '%s' has missing or empty question".formatted(node.nodeId())));
            }
            if (node.answers().isEmpty()) {
                findings.add(error(node.nodeId(), null,
                    "Node '%s' has no answers".formatted(node.nodeId())));
            } else if (node.answers().size() < limits.minAnswersPerNode()) {
                findings.add(warning(node.nodeId(), null,
                    "Node '%s' has %d answer(s); at least %d are recommended"
                        .formatted(node.nodeId(), node.answers().size(), limits.minAnswersPerNode())));
            }
            Set<String> seen = new HashSet<>();
            for (Answer answer : node.answers()) {
                if (answer.answerId() != null && !seen.add(answer.answerId())) {
                    findings.add(error(node.nodeId(), answer.answerId(),
                        "Node '%s' has duplicate answer id '%s'".formatted(node.nodeId(), answer.answerId())));
                }
            }
        }

        if (hasRoot) {
            // Rule 5: cycles reachable from the root
            var walk = new DepthFirstWalk(nodes);
            int longest = walk.visit(rootId);
            findings.addAll(walk.cycles);

            // Rule 6: orphans
            for (String nodeId : nodes.keySet()) {
                if (!walk.finished.contains(nodeId)) {
                    findings.add(warning(nodeId, null,
                        "Node '%s' is not reachable from root".formatted(nodeId)));
                }
            }

            // Rule 7a: depth
            if (longest > limits.maxTreeDepth()) {
                findings.add(warning(rootId, null,
                    "Longest path from root visits %d nodes, exceeding the maximum depth of %d"
                        .formatted(longest, limits.maxTreeDepth())));
            }
        }

        // Rule 7b: fan-out
        for (Node node : nodes.values()) {
            if (node.answers().size() > limits.maxAnswersPerNode()) {
                findings.add(warning(node.nodeId(), null,
                    "Node '%s' has %d answers, exceeding the maximum of %d"
                        .formatted(node.nodeId(), node.answers().size(), limits.maxAnswersPerNode())));
            }
        }

        if (logger.isDebugEnabled()) {
            long errors = findings.stream().filter(ValidationFinding::isError).count();
            logger.debug("Validated guide '{}': {} error(s), {} warning(s)",
                guide.metadata().title(), errors, findings.size() - errors);
        }
        return findings;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /**
     * Three-colour depth-first walk. Gray nodes are on the walk stack,
     * black nodes are finished. An edge into a gray node closes a cycle.
     * Also records the longest path (in nodes) below each finished node.
     * Frames live on an explicit stack so path length is bounded by heap, not by thread stack.
     */
    private static final class DepthFirstWalk {
        private final Map<String, Node> nodes;
        private final Set<String> onStack = new HashSet<>();
        private final Set<String> finished = new HashSet<>();
        private final Map<String, Integer> depthBelow = new HashMap<>();
        private final List<ValidationFinding> cycles = new ArrayList<>();

        DepthFirstWalk(Map<String, Node> nodes) {
            this.nodes = nodes;
        }

        private static final class Frame {
            final String nodeId;
            final List<Answer> answers;
            int next;
            int deepest;

            Frame(String nodeId, List<Answer> answers) {
                this.nodeId = nodeId;
                this.answers = answers;
            }
        }

        int visit(String startId) {
            Deque<Frame> stack = new ArrayDeque<>();
            onStack.add(startId);
            stack.push(new Frame(startId, nodes.get(startId).answers()));

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.next == frame.answers.size()) {
                    stack.pop();
                    onStack.remove(frame.nodeId);
                    finished.add(frame.nodeId);
                    int depth = frame.deepest + 1;
                    depthBelow.put(frame.nodeId, depth);
                    if (!stack.isEmpty()) {
                        Frame parent = stack.peek();
                        parent.deepest = Math.max(parent.deepest, depth);
                    }
                    continue;
                }

                Answer answer = frame.answers.get(frame.next++);
                if (!(answer instanceof Answer.Route route) || !nodes.containsKey(route.nextNodeId())) {
                    continue;
                }
                String target = route.nextNodeId();
                if (onStack.contains(target)) {
                    cycles.add(error(frame.nodeId, answer.answerId(),
                        "Cycle detected: answer '%s' on node '%s' routes back to node '%s'"
                            .formatted(answer.answerText(), frame.nodeId, target)));
                } else if (finished.contains(target)) {
                    frame.deepest = Math.max(frame.deepest, depthBelow.get(target));
                } else {
                    onStack.add(target);
                    stack.push(new Frame(target, nodes.get(target).answers()));
                }
            }
            return depthBelow.get(startId);
        }
    }
}
