package dev.treebleshooter.engine;

import dev.treebleshooter.model.Answer;
import dev.treebleshooter.model.Guide;
import dev.treebleshooter.model.GuideLimits;
import dev.treebleshooter.model.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Enumerates root-to-solution paths and derives statistics from them.
 * Results are recomputed on every call.
 * <p>
 * Only meaningful for guides without cycles. A cyclic guide fails with
 * {@link IllegalStateException} instead of looping.
 */
public final class GuideAnalyzer {

    private GuideAnalyzer() {}

    public static List<List<String>> allPaths(Guide guide) {
        return allPaths(guide, GuideLimits.defaults());
    }

    /**
     * Every path from the root to a solution answer, in answer order. Each solution
     * answer closes one path, ending at the node that owns it. Routes to missing
     * nodes are skipped.
     *
     * @throws IllegalStateException if a path revisits a node or grows beyond
     *                               {@link GuideLimits#maxHistoryLength()}
     */
    public static List<List<String>> allPaths(Guide guide, GuideLimits limits) {
        var paths = new ArrayList<List<String>>();
        if (guide.rootNode().isEmpty()) {
            return paths;
        }
        collect(guide, guide.rootNodeId(), paths, limits);
        return paths;
    }

    public static GuideStatistics statistics(Guide guide) {
        return statistics(guide, GuideLimits.defaults());
    }

    public static GuideStatistics statistics(Guide guide, GuideLimits limits) {
        List<List<String>> paths = allPaths(guide, limits);

        int solutions = 0;
        for (String nodeId : reachableFromRoot(guide)) {
            for (Answer answer : guide.nodes().get(nodeId).answers()) {
                if (answer.isSolution()) {
                    solutions++;
                }
            }
        }

        int max = paths.stream().mapToInt(List::size).max().orElse(0);
        int min = paths.stream().mapToInt(List::size).min().orElse(0);
        double average = paths.stream().mapToInt(List::size).average().orElse(0);
        return new GuideStatistics(guide.nodes().size(), solutions, paths.size(), max, min, average);
    }

    /**
     * Ids of nodes reachable from the root, including the root, in discovery order.
     */
    public static Set<String> reachableFromRoot(Guide guide) {
        var reachable = new LinkedHashSet<String>();
        if (guide.rootNode().isEmpty()) {
            return reachable;
        }
        Deque<String> toVisit = new ArrayDeque<>();
        toVisit.push(guide.rootNodeId());
        while (!toVisit.isEmpty()) {
            String nodeId = toVisit.pop();
            if (!reachable.add(nodeId)) {
                continue;
            }
            for (Node child : guide.childNodes(nodeId)) {
                if (!reachable.contains(child.nodeId())) {
                    toVisit.push(child.nodeId());
                }
            }
        }
        return reachable;
    }

    private static void collect(Guide guide, String rootId, List<List<String>> paths, GuideLimits limits) {
        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();
        // Parallel to path: index of the next answer to try on each node.
        Deque<int[]> cursors = new ArrayDeque<>();
        enter(guide, rootId, path, onPath, cursors, limits);

        while (!cursors.isEmpty()) {
            String nodeId = path.get(path.size() - 1);
            List<Answer> answers = guide.nodes().get(nodeId).answers();
            int[] cursor = cursors.peek();
            if (cursor[0] == answers.size()) {
                cursors.pop();
                onPath.remove(path.remove(path.size() - 1));
                continue;
            }
            Answer answer = answers.get(cursor[0]++);
            if (answer instanceof Answer.Solution) {
                paths.add(List.copyOf(path));
            } else if (answer instanceof Answer.Route route && guide.nodes().containsKey(route.nextNodeId())) {
                enter(guide, route.nextNodeId(), path, onPath, cursors, limits);
            }
        }
    }

    private static void enter(Guide guide, String nodeId, List<String> path, Set<String> onPath,
                              Deque<int[]> cursors, GuideLimits limits) {
        if (onPath.contains(nodeId)) {
            throw new IllegalStateException("Cycle through node '%s' on path %s; validate the guide first"
                .formatted(nodeId, path));
        }
        if (path.size() >= limits.maxHistoryLength()) {
            throw new IllegalStateException("Path exceeds %d nodes at node '%s'"
                .formatted(limits.maxHistoryLength(), nodeId));
        }
        path.add(nodeId);
        onPath.add(nodeId);
        cursors.push(new int[] {0});
    }
}
