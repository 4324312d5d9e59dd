package dev.treebleshooter.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A guide is a decision tree that walks a user from a root question to a solution.
 * Nodes are kept in an insertion-ordered map keyed by node id; all edges are ids.
 */
public record Guide(
    GuideMetadata metadata,
    Map<String, Node> nodes,
    String rootNodeId // nullable; a guide without a root cannot be executed
) {
    private static final Logger logger = LoggerFactory.getLogger(Guide.class);

    public static final String REMOVED_PATH_SOLUTION = "Path removed - please update this solution";

    public Guide {
        Objects.requireNonNull(metadata, "metadata");
        nodes = Collections.unmodifiableMap(nodes == null ? new LinkedHashMap<String, Node>() : new LinkedHashMap<String, Node>(nodes));
    }

    public static Guide create(GuideMetadata metadata) {
        return new Guide(metadata, Map.of(), null);
    }

    /**
     * Add or replace a node. The first node added becomes the root.
     */
    public Guide withNode(Node node) {
        var copy = new LinkedHashMap<>(nodes);
        copy.put(node.nodeId(), node);
        String root = rootNodeId == null ? node.nodeId() : rootNodeId;
        logger.debug("Added node {} to guide '{}'", node.nodeId(), metadata.title());
        return new Guide(metadata.touched(), copy, root);
    }

    /**
     * Add or replace a node and make it the root.
     */
    public Guide withRoot(Node node) {
        var copy = new LinkedHashMap<>(nodes);
        copy.put(node.nodeId(), node);
        logger.debug("Set root of guide '{}' to {}", metadata.title(), node.nodeId());
        return new Guide(metadata.touched(), copy, node.nodeId());
    }

    public Guide withMetadata(GuideMetadata newMetadata) {
        return new Guide(newMetadata, nodes, rootNodeId);
    }

    /**
     * Remove a node. Every route that pointed at it becomes a placeholder solution
     * so the remaining guide has no dangling references.
     *
     * @throws IllegalArgumentException if the node is the root or does not exist
     */
    public Guide withoutNode(String nodeId) {
        if (!nodes.containsKey(nodeId)) {
            throw new IllegalArgumentException("Node not found in guide: " + nodeId);
        }
        if (nodeId.equals(rootNodeId)) {
            throw new IllegalArgumentException("Cannot remove root node: " + nodeId);
        }
        var copy = new LinkedHashMap<String, Node>();
        for (Node node : nodes.values()) {
            if (node.nodeId().equals(nodeId)) {
                continue;
            }
            copy.put(node.nodeId(), redirectRoutes(node, nodeId));
        }
        logger.info("Removed node {} from guide '{}'", nodeId, metadata.title());
        return new Guide(metadata.touched(), copy, rootNodeId);
    }

    public Optional<Node> node(String nodeId) {
        return Optional.ofNullable(nodeId == null ? null : nodes.get(nodeId));
    }

    public Optional<Node> rootNode() {
        return node(rootNodeId);
    }

    /**
     * Direct successors of a node, in answer order. Dangling routes are skipped.
     */
    public List<Node> childNodes(String nodeId) {
        var children = new ArrayList<Node>();
        node(nodeId).ifPresent(node -> {
            for (Answer answer : node.answers()) {
                if (answer instanceof Answer.Route route) {
                    node(route.nextNodeId()).ifPresent(children::add);
                }
            }
        });
        return children;
    }

    private static Node redirectRoutes(Node node, String removedId) {
        boolean touched = false;
        var answers = new ArrayList<Answer>(node.answers().size());
        for (Answer answer : node.answers()) {
            if (answer instanceof Answer.Route route && removedId.equals(route.nextNodeId())) {
                answers.add(new Answer.Solution(route.answerId(), route.answerText(), REMOVED_PATH_SOLUTION));
                touched = true;
            } else {
                answers.add(answer);
            }
        }
        return touched ? node.withAnswers(answers) : node;
    }
}
