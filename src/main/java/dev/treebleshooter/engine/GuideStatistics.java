package dev.treebleshooter.engine;

/**
 * Aggregate metrics of a guide, derived from its root-to-solution paths.
 * Depths count nodes on a path.
 */
public record GuideStatistics(
    int nodeCount,
    int solutionCount,
    int pathCount,
    int maxDepth,
    int minDepth,
    double averagePathLength
) {}
