package dev.treebleshooter.engine;

import dev.treebleshooter.model.Answer;
import dev.treebleshooter.model.Guide;
import dev.treebleshooter.model.GuideLimits;
import dev.treebleshooter.model.GuideMetadata;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.treebleshooter.TestGuides.chain;
import static dev.treebleshooter.TestGuides.cycle;
import static dev.treebleshooter.TestGuides.diamond;
import static dev.treebleshooter.TestGuides.guide;
import static dev.treebleshooter.TestGuides.node;
import static dev.treebleshooter.TestGuides.powerCheck;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GuideAnalyzerTest {

    @Test
    void enumeratesOnePathPerSolution() {
        List<List<String>> paths = GuideAnalyzer.allPaths(powerCheck());

        assertThat(paths).containsExactly(
            List.of("plugged-in"),
            List.of("plugged-in", "power-button"),
            List.of("plugged-in", "power-button"));
    }

    @Test
    void statisticsForPowerCheck() {
        GuideStatistics stats = GuideAnalyzer.statistics(powerCheck());

        assertThat(stats.nodeCount()).isEqualTo(2);
        assertThat(stats.solutionCount()).isEqualTo(3);
        assertThat(stats.pathCount()).isEqualTo(3);
        assertThat(stats.maxDepth()).isEqualTo(2);
        assertThat(stats.minDepth()).isEqualTo(1);
        assertThat(stats.averagePathLength()).isCloseTo(5.0 / 3, within(1e-9));
    }

    @Test
    void diamondSharedNodeContributesPathsThroughEachParent() {
        List<List<String>> paths = GuideAnalyzer.allPaths(diamond());
        GuideStatistics stats = GuideAnalyzer.statistics(diamond());

        assertThat(paths).containsExactly(
            List.of("root", "A", "C"),
            List.of("root", "A", "C"),
            List.of("root", "A"),
            List.of("root", "B", "C"),
            List.of("root", "B", "C"),
            List.of("root", "B"));
        // C's two solutions are counted once even though C is reachable twice
        assertThat(stats.solutionCount()).isEqualTo(4);
        assertThat(stats.maxDepth()).isEqualTo(3);
    }

    @Test
    void orphanSolutionsAreNotCounted() {
        Guide guide = powerCheck().withNode(node("orphan", "Unreachable?",
            Answer.solution("Yes", "Done"), Answer.solution("No", "Done")));

        GuideStatistics stats = GuideAnalyzer.statistics(guide);

        assertThat(stats.nodeCount()).isEqualTo(3);
        assertThat(stats.solutionCount()).isEqualTo(3);
    }

    @Test
    void guideWithoutRootHasNoPaths() {
        Guide empty = Guide.create(GuideMetadata.create("Empty", "Nothing yet"));

        GuideStatistics stats = GuideAnalyzer.statistics(empty);

        assertThat(GuideAnalyzer.allPaths(empty)).isEmpty();
        assertThat(stats).isEqualTo(new GuideStatistics(0, 0, 0, 0, 0, 0.0));
    }

    @Test
    void danglingRoutesAreSkipped() {
        Guide guide = guide("Dangling", "a",
            node("a", "Question?", new Answer.Route("go", "Go", "ghost"), Answer.solution("No", "Done")));

        assertThat(GuideAnalyzer.allPaths(guide)).containsExactly(List.of("a"));
    }

    @Test
    void cyclicGuideFailsInsteadOfLooping() {
        assertThatThrownBy(() -> GuideAnalyzer.allPaths(cycle()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Cycle through node 'A'");
    }

    @Test
    void pathLongerThanHistoryLimitFails() {
        var limits = new GuideLimits(20, 10, 2, 1);

        assertThatThrownBy(() -> GuideAnalyzer.allPaths(powerCheck(), limits))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Path exceeds 1 nodes");
    }

    @Test
    void deepChainWithinHistoryLimit() {
        var limits = new GuideLimits(20, 10, 2, 50_000);

        GuideStatistics stats = GuideAnalyzer.statistics(chain(20_000, false), limits);

        assertThat(stats.pathCount()).isEqualTo(2);
        assertThat(stats.maxDepth()).isEqualTo(20_000);
        assertThat(stats.solutionCount()).isEqualTo(2);
    }

    @Test
    void reachableFromRootFollowsRoutesOnly() {
        assertThat(GuideAnalyzer.reachableFromRoot(diamond())).containsExactlyInAnyOrder("root", "A", "B", "C");
    }
}
