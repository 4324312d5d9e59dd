package dev.treebleshooter.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.treebleshooter.model.Answer;
import dev.treebleshooter.model.DifficultyLevel;
import dev.treebleshooter.model.Guide;
import dev.treebleshooter.model.GuideMetadata;
import dev.treebleshooter.model.Node;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

import static dev.treebleshooter.TestGuides.diamond;
import static dev.treebleshooter.TestGuides.powerCheck;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GuideSerializerTest {

    private static final String MINIMAL = """
        {
          "metadata": {
            "title": "Minimal",
            "description": "One node",
            "author": "Support Team",
            "version": "1.0.0",
            "created_date": "2025-08-15T10:00:00",
            "last_modified_date": "2025-08-15T10:00:00",
            "tags": [],
            "difficulty_level": "Advanced"
          },
          "root_node_id": "only",
          "nodes": {
            "only": {
              "node_id": "only",
              "question": "Does it work?",
              "answers": [
                { "answer_id": "y", "answer_text": "Yes", "is_solution": true, "solution_text": "Nothing to do" },
                { "answer_id": "n", "answer_text": "No", "is_solution": true, "solution_text": "Call support" }
              ]
            }
          }
        }
        """;

    @Test
    void roundTripPreservesGuideAndOrder() throws Exception {
        Guide original = diamond();

        Guide copy = GuideSerializer.fromRepresentation(GuideSerializer.toRepresentation(original));

        assertThat(copy).isEqualTo(original);
        assertThat(copy.nodes().keySet()).containsExactly("root", "A", "B", "C");
        assertThat(copy.nodes().get("root").answers()).extracting(Answer::answerId)
            .containsExactly("root-a", "root-b");
    }

    @Test
    void roundTripThroughJsonTextKeepsEveryField() throws Exception {
        GuideMetadata metadata = new GuideMetadata("Printer offline", "Bring a printer back online", "Ops",
            "2.3.4", LocalDateTime.of(2025, 1, 2, 3, 4, 5), LocalDateTime.of(2025, 6, 7, 8, 9, 10, 500_000_000),
            Set.of("printer"), DifficultyLevel.INTERMEDIATE, 15);
        Node root = new Node("n1", "Is the printer on?", "Look at the panel", "The LED is on the left", null,
            List.of(new Answer.Route("r1", "Yes", "n2"), new Answer.Solution("s1", "No", "Turn it on")));
        Node second = new Node("n2", "Is the cable attached?", null, null, "n1",
            List.of(new Answer.Solution("s2", "Yes", "Restart the spooler"), new Answer.Solution("s3", "No", "Attach it")));
        Guide original = Guide.create(metadata).withNode(root).withNode(second).withMetadata(metadata);

        Guide copy = GuideSerializer.fromJson(GuideSerializer.toJson(original));

        assertThat(copy).isEqualTo(original);
    }

    @Test
    void roundTripOfGuideCreatedWithoutDescription() throws Exception {
        Guide original = Guide.create(GuideMetadata.create("No description", null))
            .withNode(new Node("only", "Did a restart help?", null, null, null,
                List.of(new Answer.Solution("y", "Yes", "Done"), new Answer.Solution("n", "No", "Call support"))));

        assertThat(GuideValidator.validate(original)).isEmpty();
        Guide copy = GuideSerializer.fromRepresentation(GuideSerializer.toRepresentation(original));

        assertThat(copy).isEqualTo(original);
        assertThat(copy.metadata().description()).isEmpty();
    }

    @Test
    void writesFlatAnswerShape() {
        JsonNode json = GuideSerializer.toRepresentation(powerCheck());

        JsonNode answers = json.get("nodes").get("plugged-in").get("answers");
        assertThat(answers.get(0).get("is_solution").asBoolean()).isTrue();
        assertThat(answers.get(0).get("solution_text").asText()).isEqualTo("Plug it in");
        assertThat(answers.get(0).get("next_node_id").isNull()).isTrue();
        assertThat(answers.get(1).get("is_solution").asBoolean()).isFalse();
        assertThat(answers.get(1).get("next_node_id").asText()).isEqualTo("power-button");
        assertThat(answers.get(1).get("solution_text").isNull()).isTrue();
        assertThat(json.get("metadata").get("difficulty_level").asText()).isEqualTo("Beginner");
    }

    @Test
    void readsMinimalGuideWithOptionalKeysAbsent() throws Exception {
        Guide guide = GuideSerializer.fromJson(MINIMAL);

        assertThat(guide.rootNodeId()).isEqualTo("only");
        assertThat(guide.metadata().difficultyLevel()).isEqualTo(DifficultyLevel.ADVANCED);
        assertThat(guide.metadata().estimatedTimeMinutes()).isNull();
        Node only = guide.nodes().get("only");
        assertThat(only.description()).isNull();
        assertThat(only.parentNodeId()).isNull();
        assertThat(only.answers()).allMatch(Answer::isSolution);
    }

    @Test
    void ignoresUnknownKeys() throws Exception {
        ObjectNode json = (ObjectNode) GuideSerializer.MAPPER.readTree(MINIMAL);
        json.putObject("_metadata").put("file_version", "1.0");
        ((ObjectNode) json.get("nodes").get("only")).put("color", "blue");

        Guide guide = GuideSerializer.fromRepresentation(json);

        assertThat(guide.nodes()).containsOnlyKeys("only");
    }

    @Test
    void missingRequiredKeyNamesItsPath() throws Exception {
        ObjectNode json = (ObjectNode) GuideSerializer.MAPPER.readTree(MINIMAL);
        ObjectNode answer = (ObjectNode) json.get("nodes").get("only").get("answers").get(1);
        answer.remove("is_solution");

        assertThatThrownBy(() -> GuideSerializer.fromRepresentation(json))
            .isInstanceOf(GuideFormatException.class)
            .satisfies(e -> assertThat(((GuideFormatException) e).path())
                .isEqualTo("nodes.only.answers[1].is_solution"));
    }

    @Test
    void wrongTypeNamesItsPath() throws Exception {
        ObjectNode json = (ObjectNode) GuideSerializer.MAPPER.readTree(MINIMAL);
        ((ObjectNode) json.get("metadata")).put("tags", "not-a-list");

        assertThatThrownBy(() -> GuideSerializer.fromRepresentation(json))
            .isInstanceOf(GuideFormatException.class)
            .hasMessageContaining("metadata.tags")
            .hasMessageContaining("expected an array");
    }

    @Test
    void missingMetadataFails() {
        assertThatThrownBy(() -> GuideSerializer.fromJson("{\"root_node_id\": null, \"nodes\": {}}"))
            .isInstanceOf(GuideFormatException.class)
            .satisfies(e -> assertThat(((GuideFormatException) e).path()).isEqualTo("metadata"));
    }

    @Test
    void rejectsSolutionThatAlsoRoutes() throws Exception {
        ObjectNode json = (ObjectNode) GuideSerializer.MAPPER.readTree(MINIMAL);
        ObjectNode answer = (ObjectNode) json.get("nodes").get("only").get("answers").get(0);
        answer.put("next_node_id", "only");

        assertThatThrownBy(() -> GuideSerializer.fromRepresentation(json))
            .isInstanceOf(GuideFormatException.class)
            .hasMessageContaining("nodes.only.answers[0].next_node_id")
            .hasMessageContaining("must not also route");
    }

    @Test
    void rejectsNodeKeyThatDiffersFromNodeId() throws Exception {
        ObjectNode json = (ObjectNode) GuideSerializer.MAPPER.readTree(MINIMAL);
        ((ObjectNode) json.get("nodes").get("only")).put("node_id", "other");

        assertThatThrownBy(() -> GuideSerializer.fromRepresentation(json))
            .isInstanceOf(GuideFormatException.class)
            .hasMessageContaining("does not match its key 'only'");
    }

    @Test
    void rejectsUnknownDifficultyAndBadDates() throws Exception {
        ObjectNode badLevel = (ObjectNode) GuideSerializer.MAPPER.readTree(MINIMAL);
        ((ObjectNode) badLevel.get("metadata")).put("difficulty_level", "Expert");
        ObjectNode badDate = (ObjectNode) GuideSerializer.MAPPER.readTree(MINIMAL);
        ((ObjectNode) badDate.get("metadata")).put("created_date", "yesterday");

        assertThatThrownBy(() -> GuideSerializer.fromRepresentation(badLevel))
            .isInstanceOf(GuideFormatException.class)
            .hasMessageContaining("metadata.difficulty_level");
        assertThatThrownBy(() -> GuideSerializer.fromRepresentation(badDate))
            .isInstanceOf(GuideFormatException.class)
            .hasMessageContaining("metadata.created_date");
    }

    @Test
    void invalidJsonTextFails() {
        assertThatThrownBy(() -> GuideSerializer.fromJson("{\"metadata\": "))
            .isInstanceOf(GuideFormatException.class)
            .hasMessageContaining("Invalid JSON");
    }
}
