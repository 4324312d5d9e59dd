package dev.treebleshooter.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.treebleshooter.model.Answer;
import dev.treebleshooter.model.Guide;
import dev.treebleshooter.model.GuideMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static dev.treebleshooter.TestGuides.diamond;
import static dev.treebleshooter.TestGuides.powerCheck;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GuideLoaderTest {

    @TempDir
    Path tempDir;

    static Path fixture(String name) throws URISyntaxException {
        return Path.of(GuideLoaderTest.class.getResource("/guides/" + name).toURI());
    }

    @Test
    void loadsGuideFromFile() throws Exception {
        Guide guide = GuideLoader.loadFromFile(fixture("power-check.tsg"));

        assertThat(guide.metadata().title()).isEqualTo("Device Will Not Power On");
        assertThat(guide.metadata().tags()).containsExactly("power", "hardware");
        assertThat(guide.metadata().estimatedTimeMinutes()).isEqualTo(5);
        assertThat(guide.metadata().lastModifiedDate())
            .isEqualTo(LocalDateTime.of(2025, 8, 16, 9, 30, 15, 250_000_000));
        assertThat(guide.rootNodeId()).isEqualTo("plugged-in");
        assertThat(guide.nodes().get("power-button").parentNodeId()).isEqualTo("plugged-in");
        assertThat(guide.nodes().get("plugged-in").answers())
            .extracting(Answer::answerText).containsExactly("No", "Yes");
        assertThat(GuideValidator.validate(guide)).isEmpty();
    }

    @Test
    void fixtureMatchesTheInMemoryGuide() throws Exception {
        Guide loaded = GuideLoader.loadFromFile(fixture("power-check.tsg"));

        assertThat(loaded.nodes().get("plugged-in").answers())
            .isEqualTo(powerCheck().nodes().get("plugged-in").answers());
        assertThat(GuideAnalyzer.statistics(loaded)).isEqualTo(GuideAnalyzer.statistics(powerCheck()));
    }

    @Test
    void saveThenLoadRoundTrips() throws Exception {
        Path file = tempDir.resolve("nested/diamond.tsg");

        GuideLoader.save(diamond(), file);
        Guide loaded = GuideLoader.loadFromFile(file);

        assertThat(loaded).isEqualTo(diamond());
        assertThat(loaded.nodes().keySet()).containsExactly("root", "A", "B", "C");
    }

    @Test
    void saveAddsFileMetadataBlock() throws Exception {
        Path file = tempDir.resolve("power.tsg");

        GuideLoader.save(powerCheck(), file);

        JsonNode json = GuideSerializer.MAPPER.readTree(file.toFile());
        assertThat(json.get("_metadata").get("application").asText()).isEqualTo("Treebleshooter");
        assertThat(json.get("_metadata").get("file_version").asText()).isEqualTo("1.0");
        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    void loadsDirectoryOfGuidesSortedByName() throws Exception {
        GuideLoader.save(diamond(), tempDir.resolve("b-diamond.tsg"));
        GuideLoader.save(powerCheck(), tempDir.resolve("a-power.json"));
        Files.writeString(tempDir.resolve("notes.txt"), "not a guide");

        var guides = GuideLoader.loadFromDirectory(tempDir);

        assertThat(guides).containsOnlyKeys("a-power.json", "b-diamond.tsg");
        assertThat(guides.keySet()).containsExactly("a-power.json", "b-diamond.tsg");
    }

    @Test
    void missingFileFails() {
        assertThatThrownBy(() -> GuideLoader.loadFromFile(tempDir.resolve("absent.tsg")))
            .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void malformedFileFailsWithFormatException() throws IOException {
        Path file = tempDir.resolve("broken.tsg");
        Files.writeString(file, "{ \"metadata\": {} }");

        assertThatThrownBy(() -> GuideLoader.loadFromFile(file))
            .isInstanceOf(GuideFormatException.class)
            .hasMessageContaining("metadata.title");
    }

    @Test
    void defaultFileNameStripsUnsafeCharacters() {
        Guide guide = Guide.create(GuideMetadata.create("Wi-Fi: won't connect?!", "x"));

        assertThat(GuideLoader.defaultFileName(guide)).isEqualTo("Wi-Fi_wont_connect.tsg");
    }
}
