package dev.treebleshooter.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.treebleshooter.model.Answer;
import dev.treebleshooter.model.DifficultyLevel;
import dev.treebleshooter.model.Guide;
import dev.treebleshooter.model.GuideMetadata;
import dev.treebleshooter.model.Node;

import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts guides to and from the {@code .tsg} JSON tree. The key names are the
 * file format; renaming one breaks every saved guide.
 * <p>
 * Reading is all-or-nothing: the first malformed key aborts with a
 * {@link GuideFormatException} naming its path. Unknown keys are ignored.
 */
public final class GuideSerializer {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private GuideSerializer() {}

    public static ObjectNode toRepresentation(Guide guide) {
        ObjectNode root = MAPPER.createObjectNode();
        root.set("metadata", writeMetadata(guide.metadata()));
        root.put("root_node_id", guide.rootNodeId());
        ObjectNode nodes = root.putObject("nodes");
        for (var entry : guide.nodes().entrySet()) {
            nodes.set(entry.getKey(), writeNode(entry.getValue()));
        }
        return root;
    }

    public static String toJson(Guide guide) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toRepresentation(guide));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write guide '" + guide.metadata().title() + "'", e);
        }
    }

    public static Guide fromJson(String json) throws GuideFormatException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new GuideFormatException("$", "Invalid JSON: " + e.getOriginalMessage(), e);
        }
        return fromRepresentation(root);
    }

    public static Guide fromRepresentation(JsonNode root) throws GuideFormatException {
        if (root == null || !root.isObject()) {
            throw new GuideFormatException("$", "expected a JSON object");
        }
        GuideMetadata metadata = readMetadata(requiredObject(root, "metadata", ""));
        String rootNodeId = nullableText(root, "root_node_id", "", true);

        JsonNode nodesNode = requiredObject(root, "nodes", "");
        Map<String, Node> nodes = new LinkedHashMap<>();
        for (var entry : nodesNode.properties()) {
            String path = "nodes." + entry.getKey();
            if (!entry.getValue().isObject()) {
                throw new GuideFormatException(path, "expected an object");
            }
            Node node = readNode(entry.getValue(), path);
            if (!entry.getKey().equals(node.nodeId())) {
                throw new GuideFormatException(path + ".node_id",
                    "'%s' does not match its key '%s'".formatted(node.nodeId(), entry.getKey()));
            }
            nodes.put(entry.getKey(), node);
        }
        return new Guide(metadata, nodes, rootNodeId);
    }

    private static ObjectNode writeMetadata(GuideMetadata metadata) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("title", metadata.title());
        node.put("description", metadata.description());
        node.put("author", metadata.author());
        node.put("version", metadata.version());
        node.put("created_date", format(metadata.createdDate()));
        node.put("last_modified_date", format(metadata.lastModifiedDate()));
        ArrayNode tags = node.putArray("tags");
        metadata.tags().forEach(tags::add);
        node.put("difficulty_level", metadata.difficultyLevel().label());
        node.put("estimated_time_minutes", metadata.estimatedTimeMinutes());
        return node;
    }

    private static ObjectNode writeNode(Node node) {
        ObjectNode out = MAPPER.createObjectNode();
        out.put("node_id", node.nodeId());
        out.put("question", node.question());
        out.put("description", node.description());
        out.put("help_text", node.helpText());
        out.put("parent_node_id", node.parentNodeId());
        ArrayNode answers = out.putArray("answers");
        for (Answer answer : node.answers()) {
            ObjectNode a = answers.addObject();
            a.put("answer_id", answer.answerId());
            a.put("answer_text", answer.answerText());
            if (answer instanceof Answer.Route route) {
                a.put("next_node_id", route.nextNodeId());
                a.put("is_solution", false);
                a.putNull("solution_text");
            } else {
                a.putNull("next_node_id");
                a.put("is_solution", true);
                a.put("solution_text", ((Answer.Solution) answer).solutionText());
            }
        }
        return out;
    }

    private static GuideMetadata readMetadata(JsonNode node) throws GuideFormatException {
        String path = "metadata";
        String title = requiredText(node, "title", path);
        String description = requiredText(node, "description", path);
        String author = requiredText(node, "author", path);
        String version = requiredText(node, "version", path);
        LocalDateTime created = readDate(node, "created_date", path);
        LocalDateTime modified = readDate(node, "last_modified_date", path);

        JsonNode tagsNode = requiredArray(node, "tags", path);
        Set<String> tags = new LinkedHashSet<>();
        for (int i = 0; i < tagsNode.size(); i++) {
            JsonNode tag = tagsNode.get(i);
            if (!tag.isTextual()) {
                throw new GuideFormatException(path + ".tags[" + i + "]", "expected a string");
            }
            tags.add(tag.asText());
        }

        String levelText = requiredText(node, "difficulty_level", path);
        DifficultyLevel level;
        try {
            level = DifficultyLevel.fromLabel(levelText);
        } catch (IllegalArgumentException e) {
            throw new GuideFormatException(path + ".difficulty_level", e.getMessage(), e);
        }

        Integer minutes = null;
        JsonNode minutesNode = node.get("estimated_time_minutes");
        if (minutesNode != null && !minutesNode.isNull()) {
            if (!minutesNode.canConvertToInt() || !minutesNode.isIntegralNumber()) {
                throw new GuideFormatException(path + ".estimated_time_minutes", "expected an integer");
            }
            minutes = minutesNode.intValue();
        }
        return new GuideMetadata(title, description, author, version, created, modified, tags, level, minutes);
    }

    private static Node readNode(JsonNode node, String path) throws GuideFormatException {
        String nodeId = requiredText(node, "node_id", path);
        String question = requiredText(node, "question", path);
        String description = nullableText(node, "description", path, false);
        String helpText = nullableText(node, "help_text", path, false);
        String parentNodeId = nullableText(node, "parent_node_id", path, false);

        JsonNode answersNode = requiredArray(node, "answers", path);
        List<Answer> answers = new ArrayList<>(answersNode.size());
        for (int i = 0; i < answersNode.size(); i++) {
            String answerPath = path + ".answers[" + i + "]";
            JsonNode answerNode = answersNode.get(i);
            if (!answerNode.isObject()) {
                throw new GuideFormatException(answerPath, "expected an object");
            }
            answers.add(readAnswer(answerNode, answerPath));
        }
        return new Node(nodeId, question, description, helpText, parentNodeId, answers);
    }

    private static Answer readAnswer(JsonNode node, String path) throws GuideFormatException {
        String answerId = requiredText(node, "answer_id", path);
        String answerText = requiredText(node, "answer_text", path);
        JsonNode solutionFlag = node.get("is_solution");
        if (solutionFlag == null) {
            throw new GuideFormatException(path + ".is_solution", "missing required key");
        }
        if (!solutionFlag.isBoolean()) {
            throw new GuideFormatException(path + ".is_solution", "expected a boolean");
        }
        String nextNodeId = nullableText(node, "next_node_id", path, false);
        String solutionText = nullableText(node, "solution_text", path, false);

        if (solutionFlag.booleanValue()) {
            if (nextNodeId != null) {
                throw new GuideFormatException(path + ".next_node_id",
                    "solution answer must not also route to node '%s'".formatted(nextNodeId));
            }
            return new Answer.Solution(answerId, answerText, solutionText);
        }
        return new Answer.Route(answerId, answerText, nextNodeId);
    }

    private static JsonNode requiredObject(JsonNode parent, String key, String path) throws GuideFormatException {
        JsonNode value = required(parent, key, path);
        if (!value.isObject()) {
            throw new GuideFormatException(join(path, key), "expected an object");
        }
        return value;
    }

    private static JsonNode requiredArray(JsonNode parent, String key, String path) throws GuideFormatException {
        JsonNode value = required(parent, key, path);
        if (!value.isArray()) {
            throw new GuideFormatException(join(path, key), "expected an array");
        }
        return value;
    }

    private static String requiredText(JsonNode parent, String key, String path) throws GuideFormatException {
        JsonNode value = required(parent, key, path);
        if (!value.isTextual()) {
            throw new GuideFormatException(join(path, key), "expected a string");
        }
        return value.asText();
    }

    /**
     * A string that may be null. When {@code keyRequired} is false the key may also be absent.
     */
    private static String nullableText(JsonNode parent, String key, String path, boolean keyRequired)
            throws GuideFormatException {
        JsonNode value = keyRequired ? required(parent, key, path) : parent.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new GuideFormatException(join(path, key), "expected a string or null");
        }
        return value.asText();
    }

    private static JsonNode required(JsonNode parent, String key, String path) throws GuideFormatException {
        JsonNode value = parent.get(key);
        if (value == null) {
            throw new GuideFormatException(join(path, key), "missing required key");
        }
        return value;
    }

    private static LocalDateTime readDate(JsonNode parent, String key, String path) throws GuideFormatException {
        String text = requiredText(parent, key, path);
        try {
            return LocalDateTime.parse(text, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new GuideFormatException(join(path, key), "not an ISO-8601 date-time: " + text, e);
        }
    }

    private static String format(LocalDateTime dateTime) {
        return dateTime == null ? null : DATE_FORMAT.format(dateTime);
    }

    private static String join(String path, String key) {
        return path.isEmpty() ? key : path + "." + key;
    }
}
