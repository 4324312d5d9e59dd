package dev.treebleshooter.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.treebleshooter.model.Guide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads and writes guide files ({@code .tsg}, JSON).
 */
public final class GuideLoader {

    private static final Logger logger = LoggerFactory.getLogger(GuideLoader.class);

    public static final String GUIDE_FILE_EXTENSION = ".tsg";
    public static final String FILE_VERSION = "1.0";
    public static final String APPLICATION = "Treebleshooter";

    private GuideLoader() {}

    /**
     * Load a single guide from a file.
     *
     * @throws GuideFormatException if the content is not a well-formed guide
     * @throws IOException          if the file cannot be read
     */
    public static Guide loadFromFile(Path path) throws IOException {
        String json = Files.readString(path, StandardCharsets.UTF_8);
        Guide guide = loadFromString(json);
        logger.info("Loaded guide '{}' from {}", guide.metadata().title(), path);
        return guide;
    }

    /**
     * Load a single guide from a JSON string.
     */
    public static Guide loadFromString(String json) throws GuideFormatException {
        return GuideSerializer.fromJson(json);
    }

    /**
     * Load every guide file ({@code .tsg} or {@code .json}) in a directory, keyed by file name.
     * The first unreadable file aborts the whole load.
     */
    public static Map<String, Guide> loadFromDirectory(Path dir) throws IOException {
        var guides = new LinkedHashMap<String, Guide>();
        for (Path file : listGuideFiles(dir)) {
            guides.put(file.getFileName().toString(), loadFromFile(file));
        }
        return guides;
    }

    /**
     * Guide files in a directory, sorted by name. Subdirectories are not searched.
     */
    public static List<Path> listGuideFiles(Path dir) throws IOException {
        List<Path> files = new ArrayList<>();
        try (Stream<Path> entries = Files.list(dir)) {
            entries.filter(Files::isRegularFile)
                   .filter(p -> {
                       String name = p.getFileName().toString();
                       return name.endsWith(GUIDE_FILE_EXTENSION) || name.endsWith(".json");
                   })
                   .sorted()
                   .forEach(files::add);
        }
        logger.debug("Found {} guide files in {}", files.size(), dir);
        return files;
    }

    /**
     * Write a guide to {@code path}. The content goes to a temporary sibling first and is
     * then moved into place, so readers never see a half-written file.
     */
    public static void save(Guide guide, Path path) throws IOException {
        ObjectNode root = GuideSerializer.toRepresentation(guide);
        ObjectNode fileInfo = root.putObject("_metadata");
        fileInfo.put("file_version", FILE_VERSION);
        fileInfo.put("saved_date", DateTimeFormatter.ISO_LOCAL_DATE_TIME
            .format(LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS)));
        fileInfo.put("application", APPLICATION);

        Path target = path.toAbsolutePath();
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), ".guide-", ".tmp");
        try {
            GuideSerializer.MAPPER.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), root);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported for {}, falling back to replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.info("Saved guide '{}' to {}", guide.metadata().title(), target);
    }

    /**
     * File name derived from the guide title: letters, digits, space, '-' and '_' are kept,
     * spaces become underscores.
     */
    public static String defaultFileName(Guide guide) {
        var sb = new StringBuilder();
        for (char c : guide.metadata().title().toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_') {
                sb.append(c);
            }
        }
        String safe = sb.toString().strip().replace(' ', '_');
        return (safe.isEmpty() ? "guide" : safe) + GUIDE_FILE_EXTENSION;
    }
}
