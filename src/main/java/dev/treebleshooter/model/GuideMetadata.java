package dev.treebleshooter.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Descriptive information about a guide. Carries nothing that affects traversal.
 * <p>
 * Only {@code estimatedTimeMinutes} may be null. A missing description becomes empty,
 * a missing author, version or difficulty takes its default, and missing dates are now.
 */
public record GuideMetadata(
    String title,
    String description,
    String author,
    String version,
    LocalDateTime createdDate,
    LocalDateTime lastModifiedDate,
    Set<String> tags,
    DifficultyLevel difficultyLevel,
    Integer estimatedTimeMinutes // nullable
) {
    private static final Logger logger = LoggerFactory.getLogger(GuideMetadata.class);

    public static final String DEFAULT_AUTHOR = "Unknown";
    public static final String DEFAULT_VERSION = "1.0.0";

    /** Which part of a semantic version to increment. */
    public enum Bump { MAJOR, MINOR, PATCH }

    public GuideMetadata {
        Objects.requireNonNull(title, "title");
        description = description == null ? "" : description;
        author = author == null ? DEFAULT_AUTHOR : author;
        version = version == null ? DEFAULT_VERSION : version;
        if (createdDate == null || lastModifiedDate == null) {
            LocalDateTime now = now();
            createdDate = createdDate == null ? now : createdDate;
            lastModifiedDate = lastModifiedDate == null ? createdDate : lastModifiedDate;
        }
        difficultyLevel = difficultyLevel == null ? DifficultyLevel.BEGINNER : difficultyLevel;
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    /**
     * Metadata for a brand-new guide, created and modified now.
     */
    public static GuideMetadata create(String title, String description) {
        LocalDateTime now = now();
        return new GuideMetadata(title, description, DEFAULT_AUTHOR, DEFAULT_VERSION,
            now, now, Set.of(), DifficultyLevel.BEGINNER, null);
    }

    public GuideMetadata touched() {
        return new GuideMetadata(title, description, author, version, createdDate, now(),
            tags, difficultyLevel, estimatedTimeMinutes);
    }

    public GuideMetadata withAuthor(String newAuthor) {
        return new GuideMetadata(title, description, newAuthor, version, createdDate, lastModifiedDate,
            tags, difficultyLevel, estimatedTimeMinutes);
    }

    public GuideMetadata withDifficulty(DifficultyLevel level, Integer minutes) {
        return new GuideMetadata(title, description, author, version, createdDate, lastModifiedDate,
            tags, level, minutes);
    }

    public GuideMetadata withTag(String tag) {
        if (tags.contains(tag)) {
            return this;
        }
        var copy = new LinkedHashSet<>(tags);
        copy.add(tag);
        return new GuideMetadata(title, description, author, version, createdDate, lastModifiedDate,
            copy, difficultyLevel, estimatedTimeMinutes);
    }

    public GuideMetadata withoutTag(String tag) {
        if (!tags.contains(tag)) {
            return this;
        }
        var copy = new LinkedHashSet<>(tags);
        copy.remove(tag);
        return new GuideMetadata(title, description, author, version, createdDate, lastModifiedDate,
            copy, difficultyLevel, estimatedTimeMinutes);
    }

    /**
     * Increment the version. Anything that is not three dot-separated integers resets to 1.0.0.
     */
    public GuideMetadata withVersionBump(Bump bump) {
        String[] parts = version.split("\\.");
        String next;
        try {
            if (parts.length != 3) {
                throw new NumberFormatException("expected MAJOR.MINOR.PATCH");
            }
            int major = Integer.parseInt(parts[0]);
            int minor = Integer.parseInt(parts[1]);
            int patch = Integer.parseInt(parts[2]);
            next = switch (bump) {
                case MAJOR -> (major + 1) + ".0.0";
                case MINOR -> major + "." + (minor + 1) + ".0";
                case PATCH -> major + "." + minor + "." + (patch + 1);
            };
        } catch (NumberFormatException e) {
            logger.warn("Invalid version '{}' on guide '{}', resetting to {}", version, title, DEFAULT_VERSION);
            next = DEFAULT_VERSION;
        }
        return new GuideMetadata(title, description, author, next, createdDate, now(),
            tags, difficultyLevel, estimatedTimeMinutes);
    }

    // Second precision keeps the persisted timestamps readable.
    private static LocalDateTime now() {
        return LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);
    }
}
