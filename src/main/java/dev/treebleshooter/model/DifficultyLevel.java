package dev.treebleshooter.model;

import java.util.Arrays;

/**
 * How much experience a guide expects from the person following it.
 */
public enum DifficultyLevel {
    BEGINNER("Beginner"),
    INTERMEDIATE("Intermediate"),
    ADVANCED("Advanced");

    private final String label;

    DifficultyLevel(String label) {
        this.label = label;
    }

    /** The persisted and displayed form, e.g. {@code "Beginner"}. */
    public String label() {
        return label;
    }

    public static DifficultyLevel fromLabel(String label) {
        return Arrays.stream(values())
            .filter(level -> level.label.equals(label))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown difficulty level: " + label));
    }
}
