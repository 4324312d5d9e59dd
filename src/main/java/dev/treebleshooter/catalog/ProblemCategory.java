package dev.treebleshooter.catalog;

import java.util.ArrayList;
import java.util.List;

/**
 * A group of related problems for one product, listing the guides that address them.
 */
public record ProblemCategory(
    String categoryId,
    String categoryName,
    String description,
    String iconName, // nullable
    List<String> guideIds
) {
    public ProblemCategory {
        guideIds = guideIds == null ? List.of() : List.copyOf(guideIds);
    }

    public ProblemCategory withGuide(String guideId) {
        if (guideIds.contains(guideId)) {
            return this;
        }
        var copy = new ArrayList<>(guideIds);
        copy.add(guideId);
        return new ProblemCategory(categoryId, categoryName, description, iconName, copy);
    }

    public ProblemCategory withoutGuide(String guideId) {
        var copy = new ArrayList<>(guideIds);
        return copy.remove(guideId)
            ? new ProblemCategory(categoryId, categoryName, description, iconName, copy)
            : this;
    }
}
