package dev.treebleshooter.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A product that has troubleshooting guides, grouped by problem category.
 */
public record Product(
    String productId,
    String productName,
    String description,
    String manufacturer,
    String version,
    String iconName, // nullable
    Map<String, ProblemCategory> problemCategories
) {
    public static final String DEFAULT_MANUFACTURER = "Generic Corp";
    public static final String DEFAULT_VERSION = "1.0";

    public Product {
        problemCategories = Collections.unmodifiableMap(problemCategories == null
            ? new LinkedHashMap<String, ProblemCategory>()
            : new LinkedHashMap<String, ProblemCategory>(problemCategories));
    }

    public Product withCategory(ProblemCategory category) {
        var copy = new LinkedHashMap<>(problemCategories);
        copy.put(category.categoryId(), category);
        return new Product(productId, productName, description, manufacturer, version, iconName, copy);
    }

    /** Returns a copy without the category, or this product if it has no such category. */
    public Product withoutCategory(String categoryId) {
        if (!problemCategories.containsKey(categoryId)) {
            return this;
        }
        var copy = new LinkedHashMap<>(problemCategories);
        copy.remove(categoryId);
        return new Product(productId, productName, description, manufacturer, version, iconName, copy);
    }

    public Optional<ProblemCategory> category(String categoryId) {
        return Optional.ofNullable(problemCategories.get(categoryId));
    }

    /** Guide ids across all categories, in category order. */
    public List<String> allGuideIds() {
        var ids = new ArrayList<String>();
        problemCategories.values().forEach(c -> ids.addAll(c.guideIds()));
        return ids;
    }
}
