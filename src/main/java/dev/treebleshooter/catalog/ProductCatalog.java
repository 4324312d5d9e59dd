package dev.treebleshooter.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Products and the guides filed under them. Constructed explicitly and passed to
 * whoever needs it; there is no shared global instance.
 */
public final class ProductCatalog {

    private static final Logger logger = LoggerFactory.getLogger(ProductCatalog.class);

    /** Where a guide is filed. */
    public record GuideLocation(String productId, String categoryId) {}

    public record Statistics(int totalProducts, int totalCategories, int totalGuides, LocalDateTime lastUpdated) {}

    private final Map<String, Product> products = new LinkedHashMap<>();
    private LocalDateTime lastUpdated;

    public ProductCatalog() {
        this(LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS), List.of());
    }

    public ProductCatalog(LocalDateTime lastUpdated, Collection<Product> initialProducts) {
        this.lastUpdated = lastUpdated;
        initialProducts.forEach(p -> products.put(p.productId(), p));
    }

    public void addProduct(Product product) {
        products.put(product.productId(), product);
        lastUpdated = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);
        logger.debug("Added product '{}' to catalog", product.productName());
    }

    public boolean removeProduct(String productId) {
        if (products.remove(productId) == null) {
            return false;
        }
        lastUpdated = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);
        logger.debug("Removed product {} from catalog", productId);
        return true;
    }

    public Optional<Product> product(String productId) {
        return Optional.ofNullable(products.get(productId));
    }

    /** Case-insensitive lookup by display name. */
    public Optional<Product> productByName(String name) {
        return products.values().stream()
            .filter(p -> p.productName().equalsIgnoreCase(name))
            .findFirst();
    }

    public Optional<GuideLocation> findGuideLocation(String guideId) {
        for (Product product : products.values()) {
            for (ProblemCategory category : product.problemCategories().values()) {
                if (category.guideIds().contains(guideId)) {
                    return Optional.of(new GuideLocation(product.productId(), category.categoryId()));
                }
            }
        }
        return Optional.empty();
    }

    public Statistics statistics() {
        int categories = products.values().stream().mapToInt(p -> p.problemCategories().size()).sum();
        int guides = products.values().stream().mapToInt(p -> p.allGuideIds().size()).sum();
        return new Statistics(products.size(), categories, guides, lastUpdated);
    }

    public Map<String, Product> products() {
        return Collections.unmodifiableMap(products);
    }

    public LocalDateTime lastUpdated() {
        return lastUpdated;
    }
}
