package dev.treebleshooter.catalog;

import dev.treebleshooter.engine.GuideFormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsCatalogFromJsonString() throws Exception {
        String json = """
            {
              "products": {
                "procrastination-station": {
                  "product_id": "procrastination-station",
                  "product_name": "Procrastination Station Pro",
                  "description": "Helps you avoid being productive",
                  "problem_categories": {
                    "too-productive": {
                      "category_id": "too-productive",
                      "category_name": "Accidental Productivity",
                      "description": "When you accidentally get work done",
                      "guide_ids": ["accidentally-finished-task", "inbox-zero-panic"]
                    }
                  }
                }
              },
              "last_updated": "2025-08-15T10:00:00"
            }
            """;

        ProductCatalog catalog = CatalogLoader.loadFromString(json);

        Product product = catalog.product("procrastination-station").orElseThrow();
        assertThat(product.manufacturer()).isEqualTo(Product.DEFAULT_MANUFACTURER);
        assertThat(product.version()).isEqualTo(Product.DEFAULT_VERSION);
        assertThat(product.allGuideIds()).containsExactly("accidentally-finished-task", "inbox-zero-panic");
        assertThat(catalog.lastUpdated()).isEqualTo(LocalDateTime.of(2025, 8, 15, 10, 0));
    }

    @Test
    void missingRequiredFieldNamesItsPath() {
        String json = """
            { "products": { "p1": { "product_id": "p1", "description": "no name" } } }
            """;

        assertThatThrownBy(() -> CatalogLoader.loadFromString(json))
            .isInstanceOf(GuideFormatException.class)
            .hasMessageContaining("products.p1.product_name");
    }

    @Test
    void saveThenLoad() throws Exception {
        var category = new ProblemCategory("c1", "Category", "Things", "icon", List.of("g1"));
        var product = new Product("p1", "Product", "Stuff", "Maker", "2.0", null, null).withCategory(category);
        var catalog = new ProductCatalog(LocalDateTime.of(2025, 1, 1, 12, 0), List.of(product));
        Path file = tempDir.resolve("catalog.json");

        CatalogLoader.save(catalog, file);
        ProductCatalog loaded = CatalogLoader.loadFromFile(file);

        assertThat(loaded.products()).isEqualTo(catalog.products());
        assertThat(loaded.lastUpdated()).isEqualTo(catalog.lastUpdated());
    }
}
