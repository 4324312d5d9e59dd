package dev.treebleshooter.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.treebleshooter.engine.GuideFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the product catalog JSON file.
 */
public final class CatalogLoader {

    private static final Logger logger = LoggerFactory.getLogger(CatalogLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CatalogLoader() {}

    public static ProductCatalog loadFromFile(Path path) throws IOException {
        ProductCatalog catalog = loadFromString(Files.readString(path, StandardCharsets.UTF_8));
        logger.info("Loaded catalog with {} products from {}", catalog.products().size(), path);
        return catalog;
    }

    public static ProductCatalog loadFromString(String json) throws GuideFormatException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new GuideFormatException("$", "Invalid JSON: " + e.getOriginalMessage(), e);
        }
        return parseCatalog(root);
    }

    public static void save(ProductCatalog catalog, Path path) throws IOException {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode products = root.putObject("products");
        for (Product product : catalog.products().values()) {
            ObjectNode p = products.putObject(product.productId());
            p.put("product_id", product.productId());
            p.put("product_name", product.productName());
            p.put("description", product.description());
            p.put("manufacturer", product.manufacturer());
            p.put("version", product.version());
            p.put("icon_name", product.iconName());
            ObjectNode categories = p.putObject("problem_categories");
            for (ProblemCategory category : product.problemCategories().values()) {
                ObjectNode c = categories.putObject(category.categoryId());
                c.put("category_id", category.categoryId());
                c.put("category_name", category.categoryName());
                c.put("description", category.description());
                c.put("icon_name", category.iconName());
                category.guideIds().forEach(c.putArray("guide_ids")::add);
            }
        }
        root.put("last_updated", catalog.lastUpdated().toString());
        Files.createDirectories(path.toAbsolutePath().getParent());
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), root);
        logger.info("Saved catalog to {}", path);
    }

    private static ProductCatalog parseCatalog(JsonNode root) throws GuideFormatException {
        if (root == null || !root.isObject()) {
            throw new GuideFormatException("$", "expected a JSON object");
        }
        LocalDateTime lastUpdated = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);
        if (root.hasNonNull("last_updated")) {
            try {
                lastUpdated = LocalDateTime.parse(root.get("last_updated").asText());
            } catch (DateTimeParseException e) {
                throw new GuideFormatException("last_updated", "not an ISO-8601 date-time", e);
            }
        }
        List<Product> products = new ArrayList<>();
        for (var entry : root.path("products").properties()) {
            products.add(parseProduct(entry.getValue(), "products." + entry.getKey()));
        }
        return new ProductCatalog(lastUpdated, products);
    }

    private static Product parseProduct(JsonNode node, String path) throws GuideFormatException {
        Map<String, ProblemCategory> categories = new LinkedHashMap<>();
        for (var entry : node.path("problem_categories").properties()) {
            ProblemCategory category = parseCategory(entry.getValue(), path + ".problem_categories." + entry.getKey());
            categories.put(category.categoryId(), category);
        }
        return new Product(
            text(node, "product_id", path),
            text(node, "product_name", path),
            text(node, "description", path),
            node.hasNonNull("manufacturer") ? node.get("manufacturer").asText() : Product.DEFAULT_MANUFACTURER,
            node.hasNonNull("version") ? node.get("version").asText() : Product.DEFAULT_VERSION,
            node.hasNonNull("icon_name") ? node.get("icon_name").asText() : null,
            categories
        );
    }

    private static ProblemCategory parseCategory(JsonNode node, String path) throws GuideFormatException {
        List<String> guideIds = new ArrayList<>();
        node.path("guide_ids").forEach(id -> guideIds.add(id.asText()));
        return new ProblemCategory(
            text(node, "category_id", path),
            text(node, "category_name", path),
            text(node, "description", path),
            node.hasNonNull("icon_name") ? node.get("icon_name").asText() : null,
            guideIds
        );
    }

    private static String text(JsonNode node, String key, String path) throws GuideFormatException {
        JsonNode value = node.get(key);
        if (value == null || !value.isTextual()) {
            throw new GuideFormatException(path + "." + key, "missing or non-string value");
        }
        return value.asText();
    }
}
