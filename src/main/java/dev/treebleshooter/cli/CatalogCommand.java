package dev.treebleshooter.cli;

import dev.treebleshooter.catalog.CatalogLoader;
import dev.treebleshooter.catalog.ProblemCategory;
import dev.treebleshooter.catalog.Product;
import dev.treebleshooter.catalog.ProductCatalog;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "catalog", mixinStandardHelpOptions = true,
    description = "Show the products, problem categories and guides in a catalog file.")
class CatalogCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", defaultValue = "data/product_catalog.json",
        description = "Catalog file (default: ${DEFAULT-VALUE})")
    Path file;

    @Option(names = "--find", description = "Only report where this guide id is filed")
    String guideId;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        ProductCatalog catalog;
        try {
            catalog = CatalogLoader.loadFromFile(file);
        } catch (IOException e) {
            spec.commandLine().getErr().println("Cannot read catalog: " + e.getMessage());
            return 1;
        }

        if (guideId != null) {
            return catalog.findGuideLocation(guideId)
                .map(location -> {
                    out.printf("%s is filed under %s / %s%n", guideId, location.productId(), location.categoryId());
                    return 0;
                })
                .orElseGet(() -> {
                    out.printf("%s is not in the catalog%n", guideId);
                    return 1;
                });
        }

        for (Product product : catalog.products().values()) {
            out.printf("%s (%s, v%s)%n", product.productName(), product.manufacturer(), product.version());
            for (ProblemCategory category : product.problemCategories().values()) {
                out.printf("  %s: %s%n", category.categoryName(), String.join(", ", category.guideIds()));
            }
        }
        ProductCatalog.Statistics stats = catalog.statistics();
        out.printf("%d product(s), %d categories, %d guide(s)%n",
            stats.totalProducts(), stats.totalCategories(), stats.totalGuides());
        return 0;
    }
}
