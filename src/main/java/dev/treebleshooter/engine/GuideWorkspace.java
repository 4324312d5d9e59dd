package dev.treebleshooter.engine;

import dev.treebleshooter.model.Guide;
import dev.treebleshooter.model.GuideLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds the active guide. A replacement guide is fully parsed and validated before
 * it is swapped in; a failed load leaves the active guide exactly as it was.
 */
public final class GuideWorkspace {

    private static final Logger logger = LoggerFactory.getLogger(GuideWorkspace.class);

    private final GuideLimits limits;
    private Guide active;
    private Path activePath;

    public GuideWorkspace(GuideLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    /**
     * Load a guide file and make it active if it has no validation errors.
     *
     * @return all findings for the loaded guide; if any is an error, the guide was refused
     * @throws IOException if the file cannot be read or is malformed; the active guide is kept
     */
    public List<ValidationFinding> open(Path path) throws IOException {
        Guide candidate;
        try {
            candidate = GuideLoader.loadFromFile(path);
        } catch (IOException e) {
            logger.warn("Could not load guide from {}, keeping current guide: {}", path, e.getMessage());
            throw e;
        }
        List<ValidationFinding> findings = activate(candidate);
        if (!ValidationFinding.hasErrors(findings)) {
            activePath = path;
        }
        return findings;
    }

    /**
     * Make an in-memory guide active if it has no validation errors.
     *
     * @return all findings for the guide; if any is an error, the guide was refused
     */
    public List<ValidationFinding> activate(Guide guide) {
        List<ValidationFinding> findings = GuideValidator.validate(guide, limits);
        if (ValidationFinding.hasErrors(findings)) {
            logger.warn("Refusing guide '{}': {} validation error(s)",
                guide.metadata().title(), ValidationFinding.errors(findings).size());
            return findings;
        }
        active = guide;
        activePath = null;
        logger.info("Active guide is now '{}'", guide.metadata().title());
        return findings;
    }

    /**
     * Write the active guide to {@code path}, or to the file it was opened from when
     * {@code path} is null.
     */
    public Path save(Path path) throws IOException {
        Guide guide = active().orElseThrow(() -> new IllegalStateException("No active guide to save"));
        Path target = path != null ? path : activePath;
        if (target == null) {
            throw new IllegalStateException("Active guide has no file; a path is required");
        }
        GuideLoader.save(guide, target);
        activePath = target;
        return target;
    }

    /**
     * A navigator already started on the active guide.
     */
    public GuideNavigator newNavigator() {
        Guide guide = active().orElseThrow(() -> new IllegalStateException("No active guide"));
        var navigator = new GuideNavigator(limits);
        navigator.start(guide);
        return navigator;
    }

    public Optional<Guide> active() {
        return Optional.ofNullable(active);
    }

    public Optional<Path> activePath() {
        return Optional.ofNullable(activePath);
    }

    public GuideLimits limits() {
        return limits;
    }
}
