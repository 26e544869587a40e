package io.spekcheck.core.engine;

import io.spekcheck.core.collection.Catalog;
import io.spekcheck.core.collection.LazyCollection;
import io.spekcheck.core.error.InvalidSetupException;
import io.spekcheck.core.model.Detector;
import io.spekcheck.core.model.Dye;
import io.spekcheck.core.model.Excitation;
import io.spekcheck.core.model.Filter;
import io.spekcheck.core.model.FilterPosition;
import io.spekcheck.core.model.PathElement;
import io.spekcheck.core.model.SetupDescription;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link SetupDescription} back into a live {@link Setup} by fetching every entity it
 * names from a {@link Catalog}.
 *
 * <p>
 * The setup is only modified once every entity has been fetched, in one step and with a single
 * change event. If any fetch fails the returned future fails with that error and the setup is left
 * untouched. The setup is updated on the thread that completes the last fetch, so callers that
 * share the setup with other code should wait on the returned future before touching it.
 */
public final class SetupResolver {

    private static final Logger LOG = LoggerFactory.getLogger(SetupResolver.class);

    private final Catalog catalog;

    public SetupResolver(Catalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    /** Builds a new setup from {@code description}. */
    public CompletableFuture<Setup> resolve(SetupDescription description) {
        return apply(new Setup(), description, false);
    }

    public CompletableFuture<Setup> apply(Setup setup, SetupDescription description) {
        return apply(setup, description, false);
    }

    /**
     * Replaces the content of {@code setup} with the entities named in {@code description}.
     *
     * @param keepDye keep the dye already set on {@code setup}, e.g. one picked by the user, and
     *                ignore the description's dye; has no effect when the setup has no dye
     * @return a future completed with {@code setup}, or failed with the first fetch error
     */
    public CompletableFuture<Setup> apply(Setup setup, SetupDescription description, boolean keepDye) {
        Objects.requireNonNull(setup, "setup must not be null");
        Objects.requireNonNull(description, "description must not be null");
        String error = description.validate();
        if (error != null) {
            return CompletableFuture.failedFuture(new InvalidSetupException("Cannot apply setup: " + error));
        }

        Dye keptDye = keepDye ? setup.dye() : null;
        CompletableFuture<Detector> detector = fetch(catalog.detectors(), description.detector());
        CompletableFuture<Dye> dye = keptDye != null
                ? CompletableFuture.completedFuture(keptDye)
                : fetch(catalog.dyes(), description.dye());
        CompletableFuture<Excitation> excitation = fetch(catalog.excitations(), description.excitation());
        List<CompletableFuture<Filter>> exFilters = fetchFilters(description.exPath());
        List<CompletableFuture<Filter>> emFilters = fetchFilters(description.emPath());

        List<CompletableFuture<?>> pending = new ArrayList<>();
        pending.add(detector);
        pending.add(dye);
        pending.add(excitation);
        pending.addAll(exFilters);
        pending.addAll(emFilters);

        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    setup.load(
                            detector.join(),
                            dye.join(),
                            excitation.join(),
                            elements(description.exPath(), exFilters),
                            elements(description.emPath(), emFilters));
                    LOG.debug("Applied setup: {}", setup);
                    return setup;
                });
    }

    private List<CompletableFuture<Filter>> fetchFilters(List<FilterPosition> path) {
        List<CompletableFuture<Filter>> filters = new ArrayList<>(path.size());
        for (FilterPosition position : path) {
            filters.add(catalog.filters().get(position.filter()));
        }
        return filters;
    }

    private static List<PathElement> elements(List<FilterPosition> path, List<CompletableFuture<Filter>> filters) {
        List<PathElement> elements = new ArrayList<>(path.size());
        for (int i = 0; i < path.size(); i++) {
            elements.add(new PathElement(filters.get(i).join(), path.get(i).mode()));
        }
        return elements;
    }

    private static <V> CompletableFuture<V> fetch(LazyCollection<V> collection, String uid) {
        return uid == null ? CompletableFuture.completedFuture(null) : collection.get(uid);
    }
}
