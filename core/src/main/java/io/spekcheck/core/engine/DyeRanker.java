package io.spekcheck.core.engine;

import io.spekcheck.core.collection.LazyCollection;
import io.spekcheck.core.model.Dye;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.ToDoubleFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores every dye of a collection against the excitation and paths of a setup and keeps the best
 * ones per figure of merit.
 *
 * <p>
 * Computation happens on a copy of the setup, so the caller's setup and its listeners are not
 * touched. Dyes that fail to load, are invalid, or yield {@code NaN} sort last.
 */
public final class DyeRanker {

    private static final Logger LOG = LoggerFactory.getLogger(DyeRanker.class);

    private final LazyCollection<Dye> dyes;

    public DyeRanker(LazyCollection<Dye> dyes) {
        this.dyes = Objects.requireNonNull(dyes, "dyes must not be null");
    }

    /**
     * @param setup excitation source and paths to score against; its dye is ignored
     * @param top   number of dyes kept per figure of merit
     * @return a future completed once every dye has been fetched and scored
     */
    public CompletableFuture<DyeRanking> rank(Setup setup, int top) {
        Objects.requireNonNull(setup, "setup must not be null");
        if (top < 0) {
            throw new IllegalArgumentException("top must not be negative: " + top);
        }
        List<String> uids = dyes.keys();
        List<CompletableFuture<Dye>> fetches = new ArrayList<>(uids.size());
        for (String uid : uids) {
            // a failed dye is scored as unavailable, not a failure of the ranking
            fetches.add(dyes.get(uid).exceptionally(error -> null));
        }
        Setup scratch = setup.copy();
        return CompletableFuture.allOf(fetches.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<DyeScore> scores = new ArrayList<>(uids.size());
                    for (int i = 0; i < uids.size(); i++) {
                        scores.add(score(scratch, uids.get(i), fetches.get(i).join()));
                    }
                    LOG.debug("Scored {} dyes", scores.size());
                    return new DyeRanking(
                            best(scores, DyeScore::exEfficiency, top),
                            best(scores, DyeScore::emEfficiency, top),
                            best(scores, DyeScore::brightness, top));
                });
    }

    /** Scores one dye; {@code scratch} is reused across dyes and only its dye changes. */
    static DyeScore score(Setup scratch, String uid, Dye dye) {
        if (dye == null) {
            return DyeScore.unavailable(uid);
        }
        if (!dye.isValid()) {
            LOG.warn("Skipping invalid dye '{}': {}", uid, dye.validationError());
            return DyeScore.unavailable(uid);
        }
        scratch.setDye(dye);
        double em = scratch.emEfficiency();
        if (scratch.excitation() == null) {
            return new DyeScore(uid, Double.NaN, em, Double.NaN);
        }
        return new DyeScore(uid, scratch.exEfficiency(), em, scratch.brightness());
    }

    static List<DyeScore> best(List<DyeScore> scores, ToDoubleFunction<DyeScore> metric, int top) {
        List<DyeScore> sorted = new ArrayList<>(scores);
        sorted.sort(descendingNaNLast(metric).thenComparing(DyeScore::dye));
        return sorted.subList(0, Math.min(top, sorted.size()));
    }

    private static Comparator<DyeScore> descendingNaNLast(ToDoubleFunction<DyeScore> metric) {
        return (a, b) -> {
            double x = metric.applyAsDouble(a);
            double y = metric.applyAsDouble(b);
            if (Double.isNaN(x) || Double.isNaN(y)) {
                return Boolean.compare(Double.isNaN(x), Double.isNaN(y));
            }
            return Double.compare(y, x);
        };
    }
}
