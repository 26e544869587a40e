package io.spekcheck.core.engine;

import io.spekcheck.core.error.EmptyPathException;
import io.spekcheck.core.event.EventKind;
import io.spekcheck.core.event.ModelListener;
import io.spekcheck.core.event.Notifier;
import io.spekcheck.core.event.Observable;
import io.spekcheck.core.model.Filter;
import io.spekcheck.core.model.FilterPosition;
import io.spekcheck.core.model.Mode;
import io.spekcheck.core.model.PathElement;
import io.spekcheck.core.model.Spectrum;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered stack of filters the light goes through, each used in transmission or reflection.
 *
 * <p>
 * The combined transmission is the product of every element's active spectrum over the
 * intersection of their wavelength ranges, sampled every nanometre. It is folded lazily and
 * incrementally: the product of the first {@code k + 1} elements is kept for every {@code k}
 * already folded, so appending elements only multiplies in the new ones and changing the mode of
 * element {@code i} refolds from {@code i}. Any mutation that moves the domain throws everything
 * away.
 *
 * <p>
 * Every mutator publishes exactly one {@link EventKind#CHANGE} (none for a no-op). Instances are
 * not thread-safe.
 */
public final class FilterPath implements Observable, Iterable<PathElement> {

    private static final Logger LOG = LoggerFactory.getLogger(FilterPath.class);

    private final List<PathElement> elements = new ArrayList<>();
    private final Notifier notifier = new Notifier(this);

    // memo: null domain means nothing folded
    private double[] domain;
    private double[] domainBounds;
    private final List<double[]> prefixes = new ArrayList<>();
    private Spectrum snapshot;

    private final Map<Long, Spectrum> transmittedBySource = new HashMap<>();
    private final Map<Long, Double> efficiencyBySource = new HashMap<>();

    public FilterPath() {}

    public FilterPath(List<PathElement> initial) {
        for (PathElement element : initial) {
            elements.add(Objects.requireNonNull(element, "path element must not be null"));
        }
    }

    // --- reads ---

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public PathElement get(int index) {
        return elements.get(index);
    }

    /** Unmodifiable view of the elements, in light order. */
    public List<PathElement> elements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public Iterator<PathElement> iterator() {
        return elements().iterator();
    }

    // --- computation ---

    /**
     * Combined transmission of the whole path.
     *
     * @return an immutable snapshot; zero-length if the element ranges do not overlap
     * @throws EmptyPathException if the path has no element
     */
    public Spectrum transmission() {
        if (elements.isEmpty()) {
            throw new EmptyPathException();
        }
        if (snapshot != null) {
            return snapshot;
        }
        if (domain == null) {
            domainBounds = bounds();
            domain = grid(domainBounds);
            prefixes.clear();
            LOG.debug("Path domain set to {} samples from {} nm", domain.length, domainBounds[0]);
        }
        int from = prefixes.size();
        for (int k = from; k < elements.size(); k++) {
            double[] factor = activeSpectrum(elements.get(k)).interpolate(domain);
            double[] previous = k == 0 ? null : prefixes.get(k - 1);
            double[] next = new double[domain.length];
            for (int i = 0; i < next.length; i++) {
                next[i] = previous == null ? factor[i] : previous[i] * factor[i];
            }
            prefixes.add(next);
        }
        if (from < elements.size()) {
            LOG.debug("Folded path elements {}..{}", from, elements.size() - 1);
        }
        snapshot = new Spectrum(domain, prefixes.get(prefixes.size() - 1));
        return snapshot;
    }

    /**
     * What is left of {@code source} after going through the path, on the source's own
     * wavelengths. An empty path lets everything through.
     */
    public Spectrum transmissionOf(Spectrum source) {
        Objects.requireNonNull(source, "source must not be null");
        if (elements.isEmpty()) {
            return source.copy();
        }
        Spectrum cached = transmittedBySource.get(source.id());
        if (cached != null) {
            return cached;
        }
        Spectrum result = new Spectrum(source.wavelength(), source.multiplyBy(transmission()));
        transmittedBySource.put(source.id(), result);
        return result;
    }

    /**
     * Fraction of the source's area that passes the path: {@code 1.0} for an empty path,
     * {@code NaN} for a source with zero area.
     */
    public double efficiencyOf(Spectrum source) {
        Objects.requireNonNull(source, "source must not be null");
        if (elements.isEmpty()) {
            return 1.0;
        }
        Double cached = efficiencyBySource.get(source.id());
        if (cached != null) {
            return cached;
        }
        double efficiency = transmissionOf(source).area() / source.area();
        efficiencyBySource.put(source.id(), efficiency);
        return efficiency;
    }

    // --- mutators ---

    /** Appends elements in order. One event for the whole batch, none if it is empty. */
    public void push(PathElement... added) {
        if (added.length == 0) {
            return;
        }
        for (PathElement element : added) {
            Objects.requireNonNull(element, "path element must not be null");
        }
        int first = elements.size();
        elements.addAll(Arrays.asList(added));
        changed(first);
    }

    public void push(Filter filter, Mode mode) {
        push(new PathElement(filter, mode));
    }

    public PathElement removeAt(int index) {
        PathElement removed = elements.remove(index);
        changed(index);
        return removed;
    }

    /** Sets the mode of one element. Does nothing if it already has that mode. */
    public void setMode(int index, Mode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        PathElement current = elements.get(index);
        if (current.mode() == mode) {
            return;
        }
        elements.set(index, current.withMode(mode));
        changed(index);
    }

    public void toggleMode(int index) {
        setMode(index, elements.get(index).mode().toggle());
    }

    /** Removes every element; no event if the path is already empty. */
    public void clear() {
        if (elements.isEmpty()) {
            return;
        }
        elements.clear();
        changed(0);
    }

    /**
     * Replaces the whole content with one event. Folded prefixes shared with the new content are
     * kept. Replacing with identical content is a no-op.
     */
    public void replaceAll(List<PathElement> replacement) {
        Objects.requireNonNull(replacement, "replacement must not be null");
        for (PathElement element : replacement) {
            Objects.requireNonNull(element, "path element must not be null");
        }
        int common = 0;
        int limit = Math.min(elements.size(), replacement.size());
        while (common < limit && sameElement(elements.get(common), replacement.get(common))) {
            common++;
        }
        if (common == elements.size() && common == replacement.size()) {
            return;
        }
        elements.clear();
        elements.addAll(replacement);
        changed(common);
    }

    // --- description ---

    public List<FilterPosition> describe() {
        List<FilterPosition> positions = new ArrayList<>(elements.size());
        for (PathElement element : elements) {
            positions.add(element.describe());
        }
        return positions;
    }

    /** Same elements, cold caches, no listeners. */
    public FilterPath copy() {
        return new FilterPath(elements);
    }

    @Override
    public long subscribe(EventKind kind, ModelListener listener) {
        return notifier.subscribe(kind, listener);
    }

    @Override
    public boolean unsubscribe(long subscriptionId) {
        return notifier.unsubscribe(subscriptionId);
    }

    /** Number of elements whose product is currently cached. */
    int foldedCount() {
        return prefixes.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterPath that)) return false;
        return describe().equals(that.describe());
    }

    @Override
    public int hashCode() {
        return describe().hashCode();
    }

    @Override
    public String toString() {
        return "FilterPath" + describe();
    }

    // --- memo bookkeeping ---

    private void changed(int firstAffected) {
        invalidate(firstAffected);
        notifier.publish(EventKind.CHANGE);
    }

    private void invalidate(int firstAffected) {
        snapshot = null;
        transmittedBySource.clear();
        efficiencyBySource.clear();
        if (domain == null) {
            return;
        }
        if (elements.isEmpty() || !Arrays.equals(bounds(), domainBounds)) {
            domain = null;
            domainBounds = null;
            prefixes.clear();
            LOG.debug("Path domain changed, folded products discarded");
            return;
        }
        while (prefixes.size() > firstAffected) {
            prefixes.remove(prefixes.size() - 1);
        }
    }

    /** {@code [start, end]} of the intersection of all element ranges, NaN if one is empty. */
    private double[] bounds() {
        double start = Double.NEGATIVE_INFINITY;
        double end = Double.POSITIVE_INFINITY;
        for (PathElement element : elements) {
            Spectrum spectrum = activeSpectrum(element);
            if (spectrum.isEmpty()) {
                return new double[] {Double.NaN, Double.NaN};
            }
            start = Math.max(start, spectrum.minWavelength());
            end = Math.min(end, spectrum.maxWavelength());
        }
        return new double[] {start, end};
    }

    private static double[] grid(double[] bounds) {
        double start = bounds[0];
        double end = bounds[1];
        if (Double.isNaN(start) || Double.isNaN(end) || end < start) {
            return new double[0];
        }
        int count = (int) Math.floor(end - start) + 1;
        double[] points = new double[count];
        for (int i = 0; i < count; i++) {
            points[i] = start + i;
        }
        return points;
    }

    private static Spectrum activeSpectrum(PathElement element) {
        Spectrum spectrum = element.activeSpectrum();
        if (spectrum == null) {
            throw new IllegalStateException("Filter '" + element.filter().uid() + "' has no spectrum");
        }
        return spectrum;
    }

    private static boolean sameElement(PathElement a, PathElement b) {
        return a.filter() == b.filter() && a.mode() == b.mode();
    }
}
