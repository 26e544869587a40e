package io.spekcheck.core.collection;

import io.spekcheck.core.model.Detector;
import io.spekcheck.core.model.Dye;
import io.spekcheck.core.model.Excitation;
import io.spekcheck.core.model.Filter;
import io.spekcheck.core.model.SetupDescription;
import java.util.Objects;

/**
 * Everything the application can pick from: the four entity collections and the saved setups.
 *
 * @param dyes        dyes by uid
 * @param excitations excitation sources by uid
 * @param filters     filters and dichroics by uid
 * @param detectors   detectors by uid
 * @param setups      saved setup descriptions by setup uid
 */
public record Catalog(
        LazyCollection<Dye> dyes,
        LazyCollection<Excitation> excitations,
        LazyCollection<Filter> filters,
        LazyCollection<Detector> detectors,
        ObservableCollection<String, SetupDescription> setups) {

    public Catalog {
        Objects.requireNonNull(dyes, "dyes must not be null");
        Objects.requireNonNull(excitations, "excitations must not be null");
        Objects.requireNonNull(filters, "filters must not be null");
        Objects.requireNonNull(detectors, "detectors must not be null");
        Objects.requireNonNull(setups, "setups must not be null");
    }
}
