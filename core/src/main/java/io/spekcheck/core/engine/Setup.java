package io.spekcheck.core.engine;

import io.spekcheck.core.error.InvalidSetupException;
import io.spekcheck.core.error.MissingInputsException;
import io.spekcheck.core.event.EventKind;
import io.spekcheck.core.event.ModelListener;
import io.spekcheck.core.event.Notifier;
import io.spekcheck.core.event.Observable;
import io.spekcheck.core.model.Detector;
import io.spekcheck.core.model.Dye;
import io.spekcheck.core.model.Excitation;
import io.spekcheck.core.model.PathElement;
import io.spekcheck.core.model.SetupDescription;
import io.spekcheck.core.model.Spectrum;
import java.util.ArrayList;
import java.util.List;

/**
 * A microscope configuration: excitation source, excitation path, dye, emission path and detector.
 *
 * <p>
 * Entities are shared references taken from the catalog; the two paths belong to this setup. Any
 * change to an entity or to one of the paths is published as a single {@link EventKind#CHANGE} on
 * the setup. Quantities are recomputed on every call; the paths memoize the expensive parts.
 *
 * <p>
 * Not thread-safe.
 */
public final class Setup implements Observable {

    private final Notifier notifier = new Notifier(this);
    private final FilterPath exPath;
    private final FilterPath emPath;

    private Detector detector;
    private Dye dye;
    private Excitation excitation;

    private boolean muted;

    public Setup() {
        this(new FilterPath(), new FilterPath());
    }

    private Setup(FilterPath exPath, FilterPath emPath) {
        this.exPath = exPath;
        this.emPath = emPath;
        ModelListener forward = event -> {
            if (!muted) {
                notifier.publish(EventKind.CHANGE);
            }
        };
        exPath.subscribe(EventKind.CHANGE, forward);
        emPath.subscribe(EventKind.CHANGE, forward);
    }

    public Detector detector() {
        return detector;
    }

    public Dye dye() {
        return dye;
    }

    public Excitation excitation() {
        return excitation;
    }

    /** Path from the light source to the sample. */
    public FilterPath exPath() {
        return exPath;
    }

    /** Path from the sample to the detector. */
    public FilterPath emPath() {
        return emPath;
    }

    public void setDetector(Detector detector) {
        this.detector = detector;
        notifier.publish(EventKind.CHANGE);
    }

    public void setDye(Dye dye) {
        this.dye = dye;
        notifier.publish(EventKind.CHANGE);
    }

    public void setExcitation(Excitation excitation) {
        this.excitation = excitation;
        notifier.publish(EventKind.CHANGE);
    }

    /** Excitation light reaching the sample, or {@code null} without an excitation source. */
    public Spectrum exTransmission() {
        if (excitation == null) {
            return null;
        }
        if (exPath.isEmpty()) {
            return excitation.intensity();
        }
        return exPath.transmissionOf(excitation.intensity());
    }

    /** Dye emission reaching the detector, or {@code null} without a dye. */
    public Spectrum emTransmission() {
        if (dye == null) {
            return null;
        }
        if (emPath.isEmpty()) {
            return dye.emission();
        }
        return emPath.transmissionOf(dye.emission());
    }

    /**
     * Fraction of the source light that reaches the sample and is absorbed by the dye, relative to
     * the total source intensity.
     *
     * @throws MissingInputsException without a dye or an excitation source
     */
    public double exEfficiency() {
        requireDyeAndExcitation("ex_efficiency");
        Spectrum transmitted = exTransmission();
        double[] absorbed = transmitted.multiplyBy(dye.excitation());
        double absorbedArea = new Spectrum(transmitted.wavelength(), absorbed).area();
        return absorbedArea / excitation.intensity().area();
    }

    /**
     * Fraction of the dye emission that passes the emission path.
     *
     * @throws MissingInputsException without a dye
     */
    public double emEfficiency() {
        if (dye == null) {
            throw new MissingInputsException("em_efficiency", List.of("dye"));
        }
        return emPath.efficiencyOf(dye.emission());
    }

    /**
     * Brightness relative to Alexa Fluor 488 imaged without filters.
     *
     * @return the relative brightness, {@code NaN} if the dye's quantum yield or extinction
     *         coefficient is unknown
     * @throws MissingInputsException without a dye or an excitation source
     */
    public double brightness() {
        requireDyeAndExcitation("brightness");
        if (dye.qYield() == null || dye.exCoeff() == null) {
            return Double.NaN;
        }
        return 10.0 * exEfficiency() * dye.qYield() * dye.exCoeff() * emEfficiency() / Dye.REFERENCE_BRIGHTNESS;
    }

    /**
     * @return the uid-only projection of this setup
     * @throws InvalidSetupException if the projection fails validation
     */
    public SetupDescription describe() {
        SetupDescription description = new SetupDescription(
                detector == null ? null : detector.uid(),
                dye == null ? null : dye.uid(),
                excitation == null ? null : excitation.uid(),
                exPath.describe(),
                emPath.describe());
        String error = description.validate();
        if (error != null) {
            throw new InvalidSetupException("Setup description is invalid: " + error);
        }
        return description;
    }

    /** Clears every entity and both paths, publishing a single event. */
    public void empty() {
        muted = true;
        try {
            detector = null;
            dye = null;
            excitation = null;
            exPath.clear();
            emPath.clear();
        } finally {
            muted = false;
        }
        notifier.publish(EventKind.CHANGE);
    }

    /** Same entities, copies of both paths, no listeners. */
    public Setup copy() {
        Setup copy = new Setup(exPath.copy(), emPath.copy());
        copy.detector = detector;
        copy.dye = dye;
        copy.excitation = excitation;
        return copy;
    }

    @Override
    public long subscribe(EventKind kind, ModelListener listener) {
        return notifier.subscribe(kind, listener);
    }

    @Override
    public boolean unsubscribe(long subscriptionId) {
        return notifier.unsubscribe(subscriptionId);
    }

    /** Replaces every entity and both path contents, publishing a single event. */
    void load(
            Detector newDetector,
            Dye newDye,
            Excitation newExcitation,
            List<PathElement> exElements,
            List<PathElement> emElements) {
        muted = true;
        try {
            detector = newDetector;
            dye = newDye;
            excitation = newExcitation;
            exPath.replaceAll(exElements);
            emPath.replaceAll(emElements);
        } finally {
            muted = false;
        }
        notifier.publish(EventKind.CHANGE);
    }

    private void requireDyeAndExcitation(String quantity) {
        List<String> missing = new ArrayList<>(2);
        if (dye == null) {
            missing.add("dye");
        }
        if (excitation == null) {
            missing.add("excitation");
        }
        if (!missing.isEmpty()) {
            throw new MissingInputsException(quantity, missing);
        }
    }

    @Override
    public String toString() {
        return "Setup[dye=" + (dye == null ? null : dye.uid()) + ", excitation="
                + (excitation == null ? null : excitation.uid()) + ", exPath=" + exPath.describe() + ", emPath="
                + emPath.describe() + "]";
    }
}
