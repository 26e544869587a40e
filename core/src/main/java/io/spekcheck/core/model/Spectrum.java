package io.spekcheck.core.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Immutable sampled curve of dimensionless values (usually in [0, 1]) over wavelength in
 * nanometres.
 *
 * <p>
 * Arrays are copied on construction and on every accessor, so an instance never changes after it
 * is built. Each instance also carries an identity token, {@link #id()}, assigned from a
 * monotonically increasing counter. Caches that memoize results per source spectrum key on that
 * token; {@link #equals(Object)} compares the sampled values and ignores it.
 *
 * <p>
 * Construction never throws for bad content: use {@link #isValid()} and
 * {@link #validationError()} before relying on an instance.
 */
public final class Spectrum {

    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    /** Raw values above this are taken to be percentages. */
    static final double PERCENT_THRESHOLD = 10.0;

    private final long id;
    private final double[] wavelength;
    private final double[] data;

    /**
     * Creates a spectrum from wavelength and data arrays, both copied.
     *
     * @param wavelength strictly increasing wavelengths in nm
     * @param data       values, one per wavelength
     */
    public Spectrum(double[] wavelength, double[] data) {
        Objects.requireNonNull(wavelength, "wavelength must not be null");
        Objects.requireNonNull(data, "data must not be null");
        this.id = NEXT_ID.getAndIncrement();
        this.wavelength = Arrays.copyOf(wavelength, wavelength.length);
        this.data = Arrays.copyOf(data, data.length);
    }

    /**
     * Wraps measured values the way data files are read: if any value is above 10 the whole column
     * is assumed to be in percent and divided by 100, then every value is clipped to [0, 1].
     *
     * <p>
     * A percent column whose peak is below 10% is not rescaled. That only matters for detectors
     * with a very low quantum efficiency and is accepted as an approximation.
     *
     * @param wavelength strictly increasing wavelengths in nm
     * @param raw        measured values, fraction or percent
     * @return a new spectrum with scaled and clipped data
     */
    public static Spectrum fromMeasurements(double[] wavelength, double[] raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        double[] scaled = Arrays.copyOf(raw, raw.length);
        boolean percent = false;
        for (double v : scaled) {
            if (v > PERCENT_THRESHOLD) {
                percent = true;
                break;
            }
        }
        for (int i = 0; i < scaled.length; i++) {
            double v = percent ? scaled[i] / 100.0 : scaled[i];
            scaled[i] = Math.min(1.0, Math.max(0.0, v));
        }
        return new Spectrum(wavelength, scaled);
    }

    /** Identity token, unique per instance (copies get a new one). */
    public long id() {
        return id;
    }

    /** Number of samples. */
    public int length() {
        return wavelength.length;
    }

    public boolean isEmpty() {
        return wavelength.length == 0;
    }

    /** Returns a copy of the wavelength array. */
    public double[] wavelength() {
        return Arrays.copyOf(wavelength, wavelength.length);
    }

    /** Returns a copy of the data array. */
    public double[] data() {
        return Arrays.copyOf(data, data.length);
    }

    public double wavelengthAt(int index) {
        return wavelength[index];
    }

    public double dataAt(int index) {
        return data[index];
    }

    /** First wavelength, or {@code NaN} when empty. */
    public double minWavelength() {
        return wavelength.length == 0 ? Double.NaN : wavelength[0];
    }

    /** Last wavelength, or {@code NaN} when empty. */
    public double maxWavelength() {
        return wavelength.length == 0 ? Double.NaN : wavelength[wavelength.length - 1];
    }

    /**
     * Resamples this spectrum at the given wavelengths.
     *
     * <p>
     * Values between two samples are linearly interpolated. Points outside
     * {@code [minWavelength(), maxWavelength()]} yield {@code 0.0}. A point equal to a sample
     * wavelength yields that sample unchanged. {@code points} must be sorted in increasing order;
     * this is not checked and unsorted input gives an undefined result.
     *
     * @param points increasing wavelengths to sample at
     * @return a new array with one value per point
     */
    public double[] interpolate(double[] points) {
        Objects.requireNonNull(points, "points must not be null");
        double[] out = new double[points.length];
        int n = wavelength.length;
        if (n == 0) {
            return out;
        }
        double first = wavelength[0];
        double last = wavelength[n - 1];
        int j = 0; // index of the first sample >= current point
        for (int i = 0; i < points.length; i++) {
            double p = points[i];
            if (p < first) {
                continue;
            }
            if (p > last) {
                break; // sorted, the rest is outside too
            }
            while (wavelength[j] < p) {
                j++;
            }
            if (wavelength[j] == p) {
                out[i] = data[j];
            } else {
                double x0 = wavelength[j - 1];
                double x1 = wavelength[j];
                double y0 = data[j - 1];
                double y1 = data[j];
                out[i] = y0 + (y1 - y0) / (x1 - x0) * (p - x0);
            }
        }
        return out;
    }

    /**
     * Trapezoidal integral of the data over wavelength. Negative samples count as zero.
     *
     * @return the area, {@code 0.0} with fewer than two samples
     */
    public double area() {
        double area = 0.0;
        for (int i = 1; i < wavelength.length; i++) {
            double y0 = Math.max(0.0, data[i - 1]);
            double y1 = Math.max(0.0, data[i]);
            area += 0.5 * (y0 + y1) * (wavelength[i] - wavelength[i - 1]);
        }
        return area;
    }

    /** Wavelength of the first occurrence of the maximum value, {@code NaN} when empty. */
    public double peakWavelength() {
        if (data.length == 0) {
            return Double.NaN;
        }
        int max = 0;
        for (int i = 1; i < data.length; i++) {
            if (data[i] > data[max]) {
                max = i;
            }
        }
        return wavelength[max];
    }

    /**
     * Multiplies this spectrum by another one, resampled on this spectrum's wavelengths.
     *
     * @param other the factor spectrum, zero outside its own range
     * @return a new data array aligned with {@link #wavelength()}
     */
    public double[] multiplyBy(Spectrum other) {
        Objects.requireNonNull(other, "other must not be null");
        return multiplyBy(other.interpolate(wavelength));
    }

    /**
     * Multiplies this spectrum's data element-wise.
     *
     * @param factors one factor per sample
     * @return a new data array
     * @throws IllegalArgumentException if {@code factors} does not have one value per sample
     */
    public double[] multiplyBy(double[] factors) {
        Objects.requireNonNull(factors, "factors must not be null");
        if (factors.length != data.length) {
            throw new IllegalArgumentException(
                    "Length mismatch: spectrum has " + data.length + " samples, factors has " + factors.length);
        }
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = data[i] * factors[i];
        }
        return out;
    }

    /** Multiplies every sample by a scalar and returns the new data array. */
    public double[] multiplyBy(double factor) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = data[i] * factor;
        }
        return out;
    }

    /** {@code 1 - value} on the same wavelengths, e.g. reflection from transmission. */
    public Spectrum complement() {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = 1.0 - data[i];
        }
        return new Spectrum(wavelength, out);
    }

    /** Independent copy with its own arrays and a new identity token. */
    public Spectrum copy() {
        return new Spectrum(wavelength, data);
    }

    /**
     * Checks the invariants of the sampled data.
     *
     * @return an error message, or {@code null} if the spectrum is valid
     */
    public String validate() {
        if (wavelength.length != data.length) {
            return "'data' and 'wavelength' arrays must have the same length";
        }
        for (int i = 1; i < wavelength.length; i++) {
            if (!(wavelength[i] > wavelength[i - 1])) {
                return "'wavelength' values must be strictly increasing";
            }
        }
        for (double v : data) {
            if (!(v >= 0.0 && v <= 1.0)) {
                return "all 'data' must be in the [0 1] interval";
            }
        }
        return null;
    }

    public boolean isValid() {
        return validate() == null;
    }

    /** Same as {@link #validate()}; named for callers that only read the message. */
    public String validationError() {
        return validate();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Spectrum that)) return false;
        return Arrays.equals(wavelength, that.wavelength) && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(wavelength) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        if (wavelength.length == 0) {
            return "Spectrum[id=" + id + ", empty]";
        }
        return "Spectrum[id=" + id + ", n=" + wavelength.length + ", " + minWavelength() + "-" + maxWavelength()
                + " nm]";
    }
}
