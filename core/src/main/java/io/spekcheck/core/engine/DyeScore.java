package io.spekcheck.core.engine;

/**
 * Figures of merit of one dye under a fixed excitation and pair of paths. Values that cannot be
 * computed are {@code NaN}.
 *
 * @param dye          dye uid
 * @param exEfficiency excitation efficiency
 * @param emEfficiency emission efficiency
 * @param brightness   relative brightness
 */
public record DyeScore(String dye, double exEfficiency, double emEfficiency, double brightness) {

    static DyeScore unavailable(String dye) {
        return new DyeScore(dye, Double.NaN, Double.NaN, Double.NaN);
    }
}
