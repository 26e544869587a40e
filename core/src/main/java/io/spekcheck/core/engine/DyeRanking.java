package io.spekcheck.core.engine;

import java.util.List;

/**
 * Best dyes for a setup, by each figure of merit, best first.
 *
 * @param byExEfficiency highest excitation efficiency first
 * @param byEmEfficiency highest emission efficiency first
 * @param byBrightness   highest brightness first
 */
public record DyeRanking(List<DyeScore> byExEfficiency, List<DyeScore> byEmEfficiency, List<DyeScore> byBrightness) {

    public DyeRanking {
        byExEfficiency = List.copyOf(byExEfficiency);
        byEmEfficiency = List.copyOf(byEmEfficiency);
        byBrightness = List.copyOf(byBrightness);
    }
}
