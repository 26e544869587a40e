package io.spekcheck.standalone.cli;

import io.spekcheck.core.engine.DyeRanking;
import io.spekcheck.core.engine.DyeScore;
import io.spekcheck.core.engine.Setup;
import io.spekcheck.core.error.MissingInputsException;
import io.spekcheck.core.model.FilterPosition;
import io.spekcheck.core.model.OpticalEntity;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.function.DoubleSupplier;
import java.util.function.ToDoubleFunction;

/** Plain-text report of a setup and of a dye ranking. */
final class ReportWriter {

    private final PrintStream out;

    ReportWriter(PrintStream out) {
        this.out = out;
    }

    void writeSetup(String title, Setup setup) {
        out.println("Setup: " + title);
        out.println("  dye:             " + uidOf(setup.dye()));
        out.println("  excitation:      " + uidOf(setup.excitation()));
        out.println("  detector:        " + uidOf(setup.detector()));
        out.println("  excitation path: " + path(setup.exPath().describe()));
        out.println("  emission path:   " + path(setup.emPath().describe()));
        out.println("  ex efficiency:   " + quantity(setup::exEfficiency));
        out.println("  em efficiency:   " + quantity(setup::emEfficiency));
        out.println("  brightness:      " + quantity(setup::brightness));
    }

    void writeRanking(DyeRanking ranking) {
        table("Best dyes by excitation efficiency", ranking.byExEfficiency(), DyeScore::exEfficiency);
        table("Best dyes by emission efficiency", ranking.byEmEfficiency(), DyeScore::emEfficiency);
        table("Best dyes by brightness", ranking.byBrightness(), DyeScore::brightness);
    }

    private void table(String title, List<DyeScore> scores, ToDoubleFunction<DyeScore> metric) {
        out.println(title + ":");
        if (scores.isEmpty()) {
            out.println("  (none)");
        }
        for (int i = 0; i < scores.size(); i++) {
            DyeScore score = scores.get(i);
            out.println("  " + (i + 1) + ". " + score.dye() + "  " + number(metric.applyAsDouble(score)));
        }
    }

    private static String quantity(DoubleSupplier supplier) {
        try {
            return number(supplier.getAsDouble());
        } catch (MissingInputsException e) {
            return "n/a (no " + String.join(" or ", e.missingInputs()) + ")";
        }
    }

    static String number(double value) {
        return Double.isNaN(value) ? "n/a" : String.format(Locale.ROOT, "%.4f", value);
    }

    private static String path(List<FilterPosition> positions) {
        if (positions.isEmpty()) {
            return "(empty)";
        }
        StringBuilder text = new StringBuilder();
        for (FilterPosition position : positions) {
            if (text.length() > 0) {
                text.append(", ");
            }
            text.append(position.filter()).append(' ').append(position.mode().code());
        }
        return text.toString();
    }

    private static String uidOf(OpticalEntity entity) {
        return entity == null ? "-" : entity.uid();
    }
}
