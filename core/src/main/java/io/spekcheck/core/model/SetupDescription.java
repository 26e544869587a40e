package io.spekcheck.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A setup with every entity replaced by its uid: what gets saved, listed and compared without
 * reading any data file.
 *
 * @param detector   detector uid, or {@code null}
 * @param dye        dye uid, or {@code null}
 * @param excitation excitation source uid, or {@code null}
 * @param exPath     excitation path positions, in light order
 * @param emPath     emission path positions, in light order
 */
public record SetupDescription(
        String detector, String dye, String excitation, List<FilterPosition> exPath, List<FilterPosition> emPath) {

    public SetupDescription {
        exPath = exPath == null ? null : Collections.unmodifiableList(new ArrayList<>(exPath));
        emPath = emPath == null ? null : Collections.unmodifiableList(new ArrayList<>(emPath));
    }

    /** A description with no entities and empty paths. */
    public static SetupDescription empty() {
        return new SetupDescription(null, null, null, List.of(), List.of());
    }

    /**
     * Checks the description.
     *
     * @return an error message, or {@code null} if valid
     */
    public String validate() {
        String error = validatePath("exPath", exPath);
        return error != null ? error : validatePath("emPath", emPath);
    }

    public boolean isValid() {
        return validate() == null;
    }

    private static String validatePath(String name, List<FilterPosition> path) {
        if (path == null) {
            return name + " must be a list";
        }
        for (FilterPosition position : path) {
            if (position == null) {
                return "values of " + name + " must not be null";
            }
            if (position.filter() == null || position.filter().isBlank()) {
                return "values of " + name + " must have 'filter'";
            }
            if (position.mode() == null) {
                return "mode of '" + position.filter() + "' must be r or t";
            }
        }
        return null;
    }
}
