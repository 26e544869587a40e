package io.spekcheck.core.parse;

import io.spekcheck.core.collection.ObservableCollection;
import io.spekcheck.core.error.SetupParseException;
import io.spekcheck.core.model.FilterPosition;
import io.spekcheck.core.model.Mode;
import io.spekcheck.core.model.SetupDescription;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the list of predefined setups, one per line:
 *
 * <pre>
 * # uid, dye, excitation, emission filters :: excitation filters
 * FITC, alexa-488, xcite-120, ff01-525 t, di-488 t :: ff01-482 t, di-488 r
 * </pre>
 *
 * <p>
 * Each filter field is {@code <filter uid> <mode>} with the mode, {@code t} or {@code r} in any
 * case, after the last space. Filters go to the emission path until {@code ::}, then to the
 * excitation path. Empty dye and excitation fields mean none. Blank lines and lines starting with
 * {@code #} are skipped.
 */
public final class SetupDescriptionParser {

    private static final String PATH_SEPARATOR = "::";

    private SetupDescriptionParser() {}

    /**
     * @param text   whole file content
     * @param source file name reported in errors
     * @return setups by uid, in file order
     * @throws SetupParseException on the first malformed line
     */
    public static ObservableCollection<String, SetupDescription> parse(String text, String source) {
        Map<String, SetupDescription> setups = new LinkedHashMap<>();
        List<String> lines = text.lines().toList();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int lineNumber = i + 1;
            int comma = line.indexOf(',');
            if (comma < 0) {
                throw new SetupParseException(
                        "line " + lineNumber + ": invalid setup '" + line + "'", null, source + ":" + lineNumber);
            }
            String uid = line.substring(0, comma).trim();
            if (setups.containsKey(uid)) {
                throw new SetupParseException(
                        "line " + lineNumber + ": duplicate setup '" + uid + "'", uid, source + ":" + lineNumber);
            }
            try {
                setups.put(uid, parseLine(line.substring(comma + 1)));
            } catch (IllegalArgumentException e) {
                throw new SetupParseException(
                        "line " + lineNumber + ": " + e.getMessage(), e, uid, source + ":" + lineNumber);
            }
        }
        return new ObservableCollection<>(setups);
    }

    /**
     * Parses one setup definition without its leading uid field.
     *
     * @throws IllegalArgumentException if a filter field is malformed
     */
    public static SetupDescription parseLine(String definition) {
        String[] fields = definition.split(",", -1);
        String dye = fields.length > 0 ? emptyToNull(fields[0]) : null;
        String excitation = fields.length > 1 ? emptyToNull(fields[1]) : null;

        List<FilterPosition> exPath = new ArrayList<>();
        List<FilterPosition> emPath = new ArrayList<>();
        List<FilterPosition> path = emPath;
        for (int i = 2; i < fields.length; i++) {
            String field = fields[i];
            int separator = field.indexOf(PATH_SEPARATOR);
            if (separator < 0) {
                addFilter(path, field);
                continue;
            }
            addFilter(path, field.substring(0, separator));
            path = exPath;
            addFilter(path, field.substring(separator + PATH_SEPARATOR.length()));
        }
        return new SetupDescription(null, dye, excitation, exPath, emPath);
    }

    /**
     * Parses {@code "<filter uid> <mode>"}.
     *
     * @throws IllegalArgumentException without a space or with a mode other than t or r
     */
    public static FilterPosition parseFilterField(String field) {
        String trimmed = field.trim();
        int split = trimmed.lastIndexOf(' ');
        if (split < 0) {
            throw new IllegalArgumentException("invalid filter definition '" + trimmed + "'");
        }
        String uid = trimmed.substring(0, split).trim();
        Mode mode = Mode.fromCode(trimmed.substring(split + 1));
        return new FilterPosition(uid, mode);
    }

    // an empty field on either side of '::' leaves that path empty
    private static void addFilter(List<FilterPosition> path, String field) {
        if (!field.isBlank()) {
            path.add(parseFilterField(field));
        }
    }

    private static String emptyToNull(String field) {
        String trimmed = field.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
