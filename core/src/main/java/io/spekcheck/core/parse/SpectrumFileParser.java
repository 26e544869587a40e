package io.spekcheck.core.parse;

import io.spekcheck.core.error.SpectrumParseException;
import io.spekcheck.core.model.Detector;
import io.spekcheck.core.model.Dye;
import io.spekcheck.core.model.Excitation;
import io.spekcheck.core.model.Filter;
import io.spekcheck.core.model.Spectrum;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads spectrum data files: a short text header followed by CSV.
 *
 * <pre>
 * Name: Alexa Fluor 488
 * Type: dye
 * # comments are allowed in the header
 * Extinction coefficient: 73000
 * Quantum Yield: 0.92
 * wavelength, excitation, emission
 * 400, 2.1, 0.0
 * 401, 2.3, 0.0
 * </pre>
 *
 * <p>
 * The header ends at the first line that is neither a comment nor a {@code Key: value} pair. The
 * first CSV row names the columns; the first column is the wavelength. Every other column becomes
 * a {@link Spectrum} through {@link Spectrum#fromMeasurements}, which rescales percentages.
 *
 * <p>
 * The {@code read*} methods have the {@link io.spekcheck.core.spi.EntityReader} signature. They
 * expect the entity uid in {@code attrs} and are stateless and thread-safe.
 */
public final class SpectrumFileParser {

    /** Header keys present in every file and not used. */
    private static final Set<String> IGNORED_KEYS = Set.of("Name", "Type");

    private static final String EX_COEFF_KEY = "Extinction coefficient";
    private static final String Q_YIELD_KEY = "Quantum Yield";

    /** Property names of the header values; a CSV column may not reuse them. */
    private static final Map<String, String> HEADER_PROPERTIES =
            Map.of(EX_COEFF_KEY, "ex_coeff", Q_YIELD_KEY, "q_yield");

    /** Leading number of a header value, so that {@code "73000 M-1 cm-1"} reads as 73000. */
    private static final Pattern LEADING_NUMBER = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private SpectrumFileParser() {}

    // ── Readers ──

    public static Dye readDye(String text, Map<String, String> attrs) {
        Parsed parsed = parse(text, attrs, Set.of(EX_COEFF_KEY, Q_YIELD_KEY));
        return new Dye(
                parsed.uid,
                parsed.column("excitation"),
                parsed.column("emission"),
                parsed.header.get(EX_COEFF_KEY),
                parsed.header.get(Q_YIELD_KEY));
    }

    public static Excitation readExcitation(String text, Map<String, String> attrs) {
        Parsed parsed = parse(text, attrs, Set.of());
        return new Excitation(parsed.uid, parsed.column("intensity"));
    }

    /** Reads a filter measured either in transmission or in reflection. */
    public static Filter readFilter(String text, Map<String, String> attrs) {
        Parsed parsed = parse(text, attrs, Set.of());
        if (parsed.columns.containsKey("transmission")) {
            return new Filter(parsed.uid, parsed.columns.get("transmission"));
        }
        if (parsed.columns.containsKey("reflection")) {
            return Filter.fromReflection(parsed.uid, parsed.columns.get("reflection"));
        }
        throw parsed.error("missing 'transmission' or 'reflection' column");
    }

    public static Detector readDetector(String text, Map<String, String> attrs) {
        Parsed parsed = parse(text, attrs, Set.of());
        return new Detector(parsed.uid, parsed.column("qe"));
    }

    // ── Parsing ──

    /**
     * Splits a data file into its header values and its spectra.
     *
     * @param requiredKeys header keys that must be present; their values are parsed as numbers,
     *                     {@code null} when not a number
     */
    static Parsed parse(String text, Map<String, String> attrs, Set<String> requiredKeys) {
        String uid = attrs.get("uid");
        if (uid == null) {
            throw new IllegalArgumentException("attrs must contain 'uid'");
        }
        String keySpace = attrs.get("keySpace");
        String source = keySpace == null ? uid : keySpace + "/" + uid;
        if (text == null) {
            throw new SpectrumParseException("no content", uid, source);
        }

        List<String> lines = text.lines().toList();
        Map<String, Double> header = new LinkedHashMap<>();
        int row = 0;
        for (; row < lines.size(); row++) {
            String line = lines.get(row).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int colon = line.indexOf(':');
            if (colon < 0 || line.substring(0, colon).contains(",")) {
                break; // first CSV row
            }
            String key = line.substring(0, colon).trim();
            if (IGNORED_KEYS.contains(key) || !requiredKeys.contains(key)) {
                continue;
            }
            if (header.containsKey(key)) {
                throw new SpectrumParseException(
                        "duplicate header key '" + key + "' at line " + (row + 1), uid, source);
            }
            header.put(key, parseOptional(line.substring(colon + 1).trim()));
        }
        for (String key : requiredKeys) {
            if (!header.containsKey(key)) {
                throw new SpectrumParseException("missing value for '" + key + "' in header", uid, source);
            }
        }
        if (row >= lines.size()) {
            throw new SpectrumParseException("no CSV section", uid, source);
        }

        List<String> names = new ArrayList<>();
        String[] headerCells = lines.get(row).split(",");
        for (int i = 1; i < headerCells.length; i++) {
            String name = headerCells[i].trim();
            if (names.contains(name)) {
                throw new SpectrumParseException("duplicate column '" + name + "'", uid, source);
            }
            if (isHeaderProperty(name, header)) {
                throw new SpectrumParseException("csv and header have duplicate properties", uid, source);
            }
            names.add(name);
        }
        if (names.isEmpty()) {
            throw new SpectrumParseException("CSV has no spectrum column", uid, source);
        }

        List<double[]> values = new ArrayList<>();
        for (row = row + 1; row < lines.size(); row++) {
            String line = lines.get(row).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] cells = line.split(",");
            if (cells.length != names.size() + 1) {
                throw new SpectrumParseException(
                        "line " + (row + 1) + ": expected " + (names.size() + 1) + " values, got " + cells.length,
                        uid,
                        source);
            }
            double[] parsedRow = new double[cells.length];
            for (int i = 0; i < cells.length; i++) {
                try {
                    parsedRow[i] = Double.parseDouble(cells[i].trim());
                } catch (NumberFormatException e) {
                    throw new SpectrumParseException(
                            "line " + (row + 1) + ": '" + cells[i].trim() + "' is not a number", e, uid, source);
                }
            }
            values.add(parsedRow);
        }

        double[] wavelength = new double[values.size()];
        for (int r = 0; r < values.size(); r++) {
            wavelength[r] = values.get(r)[0];
        }
        Map<String, Spectrum> columns = new LinkedHashMap<>();
        for (int c = 0; c < names.size(); c++) {
            double[] column = new double[values.size()];
            for (int r = 0; r < values.size(); r++) {
                column[r] = values.get(r)[c + 1];
            }
            columns.put(names.get(c), Spectrum.fromMeasurements(wavelength, column));
        }
        return new Parsed(uid, source, header, columns);
    }

    private static boolean isHeaderProperty(String column, Map<String, Double> header) {
        for (String key : header.keySet()) {
            if (column.equals(key) || column.equals(HEADER_PROPERTIES.get(key))) {
                return true;
            }
        }
        return false;
    }

    /** Missing values, e.g. an unknown quantum yield, are read as {@code null}. */
    private static Double parseOptional(String value) {
        Matcher matcher = LEADING_NUMBER.matcher(value);
        if (!matcher.find()) {
            return null;
        }
        return Double.parseDouble(matcher.group());
    }

    static final class Parsed {
        final String uid;
        final String source;
        final Map<String, Double> header;
        final Map<String, Spectrum> columns;

        Parsed(String uid, String source, Map<String, Double> header, Map<String, Spectrum> columns) {
            this.uid = uid;
            this.source = source;
            this.header = header;
            this.columns = columns;
        }

        Spectrum column(String name) {
            Spectrum spectrum = columns.get(name);
            if (spectrum == null) {
                throw error("missing '" + name + "' column");
            }
            return spectrum;
        }

        SpectrumParseException error(String message) {
            return new SpectrumParseException(message, uid, source);
        }
    }
}
