package io.spekcheck.standalone.cli;

/**
 * Parsed command-line options.
 *
 * @param setup      predefined setup to load, or {@code null}
 * @param dye        dye uid overriding the setup's, or {@code null}
 * @param excitation excitation uid overriding the setup's, or {@code null}
 * @param rank       also rank every dye against the setup
 */
public record CliOptions(String setup, String dye, String excitation, boolean rank) {

    static final String USAGE =
            "usage: spekcheck [--config <file>] [--setup <uid>] [--dye <uid>] [--excitation <uid>] [--rank]";

    /**
     * @throws IllegalArgumentException on an unknown option or a missing value
     */
    public static CliOptions parse(String[] args) {
        String setup = null;
        String dye = null;
        String excitation = null;
        boolean rank = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config" -> i++; // handled by ConfigLoader
                case "--setup" -> setup = value(args, ++i, "--setup");
                case "--dye" -> dye = value(args, ++i, "--dye");
                case "--excitation" -> excitation = value(args, ++i, "--excitation");
                case "--rank" -> rank = true;
                default -> throw new IllegalArgumentException("Unknown option '" + args[i] + "'. " + USAGE);
            }
        }
        return new CliOptions(setup, dye, excitation, rank);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a uid argument");
        }
        return args[index];
    }
}
