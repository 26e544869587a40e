package io.spekcheck.standalone.config;

import java.nio.file.Path;

/**
 * Configuration of the command-line report.
 *
 * <p>
 * Every field has a default; use {@link #builder()} to override some of them.
 *
 * @param dataDir       root directory of the data files
 * @param dyesDir       dye key space, a directory under {@code dataDir}
 * @param excitationsDir excitation key space
 * @param filtersDir    filter key space
 * @param detectorsDir  detector key space
 * @param setsFile      predefined setups file, relative to {@code dataDir}
 * @param fetchThreads  threads reading data files
 * @param fetchTimeoutMs max wait for all entities of one request, in ms
 * @param rankingTop    dyes listed per figure of merit by {@code --rank}
 * @param loggingFormat json or text
 * @param loggingLevel  root log level
 */
public record SpekCheckConfig(
        String dataDir,
        String dyesDir,
        String excitationsDir,
        String filtersDir,
        String detectorsDir,
        String setsFile,
        int fetchThreads,
        int fetchTimeoutMs,
        int rankingTop,
        String loggingFormat,
        String loggingLevel) {

    public static Builder builder() {
        return new Builder();
    }

    /** The sets file resolved against the data directory. */
    public Path setsPath() {
        return Path.of(dataDir).resolve(setsFile);
    }

    /** Builder for {@link SpekCheckConfig}, starting from the defaults. */
    public static final class Builder {
        private String dataDir = "./data";
        private String dyesDir = "dyes";
        private String excitationsDir = "excitation";
        private String filtersDir = "filters";
        private String detectorsDir = "detectors";
        private String setsFile = "sets";
        private int fetchThreads = 4;
        private int fetchTimeoutMs = 30000;
        private int rankingTop = 3;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder dataDir(String dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        public Builder dyesDir(String dyesDir) {
            this.dyesDir = dyesDir;
            return this;
        }

        public Builder excitationsDir(String excitationsDir) {
            this.excitationsDir = excitationsDir;
            return this;
        }

        public Builder filtersDir(String filtersDir) {
            this.filtersDir = filtersDir;
            return this;
        }

        public Builder detectorsDir(String detectorsDir) {
            this.detectorsDir = detectorsDir;
            return this;
        }

        public Builder setsFile(String setsFile) {
            this.setsFile = setsFile;
            return this;
        }

        public Builder fetchThreads(int fetchThreads) {
            this.fetchThreads = fetchThreads;
            return this;
        }

        public Builder fetchTimeoutMs(int fetchTimeoutMs) {
            this.fetchTimeoutMs = fetchTimeoutMs;
            return this;
        }

        public Builder rankingTop(int rankingTop) {
            this.rankingTop = rankingTop;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * @throws ConfigLoadException if a numeric value is out of range
         */
        public SpekCheckConfig build() {
            if (fetchThreads < 1) {
                throw new ConfigLoadException("fetch.threads must be at least 1, got " + fetchThreads);
            }
            if (fetchTimeoutMs < 1) {
                throw new ConfigLoadException("fetch.timeout-ms must be positive, got " + fetchTimeoutMs);
            }
            if (rankingTop < 0) {
                throw new ConfigLoadException("ranking.top must not be negative, got " + rankingTop);
            }
            return new SpekCheckConfig(
                    dataDir,
                    dyesDir,
                    excitationsDir,
                    filtersDir,
                    detectorsDir,
                    setsFile,
                    fetchThreads,
                    fetchTimeoutMs,
                    rankingTop,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
