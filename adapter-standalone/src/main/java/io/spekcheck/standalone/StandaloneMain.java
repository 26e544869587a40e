package io.spekcheck.standalone;

import io.spekcheck.standalone.cli.ReportApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the command-line report.
 *
 * <p>
 * Delegates to {@link ReportApp#run(String[], java.io.PrintStream)}. On failure, logs the error
 * and exits with a non-zero status code.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * @param args command-line arguments, e.g. {@code --setup FITC --rank}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            ReportApp.run(args, System.out);
        } catch (Exception e) {
            LOG.error("Report failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
