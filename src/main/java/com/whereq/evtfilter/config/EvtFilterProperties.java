package com.whereq.evtfilter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration properties for WhereQ evtfilter.
 * Command line options override these defaults for a single run.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "evtfilter")
@Data
public class EvtFilterProperties {

    /**
     * Number of parallel workers. Zero or less means host parallelism minus one.
     */
    private int workers = 0;

    private DecoderConfig decoder = new DecoderConfig();

    private StagingConfig staging = new StagingConfig();

    private OutputConfig output = new OutputConfig();

    private CliConfig cli = new CliConfig();

    /**
     * Resolve the worker count, falling back to host parallelism.
     */
    public int resolveWorkers(Integer requested) {
        int value = requested != null ? requested : workers;
        if (value > 0) {
            return value;
        }
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    @Data
    public static class DecoderConfig {
        /**
         * Path to LogParser.exe, or a bare name resolved on the search path.
         */
        private String path = "LogParser.exe";

        /**
         * Log Parser input format. EVT handles both .evt and .evtx.
         */
        private String inputFormat = "EVT";

        /**
         * Maximum run time of one decoder process. Zero disables the limit.
         */
        private Duration timeout = Duration.ZERO;
    }

    @Data
    public static class StagingConfig {
        /**
         * Parent of the per-job temporary directories. Unset means the system temp
         * directory. Put it on the same volume as the logs to stage by hard link.
         */
        private Path directory;
    }

    @Data
    public static class OutputConfig {
        private char delimiter = ',';

        /**
         * Replaces the delimiter inside field values.
         */
        private char placeholder = '§';

        /**
         * Sort merged rows by source file instead of worker completion order.
         */
        private boolean sortBySource = false;
    }

    @Data
    public static class CliConfig {
        /**
         * Run the command line on startup. Disabled in tests that only need the beans.
         */
        private boolean enabled = true;
    }
}
