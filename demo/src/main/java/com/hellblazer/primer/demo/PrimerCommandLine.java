/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Primer.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.primer.demo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <p>Modes:
 * <ul>
 *   <li>DEMO - Print successive container states and a tree traversal</li>
 *   <li>BENCHMARK - Time both selection strategies across sizes and input distributions</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public class PrimerCommandLine {
    private static final Logger log = LoggerFactory.getLogger(PrimerCommandLine.class);

    /**
     * Available operation modes.
     */
    public enum Mode {
        DEMO("demo", "Exercise each container and print its state"),
        BENCHMARK("benchmark", "Compare median of medians with randomized quickselect"),
        HELP("help", "Show help information");

        private final String command;
        private final String description;

        Mode(String command, String description) {
            this.command = command;
            this.description = description;
        }

        public static Mode fromString(String s) {
            for (var mode : values()) {
                if (mode.command.equalsIgnoreCase(s)) {
                    return mode;
                }
            }
            return null;
        }

        public String getCommand() {
            return command;
        }

        public String getDescription() {
            return description;
        }
    }

    /**
     * Configuration holder for all command-line options.
     */
    public static class Config {
        public Mode mode = Mode.HELP;

        // Benchmark options
        public int[]                   sizes         = { 100, 1_000, 10_000 };
        public int                     trials        = 100;
        public int                     warmup        = 5;
        public Long                    seed;
        public List<InputDistribution> distributions = new ArrayList<>(List.of(InputDistribution.values()));

        // General options
        public boolean quiet = false;

        /** Problems found while parsing, reported by {@link #getValidationErrors()}. */
        final List<String> parseErrors = new ArrayList<>();

        public List<String> getValidationErrors() {
            var errors = new ArrayList<>(parseErrors);

            if (mode == Mode.BENCHMARK) {
                if (sizes.length == 0) {
                    errors.add("At least one size is required");
                }
                for (var size : sizes) {
                    if (size < 1) {
                        errors.add("Sizes must be positive: " + size);
                    }
                }
                if (trials < 1) {
                    errors.add("Trials must be positive");
                }
                if (warmup < 0) {
                    errors.add("Warmup cannot be negative");
                }
                if (distributions.isEmpty()) {
                    errors.add("At least one distribution is required");
                }
            }

            return errors;
        }

        @Override
        public String toString() {
            return String.format("Config{mode=%s, sizes=%s, trials=%d, warmup=%d, seed=%s, distributions=%s}", mode,
                                 Arrays.toString(sizes), trials, warmup, seed, distributions);
        }
    }

    /**
     * Parse command-line arguments into configuration.
     */
    public static Config parse(String[] args) {
        var config = new Config();

        if (args.length == 0) {
            config.mode = Mode.HELP;
            return config;
        }

        // First argument is the mode
        var modeArg = args[0];
        config.mode = Mode.fromString(modeArg);

        if (config.mode == null) {
            if (!modeArg.startsWith("-")) {
                log.warn("Unknown mode: {}. Use 'help' for available modes.", modeArg);
            }
            config.mode = Mode.HELP;
            return config;
        }

        for (int i = 1; i < args.length; i++) {
            var arg = args[i];

            switch (arg) {
                case "-s", "--sizes" -> {
                    if (i + 1 < args.length) {
                        config.sizes = parseSizes(args[++i], config);
                    } else {
                        config.parseErrors.add("Missing value for " + arg);
                    }
                }
                case "-t", "--trials" -> {
                    if (i + 1 < args.length) {
                        config.trials = parseInt(arg, args[++i], config.trials, config);
                    } else {
                        config.parseErrors.add("Missing value for " + arg);
                    }
                }
                case "--warmup" -> {
                    if (i + 1 < args.length) {
                        config.warmup = parseInt(arg, args[++i], config.warmup, config);
                    } else {
                        config.parseErrors.add("Missing value for " + arg);
                    }
                }
                case "--seed" -> {
                    if (i + 1 < args.length) {
                        var value = args[++i];
                        try {
                            config.seed = Long.parseLong(value);
                        } catch (NumberFormatException e) {
                            config.parseErrors.add("Invalid seed: " + value);
                        }
                    } else {
                        config.parseErrors.add("Missing value for " + arg);
                    }
                }
                case "-d", "--distributions" -> {
                    if (i + 1 < args.length) {
                        config.distributions = parseDistributions(args[++i], config);
                    } else {
                        config.parseErrors.add("Missing value for " + arg);
                    }
                }
                case "-q", "--quiet" -> config.quiet = true;
                case "-h", "--help" -> config.mode = Mode.HELP;
                default -> {
                    if (arg.startsWith("-")) {
                        log.warn("Unknown option: {}", arg);
                    }
                }
            }
        }

        return config;
    }

    /**
     * Print usage information.
     */
    public static void printUsage(PrintStream out) {
        out.println("Primer - classic data structures and linear time selection");
        out.println();
        out.println("Usage: primer <mode> [options]");
        out.println();
        out.println("Modes:");
        for (var mode : Mode.values()) {
            out.printf("  %-12s  %s%n", mode.getCommand(), mode.getDescription());
        }
        out.println();
        out.println("Benchmark Options:");
        out.println("  -s, --sizes <n,n,...>          Input sizes (default: 100,1000,10000)");
        out.println("  -t, --trials <n>               Timed trials per size and distribution (default: 100)");
        out.println("  --warmup <n>                   Untimed trials before each case (default: 5)");
        out.println("  --seed <n>                     Seed for inputs, k and random pivots (default: unseeded)");
        out.println("  -d, --distributions <d,d,...>  Input orderings to run (default: all)");
        for (var distribution : InputDistribution.values()) {
            out.printf("      %-12s               %s%n", distribution.getLabel(), distribution.getDescription());
        }
        out.println();
        out.println("Common Options:");
        out.println("  -q, --quiet                    Suppress logging and the benchmark header");
        out.println("  -h, --help                     Show this help message");
        out.println();
        out.println("Examples:");
        out.println("  primer demo");
        out.println("  primer benchmark --sizes 1000,100000 --trials 20 --seed 42");
        out.println("  primer benchmark -d random,descending");
    }

    /**
     * Validate configuration and print any errors.
     */
    public static boolean validate(Config config, PrintStream out) {
        var errors = config.getValidationErrors();
        if (!errors.isEmpty()) {
            out.println("Configuration errors:");
            for (var error : errors) {
                out.println("  - " + error);
            }
            out.println();
            out.println("Use 'primer help' for usage information.");
            return false;
        }
        return true;
    }

    /**
     * Run the mode selected by args.
     *
     * @return the process exit code
     */
    public static int execute(String[] args, PrintStream out, PrintStream err) {
        var config = parse(args);

        if (config.mode == Mode.HELP) {
            printUsage(out);
            return 0;
        }

        if (!validate(config, err)) {
            return 1;
        }

        if (!config.quiet) {
            log.info("Primer mode: {}", config.mode);
            log.info("Configuration: {}", config);
        }

        try {
            return switch (config.mode) {
                case DEMO -> ContainerDemo.run(out);
                case BENCHMARK -> SelectionBenchmark.run(config, out);
                case HELP -> {
                    printUsage(out);
                    yield 0;
                }
            };
        } catch (Exception e) {
            log.error("Error executing {}: {}", config.mode, e.getMessage(), e);
            return 1;
        }
    }

    /**
     * Main entry point for CLI.
     */
    public static void main(String[] args) {
        System.exit(execute(args, System.out, System.err));
    }

    private static List<InputDistribution> parseDistributions(String value, Config config) {
        var distributions = new ArrayList<InputDistribution>();
        for (var name : value.split(",")) {
            var distribution = InputDistribution.fromString(name.trim());
            if (distribution == null) {
                config.parseErrors.add("Unknown distribution: " + name.trim());
            } else if (!distributions.contains(distribution)) {
                distributions.add(distribution);
            }
        }
        return distributions;
    }

    private static int parseInt(String option, String value, int fallback, Config config) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            config.parseErrors.add("Invalid value for " + option + ": " + value);
            return fallback;
        }
    }

    private static int[] parseSizes(String value, Config config) {
        var sizes = new ArrayList<Integer>();
        for (var token : value.split(",")) {
            try {
                sizes.add(Integer.parseInt(token.trim()));
            } catch (NumberFormatException e) {
                config.parseErrors.add("Invalid size: " + token.trim());
            }
        }
        return sizes.stream().mapToInt(Integer::intValue).toArray();
    }
}
