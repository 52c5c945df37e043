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

import com.hellblazer.primer.selection.MedianOfMediansPivot;
import com.hellblazer.primer.selection.QuickSelector;
import com.hellblazer.primer.selection.RandomPivot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.function.Consumer;

/**
 * Benchmark mode comparing median of medians selection with randomized quickselect.
 *
 * <p>For every size and input distribution, each trial draws k uniformly, generates a fresh input and times both
 * selectors on their own copy of it. Trials run sequentially on the calling thread, so timings never overlap.
 *
 * @author hal.hildebrand
 */
public class SelectionBenchmark {
    private static final Logger log = LoggerFactory.getLogger(SelectionBenchmark.class);

    /**
     * Benchmark configuration.
     */
    public static class Settings {
        private int[]                   sizes         = { 100, 1_000, 10_000 };
        private int                     trials        = 100;
        private int                     warmup        = 5;
        private Long                    seed;
        private List<InputDistribution> distributions = List.of(InputDistribution.values());
        private boolean                 quiet;

        public static Settings from(PrimerCommandLine.Config config) {
            var settings = new Settings().withSizes(config.sizes)
                                         .withTrials(config.trials)
                                         .withWarmup(config.warmup)
                                         .withDistributions(config.distributions)
                                         .withQuiet(config.quiet);
            if (config.seed != null) {
                settings.withSeed(config.seed);
            }
            return settings;
        }

        public List<InputDistribution> getDistributions() {
            return distributions;
        }

        /**
         * The seed for inputs, k and pivots, or null for an unseeded run.
         */
        public Long getSeed() {
            return seed;
        }

        public int[] getSizes() {
            return sizes.clone();
        }

        public int getTrials() {
            return trials;
        }

        public int getWarmup() {
            return warmup;
        }

        /**
         * When quiet, only the result rows are printed.
         */
        public boolean isQuiet() {
            return quiet;
        }

        public Settings withDistributions(List<InputDistribution> distributions) {
            if (distributions.isEmpty()) {
                throw new IllegalArgumentException("At least one distribution is required");
            }
            this.distributions = List.copyOf(distributions);
            return this;
        }

        public Settings withQuiet(boolean quiet) {
            this.quiet = quiet;
            return this;
        }

        public Settings withSeed(long seed) {
            this.seed = seed;
            return this;
        }

        public Settings withSizes(int... sizes) {
            if (sizes.length == 0) {
                throw new IllegalArgumentException("At least one size is required");
            }
            for (var size : sizes) {
                if (size <= 0) {
                    throw new IllegalArgumentException("Sizes must be positive: " + size);
                }
            }
            this.sizes = sizes.clone();
            return this;
        }

        public Settings withTrials(int trials) {
            if (trials <= 0) {
                throw new IllegalArgumentException("Trials must be positive");
            }
            this.trials = trials;
            return this;
        }

        public Settings withWarmup(int warmup) {
            if (warmup < 0) {
                throw new IllegalArgumentException("Warmup cannot be negative");
            }
            this.warmup = warmup;
            return this;
        }

        @Override
        public String toString() {
            return String.format("Settings{sizes=%s, trials=%d, warmup=%d, seed=%s, distributions=%s}",
                                 Arrays.toString(sizes), trials, warmup, seed, distributions);
        }
    }

    private final Settings      settings;
    private final PrintStream   out;
    private final Random        random;
    private final QuickSelector deterministic;
    private final QuickSelector randomized;

    /** Folds every selected value so the JIT cannot discard the selections. */
    private long checksum;

    public SelectionBenchmark(Settings settings, PrintStream out) {
        this.settings = settings;
        this.out = out;
        random = settings.getSeed() == null ? new Random() : new Random(settings.getSeed());
        deterministic = new QuickSelector(new MedianOfMediansPivot());
        randomized = new QuickSelector(new RandomPivot(new Random(random.nextLong())));
    }

    /**
     * Run benchmark mode.
     */
    public static int run(PrimerCommandLine.Config config, PrintStream out) {
        return new SelectionBenchmark(Settings.from(config), out).execute();
    }

    /**
     * Execute benchmarks, printing one line per size and distribution.
     *
     * @return the process exit code
     */
    public int execute() {
        try {
            if (!settings.isQuiet()) {
                out.printf("Selection benchmark: %d trials per case%n", settings.getTrials());
            }
            runAll(result -> out.println(result.format()));
            return 0;
        } catch (RuntimeException e) {
            log.error("Benchmark failed", e);
            out.println("Benchmark failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Measure one size and distribution.
     */
    public BenchmarkResult measure(int size, InputDistribution distribution) {
        for (int i = 0; i < settings.getWarmup(); i++) {
            trial(size, distribution);
        }

        long deterministicNanos = 0;
        long randomizedNanos = 0;
        for (int i = 0; i < settings.getTrials(); i++) {
            var elapsed = trial(size, distribution);
            deterministicNanos += elapsed[0];
            randomizedNanos += elapsed[1];
        }

        var trials = settings.getTrials();
        log.debug("n={} {}: checksum {}", size, distribution.getLabel(), checksum);
        return new BenchmarkResult(size, distribution, trials, deterministicNanos / (trials * 1_000_000.0),
                                   randomizedNanos / (trials * 1_000_000.0));
    }

    /**
     * Measure every configured size and distribution, sizes outermost.
     */
    public List<BenchmarkResult> runAll() {
        return runAll(result -> {
        });
    }

    private List<BenchmarkResult> runAll(Consumer<BenchmarkResult> listener) {
        var results = new ArrayList<BenchmarkResult>();
        for (var size : settings.getSizes()) {
            for (var distribution : settings.getDistributions()) {
                var result = measure(size, distribution);
                results.add(result);
                listener.accept(result);
            }
        }
        return results;
    }

    /**
     * @return elapsed nanoseconds of the deterministic and randomized selection, in that order
     */
    private long[] trial(int size, InputDistribution distribution) {
        var k = random.nextInt(size);
        var input = distribution.generate(size, random);

        var work = new ArrayList<>(input);
        var start = System.nanoTime();
        var selected = deterministic.select(work, k);
        var deterministicNanos = System.nanoTime() - start;
        checksum += selected;

        work = new ArrayList<>(input);
        start = System.nanoTime();
        selected = randomized.select(work, k);
        var randomizedNanos = System.nanoTime() - start;
        checksum += selected;

        return new long[] { deterministicNanos, randomizedNanos };
    }
}
