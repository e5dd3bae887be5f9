package io.mdpath.core;

import java.util.Properties;

/// Configuration options for the mdpath pipeline.
///
/// Controls threading, input ordering, and the clinical constants used by imputation,
/// phase derivation and growth-velocity bucketing. Use the {@link Builder} for fluent
/// configuration, {@link #fromProperties(Properties)} to read `mdpath.*` keys, or construct
/// directly with setters.
///
/// ### Default Values
/// - `threadPoolSize`: `4` (patients processed concurrently)
/// - `parallelAggregation`: `false` (single-threaded fold)
/// - `sortVisits`: `true` (visits sorted by time before imputation)
/// - `earlyPhaseWindowMonths`: `6.0`
/// - `gtrShrinkFactor`: `0.5`, `strShrinkFactor`: `0.7`
/// - `postSurgeryCapFactor`: `0.9`
/// - `slowGrowthCmPerYear`: `0.2`, `fastGrowthCmPerYear`: `1.0`
/// - `minVelocityIntervalMonths`: `3.0`
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended to be
/// configured before passing to {@link MdpathFactory}. Do not modify after the pipeline is
/// created.
///
/// @see MdpathFactory#createPipeline(MdpathConfig)
public class MdpathConfig {

    /// Prefix of all property keys read by {@link #fromProperties(Properties)}.
    public static final String PREFIX = "mdpath.";

    private int threadPoolSize = 4;
    private boolean parallelAggregation = false;
    private boolean sortVisits = true;
    private double earlyPhaseWindowMonths = 6.0;
    private double gtrShrinkFactor = 0.5;
    private double strShrinkFactor = 0.7;
    private double postSurgeryCapFactor = 0.9;
    private double slowGrowthCmPerYear = 0.2;
    private double fastGrowthCmPerYear = 1.0;
    private double minVelocityIntervalMonths = 3.0;

    /// Creates a configuration with default values.
    public MdpathConfig() {}

    /// Returns the number of worker threads used for per-patient processing.
    ///
    /// @return pool size; `1` processes patients sequentially on the calling thread
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    /// Returns whether graphs are folded in parallel, one writer per graph.
    ///
    /// @return `true` for the partitioned parallel fold
    public boolean isParallelAggregation() {
        return parallelAggregation;
    }

    public void setParallelAggregation(boolean parallelAggregation) {
        this.parallelAggregation = parallelAggregation;
    }

    public boolean isSortVisits() {
        return sortVisits;
    }

    public void setSortVisits(boolean sortVisits) {
        this.sortVisits = sortVisits;
    }

    /// Returns the window after an intervention that counts as the early phase.
    ///
    /// A visit exactly at the window boundary is still early.
    ///
    /// @return window in months
    public double getEarlyPhaseWindowMonths() {
        return earlyPhaseWindowMonths;
    }

    public void setEarlyPhaseWindowMonths(double earlyPhaseWindowMonths) {
        this.earlyPhaseWindowMonths = earlyPhaseWindowMonths;
    }

    /// Returns the factor applied to the pre-surgery size when a gross total resection
    /// has no post-operative measurement.
    ///
    /// @return shrink factor in `(0, 1]`
    public double getGtrShrinkFactor() {
        return gtrShrinkFactor;
    }

    public void setGtrShrinkFactor(double gtrShrinkFactor) {
        this.gtrShrinkFactor = gtrShrinkFactor;
    }

    public double getStrShrinkFactor() {
        return strShrinkFactor;
    }

    public void setStrShrinkFactor(double strShrinkFactor) {
        this.strShrinkFactor = strShrinkFactor;
    }

    /// Returns the cap applied to a post-surgery measurement larger than the pre-surgery
    /// measurement.
    ///
    /// @return cap factor in `(0, 1]`
    public double getPostSurgeryCapFactor() {
        return postSurgeryCapFactor;
    }

    public void setPostSurgeryCapFactor(double postSurgeryCapFactor) {
        this.postSurgeryCapFactor = postSurgeryCapFactor;
    }

    /// Returns the lowest growth rate classified as slow growth.
    ///
    /// @return threshold in cm per year
    public double getSlowGrowthCmPerYear() {
        return slowGrowthCmPerYear;
    }

    public void setSlowGrowthCmPerYear(double slowGrowthCmPerYear) {
        this.slowGrowthCmPerYear = slowGrowthCmPerYear;
    }

    /// Returns the lowest growth rate classified as fast growth.
    ///
    /// @return threshold in cm per year
    public double getFastGrowthCmPerYear() {
        return fastGrowthCmPerYear;
    }

    public void setFastGrowthCmPerYear(double fastGrowthCmPerYear) {
        this.fastGrowthCmPerYear = fastGrowthCmPerYear;
    }

    /// Returns the shortest interval for which a growth velocity is computed.
    ///
    /// Shorter intervals carry the previous velocity forward.
    ///
    /// @return interval in months
    public double getMinVelocityIntervalMonths() {
        return minVelocityIntervalMonths;
    }

    public void setMinVelocityIntervalMonths(double minVelocityIntervalMonths) {
        this.minVelocityIntervalMonths = minVelocityIntervalMonths;
    }

    /// Checks internal consistency of the settings.
    ///
    /// @throws IllegalStateException if any setting is out of range
    public void validate() {
        if (threadPoolSize < 1) {
            throw new IllegalStateException("threadPoolSize must be positive: " + threadPoolSize);
        }
        requireFactor("gtrShrinkFactor", gtrShrinkFactor);
        requireFactor("strShrinkFactor", strShrinkFactor);
        requireFactor("postSurgeryCapFactor", postSurgeryCapFactor);
        if (earlyPhaseWindowMonths <= 0) {
            throw new IllegalStateException("earlyPhaseWindowMonths must be positive");
        }
        if (slowGrowthCmPerYear <= 0 || fastGrowthCmPerYear <= slowGrowthCmPerYear) {
            throw new IllegalStateException(
                    "Growth thresholds must satisfy 0 < slow < fast: "
                            + slowGrowthCmPerYear
                            + ", "
                            + fastGrowthCmPerYear);
        }
        if (minVelocityIntervalMonths < 0) {
            throw new IllegalStateException("minVelocityIntervalMonths must not be negative");
        }
    }

    private static void requireFactor(String name, double value) {
        if (value <= 0 || value > 1) {
            throw new IllegalStateException(name + " must be in (0, 1]: " + value);
        }
    }

    /// Reads settings from properties, using defaults for absent keys.
    ///
    /// Recognized keys: `mdpath.threadPoolSize`, `mdpath.parallelAggregation`,
    /// `mdpath.sortVisits`, `mdpath.earlyPhaseWindowMonths`, `mdpath.gtrShrinkFactor`,
    /// `mdpath.strShrinkFactor`, `mdpath.postSurgeryCapFactor`,
    /// `mdpath.slowGrowthCmPerYear`, `mdpath.fastGrowthCmPerYear`,
    /// `mdpath.minVelocityIntervalMonths`.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if a value cannot be parsed
    public static MdpathConfig fromProperties(Properties properties) {
        MdpathConfig config = new MdpathConfig();
        config.threadPoolSize = intProperty(properties, "threadPoolSize", config.threadPoolSize);
        config.parallelAggregation =
                booleanProperty(properties, "parallelAggregation", config.parallelAggregation);
        config.sortVisits = booleanProperty(properties, "sortVisits", config.sortVisits);
        config.earlyPhaseWindowMonths =
                doubleProperty(properties, "earlyPhaseWindowMonths", config.earlyPhaseWindowMonths);
        config.gtrShrinkFactor = doubleProperty(properties, "gtrShrinkFactor", config.gtrShrinkFactor);
        config.strShrinkFactor = doubleProperty(properties, "strShrinkFactor", config.strShrinkFactor);
        config.postSurgeryCapFactor =
                doubleProperty(properties, "postSurgeryCapFactor", config.postSurgeryCapFactor);
        config.slowGrowthCmPerYear =
                doubleProperty(properties, "slowGrowthCmPerYear", config.slowGrowthCmPerYear);
        config.fastGrowthCmPerYear =
                doubleProperty(properties, "fastGrowthCmPerYear", config.fastGrowthCmPerYear);
        config.minVelocityIntervalMonths =
                doubleProperty(
                        properties, "minVelocityIntervalMonths", config.minVelocityIntervalMonths);
        return config;
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(PREFIX + key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + value, e);
        }
    }

    private static double doubleProperty(Properties properties, String key, double defaultValue) {
        String value = properties.getProperty(PREFIX + key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + PREFIX + key + ": " + value, e);
        }
    }

    private static boolean booleanProperty(
            Properties properties, String key, boolean defaultValue) {
        String value = properties.getProperty(PREFIX + key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim());
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link MdpathConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final MdpathConfig config = new MdpathConfig();

        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder parallelAggregation(boolean parallelAggregation) {
            config.parallelAggregation = parallelAggregation;
            return this;
        }

        public Builder sortVisits(boolean sortVisits) {
            config.sortVisits = sortVisits;
            return this;
        }

        public Builder earlyPhaseWindowMonths(double months) {
            config.earlyPhaseWindowMonths = months;
            return this;
        }

        public Builder gtrShrinkFactor(double factor) {
            config.gtrShrinkFactor = factor;
            return this;
        }

        public Builder strShrinkFactor(double factor) {
            config.strShrinkFactor = factor;
            return this;
        }

        public Builder postSurgeryCapFactor(double factor) {
            config.postSurgeryCapFactor = factor;
            return this;
        }

        public Builder slowGrowthCmPerYear(double threshold) {
            config.slowGrowthCmPerYear = threshold;
            return this;
        }

        public Builder fastGrowthCmPerYear(double threshold) {
            config.fastGrowthCmPerYear = threshold;
            return this;
        }

        public Builder minVelocityIntervalMonths(double months) {
            config.minVelocityIntervalMonths = months;
            return this;
        }

        /// Builds and returns the configured {@link MdpathConfig} instance.
        ///
        /// @return the configured instance, never null
        public MdpathConfig build() {
            return config;
        }
    }
}
