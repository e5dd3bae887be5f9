package io.mdpath.core.classify;

import io.mdpath.core.MdpathConfig;
import io.mdpath.core.state.GrowthVelocity;

/// Buckets the growth rate between two diameter measurements.
///
/// The rate is `(current − previous) / (intervalMonths / 12)` in cm per year. Shrinking or
/// unchanged tumors are always {@link GrowthVelocity#STABLE}.
///
/// @implNote Immutable and thread-safe.
public final class GrowthVelocityClassifier {

    private final double slowGrowthCmPerYear;
    private final double fastGrowthCmPerYear;

    /// Creates a classifier with explicit thresholds.
    ///
    /// @param slowGrowthCmPerYear lowest rate classified as slow growth, positive
    /// @param fastGrowthCmPerYear lowest rate classified as fast growth, above the slow one
    public GrowthVelocityClassifier(double slowGrowthCmPerYear, double fastGrowthCmPerYear) {
        if (slowGrowthCmPerYear <= 0 || fastGrowthCmPerYear <= slowGrowthCmPerYear) {
            throw new IllegalArgumentException("Thresholds must satisfy 0 < slow < fast");
        }
        this.slowGrowthCmPerYear = slowGrowthCmPerYear;
        this.fastGrowthCmPerYear = fastGrowthCmPerYear;
    }

    public static GrowthVelocityClassifier from(MdpathConfig config) {
        return new GrowthVelocityClassifier(
                config.getSlowGrowthCmPerYear(), config.getFastGrowthCmPerYear());
    }

    /// Computes the annualized growth rate.
    ///
    /// @param previousCm earlier diameter
    /// @param currentCm later diameter
    /// @param intervalMonths positive gap between the two measurements
    /// @return rate in cm per year, negative for shrinking tumors
    /// @throws IllegalArgumentException if the interval is not positive
    public static double ratePerYear(double previousCm, double currentCm, double intervalMonths) {
        if (intervalMonths <= 0) {
            throw new IllegalArgumentException("Interval must be positive: " + intervalMonths);
        }
        return (currentCm - previousCm) / (intervalMonths / 12.0);
    }

    /// Classifies the growth between two measurements.
    ///
    /// @param previousCm earlier diameter
    /// @param currentCm later diameter
    /// @param intervalMonths positive gap between the two measurements
    /// @return velocity bucket, never null
    /// @throws IllegalArgumentException if the interval is not positive
    public GrowthVelocity classify(double previousCm, double currentCm, double intervalMonths) {
        if (currentCm <= previousCm) {
            return GrowthVelocity.STABLE;
        }
        double rate = ratePerYear(previousCm, currentCm, intervalMonths);
        if (rate < slowGrowthCmPerYear) {
            return GrowthVelocity.STABLE;
        }
        if (rate < fastGrowthCmPerYear) {
            return GrowthVelocity.SLOW_GROWTH;
        }
        return GrowthVelocity.FAST_GROWTH;
    }
}
