package io.mdpath.core.exception;

import java.io.Serial;

/// Thrown when the interval between two visits used for a growth-velocity computation is
/// zero or negative.
///
/// Visits before the offending one still form a valid timeline.
public class InvalidIntervalException extends PatientProcessingException {

    @Serial private static final long serialVersionUID = 5102738945517230164L;

    private final double intervalMonths;

    /// Creates exception for a non-positive interval.
    ///
    /// @param visitIndex index of the later visit of the pair
    /// @param intervalMonths the computed interval, zero or negative
    public InvalidIntervalException(int visitIndex, double intervalMonths) {
        super(
                "Non-positive interval of "
                        + intervalMonths
                        + " months before visit "
                        + visitIndex,
                visitIndex);
        this.intervalMonths = intervalMonths;
    }

    public double getIntervalMonths() {
        return intervalMonths;
    }

    @Override
    public String getErrorType() {
        return "InvalidInterval";
    }
}
