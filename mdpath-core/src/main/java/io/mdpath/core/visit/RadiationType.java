package io.mdpath.core.visit;

public enum RadiationType {

    /// Single-session stereotactic radiosurgery.
    SRS,

    /// Fractionated stereotactic radiotherapy.
    FSRT
}
