package io.mdpath.core.visit;

/// Extent of surgical resection.
public enum SurgeryType {

    /// Gross total resection (Simpson I-III).
    GTR,

    /// Subtotal resection (Simpson IV-V).
    STR
}
