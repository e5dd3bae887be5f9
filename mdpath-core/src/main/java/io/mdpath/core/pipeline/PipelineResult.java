package io.mdpath.core.pipeline;

import io.mdpath.core.graph.GraphRegistry;
import io.mdpath.core.graph.MdpGraph;
import io.mdpath.core.stratification.StratificationKey;
import io.mdpath.core.validation.ValidationWarning;
import io.mdpath.core.validation.WarningType;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Output of a pipeline run: the graphs, per-patient fatal errors and warnings.
///
/// @param registry all 90 graphs, not null
/// @param errors fatal per-patient errors in input order, never null
/// @param warnings advisory warnings in input order, never null
/// @param statistics run counters, not null
public record PipelineResult(
        GraphRegistry registry,
        List<PatientError> errors,
        List<ValidationWarning> warnings,
        RunStatistics statistics) {

    public PipelineResult {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(statistics, "statistics");
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    /// Returns the graphs keyed by stratification key.
    ///
    /// @return unmodifiable sorted map of all graphs, never null
    public Map<StratificationKey, MdpGraph> graphs() {
        return registry.asMap();
    }

    public MdpGraph graph(StratificationKey key) {
        return registry.get(key);
    }

    /// Returns the warnings of one category.
    ///
    /// @param type warning category, not null
    /// @return matching warnings, never null
    public List<ValidationWarning> warningsOf(WarningType type) {
        return warnings.stream().filter(w -> w.type() == type).toList();
    }
}
