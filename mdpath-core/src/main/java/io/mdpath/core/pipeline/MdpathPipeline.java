package io.mdpath.core.pipeline;

import io.mdpath.core.graph.GraphAggregator;
import io.mdpath.core.graph.GraphRegistry;
import io.mdpath.core.transition.PatientTimeline;
import io.mdpath.core.transition.RawTransition;
import io.mdpath.core.validation.TimelineValidator;
import io.mdpath.core.validation.ValidationWarning;
import io.mdpath.core.visit.PatientRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/// Batch transform from patient records to a registry of MDP graphs.
///
/// ### Stages
/// 1. **Per patient** (parallel when an executor is present): imputation, phase derivation,
///    state/action assembly, transition building, validation
/// 2. **Aggregation**: a fresh {@link GraphRegistry} of 90 graphs is folded from all
///    timelines, sequentially or partitioned by graph
///
/// Outcomes are collected in input order, so errors and warnings are reported in the same
/// order for any thread count. A failing patient never blocks the others.
///
/// @implNote Thread-safe for sequential calls to {@link #run(List)}. Owns its executor and
/// shuts it down on {@link #close()}.
///
/// @see io.mdpath.core.MdpathFactory for construction
public final class MdpathPipeline implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(MdpathPipeline.class.getName());

    private final PatientProcessor processor;
    private final TimelineValidator validator;
    private final ExecutorService executor;
    private final boolean parallelAggregation;

    /// Creates a pipeline.
    ///
    /// @param processor per-patient processor, not null
    /// @param validator validator used for the registry-level invariant check, not null
    /// @param executor worker pool, null to run everything on the calling thread
    /// @param parallelAggregation whether to fold graphs on the executor
    public MdpathPipeline(
            PatientProcessor processor,
            TimelineValidator validator,
            ExecutorService executor,
            boolean parallelAggregation) {
        this.processor = Objects.requireNonNull(processor, "processor");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.executor = executor;
        this.parallelAggregation = parallelAggregation && executor != null;
    }

    /// Runs the pipeline over all patients.
    ///
    /// @param records patient records, not null
    /// @return graphs, fatal errors and warnings, never null
    /// @throws IllegalStateException if a worker task fails unexpectedly or is interrupted
    public PipelineResult run(List<PatientRecord> records) {
        Instant startedAt = Instant.now();
        logger.info("Processing " + records.size() + " patients");

        List<PatientOutcome> outcomes = processAll(records);

        List<PatientTimeline> timelines = new ArrayList<>(outcomes.size());
        List<PatientError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();
        for (PatientOutcome outcome : outcomes) {
            timelines.add(outcome.timeline());
            outcome.getError().ifPresent(errors::add);
            warnings.addAll(outcome.warnings());
        }

        GraphRegistry registry = new GraphRegistry();
        new GraphAggregator(parallelAggregation ? executor : null).aggregate(registry, timelines);

        int violations = validator.countUnavailableActions(registry);
        if (violations > 0) {
            logger.warning(violations + " aggregated observations use an unavailable action");
        }

        RunStatistics statistics = statistics(records, timelines, errors, registry, startedAt);
        logger.info(
                "Built "
                        + statistics.edges()
                        + " edges in "
                        + statistics.populatedGraphs()
                        + " graphs; "
                        + errors.size()
                        + " patient errors, "
                        + warnings.size()
                        + " warnings");
        return new PipelineResult(registry, errors, warnings, statistics);
    }

    private List<PatientOutcome> processAll(List<PatientRecord> records) {
        if (executor == null) {
            return records.stream().map(processor::process).toList();
        }
        List<Callable<PatientOutcome>> tasks = new ArrayList<>(records.size());
        for (PatientRecord record : records) {
            tasks.add(() -> processor.process(record));
        }
        List<PatientOutcome> outcomes = new ArrayList<>(records.size());
        try {
            for (Future<PatientOutcome> future : executor.invokeAll(tasks)) {
                outcomes.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while processing patients", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Patient processing failed: " + e.getCause(), e.getCause());
        }
        return outcomes;
    }

    private static RunStatistics statistics(
            List<PatientRecord> records,
            List<PatientTimeline> timelines,
            List<PatientError> errors,
            GraphRegistry registry,
            Instant startedAt) {
        int visits = 0;
        int rawTransitions = 0;
        int crossGraph = 0;
        for (PatientTimeline timeline : timelines) {
            visits += timeline.visits().size();
            rawTransitions += timeline.transitions().size();
            for (RawTransition transition : timeline.transitions()) {
                if (transition.isCrossGraph()) {
                    crossGraph++;
                }
            }
        }
        int edges = registry.getGraphs().stream().mapToInt(g -> g.getTransitions().size()).sum();
        int populated = (int) registry.nonEmpty().count();
        return new RunStatistics(
                records.size(),
                errors.size(),
                visits,
                rawTransitions,
                crossGraph,
                edges,
                populated,
                startedAt,
                Instant.now());
    }

    /// Shuts down the owned executor.
    @Override
    public void close() {
        if (executor != null) {
            executor.shutdown();
        }
    }
}
