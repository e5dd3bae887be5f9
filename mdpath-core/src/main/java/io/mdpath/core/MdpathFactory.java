package io.mdpath.core;

import io.mdpath.core.assembly.StateActionAssembler;
import io.mdpath.core.imputation.ImputationEngine;
import io.mdpath.core.phase.TreatmentPhaseMachine;
import io.mdpath.core.pipeline.MdpathPipeline;
import io.mdpath.core.pipeline.PatientProcessor;
import io.mdpath.core.transition.TransitionBuilder;
import io.mdpath.core.validation.TimelineValidator;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/// Factory for creating and wiring mdpath pipelines.
///
/// ### Usage
/// {@snippet :
/// try (MdpathPipeline pipeline = MdpathFactory.createPipeline(
///         MdpathConfig.builder().threadPoolSize(8).build())) {
///     PipelineResult result = pipeline.run(records);
/// }
/// }
///
/// @implNote This is a utility class with only static methods. All dependencies are wired
/// explicitly via constructor injection in created components.
///
/// @see MdpathConfig
/// @see MdpathPipeline
public final class MdpathFactory {

    private MdpathFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates a pipeline with default configuration.
    ///
    /// @return a fully-wired pipeline, never null
    public static MdpathPipeline createPipeline() {
        return createPipeline(new MdpathConfig());
    }

    /// Creates a pipeline from configuration.
    ///
    /// @apiNote **Side effects**: Creates a fixed thread pool when `threadPoolSize > 1`;
    /// close the pipeline to release it.
    ///
    /// @param config pipeline settings, not null
    /// @return a fully-wired pipeline, never null
    /// @throws IllegalStateException if the configuration is inconsistent
    public static MdpathPipeline createPipeline(MdpathConfig config) {
        config.validate();
        ExecutorService executor =
                config.getThreadPoolSize() > 1
                        ? Executors.newFixedThreadPool(config.getThreadPoolSize())
                        : null;
        return createPipeline(config, executor);
    }

    /// Creates a pipeline with an explicit executor.
    ///
    /// Useful for tests and for sharing a pool. The pipeline shuts the executor down when
    /// closed.
    ///
    /// @param config pipeline settings, not null
    /// @param executor worker pool, null for single-threaded processing
    /// @return a fully-wired pipeline, never null
    public static MdpathPipeline createPipeline(MdpathConfig config, ExecutorService executor) {
        config.validate();
        TimelineValidator validator = new TimelineValidator();
        PatientProcessor processor =
                new PatientProcessor(
                        config,
                        new ImputationEngine(config),
                        new TreatmentPhaseMachine(config.getEarlyPhaseWindowMonths()),
                        new TransitionBuilder(new StateActionAssembler()),
                        validator);
        return new MdpathPipeline(processor, validator, executor, config.isParallelAggregation());
    }
}
