package io.mdpath.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.mdpath.core.graph.MdpGraph;
import io.mdpath.core.graph.Transition;
import io.mdpath.core.pipeline.PipelineResult;
import io.mdpath.core.visit.PatientRecord;
import io.mdpath.core.visit.RawVisit;
import io.mdpath.serialization.mixin.PatientRecordBuilderMixin;
import io.mdpath.serialization.mixin.PatientRecordMixin;
import io.mdpath.serialization.mixin.RawVisitBuilderMixin;
import io.mdpath.serialization.mixin.RawVisitMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all mdpath serialization configuration in one place.
///
/// **Output serializers** (write-only snapshot of aggregated results):
/// - `PipelineResult` — `PipelineResultSerializer`
/// - `MdpGraph` — `MdpGraphSerializer`
/// - `Transition` — `TransitionSerializer`
///
/// **Mixin/builder pairs** (input records from the extraction service, snake_case fields):
/// - `PatientRecord` + `PatientRecord.Builder`
/// - `RawVisit` + `RawVisit.Builder`
///
/// @see MdpathSerializer for the convenience factory API
public class MdpathJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 1940725083551247118L;

    public MdpathJacksonModule() {
        super("MdpathJacksonModule");

        addSerializer(PipelineResult.class, new PipelineResultSerializer());
        addSerializer(MdpGraph.class, new MdpGraphSerializer());
        addSerializer(Transition.class, new TransitionSerializer());
    }

    /// Applies mixin annotations to the builder-pattern input types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(PatientRecord.class, PatientRecordMixin.class);
        context.setMixInAnnotations(PatientRecord.Builder.class, PatientRecordBuilderMixin.class);

        context.setMixInAnnotations(RawVisit.class, RawVisitMixin.class);
        context.setMixInAnnotations(RawVisit.Builder.class, RawVisitBuilderMixin.class);
    }
}
