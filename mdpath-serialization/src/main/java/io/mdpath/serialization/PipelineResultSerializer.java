package io.mdpath.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.mdpath.core.graph.MdpGraph;
import io.mdpath.core.pipeline.PatientError;
import io.mdpath.core.pipeline.PipelineResult;
import io.mdpath.core.pipeline.RunStatistics;
import io.mdpath.core.validation.ValidationWarning;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `PipelineResult`: statistics, errors, warnings and all graphs.
///
/// Every declared graph is written, including graphs without observations, so consumers
/// can rely on all 90 keys being present.
///
/// @implNote Package-private. Registered by {@link MdpathJacksonModule}.
class PipelineResultSerializer extends StdSerializer<PipelineResult> {

    @Serial private static final long serialVersionUID = 2286450771593012870L;

    PipelineResultSerializer() {
        super(PipelineResult.class);
    }

    @Override
    public void serialize(PipelineResult result, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        writeStatistics(result.statistics(), gen, provider);

        gen.writeArrayFieldStart("errors");
        for (PatientError error : result.errors()) {
            gen.writeStartObject();
            gen.writeStringField("patient_id", error.patientId());
            gen.writeStringField("error_type", error.errorType());
            gen.writeNumberField("visit_index", error.visitIndex());
            gen.writeStringField("message", error.message());
            gen.writeBooleanField("partial", error.partial());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("warnings");
        for (ValidationWarning warning : result.warnings()) {
            gen.writeStartObject();
            gen.writeStringField("patient_id", warning.patientId());
            gen.writeStringField("type", warning.type().name());
            gen.writeNumberField("visit_index", warning.visitIndex());
            gen.writeStringField("message", warning.message());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("graphs");
        for (MdpGraph graph : result.registry().getGraphs()) {
            provider.defaultSerializeValue(graph, gen);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private static void writeStatistics(
            RunStatistics statistics, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeObjectFieldStart("statistics");
        gen.writeNumberField("patients", statistics.patients());
        gen.writeNumberField("failed_patients", statistics.failedPatients());
        gen.writeNumberField("visits", statistics.visits());
        gen.writeNumberField("raw_transitions", statistics.rawTransitions());
        gen.writeNumberField("cross_graph_transitions", statistics.crossGraphTransitions());
        gen.writeNumberField("edges", statistics.edges());
        gen.writeNumberField("populated_graphs", statistics.populatedGraphs());
        gen.writeFieldName("started_at");
        provider.defaultSerializeValue(statistics.startedAt(), gen);
        gen.writeFieldName("completed_at");
        provider.defaultSerializeValue(statistics.completedAt(), gen);
        gen.writeEndObject();
    }
}
