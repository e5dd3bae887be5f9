package io.mdpath.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.mdpath.core.graph.Transition;
import io.mdpath.core.transition.TransitionOutcome;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes an aggregated `Transition` as one edge object.
///
/// ```
/// field                 content
/// ——————————————————————+———————————————————————————————————————————————
/// from_graph, to_graph  │ stratification key ids
/// from_state, to_state  │ state ids
/// action                │ action label
/// count                 │ number of merged observations
/// patient_ids           │ sorted contributing patients
/// mean/std_elapsed_...  │ elapsed time statistics in months
/// outcome_counts        │ shrank / unchanged / grew counts
/// is_cross_graph        │ whether the edge changes graph
/// changed_factors       │ stratification factors that differ
/// assumed_grade_count   │ observations leaving a defaulted grade
/// ```
///
/// @implNote Package-private. Registered by {@link MdpathJacksonModule}.
class TransitionSerializer extends StdSerializer<Transition> {

    @Serial private static final long serialVersionUID = 4418106622941205539L;

    TransitionSerializer() {
        super(Transition.class);
    }

    @Override
    public void serialize(Transition edge, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("from_graph", edge.getFromGraph().id());
        gen.writeStringField("from_state", edge.getFromState().id());
        gen.writeStringField("action", edge.getAction().label());
        gen.writeStringField("to_graph", edge.getToGraph().id());
        gen.writeStringField("to_state", edge.getToState().id());
        gen.writeNumberField("count", edge.getCount());

        gen.writeArrayFieldStart("patient_ids");
        for (String patientId : edge.getPatientIds()) {
            gen.writeString(patientId);
        }
        gen.writeEndArray();

        gen.writeNumberField("mean_elapsed_months", edge.getMeanElapsedMonths());
        gen.writeNumberField("std_elapsed_months", edge.getStdElapsedMonths());

        gen.writeObjectFieldStart("outcome_counts");
        Map<TransitionOutcome, Integer> outcomes = edge.getOutcomeCounts();
        for (TransitionOutcome outcome : TransitionOutcome.values()) {
            gen.writeNumberField(outcome.label(), outcomes.getOrDefault(outcome, 0));
        }
        gen.writeEndObject();

        gen.writeBooleanField("is_cross_graph", edge.isCrossGraph());
        gen.writeArrayFieldStart("changed_factors");
        for (String factor : edge.getChangedFactors()) {
            gen.writeString(factor);
        }
        gen.writeEndArray();
        gen.writeNumberField("assumed_grade_count", edge.getAssumedGradeCount());
        gen.writeEndObject();
    }
}
