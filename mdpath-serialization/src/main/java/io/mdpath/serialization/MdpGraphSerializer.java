package io.mdpath.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.mdpath.core.graph.MdpGraph;
import io.mdpath.core.graph.NodeStats;
import io.mdpath.core.graph.Transition;
import io.mdpath.core.state.StateId;
import io.mdpath.core.stratification.StratificationKey;
import java.io.IOException;
import java.io.Serial;
import java.util.List;
import java.util.Map;

/// Serializes an `MdpGraph` with its node list, edge list and both cross-graph lists.
///
/// Incoming cross-graph transitions are written as references (source graph, states,
/// action, count) since the edge itself belongs to the source graph.
///
/// @implNote Package-private. Registered by {@link MdpathJacksonModule}.
class MdpGraphSerializer extends StdSerializer<MdpGraph> {

    @Serial private static final long serialVersionUID = -7352285143980418071L;

    MdpGraphSerializer() {
        super(MdpGraph.class);
    }

    @Override
    public void serialize(MdpGraph graph, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        writeKey(graph.getKey(), gen);
        gen.writeNumberField("observation_count", graph.getObservationCount());

        gen.writeArrayFieldStart("nodes");
        for (Map.Entry<StateId, NodeStats> node : graph.getNodes().entrySet()) {
            writeNode(node.getKey(), node.getValue(), gen);
        }
        gen.writeEndArray();

        writeTransitions("edges", graph.getEdges(), gen, provider);
        writeTransitions("cross_graph_transitions", graph.getOutgoingCrossGraph(), gen, provider);

        gen.writeArrayFieldStart("incoming_cross_graph");
        for (Transition edge : graph.getIncomingCrossGraph()) {
            gen.writeStartObject();
            gen.writeStringField("from_graph", edge.getFromGraph().id());
            gen.writeStringField("from_state", edge.getFromState().id());
            gen.writeStringField("action", edge.getAction().label());
            gen.writeStringField("to_state", edge.getToState().id());
            gen.writeNumberField("count", edge.getCount());
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private static void writeKey(StratificationKey key, JsonGenerator gen) throws IOException {
        gen.writeStringField("graph_id", key.id());
        gen.writeObjectFieldStart("stratification");
        gen.writeStringField("age", key.age().label());
        gen.writeStringField("gender", key.gender().label());
        gen.writeStringField("tumor_grade", key.grade().label());
        gen.writeStringField("location", key.location().label());
        gen.writeEndObject();
    }

    private static void writeNode(StateId state, NodeStats stats, JsonGenerator gen)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("state", state.id());
        gen.writeStringField("tumor_size", state.size().label());
        gen.writeStringField("symptoms", state.symptoms().label());
        gen.writeStringField("growth_velocity", state.velocity().label());
        gen.writeStringField("treatment_phase", state.phase().label());
        gen.writeNumberField("count", stats.getObservationCount());
        gen.writeArrayFieldStart("patient_ids");
        for (String patientId : stats.getPatientIds()) {
            gen.writeString(patientId);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private static void writeTransitions(
            String field, List<Transition> edges, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeArrayFieldStart(field);
        for (Transition edge : edges) {
            provider.defaultSerializeValue(edge, gen);
        }
        gen.writeEndArray();
    }
}
