package io.conclave.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.conclave.core.metric.Scorecard;
import java.io.IOException;
import java.io.Serial;
import java.util.Iterator;
import java.util.Map;

/// Deserializes a `Scorecard` from a flat JSON object.
///
/// JSON `null` becomes an explicit null entry; field order becomes metric order.
/// Non-numeric values are rejected.
///
/// @implNote Package-private. Registered by {@link ConclaveJacksonModule}.
/// @see ScorecardSerializer for the inverse operation
class ScorecardDeserializer extends StdDeserializer<Scorecard> {

    @Serial private static final long serialVersionUID = -6184922340163551207L;

    ScorecardDeserializer() {
        super(Scorecard.class);
    }

    @Override
    public Scorecard deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        if (!root.isObject()) {
            throw new IOException("Scorecard must be a JSON object, was " + root.getNodeType());
        }

        Scorecard.Builder builder = Scorecard.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                builder.put(field.getKey(), null);
            } else if (value.isNumber()) {
                builder.put(field.getKey(), value.doubleValue());
            } else {
                throw new IOException(
                        "Scorecard value for '" + field.getKey() + "' must be a number or null");
            }
        }
        return builder.build();
    }
}
