package io.conclave.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.conclave.core.metric.Scorecard;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes a `Scorecard` as a flat JSON object in metric order.
///
/// Explicit null values are written as JSON `null` so that "present but null" and
/// "absent" survive a round trip: `{"codeQuality":8.0,"testCoverage":null}`.
///
/// @implNote Package-private. Registered by {@link ConclaveJacksonModule}.
/// @see ScorecardDeserializer for the inverse operation
class ScorecardSerializer extends StdSerializer<Scorecard> {

    @Serial private static final long serialVersionUID = 3317795305622541862L;

    ScorecardSerializer() {
        super(Scorecard.class);
    }

    @Override
    public void serialize(Scorecard scorecard, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        for (Map.Entry<String, Double> entry : scorecard.asMap().entrySet()) {
            if (entry.getValue() == null) {
                gen.writeNullField(entry.getKey());
            } else {
                gen.writeNumberField(entry.getKey(), entry.getValue());
            }
        }
        gen.writeEndObject();
    }
}
