package io.conclave.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;

/// Jackson mixin enabling field-level visibility for `EvaluationHistory`.
///
/// `EvaluationHistory` has a no-arg constructor and private mutable fields rather than a
/// builder, so Jackson reads and writes the fields directly. The `isEmpty()` accessor is
/// derived state and is not written.
///
/// @see io.conclave.serialization.ConclaveJacksonModule
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
public abstract class EvaluationHistoryMixin {

    @JsonIgnore
    public abstract boolean isEmpty();
}
