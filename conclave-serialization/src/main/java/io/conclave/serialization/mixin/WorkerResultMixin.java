package io.conclave.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.conclave.core.worker.WorkerResult;

/// Jackson mixin that binds `WorkerResult` deserialization to its builder.
///
/// Applied to `WorkerResult.class` via `ConclaveJacksonModule.setupModule()`.
///
/// @apiNote The companion mixin {@link WorkerResultBuilderMixin} must also be registered
/// so Jackson knows how to invoke the builder's setters and `build()` method.
///
/// @see io.conclave.serialization.ConclaveJacksonModule
@JsonDeserialize(builder = WorkerResult.Builder.class)
public abstract class WorkerResultMixin {}
