package io.conclave.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `WorkerResult.Builder` that configures POJO builder deserialization.
///
/// Sets `withPrefix = ""` so JSON field names map directly to builder method names.
///
/// @see WorkerResultMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class WorkerResultBuilderMixin {}
