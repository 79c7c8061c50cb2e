package io.conclave.serialization;

import io.conclave.core.metric.MetricRegistry;
import io.conclave.core.weight.WeightTable;
import java.util.Objects;

/// A metric set together with the role weights used to aggregate it.
///
/// @param registry metrics a scorecard may contain, not null
/// @param weights role weights for those metrics, not null
/// @see EvaluationProfileParser
public record EvaluationProfile(MetricRegistry registry, WeightTable weights) {

    public EvaluationProfile {
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(weights, "weights must not be null");
    }
}
