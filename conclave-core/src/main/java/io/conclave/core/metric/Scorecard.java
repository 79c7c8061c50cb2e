package io.conclave.core.metric;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable mapping from metric name to a numeric value or null.
///
/// A scorecard distinguishes a metric that is **present with a null value** (the
/// producer explicitly abstained) from a metric that is **absent**. Aggregated
/// scorecards never contain null values: a metric nobody scored is simply absent.
///
/// ### Usage
/// {@snippet :
/// Scorecard card = Scorecard.builder()
///     .put("codeQuality", 8.0)
///     .put("testCoverage", null)
///     .build();
///
/// card.contains("testCoverage");   // true
/// card.valueOf("testCoverage");    // Optional.empty()
/// }
///
/// @implNote Thread-safe. Backed by an unmodifiable insertion-ordered map, so
/// `null` values are allowed (unlike `Map.copyOf`).
///
/// @see MetricRegistry for the set of legal keys
public final class Scorecard {

    private static final Scorecard EMPTY = new Scorecard(new LinkedHashMap<>());

    private final Map<String, Double> values;

    private Scorecard(LinkedHashMap<String, Double> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Scorecard empty() {
        return EMPTY;
    }

    /// Creates a scorecard from a map, preserving its iteration order and null values.
    ///
    /// @param values metric values, not null (values may be null)
    /// @return new scorecard, never null
    public static Scorecard of(Map<String, Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        LinkedHashMap<String, Double> copy = new LinkedHashMap<>();
        values.forEach(
                (name, value) -> {
                    Objects.requireNonNull(name, "metric name must not be null");
                    copy.put(name, value);
                });
        return new Scorecard(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns whether the metric is present, with or without a value.
    public boolean contains(String metric) {
        return values.containsKey(metric);
    }

    /// Returns the raw value for a metric.
    ///
    /// @param metric metric name, not null
    /// @return the value, or null if absent or explicitly null
    public Double get(String metric) {
        return values.get(metric);
    }

    /// Returns the value for a metric when one was given.
    ///
    /// @param metric metric name, not null
    /// @return the value, empty if absent or null
    public Optional<Double> valueOf(String metric) {
        return Optional.ofNullable(values.get(metric));
    }

    /// Returns whether the metric is present with an explicit null value.
    public boolean isExplicitNull(String metric) {
        return values.containsKey(metric) && values.get(metric) == null;
    }

    public Set<String> metricNames() {
        return values.keySet();
    }

    /// Returns the underlying values.
    ///
    /// @return unmodifiable, insertion-ordered view that may contain null values
    public Map<String, Double> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    /// Returns a copy containing only metrics known to the registry.
    ///
    /// Entries are reordered to follow the registry's declaration order.
    ///
    /// @param registry the registry defining legal metric names, not null
    /// @return this scorecard if nothing was stripped and order already matched,
    ///         otherwise a new sanitized scorecard
    public Scorecard restrictTo(MetricRegistry registry) {
        LinkedHashMap<String, Double> sanitized = new LinkedHashMap<>();
        for (String name : registry.names()) {
            if (values.containsKey(name)) {
                sanitized.put(name, values.get(name));
            }
        }
        if (sanitized.keySet().stream().toList().equals(values.keySet().stream().toList())) {
            return this;
        }
        return new Scorecard(sanitized);
    }

    /// Returns a copy where every metric in `update` replaces the value in this scorecard.
    ///
    /// Metrics absent from `update` keep their current value.
    ///
    /// @param update values to overlay, not null
    /// @return merged scorecard, never null
    public Scorecard mergedWith(Scorecard update) {
        LinkedHashMap<String, Double> merged = new LinkedHashMap<>(values);
        merged.putAll(update.values);
        return new Scorecard(merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Scorecard other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Scorecard" + values;
    }

    /// Builder for scorecards. Later puts for the same metric overwrite earlier ones.
    public static final class Builder {
        private final LinkedHashMap<String, Double> values = new LinkedHashMap<>();

        private Builder() {}

        /// Sets a metric value.
        ///
        /// @param metric metric name, not null
        /// @param value the value, may be null to record an explicit abstention
        /// @return this builder for chaining
        public Builder put(String metric, Double value) {
            Objects.requireNonNull(metric, "metric must not be null");
            values.put(metric, value);
            return this;
        }

        public Builder putAll(Map<String, Double> entries) {
            entries.forEach(this::put);
            return this;
        }

        public Scorecard build() {
            return new Scorecard(new LinkedHashMap<>(values));
        }
    }
}
