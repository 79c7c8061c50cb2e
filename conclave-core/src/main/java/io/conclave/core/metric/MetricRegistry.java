package io.conclave.core.metric;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Ordered, immutable set of metrics a scorecard may contain.
///
/// The registry is configuration, not a constant: build one from definitions
/// (see {@link DefaultMetrics#pillars()} for the stock eight-pillar set) and inject it
/// into the components that need it.
///
/// ### Contracts
/// - **Invariant**: metric names are unique; iteration order is declaration order
/// - **Invariant**: immutable after construction
///
/// @implNote Thread-safe. Shared read-only by every round of every evaluation.
///
/// @see MetricDefinition
/// @see Scorecard#restrictTo(MetricRegistry)
public final class MetricRegistry {

    private final Map<String, MetricDefinition> definitions;

    private MetricRegistry(Map<String, MetricDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    /// Creates a registry from the given definitions, preserving their order.
    ///
    /// @param definitions metric definitions, not null or empty
    /// @return new registry, never null
    /// @throws IllegalArgumentException if the list is empty or a name is duplicated
    public static MetricRegistry of(List<MetricDefinition> definitions) {
        Objects.requireNonNull(definitions, "definitions must not be null");
        if (definitions.isEmpty()) {
            throw new IllegalArgumentException("Metric registry requires at least one metric");
        }
        Map<String, MetricDefinition> byName = new LinkedHashMap<>();
        for (MetricDefinition definition : definitions) {
            Objects.requireNonNull(definition, "definition must not be null");
            if (byName.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException(
                        "Duplicate metric name: " + definition.name());
            }
        }
        return new MetricRegistry(byName);
    }

    /// Creates a registry from definitions given inline.
    ///
    /// @param definitions metric definitions, not empty
    /// @return new registry, never null
    public static MetricRegistry of(MetricDefinition... definitions) {
        return of(List.of(definitions));
    }

    /// Returns metric names in declaration order.
    ///
    /// @return immutable list of names, never null
    public List<String> names() {
        return List.copyOf(definitions.keySet());
    }

    /// Returns all definitions in declaration order.
    ///
    /// @return immutable list of definitions, never null
    public List<MetricDefinition> definitions() {
        return List.copyOf(definitions.values());
    }

    /// Returns the names of metrics that must not be null in a valid result.
    ///
    /// @return immutable list of required names, may be empty
    public List<String> requiredNames() {
        return definitions.values().stream()
                .filter(d -> !d.nullable())
                .map(MetricDefinition::name)
                .toList();
    }

    public boolean contains(String name) {
        return definitions.containsKey(name);
    }

    public Optional<MetricDefinition> get(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    /// Returns whether the named metric accepts null values.
    ///
    /// @param name metric name, not null
    /// @return true if nullable
    /// @throws IllegalArgumentException if the metric is not registered
    public boolean isNullable(String name) {
        MetricDefinition definition = definitions.get(name);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown metric: " + name);
        }
        return definition.nullable();
    }

    public int size() {
        return definitions.size();
    }

    @Override
    public String toString() {
        return "MetricRegistry" + definitions.keySet();
    }
}
