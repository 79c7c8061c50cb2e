package io.conclave.core.weight;

import io.conclave.core.metric.MetricRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Per-role, per-metric expertise weights used for weighted voting.
///
/// Each entry maps a `(roleKey, metricName)` pair to a weight in `[0, 1]`. A role
/// is considered the **primary** authority for a metric when its weight is at least
/// {@link #PRIMARY_THRESHOLD}.
///
/// ### Role resolution
/// Lookups accept either a role key (`"senior-architect"`) or a registered alias
/// (`"Senior Architect"`). Names are lower-cased and trimmed before matching.
///
/// | Lookup                          | Result                                             |
/// |---------------------------------|----------------------------------------------------|
/// | known role, known metric        | configured weight                                  |
/// | known role, unconfigured metric | `0.0`                                              |
/// | unknown role                    | {@link #UNKNOWN_ROLE_WEIGHT}, logged once per role |
///
/// @implNote Weights are immutable after {@link Builder#build()}. Safe to share across threads
/// and evaluations.
///
/// @see DefaultWeights#expertise() for the built-in five-role table
public final class WeightTable {

    private static final Logger logger = Logger.getLogger(WeightTable.class.getName());

    /// Weight at or above which a role counts as the primary authority for a metric.
    public static final double PRIMARY_THRESHOLD = 0.4;

    /// Weight used for roles the table does not know.
    public static final double UNKNOWN_ROLE_WEIGHT = 0.2;

    static final double SUM_TOLERANCE = 0.001;

    private final Map<String, Map<String, Double>> weights;
    private final Map<String, String> aliases;
    private final Set<String> warnedRoles = ConcurrentHashMap.newKeySet();

    private WeightTable(Builder builder) {
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        builder.weights.forEach(
                (role, perMetric) ->
                        copy.put(role, Collections.unmodifiableMap(new LinkedHashMap<>(perMetric))));
        this.weights = Collections.unmodifiableMap(copy);
        this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(builder.aliases));
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the weight of a role for a metric.
    ///
    /// @param role role key or alias, not null
    /// @param metric metric name, not null
    /// @return weight in [0, 1]
    public double weight(String role, String metric) {
        String roleKey = normalizeRole(role);
        Map<String, Double> perMetric = weights.get(roleKey);
        if (perMetric == null) {
            if (warnedRoles.add(roleKey)) {
                logger.warning(
                        "Unknown role '"
                                + role
                                + "', using default weight "
                                + UNKNOWN_ROLE_WEIGHT);
            }
            return UNKNOWN_ROLE_WEIGHT;
        }
        return perMetric.getOrDefault(metric, 0.0);
    }

    /// Returns whether the role is the primary authority for the metric.
    public boolean isPrimary(String role, String metric) {
        return knowsRole(role) && weight(role, metric) >= PRIMARY_THRESHOLD;
    }

    /// Resolves a role name or alias to its role key.
    ///
    /// @param role role key, alias or display name, may be null
    /// @return the canonical role key, or the lower-cased trimmed input if no alias
    ///         matches; empty string for null
    public String normalizeRole(String role) {
        if (role == null) {
            return "";
        }
        String normalized = role.toLowerCase(Locale.ROOT).trim();
        return aliases.getOrDefault(normalized, normalized);
    }

    public boolean knowsRole(String role) {
        return weights.containsKey(normalizeRole(role));
    }

    public Set<String> roles() {
        return weights.keySet();
    }

    public Map<String, String> aliases() {
        return aliases;
    }

    /// Returns the configured weights of one role.
    ///
    /// @param roleKey canonical role key, not null
    /// @return unmodifiable metric-to-weight map, empty if the role is unknown
    public Map<String, Double> weightsFor(String roleKey) {
        return weights.getOrDefault(roleKey, Map.of());
    }

    /// Checks that every metric's weights sum to 1.0 across all roles.
    ///
    /// Deviations are logged and returned; they never prevent use of the table.
    ///
    /// @param registry metrics to check, not null
    /// @return one message per deviating metric, empty if the table is balanced
    public List<String> validate(MetricRegistry registry) {
        List<String> problems = new ArrayList<>();
        for (String metric : registry.names()) {
            double sum = 0.0;
            for (Map<String, Double> perMetric : weights.values()) {
                sum += perMetric.getOrDefault(metric, 0.0);
            }
            if (Math.abs(sum - 1.0) > SUM_TOLERANCE + 1e-9) {
                String message =
                        "Weights for metric '"
                                + metric
                                + "' sum to "
                                + String.format(Locale.ROOT, "%.3f", sum)
                                + ", expected 1.000";
                logger.warning(message);
                problems.add(message);
            }
        }
        return problems;
    }

    @Override
    public String toString() {
        return "WeightTable{roles=" + weights.keySet() + ", aliases=" + aliases.size() + "}";
    }

    /// Builder for weight tables.
    public static final class Builder {
        private final Map<String, Map<String, Double>> weights = new LinkedHashMap<>();
        private final Map<String, String> aliases = new LinkedHashMap<>();

        private Builder() {}

        /// Sets the weight of a role for a metric.
        ///
        /// @param roleKey canonical role key, not null or blank
        /// @param metric metric name, not null
        /// @param weight weight in [0, 1]
        /// @return this builder for chaining
        /// @throws IllegalArgumentException if the weight is outside [0, 1] or the role
        ///         key is blank
        public Builder weight(String roleKey, String metric, double weight) {
            Objects.requireNonNull(roleKey, "roleKey must not be null");
            Objects.requireNonNull(metric, "metric must not be null");
            if (roleKey.isBlank()) {
                throw new IllegalArgumentException("roleKey must not be blank");
            }
            if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
                throw new IllegalArgumentException(
                        "Weight for role '"
                                + roleKey
                                + "' and metric '"
                                + metric
                                + "' must be in [0, 1], was "
                                + weight);
            }
            weights.computeIfAbsent(roleKey.toLowerCase(Locale.ROOT).trim(), k -> new LinkedHashMap<>())
                    .put(metric, weight);
            return this;
        }

        /// Sets several weights for one role.
        public Builder role(String roleKey, Map<String, Double> perMetric) {
            perMetric.forEach((metric, weight) -> weight(roleKey, metric, weight));
            return this;
        }

        /// Registers an alternative name for a role key.
        ///
        /// @param alias display name or alternative spelling, matched case-insensitively
        /// @param roleKey canonical role key, not null
        /// @return this builder for chaining
        public Builder alias(String alias, String roleKey) {
            Objects.requireNonNull(alias, "alias must not be null");
            Objects.requireNonNull(roleKey, "roleKey must not be null");
            aliases.put(
                    alias.toLowerCase(Locale.ROOT).trim(), roleKey.toLowerCase(Locale.ROOT).trim());
            return this;
        }

        public WeightTable build() {
            return new WeightTable(this);
        }
    }
}
