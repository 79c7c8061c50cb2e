package io.conclave.core;

import io.conclave.core.metric.DefaultMetrics;
import io.conclave.core.metric.MetricRegistry;
import io.conclave.core.storage.DiscussionStateRepository;
import io.conclave.core.storage.InMemoryDiscussionStateRepository;
import io.conclave.core.weight.DefaultWeights;
import io.conclave.core.weight.WeightTable;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/// Factory for creating and wiring Conclave environments.
///
/// ### Usage Patterns
///
/// **Builder with explicit components**:
/// {@snippet :
/// var env = ConclaveFactory.builder()
///     .config(ConclaveFactory.loadConfig(properties))
///     .metricRegistry(profile.registry())
///     .weightTable(profile.weights())
///     .build();
/// }
///
/// **Quick start with environment variables**:
/// {@snippet :
/// var env = ConclaveFactory.createEnvironment();
/// }
///
/// ### Settings
/// | Property                          | Environment variable               |
/// |-----------------------------------|------------------------------------|
/// | `conclave.rounds.max`             | `CONCLAVE_ROUNDS_MAX`              |
/// | `conclave.rounds.min`             | `CONCLAVE_ROUNDS_MIN`              |
/// | `conclave.convergence.threshold`  | `CONCLAVE_CONVERGENCE_THRESHOLD`   |
/// | `conclave.worker.timeout-seconds` | `CONCLAVE_WORKER_TIMEOUT_SECONDS`  |
/// | `conclave.threads`                | `CONCLAVE_THREADS`                 |
///
/// Properties take precedence over environment variables. A timeout of `0` or less
/// disables the worker timeout.
///
/// @see ConclaveEnvironment
/// @see ConclaveConfig
public final class ConclaveFactory {

    private static final Logger logger = Logger.getLogger(ConclaveFactory.class.getName());

    static final String MAX_ROUNDS = "conclave.rounds.max";
    static final String MIN_ROUNDS = "conclave.rounds.min";
    static final String CONVERGENCE_THRESHOLD = "conclave.convergence.threshold";
    static final String WORKER_TIMEOUT_SECONDS = "conclave.worker.timeout-seconds";
    static final String THREADS = "conclave.threads";

    private static final List<String> KEYS =
            List.of(MAX_ROUNDS, MIN_ROUNDS, CONVERGENCE_THRESHOLD, WORKER_TIMEOUT_SECONDS, THREADS);

    private ConclaveFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment with the default profile and configuration read from
    /// environment variables.
    ///
    /// @apiNote **Side effects**: Creates a new thread pool
    ///
    /// @return a fully-configured environment, never null
    public static ConclaveEnvironment createEnvironment() {
        return builder().config(loadConfig(new Properties())).build();
    }

    /// Creates an environment with the default eight-pillar profile.
    ///
    /// @param config configuration options, not null
    /// @return a fully-configured environment, never null
    public static ConclaveEnvironment createEnvironment(ConclaveConfig config) {
        return builder().config(config).build();
    }

    /// Loads configuration from environment variables and properties.
    ///
    /// @param properties settings overriding the environment, not null
    /// @return configuration with defaults for unset keys, never null
    /// @throws IllegalArgumentException if a value is not a valid number
    public static ConclaveConfig loadConfig(Properties properties) {
        return loadConfig(properties, System.getenv());
    }

    /// Loads configuration from an explicit environment map and properties.
    ///
    /// @param properties settings overriding the environment, not null
    /// @param environment environment variables, not null
    /// @return configuration with defaults for unset keys, never null
    /// @throws IllegalArgumentException if a value is not a valid number
    public static ConclaveConfig loadConfig(Properties properties, Map<String, String> environment) {
        Map<String, String> settings = new HashMap<>();
        for (String key : KEYS) {
            String value = environment.get(toEnvironmentName(key));
            if (value != null && !value.isBlank()) {
                settings.put(key, value.trim());
            }
        }
        for (String key : KEYS) {
            String value = properties.getProperty(key);
            if (value != null && !value.isBlank()) {
                settings.put(key, value.trim());
            }
        }

        ConclaveConfig config = new ConclaveConfig();
        if (settings.containsKey(MAX_ROUNDS)) {
            config.setMaxRounds(parseInt(MAX_ROUNDS, settings.get(MAX_ROUNDS)));
        }
        if (settings.containsKey(MIN_ROUNDS)) {
            config.setMinRounds(parseInt(MIN_ROUNDS, settings.get(MIN_ROUNDS)));
        }
        if (settings.containsKey(CONVERGENCE_THRESHOLD)) {
            config.setConvergenceThreshold(
                    parseDouble(CONVERGENCE_THRESHOLD, settings.get(CONVERGENCE_THRESHOLD)));
        }
        if (settings.containsKey(WORKER_TIMEOUT_SECONDS)) {
            long seconds = parseInt(WORKER_TIMEOUT_SECONDS, settings.get(WORKER_TIMEOUT_SECONDS));
            config.setWorkerTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : null);
        }
        if (settings.containsKey(THREADS)) {
            config.setThreadPoolSize(parseInt(THREADS, settings.get(THREADS)));
        }
        logger.fine("Loaded configuration keys: " + settings.keySet());
        return config;
    }

    /// Maps a property key to its environment variable name.
    ///
    /// `conclave.worker.timeout-seconds` becomes `CONCLAVE_WORKER_TIMEOUT_SECONDS`.
    static String toEnvironmentName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid integer for " + key + ": '" + value + "'", e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid number for " + key + ": '" + value + "'", e);
        }
    }

    /// Creates a new builder for fine-grained environment construction.
    ///
    /// @return a new builder, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link ConclaveEnvironment} instances.
    ///
    /// Unset components fall back to the eight-pillar metric registry, the five-role
    /// expertise weights, an in-memory state repository and a fixed thread pool sized
    /// from the configuration.
    ///
    /// @implNote **Not thread-safe**. Intended for single-threaded configuration
    /// before calling {@link #build()}.
    public static class Builder {
        private ConclaveConfig config = new ConclaveConfig();
        private MetricRegistry metricRegistry;
        private WeightTable weightTable;
        private DiscussionStateRepository stateRepository;
        private ExecutorService executorService;

        public Builder config(ConclaveConfig config) {
            this.config = config;
            return this;
        }

        public Builder metricRegistry(MetricRegistry metricRegistry) {
            this.metricRegistry = metricRegistry;
            return this;
        }

        public Builder weightTable(WeightTable weightTable) {
            this.weightTable = weightTable;
            return this;
        }

        public Builder stateRepository(DiscussionStateRepository stateRepository) {
            this.stateRepository = stateRepository;
            return this;
        }

        /// Uses an externally managed thread pool.
        ///
        /// The pool is still shut down when the environment is closed.
        ///
        /// @param executorService the pool, not null
        /// @return this builder for chaining, never null
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        /// Builds the environment.
        ///
        /// Weight sums that deviate from 1.0 are logged but do not fail the build.
        ///
        /// @return a fully-configured environment, never null
        public ConclaveEnvironment build() {
            MetricRegistry registry =
                    metricRegistry != null ? metricRegistry : DefaultMetrics.pillars();
            WeightTable weights = weightTable != null ? weightTable : DefaultWeights.expertise();
            weights.validate(registry);

            DiscussionStateRepository repository =
                    stateRepository != null
                            ? stateRepository
                            : new InMemoryDiscussionStateRepository();
            ExecutorService executor =
                    executorService != null
                            ? executorService
                            : Executors.newFixedThreadPool(config.getThreadPoolSize());

            return new ConclaveEnvironment(config, registry, weights, repository, executor);
        }
    }
}
