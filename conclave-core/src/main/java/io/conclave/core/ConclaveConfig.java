package io.conclave.core;

import io.conclave.core.execution.DiscussionOptions;
import java.time.Duration;

/// Configuration options for the Conclave evaluation environment.
///
/// Controls thread pool sizing, worker timeout and the default round limits of a
/// discussion. Use the {@link Builder} for fluent configuration or construct
/// directly with setters for mutable configuration.
///
/// ### Default Values
/// - `threadPoolSize`: `10`
/// - `maxRounds`: `3`
/// - `minRounds`: `2`
/// - `convergenceThreshold`: `0.85`
/// - `workerTimeout`: `300` seconds (`null` disables the timeout)
///
/// @implNote **Not thread-safe**. This is a mutable configuration object
/// intended to be configured before passing to {@link ConclaveFactory}.
/// Do not modify after environment creation.
///
/// @see ConclaveFactory#loadConfig(java.util.Properties)
/// @see Builder
public class ConclaveConfig {
    private int threadPoolSize = 10;
    private int maxRounds = DiscussionOptions.DEFAULT_MAX_ROUNDS;
    private int minRounds = DiscussionOptions.DEFAULT_MIN_ROUNDS;
    private double convergenceThreshold = DiscussionOptions.DEFAULT_CONVERGENCE_THRESHOLD;
    private Duration workerTimeout = Duration.ofSeconds(300);

    /// Creates a configuration with default values.
    public ConclaveConfig() {}

    /// Returns the number of threads running worker invocations.
    ///
    /// @return the fixed thread pool size
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /// Sets the number of threads running worker invocations.
    ///
    /// ### Contracts
    /// - **Precondition**: `threadPoolSize` should be positive
    ///
    /// @param threadPoolSize the number of threads in the fixed pool, must be positive
    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    public int getMaxRounds() {
        return maxRounds;
    }

    public void setMaxRounds(int maxRounds) {
        this.maxRounds = maxRounds;
    }

    public int getMinRounds() {
        return minRounds;
    }

    public void setMinRounds(int minRounds) {
        this.minRounds = minRounds;
    }

    public double getConvergenceThreshold() {
        return convergenceThreshold;
    }

    public void setConvergenceThreshold(double convergenceThreshold) {
        this.convergenceThreshold = convergenceThreshold;
    }

    /// Returns how long a round waits for its workers.
    ///
    /// @return the timeout, or null if workers may run indefinitely
    public Duration getWorkerTimeout() {
        return workerTimeout;
    }

    public void setWorkerTimeout(Duration workerTimeout) {
        this.workerTimeout = workerTimeout;
    }

    /// Returns the round limits of this configuration as discussion options.
    ///
    /// @return options for {@link io.conclave.core.execution.DiscussionController#evaluate},
    ///         never null
    public DiscussionOptions toDiscussionOptions() {
        return new DiscussionOptions(maxRounds, minRounds, convergenceThreshold);
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link ConclaveConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}. The returned config can still be modified
    /// via setters after building.
    public static class Builder {
        private final ConclaveConfig config = new ConclaveConfig();

        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder maxRounds(int maxRounds) {
            config.maxRounds = maxRounds;
            return this;
        }

        public Builder minRounds(int minRounds) {
            config.minRounds = minRounds;
            return this;
        }

        public Builder convergenceThreshold(double convergenceThreshold) {
            config.convergenceThreshold = convergenceThreshold;
            return this;
        }

        /// Sets how long a round waits for its workers.
        ///
        /// @param workerTimeout the timeout, may be null to wait indefinitely
        /// @return this builder for chaining, never null
        public Builder workerTimeout(Duration workerTimeout) {
            config.workerTimeout = workerTimeout;
            return this;
        }

        /// Builds and returns the configured {@link ConclaveConfig} instance.
        ///
        /// @return the configured instance, never null
        public ConclaveConfig build() {
            return config;
        }
    }
}
