package com.camsentinel.core.pipeline;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Typed, immutable settings shared by every device pipeline.
 *
 * <p>
 * Built from the global section of the watcher configuration, or with the
 * {@link Builder} in tests. {@link Builder#build()} validates that every
 * duration is positive and that the renewal margin leaves room inside the
 * requested subscription lifetime.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineSettings {

    private final Duration postDetectionDuration;
    private final Duration tickInterval;
    private final Duration subscriptionDuration;
    private final Duration renewMargin;
    private final Duration backoffBase;
    private final Duration backoffMax;
    private final int maxReconnectAttempts;
    private final int pullMessageLimit;
    private final boolean restartOnFailure;
    private final Duration restartDelay;
    private final Duration gracefulStopTimeout;
    private final Duration terminateTimeout;
    private final Path outputRoot;
    private final String personTopic;

    private PipelineSettings(Builder b) {
        this.postDetectionDuration = b.postDetectionDuration;
        this.tickInterval = b.tickInterval;
        this.subscriptionDuration = b.subscriptionDuration;
        this.renewMargin = b.renewMargin;
        this.backoffBase = b.backoffBase;
        this.backoffMax = b.backoffMax;
        this.maxReconnectAttempts = b.maxReconnectAttempts;
        this.pullMessageLimit = b.pullMessageLimit;
        this.restartOnFailure = b.restartOnFailure;
        this.restartDelay = b.restartDelay;
        this.gracefulStopTimeout = b.gracefulStopTimeout;
        this.terminateTimeout = b.terminateTimeout;
        this.outputRoot = b.outputRoot;
        this.personTopic = b.personTopic;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /** @return how long a recording continues after the last positive detection */
    public Duration getPostDetectionDuration() {
        return postDetectionDuration;
    }

    /** @return upper bound on a single wait for notifications */
    public Duration getTickInterval() {
        return tickInterval;
    }

    /** @return subscription lifetime requested from the device */
    public Duration getSubscriptionDuration() {
        return subscriptionDuration;
    }

    /** @return how long before expiry a subscription is renewed */
    public Duration getRenewMargin() {
        return renewMargin;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public Duration getBackoffMax() {
        return backoffMax;
    }

    /** @return consecutive failed connects tolerated, {@code 0} for unbounded */
    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public int getPullMessageLimit() {
        return pullMessageLimit;
    }

    public boolean isRestartOnFailure() {
        return restartOnFailure;
    }

    public Duration getRestartDelay() {
        return restartDelay;
    }

    public Duration getGracefulStopTimeout() {
        return gracefulStopTimeout;
    }

    public Duration getTerminateTimeout() {
        return terminateTimeout;
    }

    public Path getOutputRoot() {
        return outputRoot;
    }

    public String getPersonTopic() {
        return personTopic;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link PipelineSettings}.
     */
    public static class Builder {
        private Duration postDetectionDuration = Duration.ofSeconds(15);
        private Duration tickInterval = Duration.ofSeconds(1);
        private Duration subscriptionDuration = Duration.ofSeconds(60);
        private Duration renewMargin = Duration.ofSeconds(10);
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration backoffMax = Duration.ofSeconds(60);
        private int maxReconnectAttempts;
        private int pullMessageLimit = 10;
        private boolean restartOnFailure = true;
        private Duration restartDelay = Duration.ofSeconds(30);
        private Duration gracefulStopTimeout = Duration.ofSeconds(10);
        private Duration terminateTimeout = Duration.ofSeconds(2);
        private Path outputRoot = Path.of("recordings");
        private String personTopic = "PeopleDetect";

        public Builder postDetectionDuration(Duration v) {
            this.postDetectionDuration = v;
            return this;
        }

        public Builder tickInterval(Duration v) {
            this.tickInterval = v;
            return this;
        }

        public Builder subscriptionDuration(Duration v) {
            this.subscriptionDuration = v;
            return this;
        }

        public Builder renewMargin(Duration v) {
            this.renewMargin = v;
            return this;
        }

        public Builder backoffBase(Duration v) {
            this.backoffBase = v;
            return this;
        }

        public Builder backoffMax(Duration v) {
            this.backoffMax = v;
            return this;
        }

        public Builder maxReconnectAttempts(int v) {
            this.maxReconnectAttempts = v;
            return this;
        }

        public Builder pullMessageLimit(int v) {
            this.pullMessageLimit = v;
            return this;
        }

        public Builder restartOnFailure(boolean v) {
            this.restartOnFailure = v;
            return this;
        }

        public Builder restartDelay(Duration v) {
            this.restartDelay = v;
            return this;
        }

        public Builder gracefulStopTimeout(Duration v) {
            this.gracefulStopTimeout = v;
            return this;
        }

        public Builder terminateTimeout(Duration v) {
            this.terminateTimeout = v;
            return this;
        }

        public Builder outputRoot(Path v) {
            this.outputRoot = v;
            return this;
        }

        public Builder personTopic(String v) {
            this.personTopic = v;
            return this;
        }

        /**
         * Build and validate the settings.
         *
         * @return validated {@link PipelineSettings}
         * @throws IllegalArgumentException if any value is invalid
         */
        public PipelineSettings build() {
            requirePositive(postDetectionDuration, "postDetectionDuration");
            requirePositive(tickInterval, "tickInterval");
            requirePositive(subscriptionDuration, "subscriptionDuration");
            requirePositive(backoffBase, "backoffBase");
            requirePositive(backoffMax, "backoffMax");
            requirePositive(gracefulStopTimeout, "gracefulStopTimeout");
            requirePositive(terminateTimeout, "terminateTimeout");
            Objects.requireNonNull(renewMargin, "renewMargin required");
            Objects.requireNonNull(restartDelay, "restartDelay required");
            Objects.requireNonNull(outputRoot, "outputRoot required");

            if (renewMargin.isNegative() || renewMargin.compareTo(subscriptionDuration) >= 0) {
                throw new IllegalArgumentException(
                        "renewMargin must be in [0, subscriptionDuration), got: " + renewMargin);
            }
            if (backoffMax.compareTo(backoffBase) < 0) {
                throw new IllegalArgumentException(
                        "backoffMax must be >= backoffBase, got: " + backoffMax + " < " + backoffBase);
            }
            if (maxReconnectAttempts < 0) {
                throw new IllegalArgumentException(
                        "maxReconnectAttempts must be >= 0, got: " + maxReconnectAttempts);
            }
            if (pullMessageLimit < 1) {
                throw new IllegalArgumentException(
                        "pullMessageLimit must be >= 1, got: " + pullMessageLimit);
            }
            if (restartDelay.isNegative()) {
                throw new IllegalArgumentException("restartDelay must not be negative");
            }
            if (personTopic == null || personTopic.isBlank()) {
                throw new IllegalArgumentException("personTopic must not be null or blank");
            }
            return new PipelineSettings(this);
        }

        private static void requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " required");
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be > 0, got: " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "PipelineSettings{" +
                "postDetectionDuration=" + postDetectionDuration +
                ", tickInterval=" + tickInterval +
                ", subscriptionDuration=" + subscriptionDuration +
                ", renewMargin=" + renewMargin +
                ", backoff=" + backoffBase + ".." + backoffMax +
                ", maxReconnectAttempts=" + maxReconnectAttempts +
                ", restartOnFailure=" + restartOnFailure +
                ", outputRoot=" + outputRoot +
                ", personTopic='" + personTopic + '\'' +
                '}';
    }
}
