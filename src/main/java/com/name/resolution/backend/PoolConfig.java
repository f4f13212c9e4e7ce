package com.name.resolution.backend;

import java.time.Duration;

/**
 * Connection pool settings for the lookup database.
 * Defaults: 20 connections at most, 10 kept idle, each retired after 5 minutes.
 */
public class PoolConfig {

    private final int maxPoolSize;
    private final int minIdle;
    private final Duration maxLifetime;
    private final Duration connectionTimeout;

    private PoolConfig(Builder builder) {
        this.maxPoolSize = builder.maxPoolSize;
        this.minIdle = builder.minIdle;
        this.maxLifetime = builder.maxLifetime;
        this.connectionTimeout = builder.connectionTimeout;
    }

    public int getMaxPoolSize() { return maxPoolSize; }
    public int getMinIdle() { return minIdle; }
    public Duration getMaxLifetime() { return maxLifetime; }
    public Duration getConnectionTimeout() { return connectionTimeout; }

    public static PoolConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxPoolSize = 20;
        private int minIdle = 10;
        private Duration maxLifetime = Duration.ofMinutes(5);
        private Duration connectionTimeout = Duration.ofSeconds(5);

        public Builder maxPoolSize(int maxPoolSize) {
            if (maxPoolSize <= 0) throw new IllegalArgumentException("maxPoolSize must be > 0");
            this.maxPoolSize = maxPoolSize;
            return this;
        }

        public Builder minIdle(int minIdle) {
            if (minIdle < 0) throw new IllegalArgumentException("minIdle must be >= 0");
            this.minIdle = minIdle;
            return this;
        }

        /**
         * Age after which a connection is retired. The pool needs at least 30 seconds.
         */
        public Builder maxLifetime(Duration maxLifetime) {
            if (maxLifetime == null || maxLifetime.getSeconds() < 30) {
                throw new IllegalArgumentException("maxLifetime must be at least 30s");
            }
            this.maxLifetime = maxLifetime;
            return this;
        }

        /**
         * How long a caller waits for a free connection before the query fails.
         */
        public Builder connectionTimeout(Duration connectionTimeout) {
            if (connectionTimeout == null || connectionTimeout.toMillis() < 250) {
                throw new IllegalArgumentException("connectionTimeout must be at least 250ms");
            }
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public PoolConfig build() {
            if (minIdle > maxPoolSize) {
                throw new IllegalArgumentException("minIdle cannot exceed maxPoolSize");
            }
            return new PoolConfig(this);
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "maxPoolSize=" + maxPoolSize +
                ", minIdle=" + minIdle +
                ", maxLifetime=" + maxLifetime +
                ", connectionTimeout=" + connectionTimeout +
                '}';
    }
}
