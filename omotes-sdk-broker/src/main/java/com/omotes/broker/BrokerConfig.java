package com.omotes.broker;

import java.util.Objects;
import java.util.function.Function;

/**
 * Connection settings of the message broker, loaded from environment variables.
 * <p>
 * OMOTES_BROKER_HOST (default localhost), OMOTES_BROKER_PORT (default 6379),
 * OMOTES_BROKER_POLL_TIMEOUT_SECONDS: how long one blocking poll waits for a message (default 1).
 */
public final class BrokerConfig {

    private static final String ENV_HOST = "OMOTES_BROKER_HOST";
    private static final String ENV_PORT = "OMOTES_BROKER_PORT";
    private static final String ENV_POLL_TIMEOUT_SECONDS = "OMOTES_BROKER_POLL_TIMEOUT_SECONDS";

    private static final String DEFAULT_HOST = "localhost";
    private static final int DEFAULT_PORT = 6379;
    private static final int DEFAULT_POLL_TIMEOUT_SECONDS = 1;

    private final String host;
    private final int port;
    private final int pollTimeoutSeconds;

    private BrokerConfig(Builder b) {
        this.host = b.host;
        this.port = b.port;
        this.pollTimeoutSeconds = b.pollTimeoutSeconds;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    /** Seconds one blocking poll waits before the consumer loop re-checks its subscriptions. */
    public int getPollTimeoutSeconds() {
        return pollTimeoutSeconds;
    }

    public static BrokerConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static BrokerConfig fromEnvironment(Function<String, String> env) {
        return builder()
                .host(getEnv(env, ENV_HOST, DEFAULT_HOST))
                .port(parseInt(env.apply(ENV_PORT), DEFAULT_PORT))
                .pollTimeoutSeconds(parseInt(env.apply(ENV_POLL_TIMEOUT_SECONDS), DEFAULT_POLL_TIMEOUT_SECONDS))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "BrokerConfig{host=" + host + ", port=" + port + ", pollTimeoutSeconds=" + pollTimeoutSeconds + "}";
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private int pollTimeoutSeconds = DEFAULT_POLL_TIMEOUT_SECONDS;

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder pollTimeoutSeconds(int pollTimeoutSeconds) {
            this.pollTimeoutSeconds = Math.max(1, pollTimeoutSeconds);
            return this;
        }

        public BrokerConfig build() {
            return new BrokerConfig(this);
        }
    }
}
