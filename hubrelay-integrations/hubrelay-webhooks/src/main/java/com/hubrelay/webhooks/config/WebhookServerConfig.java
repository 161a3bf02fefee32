package com.hubrelay.webhooks.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Immutable configuration for {@link com.hubrelay.webhooks.server.RelayWebhookServer}
 * and the components behind it.
 *
 * Build with the nested {@link Builder}:
 * <pre>
 *   WebhookServerConfig config = WebhookServerConfig.builder()
 *       .port(8080)
 *       .path("/webhook")
 *       .rootSecret("process-wide-root-secret")
 *       .aggregationTimeout(Duration.ofSeconds(1))
 *       .build();
 * </pre>
 *
 * or from key/value pairs with {@link #fromConfig(Map)}.
 */
public final class WebhookServerConfig {

    public static final String PORT                   = "hubrelay.port";
    public static final String PATH                   = "hubrelay.path";
    public static final String ROOT_SECRET            = "hubrelay.root-secret";
    public static final String GLOBAL_SECRET          = "hubrelay.global-secret";
    public static final String AGGREGATION_TIMEOUT_MS = "hubrelay.aggregation-timeout-ms";
    public static final String MAX_THREADS            = "hubrelay.max-threads";
    public static final String DELIVERY_THREADS       = "hubrelay.delivery-threads";
    public static final String SUBSCRIPTION_FILE      = "hubrelay.subscription-file";

    private final int      port;
    private final String   path;
    private final String   rootSecret;
    private final String   globalSecret;
    private final Duration aggregationTimeout;
    private final int      maxThreads;
    private final int      deliveryThreads;
    private final Path     subscriptionFile;

    private WebhookServerConfig(Builder b) {
        this.port               = b.port;
        this.path               = b.path;
        this.rootSecret         = b.rootSecret;
        this.globalSecret       = b.globalSecret;
        this.aggregationTimeout = b.aggregationTimeout;
        this.maxThreads         = b.maxThreads;
        this.deliveryThreads    = b.deliveryThreads;
        this.subscriptionFile   = b.subscriptionFile;
    }

    public int      getPort()               { return port; }
    public String   getPath()               { return path; }
    public String   getRootSecret()         { return rootSecret; }
    /** Optional secret accepted for every subscription; {@code null} if unset. */
    public String   getGlobalSecret()       { return globalSecret; }
    /** Negative when aggregation is disabled. */
    public Duration getAggregationTimeout() { return aggregationTimeout; }
    public int      getMaxThreads()         { return maxThreads; }
    public int      getDeliveryThreads()    { return deliveryThreads; }
    /** JSON file subscriptions are kept in; {@code null} keeps them in memory only. */
    public Path     getSubscriptionFile()   { return subscriptionFile; }

    public boolean isAggregationEnabled()   { return !aggregationTimeout.isNegative(); }

    public static Builder builder() { return new Builder(); }

    /**
     * Reads the {@code hubrelay.*} keys of {@code values}; absent keys keep
     * their defaults.
     *
     * @throws IllegalStateException if a value is malformed or the result is invalid
     */
    public static WebhookServerConfig fromConfig(Map<String, String> values) {
        Builder b = builder();
        String value;
        if ((value = get(values, PORT)) != null)                   b.port(parseInt(PORT, value));
        if ((value = get(values, PATH)) != null)                   b.path(value);
        if ((value = get(values, ROOT_SECRET)) != null)            b.rootSecret(value);
        if ((value = get(values, GLOBAL_SECRET)) != null)          b.globalSecret(value);
        if ((value = get(values, AGGREGATION_TIMEOUT_MS)) != null) b.aggregationTimeout(Duration.ofMillis(parseInt(AGGREGATION_TIMEOUT_MS, value)));
        if ((value = get(values, MAX_THREADS)) != null)            b.maxThreads(parseInt(MAX_THREADS, value));
        if ((value = get(values, DELIVERY_THREADS)) != null)       b.deliveryThreads(parseInt(DELIVERY_THREADS, value));
        if ((value = get(values, SUBSCRIPTION_FILE)) != null)      b.subscriptionFile(Path.of(value));
        return b.build();
    }

    private static String get(Map<String, String> values, String key) {
        String value = values.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    @Override
    public String toString() {
        return "WebhookServerConfig{port=" + port + ", path=" + path +
               ", globalSecret=" + (globalSecret != null ? "set" : "unset") +
               ", aggregationTimeout=" + (isAggregationEnabled() ? aggregationTimeout : "disabled") +
               ", maxThreads=" + maxThreads + ", deliveryThreads=" + deliveryThreads +
               ", subscriptionFile=" + subscriptionFile + '}';
    }

    public static final class Builder {
        private int      port    = 8080;
        private String   path    = "/webhook";
        private String   rootSecret;
        private String   globalSecret;
        private Duration aggregationTimeout = Duration.ofSeconds(1);
        private int      maxThreads = 10;
        private int      deliveryThreads = 2;
        private Path     subscriptionFile;

        public Builder port(int port)                           { this.port = port; return this; }
        public Builder path(String path)                        { this.path = path; return this; }
        public Builder rootSecret(String secret)                { this.rootSecret = secret; return this; }
        public Builder globalSecret(String secret)              { this.globalSecret = secret; return this; }
        public Builder aggregationTimeout(Duration timeout)     { this.aggregationTimeout = timeout; return this; }
        /** Shorthand for a negative timeout. */
        public Builder disableAggregation()                     { this.aggregationTimeout = Duration.ofMillis(-1); return this; }
        public Builder maxThreads(int maxThreads)               { this.maxThreads = maxThreads; return this; }
        public Builder deliveryThreads(int deliveryThreads)     { this.deliveryThreads = deliveryThreads; return this; }
        public Builder subscriptionFile(Path subscriptionFile)  { this.subscriptionFile = subscriptionFile; return this; }

        public WebhookServerConfig build() {
            if (rootSecret == null || rootSecret.isBlank()) {
                throw new IllegalStateException("rootSecret is required");
            }
            if (port < 0 || port > 65535) {
                throw new IllegalStateException("port must be between 0 and 65535, got " + port);
            }
            if (path == null || !path.startsWith("/")) {
                throw new IllegalStateException("path must start with '/', got " + path);
            }
            while (path.length() > 1 && path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            if (aggregationTimeout == null) {
                throw new IllegalStateException("aggregationTimeout is required");
            }
            if (maxThreads < 4) {
                throw new IllegalStateException("maxThreads must be at least 4, got " + maxThreads);
            }
            if (deliveryThreads < 1) {
                throw new IllegalStateException("deliveryThreads must be at least 1, got " + deliveryThreads);
            }
            if (globalSecret != null && globalSecret.isBlank()) {
                globalSecret = null;
            }
            return new WebhookServerConfig(this);
        }
    }
}
