package com.hubrelay.webhooks;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubrelay.webhooks.aggregation.AggregationEngine;
import com.hubrelay.webhooks.aggregation.ExecutorDeadlineScheduler;
import com.hubrelay.webhooks.config.WebhookServerConfig;
import com.hubrelay.webhooks.handler.DeduplicatingDeliveryHandler;
import com.hubrelay.webhooks.handler.DeliveryHandler;
import com.hubrelay.webhooks.handler.LoggingDeliveryHandler;
import com.hubrelay.webhooks.intake.WebhookDispatcher;
import com.hubrelay.webhooks.intake.WebhookRequestDecoder;
import com.hubrelay.webhooks.model.ObjectMapperFactory;
import com.hubrelay.webhooks.security.HmacVerifier;
import com.hubrelay.webhooks.security.WebhookSecrets;
import com.hubrelay.webhooks.server.RelayWebhookServer;
import com.hubrelay.webhooks.subscription.InMemorySubscriptionStore;
import com.hubrelay.webhooks.subscription.JsonFileSubscriptionStore;
import com.hubrelay.webhooks.subscription.SubscriptionRegistry;
import com.hubrelay.webhooks.subscription.SubscriptionStore;
import com.hubrelay.webhooks.subscription.SubscriptionStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the relay together and runs it until the JVM exits.
 *
 * <p>Configuration comes from a properties file (the first argument, or
 * {@code hubrelay.properties} on the classpath) with {@code HUBRELAY_*}
 * environment variables taking precedence: {@code HUBRELAY_ROOT_SECRET}
 * overrides {@code hubrelay.root-secret}.
 */
public class HubRelayApplication {

    private static final Logger log = LoggerFactory.getLogger(HubRelayApplication.class);

    static final String DEFAULT_PROPERTIES = "hubrelay.properties";
    static final String ENV_PREFIX         = "HUBRELAY_";

    private final WebhookServerConfig       config;
    private final SubscriptionRegistry      registry;
    private final ExecutorDeadlineScheduler scheduler;
    private final ExecutorService           deliveryExecutor;
    private final AggregationEngine         engine;
    private final RelayWebhookServer        server;

    public HubRelayApplication(WebhookServerConfig config, DeliveryHandler handler) throws SubscriptionStoreException {
        this.config = config;
        ObjectMapper mapper = ObjectMapperFactory.create();
        SubscriptionStore store = config.getSubscriptionFile() != null
                ? JsonFileSubscriptionStore.open(config.getSubscriptionFile())
                : new InMemorySubscriptionStore();
        this.registry = new SubscriptionRegistry(store, new WebhookSecrets(config.getRootSecret()));

        DeliveryHandler deduplicating = new DeduplicatingDeliveryHandler(handler);
        WebhookDispatcher dispatcher;
        if (config.isAggregationEnabled()) {
            this.scheduler = new ExecutorDeadlineScheduler();
            this.deliveryExecutor = Executors.newFixedThreadPool(config.getDeliveryThreads(), namedThreads("hubrelay-delivery"));
            this.engine = new AggregationEngine(scheduler, config.getAggregationTimeout(), deduplicating, deliveryExecutor);
            dispatcher = new WebhookDispatcher(registry, deduplicating, engine);
        } else {
            this.scheduler = null;
            this.deliveryExecutor = null;
            this.engine = null;
            dispatcher = new WebhookDispatcher(registry, deduplicating);
        }

        WebhookRequestDecoder decoder = new WebhookRequestDecoder(registry, new HmacVerifier(), mapper,
                config.getGlobalSecret());
        this.server = new RelayWebhookServer(config, decoder, dispatcher, mapper);
    }

    public void start() throws Exception {
        server.start();
        log.info("Hub relay started: {}", config);
    }

    /** Stops accepting deliveries, then flushes and delivers every pending aggregation. */
    public void stop() throws Exception {
        server.stop();
        if (engine != null) {
            engine.shutdown();
        }
        if (scheduler != null) {
            scheduler.close();
        }
        if (deliveryExecutor != null) {
            deliveryExecutor.shutdown();
            if (!deliveryExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Delivery executor did not terminate within 10s");
            }
        }
        log.info("Hub relay stopped");
    }

    public SubscriptionRegistry getRegistry() { return registry; }
    public int getPort()                      { return server.getPort(); }

    public static void main(String[] args) throws Exception {
        WebhookServerConfig config = WebhookServerConfig.fromConfig(loadConfig(args, System.getenv()));
        HubRelayApplication application = new HubRelayApplication(config, new LoggingDeliveryHandler());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                application.stop();
            } catch (Exception e) {
                log.error("Error while stopping the hub relay", e);
            }
        }, "hubrelay-shutdown"));
        application.start();
    }

    /**
     * Reads the properties file named by {@code args[0]} (or the classpath
     * default) and applies {@code HUBRELAY_*} overrides from {@code env}.
     */
    static Map<String, String> loadConfig(String[] args, Map<String, String> env) {
        Properties properties = new Properties();
        try {
            if (args.length > 0) {
                try (InputStream in = Files.newInputStream(Path.of(args[0]))) {
                    properties.load(in);
                }
            } else {
                try (InputStream in = HubRelayApplication.class.getClassLoader().getResourceAsStream(DEFAULT_PROPERTIES)) {
                    if (in != null) {
                        properties.load(in);
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration", e);
        }
        Map<String, String> values = new HashMap<>();
        for (String name : properties.stringPropertyNames()) {
            values.put(name, properties.getProperty(name));
        }
        for (Map.Entry<String, String> entry : env.entrySet()) {
            if (entry.getKey().startsWith(ENV_PREFIX)) {
                values.put(propertyName(entry.getKey()), entry.getValue());
            }
        }
        return values;
    }

    /** {@code HUBRELAY_AGGREGATION_TIMEOUT_MS} to {@code hubrelay.aggregation-timeout-ms}. */
    static String propertyName(String envName) {
        return "hubrelay." + envName.substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT).replace('_', '-');
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
