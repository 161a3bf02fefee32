package com.hubrelay.webhooks.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("WebhookServerConfig Tests")
class WebhookServerConfigTest {

    @Nested
    @DisplayName("Builder")
    class BuilderTest {

        @Test
        @DisplayName("Should apply defaults")
        void shouldApplyDefaults() {
            WebhookServerConfig config = WebhookServerConfig.builder().rootSecret("root").build();

            assertThat(config.getPort()).isEqualTo(8080);
            assertThat(config.getPath()).isEqualTo("/webhook");
            assertThat(config.getAggregationTimeout()).isEqualTo(Duration.ofSeconds(1));
            assertThat(config.isAggregationEnabled()).isTrue();
            assertThat(config.getGlobalSecret()).isNull();
            assertThat(config.getSubscriptionFile()).isNull();
        }

        @Test
        @DisplayName("Should require a root secret")
        void shouldRequireRootSecret() {
            assertThatThrownBy(() -> WebhookServerConfig.builder().build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("rootSecret");
        }

        @Test
        @DisplayName("Should validate port, path and thread counts")
        void shouldValidateValues() {
            assertThatThrownBy(() -> WebhookServerConfig.builder().rootSecret("r").port(70000).build())
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> WebhookServerConfig.builder().rootSecret("r").path("webhook").build())
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> WebhookServerConfig.builder().rootSecret("r").maxThreads(1).build())
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> WebhookServerConfig.builder().rootSecret("r").deliveryThreads(0).build())
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Should strip trailing slashes and blank global secrets")
        void shouldNormalize() {
            WebhookServerConfig config = WebhookServerConfig.builder()
                    .rootSecret("r").path("/hooks/github/").globalSecret(" ").build();

            assertThat(config.getPath()).isEqualTo("/hooks/github");
            assertThat(config.getGlobalSecret()).isNull();
        }
    }

    @Nested
    @DisplayName("Key/value sources")
    class FromConfigTest {

        @Test
        @DisplayName("Should read every key")
        void shouldReadEveryKey() {
            WebhookServerConfig config = WebhookServerConfig.fromConfig(Map.of(
                    WebhookServerConfig.PORT, "9090",
                    WebhookServerConfig.PATH, "/gh",
                    WebhookServerConfig.ROOT_SECRET, "root",
                    WebhookServerConfig.GLOBAL_SECRET, "global",
                    WebhookServerConfig.AGGREGATION_TIMEOUT_MS, "250",
                    WebhookServerConfig.MAX_THREADS, "16",
                    WebhookServerConfig.DELIVERY_THREADS, "4",
                    WebhookServerConfig.SUBSCRIPTION_FILE, "/tmp/subs.json"));

            assertThat(config.getPort()).isEqualTo(9090);
            assertThat(config.getPath()).isEqualTo("/gh");
            assertThat(config.getRootSecret()).isEqualTo("root");
            assertThat(config.getGlobalSecret()).isEqualTo("global");
            assertThat(config.getAggregationTimeout()).isEqualTo(Duration.ofMillis(250));
            assertThat(config.getMaxThreads()).isEqualTo(16);
            assertThat(config.getDeliveryThreads()).isEqualTo(4);
            assertThat(config.getSubscriptionFile()).isEqualTo(Path.of("/tmp/subs.json"));
        }

        @Test
        @DisplayName("Should disable aggregation with a negative timeout")
        void shouldDisableAggregation() {
            WebhookServerConfig config = WebhookServerConfig.fromConfig(Map.of(
                    WebhookServerConfig.ROOT_SECRET, "root",
                    WebhookServerConfig.AGGREGATION_TIMEOUT_MS, "-1"));

            assertThat(config.isAggregationEnabled()).isFalse();
        }

        @Test
        @DisplayName("Should report a malformed number with its key")
        void shouldRejectMalformedNumber() {
            assertThatThrownBy(() -> WebhookServerConfig.fromConfig(Map.of(
                    WebhookServerConfig.ROOT_SECRET, "root",
                    WebhookServerConfig.PORT, "eighty")))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining(WebhookServerConfig.PORT);
        }
    }
}
