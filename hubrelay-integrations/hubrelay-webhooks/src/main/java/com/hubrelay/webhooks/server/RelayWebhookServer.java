package com.hubrelay.webhooks.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubrelay.webhooks.config.WebhookServerConfig;
import com.hubrelay.webhooks.intake.DecodedDelivery;
import com.hubrelay.webhooks.intake.RejectionReason;
import com.hubrelay.webhooks.intake.WebhookDispatcher;
import com.hubrelay.webhooks.intake.WebhookRejectedException;
import com.hubrelay.webhooks.intake.WebhookRequest;
import com.hubrelay.webhooks.intake.WebhookRequestDecoder;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Embedded Jetty HTTP server receiving GitHub webhook deliveries.
 *
 * <h2>Endpoints</h2>
 * <pre>
 *   POST {path}/{subscriptionId}
 *   POST {path}?id={subscriptionId}
 * </pre>
 *
 * <h2>Usage</h2>
 * <pre>
 *   RelayWebhookServer server = new RelayWebhookServer(config, decoder, dispatcher, mapper);
 *   server.start();
 *   // ... application runs ...
 *   server.stop();
 * </pre>
 */
public class RelayWebhookServer {

    private static final Logger log = LoggerFactory.getLogger(RelayWebhookServer.class);

    private final WebhookServerConfig   config;
    private final WebhookRequestDecoder decoder;
    private final WebhookDispatcher     dispatcher;
    private final ObjectMapper          mapper;

    private Server          jettyServer;
    private ServerConnector connector;

    public RelayWebhookServer(WebhookServerConfig config, WebhookRequestDecoder decoder,
                              WebhookDispatcher dispatcher, ObjectMapper mapper) {
        this.config = config;
        this.decoder = decoder;
        this.dispatcher = dispatcher;
        this.mapper = mapper;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    public void start() throws Exception {
        QueuedThreadPool pool = new QueuedThreadPool(config.getMaxThreads(), 2);
        pool.setName("hubrelay-http");
        jettyServer = new Server(pool);

        connector = new ServerConnector(jettyServer);
        connector.setPort(config.getPort());
        jettyServer.addConnector(connector);

        ServletContextHandler ctx = new ServletContextHandler();
        ctx.setContextPath("/");
        String mapping = "/".equals(config.getPath()) ? "/*" : config.getPath() + "/*";
        ctx.addServlet(new ServletHolder(new WebhookServlet()), mapping);
        jettyServer.setHandler(ctx);

        jettyServer.start();
        log.info("Webhook server listening on port {} at path {}", getPort(), config.getPath());
    }

    public void stop() throws Exception {
        if (jettyServer != null) {
            jettyServer.stop();
            log.info("Webhook server stopped");
        }
    }

    /** The bound port; differs from the configured one when that was 0. */
    public int getPort() {
        return connector != null && connector.getLocalPort() > 0 ? connector.getLocalPort() : config.getPort();
    }

    // ------------------------------------------------------------------
    // Internal servlet
    // ------------------------------------------------------------------

    private class WebhookServlet extends HttpServlet {

        @Override
        protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            // read the body before touching parameters so form decoding never consumes it
            byte[] body = req.getInputStream().readAllBytes();
            WebhookRequest request = new WebhookRequest(subscriptionId(req), headers(req), body);

            DecodedDelivery delivery;
            try {
                delivery = decoder.decode(request);
            } catch (WebhookRejectedException e) {
                reject(resp, e);
                return;
            }

            try {
                dispatcher.handle(delivery);
            } catch (RuntimeException e) {
                log.error("Failed to dispatch {}", delivery, e);
                respond(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR,
                        Map.of("status", "error", "message", "Internal error"));
                return;
            }
            respond(resp, HttpServletResponse.SC_OK, Map.of("status", "accepted"));
        }

        private String subscriptionId(HttpServletRequest req) {
            String pathInfo = req.getPathInfo();
            if (pathInfo != null && pathInfo.length() > 1) {
                String id = pathInfo.substring(1);
                return id.endsWith("/") ? id.substring(0, id.length() - 1) : id;
            }
            return req.getParameter("id");
        }

        private Map<String, String> headers(HttpServletRequest req) {
            Map<String, String> headers = new LinkedHashMap<>();
            for (String name : Collections.list(req.getHeaderNames())) {
                headers.put(name, req.getHeader(name));
            }
            return headers;
        }
    }

    private void reject(HttpServletResponse resp, WebhookRejectedException e) throws IOException {
        RejectionReason reason = e.getReason();
        switch (reason) {
            case UNSUPPORTED_EVENT_KIND -> log.info("Ignoring delivery: {}", e.getMessage());
            case INVALID_SIGNATURE -> log.warn("Rejected webhook delivery: {}", e.getMessage());
            case STORE_UNAVAILABLE -> log.error("Rejected webhook delivery: {}", e.getMessage(), e);
            default -> log.debug("Rejected webhook delivery ({}): {}", reason, e.getMessage());
        }
        Map<String, String> document = new LinkedHashMap<>();
        document.put("status", reason == RejectionReason.UNSUPPORTED_EVENT_KIND ? "ignored" : "rejected");
        document.put("reason", reason.name());
        document.put("message", e.getMessage());
        respond(resp, reason.getHttpStatus(), document);
    }

    private void respond(HttpServletResponse resp, int status, Map<String, String> document) throws IOException {
        resp.setStatus(status);
        resp.setContentType("application/json");
        resp.setCharacterEncoding("UTF-8");
        resp.getWriter().write(mapper.writeValueAsString(document));
    }
}
