package com.edgeroute.proxy.core.services;

import com.edgeroute.proxy.config.AdminConfig;
import com.sun.net.httpserver.HttpServer;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service providing application metrics via Micrometer and a simple HTTP admin
 * server.
 */
public class MetricsService {
    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);
    private final PrometheusMeterRegistry registry;
    private HttpServer adminServer;
    private ExecutorService executor;
    private AdminConfig config;

    public MetricsService(AdminConfig config) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.config = config;
        setupAdminServer();
    }

    private void setupAdminServer() {
        if (!config.isEnabled()) {
            return;
        }

        try {
            this.adminServer = HttpServer.create(new InetSocketAddress(config.getBindAddress(), config.getPort()), 0);

            // Health check endpoint
            adminServer.createContext("/health", exchange -> {
                byte[] response = "OK".getBytes(StandardCharsets.UTF_8);
                exchange.sendResponseHeaders(200, response.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(response);
                }
            });

            // Metrics endpoint (Prometheus format)
            adminServer.createContext("/metrics", exchange -> {
                byte[] bytes = registry.scrape().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            });

            this.executor = Executors.newFixedThreadPool(2, r -> {
                Thread t = new Thread(r, "admin-http");
                t.setDaemon(true);
                return t;
            });
            adminServer.setExecutor(executor);
            adminServer.start();
            log.info("Admin server started on port {} (/health, /metrics)", getPort());
        } catch (IOException e) {
            log.error("Failed to start admin server: {}", e.getMessage());
            this.adminServer = null;
        }
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Returns the port the admin server is bound to.
     *
     * @return The bound port, or -1 if the server is not running.
     */
    public int getPort() {
        return adminServer == null ? -1 : adminServer.getAddress().getPort();
    }

    public void updateConfig(AdminConfig newConfig) {
        if (newConfig.isEnabled() != config.isEnabled() || newConfig.getPort() != config.getPort()
                || !Objects.equals(newConfig.getBindAddress(), config.getBindAddress())) {
            shutdown();
            this.config = newConfig;
            setupAdminServer();
        }
    }

    public void shutdown() {
        if (adminServer != null) {
            log.info("Stopping admin server...");
            adminServer.stop(0);
            adminServer = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }
}
