package com.edgeroute.proxy.core.engine;

import com.edgeroute.proxy.config.ChallengeConfig;
import com.edgeroute.proxy.core.acme.ChallengeResponder;
import com.edgeroute.proxy.core.acme.ChallengeResponse;
import com.edgeroute.proxy.core.exceptions.ProxyException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plain HTTP listener that answers ACME HTTP-01 challenges. Every other path
 * gets 404.
 */
public class ChallengeServer {
    private static final Logger log = LoggerFactory.getLogger(ChallengeServer.class);

    private final ChallengeConfig config;
    private final Function<String, ChallengeResponse> handler;
    private HttpServer server;
    private ExecutorService executor;

    /**
     * @param config  Listener settings.
     * @param handler Maps a request path to its answer.
     */
    public ChallengeServer(ChallengeConfig config, Function<String, ChallengeResponse> handler) {
        this.config = config;
        this.handler = handler;
    }

    /**
     * Binds and starts the listener.
     *
     * @throws ProxyException if the port cannot be bound.
     */
    public void start() {
        InetSocketAddress address = config.getBindAddress() == null
                ? new InetSocketAddress(config.getPort())
                : new InetSocketAddress(config.getBindAddress(), config.getPort());
        try {
            server = HttpServer.create(address, 0);
        } catch (IOException e) {
            throw new ProxyException("Failed to start ACME challenge listener on " + address, e);
        }
        server.createContext(ChallengeResponder.PATH_PREFIX, this::handleChallenge);
        server.createContext("/", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        executor = Executors.newFixedThreadPool(4, r -> {
            Thread t = new Thread(r, "acme-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        log.info("ACME challenge listener started on port {}", getPort());
    }

    private void handleChallenge(HttpExchange exchange) throws IOException {
        try {
            ChallengeResponse response = handler.apply(exchange.getRequestURI().getPath());
            if (!response.hasBody() || "HEAD".equalsIgnoreCase(exchange.getRequestMethod())) {
                if (response.hasBody()) {
                    exchange.getResponseHeaders().set("Content-Type", response.contentType());
                }
                exchange.sendResponseHeaders(response.status(), -1);
                return;
            }
            byte[] body = response.body().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", response.contentType());
            exchange.sendResponseHeaders(response.status(), body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        } finally {
            exchange.close();
        }
    }

    /**
     * Returns the bound port.
     *
     * @return The port, or -1 if not running.
     */
    public int getPort() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    public ChallengeConfig getConfig() {
        return config;
    }

    public void stop() {
        if (server != null) {
            log.info("Stopping ACME challenge listener...");
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }
}
