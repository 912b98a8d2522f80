package com.edgeroute.proxy.core.engine;

import com.edgeroute.proxy.config.ChallengeConfig;
import com.edgeroute.proxy.config.EdgerouteProperties;
import com.edgeroute.proxy.core.acme.ChallengeResponder;
import com.edgeroute.proxy.core.loadbalancer.LoadBalancerSelector;
import com.edgeroute.proxy.core.routing.BackendPoolResolver;
import com.edgeroute.proxy.core.routing.HostNormalizer;
import com.edgeroute.proxy.core.routing.RouteResolver;
import com.edgeroute.proxy.core.services.DecisionMetrics;
import com.edgeroute.proxy.core.services.MetricsService;
import com.edgeroute.proxy.core.store.ConfigStore;
import com.edgeroute.proxy.core.store.ConfigStoreFactory;
import com.edgeroute.proxy.core.tls.CertificateSelector;
import com.edgeroute.proxy.core.tls.SniKeyManager;
import com.edgeroute.proxy.core.utils.SslUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import javax.net.ssl.SSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide owner of the store pool, metrics, phases and listeners.
 *
 * <p>
 * Request-facing callers go through {@link #phases()}, which always returns the
 * phases built from the latest configuration. A reload that changes the store
 * settings opens a new store; the old one is closed after a drain grace period
 * so that requests still running on the previous phases can finish.
 * </p>
 */
public class EdgeRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EdgeRuntime.class);

    /** Default time a replaced store stays open for in-flight requests. */
    public static final Duration DEFAULT_STORE_DRAIN = Duration.ofSeconds(30);

    private final Function<EdgerouteProperties, ConfigStore> storeFactory;
    private final Duration storeDrain;
    private final ScheduledExecutorService retirementExecutor;
    private final List<ConfigStore> retiring = new ArrayList<>();
    private final MetricsService metricsService;
    private final DecisionMetrics decisionMetrics;

    private EdgerouteProperties properties;
    private ConfigStore store;
    private volatile EdgePhases phases;
    private ChallengeServer challengeServer;
    private boolean started;

    public EdgeRuntime(EdgerouteProperties properties) {
        this(properties, props -> ConfigStoreFactory.create(props.getStore()));
    }

    /**
     * Creates a runtime with a custom store factory.
     *
     * @param properties   Initial configuration.
     * @param storeFactory Builds the store for a configuration.
     */
    public EdgeRuntime(EdgerouteProperties properties, Function<EdgerouteProperties, ConfigStore> storeFactory) {
        this(properties, storeFactory, DEFAULT_STORE_DRAIN);
    }

    /**
     * Creates a runtime with a custom store factory and drain period.
     *
     * @param properties   Initial configuration.
     * @param storeFactory Builds the store for a configuration.
     * @param storeDrain   How long a store replaced by a reload stays open.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public EdgeRuntime(EdgerouteProperties properties, Function<EdgerouteProperties, ConfigStore> storeFactory,
            Duration storeDrain) {
        this.storeFactory = storeFactory;
        this.storeDrain = storeDrain;
        this.properties = properties;
        this.store = storeFactory.apply(properties);
        this.metricsService = new MetricsService(properties.getAdmin());
        this.decisionMetrics = new DecisionMetrics(metricsService.getRegistry());
        this.phases = buildPhases(properties, store);
        this.retirementExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "store-retirement");
            t.setDaemon(true);
            return t;
        });
    }

    private EdgePhases buildPhases(EdgerouteProperties props, ConfigStore configStore) {
        HostNormalizer normalizer = HostNormalizer.forSuffixes(props.getRouting().getWildcardSuffixes());
        RouteResolver routeResolver = new RouteResolver(configStore, normalizer, new BackendPoolResolver(configStore));
        return new EdgePhases(routeResolver,
                new LoadBalancerSelector(props.getBalancer()),
                new CertificateSelector(configStore, normalizer, decisionMetrics),
                new ChallengeResponder(configStore, decisionMetrics),
                decisionMetrics,
                props.getBalancer().getWorkerId());
    }

    /**
     * Starts the challenge listener if enabled.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        startChallengeServer(properties.getChallenge());
        started = true;
        log.info("Edge runtime started (store: {})", properties.getStore().getBackend());
    }

    private void startChallengeServer(ChallengeConfig config) {
        if (!config.isEnabled()) {
            return;
        }
        challengeServer = new ChallengeServer(config, path -> phases.onChallenge(path));
        challengeServer.start();
    }

    /**
     * Applies a new configuration. Requests in flight keep the phases they
     * started with; a replaced store is closed once the drain period has passed.
     *
     * @param newProperties The new configuration.
     */
    public synchronized void reload(EdgerouteProperties newProperties) {
        ConfigStore oldStore = null;
        if (!Objects.equals(newProperties.getStore(), properties.getStore())) {
            ConfigStore newStore = storeFactory.apply(newProperties);
            oldStore = store;
            store = newStore;
            log.info("Store settings changed, switched to a new connection pool");
        }
        phases = buildPhases(newProperties, store);
        metricsService.updateConfig(newProperties.getAdmin());

        if (started && challengeChanged(properties.getChallenge(), newProperties.getChallenge())) {
            if (challengeServer != null) {
                challengeServer.stop();
                challengeServer = null;
            }
            startChallengeServer(newProperties.getChallenge());
        }
        properties = newProperties;
        if (oldStore != null) {
            retire(oldStore);
        }
    }

    private void retire(ConfigStore oldStore) {
        if (retirementExecutor.isShutdown()) {
            oldStore.close();
            return;
        }
        retiring.add(oldStore);
        retirementExecutor.schedule(() -> closeRetired(oldStore), storeDrain.toMillis(), TimeUnit.MILLISECONDS);
    }

    private synchronized void closeRetired(ConfigStore oldStore) {
        if (retiring.remove(oldStore)) {
            oldStore.close();
            log.debug("Closed store replaced by reload");
        }
    }

    private static boolean challengeChanged(ChallengeConfig a, ChallengeConfig b) {
        return a.isEnabled() != b.isEnabled() || a.getPort() != b.getPort()
                || !Objects.equals(a.getBindAddress(), b.getBindAddress());
    }

    /**
     * Returns the current phases.
     *
     * @return Phases built from the latest configuration.
     */
    public EdgePhases phases() {
        return phases;
    }

    /**
     * Creates a key manager that selects certificates through the current
     * phases on every handshake.
     *
     * @return A new key manager.
     */
    public SniKeyManager sniKeyManager() {
        return new SniKeyManager(serverName -> phases.onCertificate(serverName));
    }

    /**
     * Creates a server SSL context backed by {@link #sniKeyManager()}, for
     * engines that terminate TLS through JSSE.
     *
     * @return The SSL context.
     * @throws GeneralSecurityException if the context cannot be initialized.
     */
    public SSLContext createServerSslContext() throws GeneralSecurityException {
        return SslUtils.createServerContext(sniKeyManager());
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public MetricsService getMetricsService() {
        return metricsService;
    }

    /**
     * Returns the challenge listener port.
     *
     * @return The bound port, or -1 if the listener is not running.
     */
    public synchronized int getChallengePort() {
        return challengeServer == null ? -1 : challengeServer.getPort();
    }

    /**
     * Stops listeners and releases the store pool.
     */
    public synchronized void stop() {
        if (challengeServer != null) {
            challengeServer.stop();
            challengeServer = null;
        }
        metricsService.shutdown();
        retirementExecutor.shutdownNow();
        for (ConfigStore oldStore : retiring) {
            oldStore.close();
        }
        retiring.clear();
        if (store != null) {
            store.close();
            store = null;
        }
        started = false;
        log.info("Edge runtime stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
