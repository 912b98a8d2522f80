package com.edgeroute.proxy.core.engine;

import com.edgeroute.proxy.config.EdgerouteProperties;
import com.edgeroute.proxy.core.store.ConfigStore;
import com.edgeroute.proxy.core.store.InMemoryConfigStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLContext;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class EdgeRuntimeTest {

    private final List<InMemoryConfigStore> created = new ArrayList<>();
    private EdgeRuntime runtime;

    private ConfigStore newStore(EdgerouteProperties props) {
        InMemoryConfigStore store = new InMemoryConfigStore();
        store.addMembers("routes:index:host:app.example.com", "r1")
                .put("routes:r1", "{\"path\":\"/\"}")
                .append("upstreams:r1", "10.0.0.5:8080");
        created.add(store);
        return store;
    }

    private static EdgerouteProperties props(int challengePort) {
        EdgerouteProperties props = new EdgerouteProperties();
        props.getStore().setBackend("memory");
        props.getAdmin().setEnabled(false);
        props.getChallenge().setBindAddress("127.0.0.1");
        props.getChallenge().setPort(challengePort);
        return props;
    }

    private static int freePort() throws Exception {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        runtime = new EdgeRuntime(props(freePort()), this::newStore);
        runtime.start();
    }

    @AfterEach
    void tearDown() {
        runtime.stop();
    }

    @Test
    void phases_routeThroughStore() {
        RequestContext context = new RequestContext("app.example.com", "/", "10.1.1.1", 0);

        assertThat(runtime.phases().onAccess(context).isContinue()).isTrue();
        assertThat(runtime.phases().onBalance(context).authority()).isEqualTo("10.0.0.5:8080");
    }

    @Test
    void start_opensChallengeListener() {
        assertThat(runtime.getChallengePort()).isPositive();
    }

    @Test
    void reload_sameStoreSettings_keepsStore() throws Exception {
        EdgePhases before = runtime.phases();
        EdgerouteProperties next = props(runtime.getChallengePort());
        next.getBalancer().setWorkerId(3);

        runtime.reload(next);

        assertThat(created).hasSize(1);
        assertThat(runtime.phases()).isNotSameAs(before);
    }

    @Test
    void reload_storeSettingsChanged_swapsStore() {
        EdgerouteProperties next = props(runtime.getChallengePort());
        next.getStore().setDatabase(2);

        runtime.reload(next);

        assertThat(created).hasSize(2);
        RequestContext context = new RequestContext("app.example.com", "/", null, 0);
        assertThat(runtime.phases().onAccess(context).isContinue()).isTrue();
    }

    @Test
    void reload_storeSettingsChanged_oldStoreServesInFlightRequestsUntilDrained() throws Exception {
        List<InMemoryConfigStore> spies = new ArrayList<>();
        EdgeRuntime draining = new EdgeRuntime(props(freePort()), props -> {
            InMemoryConfigStore store = spy((InMemoryConfigStore) newStore(props));
            spies.add(store);
            return store;
        }, Duration.ofMillis(300));
        try {
            EdgePhases inFlight = draining.phases();
            EdgerouteProperties next = props(freePort());
            next.getStore().setDatabase(2);

            draining.reload(next);

            verify(spies.get(0), never()).close();
            RequestContext context = new RequestContext("app.example.com", "/", null, 0);
            assertThat(inFlight.onAccess(context).isContinue()).isTrue();
            await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> verify(spies.get(0)).close());
            verify(spies.get(1), never()).close();
        } finally {
            draining.stop();
        }
    }

    @Test
    void stop_closesStoresStillDraining() throws Exception {
        List<InMemoryConfigStore> spies = new ArrayList<>();
        EdgeRuntime draining = new EdgeRuntime(props(freePort()), props -> {
            InMemoryConfigStore store = spy((InMemoryConfigStore) newStore(props));
            spies.add(store);
            return store;
        }, Duration.ofMinutes(5));
        EdgerouteProperties next = props(freePort());
        next.getStore().setDatabase(2);
        draining.reload(next);

        draining.stop();

        verify(spies.get(0)).close();
        verify(spies.get(1)).close();
    }

    @Test
    void reload_challengePortChanged_rebindsListener() throws Exception {
        int newPort = freePort();
        runtime.reload(props(newPort));

        assertThat(runtime.getChallengePort()).isEqualTo(newPort);
    }

    @Test
    void reload_challengeDisabled_stopsListener() throws Exception {
        EdgerouteProperties next = props(runtime.getChallengePort());
        next.getChallenge().setEnabled(false);

        runtime.reload(next);

        assertThat(runtime.getChallengePort()).isEqualTo(-1);
    }

    @Test
    void createServerSslContext_isInitialized() throws Exception {
        SSLContext context = runtime.createServerSslContext();

        assertThat(context.getServerSocketFactory()).isNotNull();
        assertThat(runtime.sniKeyManager().getCertificateChain("app.example.com")).isNull();
    }
}
