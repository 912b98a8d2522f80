package com.edgeroute.proxy.core.tls;

import com.edgeroute.proxy.core.routing.HostNormalizer;
import com.edgeroute.proxy.core.services.DecisionMetrics;
import com.edgeroute.proxy.core.store.InMemoryConfigStore;
import com.edgeroute.proxy.core.utils.SslUtils;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLServerSocket;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import java.io.IOException;
import java.net.Socket;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Full JSSE handshakes against a server whose certificates come from the store.
 */
class TlsHandshakeTest {

    private final AtomicInteger lookups = new AtomicInteger();
    private InMemoryConfigStore store;
    private SSLServerSocket server;
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws Exception {
        store = new InMemoryConfigStore();
        CertificateSelector selector = new CertificateSelector(store, HostNormalizer.defaults(),
                new DecisionMetrics(new SimpleMeterRegistry()));
        SSLContext serverContext = SslUtils.createServerContext(new SniKeyManager(name -> {
            lookups.incrementAndGet();
            return selector.selectCertificate(name);
        }));
        server = (SSLServerSocket) serverContext.getServerSocketFactory().createServerSocket(0);
        executor = Executors.newSingleThreadExecutor();
        executor.submit(() -> {
            while (!server.isClosed()) {
                try (SSLSocket accepted = (SSLSocket) server.accept()) {
                    accepted.startHandshake();
                    accepted.getInputStream().read();
                } catch (IOException e) {
                    // failed handshakes are expected in some tests
                }
            }
        });
    }

    @AfterEach
    void tearDown() throws IOException {
        server.close();
        executor.shutdownNow();
    }

    private X509Certificate handshake(String serverName) throws Exception {
        SSLContext clientContext = SSLContext.getInstance("TLS");
        clientContext.init(null, new TrustManager[] { new TrustAll() }, null);
        try (SSLSocket client = (SSLSocket) clientContext.getSocketFactory()
                .createSocket("127.0.0.1", server.getLocalPort())) {
            SSLParameters params = client.getSSLParameters();
            params.setServerNames(List.of(new SNIHostName(serverName)));
            client.setSSLParameters(params);
            client.setSoTimeout(5000);
            client.startHandshake();
            return (X509Certificate) client.getSession().getPeerCertificates()[0];
        }
    }

    @Test
    void handshake_rsaCertificateSelectedBySni() throws Exception {
        store.put("certs:app.example.com", TlsFixtures.recordJson("app.example.com"));

        assertThat(handshake("app.example.com").getSubjectX500Principal().getName())
                .isEqualTo("CN=app.example.com");
    }

    @Test
    void handshake_ecCertificateSelectedBySni() throws Exception {
        store.put("certs:app.example.com", TlsFixtures.recordJson("app.example.com"))
                .put("certs:api.example.com", TlsFixtures.recordJson("api.example.com"));

        assertThat(handshake("api.example.com").getSubjectX500Principal().getName())
                .isEqualTo("CN=api.example.com");
    }

    @Test
    void handshake_looksUpCertificateOncePerHandshake() throws Exception {
        store.put("certs:app.example.com", TlsFixtures.recordJson("app.example.com"))
                .put("certs:api.example.com", TlsFixtures.recordJson("api.example.com"));

        handshake("app.example.com");
        assertThat(lookups.get()).isEqualTo(1);

        handshake("api.example.com");
        assertThat(lookups.get()).isEqualTo(2);
    }

    @Test
    void handshake_certificateAddedAtRuntime_usedOnNextHandshake() throws Exception {
        assertThatThrownBy(() -> handshake("app.example.com")).isInstanceOf(IOException.class);

        store.put("certs:app.example.com", TlsFixtures.recordJson("app.example.com"));

        assertThat(handshake("app.example.com").getSubjectX500Principal().getName())
                .isEqualTo("CN=app.example.com");
    }

    private static final class TrustAll extends X509ExtendedTrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
