package com.edgeroute.proxy.core.tls;

import com.edgeroute.proxy.core.exceptions.StoreUnavailableException;
import com.edgeroute.proxy.core.routing.HostNormalizer;
import com.edgeroute.proxy.core.services.DecisionMetrics;
import com.edgeroute.proxy.core.store.ConfigStore;
import com.edgeroute.proxy.core.store.InMemoryConfigStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CertificateSelectorTest {

    private InMemoryConfigStore store;
    private SimpleMeterRegistry registry;
    private CertificateSelector selector;

    @BeforeEach
    void setUp() {
        store = new InMemoryConfigStore();
        registry = new SimpleMeterRegistry();
        selector = new CertificateSelector(store, HostNormalizer.defaults(), new DecisionMetrics(registry));
    }

    private double lookups(String outcome) {
        return registry.counter(DecisionMetrics.CERT_LOOKUPS, "outcome", outcome).count();
    }

    @Test
    void selectCertificate_loadsFilesFromRecord() {
        store.put("certs:app.example.com", TlsFixtures.recordJson("app.example.com"));

        Optional<CertificateMaterial> material = selector.selectCertificate("app.example.com");

        assertThat(material).hasValueSatisfying(m -> {
            assertThat(m.getDomain()).isEqualTo("app.example.com");
            assertThat(m.getChain()[0].getSubjectX500Principal().getName()).isEqualTo("CN=app.example.com");
            assertThat(m.getPrivateKey().getAlgorithm()).isEqualTo("RSA");
        });
        assertThat(lookups("found")).isEqualTo(1.0);
    }

    @Test
    void selectCertificate_exposesDerEncodings() throws Exception {
        store.put("certs:app.example.com", TlsFixtures.recordJson("app.example.com"));

        CertificateMaterial material = selector.selectCertificate("app.example.com").orElseThrow();

        assertThat(material.getChainDer()).hasSize(1);
        assertThat(material.getChainDer().get(0)[0]).isEqualTo((byte) 0x30);
        assertThat(material.getPrivateKeyDer()[0]).isEqualTo((byte) 0x30);
    }

    @Test
    void selectCertificate_inlinePem() throws Exception {
        String json = "{\"cert_pem\":" + quote(TlsFixtures.read("api.example.com.crt"))
                + ",\"key_pem\":" + quote(TlsFixtures.read("api.example.com.key")) + "}";
        store.put("certs:api.example.com", json);

        assertThat(selector.selectCertificate("api.example.com")).hasValueSatisfying(
                m -> assertThat(m.getPrivateKey().getAlgorithm()).isEqualTo("EC"));
    }

    @Test
    void selectCertificate_normalizedNameFirst() {
        store.put("certs:app", TlsFixtures.recordJson("app.example.com"))
                .put("certs:app.10.0.0.1.nip.io", TlsFixtures.recordJson("api.example.com"));

        assertThat(selector.selectCertificate("app.10.0.0.1.nip.io")).get()
                .extracting(CertificateMaterial::getDomain).isEqualTo("app");
    }

    @Test
    void selectCertificate_fallsBackToRawName() {
        store.put("certs:app.10.0.0.1.nip.io", TlsFixtures.recordJson("app.example.com"));

        assertThat(selector.selectCertificate("app.10.0.0.1.nip.io")).get()
                .extracting(CertificateMaterial::getDomain).isEqualTo("app.10.0.0.1.nip.io");
    }

    @Test
    void selectCertificate_noSni_isEmpty() {
        assertThat(selector.selectCertificate(null)).isEmpty();
        assertThat(lookups("no_sni")).isEqualTo(1.0);
    }

    @Test
    void selectCertificate_unknownName_isEmpty() {
        assertThat(selector.selectCertificate("unknown.example.com")).isEmpty();
        assertThat(lookups("missing")).isEqualTo(1.0);
    }

    @Test
    void selectCertificate_malformedRecord_isEmpty() {
        store.put("certs:app.example.com", "{broken");

        assertThat(selector.selectCertificate("app.example.com")).isEmpty();
    }

    @Test
    void selectCertificate_recordWithoutPaths_isEmpty() {
        store.put("certs:app.example.com", "{\"domain\":\"app.example.com\"}");

        assertThat(selector.selectCertificate("app.example.com")).isEmpty();
    }

    @Test
    void selectCertificate_missingFile_isEmptyAndCountedAsError() {
        store.put("certs:app.example.com",
                "{\"cert_path\":\"/nonexistent/app.crt\",\"key_path\":\"/nonexistent/app.key\"}");

        assertThat(selector.selectCertificate("app.example.com")).isEmpty();
        assertThat(lookups("error")).isEqualTo(1.0);
    }

    @Test
    void selectCertificate_keyFileWithCertificate_isEmpty() {
        String certPath = TlsFixtures.path("app.example.com.crt").toString().replace("\\", "\\\\");
        store.put("certs:app.example.com",
                "{\"cert_path\":\"" + certPath + "\",\"key_path\":\"" + certPath + "\"}");

        assertThat(selector.selectCertificate("app.example.com")).isEmpty();
    }

    @Test
    void selectCertificate_storeFailure_isEmpty() {
        ConfigStore failing = mock(ConfigStore.class);
        when(failing.openSession()).thenThrow(new StoreUnavailableException("down"));
        CertificateSelector failingSelector = new CertificateSelector(failing, HostNormalizer.defaults(),
                new DecisionMetrics(registry));

        assertThat(failingSelector.selectCertificate("app.example.com")).isEmpty();
        assertThat(lookups("error")).isEqualTo(1.0);
    }

    private static String quote(String pem) {
        return "\"" + pem.replace("\n", "\\n") + "\"";
    }
}
