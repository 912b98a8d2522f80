package com.edgeroute.proxy.core.tls;

import com.edgeroute.proxy.core.constants.StoreKeys;
import com.edgeroute.proxy.core.exceptions.CertificateLoadException;
import com.edgeroute.proxy.core.exceptions.StoreUnavailableException;
import com.edgeroute.proxy.core.routing.HostNormalizer;
import com.edgeroute.proxy.core.services.DecisionMetrics;
import com.edgeroute.proxy.core.store.ConfigStore;
import com.edgeroute.proxy.core.store.StoreSession;
import com.edgeroute.proxy.core.utils.JsonDocuments;
import com.edgeroute.proxy.entity.CertificateRecord;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the certificate to present for a TLS server name.
 *
 * <p>
 * Never fails the handshake: a missing record, a malformed record, an
 * unreadable file, bad PEM or an unreachable store all yield empty, and the
 * engine falls back to its default certificate.
 * </p>
 */
public class CertificateSelector {

    private static final Logger log = LoggerFactory.getLogger(CertificateSelector.class);

    private final ConfigStore store;
    private final HostNormalizer normalizer;
    private final DecisionMetrics metrics;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public CertificateSelector(ConfigStore store, HostNormalizer normalizer, DecisionMetrics metrics) {
        this.store = store;
        this.normalizer = normalizer;
        this.metrics = metrics;
    }

    /**
     * Looks up and loads the certificate for a server name.
     *
     * @param serverName Raw SNI name; null when the client sent none.
     * @return The material, or empty.
     */
    public Optional<CertificateMaterial> selectCertificate(String serverName) {
        if (serverName == null || serverName.isEmpty()) {
            metrics.certificateLookup("no_sni");
            return Optional.empty();
        }
        try {
            Optional<CertificateRecord> record = findRecord(serverName);
            if (record.isEmpty()) {
                metrics.certificateLookup("missing");
                return Optional.empty();
            }
            CertificateMaterial material = load(record.get());
            metrics.certificateLookup("found");
            return Optional.of(material);
        } catch (StoreUnavailableException e) {
            log.error("Store unavailable while selecting certificate for {}: {}", serverName, e.getMessage());
        } catch (CertificateLoadException e) {
            log.error("Cannot load certificate for {}: {}", serverName, e.getMessage());
        }
        metrics.certificateLookup("error");
        return Optional.empty();
    }

    private Optional<CertificateRecord> findRecord(String serverName) {
        String normalized = normalizer.normalize(serverName);
        try (StoreSession session = store.openSession()) {
            String domain = normalized;
            Optional<String> json = session.get(StoreKeys.CERTIFICATE.key(domain));
            if (json.isEmpty() && !normalized.equals(serverName)) {
                domain = serverName;
                json = session.get(StoreKeys.CERTIFICATE.key(domain));
            }
            if (json.isEmpty()) {
                log.debug("No certificate stored for {} (normalized {})", serverName, normalized);
                return Optional.empty();
            }
            String key = StoreKeys.CERTIFICATE.key(domain);
            Optional<CertificateRecord> record = JsonDocuments.read(json.get(), CertificateRecord.class, key);
            if (record.isEmpty()) {
                return Optional.empty();
            }
            if (!record.get().hasMaterial()) {
                log.warn("Certificate record {} names no certificate and key", key);
                return Optional.empty();
            }
            // The alias handed to JSSE is the key the record was found under.
            record.get().setDomain(domain);
            return record;
        }
    }

    /**
     * Reads and converts the PEM material a record refers to. Inline PEM takes
     * precedence over file paths.
     *
     * @param record The certificate record.
     * @return Loaded material.
     * @throws CertificateLoadException if reading or conversion fails.
     */
    static CertificateMaterial load(CertificateRecord record) {
        String certPem = inlineOrFile(record.getCertPem(), record.getCertPath());
        String keyPem = inlineOrFile(record.getKeyPem(), record.getKeyPath());
        X509Certificate[] chain = PemUtils.parseCertificateChain(certPem);
        PrivateKey key = PemUtils.parsePrivateKey(keyPem);
        return new CertificateMaterial(record.getDomain(), chain, key);
    }

    private static String inlineOrFile(String inline, String path) {
        if (inline != null && !inline.isBlank()) {
            return inline;
        }
        if (path == null || path.isBlank()) {
            throw new CertificateLoadException("No PEM path configured");
        }
        try {
            return Files.readString(Path.of(path), StandardCharsets.UTF_8);
        } catch (IOException | InvalidPathException e) {
            throw new CertificateLoadException("Cannot read " + path + ": " + e.getMessage(), e);
        }
    }
}
