package com.edgeroute.proxy.core.tls;

import java.net.Socket;
import java.security.Principal;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import javax.net.ssl.ExtendedSSLSession;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SNIServerName;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLSession;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.X509ExtendedKeyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server-side key manager that picks the certificate by the SNI name of each
 * handshake.
 *
 * <p>
 * JSSE asks for an alias once per candidate key type. The lookup runs on the
 * first request of a handshake and its result is kept on the handshake session;
 * later requests of the same handshake only check the key type. Every
 * selection gets its own alias of the form {@code domain#n}, so concurrent
 * handshakes for the same domain never read each other's material. The alias
 * is released once JSSE has read both the key and the chain, or after
 * {@link #SELECTION_TTL_MILLIS} if the handshake is abandoned in between.
 * </p>
 */
public class SniKeyManager extends X509ExtendedKeyManager {

    private static final Logger log = LoggerFactory.getLogger(SniKeyManager.class);

    private static final String SESSION_KEY = SniKeyManager.class.getName() + ".selection";

    /** Age after which an unread selection is dropped. */
    static final long SELECTION_TTL_MILLIS = 60_000;

    private final Function<String, Optional<CertificateMaterial>> lookup;
    private final Map<String, Selection> selections = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * @param lookup Resolves a server name to material, typically
     *               {@link CertificateSelector#selectCertificate(String)}.
     */
    public SniKeyManager(Function<String, Optional<CertificateMaterial>> lookup) {
        this.lookup = lookup;
    }

    @Override
    public String chooseEngineServerAlias(String keyType, Principal[] issuers, SSLEngine engine) {
        return chooseAlias(keyType, engine == null ? null : engine.getHandshakeSession());
    }

    @Override
    public String chooseServerAlias(String keyType, Principal[] issuers, Socket socket) {
        SSLSession session = socket instanceof SSLSocket sslSocket ? sslSocket.getHandshakeSession() : null;
        return chooseAlias(keyType, session);
    }

    private String chooseAlias(String keyType, SSLSession session) {
        String serverName = requestedServerName(session);
        if (serverName == null) {
            return null;
        }
        Selection selection = selectionFor(serverName, session);
        if (selection.material == null) {
            return null;
        }
        String keyAlgorithm = selection.material.getPrivateKey().getAlgorithm();
        if (!keyTypeMatches(keyType, keyAlgorithm)) {
            log.debug("Certificate for {} has a {} key, handshake asked for {}", serverName, keyAlgorithm, keyType);
            return null;
        }
        selections.putIfAbsent(selection.alias, selection);
        return selection.alias;
    }

    private Selection selectionFor(String serverName, SSLSession session) {
        Object memo = session.getValue(SESSION_KEY);
        if (memo instanceof Selection previous && previous.serverName.equals(serverName)) {
            return previous;
        }
        purgeExpired();
        CertificateMaterial material = lookup.apply(serverName).orElse(null);
        String alias = material == null ? null : material.getDomain() + "#" + sequence.incrementAndGet();
        Selection selection = new Selection(serverName, material, alias, System.currentTimeMillis());
        session.putValue(SESSION_KEY, selection);
        return selection;
    }

    private void purgeExpired() {
        long cutoff = System.currentTimeMillis() - SELECTION_TTL_MILLIS;
        selections.values().removeIf(selection -> selection.createdAt < cutoff);
    }

    private void release(Selection selection) {
        if (selection.keyRead && selection.chainRead) {
            selections.remove(selection.alias, selection);
        }
    }

    /**
     * Number of selections whose material has not been fully read yet.
     *
     * @return Pending selection count.
     */
    int pendingSelections() {
        return selections.size();
    }

    /**
     * Extracts the SNI host name from a handshake session.
     *
     * @param session Handshake session, may be null.
     * @return The ASCII server name, or null if none was sent.
     */
    static String requestedServerName(SSLSession session) {
        if (!(session instanceof ExtendedSSLSession extended)) {
            return null;
        }
        List<SNIServerName> names = extended.getRequestedServerNames();
        for (SNIServerName name : names) {
            if (name instanceof SNIHostName hostName) {
                return hostName.getAsciiName();
            }
        }
        return null;
    }

    static boolean keyTypeMatches(String keyType, String keyAlgorithm) {
        if (keyType == null || keyType.equalsIgnoreCase(keyAlgorithm)) {
            return true;
        }
        if ("RSA".equals(keyAlgorithm)) {
            return keyType.startsWith("RSA");
        }
        if ("EC".equals(keyAlgorithm)) {
            return keyType.startsWith("EC");
        }
        return ("EdDSA".equals(keyAlgorithm) || "Ed25519".equals(keyAlgorithm))
                && ("EdDSA".equals(keyType) || "Ed25519".equals(keyType));
    }

    @Override
    public X509Certificate[] getCertificateChain(String alias) {
        Selection selection = alias == null ? null : selections.get(alias);
        if (selection == null) {
            return null;
        }
        selection.chainRead = true;
        release(selection);
        return selection.material.getChain();
    }

    @Override
    public PrivateKey getPrivateKey(String alias) {
        Selection selection = alias == null ? null : selections.get(alias);
        if (selection == null) {
            return null;
        }
        selection.keyRead = true;
        release(selection);
        return selection.material.getPrivateKey();
    }

    /**
     * Aliases only exist for the handshake that chose them, so none are listed.
     */
    @Override
    public String[] getServerAliases(String keyType, Principal[] issuers) {
        return null;
    }

    @Override
    public String[] getClientAliases(String keyType, Principal[] issuers) {
        return null;
    }

    @Override
    public String chooseClientAlias(String[] keyType, Principal[] issuers, Socket socket) {
        return null;
    }

    private static final class Selection {
        private final String serverName;
        private final CertificateMaterial material;
        private final String alias;
        private final long createdAt;
        private volatile boolean keyRead;
        private volatile boolean chainRead;

        private Selection(String serverName, CertificateMaterial material, String alias, long createdAt) {
            this.serverName = serverName;
            this.material = material;
            this.alias = alias;
            this.createdAt = createdAt;
        }
    }
}
