package com.edgeroute.proxy.core.utils;

import java.security.GeneralSecurityException;
import javax.net.ssl.KeyManager;
import javax.net.ssl.SSLContext;
import javax.net.ssl.X509ExtendedKeyManager;

/**
 * Provides utility methods for creating server SSL contexts.
 */
public class SslUtils {

    private SslUtils() {
        // Utility class
    }

    /**
     * Creates a server {@link SSLContext} whose certificates come from the given
     * key manager, e.g. an SNI-driven
     * {@link com.edgeroute.proxy.core.tls.SniKeyManager}.
     *
     * @param keyManager Key manager consulted on every handshake.
     * @return An initialized SSL context.
     * @throws GeneralSecurityException If the SSL context cannot be initialized.
     */
    public static SSLContext createServerContext(X509ExtendedKeyManager keyManager)
            throws GeneralSecurityException {
        SSLContext sslContext = SSLContext.getInstance("TLS");
        sslContext.init(new KeyManager[] { keyManager }, null, null);
        return sslContext;
    }
}
