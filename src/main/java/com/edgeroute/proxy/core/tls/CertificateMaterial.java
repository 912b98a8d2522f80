package com.edgeroute.proxy.core.tls;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.security.PrivateKey;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;

/**
 * Certificate chain and private key ready to be installed into a handshake.
 */
public final class CertificateMaterial {

    private final String domain;
    private final X509Certificate[] chain;
    private final PrivateKey privateKey;

    /**
     * @param domain     Store domain the material was found under.
     * @param chain      Leaf first.
     * @param privateKey Key matching the leaf certificate.
     */
    public CertificateMaterial(String domain, X509Certificate[] chain, PrivateKey privateKey) {
        this.domain = domain;
        this.chain = chain.clone();
        this.privateKey = privateKey;
    }

    public String getDomain() {
        return domain;
    }

    public X509Certificate[] getChain() {
        return chain.clone();
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public PrivateKey getPrivateKey() {
        return privateKey;
    }

    /**
     * Returns the chain in DER encoding, leaf first.
     *
     * @return One DER blob per certificate.
     * @throws CertificateEncodingException if a certificate cannot be encoded.
     */
    public List<byte[]> getChainDer() throws CertificateEncodingException {
        List<byte[]> der = new ArrayList<>(chain.length);
        for (X509Certificate certificate : chain) {
            der.add(certificate.getEncoded());
        }
        return der;
    }

    /**
     * Returns the private key in PKCS#8 DER encoding.
     *
     * @return The encoded key.
     */
    public byte[] getPrivateKeyDer() {
        return privateKey.getEncoded();
    }

    @Override
    public String toString() {
        return "CertificateMaterial{domain=" + domain + ", chainLength=" + chain.length
                + ", keyAlgorithm=" + privateKey.getAlgorithm() + "}";
    }
}
