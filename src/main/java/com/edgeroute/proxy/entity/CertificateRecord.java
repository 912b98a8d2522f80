package com.edgeroute.proxy.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Certificate reference stored under {@code certs:{domain}}.
 * Material is either read from {@code cert_path}/{@code key_path} or taken
 * inline from {@code cert_pem}/{@code key_pem}; inline payloads win.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CertificateRecord {
    private String domain;

    /** PEM file with the leaf certificate followed by any intermediates. */
    @JsonProperty("cert_path")
    private String certPath;

    /** PEM file with the PKCS#8 private key. */
    @JsonProperty("key_path")
    private String keyPath;

    @JsonProperty("cert_pem")
    private String certPem;

    @JsonProperty("key_pem")
    private String keyPem;

    /** Expiry as epoch seconds. Informational here; renewal happens elsewhere. */
    @JsonProperty("expires_at")
    private long expiresAt;

    @JsonProperty("auto_renew")
    private boolean autoRenew = true;

    public String getDomain() {
        return domain;
    }

    public void setDomain(String domain) {
        this.domain = domain;
    }

    public String getCertPath() {
        return certPath;
    }

    public void setCertPath(String certPath) {
        this.certPath = certPath;
    }

    public String getKeyPath() {
        return keyPath;
    }

    public void setKeyPath(String keyPath) {
        this.keyPath = keyPath;
    }

    public String getCertPem() {
        return certPem;
    }

    public void setCertPem(String certPem) {
        this.certPem = certPem;
    }

    public String getKeyPem() {
        return keyPem;
    }

    public void setKeyPem(String keyPem) {
        this.keyPem = keyPem;
    }

    public long getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(long expiresAt) {
        this.expiresAt = expiresAt;
    }

    public boolean isAutoRenew() {
        return autoRenew;
    }

    public void setAutoRenew(boolean autoRenew) {
        this.autoRenew = autoRenew;
    }

    /**
     * Checks whether the record points at certificate and key material at all.
     *
     * @return true if both a certificate and a key source are present.
     */
    public boolean hasMaterial() {
        return hasText(certPem, certPath) && hasText(keyPem, keyPath);
    }

    private static boolean hasText(String inline, String path) {
        return (inline != null && !inline.isBlank()) || (path != null && !path.isBlank());
    }
}
