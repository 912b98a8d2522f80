package com.edgeroute.proxy.core.exceptions;

/**
 * Thrown when certificate or private key material referenced by a certificate
 * record cannot be read or converted for the handshake.
 */
public class CertificateLoadException extends ProxyException {
    /**
     * Constructs a new CertificateLoadException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public CertificateLoadException(String message) {
        super(message);
    }

    /**
     * Constructs a new CertificateLoadException with the specified detail message
     * and cause.
     * 
     * @param message the detail message.
     * @param cause   the cause of the exception.
     */
    public CertificateLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
