package io.clusterprobe.certs;

/**
 * Exception thrown when the run's certificate authority cannot create or sign key material.
 */
public class CertificateAuthorityException extends Exception {

    public CertificateAuthorityException(String message) {
        super(message);
    }

    public CertificateAuthorityException(String message, Throwable cause) {
        super(message, cause);
    }
}
