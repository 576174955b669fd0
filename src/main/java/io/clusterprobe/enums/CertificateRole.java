package io.clusterprobe.enums;

/**
 * Role a certificate issued by the run's authority plays in the mutual TLS handshake.
 */
public enum CertificateRole {
    AUTHORITY,
    SERVER,
    CLIENT
}
