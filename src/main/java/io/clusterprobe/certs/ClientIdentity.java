package io.clusterprobe.certs;

import lombok.ToString;
import lombok.Value;

import javax.net.ssl.SSLContext;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;

/**
 * Client certificate handed to one workload so it can submit results to the transport.
 */
@Value
public class ClientIdentity {
    CertificateIdentity identity;
    X509Certificate certificate;

    @ToString.Exclude
    PrivateKey privateKey;

    X509Certificate authorityCertificate;

    public String getWorkloadName() {
        return identity.getSubject();
    }

    /**
     * Build a client TLS context presenting this identity and trusting only the issuing authority.
     */
    public SSLContext sslContext() throws CertificateAuthorityException {
        try {
            return TlsContexts.create(
                privateKey,
                new X509Certificate[]{certificate, authorityCertificate},
                authorityCertificate);
        } catch (Exception e) {
            throw new CertificateAuthorityException(
                "failed to build TLS context for workload " + getWorkloadName(), e);
        }
    }
}
