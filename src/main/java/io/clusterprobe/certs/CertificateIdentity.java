package io.clusterprobe.certs;

import io.clusterprobe.enums.CertificateRole;
import lombok.Value;

import java.security.cert.X509Certificate;
import java.time.Instant;

/**
 * Descriptive view of a certificate issued by the run's authority.
 */
@Value
public class CertificateIdentity {
    String subject;
    CertificateRole role;
    Instant notBefore;
    Instant notAfter;

    static CertificateIdentity of(String subject, CertificateRole role, X509Certificate certificate) {
        return new CertificateIdentity(
            subject,
            role,
            certificate.getNotBefore().toInstant(),
            certificate.getNotAfter().toInstant());
    }

    public boolean isValidAt(Instant instant) {
        return !instant.isBefore(notBefore) && !instant.isAfter(notAfter);
    }
}
