package io.clusterprobe.certs;

import lombok.Value;

import javax.net.ssl.SSLContext;
import java.security.cert.X509Certificate;

/**
 * Server side TLS material for the result transport. The context presents the server
 * certificate and trusts client certificates issued by the run's authority only.
 */
@Value
public class ServerTlsConfig {
    SSLContext sslContext;
    CertificateIdentity identity;
    X509Certificate certificate;
    X509Certificate authorityCertificate;
}
