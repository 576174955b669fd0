package io.clusterprobe.certs;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;

/**
 * Assembles in-memory key and trust stores into an {@link SSLContext}. Nothing touches disk.
 */
final class TlsContexts {
    private static final String STORE_TYPE = "PKCS12";
    private static final String IDENTITY_ALIAS = "identity";
    private static final String AUTHORITY_ALIAS = "authority";
    // Protects the transient in-memory store only
    private static final char[] STORE_PASSWORD = "cluster-probe".toCharArray();

    private TlsContexts() {
    }

    static SSLContext create(PrivateKey key, X509Certificate[] chain, X509Certificate trusted)
            throws GeneralSecurityException, IOException {
        KeyStore keyStore = KeyStore.getInstance(STORE_TYPE);
        keyStore.load(null, null);
        keyStore.setKeyEntry(IDENTITY_ALIAS, key, STORE_PASSWORD, chain);
        KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        kmf.init(keyStore, STORE_PASSWORD);

        KeyStore trustStore = KeyStore.getInstance(STORE_TYPE);
        trustStore.load(null, null);
        trustStore.setCertificateEntry(AUTHORITY_ALIAS, trusted);
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trustStore);

        SSLContext ssl = SSLContext.getInstance("TLS");
        ssl.init(kmf.getKeyManagers(), tmf.getTrustManagers(), null);
        return ssl;
    }
}
