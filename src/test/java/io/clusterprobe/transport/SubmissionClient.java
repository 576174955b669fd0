package io.clusterprobe.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusterprobe.certs.ClientIdentity;
import io.clusterprobe.models.SubmissionRequest;
import io.clusterprobe.models.SubmissionResponse;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.KeyStore;
import java.security.cert.X509Certificate;
import java.time.Duration;

import static io.clusterprobe.config.Constants.CONTENT_TYPE_JSON;
import static io.clusterprobe.config.Constants.RESULTS_PATH;

/**
 * Submits results to a running transport the way a workload would.
 */
public class SubmissionClient {

    private static final char[] PASSWORD = "test".toCharArray();

    private final HttpClient httpClient;
    private final URI uri;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SubmissionClient(SSLContext sslContext, int port) {
        this.httpClient = HttpClient.newBuilder()
            .sslContext(sslContext)
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();
        this.uri = URI.create("https://127.0.0.1:" + port + RESULTS_PATH);
    }

    public SubmissionClient(ClientIdentity identity, InetSocketAddress address) throws Exception {
        this(identity.sslContext(), address.getPort());
    }

    public HttpResponse<String> submit(SubmissionRequest request) throws IOException, InterruptedException {
        return send("POST", objectMapper.writeValueAsString(request));
    }

    public HttpResponse<String> send(String method, String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(10))
            .header("Content-Type", CONTENT_TYPE_JSON)
            .method(method, body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body))
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    public SubmissionResponse parse(HttpResponse<String> response) throws IOException {
        return objectMapper.readValue(response.body(), SubmissionResponse.class);
    }

    /**
     * TLS context presenting the given identity while trusting an arbitrary authority.
     */
    public static SSLContext presenting(ClientIdentity identity, X509Certificate trusted) throws Exception {
        KeyStore keyStore = KeyStore.getInstance("PKCS12");
        keyStore.load(null, null);
        keyStore.setKeyEntry("client", identity.getPrivateKey(), PASSWORD,
            new X509Certificate[]{identity.getCertificate(), identity.getAuthorityCertificate()});
        KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        kmf.init(keyStore, PASSWORD);

        KeyStore trustStore = KeyStore.getInstance("PKCS12");
        trustStore.load(null, null);
        trustStore.setCertificateEntry("authority", trusted);
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trustStore);

        SSLContext context = SSLContext.getInstance("TLS");
        context.init(kmf.getKeyManagers(), tmf.getTrustManagers(), null);
        return context;
    }
}
