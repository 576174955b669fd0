package io.clusterprobe.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpsExchange;
import io.clusterprobe.aggregation.SubmissionOutcome;
import io.clusterprobe.certs.CertificateAuthority;
import io.clusterprobe.metrics.MetricsProvider;
import io.clusterprobe.models.Result;
import io.clusterprobe.models.SubmissionRequest;
import io.clusterprobe.models.SubmissionResponse;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLPeerUnverifiedException;
import java.io.IOException;
import java.io.OutputStream;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.clusterprobe.config.Constants.*;

/**
 * Handles result submissions on {@code /api/v1/results}.
 *
 * <p>The producer of a submission is the common name of the caller's client certificate,
 * never a field of the request. A body that names a different producer is refused.
 */
@Slf4j
class ResultHandler implements HttpHandler {

    private final SubmissionHandler submissionHandler;
    private final MetricsProvider metricsProvider;
    private final ObjectMapper objectMapper;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Object idle = new Object();

    ResultHandler(SubmissionHandler submissionHandler, MetricsProvider metricsProvider) {
        this.submissionHandler = submissionHandler;
        this.metricsProvider = metricsProvider;
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        inFlight.incrementAndGet();
        try {
            SubmissionResponse response = process(exchange);
            write(exchange, response);
        } finally {
            exchange.close();
            if (inFlight.decrementAndGet() == 0) {
                synchronized (idle) {
                    idle.notifyAll();
                }
            }
        }
    }

    /**
     * Wait until no exchange is being handled.
     *
     * @return false if exchanges were still running when the timeout elapsed
     */
    boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idle) {
            while (inFlight.get() > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0L) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(idle, remaining);
            }
            return true;
        }
    }

    private SubmissionResponse process(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        if (!METHOD_POST.equalsIgnoreCase(method) && !METHOD_PUT.equalsIgnoreCase(method)) {
            return reject("method", SubmissionResponse.methodNotAllowed(method));
        }

        Optional<String> identity = callerIdentity(exchange);
        if (identity.isEmpty()) {
            return reject("identity", SubmissionResponse.forbidden("client certificate without a subject name"));
        }
        String producer = identity.get();

        byte[] body = exchange.getRequestBody().readNBytes(MAX_SUBMISSION_BYTES + 1);
        if (body.length > MAX_SUBMISSION_BYTES) {
            return reject("size", SubmissionResponse.badRequest("result body exceeds " + MAX_SUBMISSION_BYTES + " bytes"));
        }
        SubmissionRequest request;
        try {
            request = body.length == 0 ? null : objectMapper.readValue(body, SubmissionRequest.class);
        } catch (JsonProcessingException e) {
            log.warn("Malformed result body from {}: {}", producer, e.getOriginalMessage());
            return reject("body", SubmissionResponse.badRequest("malformed result body"));
        }
        if (request == null) {
            return reject("body", SubmissionResponse.badRequest("empty result body"));
        }
        if (request.getKind() == null || request.getKind().isBlank()) {
            return reject("body", SubmissionResponse.badRequest("result kind is required"));
        }
        if (request.getProducer() != null && !request.getProducer().isBlank()
                && !request.getProducer().equals(producer)) {
            log.warn("Rejecting result from {} claiming to be produced by {}", producer, request.getProducer());
            return reject("identity", SubmissionResponse.forbidden(
                "producer " + request.getProducer() + " does not match client certificate"));
        }

        Result result = Result.builder()
            .producer(producer)
            .locus(request.getLocus())
            .kind(request.getKind())
            .payload(request.getPayload())
            .error(request.getError())
            .build();
        SubmissionOutcome outcome;
        try {
            outcome = submissionHandler.handleSubmission(result);
        } catch (Exception e) {
            log.error("Failed to handle result from {}: {}", producer, e.getMessage(), e);
            return SubmissionResponse.internalError(e.getMessage());
        }
        switch (outcome) {
            case ACCEPTED:
                return SubmissionResponse.accepted();
            case DUPLICATE:
                return SubmissionResponse.ignored("result already received for this slot");
            default:
                return SubmissionResponse.ignored("no result expected for this slot");
        }
    }

    private Optional<String> callerIdentity(HttpExchange exchange) {
        if (!(exchange instanceof HttpsExchange)) {
            return Optional.empty();
        }
        try {
            Certificate[] peer = ((HttpsExchange) exchange).getSSLSession().getPeerCertificates();
            if (peer.length == 0 || !(peer[0] instanceof X509Certificate)) {
                return Optional.empty();
            }
            return CertificateAuthority.subjectName((X509Certificate) peer[0]);
        } catch (SSLPeerUnverifiedException e) {
            log.warn("Request from {} without a verified client certificate", exchange.getRemoteAddress());
            return Optional.empty();
        }
    }

    private SubmissionResponse reject(String reason, SubmissionResponse response) {
        metricsProvider.recordRejection(reason);
        return response;
    }

    private void write(HttpExchange exchange, SubmissionResponse response) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(response);
        exchange.getResponseHeaders().set("Content-Type", CONTENT_TYPE_JSON);
        exchange.sendResponseHeaders(response.getCode(), bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
