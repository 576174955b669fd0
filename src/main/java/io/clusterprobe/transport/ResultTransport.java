package io.clusterprobe.transport;

import com.sun.net.httpserver.HttpsConfigurator;
import com.sun.net.httpserver.HttpsParameters;
import com.sun.net.httpserver.HttpsServer;
import io.clusterprobe.certs.ServerTlsConfig;
import io.clusterprobe.metrics.MetricsProvider;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static io.clusterprobe.config.Constants.RESULTS_PATH;

/**
 * HTTPS endpoint workloads submit their results to. Every caller must present a client
 * certificate issued by the run's authority; anything else fails the TLS handshake and
 * never reaches the {@link SubmissionHandler}.
 *
 * <p>{@link #start()} binds on a background thread. The outcome is reported through
 * {@link #started()} and, once the server stops for any reason, {@link #termination()}.
 */
@Slf4j
public class ResultTransport implements AutoCloseable {

    private static final int BACKLOG = 128;
    private static final int HANDLER_THREADS = 8;

    private final String bindAddress;
    private final int bindPort;
    private final ServerTlsConfig tlsConfig;
    private final ResultHandler handler;

    private final CompletableFuture<InetSocketAddress> started = new CompletableFuture<>();
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private final Object lifecycleLock = new Object();
    private final AtomicInteger handlerThreadCount = new AtomicInteger();

    // Guarded by lifecycleLock
    private HttpsServer server;
    private ExecutorService handlerExecutor;
    private boolean startRequested;
    private boolean closed;

    public ResultTransport(String bindAddress, int bindPort, ServerTlsConfig tlsConfig,
                           SubmissionHandler submissionHandler, MetricsProvider metricsProvider) {
        this.bindAddress = bindAddress;
        this.bindPort = bindPort;
        this.tlsConfig = tlsConfig;
        this.handler = new ResultHandler(submissionHandler, metricsProvider);
    }

    /**
     * Bind and serve asynchronously. Returns immediately.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (startRequested) {
                throw new IllegalStateException("result transport already started");
            }
            startRequested = true;
        }
        Thread starter = new Thread(this::bindAndServe, "result-transport-start");
        starter.setDaemon(true);
        starter.start();
    }

    private void bindAndServe() {
        log.info("Starting result transport on {}:{}", bindAddress, bindPort);
        ExecutorService executor = null;
        try {
            HttpsServer created = HttpsServer.create(new InetSocketAddress(bindAddress, bindPort), BACKLOG);
            created.setHttpsConfigurator(configurator(tlsConfig.getSslContext()));
            created.createContext(RESULTS_PATH, handler);
            executor = Executors.newFixedThreadPool(HANDLER_THREADS, r -> {
                Thread t = new Thread(r);
                t.setName("result-transport-" + handlerThreadCount.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            created.setExecutor(executor);

            synchronized (lifecycleLock) {
                if (closed) {
                    created.stop(0);
                    executor.shutdownNow();
                    log.info("Result transport closed before it finished starting");
                    return;
                }
                created.start();
                server = created;
                handlerExecutor = executor;
            }
            InetSocketAddress address = created.getAddress();
            log.info("Result transport listening on {} (server identity {})",
                address, tlsConfig.getIdentity().getSubject());
            started.complete(address);
        } catch (Exception e) {
            log.error("Result transport failed on {}:{}: {}", bindAddress, bindPort, e.getMessage(), e);
            if (executor != null) {
                executor.shutdownNow();
            }
            started.completeExceptionally(e);
            termination.completeExceptionally(e);
        }
    }

    private static HttpsConfigurator configurator(SSLContext sslContext) {
        return new HttpsConfigurator(sslContext) {
            @Override
            public void configure(HttpsParameters params) {
                SSLParameters sslParams = getSSLContext().getDefaultSSLParameters();
                sslParams.setNeedClientAuth(true);
                params.setSSLParameters(sslParams);
            }
        };
    }

    /**
     * Completes with the bound address once the server accepts connections.
     */
    public CompletableFuture<InetSocketAddress> started() {
        return started;
    }

    /**
     * Single-shot signal: completes normally when the transport is closed, exceptionally when
     * it could not bind or serve.
     */
    public CompletableFuture<Void> termination() {
        return termination;
    }

    public boolean isClosed() {
        synchronized (lifecycleLock) {
            return closed;
        }
    }

    /**
     * Let exchanges already being handled finish, waiting at most {@code drainTimeout}, then
     * stop. Whatever is still running afterwards is dropped. Idempotent, and a no-op after
     * {@link #close()}.
     */
    public void stop(Duration drainTimeout) {
        HttpsServer toStop;
        ExecutorService executor;
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
            toStop = server;
            executor = handlerExecutor;
        }
        if (toStop != null) {
            try {
                if (!handler.awaitIdle(drainTimeout)) {
                    log.warn("Result transport still handling requests after {}, dropping them", drainTimeout);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            toStop.stop(0);
            executor.shutdownNow();
            log.info("Result transport on {}:{} stopped", bindAddress, bindPort);
        }
        finish();
    }

    /**
     * Stop immediately, dropping in-flight exchanges. Idempotent.
     */
    @Override
    public void close() {
        HttpsServer toStop;
        ExecutorService executor;
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
            toStop = server;
            executor = handlerExecutor;
        }
        if (toStop != null) {
            toStop.stop(0);
            executor.shutdownNow();
            log.info("Result transport on {}:{} closed", bindAddress, bindPort);
        }
        finish();
    }

    private void finish() {
        if (!started.isDone()) {
            started.completeExceptionally(new IllegalStateException("result transport closed before it started"));
        }
        termination.complete(null);
    }
}
