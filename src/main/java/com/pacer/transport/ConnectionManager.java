package com.pacer.transport;

import com.pacer.config.PacerProperties;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single pooled HTTP client used for physical requests.
 *
 * The client is built lazily on first use and rebuilt on the next call
 * after {@link #close()} has disposed its connection pool.
 * Construction is serialized; concurrent callers share one instance.
 */
@Slf4j
@Component
public class ConnectionManager {

    private static final String POOL_NAME = "pacer-pool";

    private final PacerProperties.ConnectionConfig config;
    private final WebClient.Builder webClientBuilder;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile PooledClient current;

    public ConnectionManager(PacerProperties properties, WebClient.Builder webClientBuilder) {
        this.config = properties.getConnection();
        this.webClientBuilder = webClientBuilder;
    }

    /**
     * Get the pooled client, creating it if there is none or the held one was closed.
     */
    public WebClient getClient() {
        PooledClient held = current;
        if (held != null && !held.isClosed()) {
            return held.webClient;
        }

        lock.lock();
        try {
            held = current;
            if (held == null || held.isClosed()) {
                held = createClient();
                current = held;
            }
            return held.webClient;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether a live client is currently held.
     */
    public boolean isOpen() {
        PooledClient held = current;
        return held != null && !held.isClosed();
    }

    /**
     * Dispose the connection pool. Safe to call repeatedly or with no client.
     */
    @PreDestroy
    public void close() {
        lock.lock();
        try {
            PooledClient held = current;
            current = null;
            if (held != null && !held.isClosed()) {
                held.close();
                log.info("Closed pooled HTTP client");
            }
        } finally {
            lock.unlock();
        }
    }

    private PooledClient createClient() {
        // Reactor Netty bounds idle connections by max-connections and evicts them after keepalive-expiry
        ConnectionProvider provider = ConnectionProvider.builder(POOL_NAME)
                .maxConnections(config.getMaxConnections())
                .pendingAcquireTimeout(config.getPoolAcquireTimeout())
                .maxIdleTime(config.getKeepaliveExpiry())
                .evictInBackground(config.getKeepaliveExpiry())
                .build();

        long readTimeoutMs = config.getReadTimeout().toMillis();
        long writeTimeoutMs = config.getWriteTimeout().toMillis();

        HttpClient httpClient = HttpClient.create(provider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getConnectTimeout().toMillis())
                .responseTimeout(config.getReadTimeout())
                .compress(config.isCompression())
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(readTimeoutMs, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(writeTimeoutMs, TimeUnit.MILLISECONDS)));

        if (config.isHttp2()) {
            // h2 is negotiated through ALPN, so it only applies to https endpoints
            httpClient = httpClient
                    .protocol(HttpProtocol.H2, HttpProtocol.HTTP11)
                    .secure();
        }

        WebClient webClient = webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();

        log.info("Created pooled HTTP client: max_connections={}, keepalive_expiry={}, http2={}",
                config.getMaxConnections(), config.getKeepaliveExpiry(), config.isHttp2());

        return new PooledClient(provider, webClient);
    }

    private static final class PooledClient {
        private final ConnectionProvider connectionProvider;
        private final WebClient webClient;
        private volatile boolean closed;

        private PooledClient(ConnectionProvider connectionProvider, WebClient webClient) {
            this.connectionProvider = connectionProvider;
            this.webClient = webClient;
        }

        // ConnectionProvider.isDisposed() is true for a pool that never opened a connection
        private boolean isClosed() {
            return closed;
        }

        private void close() {
            closed = true;
            connectionProvider.dispose();
        }
    }
}
