package com.livemux.listener;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.channel.ChannelOption;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.tcp.TcpServer;

/**
 * Reactive Livestatus TCP listener.
 *
 * Requests on a connection are answered strictly in order. The connection is closed after
 * a response unless the request asked for {@code Keepalive: on}.
 */
@Component
public class LivestatusListener {
    private static final Logger log = LoggerFactory.getLogger(LivestatusListener.class);

    private final RequestHandler handler;
    private final boolean enabled;
    private final int port;
    private final Counter connectionsAccepted;
    private final Counter connectionsClosed;
    private final Counter requestsReceived;

    private DisposableServer server;

    public LivestatusListener(RequestHandler handler, MeterRegistry meterRegistry,
                              @Value("${livemux.listen.enabled:true}") boolean enabled,
                              @Value("${livemux.listen.port:6557}") int port) {
        this.handler = handler;
        this.enabled = enabled;
        this.port = port;

        this.connectionsAccepted = Counter.builder("livemux.listener.connections.accepted")
            .description("Total client connections accepted")
            .register(meterRegistry);

        this.connectionsClosed = Counter.builder("livemux.listener.connections.closed")
            .description("Total client connections closed")
            .register(meterRegistry);

        this.requestsReceived = Counter.builder("livemux.listener.requests.received")
            .description("Total client requests received")
            .register(meterRegistry);
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Livestatus listener disabled");
            return;
        }
        server = TcpServer.create()
            .port(port)
            .option(ChannelOption.SO_REUSEADDR, true)
            .childOption(ChannelOption.TCP_NODELAY, true)
            .childOption(ChannelOption.ALLOW_HALF_CLOSURE, true)
            .doOnConnection(connection -> {
                connectionsAccepted.increment();
                log.debug("Client connection accepted from {}", connection.channel().remoteAddress());
                connection.onDispose(() -> {
                    connectionsClosed.increment();
                    log.debug("Client connection closed from {}", connection.channel().remoteAddress());
                });
            })
            .handle((in, out) -> {
                RequestFramer framer = new RequestFramer();
                Flux<byte[]> responses = in.receive()
                    .asByteArray()
                    .concatMapIterable(framer::feed)
                    .concatWith(Mono.fromCallable(framer::flush))
                    .doOnNext(text -> requestsReceived.increment())
                    .concatMap(handler::handle)
                    .takeUntil(response -> !response.isKeepAlive())
                    .map(ClientResponse::getPayload);
                return out.sendByteArray(responses).then();
            })
            .bindNow();
        log.info("Livestatus listener bound on port {}", server.port());
    }

    /**
     * Bound port, useful when configured as 0. Returns -1 when not listening.
     */
    public int getPort() {
        return server == null ? -1 : server.port();
    }

    @PreDestroy
    public void stop() {
        if (server != null) {
            server.disposeNow();
            log.info("Livestatus listener stopped");
        }
    }
}
