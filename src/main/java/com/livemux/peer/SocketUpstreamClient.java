package com.livemux.peer;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelOption;
import io.netty.channel.unix.DomainSocketAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.Connection;
import reactor.netty.tcp.TcpClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Reactor Netty implementation of {@link UpstreamClient}.
 *
 * Sources are addressed as {@code host:port} (TCP) or as a filesystem path to a unix domain
 * socket; the latter needs the native epoll transport. Each exchange uses its own connection,
 * the source closes it after answering, so the whole response is aggregated and then split
 * into the fixed16 header and the body.
 */
public class SocketUpstreamClient implements UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(SocketUpstreamClient.class);
    private static final int HEADER_SIZE = 16;
    private static final int MAX_RESPONSE_SIZE = 512 * 1024 * 1024;

    private final String address;
    private final TcpClient tcpClient;
    private final Duration readTimeout;

    /**
     * @param address {@code host:port}, or a path containing {@code /} or ending in {@code .sock}
     */
    public SocketUpstreamClient(String address, int connectTimeoutMs, int readTimeoutMs) {
        this.address = address;
        this.readTimeout = Duration.ofMillis(readTimeoutMs);
        this.tcpClient = configure(address)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .option(ChannelOption.TCP_NODELAY, true);
    }

    static boolean isSocketPath(String address) {
        return address.contains("/") || address.endsWith(".sock");
    }

    private static TcpClient configure(String address) {
        if (isSocketPath(address)) {
            return TcpClient.newConnection()
                .remoteAddress(() -> new DomainSocketAddress(address));
        }
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new IllegalArgumentException("Invalid source address, expected host:port or socket path: " + address);
        }
        int port;
        try {
            port = Integer.parseInt(address.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in source address: " + address, e);
        }
        return TcpClient.newConnection()
            .host(address.substring(0, colon))
            .port(port);
    }

    @Override
    public Mono<String> query(String request) {
        return Mono.usingWhen(
                tcpClient.connect(),
                connection -> exchange(connection, request),
                connection -> Mono.fromRunnable(connection::dispose))
            .timeout(readTimeout)
            .onErrorMap(e -> !(e instanceof UpstreamException), e -> new UpstreamException(
                "query to " + address + " failed: " + describe(e), address, e));
    }

    @Override
    public Mono<Void> command(String command) {
        return Mono.usingWhen(
                tcpClient.connect(),
                connection -> connection.outbound()
                    .sendString(Mono.just(command + "\n\n"), StandardCharsets.UTF_8)
                    .then(),
                connection -> Mono.fromRunnable(connection::dispose))
            .timeout(readTimeout)
            .onErrorMap(e -> !(e instanceof UpstreamException), e -> new UpstreamException(
                "command to " + address + " failed: " + describe(e), address, e));
    }

    @Override
    public String getAddress() {
        return address;
    }

    private Mono<String> exchange(Connection connection, String request) {
        return connection.outbound()
            .sendString(Mono.just(request), StandardCharsets.UTF_8)
            .then()
            .then(connection.inbound().receive().aggregate().map(this::parse))
            .switchIfEmpty(Mono.error(() ->
                new UpstreamException("incomplete response header from " + address, address)));
    }

    private String parse(ByteBuf response) {
        if (response.readableBytes() < HEADER_SIZE) {
            throw new UpstreamException("incomplete response header from " + address, address);
        }
        String headerText = response.readCharSequence(HEADER_SIZE, StandardCharsets.US_ASCII).toString();
        int status;
        int length;
        try {
            status = Integer.parseInt(headerText.substring(0, 3));
            length = Integer.parseInt(headerText.substring(4, 15).trim());
        } catch (NumberFormatException e) {
            throw new UpstreamException("invalid response header from " + address + ": " + headerText.trim(),
                address, e);
        }
        if (length < 0 || length > MAX_RESPONSE_SIZE) {
            throw new UpstreamException("response from " + address + " too large: " + length + " bytes", address);
        }
        if (response.readableBytes() < length) {
            throw new UpstreamException("incomplete response from " + address + ", expected "
                + length + " bytes", address);
        }

        String text = response.readCharSequence(length, StandardCharsets.UTF_8).toString();
        if (status != 200) {
            throw new UpstreamException("source " + address + " answered " + status + ": " + text.trim(), address);
        }
        log.trace("Received {} bytes from {}", length, address);
        return text;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
