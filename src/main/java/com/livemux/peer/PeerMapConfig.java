package com.livemux.peer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.livemux.query.QueryMetrics;
import com.livemux.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the peers and the multiplexer over them.
 * Peers are created from {@code livemux.connections} and live as long as the context.
 */
@Configuration
public class PeerMapConfig {
    private static final Logger logger = LoggerFactory.getLogger(PeerMapConfig.class);

    @Value("${livemux.connections:}")
    private String connections;

    @Value("${livemux.update-interval-ms:7000}")
    private long updateIntervalMs;

    @Value("${livemux.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${livemux.read-timeout-ms:30000}")
    private int readTimeoutMs;

    @Value("${livemux.shutdown-timeout-ms:30000}")
    private long shutdownTimeoutMs;

    @Bean
    public PeerMap peerMap(SchemaRegistry schema, ObjectMapper objectMapper, PeerMetrics peerMetrics,
                           QueryMetrics queryMetrics) {
        List<Peer> peers = new ArrayList<>();
        for (PeerConnection connection : PeerConnection.parseAll(connections)) {
            List<UpstreamClient> clients = new ArrayList<>();
            for (String source : connection.getSources()) {
                clients.add(new SocketUpstreamClient(source, connectTimeoutMs, readTimeoutMs));
            }
            peers.add(new Peer(connection, clients, schema, objectMapper,
                Duration.ofMillis(updateIntervalMs), peerMetrics));
            logger.info("Configured peer {}", connection);
        }
        if (peers.isEmpty()) {
            logger.warn("No connections configured, every query will return an empty result");
        }
        return new PeerMap(peers, queryMetrics, Duration.ofMillis(shutdownTimeoutMs));
    }
}
