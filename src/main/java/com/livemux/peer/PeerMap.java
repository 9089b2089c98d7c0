package com.livemux.peer;

import com.livemux.domain.QueryResponse;
import com.livemux.query.BadRequestException;
import com.livemux.query.QueryMetrics;
import com.livemux.query.Request;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Phaser;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Multiplexer over all configured peers.
 *
 * Every query is dispatched to the selected peers concurrently and merged once all of them
 * answered. A peer that fails contributes no rows and is reported under {@code failed};
 * it never fails the whole query. Commands are forwarded best effort: every selected peer
 * gets the command even if an earlier one failed, and the first failure is reported.
 *
 * In-flight queries are tracked so shutdown can stop accepting new work and wait for the
 * running queries before the peers are stopped.
 */
public class PeerMap {

    private static final Logger log = LoggerFactory.getLogger(PeerMap.class);

    private final List<Peer> peers;
    private final QueryMetrics metrics;
    private final Duration shutdownTimeout;
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final Phaser inFlight = new Phaser(1);

    public PeerMap(List<Peer> peers, QueryMetrics metrics, Duration shutdownTimeout) {
        this.peers = List.copyOf(peers);
        this.metrics = metrics;
        this.shutdownTimeout = shutdownTimeout;
    }

    @PostConstruct
    public void start() {
        for (Peer peer : peers) {
            peer.start();
        }
        log.info("PeerMap started with {} peers", peers.size());
    }

    /**
     * Run a query on every selected peer and merge the results.
     *
     * @return Mono emitting the merged response, or a {@link BadRequestException} if the
     *         Backends header names an unknown peer
     */
    public Mono<QueryResponse> execute(Request request) {
        return Mono.defer(() -> {
            if (!accepting.get()) {
                return Mono.error(new IllegalStateException("shutting down, not accepting queries"));
            }
            List<Peer> selected = selectPeers(request.getBackends());
            Request perPeer = pushDown(request);
            Timer.Sample sample = metrics.startQueryTimer();
            inFlight.register();

            return Flux.fromIterable(selected)
                .flatMapSequential(peer -> peer.execute(perPeer)
                    .onErrorResume(e -> {
                        log.warn("Query on peer {} failed: {}", peer.getId(), e.getMessage());
                        return Mono.just(PeerResult.failed(peer.getId(), String.valueOf(e.getMessage())));
                    }))
                .collectList()
                .map(results -> ResultMerger.merge(request, results))
                .doOnSuccess(response -> {
                    metrics.recordQueryExecuted();
                    metrics.recordResultSize(response.getData().size());
                    metrics.recordQueryLatency(sample);
                    if (!response.getFailed().isEmpty()) {
                        log.debug("Query on {} answered without peers {}", request.getTable(),
                            response.getFailed().keySet());
                    }
                })
                .doOnError(e -> metrics.recordQueryFailed())
                .doFinally(signal -> inFlight.arriveAndDeregister());
        });
    }

    /**
     * Forward a command to every selected peer.
     *
     * @return Mono completing when all peers were tried, failing with the first error
     */
    public Mono<Void> command(Request request) {
        return Mono.defer(() -> {
            List<Peer> selected = selectPeers(request.getBackends());
            metrics.recordCommandForwarded();
            return Flux.fromIterable(selected)
                .flatMapSequential(peer -> peer.command(request.getCommand())
                    .then(Mono.<Throwable>empty())
                    .onErrorResume(e -> {
                        log.warn("Command to peer {} failed: {}", peer.getId(), e.getMessage());
                        return Mono.just(e);
                    }))
                .collectList()
                .flatMap(errors -> errors.isEmpty() ? Mono.<Void>empty() : Mono.error(errors.get(0)));
        });
    }

    /**
     * Peers named by a Backends header in configured order, or all peers when it is empty.
     */
    List<Peer> selectPeers(List<String> backends) {
        if (backends.isEmpty()) {
            return peers;
        }
        for (String backend : backends) {
            if (getPeer(backend) == null) {
                throw new BadRequestException("bad request: backend " + backend + " does not exist");
            }
        }
        List<Peer> selected = new ArrayList<>();
        for (Peer peer : peers) {
            if (backends.contains(peer.getId())) {
                selected.add(peer);
            }
        }
        return selected;
    }

    /**
     * Per-peer form of a plain query: every peer returns its first {@code offset + limit}
     * rows, the global offset is applied after merging.
     */
    static Request pushDown(Request request) {
        if (request.isStatsQuery() || request.getOffset() == 0) {
            return request;
        }
        Request perPeer = request.copy();
        perPeer.setOffset(0);
        if (request.getLimit() != null) {
            perPeer.setLimit(saturatedLimit(request));
        }
        return perPeer;
    }

    /**
     * Offset plus limit, capped at {@link Integer#MAX_VALUE}.
     */
    static int saturatedLimit(Request request) {
        return (int) Math.min(Integer.MAX_VALUE, (long) request.getOffset() + request.getLimit());
    }

    public Peer getPeer(String id) {
        for (Peer peer : peers) {
            if (peer.getId().equals(id)) {
                return peer;
            }
        }
        return null;
    }

    public List<Peer> getPeers() {
        return peers;
    }

    /**
     * Number of queries currently running.
     */
    public int getInFlightCount() {
        return Math.max(0, inFlight.getRegisteredParties() - (accepting.get() ? 1 : 0));
    }

    /**
     * Stop accepting queries, wait for running ones and stop all peers.
     */
    @PreDestroy
    public void shutdown() {
        if (!accepting.compareAndSet(true, false)) {
            return;
        }
        log.info("Shutting down PeerMap, waiting for {} running queries", inFlight.getRegisteredParties() - 1);
        int phase = inFlight.arriveAndDeregister();
        try {
            inFlight.awaitAdvanceInterruptibly(phase, shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("{} queries still running after {} ms, stopping peers anyway",
                inFlight.getRegisteredParties(), shutdownTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for running queries");
        }
        for (Peer peer : peers) {
            peer.stop();
        }
        log.info("PeerMap stopped");
    }
}
